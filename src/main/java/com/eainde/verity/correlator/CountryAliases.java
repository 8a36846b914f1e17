package com.eainde.verity.correlator;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Free-text country and place names resolved to ISO 3166 alpha-2 codes.
 */
final class CountryAliases {

    private static final Map<String, String> ALIASES = new LinkedHashMap<>();
    private static final Pattern ISO2 = Pattern.compile("[A-Za-z]{2}");

    static {
        alias("BD", "bangladesh", "savar", "dhaka", "chittagong", "chattogram", "gazipur", "narayanganj");
        alias("DE", "germany", "deutschland", "hamburg", "bremen");
        alias("CN", "china", "shanghai", "ningbo", "shenzhen");
        alias("IN", "india", "mumbai", "chennai", "tiruppur");
        alias("VN", "vietnam", "viet nam", "ho chi minh", "hai phong");
        alias("TR", "turkey", "turkiye", "istanbul", "izmir");
        alias("NL", "netherlands", "holland", "rotterdam");
        alias("PK", "pakistan", "karachi", "lahore");
        alias("IT", "italy", "genoa");
        alias("PT", "portugal", "porto");
    }

    private CountryAliases() {
    }

    private static void alias(String iso, String... names) {
        for (String name : names) {
            ALIASES.put(name, iso);
        }
    }

    /**
     * @return the ISO code the text names, or {@code null} when it names no known country
     */
    static String resolve(String text) {
        if (text == null || text.isBlank()) {
            return null;
        }
        String trimmed = text.trim();
        if (ISO2.matcher(trimmed).matches()) {
            return trimmed.toUpperCase(Locale.ROOT);
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : ALIASES.entrySet()) {
            if (lower.contains(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }

    /** Whether a free-text address names the given country, by place alias or by a standalone ISO code. */
    static boolean mentions(String address, String iso) {
        if (address == null || address.isBlank() || iso == null) {
            return false;
        }
        String lower = address.toLowerCase(Locale.ROOT);
        for (Map.Entry<String, String> entry : ALIASES.entrySet()) {
            if (entry.getValue().equals(iso) && lower.contains(entry.getKey())) {
                return true;
            }
        }
        return Pattern.compile("\\b" + iso + "\\b").matcher(address.toUpperCase(Locale.ROOT)).find();
    }
}
