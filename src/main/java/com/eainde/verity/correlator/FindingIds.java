package com.eainde.verity.correlator;

import java.util.Locale;
import java.util.UUID;

final class FindingIds {

    private FindingIds() {
    }

    static String deterministic() {
        return "FIND-" + hex(8);
    }

    static String reasoned() {
        return "FIND-AI-" + hex(6);
    }

    private static String hex(int length) {
        return UUID.randomUUID().toString().replace("-", "").substring(0, length).toUpperCase(Locale.ROOT);
    }
}
