package com.eainde.verity.document;

import java.util.Map;

/**
 * Transport manifest (bill of lading).
 */
public record ManifestRecord(
        String sourceName,
        Map<String, Object> raw,
        String invoiceReference,
        String portOfLoading,
        String portOfDischarge,
        Double quantity,
        String unit,
        Double weightKg,
        String vessel,
        String departureDate,
        String shipper,
        String shipperAddress
) implements DocumentRecord {

    public static ManifestRecord from(String sourceName, Map<String, Object> raw) {
        String port = Fields.text(raw, "port_of_loading");
        String discharge = Fields.text(raw, "port_of_discharge");
        return new ManifestRecord(
                sourceName,
                Fields.copy(raw),
                Fields.text(raw, "invoice_reference", "reference"),
                port == null ? null : port.toUpperCase(),
                discharge == null ? null : discharge.toUpperCase(),
                Fields.number(raw, "quantity"),
                Fields.text(raw, "unit"),
                Fields.number(raw, "weight_kg"),
                Fields.text(raw, "vessel", "vessel_name"),
                Fields.text(raw, "departure_date"),
                Fields.text(raw, "shipper"),
                Fields.text(raw, "shipper_address"));
    }

    @Override
    public DocumentRole role() {
        return DocumentRole.MANIFEST;
    }
}
