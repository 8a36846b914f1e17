package com.eainde.verity.document;

import java.util.Map;

public record InvoiceRecord(
        String sourceName,
        Map<String, Object> raw,
        String invoiceNumber,
        String supplier,
        String invoiceDate,
        String manufacturingDate,
        String declaredOrigin,
        String originCountry,
        Double quantity,
        String unit,
        Double totalValue,
        String currency
) implements DocumentRecord {

    public static InvoiceRecord from(String sourceName, Map<String, Object> raw) {
        return new InvoiceRecord(
                sourceName,
                Fields.copy(raw),
                Fields.text(raw, "invoice_number", "invoice_id", "invoice_no"),
                Fields.text(raw, "supplier", "vendor_name", "supplier_name"),
                Fields.text(raw, "invoice_date", "issue_date"),
                Fields.text(raw, "manufacturing_date", "production_date"),
                Fields.text(raw, "declared_origin", "country_of_origin"),
                Fields.text(raw, "country_of_origin", "origin_country"),
                Fields.number(raw, "quantity"),
                Fields.text(raw, "unit"),
                Fields.number(raw, "total_value"),
                Fields.text(raw, "currency"));
    }

    @Override
    public DocumentRole role() {
        return DocumentRole.INVOICE;
    }
}
