package com.eainde.verity.document;

public enum DocumentRole {
    INVOICE,
    MANIFEST,
    CERTIFICATE
}
