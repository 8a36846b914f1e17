package com.eainde.verity.document;

import java.util.Map;

/**
 * A raw extracted record after classification, with a stable schema for its role.
 */
public interface DocumentRecord {

    DocumentRole role();

    /** Document name or type the record was recognized from. */
    String sourceName();

    /** The untouched extracted fields. */
    Map<String, Object> raw();
}
