package com.eainde.verity.correlator;

import com.eainde.verity.document.ClassifiedDocuments;
import com.eainde.verity.model.Finding;

import java.util.List;

/**
 * One deterministic cross-document rule. Detectors are independent of each other and of their order;
 * a detector whose documents are absent returns nothing.
 */
public interface DiscrepancyDetector {

    String name();

    List<Finding> detect(ClassifiedDocuments documents);
}
