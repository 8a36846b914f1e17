package com.eainde.verity.model;

public enum LogSeverity {
    INFO,
    WARNING,
    ERROR,
    CRITICAL
}
