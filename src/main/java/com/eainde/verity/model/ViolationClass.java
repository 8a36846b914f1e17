package com.eainde.verity.model;

public enum ViolationClass {
    CRITICAL,
    MAJOR,
    MINOR,
    OBSERVATION
}
