package com.webresearch.core.entity;

public enum VerificationType {
    CORROBORATION,
    CONTRADICTION,
    UPDATE
}
