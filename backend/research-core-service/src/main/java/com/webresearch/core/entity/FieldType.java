package com.webresearch.core.entity;

public enum FieldType {
    STRING,
    NUMBER,
    DATE,
    LIST,
    URL,
    EMAIL,
    BOOLEAN
}
