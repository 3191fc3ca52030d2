package com.webresearch.core.entity;

public enum PathStatus {
    PENDING,
    ACTIVE,
    COMPLETED,
    TERMINATED
}
