package com.webresearch.core.entity;

public enum RelationshipType {
    SUPPORTS,
    CONTRADICTS,
    RELATED
}
