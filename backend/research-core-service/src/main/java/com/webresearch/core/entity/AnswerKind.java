package com.webresearch.core.entity;

/**
 * Expected shape of the answer to a primary question
 */
public enum AnswerKind {
    STRING,
    NUMBER,
    DATE,
    LIST,
    STRUCTURED,
    BOOLEAN
}
