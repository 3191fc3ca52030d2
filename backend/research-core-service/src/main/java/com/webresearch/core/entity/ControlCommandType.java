package com.webresearch.core.entity;

public enum ControlCommandType {
    PAUSE,
    RESUME,
    STOP
}
