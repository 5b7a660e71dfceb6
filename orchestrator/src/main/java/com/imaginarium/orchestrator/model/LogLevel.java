package com.imaginarium.orchestrator.model;

public enum LogLevel {
    DEBUG,
    INFO,
    WARN,
    ERROR
}
