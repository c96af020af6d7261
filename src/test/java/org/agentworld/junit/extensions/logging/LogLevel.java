package org.agentworld.junit.extensions.logging;

public enum LogLevel {
    INFO,
    WARN,
    ERROR
}
