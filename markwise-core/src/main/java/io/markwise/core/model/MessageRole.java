package io.markwise.core.model;

public enum MessageRole {
    SYSTEM,
    USER,
    ASSISTANT
}
