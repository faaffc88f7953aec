package io.ipamsync.enums;

public enum OutcomeStatus {
    SUCCEEDED,
    FAILED,
    SKIPPED
}
