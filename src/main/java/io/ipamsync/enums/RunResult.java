package io.ipamsync.enums;

import io.ipamsync.config.Constants;

/**
 * Result signal of one sync run request.
 */
public enum RunResult {
    COMPLETED(Constants.EXIT_CODE_SUCCESS),
    ALREADY_RUNNING(Constants.EXIT_CODE_ALREADY_RUNNING);

    private final int exitCode;

    RunResult(int exitCode) {
        this.exitCode = exitCode;
    }

    public int getExitCode() {
        return exitCode;
    }
}
