package io.ipamsync;

/**
 * Terminates the process with an exit code.
 */
@FunctionalInterface
public interface ExitHandler {
    void exit(int code);
}
