package io.github.eutro.pathprof.runner;

/**
 * Thrown when the interpreter cannot continue running a program, such as when it reads
 * a variable that was never assigned, or runs for too many steps.
 */
public class ExecutionException extends RuntimeException {
    public ExecutionException(String message) {
        super(message);
    }

    public ExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
