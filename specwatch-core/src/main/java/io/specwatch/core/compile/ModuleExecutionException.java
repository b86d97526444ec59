package io.specwatch.core.compile;

/**
 * A compiled spec module failed while being loaded or executed for discovery.
 */
public class ModuleExecutionException extends RuntimeException {

    public ModuleExecutionException(String message) {
        super(message);
    }

    public ModuleExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
