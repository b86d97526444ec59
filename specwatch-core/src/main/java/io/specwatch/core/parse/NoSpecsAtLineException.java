package io.specwatch.core.parse;

import java.nio.file.Path;

/**
 * No declaration could be matched to a requested {@code file:line} location.
 */
public class NoSpecsAtLineException extends RuntimeException {

    private final Path module;
    private final int line;

    public NoSpecsAtLineException(Path module, int line) {
        super("No specs found at the specified line " + line + " in " + module);
        this.module = module;
        this.line = line;
    }

    public Path module() {
        return module;
    }

    public int line() {
        return line;
    }
}
