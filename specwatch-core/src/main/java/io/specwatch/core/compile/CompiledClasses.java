package io.specwatch.core.compile;

import java.util.Map;

/**
 * Class files produced by {@link JavacModuleCompiler} for one module and its sources.
 *
 * @param mainClassName binary name of the module's first top-level type
 * @param classes       binary class name to class file bytes
 */
public record CompiledClasses(String mainClassName, Map<String, byte[]> classes) {

    public CompiledClasses {
        classes = Map.copyOf(classes);
    }

    public long sizeBytes() {
        long size = 0;
        for (byte[] bytes : classes.values()) {
            size += bytes.length;
        }
        return size;
    }
}
