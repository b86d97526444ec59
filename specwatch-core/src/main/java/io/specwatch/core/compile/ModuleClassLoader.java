package io.specwatch.core.compile;

import java.util.Map;

/**
 * Defines in-memory compiled classes. One loader per execution, so re-running a module
 * always sees fresh static state.
 */
final class ModuleClassLoader extends ClassLoader {

    private final Map<String, byte[]> classes;

    ModuleClassLoader(Map<String, byte[]> classes, ClassLoader parent) {
        super(parent);
        this.classes = classes;
    }

    @Override
    protected Class<?> findClass(String name) throws ClassNotFoundException {
        byte[] bytes = classes.get(name);
        if (bytes == null) {
            throw new ClassNotFoundException(name);
        }
        return defineClass(name, bytes, 0, bytes.length);
    }
}
