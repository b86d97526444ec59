package io.specwatch.core.dsl;

/**
 * Binds a {@link DiscoveryContext} to the current thread for the duration of a
 * try-with-resources block:
 * <pre>{@code
 * try (DiscoveryScope scope = DiscoveryScope.open(context)) {
 *     compiler.execute(artifact, context);
 *     tree = context.tree();
 * }
 * }</pre>
 * The context is reset when the scope opens and again when it closes, and the binding is
 * removed on every exit path, so a failed module never leaks declarations into the next.
 */
public final class DiscoveryScope implements AutoCloseable {

    private static final ThreadLocal<DiscoveryContext> CURRENT = new ThreadLocal<>();

    private final DiscoveryContext context;
    private boolean closed;

    private DiscoveryScope(DiscoveryContext context) {
        this.context = context;
    }

    /**
     * @throws IllegalStateException if a scope is already open on this thread
     */
    public static DiscoveryScope open(DiscoveryContext context) {
        if (CURRENT.get() != null) {
            throw new IllegalStateException("A discovery scope is already open on thread "
                    + Thread.currentThread().getName());
        }
        context.reset();
        CURRENT.set(context);
        return new DiscoveryScope(context);
    }

    /**
     * Context bound to the current thread.
     *
     * @throws IllegalStateException outside an open scope
     */
    static DiscoveryContext current() {
        DiscoveryContext context = CURRENT.get();
        if (context == null) {
            throw new IllegalStateException(
                    "Spec declarations are only allowed while a module is being discovered");
        }
        return context;
    }

    public static boolean isOpen() {
        return CURRENT.get() != null;
    }

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        try {
            context.reset();
        } finally {
            CURRENT.remove();
        }
    }
}
