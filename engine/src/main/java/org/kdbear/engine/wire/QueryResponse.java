package org.kdbear.engine.wire;

import java.util.Objects;

/**
 * Owning handle of the object returned by one executor call.
 *
 * The handle is released exactly once: the first {@link #close()} runs the
 * release action supplied by the executor, later calls do nothing. Objects
 * reached through {@link #root()} are borrowed views and are never released on
 * their own; they must not be used after the handle is closed.
 */
public final class QueryResponse implements AutoCloseable {

    private static final Runnable NO_RELEASE = () -> {
    };

    private final KObject root;
    private final Runnable release;
    private boolean released;

    public QueryResponse(KObject root, Runnable release) {
        this.root = Objects.requireNonNull(root, "root");
        this.release = Objects.requireNonNull(release, "release");
    }

    /**
     * Wraps an object that holds no external resources.
     */
    public static QueryResponse of(KObject root) {
        return new QueryResponse(root, NO_RELEASE);
    }

    /**
     * @return the top-level object
     * @throws IllegalStateException if the handle was already released
     */
    public KObject root() {
        if (released) {
            throw new IllegalStateException("Response already released");
        }
        return root;
    }

    public boolean isReleased() {
        return released;
    }

    @Override
    public void close() {
        if (released) {
            return;
        }
        released = true;
        release.run();
    }
}
