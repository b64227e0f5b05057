package dumb.logics;

import java.io.Serializable;

/**
 * Base for immutable values whose hash is computed once and then memoized.
 * <p>
 * The memo is transient: a deserialized instance starts without it and recomputes on first use,
 * since hashes of strings and enums are not stable across JVM runs.
 */
public abstract class Hashed implements Serializable {

    private static final long serialVersionUID = 1L;

    private transient volatile int hashCodeCache;
    private transient volatile boolean hashCodeCalculated;

    protected abstract int computeHash();

    @Override
    public final int hashCode() {
        if (!hashCodeCalculated) {
            hashCodeCache = computeHash();
            hashCodeCalculated = true;
        }
        return hashCodeCache;
    }

    public final boolean isHashMemoized() {
        return hashCodeCalculated;
    }
}
