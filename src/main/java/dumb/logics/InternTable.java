package dumb.logics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

import static java.util.Objects.requireNonNull;

/**
 * Hash-consing table: maps every structurally distinct formula to the single instance that represents it.
 * <p>
 * The table is partitioned by formalism. Lookups use the formulas' own equality, so commutative
 * operators are canonical regardless of operand order. Interning is atomic per partition, so concurrent
 * first constructions of equal formulas converge on one instance. The table keeps every interned formula
 * alive until {@link #reset()}.
 */
public final class InternTable {

    private static final Logger logger = LoggerFactory.getLogger(InternTable.class);

    private final ConcurrentMap<Formalism, ConcurrentMap<Formula, Formula>> context = new ConcurrentHashMap<>();

    /**
     * Returns the cached formula equal to {@code candidate}, or registers and returns the candidate itself.
     */
    public <F extends Formula> F intern(F candidate) {
        requireNonNull(candidate);
        var partition = context.computeIfAbsent(candidate.formalism(), f -> new ConcurrentHashMap<>());
        var cached = partition.putIfAbsent(candidate, candidate);
        if (cached == null) {
            if (logger.isTraceEnabled()) logger.trace("interned {} formula {}", candidate.formalism().id, candidate);
            return candidate;
        }
        @SuppressWarnings("unchecked") var same = (F) cached;
        return same;
    }

    /**
     * Forgets every interned formula. Formulas already handed out stay valid but lose identity with later ones.
     */
    public void reset() {
        var size = size();
        context.clear();
        logger.info("intern table reset, {} formulas dropped", size);
    }

    public int size() {
        return context.values().stream().mapToInt(Map::size).sum();
    }

    public int size(Formalism formalism) {
        var partition = context.get(formalism);
        return partition == null ? 0 : partition.size();
    }

    /**
     * Read-only snapshot of the table contents, per formalism.
     */
    public Map<Formalism, Set<Formula>> context() {
        var out = new EnumMap<Formalism, Set<Formula>>(Formalism.class);
        context.forEach((formalism, partition) -> out.put(formalism, Set.copyOf(partition.keySet())));
        return Collections.unmodifiableMap(out);
    }
}
