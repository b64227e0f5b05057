package dumb.logics.semantics;

import java.util.Map;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Truth assignment to atom names. Atoms it does not mention are false.
 */
public final class Interpretation {

    private final Map<String, Boolean> values;

    private Interpretation(Map<String, Boolean> values) {
        this.values = values;
    }

    /**
     * The atoms in {@code trueAtoms} are true.
     */
    public static Interpretation of(Set<String> trueAtoms) {
        return new Interpretation(trueAtoms.stream().collect(Collectors.toUnmodifiableMap(a -> a, a -> true)));
    }

    public static Interpretation of(Map<String, Boolean> values) {
        return new Interpretation(Map.copyOf(values));
    }

    public static Interpretation of(String... trueAtoms) {
        return of(Set.of(trueAtoms));
    }

    public boolean holds(String atom) {
        return values.getOrDefault(requireNonNull(atom), false);
    }

    @Override
    public String toString() {
        return values.entrySet().stream().filter(Map.Entry::getValue).map(Map.Entry::getKey).sorted()
                .collect(Collectors.joining(", ", "{", "}"));
    }
}
