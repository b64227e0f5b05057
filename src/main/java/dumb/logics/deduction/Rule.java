package dumb.logics.deduction;

import org.jetbrains.annotations.Nullable;

import java.util.Arrays;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * Inference rules of natural deduction, by the names proofs cite them with.
 */
public enum Rule {
    AND_E1("and_e1"),
    AND_E2("and_e2"),
    AND_I("and_i"),
    ASSUMPTION("assumption"),
    BOT_E("bot_e"),
    COPY("copy"),
    DNEG_E("dneg_e"),
    DNEG_I("dneg_i"),
    EXISTS_E("exists_e"),
    EXISTS_I("exists_i"),
    FORALL_E("forall_e"),
    FORALL_I("forall_i"),
    IMPL_E("impl_e"),
    IMPL_I("impl_i"),
    /** Modus tollens. */
    MT("MT"),
    NEG_E("neg_e"),
    NEG_I("neg_i"),
    OR_E("or_e"),
    OR_I1("or_i1"),
    OR_I2("or_i2"),
    PREMISE("premise");

    private static final Map<String, Rule> byId = Arrays.stream(values()).collect(Collectors.toUnmodifiableMap(r -> r.id, Function.identity()));

    public final String id;

    Rule(String id) {
        this.id = id;
    }

    @Nullable
    public static Rule of(String id) {
        return byId.get(id);
    }

    @Override
    public String toString() {
        return id;
    }
}
