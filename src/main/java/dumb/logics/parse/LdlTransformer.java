package dumb.logics.parse;

import dumb.logics.Formalism;
import dumb.logics.Formula;
import dumb.logics.Formulas;

import java.util.List;
import java.util.Set;

import static dumb.logics.Operator.SEQ;
import static dumb.logics.Operator.UNION;

/**
 * Rules of the embedded propositional grammar ({@code pl__} prefixed, or shared by name) are
 * handled by a {@link PlTransformer}.
 */
final class LdlTransformer extends Transformer {

    private static final String PL_PREFIX = "pl__";
    private static final Set<String> PL_IMPORTED = Set.of("pl_atom", "propositional_formula");

    private final PlTransformer pl;

    LdlTransformer(Formulas formulas) {
        super(formulas);
        pl = new PlTransformer(formulas);
        on("ldlf_formula", args -> single("ldlf_formula", args));
        on("ldlf_equivalence", args -> starredBinaryOp(args, formulas::equivalence, "ldlf_equivalence"));
        on("ldlf_implication", args -> starredBinaryOp(args, formulas::implies, "ldlf_implication"));
        on("ldlf_or", args -> starredBinaryOp(args, formulas::or, "ldlf_or"));
        on("ldlf_and", args -> starredBinaryOp(args, formulas::and, "ldlf_and"));
        on("ldlf_box", args -> modal(args, "ldlf_box"));
        on("ldlf_diamond", args -> modal(args, "ldlf_diamond"));
        on("ldlf_not", args -> {
            if (args.size() != 2) throw error("ldlf_not", args);
            return formulas.not(formula(args.get(1), "ldlf_not", args));
        });
        on("ldlf_wrapped", args -> wrapped("ldlf_wrapped", args));
        on("ldlf_tt", args -> formulas.top(Formalism.LDL));
        on("ldlf_ff", args -> formulas.bottom(Formalism.LDL));
        on("ldlf_last", args -> formulas.ldlLast());
        on("ldlf_end", args -> formulas.end());
        on("ldlf_prop_true", args -> step(formulas.top(Formalism.PL)));
        on("ldlf_prop_false", args -> step(formulas.bottom(Formalism.PL)));
        on("ldlf_prop_atom", args -> step(formulas.atomic(text(single("ldlf_prop_atom", args), "ldlf_prop_atom", args), Formalism.PL)));

        on("regular_expression", args -> single("regular_expression", args));
        on("re_union", args -> starredBinaryOp(args, xs -> formulas.make(UNION, xs), "re_union"));
        on("re_sequence", args -> starredBinaryOp(args, xs -> formulas.make(SEQ, xs), "re_sequence"));
        on("re_star", args -> {
            if (args.size() == 1) return args.get(0);
            if (args.size() == 2) return formulas.star(formula(args.get(0), "re_star", args));
            throw error("re_star", args);
        });
        on("re_test", args -> {
            if (args.size() == 1) return args.get(0);
            if (args.size() == 2) return formulas.test(formula(args.get(1), "re_test", args));
            throw error("re_test", args);
        });
        on("re_wrapped", args -> wrapped("re_wrapped", args));
        on("re_propositional", args -> formulas.prop(formula(single("re_propositional", args), "re_propositional", args)));
    }

    @Override
    protected Action action(String rule) throws Parser.ParseException {
        if (handles(rule)) return super.action(rule);
        if (rule.startsWith(PL_PREFIX)) return pl.action(rule.substring(PL_PREFIX.length()));
        if (PL_IMPORTED.contains(rule)) return pl.action(rule);
        if (rule.equals(rule.toUpperCase())) throw new Parser.ParseException("Terminals should not be parsed: " + rule);
        return super.action(rule);
    }

    /**
     * {@code <a>tt}: one step reading a symbol that satisfies {@code f}.
     */
    private Formula step(Formula f) {
        return formulas.diamond(formulas.prop(f), formulas.top(Formalism.LDL));
    }

    private Formula modal(List<Object> args, String rule) throws Parser.ParseException {
        if (args.size() != 4) throw error(rule, args);
        var regex = formula(args.get(1), rule, args);
        var tail = formula(args.get(3), rule, args);
        return rule.equals("ldlf_box") ? formulas.box(regex, tail) : formulas.diamond(regex, tail);
    }
}
