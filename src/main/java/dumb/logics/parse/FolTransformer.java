package dumb.logics.parse;

import dumb.logics.Formalism;
import dumb.logics.Formula;
import dumb.logics.Formulas;
import dumb.logics.Term;
import dumb.logics.deduction.Substitution;

import java.util.ArrayList;
import java.util.List;

/**
 * Lowercase identifiers are read as constants; a quantifier turns the constants named like its
 * variable, in its body, into that variable.
 */
final class FolTransformer extends Transformer {

    private final Substitution substitution;

    FolTransformer(Formulas formulas) {
        super(formulas);
        substitution = new Substitution(formulas);
        on("fol_formula", args -> single("fol_formula", args));
        on("fol_equivalence", args -> starredBinaryOp(args, formulas::equivalence, "fol_equivalence"));
        on("fol_implication", args -> starredBinaryOp(args, formulas::implies, "fol_implication"));
        on("fol_or", args -> starredBinaryOp(args, formulas::or, "fol_or"));
        on("fol_and", args -> starredBinaryOp(args, formulas::and, "fol_and"));
        on("fol_not", args -> processUnaryOp(args, formulas::not, "fol_not"));
        on("fol_wrapped", args -> wrapped("fol_wrapped", args));
        on("fol_true", args -> formulas.top(Formalism.FOL));
        on("fol_false", args -> formulas.bottom(Formalism.FOL));
        on("fol_forall", args -> quantified(args, "fol_forall"));
        on("fol_exists", args -> quantified(args, "fol_exists"));
        on("fol_predicate", args -> formulas.predicate(text(args.get(0), "fol_predicate", args), arguments(args, "fol_predicate")));
        on("fol_function", args -> new Term.Fn(text(args.get(0), "fol_function", args), arguments(args, "fol_function")));
        on("fol_symbol", args -> new Term.Const(text(single("fol_symbol", args), "fol_symbol", args)));
    }

    private Formula quantified(List<Object> args, String rule) throws Parser.ParseException {
        if (args.size() != 4) throw error(rule, args);
        var variable = new Term.Var(text(args.get(1), rule, args));
        var body = substitution.replace(formula(args.get(3), rule, args), new Term.Const(variable.name()), variable);
        return rule.equals("fol_forall") ? formulas.forAll(variable, body) : formulas.exists(variable, body);
    }

    /**
     * Terms of {@code NAME ("(" term ("," term)* ")")?}.
     */
    private static List<Term> arguments(List<Object> args, String rule) throws Parser.ParseException {
        var terms = new ArrayList<Term>();
        if (args.size() == 1) return terms;
        if (args.size() < 4 || args.size() % 2 != 0) throw error(rule, args);
        for (var i = 2; i < args.size(); i += 2) {
            if (!(args.get(i) instanceof Term t)) throw error(rule, args);
            terms.add(t);
        }
        return terms;
    }
}
