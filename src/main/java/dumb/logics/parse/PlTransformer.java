package dumb.logics.parse;

import dumb.logics.Formalism;
import dumb.logics.Formulas;

final class PlTransformer extends Transformer {

    PlTransformer(Formulas formulas) {
        super(formulas);
        on("propositional_formula", args -> single("propositional_formula", args));
        on("prop_equivalence", args -> starredBinaryOp(args, formulas::equivalence, "prop_equivalence"));
        on("prop_implication", args -> starredBinaryOp(args, formulas::implies, "prop_implication"));
        on("prop_or", args -> starredBinaryOp(args, formulas::or, "prop_or"));
        on("prop_and", args -> starredBinaryOp(args, formulas::and, "prop_and"));
        on("prop_not", args -> processUnaryOp(args, formulas::not, "prop_not"));
        on("prop_wrapped", args -> wrapped("prop_wrapped", args));
        on("prop_atom", args -> single("prop_atom", args));
        on("prop_true", args -> formulas.top(Formalism.PL));
        on("prop_false", args -> formulas.bottom(Formalism.PL));
        on("atom", args -> formulas.atomic(text(single("atom", args), "atom", args), Formalism.PL));
    }
}
