package dumb.logics.parse;

import dumb.logics.Formalism;
import dumb.logics.Formulas;

import static dumb.logics.Operator.SINCE;

final class PltlTransformer extends Transformer {

    PltlTransformer(Formulas formulas) {
        super(formulas);
        on("pltlf_formula", args -> single("pltlf_formula", args));
        on("pltlf_equivalence", args -> starredBinaryOp(args, formulas::equivalence, "pltlf_equivalence"));
        on("pltlf_implication", args -> starredBinaryOp(args, formulas::implies, "pltlf_implication"));
        on("pltlf_or", args -> starredBinaryOp(args, formulas::or, "pltlf_or"));
        on("pltlf_and", args -> starredBinaryOp(args, formulas::and, "pltlf_and"));
        on("pltlf_since", args -> starredBinaryOp(args, xs -> formulas.make(SINCE, xs), "pltlf_since"));
        on("pltlf_before", args -> processUnaryOp(args, formulas::before, "pltlf_before"));
        on("pltlf_once", args -> processUnaryOp(args, formulas::once, "pltlf_once"));
        on("pltlf_historically", args -> processUnaryOp(args, formulas::historically, "pltlf_historically"));
        on("pltlf_not", args -> processUnaryOp(args, formulas::not, "pltlf_not"));
        on("pltlf_wrapped", args -> wrapped("pltlf_wrapped", args));
        on("pltlf_true", args -> formulas.top(Formalism.PLTL));
        on("pltlf_false", args -> formulas.bottom(Formalism.PLTL));
        on("pltlf_start", args -> formulas.start());
        on("pltlf_symbol", args -> formulas.atomic(text(single("pltlf_symbol", args), "pltlf_symbol", args), Formalism.PLTL));
    }
}
