package dumb.logics.parse;

import dumb.logics.Formalism;
import dumb.logics.Formulas;

import static dumb.logics.Operator.*;

final class LtlTransformer extends Transformer {

    LtlTransformer(Formulas formulas) {
        super(formulas);
        on("ltlf_formula", args -> single("ltlf_formula", args));
        on("ltlf_equivalence", args -> starredBinaryOp(args, formulas::equivalence, "ltlf_equivalence"));
        on("ltlf_implication", args -> starredBinaryOp(args, formulas::implies, "ltlf_implication"));
        on("ltlf_or", args -> starredBinaryOp(args, formulas::or, "ltlf_or"));
        on("ltlf_and", args -> starredBinaryOp(args, formulas::and, "ltlf_and"));
        on("ltlf_weak_until", args -> starredBinaryOp(args, xs -> formulas.make(WEAK_UNTIL, xs), "ltlf_weak_until"));
        on("ltlf_until", args -> starredBinaryOp(args, xs -> formulas.make(UNTIL, xs), "ltlf_until"));
        on("ltlf_release", args -> starredBinaryOp(args, xs -> formulas.make(RELEASE, xs), "ltlf_release"));
        on("ltlf_strong_release", args -> starredBinaryOp(args, xs -> formulas.make(STRONG_RELEASE, xs), "ltlf_strong_release"));
        on("ltlf_always", args -> processUnaryOp(args, formulas::always, "ltlf_always"));
        on("ltlf_eventually", args -> processUnaryOp(args, formulas::eventually, "ltlf_eventually"));
        on("ltlf_next", args -> processUnaryOp(args, formulas::next, "ltlf_next"));
        on("ltlf_weak_next", args -> processUnaryOp(args, formulas::weakNext, "ltlf_weak_next"));
        on("ltlf_not", args -> processUnaryOp(args, formulas::not, "ltlf_not"));
        on("ltlf_wrapped", args -> wrapped("ltlf_wrapped", args));
        on("ltlf_true", args -> formulas.top(Formalism.LTL));
        on("ltlf_false", args -> formulas.bottom(Formalism.LTL));
        on("ltlf_last", args -> formulas.last());
        on("ltlf_symbol", args -> formulas.atomic(text(single("ltlf_symbol", args), "ltlf_symbol", args), Formalism.LTL));
    }
}
