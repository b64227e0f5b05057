package dumb.logics;

/**
 * The logic a formula belongs to. Every formula carries exactly one.
 */
public enum Formalism {
    PL("pl"),
    LTL("ltl"),
    PLTL("pltl"),
    LDL("ldl"),
    /** Regular expressions of LDL. */
    RE("re"),
    FOL("fol"),
    ANY("any");

    public final String id;

    Formalism(String id) {
        this.id = id;
    }
}
