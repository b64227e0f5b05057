package dumb.logics.deduction;

import dumb.logics.AbstractLogicsTest;
import dumb.logics.Logics;
import dumb.logics.Term;
import dumb.logics.parse.Parser;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class NaturalDeductionTest extends AbstractLogicsTest {

    private final NaturalDeduction nd = new NaturalDeduction(formulas, new Logics.Configuration());

    private Proof proof(Object... notation) {
        return Proof.build(List.of(notation));
    }

    private static List<Object> by(Object rule, Integer... refs) {
        var out = new ArrayList<Object>();
        out.add(rule);
        out.addAll(List.of(refs));
        return out;
    }

    @Test
    void andElimination() throws Exception {
        var premise = fol("P & Q");
        assertTrue(nd.check(proof(1, premise, by("premise"), 2, fol("P"), by("and_e1", 1))));
        assertTrue(nd.check(proof(1, premise, by("premise"), 2, fol("Q"), by("and_e2", 1))));
        assertFalse(nd.check(proof(1, premise, by("premise"), 2, fol("Q"), by("and_e1", 1))));
    }

    @Test
    void andEliminationOfLongConjunctions() throws Exception {
        assertTrue(nd.check(proof(1, fol("P & Q & R"), by("premise"), 2, fol("Q & R"), by(Rule.AND_E2, 1))));
    }

    @Test
    void andIntroduction() throws Exception {
        assertTrue(nd.check(proof(
                1, fol("P"), by("premise"),
                2, fol("Q"), by("premise"),
                3, fol("P & Q"), by("and_i", 1, 2))));
        assertFalse(nd.check(proof(
                1, fol("P"), by("premise"),
                2, fol("P & Q"), by("and_i", 1, 1))));
    }

    @Test
    void orIntroduction() throws Exception {
        assertTrue(nd.check(proof(1, fol("P"), by("premise"), 2, fol("P | Q"), by("or_i1", 1))));
        assertTrue(nd.check(proof(1, fol("Q"), by("premise"), 2, fol("P | Q"), by("or_i2", 1))));
        assertFalse(nd.check(proof(1, fol("R"), by("premise"), 2, fol("P | Q"), by("or_i1", 1))));
    }

    @Test
    void implicationElimination() throws Exception {
        assertTrue(nd.check(proof(
                1, fol("P"), by("premise"),
                2, fol("P -> Q"), by("premise"),
                3, fol("Q"), by("impl_e", 1, 2))));
        assertFalse(nd.check(proof(
                1, fol("Q"), by("premise"),
                2, fol("P -> Q"), by("premise"),
                3, fol("P"), by("impl_e", 1, 2))));
    }

    @Test
    void materialImplication() throws Exception {
        var p = proof(
                1, fol("~P | Q"), by("premise"),
                2, fol("P"), by("premise"),
                3, fol("Q"), by("impl_e", 2, 1));
        assertTrue(nd.check(p));
        assertFalse(new NaturalDeduction(formulas, new Logics.Configuration(64, false, false)).check(p));
    }

    @Test
    void modusTollens() throws Exception {
        assertTrue(nd.check(proof(
                1, fol("P -> Q"), by("premise"),
                2, fol("~Q"), by("premise"),
                3, fol("~P"), by(Rule.MT, 1, 2))));
    }

    @Test
    void implicationIntroduction() throws Exception {
        assertTrue(nd.check(proof(
                1, List.of(fol("P"), by("assumption"),
                        2, fol("P | Q"), by("or_i1", 1)),
                3, fol("P -> P | Q"), by("impl_i", 1))));
    }

    @Test
    void negationIntroduction() throws Exception {
        assertTrue(nd.check(proof(
                1, fol("P -> Q"), by("premise"),
                2, fol("~Q"), by("premise"),
                3, List.of(fol("P"), by("assumption"),
                        4, fol("Q"), by("impl_e", 3, 1),
                        5, fol("false"), by("neg_e", 4, 2)),
                6, fol("~P"), by("neg_i", 3))));
    }

    @Test
    void doubleNegation() throws Exception {
        assertTrue(nd.check(proof(1, fol("P"), by("premise"), 2, fol("~~P"), by("dneg_i", 1))));
        assertTrue(nd.check(proof(1, fol("P"), by("premise"), 2, fol("P"), by("dneg_e", 1))));
        assertTrue(nd.check(proof(1, fol("false"), by("premise"), 2, fol("Q(a)"), by("bot_e", 1))));
    }

    @Test
    void orElimination() throws Exception {
        assertTrue(nd.check(proof(
                1, fol("P | Q"), by("premise"),
                2, fol("P -> R"), by("premise"),
                3, fol("Q -> R"), by("premise"),
                4, List.of(fol("P"), by("assumption"),
                        5, fol("R"), by("impl_e", 4, 2)),
                6, List.of(fol("Q"), by("assumption"),
                        7, fol("R"), by("impl_e", 6, 3)),
                8, fol("R"), by("or_e", 1, 4, 6))));
    }

    @Test
    void universalElimination() throws Exception {
        var all = fol("forall x.P(x)");
        assertTrue(nd.check(proof(1, all, by("premise"), 2, fol("P(a)"), by("forall_e", 1))));
        assertTrue(nd.check(proof(1, all, by("premise"), 2, fol("P(f(b))"), by("forall_e", 1))));
        assertFalse(nd.check(proof(1, all, by("premise"), 2, fol("Q(a)"), by("forall_e", 1))));
        assertFalse(nd.check(proof(1, fol("forall x.R(x, x)"), by("premise"), 2, fol("R(a, b)"), by("forall_e", 1))));
    }

    @Test
    void universalEliminationAvoidsCapture() throws Exception {
        var x = new Term.Var("x");
        var y = new Term.Var("y");
        var premise = formulas.forAll(x, formulas.exists(y, formulas.predicate("R", x, y)));
        var captured = formulas.exists(y, formulas.predicate("R", y, y));
        assertFalse(nd.check(proof(1, premise, by("premise"), 2, captured, by("forall_e", 1))));
        assertTrue(nd.check(proof(1, premise, by("premise"), 2, fol("exists y.R(a, y)"), by("forall_e", 1))));
    }

    @Test
    void existentialIntroduction() throws Exception {
        assertTrue(nd.check(proof(1, fol("P(a) & Q(a)"), by("premise"), 2, fol("exists x.(P(x) & Q(x))"), by("exists_i", 1))));
        assertFalse(nd.check(proof(1, fol("P(a) & Q(b)"), by("premise"), 2, fol("exists x.(P(x) & Q(x))"), by("exists_i", 1))));
    }

    @Test
    void instancesOfCommutativeBodiesInAnyOrder() throws Exception {
        var all = fol("forall x.(P(x) & Q(x))");
        assertTrue(nd.check(proof(1, all, by("premise"), 2, fol("Q(a) & P(a)"), by("forall_e", 1))));
        assertFalse(nd.check(proof(1, all, by("premise"), 2, fol("Q(a) & P(b)"), by("forall_e", 1))));
        assertTrue(nd.check(proof(1, fol("Q(a) | P(a)"), by("premise"), 2, fol("exists x.(P(x) | Q(x))"), by("exists_i", 1))));
        assertTrue(nd.check(proof(1, fol("Q(a) & P(a)"), by("premise"), 2, fol("exists x.(P(x) & Q(x))"), by("exists_i", 1))));
    }

    @Test
    void positionalRulesFollowTheFirstParsedOrder() throws Exception {
        var first = fol("Q | P");
        var later = fol("P | Q");
        assertSame(first, later);
        assertFalse(nd.check(proof(1, fol("P"), by("premise"), 2, later, by("or_i1", 1))));
        assertTrue(nd.check(proof(1, fol("P"), by("premise"), 2, later, by("or_i2", 1))));

        var conjunction = fol("S & R");
        assertSame(conjunction, fol("R & S"));
        assertTrue(nd.check(proof(1, fol("R & S"), by("premise"), 2, fol("S"), by("and_e1", 1))));
    }

    @Test
    void universalIntroduction() throws Exception {
        assertTrue(nd.check(proof(
                1, fol("forall x.(P(x) & Q(x))"), by("premise"),
                2, List.of(term("x0"), fol("P(x0) & Q(x0)"), by("forall_e", 1),
                        3, fol("P(x0)"), by("and_e1", 2)),
                4, fol("forall x.P(x)"), by("forall_i", 2))));
    }

    @Test
    void witnessMustBeFresh() throws Exception {
        assertFalse(nd.check(proof(
                1, fol("P(x0)"), by("premise"),
                2, List.of(term("x0"), fol("P(x0)"), by("copy", 1)),
                3, fol("forall x.P(x)"), by("forall_i", 2))));
    }

    @Test
    void existentialElimination() throws Exception {
        assertTrue(nd.check(proof(
                1, fol("exists x.P(x)"), by("premise"),
                2, fol("forall x.(P(x) -> Q)"), by("premise"),
                3, List.of(term("x0"), fol("P(x0)"), by("assumption"),
                        4, fol("P(x0) -> Q"), by("forall_e", 2),
                        5, fol("Q"), by("impl_e", 3, 4)),
                6, fol("Q"), by("exists_e", 1, 3))));
    }

    @Test
    void existentialEliminationKeepsTheWitnessInside() throws Exception {
        assertFalse(nd.check(proof(
                1, fol("exists x.P(x)"), by("premise"),
                2, List.of(term("x0"), fol("P(x0)"), by("assumption")),
                3, fol("P(x0)"), by("exists_e", 1, 2))));
    }

    @Test
    void unknownRule() throws Exception {
        assertFalse(nd.check(proof(1, fol("P"), by("premise"), 2, fol("P"), by("magic", 1))));
    }

    @Test
    void closedBoxesHideTheirRows() throws Exception {
        assertFalse(nd.check(proof(
                1, List.of(fol("P"), by("assumption"),
                        2, fol("P"), by("copy", 1)),
                3, fol("P"), by("copy", 2))));
    }

    @Test
    void laterRowsAreNotInScope() throws Exception {
        assertFalse(nd.check(proof(
                1, fol("P"), by("copy", 2),
                2, fol("P"), by("premise"))));
    }

    @Test
    void nestingIsBounded() throws Exception {
        var p = proof(
                1, List.of(fol("P"), by("assumption"),
                        2, List.of(fol("Q"), by("assumption")),
                        3, fol("P"), by("copy", 1)),
                4, fol("P -> P"), by("impl_i", 1));
        assertTrue(nd.check(p));
        assertFalse(new NaturalDeduction(formulas, new Logics.Configuration(1, true, false)).check(p));
    }

    @Test
    void rulesByName() {
        assertEquals(Rule.MT, Rule.of("MT"));
        assertEquals(Rule.FORALL_E, Rule.of("forall_e"));
        assertNull(Rule.of("mt"));
        assertEquals("impl_i", Rule.IMPL_I.toString());
    }

    @Test
    void facadeUsesDefaults() throws Parser.ParseException {
        assertTrue(Logics.checkProof(proof(1, fol("P & Q"), by(Rule.PREMISE), 2, fol("P"), by(Rule.AND_E1, 1))));
    }
}
