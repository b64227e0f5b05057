package dumb.logics.deduction;

import dumb.logics.AbstractLogicsTest;
import dumb.logics.ValidationException;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofTest extends AbstractLogicsTest {

    @Test
    void flatNotation() throws Exception {
        var p = Proof.build(List.of(
                1, fol("P & Q"), List.of("premise"),
                2, fol("P"), List.of(Rule.AND_E1, 1),
                3, fol("Q"), new Proof.Justification(Rule.AND_E2, 1)));
        assertEquals(3, p.size());
        var second = assertInstanceOf(Proof.Step.class, p.get(1));
        assertEquals(2, second.id());
        assertEquals("and_e1", second.by().rule());
        assertEquals(List.of(1), second.by().refs());
        assertEquals(fol("Q"), p.last());
    }

    @Test
    void boxes() throws Exception {
        var p = Proof.build(List.of(
                1, List.of(fol("P"), List.of("assumption"),
                        2, fol("P | Q"), List.of("or_i1", 1)),
                3, fol("P -> P | Q"), List.of("impl_i", 1)));
        assertEquals(2, p.size());
        var box = assertInstanceOf(Proof.Box.class, p.get(0));
        assertEquals(1, box.id());
        assertEquals(1, box.proof().get(0).id());
        assertEquals(fol("P"), box.proof().first());
        assertEquals(fol("P | Q"), box.proof().last());
    }

    @Test
    void witnessBoxes() throws Exception {
        var p = Proof.build(List.of(
                1, List.of(term("x0"), fol("P(x0)"), List.of("assumption"))));
        var box = assertInstanceOf(Proof.Box.class, p.get(0));
        var witness = assertInstanceOf(Proof.Witness.class, box.proof().get(0));
        assertEquals(1, witness.id());
        assertEquals(term("x0"), witness.term());
        var step = assertInstanceOf(Proof.Step.class, box.proof().get(1));
        assertEquals(1, step.id());
        assertEquals(fol("P(x0)"), step.formula());
    }

    @Test
    void unknownRulesAreKept() throws Exception {
        var p = Proof.build(List.of(1, fol("P"), List.of("magic")));
        assertEquals("magic", ((Proof.Step) p.get(0)).by().rule());
    }

    @Test
    void malformedNotation() throws Exception {
        var f = fol("P");
        assertThrows(ValidationException.class, () -> Proof.build(List.of(1)));
        assertThrows(ValidationException.class, () -> Proof.build(List.of(1, f)));
        assertThrows(ValidationException.class, () -> Proof.build(List.of("one", f, List.of("premise"))));
        assertThrows(ValidationException.class, () -> Proof.build(List.of(1, List.of())));
        assertThrows(ValidationException.class, () -> Proof.build(List.of(1, "P", List.of("premise"))));
        assertThrows(ValidationException.class, () -> Proof.build(List.of(1, f, List.of())));
        assertThrows(ValidationException.class, () -> Proof.build(List.of(1, f, List.of("copy", "two"))));
    }

    @Test
    void rendering() throws Exception {
        var p = Proof.build(List.of(
                1, fol("P"), List.of("premise"),
                2, List.of(fol("Q"), List.of("assumption"),
                        3, fol("P & Q"), List.of("and_i", 1, 2)),
                4, fol("Q -> P & Q"), List.of("impl_i", 2)));
        var lines = p.toString().lines().toList();
        assertEquals(4, lines.size());
        assertTrue(lines.get(0).endsWith("premise"));
        assertTrue(lines.get(1).startsWith("| 2"));
        assertTrue(lines.get(2).endsWith("and_i 1, 2"));
        assertTrue(lines.get(3).startsWith("4"));
    }
}
