package dumb.logics;

import dumb.logics.deduction.Rule;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class LogicsTest extends AbstractLogicsTest {

    @Test
    void defaults() {
        var c = new Logics.Configuration();
        assertEquals(Logics.Configuration.DEFAULT_MAX_PROOF_DEPTH, c.maxProofDepth());
        assertTrue(c.materialImplication());
        assertFalse(c.traceProofs());
    }

    @Test
    void missingResourceGivesDefaults() {
        assertEquals(new Logics.Configuration(), Logics.load("no-such-config.json"));
    }

    @Test
    void partialResourceKeepsDefaultsForTheRest() {
        var c = Logics.load("logics-strict.json");
        assertEquals(3, c.maxProofDepth());
        assertFalse(c.materialImplication());
        assertEquals(Logics.Configuration.DEFAULT_TRACE_PROOFS, c.traceProofs());
    }

    @Test
    void unreadableResourceGivesDefaults() {
        assertEquals(new Logics.Configuration(), Logics.load("logics-broken.json"));
    }

    @Test
    void facade() throws Exception {
        var f = Logics.parsePl("a -> b");
        assertEquals("(a) -> (b)", Logics.toString(f));
        assertTrue(Logics.evaluate(f, Set.of("b")));
        assertFalse(Logics.evaluate(f, Map.of("a", true, "b", false)));

        assertEquals(Formalism.LTL, Logics.parseLtl("G a").formalism());
        assertEquals(Formalism.PLTL, Logics.parsePltl("O a").formalism());
        assertEquals(Formalism.LDL, Logics.parseLdl("<a*>tt").formalism());
        assertEquals(Formalism.FOL, Logics.parseFol("P(a)").formalism());
    }

    @Test
    void proofs() throws Exception {
        var proof = Logics.buildProof(List.of(
                1, Logics.parseFol("P & Q"), List.of(Rule.PREMISE),
                2, Logics.parseFol("Q & P"), List.of(Rule.COPY, 1)));
        assertTrue(Logics.checkProof(proof));
    }
}
