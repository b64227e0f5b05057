package dumb.logics.util;

import dumb.logics.AbstractLogicsTest;
import dumb.logics.Logics;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class JsonTest extends AbstractLogicsTest {

    @Test
    void operatorNodes() throws Exception {
        var n = Json.formula(ltl("a U !b"));
        assertEquals("ltl", n.get("formalism").asText());
        assertEquals("until", n.get("op").asText());
        assertEquals("a", n.get("operands").get(0).get("atom").asText());
        var not = n.get("operands").get(1);
        assertEquals("not", not.get("op").asText());
        assertEquals("b", not.get("operands").get(0).get("atom").asText());
    }

    @Test
    void constants() throws Exception {
        var n = Json.formula(pl("true"));
        assertEquals("pl", n.get("formalism").asText());
        assertTrue(n.get("value").asBoolean());
    }

    @Test
    void modalNodes() throws Exception {
        var n = Json.formula(ldl("[a*]ff"));
        assertEquals("box", n.get("op").asText());
        assertEquals("re", n.get("regex").get("formalism").asText());
        assertEquals("star", n.get("regex").get("op").asText());
        assertFalse(n.get("tail").get("value").asBoolean());
    }

    @Test
    void firstOrderNodes() throws Exception {
        var n = Json.formula(fol("forall x.P(x, f(a))"));
        assertEquals("forall", n.get("op").asText());
        assertEquals("x", n.get("variable").asText());
        var body = n.get("body");
        assertEquals("P", body.get("predicate").asText());
        assertEquals("x", body.get("terms").get(0).get("variable").asText());
        var f = body.get("terms").get(1);
        assertEquals("f", f.get("function").asText());
        assertEquals("a", f.get("terms").get(0).get("constant").asText());
    }

    @Test
    void configurationRoundTrip() throws Exception {
        var c = new Logics.Configuration(8, false, true);
        assertEquals(c, Json.obj(Json.str(c), Logics.Configuration.class));
        assertEquals(new Logics.Configuration(), Json.obj("{}", Logics.Configuration.class));
        assertEquals(8, Json.node(c).get("maxProofDepth").asInt());
    }
}
