package dumb.logics.deduction;

import dumb.logics.AbstractLogicsTest;
import dumb.logics.parse.Parser;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ProofJsonTest extends AbstractLogicsTest {

    private ProofJson json;
    private NaturalDeduction nd;

    @BeforeEach
    void setUp() {
        json = new ProofJson(Parser.fol(formulas));
        nd = new NaturalDeduction();
    }

    @Test
    void read() throws Exception {
        var p = json.read("""
                [
                  {"row": 1, "formula": "P & Q", "by": ["premise"]},
                  {"row": 2, "formula": "P", "by": ["and_e1", 1]}
                ]
                """);
        assertEquals(2, p.size());
        assertEquals(fol("P"), p.last());
        assertTrue(nd.check(p));
    }

    @Test
    void readBoxes() throws Exception {
        var p = json.read("""
                [
                  {"row": 1, "formula": "exists x.P(x)", "by": ["premise"]},
                  {"row": 2, "box": [
                    {"row": 2, "term": "x0"},
                    {"row": 2, "formula": "P(x0)", "by": ["assumption"]},
                    {"row": 3, "formula": "exists y.P(y)", "by": ["exists_i", 2]}
                  ]},
                  {"row": 4, "formula": "exists y.P(y)", "by": ["exists_e", 1, 2]}
                ]
                """);
        var box = assertInstanceOf(Proof.Box.class, p.get(1));
        assertInstanceOf(Proof.Witness.class, box.proof().get(0));
        assertTrue(nd.check(p));
    }

    @Test
    void writeThenRead() throws Exception {
        var p = Proof.build(List.of(
                1, fol("forall x.(P(x) -> Q(x))"), List.of("premise"),
                2, fol("P(a)"), List.of("premise"),
                3, fol("P(a) -> Q(a)"), List.of("forall_e", 1),
                4, fol("Q(a)"), List.of("impl_e", 2, 3)));
        var rows = ProofJson.write(p);
        assertEquals(4, rows.size());
        assertEquals("(P(a)) -> (Q(a))", rows.get(2).get("formula").asText());
        assertEquals(3, rows.get(3).get("by").get(2).asInt());

        var copy = json.read(rows);
        assertEquals(p.toString(), copy.toString());
        assertTrue(nd.check(copy));
    }

    @Test
    void malformed() {
        assertThrows(Parser.ParseException.class, () -> json.read("[{\"row\": 1"));
        assertThrows(Parser.ParseException.class, () -> json.read("{\"row\": 1}"));
        assertThrows(Parser.ParseException.class, () -> json.read("[]"));
        assertThrows(Parser.ParseException.class, () -> json.read("[{\"formula\": \"P\", \"by\": [\"premise\"]}]"));
        assertThrows(Parser.ParseException.class, () -> json.read("[{\"row\": 1, \"formula\": \"P\"}]"));
        assertThrows(Parser.ParseException.class, () -> json.read("[{\"row\": 1, \"formula\": \"P\", \"by\": [\"copy\", \"one\"]}]"));
        assertThrows(Parser.ParseException.class, () -> json.read("[{\"row\": 1, \"formula\": \"p & q\", \"by\": [\"premise\"]}]"));
        assertThrows(Parser.ParseException.class, () -> json.read("[{\"row\": 1, \"note\": \"P\"}]"));
    }

    @Test
    void syntaxErrorsCarryTheirPosition() {
        var e = assertThrows(Parser.ParseException.class, () -> json.read("[\n  {\"row\": }\n]"));
        assertEquals(2, e.line());
    }
}
