package dumb.logics.deduction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import dumb.logics.parse.Parser;
import dumb.logics.util.Json;
import dumb.logics.util.Printer;

import java.util.ArrayList;

import static java.util.Objects.requireNonNull;

/**
 * Proofs as JSON arrays of rows:
 * <pre>
 * {"row": 1, "formula": "P &amp; Q", "by": ["premise"]}
 * {"row": 2, "term": "x0"}
 * {"row": 3, "box": [rows...]}
 * </pre>
 * Formulas and terms are written in first-order syntax.
 */
public final class ProofJson {

    private final Parser parser;

    public ProofJson(Parser parser) {
        this.parser = requireNonNull(parser);
    }

    public Proof read(String json) throws Parser.ParseException {
        try {
            return read(Json.node(json));
        } catch (JsonProcessingException e) {
            var location = e.getLocation();
            throw location == null
                    ? new Parser.ParseException("invalid proof JSON: " + e.getOriginalMessage())
                    : new Parser.ParseException("invalid proof JSON: " + e.getOriginalMessage(), location.getLineNr(), location.getColumnNr(), "");
        }
    }

    public Proof read(JsonNode rows) throws Parser.ParseException {
        if (!rows.isArray()) throw new Parser.ParseException("a proof is an array of rows, found: " + rows);
        var out = new ArrayList<Proof.Row>();
        for (var r : rows) out.add(row(r));
        if (out.isEmpty()) throw new Parser.ParseException("empty proof");
        return new Proof(out);
    }

    private Proof.Row row(JsonNode r) throws Parser.ParseException {
        if (!r.path("row").isInt()) throw new Parser.ParseException("row without a number: " + r);
        var id = r.get("row").asInt();
        if (r.has("box")) return new Proof.Box(id, read(r.get("box")));
        if (r.has("term")) return new Proof.Witness(id, parser.term(r.get("term").asText()));
        if (!r.has("formula")) throw new Parser.ParseException("row " + id + " has no formula, term or box");
        var by = r.path("by");
        if (!by.isArray() || by.isEmpty() || !by.get(0).isTextual())
            throw new Parser.ParseException("row " + id + " has no justification");
        var refs = new ArrayList<Integer>();
        for (var i = 1; i < by.size(); i++) {
            if (!by.get(i).isInt()) throw new Parser.ParseException("row " + id + ": invalid reference " + by.get(i));
            refs.add(by.get(i).asInt());
        }
        return new Proof.Step(id, parser.parse(r.get("formula").asText()), new Proof.Justification(by.get(0).asText(), refs));
    }

    public static ArrayNode write(Proof proof) {
        var rows = Json.array();
        for (var row : proof) {
            var r = rows.addObject();
            r.put("row", row.id());
            if (row instanceof Proof.Step s) {
                r.put("formula", Printer.toString(s.formula()));
                var by = r.putArray("by");
                by.add(s.by().rule());
                s.by().refs().forEach(by::add);
            } else if (row instanceof Proof.Witness w) {
                r.put("term", w.term().toString());
            } else if (row instanceof Proof.Box b) {
                r.set("box", write(b.proof()));
            }
        }
        return rows;
    }
}
