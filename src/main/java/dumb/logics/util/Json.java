package dumb.logics.util;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import dumb.logics.Formula;
import dumb.logics.Formula.*;
import dumb.logics.Term;
import dumb.logics.UnsupportedFormulaException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;

public class Json {

    private static final Logger logger = LoggerFactory.getLogger(Json.class);

    public static final ObjectMapper the = JsonMapper.builder()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .build();

    public static String str(Object obj) {
        try {
            return the.writeValueAsString(obj);
        } catch (JsonProcessingException e) {
            logger.error("Error serializing object to JSON: {}", e.getMessage(), e);
            return "{}";
        }
    }

    public static JsonNode node(Object obj) {
        try {
            return the.valueToTree(obj);
        } catch (IllegalArgumentException e) {
            logger.error("Error converting object to JsonNode: {}", e.getMessage(), e);
            return the.createObjectNode();
        }
    }

    public static JsonNode node(String json) throws JsonProcessingException {
        return the.readTree(json);
    }

    public static <T> T obj(String json, Class<T> valueType) throws JsonProcessingException {
        return the.readValue(json, valueType);
    }

    public static <T> T obj(InputStream json, Class<T> valueType) throws IOException {
        return the.readValue(json, valueType);
    }

    public static ObjectNode node() {
        return the.createObjectNode();
    }

    public static ArrayNode array() {
        return the.createArrayNode();
    }

    /**
     * A formula as a JSON tree: {@code op} and {@code operands} for operators, {@code atom},
     * {@code value} or {@code predicate} for leaves; every node names its {@code formalism}.
     */
    public static ObjectNode formula(Formula f) {
        var n = node();
        n.put("formalism", f.formalism().id);
        if (f instanceof Bool b) {
            n.put("value", b.value);
        } else if (f instanceof Atomic a) {
            n.put("atom", a.name);
        } else if (f instanceof Predicate p) {
            n.put("predicate", p.name);
            var terms = n.putArray("terms");
            p.operands.forEach(t -> terms.add(term(t)));
        } else if (f instanceof Unary u) {
            n.put("op", u.op.symbol);
            n.putArray("operands").add(formula(u.argument));
        } else if (f instanceof Nary x) {
            n.put("op", x.op.symbol);
            var operands = n.putArray("operands");
            x.operands.forEach(o -> operands.add(formula(o)));
        } else if (f instanceof Quantified q) {
            n.put("op", q.op.symbol);
            n.put("variable", q.variable.name());
            n.set("body", formula(q.body));
        } else if (f instanceof Modal m) {
            n.put("op", m.op.symbol);
            n.set("regex", formula(m.regex));
            n.set("tail", formula(m.tail));
        } else {
            throw UnsupportedFormulaException.of(f, "Json.formula");
        }
        return n;
    }

    public static JsonNode term(Term t) {
        if (t instanceof Term.Fn fn) {
            var n = node();
            n.put("function", fn.name());
            var args = n.putArray("terms");
            fn.operands().forEach(o -> args.add(term(o)));
            return n;
        }
        var n = node();
        n.put(t instanceof Term.Var ? "variable" : "constant", t.name());
        return n;
    }
}
