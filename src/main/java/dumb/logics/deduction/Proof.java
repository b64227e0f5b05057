package dumb.logics.deduction;

import dumb.logics.Formula;
import dumb.logics.Term;
import dumb.logics.ValidationException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * A natural deduction proof: numbered rows, each a justified formula, a witness term, or a box
 * (a nested proof opened by an assumption). A box has the number of its first row.
 */
public final class Proof implements Iterable<Proof.Row> {

    public sealed interface Row permits Step, Witness, Box {
        int id();

        /**
         * The formula, term or nested proof of this row.
         */
        Object content();
    }

    /**
     * The cited rule, by name, and the rows it is applied to. Unknown names are kept; the checker rejects them.
     */
    public record Justification(String rule, List<Integer> refs) {
        public Justification {
            requireNonNull(rule);
            refs = List.copyOf(refs);
        }

        public Justification(Rule rule, Integer... refs) {
            this(rule.id, List.of(refs));
        }

        @Override
        public String toString() {
            return refs.isEmpty() ? rule : rule + " " + refs.stream().map(String::valueOf).collect(Collectors.joining(", "));
        }
    }

    public record Step(int id, Formula formula, Justification by) implements Row {
        public Step {
            requireNonNull(formula);
            requireNonNull(by);
        }

        @Override
        public Object content() {
            return formula;
        }
    }

    public record Witness(int id, Term term) implements Row {
        public Witness {
            requireNonNull(term);
        }

        @Override
        public Object content() {
            return term;
        }
    }

    public record Box(int id, Proof proof) implements Row {
        public Box {
            if (proof.rows.isEmpty()) throw new ValidationException("box " + id + " is empty");
        }

        @Override
        public Object content() {
            return proof;
        }
    }

    private final List<Row> rows;

    public Proof(List<Row> rows) {
        this.rows = List.copyOf(rows);
    }

    public List<Row> rows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public Row get(int i) {
        return rows.get(i);
    }

    public Object content(int i) {
        return rows.get(i).content();
    }

    public Object first() {
        return content(0);
    }

    public Object last() {
        return content(rows.size() - 1);
    }

    @Override
    public Iterator<Row> iterator() {
        return rows.iterator();
    }

    /**
     * Builds a proof from the flat notation {@code [id, content, justification, id, content, justification, ...]}.
     * <p>
     * A justification is a list {@code [rule, ref...]} with the rule as a {@link Rule} or its name.
     * A box is written {@code id, [content, justification, id, content, ...]}: its first row takes the
     * box number. A box that opens with a term and a formula, as in
     * {@code [x0, P(x0), justification, ...]}, introduces the term as a witness and the formula as
     * a row of the same number.
     */
    public static Proof build(List<?> notation) {
        var rows = new ArrayList<Row>();
        var i = 0;
        while (i < notation.size()) {
            var id = id(notation.get(i++));
            if (i >= notation.size()) throw new ValidationException("row " + id + " has no content");
            var content = notation.get(i++);
            if (content instanceof List<?> box) {
                rows.add(new Box(id, box(id, box)));
                continue;
            }
            if (i >= notation.size()) throw new ValidationException("row " + id + " has no justification");
            var justification = justification(id, notation.get(i++));
            if (content instanceof Formula f) rows.add(new Step(id, f, justification));
            else if (content instanceof Term t) rows.add(new Witness(id, t));
            else throw new ValidationException("row " + id + ": expected a formula, a term or a box, found " + content);
        }
        return new Proof(rows);
    }

    private static Proof box(int id, List<?> box) {
        if (box.isEmpty()) throw new ValidationException("box " + id + " is empty");
        var rows = new ArrayList<Object>();
        rows.add(id);
        if (box.size() > 1 && box.get(0) instanceof Term && box.get(1) instanceof Formula) {
            rows.add(box.get(0));
            rows.add(List.of(Rule.ASSUMPTION));
            rows.add(id);
            rows.addAll(box.subList(1, box.size()));
        } else {
            rows.addAll(box);
        }
        return build(rows);
    }

    private static int id(Object o) {
        if (o instanceof Integer n) return n;
        throw new ValidationException("expected a row number, found " + o);
    }

    private static Justification justification(int row, Object o) {
        if (o instanceof Justification j) return j;
        if (o instanceof Rule r) return new Justification(r);
        if (o instanceof List<?> l && !l.isEmpty()) {
            var head = l.get(0);
            var rule = head instanceof Rule r ? r.id : head instanceof String s ? s : null;
            if (rule != null) {
                var refs = new ArrayList<Integer>();
                for (var ref : l.subList(1, l.size())) refs.add(id(ref));
                return new Justification(rule, refs);
            }
        }
        throw new ValidationException("row " + row + ": expected a justification, found " + o);
    }

    @Override
    public String toString() {
        return rows.stream().map(Proof::render).collect(Collectors.joining("\n"));
    }

    private static String render(Row r) {
        if (r instanceof Step s) return s.id() + "\t" + s.formula() + "\t" + s.by();
        if (r instanceof Witness w) return w.id() + "\t" + w.term();
        return ((Box) r).proof().rows.stream().map(Proof::render).flatMap(String::lines).map(x -> "| " + x).collect(Collectors.joining("\n"));
    }
}
