package dumb.logics.parse;

import java.util.List;
import java.util.stream.Collectors;

/**
 * A parse tree node labelled by the rule that produced it. Children are {@link Tree}s or {@link Token}s.
 */
public record Tree(String rule, List<Object> children) {

    public Tree {
        children = List.copyOf(children);
    }

    @Override
    public String toString() {
        return children.stream().map(Object::toString).collect(Collectors.joining(" ", "(" + rule + " ", ")"));
    }
}
