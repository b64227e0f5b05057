package dumb.logics;

import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.ObjectInputStream;
import java.io.ObjectOutputStream;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class HashedTest {

    @Test
    void hashIsComputedOnFirstUse() {
        var a = new Formula.Atomic("a", Formalism.PL);
        assertFalse(a.isHashMemoized());
        var h = a.hashCode();
        assertTrue(a.isHashMemoized());
        assertEquals(h, a.hashCode());
    }

    @Test
    void memoIsNotSerialized() throws IOException, ClassNotFoundException {
        var a = new Formula.Atomic("a", Formalism.PL);
        var h = a.hashCode();

        var bytes = new ByteArrayOutputStream();
        try (var out = new ObjectOutputStream(bytes)) {
            out.writeObject(a);
        }
        Object copy;
        try (var in = new ObjectInputStream(new ByteArrayInputStream(bytes.toByteArray()))) {
            copy = in.readObject();
        }

        var b = assertInstanceOf(Formula.Atomic.class, copy);
        assertFalse(b.isHashMemoized());
        assertEquals(a, b);
        assertEquals(h, b.hashCode());
        assertTrue(b.isHashMemoized());
    }

    @Test
    void equalFormulasHashAlike() {
        var x = new Formula.Atomic("x", Formalism.LTL);
        var y = new Formula.Atomic("y", Formalism.LTL);
        var xy = new Formula.Nary(Operator.AND, List.of(x, y), Formalism.LTL);
        var yx = new Formula.Nary(Operator.AND, List.of(y, x), Formalism.LTL);
        assertEquals(xy, yx);
        assertEquals(xy.hashCode(), yx.hashCode());

        var until = new Formula.Nary(Operator.UNTIL, List.of(x, y), Formalism.LTL);
        var reversed = new Formula.Nary(Operator.UNTIL, List.of(y, x), Formalism.LTL);
        assertNotEquals(until, reversed);
    }
}
