package dumb.logics;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

class InternTableTest extends AbstractLogicsTest {

    @Test
    void equalFormulasAreOneInstance() throws Exception {
        var a = pl("a");
        assertSame(a, pl("a"));
        assertSame(a, formulas.atomic("a"));
        assertEquals(1, formulas.table().size(Formalism.PL));
    }

    @Test
    void commutativeOperandsShareAnInstance() throws Exception {
        var ab = pl("a & b");
        assertSame(ab, pl("b & a"));
        assertNotSame(pl("a -> b"), pl("b -> a"));
    }

    @Test
    void partitionedByFormalism() {
        var p = formulas.atomic("a", Formalism.PL);
        var l = formulas.atomic("a", Formalism.LTL);
        assertNotEquals(p, l);
        assertEquals(1, formulas.table().size(Formalism.PL));
        assertEquals(1, formulas.table().size(Formalism.LTL));
        assertEquals(0, formulas.table().size(Formalism.FOL));

        var context = Logics.getCacheContext();
        assertEquals(Set.of(p), context.get(Formalism.PL));
        assertThrows(UnsupportedOperationException.class, () -> context.get(Formalism.PL).clear());
    }

    @Test
    void resetForgetsIdentity() throws Exception {
        var before = pl("a | b");
        Logics.resetCache();
        assertEquals(0, formulas.table().size());
        var after = pl("a | b");
        assertNotSame(before, after);
        assertEquals(before, after);
    }

    @Test
    void separateTablesDoNotShare() {
        var other = new Formulas(new InternTable());
        var a = other.atomic("a");
        assertNotSame(a, formulas.atomic("a"));
        assertEquals(a, formulas.atomic("a"));
        assertSame(a, other.atomic("a"));
    }

    @Test
    void concurrentConstructionConverges() throws Exception {
        var table = new Formulas(new InternTable());
        var pool = Executors.newFixedThreadPool(8);
        try {
            var tasks = new ArrayList<Callable<Formula>>();
            for (var i = 0; i < 64; i++)
                tasks.add(() -> table.and(table.atomic("p"), table.not(table.atomic("q"))));
            var results = new ArrayList<Formula>();
            for (Future<Formula> f : pool.invokeAll(tasks)) results.add(f.get());
            for (var r : results) assertSame(results.get(0), r);
        } finally {
            pool.shutdown();
            assertTrue(pool.awaitTermination(5, TimeUnit.SECONDS));
        }
    }
}
