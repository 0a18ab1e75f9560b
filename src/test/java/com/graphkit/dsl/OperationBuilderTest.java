package com.graphkit.dsl;

import com.graphkit.GraphKit;
import com.graphkit.op.FunctionalOperation;
import org.junit.Test;

import java.util.List;
import java.util.Map;

import static org.junit.Assert.*;

public class OperationBuilderTest {

    @Test
    public void testFn1() throws Exception {
        FunctionalOperation op = GraphKit.operation("neg").needs("x").provides("y").fn1(x -> -(Integer) x);
        assertEquals("neg", op.name());
        assertEquals(List.of("x"), op.needs());
        assertEquals(List.of("y"), op.provides());
        assertEquals(Map.of("y", -4), op.invoke(Map.of("x", 4)));
    }

    @Test
    public void testFn3() throws Exception {
        FunctionalOperation op = GraphKit.operation("fma").needs("a", "b", "c").provides("r")
                .fn3((a, b, c) -> (Integer) a * (Integer) b + (Integer) c);
        assertEquals(Map.of("r", 7), op.invoke(Map.of("a", 2, "b", 3, "c", 1)));
    }

    @Test
    public void testFnNReceivesNeedsInDeclarationOrder() throws Exception {
        FunctionalOperation op = GraphKit.operation("concat").needs("z", "a", "m").provides("s")
                .fnN(args -> "" + args[0] + args[1] + args[2]);
        assertEquals(Map.of("s", "ZAM"), op.invoke(Map.of("a", "A", "m", "M", "z", "Z")));
    }

    @Test
    public void testMultipleProvidesFromArrayOrList() throws Exception {
        FunctionalOperation arr = GraphKit.operation("divmod").needs("n", "d").provides("q", "r")
                .fn2((n, d) -> new Object[] { (Integer) n / (Integer) d, (Integer) n % (Integer) d });
        assertEquals(Map.of("q", 3, "r", 1), arr.invoke(Map.of("n", 7, "d", 2)));

        FunctionalOperation list = GraphKit.operation("split").needs("s").provides("head", "tail")
                .fn1(s -> List.of(((String) s).substring(0, 1), ((String) s).substring(1)));
        assertEquals(Map.of("head", "a", "tail", "bc"), list.invoke(Map.of("s", "abc")));
    }

    @Test(expected = IllegalStateException.class)
    public void testWrongResultCount() throws Exception {
        GraphKit.operation("bad").needs("x").provides("p", "q").fn1(x -> new Object[] { 1 })
                .invoke(Map.of("x", 0));
    }

    @Test(expected = IllegalStateException.class)
    public void testScalarResultForSeveralProvides() throws Exception {
        GraphKit.operation("bad").needs("x").provides("p", "q").fn1(x -> 1).invoke(Map.of("x", 0));
    }

    @Test
    public void testNamedFn() throws Exception {
        FunctionalOperation op = GraphKit.operation("swap").needs("l", "r").provides("l2", "r2")
                .fn(in -> Map.of("l2", in.get("r"), "r2", in.get("l")));
        assertEquals(Map.of("l2", 2, "r2", 1), op.invoke(Map.of("l", 1, "r", 2)));
    }

    @Test
    public void testParams() {
        FunctionalOperation op = GraphKit.operation("scale").needs("x").provides("y")
                .param("factor", 3)
                .params(Map.of("unit", "m"))
                .fn1(x -> x);
        assertEquals(3, op.params().get("factor"));
        assertEquals("m", op.params().get("unit"));
        assertTrue(GraphKit.operation("plain").needs("x").provides("y").fn1(x -> x).params().isEmpty());
    }

    @Test(expected = IllegalArgumentException.class)
    public void testArityMismatch() {
        GraphKit.operation("add").needs("a").provides("sum").fn2((a, b) -> a);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateNeedRejected() {
        GraphKit.operation("add").needs("a", "a").provides("sum").fn2((a, b) -> a);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testDuplicateProvideRejected() {
        GraphKit.operation("add").needs("a").provides("x", "x").fn1(a -> a);
    }

    @Test(expected = IllegalArgumentException.class)
    public void testBlankNameRejected() {
        GraphKit.operation("").needs("a").provides("x").fn1(a -> a);
    }

    @Test
    public void testToString() {
        FunctionalOperation op = GraphKit.operation("neg").needs("x").provides("y").fn1(x -> x);
        assertEquals("FunctionalOperation(name='neg', needs=[x], provides=[y])", op.toString());
    }
}
