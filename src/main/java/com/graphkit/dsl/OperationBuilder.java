package com.graphkit.dsl;

import com.graphkit.fn.Fn1;
import com.graphkit.fn.Fn2;
import com.graphkit.fn.Fn3;
import com.graphkit.fn.FnN;
import com.graphkit.fn.NamedFn;
import com.graphkit.op.FunctionalOperation;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Operation Builder -- fluent API for declaring operations.
 *
 * Usage Pattern:
 * 1. Start: GraphKit.operation("add")
 * 2. Declare the contract: .needs("a", "b").provides("sum")
 * 3. Attach the body: .fn2((a, b) -> (Integer) a + (Integer) b)
 *
 * The terminal fn* methods build the operation; the builder may be reused to
 * create further operations with the same contract.
 */
public final class OperationBuilder {
    private final String name;
    private final List<String> needs = new ArrayList<>();
    private final List<String> provides = new ArrayList<>();
    private final Map<String, Object> params = new LinkedHashMap<>();

    private OperationBuilder(String name) {
        this.name = name;
    }

    public static OperationBuilder create(String name) {
        return new OperationBuilder(name);
    }

    // ── Contract ────────────────────────────────────────────────

    public OperationBuilder needs(String... names) {
        needs.addAll(Arrays.asList(names));
        return this;
    }

    public OperationBuilder needs(List<String> names) {
        needs.addAll(names);
        return this;
    }

    public OperationBuilder provides(String... names) {
        provides.addAll(Arrays.asList(names));
        return this;
    }

    public OperationBuilder provides(List<String> names) {
        provides.addAll(names);
        return this;
    }

    /** Attaches a static parameter, visible through {@code params()}. */
    public OperationBuilder param(String key, Object value) {
        params.put(key, value);
        return this;
    }

    public OperationBuilder params(Map<String, ?> values) {
        params.putAll(values);
        return this;
    }

    // ── Bodies (1, 2, 3, N positional inputs, or named) ─────────

    public FunctionalOperation fn1(Fn1 fn) {
        checkArity(1, fn);
        return fnN(args -> fn.apply(args[0]));
    }

    public FunctionalOperation fn2(Fn2 fn) {
        checkArity(2, fn);
        return fnN(args -> fn.apply(args[0], args[1]));
    }

    public FunctionalOperation fn3(Fn3 fn) {
        checkArity(3, fn);
        return fnN(args -> fn.apply(args[0], args[1], args[2]));
    }

    /** Positional body receiving the needs in declaration order. */
    public FunctionalOperation fnN(FnN fn) {
        return FunctionalOperation.positional(name, needs, provides, params, fn);
    }

    /** Body receiving and returning values keyed by name. */
    public FunctionalOperation fn(NamedFn fn) {
        return new FunctionalOperation(name, needs, provides, params, fn);
    }

    private void checkArity(int arity, Object fn) {
        if (fn == null)
            throw new IllegalArgumentException("Operation '" + name + "' has no body");
        if (needs.size() != arity)
            throw new IllegalArgumentException("Operation '" + name + "' declares " + needs.size()
                    + " needs but its body takes " + arity);
    }
}
