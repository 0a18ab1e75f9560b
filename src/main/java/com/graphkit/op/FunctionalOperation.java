package com.graphkit.op;

import com.graphkit.api.Operation;
import com.graphkit.fn.FnN;
import com.graphkit.fn.NamedFn;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Operation backed by a Java function.
 *
 * Two body shapes are supported:
 * <ul>
 * <li>Named: a {@link NamedFn} receiving and returning maps keyed by name.</li>
 * <li>Positional: a {@link FnN} receiving the needs in declaration order. Its
 * result is zipped with the provides: a single provide takes the result as is,
 * several provides expect an {@code Object[]} or {@code List} of matching
 * size.</li>
 * </ul>
 *
 * Instances are immutable. Use {@link com.graphkit.dsl.OperationBuilder} for a
 * fluent way to create them.
 */
public final class FunctionalOperation implements Operation {
    private final String name;
    private final List<String> needs;
    private final List<String> provides;
    private final Map<String, Object> params;
    private final NamedFn body;

    public FunctionalOperation(String name, List<String> needs, List<String> provides,
            Map<String, Object> params, NamedFn body) {
        if (name == null || name.isBlank())
            throw new IllegalArgumentException("Operation name must not be blank");
        if (body == null)
            throw new IllegalArgumentException("Operation '" + name + "' has no body");
        this.name = name;
        this.needs = checkNames(name, "needs", needs);
        this.provides = checkNames(name, "provides", provides);
        this.params = params == null || params.isEmpty()
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(params));
        this.body = body;
    }

    /** Creates an operation whose body takes its needs positionally. */
    public static FunctionalOperation positional(String name, List<String> needs, List<String> provides,
            Map<String, Object> params, FnN fn) {
        if (fn == null)
            throw new IllegalArgumentException("Operation '" + name + "' has no body");
        List<String> needsCopy = needs == null ? List.of() : new ArrayList<>(needs);
        List<String> providesCopy = provides == null ? List.of() : new ArrayList<>(provides);
        return new FunctionalOperation(name, needsCopy, providesCopy, params, inputs -> {
            Object[] args = new Object[needsCopy.size()];
            for (int i = 0; i < args.length; i++)
                args[i] = inputs.get(needsCopy.get(i));
            return zip(name, providesCopy, fn.apply(args));
        });
    }

    @Override
    public String name() {
        return name;
    }

    @Override
    public List<String> needs() {
        return needs;
    }

    @Override
    public List<String> provides() {
        return provides;
    }

    @Override
    public Map<String, Object> params() {
        return params;
    }

    @Override
    public Map<String, Object> invoke(Map<String, Object> inputs) throws Exception {
        return body.apply(inputs);
    }

    @Override
    public String toString() {
        return "FunctionalOperation(name='" + name + "', needs=" + needs + ", provides=" + provides + ")";
    }

    static Map<String, Object> zip(String opName, List<String> provides, Object result) {
        Map<String, Object> out = new LinkedHashMap<>(provides.size() * 2);
        if (provides.size() == 1) {
            out.put(provides.get(0), result);
            return out;
        }
        List<?> values;
        if (result instanceof Object[] arr)
            values = Arrays.asList(arr);
        else if (result instanceof List<?> list)
            values = list;
        else
            throw new IllegalStateException("Operation '" + opName + "' must return " + provides.size()
                    + " values as an array or list, got " + (result == null ? "null" : result.getClass().getName()));
        if (values.size() != provides.size())
            throw new IllegalStateException("Operation '" + opName + "' returned " + values.size()
                    + " values for " + provides.size() + " provides " + provides);
        for (int i = 0; i < provides.size(); i++)
            out.put(provides.get(i), values.get(i));
        return out;
    }

    private static List<String> checkNames(String opName, String what, List<String> names) {
        if (names == null || names.isEmpty())
            return List.of();
        Set<String> seen = new HashSet<>();
        List<String> copy = new ArrayList<>(names.size());
        for (String n : names) {
            if (n == null || n.isBlank())
                throw new IllegalArgumentException("Operation '" + opName + "' has a blank name in " + what);
            if (!seen.add(n))
                throw new IllegalArgumentException("Operation '" + opName + "' lists '" + n + "' twice in " + what);
            copy.add(n);
        }
        return Collections.unmodifiableList(copy);
    }
}
