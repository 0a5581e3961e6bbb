package com.olap.bench.domain;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * A query template plus one argument list per slot, describing the Cartesian
 * product of all argument combinations.
 *
 * Queries are materialized on demand from a linear index via
 * {@link Unranking}; nothing is pre-enumerated. Instances are immutable and
 * every accessor is a pure function, so a QuerySet can be read by any number
 * of worker threads in any order.
 *
 * An empty argument list yields a zero-size set rather than an error.
 */
public final class QuerySet {

    private final String name;
    private final QueryTemplate template;
    private final List<List<QueryArgument>> arguments;
    private final int[] cardinalities;
    private final long size;

    private QuerySet(String name, QueryTemplate template, List<List<QueryArgument>> arguments) {
        this.name = name;
        this.template = template;
        this.arguments = arguments.stream().map(List::copyOf).collect(Collectors.toUnmodifiableList());
        this.cardinalities = arguments.stream().mapToInt(List::size).toArray();
        this.size = Unranking.size(cardinalities);
    }

    /**
     * Creates a query set, validating the arguments against the template slots.
     *
     * @param name query set name, used for reporting and result file names
     * @param template template text with {@code %d}/{@code %s} slots
     * @param arguments one argument list per slot, in slot order
     * @return the query set
     * @throws IllegalArgumentException if slot count or slot kinds do not match
     */
    public static QuerySet of(String name, String template, List<List<QueryArgument>> arguments) {
        QueryTemplate parsed = QueryTemplate.parse(template);
        if (parsed.slotCount() != arguments.size()) {
            throw new IllegalArgumentException(String.format(
                "Query set %s: template has %d slots but %d argument lists were given",
                name, parsed.slotCount(), arguments.size()));
        }
        for (int slot = 0; slot < arguments.size(); slot++) {
            QueryArgument.Kind expected = parsed.slots().get(slot);
            for (QueryArgument argument : arguments.get(slot)) {
                if (argument.kind() != expected) {
                    throw new IllegalArgumentException(String.format(
                        "Query set %s: slot %d expects %s but got %s '%s'",
                        name, slot, expected, argument.kind(), argument.render()));
                }
            }
        }
        return new QuerySet(name, parsed, arguments);
    }

    /**
     * Shorthand for query sets whose slots are all integer ids.
     */
    public static QuerySet ofInts(String name, String template, List<List<Integer>> arguments) {
        List<List<QueryArgument>> typed = new ArrayList<>(arguments.size());
        for (List<Integer> list : arguments) {
            typed.add(QueryArgument.ints(list));
        }
        return of(name, template, typed);
    }

    public String name() {
        return name;
    }

    public QueryTemplate template() {
        return template;
    }

    /** Iteration count: the product of the argument list lengths. */
    public long size() {
        return size;
    }

    public int[] cardinalities() {
        return cardinalities.clone();
    }

    public int dimensions() {
        return cardinalities.length;
    }

    /**
     * Materializes the n-th query as raw text.
     *
     * @param n linear index in {@code [0, size())}
     * @return the populated template
     */
    public String queryTextAt(long n) {
        return template.render(argumentsAt(n));
    }

    /**
     * Materializes the n-th query as a structured row with an empty output.
     */
    public QueryRow rowAt(long n) {
        List<QueryArgument> inputs = argumentsAt(n);
        return new QueryRow(n, template.render(inputs), inputs, List.of());
    }

    private List<QueryArgument> argumentsAt(long n) {
        int[] indices = Unranking.unrank(n, cardinalities);
        List<QueryArgument> tuple = new ArrayList<>(indices.length);
        for (int k = 0; k < indices.length; k++) {
            tuple.add(arguments.get(k).get(indices[k]));
        }
        return tuple;
    }

    @Override
    public String toString() {
        return String.format("%d queries of form:%n%s", size, template.source());
    }
}
