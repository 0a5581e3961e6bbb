package com.olap.bench.domain;

import java.util.Arrays;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * One typed value bound to a template slot: either an integer row id or a
 * string literal.
 */
public record QueryArgument(Kind kind, long number, String text) {

    public enum Kind {
        INTEGER('d'),
        STRING('s');

        private final char conversion;

        Kind(char conversion) {
            this.conversion = conversion;
        }

        static Kind forConversion(char conversion) {
            for (Kind kind : values()) {
                if (kind.conversion == conversion) {
                    return kind;
                }
            }
            return null;
        }
    }

    public QueryArgument {
        Objects.requireNonNull(kind, "kind");
        if (kind == Kind.STRING) {
            Objects.requireNonNull(text, "text");
        }
    }

    public static QueryArgument of(long number) {
        return new QueryArgument(Kind.INTEGER, number, null);
    }

    public static QueryArgument of(String text) {
        return new QueryArgument(Kind.STRING, 0, text);
    }

    public static List<QueryArgument> ints(List<Integer> values) {
        return values.stream().map(QueryArgument::of).collect(Collectors.toUnmodifiableList());
    }

    public static List<QueryArgument> ints(int... values) {
        return Arrays.stream(values).mapToObj(QueryArgument::of).collect(Collectors.toUnmodifiableList());
    }

    public static List<QueryArgument> strings(List<String> values) {
        return values.stream().map(QueryArgument::of).collect(Collectors.toUnmodifiableList());
    }

    public String render() {
        return kind == Kind.INTEGER ? Long.toString(number) : text;
    }

    @Override
    public String toString() {
        return render();
    }
}
