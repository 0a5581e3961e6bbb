package com.olap.bench.domain;

import java.util.ArrayList;
import java.util.List;

/**
 * Query text with positional slots.
 *
 * Supported conversions: {@code %d} binds an integer argument, {@code %s}
 * binds a string argument and {@code %%} is a literal percent sign. The
 * template is parsed once into literal fragments and slot kinds so rendering
 * is a plain concatenation.
 */
public final class QueryTemplate {

    private final String source;
    private final List<String> fragments;
    private final List<QueryArgument.Kind> slots;

    private QueryTemplate(String source, List<String> fragments, List<QueryArgument.Kind> slots) {
        this.source = source;
        this.fragments = List.copyOf(fragments);
        this.slots = List.copyOf(slots);
    }

    /**
     * Parses a template.
     *
     * @param source the template text
     * @return the parsed template
     * @throws IllegalArgumentException on an unknown or dangling conversion
     */
    public static QueryTemplate parse(String source) {
        List<String> fragments = new ArrayList<>();
        List<QueryArgument.Kind> slots = new ArrayList<>();
        StringBuilder literal = new StringBuilder();

        for (int i = 0; i < source.length(); i++) {
            char c = source.charAt(i);
            if (c != '%') {
                literal.append(c);
                continue;
            }
            if (i + 1 >= source.length()) {
                throw new IllegalArgumentException("Dangling '%' at end of template");
            }
            char conversion = source.charAt(++i);
            if (conversion == '%') {
                literal.append('%');
                continue;
            }
            QueryArgument.Kind kind = QueryArgument.Kind.forConversion(conversion);
            if (kind == null) {
                throw new IllegalArgumentException(
                    "Unsupported conversion '%" + conversion + "' at offset " + (i - 1));
            }
            fragments.add(literal.toString());
            literal.setLength(0);
            slots.add(kind);
        }
        fragments.add(literal.toString());

        return new QueryTemplate(source, fragments, slots);
    }

    public String source() {
        return source;
    }

    public int slotCount() {
        return slots.size();
    }

    public List<QueryArgument.Kind> slots() {
        return slots;
    }

    /**
     * Renders the template with one argument per slot.
     *
     * @throws IllegalArgumentException if the arguments do not match the slots
     */
    public String render(List<QueryArgument> arguments) {
        if (arguments.size() != slots.size()) {
            throw new IllegalArgumentException(
                "Template has " + slots.size() + " slots, got " + arguments.size() + " arguments");
        }
        StringBuilder out = new StringBuilder(source.length() + 16 * slots.size());
        for (int i = 0; i < slots.size(); i++) {
            QueryArgument argument = arguments.get(i);
            if (argument.kind() != slots.get(i)) {
                throw new IllegalArgumentException(
                    "Slot " + i + " expects " + slots.get(i) + ", got " + argument.kind());
            }
            out.append(fragments.get(i)).append(argument.render());
        }
        return out.append(fragments.get(slots.size())).toString();
    }

    @Override
    public String toString() {
        return source;
    }
}
