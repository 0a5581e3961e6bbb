package com.olap.bench.service.grouped;

import java.util.Comparator;
import java.util.List;
import java.util.function.Function;

import com.olap.bench.domain.GroupedRow;
import com.olap.bench.domain.QueryArgument;
import com.olap.bench.domain.QueryTemplate;

/**
 * A grouped query family: the group keys to query, how a key fills the
 * template, and the order rows are reported in.
 *
 * @param name family name, e.g. {@code 4.2}
 * @param groupBy human-readable GROUP BY columns
 * @param template point-aggregate query with one slot per template argument
 * @param keys one row per group, results unset
 * @param arguments template arguments of a key row
 * @param order ORDER BY of the report
 */
public record GroupedFamily(
    String name,
    String groupBy,
    QueryTemplate template,
    List<GroupedRow> keys,
    Function<GroupedRow, List<QueryArgument>> arguments,
    Comparator<GroupedRow> order
) {
    public GroupedFamily {
        keys = List.copyOf(keys);
    }

    public String queryFor(GroupedRow key) {
        return template.render(arguments.apply(key));
    }

    public int size() {
        return keys.size();
    }
}
