package com.olap.bench.service.grouped;

import java.util.Comparator;
import java.util.function.Function;

import com.olap.bench.domain.GroupedRow;

/**
 * ORDER BY clauses of the grouped query families. Missing keys sort first.
 */
public final class GroupedRowComparators {

    /** 2.x: year, brand number. */
    public static final Comparator<GroupedRow> BY_YEAR_BRAND_NUMBER =
        ascending(GroupedRow::getYear).thenComparing(ascending(GroupedRow::getBrandNumber));

    /** 3.x: year ascending, revenue descending. Failed rows count as zero revenue. */
    public static final Comparator<GroupedRow> BY_YEAR_RESULT_DESC =
        ascending(GroupedRow::getYear)
            .thenComparing(Comparator.comparingLong(GroupedRow::resultOrZero).reversed());

    /** 4.1: year, customer nation. */
    public static final Comparator<GroupedRow> BY_YEAR_C_NATION =
        ascending(GroupedRow::getYear).thenComparing(ascending(GroupedRow::getCNationId));

    /** 4.2: year, supplier nation, category. */
    public static final Comparator<GroupedRow> BY_YEAR_S_NATION_CATEGORY =
        ascending(GroupedRow::getYear)
            .thenComparing(ascending(GroupedRow::getSNationId))
            .thenComparing(ascending(GroupedRow::getCategoryId));

    /** 4.3: year, supplier city, brand. */
    public static final Comparator<GroupedRow> BY_YEAR_S_CITY_BRAND =
        ascending(GroupedRow::getYear)
            .thenComparing(ascending(GroupedRow::getSCityId))
            .thenComparing(ascending(GroupedRow::getBrandId));

    private GroupedRowComparators() {
    }

    private static Comparator<GroupedRow> ascending(Function<GroupedRow, Integer> key) {
        return Comparator.comparing(key, Comparator.nullsFirst(Comparator.naturalOrder()));
    }
}
