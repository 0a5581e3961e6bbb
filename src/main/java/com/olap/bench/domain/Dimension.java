package com.olap.bench.domain;

/**
 * Axes of the star-schema query space known to {@link DimensionEncoder}.
 */
public enum Dimension {
    YEAR,
    YEAR_MONTH,
    REGION,
    NATION,
    CITY,
    MFGR,
    CATEGORY,
    BRAND
}
