package com.olap.bench.domain;

import lombok.Getter;

/**
 * Thrown when a domain value or id has no mapping in a {@link Dimension}.
 */
@Getter
public class DimensionValueNotFoundException extends RuntimeException {

    private final Dimension dimension;
    private final String value;

    public DimensionValueNotFoundException(Dimension dimension, String value) {
        super("No " + dimension + " mapping for '" + value + "'");
        this.dimension = dimension;
        this.value = value;
    }
}
