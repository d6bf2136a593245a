package com.cbinding.generator.codegen.model;

import lombok.Value;

/**
 * One array extent. {@code extent} is null when the size is unknown: {@code x[]}.
 */
@Value
public class ArrayDimension {
    private static final ArrayDimension UNKNOWN = new ArrayDimension(null);

    Long extent;

    public static ArrayDimension of(long extent) {
        return new ArrayDimension(extent);
    }

    public static ArrayDimension unknown() {
        return UNKNOWN;
    }

    @Override
    public String toString() {
        return extent != null ? "[" + extent + "]" : "[]";
    }
}
