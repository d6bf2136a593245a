package com.cbinding.generator.model;

import lombok.Value;

/**
 * Source coordinate of a declaration, as reported by the upstream C parser.
 */
@Value
public class Coord {
    String file;
    int line;
    int column;

    @Override
    public String toString() {
        return column > 0 ? file + ":" + line + ":" + column : file + ":" + line;
    }
}
