package com.cbinding.generator.model;

import lombok.Value;

/**
 * One enumerator of an enum body; {@code value} is null when no initializer was written.
 */
@Value
public class Enumerator {
    String name;
    CExpression value;
}
