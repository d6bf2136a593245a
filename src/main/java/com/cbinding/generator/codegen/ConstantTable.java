package com.cbinding.generator.codegen;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalLong;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.cbinding.generator.codegen.util.IntegerLiteralParser;
import com.cbinding.generator.model.CExpression;
import com.cbinding.generator.model.Enumerator;

/**
 * Integer values of the enumerators seen so far in one translation run.
 * Consulted when an array extent is written as a named constant.
 */
public class ConstantTable {

    private static final Logger log = LoggerFactory.getLogger(ConstantTable.class);

    private final Map<String, Long> values = new LinkedHashMap<>();

    public void record(String name, long value) {
        values.put(name, value);
    }

    public OptionalLong lookup(String name) {
        Long value = values.get(name);
        return value != null ? OptionalLong.of(value) : OptionalLong.empty();
    }

    public int size() {
        return values.size();
    }

    /**
     * Evaluates an enum body in declaration order and records every enumerator.
     * An integer-literal initializer sets the value; anything else continues from
     * the previous value plus one, starting at 0.
     *
     * @return the enumerator names, in order
     */
    public List<String> recordEnumerators(List<Enumerator> enumerators) {
        List<String> names = new ArrayList<>();
        long previous = -1;
        for (Enumerator enumerator : enumerators) {
            OptionalLong explicit = literalValue(enumerator.getValue());
            long value = explicit.isPresent() ? explicit.getAsLong() : previous + 1;
            if (explicit.isEmpty() && enumerator.getValue() != null) {
                log.debug("Enumerator {} has a non-literal initializer, continuing at {}",
                        enumerator.getName(), value);
            }
            record(enumerator.getName(), value);
            names.add(enumerator.getName());
            previous = value;
        }
        return names;
    }

    private static OptionalLong literalValue(CExpression expression) {
        if (expression instanceof CExpression.Constant constant) {
            return IntegerLiteralParser.parse(constant.value());
        }
        return OptionalLong.empty();
    }
}
