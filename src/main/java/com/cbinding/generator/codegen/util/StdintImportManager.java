package com.cbinding.generator.codegen.util;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Collects the fixed-width integer type names a header refers to,
 * in first-use order, for the {@code from libc.stdint cimport ...} line.
 */
public class StdintImportManager {

    public static final Set<String> STDINT_TYPES = Set.of(
            "int8_t", "uint8_t", "int16_t", "uint16_t",
            "int32_t", "uint32_t", "int64_t", "uint64_t",
            "int_least8_t", "uint_least8_t", "int_least16_t", "uint_least16_t",
            "int_least32_t", "uint_least32_t", "int_least64_t", "uint_least64_t",
            "int_fast8_t", "uint_fast8_t", "int_fast16_t", "uint_fast16_t",
            "int_fast32_t", "uint_fast32_t", "int_fast64_t", "uint_fast64_t",
            "intptr_t", "uintptr_t", "intmax_t", "uintmax_t");

    private final Set<String> imports = new LinkedHashSet<>();

    /**
     * Registers a type word. Words that are not fixed-width integer types are ignored.
     */
    public void addImport(String typeWord) {
        if (typeWord != null && STDINT_TYPES.contains(typeWord)) {
            imports.add(typeWord);
        }
    }

    public void addImports(Iterable<String> typeWords) {
        for (String word : typeWords) {
            addImport(word);
        }
    }

    public List<String> getImports() {
        return List.copyOf(imports);
    }
}
