package com.cbinding.generator.codegen;

import java.util.List;

import lombok.Value;

/**
 * The .pxd text produced for one header, with what went into it.
 */
@Value
public class HeaderTranslation {
    String pxd;
    List<String> stdintImports;
    int topLevelDeclarations;
}
