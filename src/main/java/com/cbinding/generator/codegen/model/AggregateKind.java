package com.cbinding.generator.codegen.model;

import com.cbinding.generator.codegen.naming.NamingContext;

/**
 * Kind of an aggregate block, with the tag used when it has to be named after its path.
 */
public enum AggregateKind {
    STRUCT("struct", NamingContext.STRUCT_TAG),
    UNION("union", NamingContext.UNION_TAG);

    private final String keyword;
    private final String tag;

    AggregateKind(String keyword, String tag) {
        this.keyword = keyword;
        this.tag = tag;
    }

    public String getKeyword() {
        return keyword;
    }

    public String getTag() {
        return tag;
    }
}
