package com.cbinding.generator.codegen.model;

import java.util.List;
import java.util.Optional;

import com.cbinding.generator.codegen.exception.DeclaratorShapeException;

import lombok.EqualsAndHashCode;
import lombok.Getter;

/**
 * A function prototype: {@code int open(const char* path, int flags)}.
 */
@Getter
@EqualsAndHashCode(callSuper = false)
public class FunctionSignature extends Declarator {
    private final String returnType;
    private final String name;
    private final List<Declarator> params;

    public FunctionSignature(String returnType, String name, List<Declarator> params) {
        this.returnType = returnType;
        this.name = name != null ? name : "";
        this.params = List.copyOf(params);
    }

    @Override
    public String getTypeText() {
        return returnType;
    }

    @Override
    public Declarator withName(String newName) {
        if (!name.isEmpty() || newName == null || newName.isEmpty()) {
            return this;
        }
        return new FunctionSignature(returnType, newName, params);
    }

    /**
     * Comma-separated parameter list. Every parameter must render on exactly one line.
     */
    public String argumentList() {
        StringBuilder sb = new StringBuilder();
        for (Declarator param : params) {
            List<String> paramLines = param.lines();
            if (paramLines.size() != 1) {
                throw new DeclaratorShapeException(
                        "Parameter of " + name + " renders on " + paramLines.size() + " lines: " + paramLines);
            }
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(paramLines.get(0));
        }
        return sb.toString();
    }

    @Override
    protected Optional<String> functionPointerLine(int depth) {
        return Optional.of(returnType + " (" + "*".repeat(depth) + name + ")(" + argumentList() + ")");
    }

    @Override
    public List<String> lines() {
        return List.of(returnType + " " + name + "(" + argumentList() + ")");
    }
}
