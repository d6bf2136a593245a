package com.cbinding.generator.codegen.naming;

import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Tracks the declared names of the nodes enclosing the current point of the walk
 * and derives deterministic names for anonymous types from them.
 *
 * One frame is pushed per visited node, named or not, so that the two innermost
 * frames are always the node being named and the declarator it hangs from.
 */
public class NamingContext {

    public static final String STRUCT_TAG = "s";
    public static final String UNION_TAG = "u";
    public static final String ENUM_TAG = "e";
    public static final String FUNCTION_TYPE_TAG = "ft";

    private final List<String> frames = new ArrayList<>();

    public void enter(String name) {
        frames.add(name);
    }

    public void exit() {
        if (frames.isEmpty()) {
            throw new IllegalStateException("exit() without matching enter()");
        }
        frames.remove(frames.size() - 1);
    }

    public int depth() {
        return frames.size();
    }

    /**
     * Underscore-joined names of every enclosing frame, excluding the two innermost ones.
     */
    public String currentPathName() {
        int end = Math.max(0, frames.size() - 2);
        return frames.subList(0, end).stream()
                .filter(name -> name != null && !name.isEmpty())
                .collect(Collectors.joining("_"));
    }

    /**
     * Tagged path name: {@code _<path>_<tag>}.
     */
    public String currentPathName(String tag) {
        if (tag == null) {
            return currentPathName();
        }
        return "_" + currentPathName() + "_" + tag;
    }
}
