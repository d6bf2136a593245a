package com.cbinding.generator.codegen.resolve;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.cbinding.generator.codegen.model.PxdNode;

/**
 * Ordered list of the blocks emitted at the top level of the .pxd file.
 * Hoisted types are appended as soon as they are complete, so they precede their users.
 */
public class TopLevelAccumulator {

    private final List<PxdNode> nodes = new ArrayList<>();

    public void add(PxdNode node) {
        nodes.add(node);
    }

    public List<PxdNode> getNodes() {
        return Collections.unmodifiableList(nodes);
    }

    public int size() {
        return nodes.size();
    }
}
