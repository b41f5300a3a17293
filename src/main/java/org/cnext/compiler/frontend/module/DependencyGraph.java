package org.cnext.compiler.frontend.module;

import org.cnext.compiler.frontend.semantics.SourceLanguage;

import java.util.List;
import java.util.stream.Collectors;

/**
 * The output of dependency resolution: the include tree of one entry file and its nodes
 * in leaves-first order (every node appears after all of its children).
 *
 * @param root             The entry file, or {@code null} if it could not be loaded.
 * @param leavesFirstOrder All nodes of the tree, dependencies before dependents.
 */
public record DependencyGraph(DependencyNode root, List<DependencyNode> leavesFirstOrder) {

    public DependencyGraph {
        leavesFirstOrder = List.copyOf(leavesFirstOrder);
    }

    /**
     * Returns the C and C++ headers in leaves-first order.
     */
    public List<DependencyNode> foreignHeaders() {
        return leavesFirstOrder.stream()
                .filter(n -> n.language().isForeignHeader())
                .collect(Collectors.toList());
    }

    /**
     * Returns the C-Next units in leaves-first order, the root last.
     */
    public List<DependencyNode> cnextUnits() {
        return leavesFirstOrder.stream()
                .filter(n -> n.language() == SourceLanguage.CNEXT)
                .collect(Collectors.toList());
    }

    public List<DependencyNode> systemHeaders() {
        return leavesFirstOrder.stream()
                .filter(n -> n.language() == SourceLanguage.SYSTEM)
                .collect(Collectors.toList());
    }
}
