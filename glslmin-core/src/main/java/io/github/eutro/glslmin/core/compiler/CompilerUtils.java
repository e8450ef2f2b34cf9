package io.github.eutro.glslmin.core.compiler;

import io.github.eutro.glslmin.core.ast.Node;
import io.github.eutro.glslmin.core.ast.NodeType;
import io.github.eutro.glslmin.core.ast.visit.NodeCollector;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Helpers shared by compiler steps.
 */
public final class CompilerUtils {
    private CompilerUtils() {
    }

    /**
     * Find the declarators that declare struct members.
     *
     * @param root The tree to search.
     * @return The ids of every declarator directly inside a struct definition.
     */
    public static Set<Integer> getStructDeclarations(Node root) {
        List<Node> members = NodeCollector.collectNodes(root, (node, stack) ->
                node.is(NodeType.DECLARATOR)
                        && !stack.isEmpty()
                        && stack.get(stack.size() - 1).is(NodeType.STRUCT_DEFINITION));
        Set<Integer> ids = new HashSet<>();
        for (Node member : members) {
            ids.add(member.getId());
        }
        return ids;
    }
}
