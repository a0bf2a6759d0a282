package ai.callgraph.analyzer;

import static ai.callgraph.analyzer.PythonTreeSitterNodeTypes.COMMENT;
import static ai.callgraph.analyzer.PythonTreeSitterNodeTypes.LINE_CONTINUATION;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Predicate;
import org.jetbrains.annotations.Nullable;
import org.treesitter.TSNode;

/** Utility class for the tree-sitter traversal patterns the Python lowering needs. */
public final class ASTTraversalUtils {
    private ASTTraversalUtils() {}

    /** Depth-first, pre-order search for the first node matching the predicate. */
    public static @Nullable TSNode findNodeRecursive(@Nullable TSNode rootNode, Predicate<TSNode> predicate) {
        if (rootNode == null || rootNode.isNull()) {
            return null;
        }

        if (predicate.test(rootNode)) {
            return rootNode;
        }

        for (int i = 0; i < rootNode.getChildCount(); i++) {
            var child = rootNode.getChild(i);
            if (child != null && !child.isNull()) {
                var result = findNodeRecursive(child, predicate);
                if (result != null) {
                    return result;
                }
            }
        }

        return null;
    }

    /** Named children in source order, without comments and line continuations. */
    public static List<TSNode> namedChildren(TSNode node) {
        var results = new ArrayList<TSNode>(node.getNamedChildCount());
        for (int i = 0; i < node.getNamedChildCount(); i++) {
            var child = node.getNamedChild(i);
            if (child == null || child.isNull()) {
                continue;
            }
            var type = child.getType();
            if (!COMMENT.equals(type) && !LINE_CONTINUATION.equals(type)) {
                results.add(child);
            }
        }
        return results;
    }

    /** Named children of the given type, in source order. */
    public static List<TSNode> namedChildrenOfType(TSNode node, String nodeType) {
        return namedChildren(node).stream()
                .filter(child -> nodeType.equals(child.getType()))
                .toList();
    }

    /** The child stored under {@code fieldName}, or null when the field is absent. */
    public static @Nullable TSNode field(TSNode node, String fieldName) {
        var child = node.getChildByFieldName(fieldName);
        return child == null || child.isNull() ? null : child;
    }

    /** Whether any direct child, named or anonymous, has the given type. Used for keyword tokens such as {@code async}. */
    public static boolean hasChildOfType(TSNode node, String nodeType) {
        for (int i = 0; i < node.getChildCount(); i++) {
            var child = node.getChild(i);
            if (child != null && !child.isNull() && nodeType.equals(child.getType())) {
                return true;
            }
        }
        return false;
    }
}
