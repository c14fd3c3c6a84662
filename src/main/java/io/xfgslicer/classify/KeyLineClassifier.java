package io.xfgslicer.classify;

import io.xfgslicer.model.KeyLineCategory;
import io.xfgslicer.model.KeyLineSet;
import io.xfgslicer.model.NodeRecord;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Finds the key lines of a source file in a single pass over its node table.
 * <p>
 * Categories are checked in this order:
 * <ul>
 *   <li>{@code CallExpression} whose callee is a sensitive API -> {@link KeyLineCategory#CALL}</li>
 *   <li>{@code ArrayIndexing} -> {@link KeyLineCategory#ARRAY}</li>
 *   <li>{@code PtrMemberAccess} -> {@link KeyLineCategory#PTR}</li>
 *   <li>any other node with operator {@code + - * /} -> {@link KeyLineCategory#ARITH}</li>
 * </ul>
 * The callee name is read from the node directly after the call node. The extractor writes
 * the callee identifier as the call's first child, so it follows the call in table order;
 * nothing in the tables links the two explicitly.
 */
public class KeyLineClassifier {

    static final String CALL_EXPRESSION = "CallExpression";
    static final String ARRAY_INDEXING = "ArrayIndexing";
    static final String PTR_MEMBER_ACCESS = "PtrMemberAccess";
    static final Set<String> ARITHMETIC_OPERATORS = Set.of("+", "-", "*", "/");

    private final SensitiveApiList sensitiveApis;

    public KeyLineClassifier(SensitiveApiList sensitiveApis) {
        this.sensitiveApis = sensitiveApis;
    }

    public Classification classify(List<NodeRecord> nodes) {
        KeyLineSet.Builder keyLines = KeyLineSet.builder();
        List<DroppedCandidate> dropped = new ArrayList<>();

        for (int i = 0; i < nodes.size(); i++) {
            NodeRecord node = nodes.get(i);
            KeyLineCategory category = categoryOf(node);
            if (category == null) {
                continue;
            }

            if (category == KeyLineCategory.CALL) {
                String callee = i + 1 < nodes.size() ? nodes.get(i + 1).code() : "";
                if (callee.isEmpty()) {
                    dropped.add(new DroppedCandidate(i, category, DropReason.CALLEE_MISSING));
                    continue;
                }
                if (!sensitiveApis.contains(callee)) {
                    continue;
                }
            }

            LineResolution resolution = LineResolver.resolve(nodes, i);
            if (resolution.isResolved()) {
                keyLines.add(category, resolution.line());
            } else {
                dropped.add(new DroppedCandidate(i, category, resolution.reason()));
            }
        }

        return new Classification(keyLines.build(), dropped);
    }

    /**
     * Category a node is a candidate for, ignoring the sensitive API check; null if none.
     */
    private KeyLineCategory categoryOf(NodeRecord node) {
        return switch (node.type()) {
            case CALL_EXPRESSION -> KeyLineCategory.CALL;
            case ARRAY_INDEXING -> KeyLineCategory.ARRAY;
            case PTR_MEMBER_ACCESS -> KeyLineCategory.PTR;
            default -> ARITHMETIC_OPERATORS.contains(node.operator()) ? KeyLineCategory.ARITH : null;
        };
    }
}
