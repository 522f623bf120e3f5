package org.sassline.compiler.frontend.parser;

import org.sassline.compiler.frontend.parser.ast.AstNode;

import java.util.List;

/**
 * The outcome of classifying one logical line. A line yields one node, several nodes
 * (a comma-separated import list), or nothing, when the line attached itself to an
 * earlier node (an {@code @else} branch).
 */
public sealed interface ClassificationResult {

    /** The shared result for lines that produce no node of their own. */
    ClassificationResult NOTHING = new NoOp();

    /**
     * @return The produced nodes in order; empty for {@link NoOp}.
     */
    List<AstNode> nodes();

    static ClassificationResult of(AstNode node) {
        return new Produced(node);
    }

    static ClassificationResult ofAll(List<? extends AstNode> nodes) {
        return new ProducedMany(List.copyOf(nodes));
    }

    record Produced(AstNode node) implements ClassificationResult {
        @Override
        public List<AstNode> nodes() {
            return List.of(node);
        }
    }

    record ProducedMany(List<AstNode> nodes) implements ClassificationResult {
        public ProducedMany {
            nodes = List.copyOf(nodes);
        }
    }

    record NoOp() implements ClassificationResult {
        @Override
        public List<AstNode> nodes() {
            return List.of();
        }
    }
}
