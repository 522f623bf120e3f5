package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A CSS rule. Selectors written across several lines, each but the last ending in a
 * comma, are merged into one rule holding all of them.
 */
public final class RuleNode extends AstNode {

    private final List<String> selectors = new ArrayList<>();

    public RuleNode(SourceInfo sourceInfo, String selector) {
        super(sourceInfo);
        selectors.add(selector);
    }

    /**
     * @return The selector lines in source order. Unmodifiable.
     */
    public List<String> selectors() {
        return Collections.unmodifiableList(selectors);
    }

    /**
     * @return The selector lines joined with a space.
     */
    public String selector() {
        return String.join(" ", selectors);
    }

    /**
     * @return true if the last selector line ends in a comma, i.e. more selectors follow.
     */
    public boolean isContinued() {
        return selectors.get(selectors.size() - 1).endsWith(",");
    }

    /**
     * Appends another rule's selectors to this one.
     * @param next The following rule.
     */
    public void addSelectorsOf(RuleNode next) {
        selectors.addAll(next.selectors);
    }

    /**
     * Completes a merge: takes the terminal rule's selectors and its children.
     * @param terminal The rule that ended the continuation.
     */
    public void closeWith(RuleNode terminal) {
        addSelectorsOf(terminal);
        replaceChildren(terminal.getChildren());
    }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
