package org.sassline.compiler.frontend.parser.ast;

import org.sassline.compiler.api.SourceInfo;

/**
 * An import of another stylesheet, resolved to a file path.
 */
public final class FileImportNode extends AstNode {

    private final String path;

    public FileImportNode(SourceInfo sourceInfo, String path) {
        super(sourceInfo);
        this.path = path;
    }

    public String path() { return path; }

    @Override
    public <T> T accept(AstVisitor<T> visitor) {
        return visitor.visit(this);
    }
}
