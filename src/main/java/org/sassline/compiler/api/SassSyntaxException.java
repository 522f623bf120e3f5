package org.sassline.compiler.api;

import org.sassline.compiler.internal.i18n.Messages;

/**
 * The single error kind raised by the front end. Every malformed construct, and every
 * failure of a collaborator (expression parser, import resolver), surfaces as this
 * exception and aborts the parse of the whole document.
 * <p>
 * The line is always known when the exception is created. The file name and the
 * starting line of an embedded fragment are attached by the top-level parser when the
 * exception leaves the parse, see {@link #addMetadata(String, int)}.
 */
public class SassSyntaxException extends Exception {

    private final SyntaxErrorCode code;
    private final int sassLine;
    private String sassFilename;
    private int startLine = 1;

    /**
     * Constructs a new syntax exception.
     * @param code The error code; its message pattern is formatted with {@code args}.
     * @param sassLine The 1-based source line the error points at.
     * @param args The message arguments.
     */
    public SassSyntaxException(SyntaxErrorCode code, int sassLine, Object... args) {
        super(Messages.format(code.messageKey(), args));
        this.code = code;
        this.sassLine = sassLine;
    }

    /**
     * Constructs a new syntax exception wrapping a collaborator failure.
     * @param cause The collaborator's exception.
     * @param code The error code; its message pattern is formatted with {@code args}.
     * @param sassLine The 1-based source line the error points at.
     * @param args The message arguments.
     */
    public SassSyntaxException(Throwable cause, SyntaxErrorCode code, int sassLine, Object... args) {
        super(Messages.format(code.messageKey(), args), cause);
        this.code = code;
        this.sassLine = sassLine;
    }

    /**
     * Attaches the document's file name and starting line. Values that are already set
     * are kept, so an error raised while parsing an imported file keeps that file's name.
     * @param fileName The file being parsed, may be null.
     * @param startLine The line number the parse started at.
     */
    public void addMetadata(String fileName, int startLine) {
        if (this.sassFilename == null) {
            this.sassFilename = fileName;
        }
        if (this.startLine == 1) {
            this.startLine = startLine;
        }
    }

    public SyntaxErrorCode getCode() {
        return code;
    }

    /**
     * @return The 1-based line the error points at (already offset by the starting line).
     */
    public int getSassLine() {
        return sassLine;
    }

    /**
     * @return The file name attached by {@link #addMetadata(String, int)}, or null.
     */
    public String getSassFilename() {
        return sassFilename;
    }

    public int getStartLine() {
        return startLine;
    }

    /**
     * Formats the error for display, e.g. {@code main.sass:4: Invalid attribute: ":".}
     * @return A human-readable description including the location.
     */
    public String describe() {
        String file = sassFilename != null ? sassFilename : "<memory>";
        return String.format("%s:%d: %s", file, sassLine, getMessage());
    }
}
