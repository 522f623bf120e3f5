package org.sassline.compiler.api;

/**
 * Defines unique, testable error codes for every syntax error the front end can raise.
 * This decouples test logic from the (translatable) error messages, which are looked up
 * in the {@code syntax_messages} resource bundle under {@link #messageKey()}.
 */
public enum SyntaxErrorCode {
    // region Indentation
    /** The first non-blank line of the document is indented. */
    INDENTATION_AT_DOCUMENT_START("syntax.indentation.documentStart"),
    /** The indentation unit mixes tabs and spaces. */
    INDENTATION_MIXED("syntax.indentation.mixed"),
    /** A line's indentation is not a whole multiple of the document's unit. */
    INDENTATION_INCONSISTENT("syntax.indentation.inconsistent"),
    /** A line is indented more than one level below the previous line. */
    INDENTATION_TOO_DEEP("syntax.indentation.tooDeep"),
    // endregion

    // region Nesting and placement
    /** Something was nested beneath a construct that must not have children. */
    ILLEGAL_NESTING("syntax.nesting.illegal"),
    /** A mixin was defined somewhere other than the document root. */
    MIXIN_NOT_AT_ROOT("syntax.placement.mixin"),
    /** An import was used somewhere other than the document root. */
    IMPORT_NOT_AT_ROOT("syntax.placement.import"),
    /** A rule ending in a comma was not followed by a rule to merge into. */
    RULE_ENDS_IN_COMMA("syntax.rule.trailingComma"),
    // endregion

    // region Constructs
    /** A variable declaration line could not be parsed. */
    INVALID_VARIABLE_DECLARATION("syntax.variable.invalidDeclaration"),
    /** A variable name is not lexically valid. */
    INVALID_VARIABLE_NAME("syntax.variable.invalidName"),
    /** An attribute line could not be parsed. */
    INVALID_ATTRIBUTE("syntax.attribute.invalid"),
    /** A directive that needs an expression was given none. */
    MISSING_DIRECTIVE_EXPRESSION("syntax.directive.missingExpression"),
    /** An {@code @for} directive is malformed. */
    INVALID_FOR_DIRECTIVE("syntax.for.invalid"),
    /** An {@code @else} does not follow an {@code @if}. */
    ELSE_WITHOUT_IF("syntax.else.withoutIf"),
    /** Text after {@code @else} is not an {@code if <expr>} guard. */
    INVALID_ELSE_DIRECTIVE("syntax.else.invalid"),
    /** An {@code @import} directive has no file names. */
    INVALID_IMPORT_DIRECTIVE("syntax.import.invalid"),
    /** A mixin definition line could not be parsed. */
    INVALID_MIXIN("syntax.mixin.invalid"),
    /** A mixin include line could not be parsed. */
    INVALID_MIXIN_INCLUDE("syntax.mixin.invalidInclude"),
    /** A mixin argument list contains an empty entry. */
    EMPTY_MIXIN_ARGUMENT("syntax.mixin.emptyArgument"),
    /** A mixin definition argument does not start with the variable sigil. */
    MIXIN_ARGUMENT_NOT_VARIABLE("syntax.mixin.argumentNotVariable"),
    /** A required mixin argument follows an optional one. */
    REQUIRED_ARGUMENT_AFTER_OPTIONAL("syntax.mixin.requiredAfterOptional"),
    // endregion

    // region Collaborators
    /** The expression parser rejected an expression. */
    EXPRESSION_SYNTAX("syntax.collaborator.expression"),
    /** The import resolver could not find an imported file. */
    IMPORT_NOT_FOUND("syntax.collaborator.import");
    // endregion

    private final String messageKey;

    SyntaxErrorCode(String messageKey) {
        this.messageKey = messageKey;
    }

    /**
     * Returns the resource bundle key holding this error's message pattern.
     * @return The message key.
     */
    public String messageKey() {
        return messageKey;
    }
}
