package org.sassline.compiler.frontend.script;

import java.util.regex.Pattern;

/**
 * Lexical rules of the expression language that the front end itself relies on.
 */
public final class ScriptSyntax {

    /** The sigil in front of every variable name. */
    public static final char VARIABLE_CHAR = '!';

    private static final Pattern VARIABLE = Pattern.compile("![a-zA-Z_]\\w*");

    private ScriptSyntax() {}

    /**
     * Checks a variable reference such as {@code !width}.
     * @param candidate The text including the sigil.
     * @return true if it is a lexically valid variable.
     */
    public static boolean isValidVariable(String candidate) {
        return VARIABLE.matcher(candidate).matches();
    }
}
