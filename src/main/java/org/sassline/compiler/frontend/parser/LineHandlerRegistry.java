package org.sassline.compiler.frontend.parser;

import org.sassline.compiler.frontend.directive.DirectiveLineHandler;
import org.sassline.compiler.frontend.parser.features.attribute.AttributeHandler;
import org.sassline.compiler.frontend.parser.features.comment.CommentHandler;
import org.sassline.compiler.frontend.parser.features.mixin.MixinDefinitionHandler;
import org.sassline.compiler.frontend.parser.features.mixin.MixinIncludeHandler;
import org.sassline.compiler.frontend.parser.features.rule.DefaultLineHandler;
import org.sassline.compiler.frontend.parser.features.rule.EscapeHandler;
import org.sassline.compiler.frontend.parser.features.variable.VariableHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * A registry for line handlers, keyed by the first character of a line's text.
 * Lines whose first character has no entry go to the fallback handler.
 */
public class LineHandlerRegistry {
    private final Map<Character, ILineHandler> handlers = new HashMap<>();
    private final ILineHandler fallback;

    /**
     * @param fallback The handler for lines with no registered first character.
     */
    public LineHandlerRegistry(ILineHandler fallback) {
        this.fallback = fallback;
    }

    /**
     * Registers a handler for lines starting with a character.
     * @param firstChar The leading character.
     * @param handler The handler.
     */
    public void register(char firstChar, ILineHandler handler) {
        handlers.put(firstChar, handler);
    }

    /**
     * Gets the handler for a line.
     * @param text The line's trimmed, non-empty text.
     * @return The registered handler, or the fallback.
     */
    public ILineHandler get(String text) {
        return handlers.getOrDefault(text.charAt(0), fallback);
    }

    /**
     * Initializes the registry with all the built-in handlers.
     * @return A new instance of {@link LineHandlerRegistry} with all handlers registered.
     */
    public static LineHandlerRegistry initialize() {
        LineHandlerRegistry registry = new LineHandlerRegistry(new DefaultLineHandler());
        registry.register(':', new AttributeHandler());
        registry.register('!', new VariableHandler());
        registry.register('/', new CommentHandler());
        registry.register('@', new DirectiveLineHandler());
        registry.register('\\', new EscapeHandler());
        registry.register('=', new MixinDefinitionHandler());
        registry.register('+', new MixinIncludeHandler());
        return registry;
    }
}
