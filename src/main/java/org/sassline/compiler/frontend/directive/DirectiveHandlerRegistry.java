package org.sassline.compiler.frontend.directive;

import org.sassline.compiler.frontend.parser.features.control.ElseDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.control.ForDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.control.IfDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.control.WhileDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.debug.DebugDirectiveHandler;
import org.sassline.compiler.frontend.parser.features.importdir.ImportDirectiveHandler;

import java.util.HashMap;
import java.util.Map;

/**
 * A registry for directive handlers. This class holds a map of directive keywords
 * to their corresponding handlers. Keywords are case-sensitive; unknown keywords
 * are handled by the fallback.
 */
public class DirectiveHandlerRegistry {
    private final Map<String, IDirectiveHandler> handlers = new HashMap<>();
    private final IDirectiveHandler fallback;

    /**
     * @param fallback The handler for keywords without a registered handler.
     */
    public DirectiveHandlerRegistry(IDirectiveHandler fallback) {
        this.fallback = fallback;
    }

    /**
     * Registers a new directive handler.
     * @param keyword The directive keyword without the {@code @} (e.g., "import").
     * @param handler The handler for the directive.
     */
    public void register(String keyword, IDirectiveHandler handler) {
        handlers.put(keyword, handler);
    }

    /**
     * Gets the handler for a given keyword.
     * @param keyword The directive keyword.
     * @return The registered handler, or the fallback.
     */
    public IDirectiveHandler get(String keyword) {
        return handlers.getOrDefault(keyword, fallback);
    }

    /**
     * Initializes the directive handler registry with all the built-in handlers.
     * @return A new instance of {@link DirectiveHandlerRegistry} with all handlers registered.
     */
    public static DirectiveHandlerRegistry initialize() {
        DirectiveHandlerRegistry registry = new DirectiveHandlerRegistry(new GenericDirectiveHandler());
        registry.register("import", new ImportDirectiveHandler());
        registry.register("for", new ForDirectiveHandler());
        registry.register("if", new IfDirectiveHandler());
        registry.register("else", new ElseDirectiveHandler());
        registry.register("while", new WhileDirectiveHandler());
        registry.register("debug", new DebugDirectiveHandler());
        return registry;
    }
}
