package org.themecheck.frontend.parser;

import org.themecheck.frontend.parser.tags.CaseTagHandler;
import org.themecheck.frontend.parser.tags.ConditionTagHandler;
import org.themecheck.frontend.parser.tags.ContentForTagHandler;
import org.themecheck.frontend.parser.tags.EchoTagHandler;
import org.themecheck.frontend.parser.tags.RenderTagHandler;
import org.themecheck.frontend.parser.tags.SingleArgumentTagHandler;
import org.themecheck.frontend.parser.tags.WhenTagHandler;

import java.util.HashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Registry of markup handlers by tag name. Tags without a handler keep their markup as raw text.
 */
public class LiquidTagRegistry {

    private final Map<String, ILiquidTagHandler> handlers = new HashMap<>();

    /**
     * Registers a handler for a tag name.
     * @param tagName The tag name (e.g., "render").
     * @param handler The handler for this tag.
     */
    public void register(String tagName, ILiquidTagHandler handler) {
        handlers.put(tagName, handler);
    }

    /**
     * Looks up the handler for a tag name.
     * @param tagName The tag name.
     * @return The handler, or empty if the tag's markup is not parsed.
     */
    public Optional<ILiquidTagHandler> get(String tagName) {
        return Optional.ofNullable(handlers.get(tagName));
    }

    /**
     * Creates a registry with all built-in tag handlers.
     * @return A new registry instance.
     */
    public static LiquidTagRegistry initialize() {
        LiquidTagRegistry registry = new LiquidTagRegistry();
        ConditionTagHandler condition = new ConditionTagHandler();
        registry.register("if", condition);
        registry.register("elsif", condition);
        registry.register("unless", condition);
        registry.register("case", new CaseTagHandler());
        registry.register("when", new WhenTagHandler());
        RenderTagHandler render = new RenderTagHandler();
        registry.register("render", render);
        registry.register("include", render);
        SingleArgumentTagHandler singleArgument = new SingleArgumentTagHandler();
        registry.register("section", singleArgument);
        registry.register("sections", singleArgument);
        registry.register("layout", singleArgument);
        registry.register("content_for", new ContentForTagHandler());
        registry.register("echo", new EchoTagHandler());
        return registry;
    }
}
