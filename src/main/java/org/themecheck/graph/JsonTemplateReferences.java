package org.themecheck.graph;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;
import org.themecheck.frontend.parser.ast.Position;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Collects the references of JSON templates and section groups. Each entry of {@code sections}
 * references {@code sections/<type>.liquid}, visited in {@code order} order followed by the remaining
 * entries. A string {@code layout} references a layout; {@code false} references nothing.
 */
final class JsonTemplateReferences {

    private JsonTemplateReferences() {}

    /**
     * @throws JsonParseException if the text is not a JSON object.
     */
    static List<ExtractedReference> extract(String source) {
        JsonElement parsed = JsonParser.parseString(source);
        if (!parsed.isJsonObject()) {
            throw new JsonParseException("Expected a JSON object at the top level");
        }
        JsonObject root = parsed.getAsJsonObject();
        List<ExtractedReference> references = new ArrayList<>();

        JsonElement layout = root.get("layout");
        if (layout != null && layout.isJsonPrimitive() && layout.getAsJsonPrimitive().isString()) {
            String name = layout.getAsString();
            references.add(new ExtractedReference("layout", LiquidModuleKind.LAYOUT,
                    LiquidModuleKind.LAYOUT.pathFor(name), name, locate(source, "layout", name, 0)));
        }

        JsonElement sections = root.get("sections");
        if (sections == null || !sections.isJsonObject()) {
            return references;
        }
        JsonObject sectionsObject = sections.getAsJsonObject();
        for (String id : orderedIds(root, sectionsObject)) {
            JsonElement section = sectionsObject.get(id);
            if (section == null || !section.isJsonObject()) continue;
            JsonElement type = section.getAsJsonObject().get("type");
            if (type == null || !type.isJsonPrimitive() || !type.getAsJsonPrimitive().isString()) continue;
            String name = type.getAsString();
            if (name.startsWith("@")) continue;
            references.add(new ExtractedReference("section", LiquidModuleKind.SECTION,
                    LiquidModuleKind.SECTION.pathFor(name), name, locateSectionType(source, id, name)));
        }
        return references;
    }

    private static Set<String> orderedIds(JsonObject root, JsonObject sections) {
        Set<String> ids = new LinkedHashSet<>();
        JsonElement order = root.get("order");
        if (order != null && order.isJsonArray()) {
            JsonArray array = order.getAsJsonArray();
            for (JsonElement element : array) {
                if (element.isJsonPrimitive() && sections.has(element.getAsString())) {
                    ids.add(element.getAsString());
                }
            }
        }
        ids.addAll(sections.keySet());
        return ids;
    }

    /**
     * Finds the {@code type} of section {@code id}, searching after the section's own key so that
     * sections sharing a type each get their own range.
     */
    private static Position locateSectionType(String source, String id, String type) {
        Matcher entry = Pattern.compile("\"" + Pattern.quote(id) + "\"\\s*:\\s*\\{").matcher(source);
        if (entry.find()) {
            Position position = locate(source, "type", type, entry.end());
            if (position.end() > 0) {
                return position;
            }
        }
        return locate(source, "type", type, 0);
    }

    /**
     * Finds the first {@code "key": "value"} pair at or after {@code from} and returns the range of the
     * quoted value, or an empty range at the start of the file if the pair is written in a form this
     * search does not match.
     */
    private static Position locate(String source, String key, String value, int from) {
        Pattern pattern = Pattern.compile("\"" + Pattern.quote(key) + "\"\\s*:\\s*(\"" + Pattern.quote(value) + "\")");
        Matcher matcher = pattern.matcher(source);
        if (matcher.find(from)) {
            return new Position(matcher.start(1), matcher.end(1));
        }
        return new Position(0, 0);
    }
}
