package org.themecheck.graph;

import com.google.gson.JsonParseException;
import org.themecheck.frontend.io.IThemeFileSystem;
import org.themecheck.frontend.io.ThemePaths;
import org.themecheck.frontend.parser.ILiquidParser;
import org.themecheck.frontend.parser.LiquidParseException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.util.List;

/**
 * Reads and parses one module. Loading never touches the graph, so it may run on worker threads.
 */
final class ModuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ModuleLoader.class);

    private final IThemeFileSystem fileSystem;
    private final ILiquidParser parser;
    private final String root;

    ModuleLoader(IThemeFileSystem fileSystem, ILiquidParser parser, String root) {
        this.fileSystem = fileSystem;
        this.parser = parser;
        this.root = root;
    }

    LoadedModule load(String path, LiquidModuleKind kind) {
        String uri = ThemePaths.join(root, path);
        if (kind == LiquidModuleKind.ASSET) {
            try {
                return new LoadedModule(fileSystem.exists(uri), ParseStatus.OK, List.of());
            } catch (IOException e) {
                log.warn("Could not stat asset {}", uri, e);
                return new LoadedModule(true, ParseStatus.OK, List.of());
            }
        }

        String text;
        try {
            text = fileSystem.readFile(uri);
        } catch (NoSuchFileException e) {
            log.debug("Module {} does not exist", path);
            return LoadedModule.missing();
        } catch (IOException e) {
            log.warn("Could not read module {}", uri, e);
            return LoadedModule.unparsable();
        }

        if (path.endsWith(".json")) {
            try {
                return new LoadedModule(true, ParseStatus.OK, JsonTemplateReferences.extract(text));
            } catch (JsonParseException e) {
                log.debug("Module {} is not valid JSON: {}", path, e.getMessage());
                return LoadedModule.unparsable();
            }
        }
        try {
            return new LoadedModule(true, ParseStatus.OK, ReferenceExtractor.extract(parser.parse(text), text));
        } catch (LiquidParseException e) {
            log.debug("Module {} does not parse: {}", path, e.getMessage());
            return LoadedModule.unparsable();
        }
    }
}
