package org.themecheck.graph;

import java.util.List;

/**
 * Result of reading one module off the coordinator thread.
 *
 * @param exists     false if the file does not exist.
 * @param status     Whether the file could be parsed.
 * @param references The references found, in document order.
 */
record LoadedModule(boolean exists, ParseStatus status, List<ExtractedReference> references) {

    LoadedModule {
        references = List.copyOf(references);
    }

    static LoadedModule missing() {
        return new LoadedModule(false, ParseStatus.OK, List.of());
    }

    static LoadedModule unparsable() {
        return new LoadedModule(true, ParseStatus.UNPARSABLE, List.of());
    }
}
