package org.pragmatica.aether.symbols;

import org.pragmatica.aether.tree.EditorRange;

/**
 * A range inside a named document.
 */
public record DefinitionLocation(String uri, EditorRange range) {}
