package org.pragmatica.aether.symbols;

/**
 * Flat outline entry.
 */
public record DocumentSymbol(String name, SymbolKind kind, DefinitionLocation location) {}
