package org.pragmatica.aether.symbols;

import org.pragmatica.aether.tree.EditorRange;

public record TextEdit(EditorRange range, String newText) {}
