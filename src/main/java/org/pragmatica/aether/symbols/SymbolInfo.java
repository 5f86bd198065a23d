package org.pragmatica.aether.symbols;

import org.pragmatica.aether.tree.EditorRange;

import java.util.Optional;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * One declared name.
 *
 * @param name           Declared name
 * @param kind           Declaration kind
 * @param range          Zero-based range of the whole declaration
 * @param selectionRange Zero-based range of the name token
 * @param detail         One-line summary such as {@code Function: SUM(A, B)}
 * @param documentation  Comment block directly above the declaration, if any
 */
public record SymbolInfo(
    String name,
    SymbolKind kind,
    EditorRange range,
    EditorRange selectionRange,
    String detail,
    Optional<String> documentation
) {
    public SymbolInfo {
        checkNotNull(name, "name");
        checkNotNull(kind, "kind");
        checkNotNull(documentation, "documentation");
    }
}
