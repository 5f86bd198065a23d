package org.pragmatica.aether.symbols;

/**
 * What a declared name stands for.
 */
public enum SymbolKind {
    VARIABLE("Variable"),
    LAZY("Lazy"),
    FUNCTION("Function"),
    GENERATOR("Generator");

    private final String label;

    SymbolKind(String label) {
        this.label = label;
    }

    public String label() {
        return label;
    }

    /**
     * Functions and generators are listed apart from value bindings.
     */
    public boolean isCallable() {
        return this == FUNCTION || this == GENERATOR;
    }
}
