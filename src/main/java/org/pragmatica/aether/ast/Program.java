package org.pragmatica.aether.ast;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * A parsed script: statements in execution order.
 */
public record Program(List<Statement> statements) {

    public static final Program EMPTY = new Program(List.of());

    public Program {
        statements = ImmutableList.copyOf(statements);
    }

    public boolean isEmpty() {
        return statements.isEmpty();
    }

    public int size() {
        return statements.size();
    }

    public Statement get(int index) {
        return statements.get(index);
    }
}
