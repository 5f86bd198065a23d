package org.pragmatica.aether.ast;

import com.google.common.collect.ImmutableList;
import org.pragmatica.aether.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

import static com.google.common.base.Preconditions.checkArgument;

/**
 * Statement nodes of the Aether syntax tree.
 */
public sealed interface Statement {

    /**
     * Source span from the first to the last token of this statement (terminator excluded).
     */
    SourceSpan span();

    /**
     * A statement that introduces a named symbol.
     */
    sealed interface Declaration extends Statement {
        String name();

        SourceSpan nameSpan();
    }

    /**
     * Functions and generators share one shape.
     */
    sealed interface Routine extends Declaration {
        List<String> parameters();

        List<Statement> body();
    }

    // === Declarations ===

    record Set(SourceSpan span, String name, SourceSpan nameSpan, Expression value) implements Declaration {}

    record FunctionDefinition(
        SourceSpan span,
        String name,
        SourceSpan nameSpan,
        List<String> parameters,
        List<Statement> body
    ) implements Routine {
        public FunctionDefinition {
            parameters = ImmutableList.copyOf(parameters);
            body = ImmutableList.copyOf(body);
        }
    }

    record GeneratorDefinition(
        SourceSpan span,
        String name,
        SourceSpan nameSpan,
        List<String> parameters,
        List<Statement> body
    ) implements Routine {
        public GeneratorDefinition {
            parameters = ImmutableList.copyOf(parameters);
            body = ImmutableList.copyOf(body);
        }
    }

    record LazyDefinition(SourceSpan span, String name, SourceSpan nameSpan, Expression expression) implements Declaration {}

    // === Assignment ===

    record SetIndex(SourceSpan span, Expression target, Expression index, Expression value) implements Statement {}

    // === Control flow ===

    record Return(SourceSpan span, Expression value) implements Statement {}

    record Yield(SourceSpan span, Expression value) implements Statement {}

    record Break(SourceSpan span) implements Statement {}

    record Continue(SourceSpan span) implements Statement {}

    record Throw(SourceSpan span, Expression value) implements Statement {}

    record While(SourceSpan span, Expression condition, List<Statement> body) implements Statement {
        public While {
            body = ImmutableList.copyOf(body);
        }
    }

    record For(SourceSpan span, String variable, Expression iterable, List<Statement> body) implements Statement {
        public For {
            body = ImmutableList.copyOf(body);
        }
    }

    record ForIndexed(
        SourceSpan span,
        String indexVariable,
        String valueVariable,
        Expression iterable,
        List<Statement> body
    ) implements Statement {
        public ForIndexed {
            body = ImmutableList.copyOf(body);
        }
    }

    record Switch(
        SourceSpan span,
        Expression scrutinee,
        List<SwitchCase> cases,
        Optional<List<Statement>> defaultBody
    ) implements Statement {
        public Switch {
            cases = ImmutableList.copyOf(cases);
            defaultBody = defaultBody.<List<Statement>>map(ImmutableList::copyOf);
        }
    }

    record SwitchCase(Expression value, List<Statement> body) {
        public SwitchCase {
            body = ImmutableList.copyOf(body);
        }
    }

    // === Modules ===

    /**
     * Import of one or more names; {@code aliases} is index-aligned with {@code names}.
     */
    record Import(SourceSpan span, List<String> names, String path, List<Optional<String>> aliases) implements Statement {
        public Import {
            checkArgument(names.size() == aliases.size(), "%s names but %s aliases", names.size(), aliases.size());
            names = ImmutableList.copyOf(names);
            aliases = ImmutableList.copyOf(aliases);
        }
    }

    record Export(SourceSpan span, String name) implements Statement {}

    // === Expressions ===

    record ExpressionStatement(SourceSpan span, Expression expression) implements Statement {}
}
