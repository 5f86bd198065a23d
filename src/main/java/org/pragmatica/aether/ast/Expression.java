package org.pragmatica.aether.ast;

import com.google.common.collect.ImmutableList;
import org.pragmatica.aether.tree.SourceSpan;

import java.util.List;
import java.util.Optional;

/**
 * Expression nodes of the Aether syntax tree.
 */
public sealed interface Expression {

    /**
     * Source span from the first to the last token of this expression.
     */
    SourceSpan span();

    // === Literals ===

    record NumberLiteral(SourceSpan span, double value) implements Expression {}

    /**
     * Integer literal too long for a double, kept as its exact digit string.
     */
    record BigIntegerLiteral(SourceSpan span, String digits) implements Expression {}

    record StringLiteral(SourceSpan span, String value) implements Expression {}

    record BooleanLiteral(SourceSpan span, boolean value) implements Expression {}

    record NullLiteral(SourceSpan span) implements Expression {}

    record Identifier(SourceSpan span, String name) implements Expression {}

    record ArrayLiteral(SourceSpan span, List<Expression> elements) implements Expression {
        public ArrayLiteral {
            elements = ImmutableList.copyOf(elements);
        }
    }

    /**
     * Dictionary literal. Entries keep source order; duplicate keys are not merged.
     */
    record DictLiteral(SourceSpan span, List<DictEntry> entries) implements Expression {
        public DictLiteral {
            entries = ImmutableList.copyOf(entries);
        }
    }

    record DictEntry(String key, Expression value) {}

    // === Operators ===

    record Binary(SourceSpan span, Expression left, BinaryOperator operator, Expression right) implements Expression {}

    record Unary(SourceSpan span, UnaryOperator operator, Expression operand) implements Expression {}

    // === Postfix ===

    record Call(SourceSpan span, Expression callee, List<Expression> arguments) implements Expression {
        public Call {
            arguments = ImmutableList.copyOf(arguments);
        }
    }

    record Index(SourceSpan span, Expression target, Expression index) implements Expression {}

    // === Compound ===

    /**
     * If/Elif/Else chain used as a value.
     */
    record Conditional(
        SourceSpan span,
        Expression condition,
        List<Statement> thenBranch,
        List<ElifBranch> elifBranches,
        Optional<List<Statement>> elseBranch
    ) implements Expression {
        public Conditional {
            thenBranch = ImmutableList.copyOf(thenBranch);
            elifBranches = ImmutableList.copyOf(elifBranches);
            elseBranch = elseBranch.<List<Statement>>map(ImmutableList::copyOf);
        }
    }

    record ElifBranch(Expression condition, List<Statement> body) {
        public ElifBranch {
            body = ImmutableList.copyOf(body);
        }
    }

    /**
     * Anonymous function. The arrow form stores its expression as a single {@code Return}.
     */
    record Lambda(SourceSpan span, List<String> parameters, List<Statement> body) implements Expression {
        public Lambda {
            parameters = ImmutableList.copyOf(parameters);
            body = ImmutableList.copyOf(body);
        }
    }
}
