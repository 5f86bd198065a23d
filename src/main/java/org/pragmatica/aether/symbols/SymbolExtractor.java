package org.pragmatica.aether.symbols;

import org.pragmatica.aether.ast.Expression;
import org.pragmatica.aether.ast.Program;
import org.pragmatica.aether.ast.Statement;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Builds a {@link SymbolTable} from a parsed program.
 *
 * <p>Every nested statement body is visited, including bodies reached through expressions
 * (conditionals and lambdas), so locally scoped declarations are indexed as well.
 */
public final class SymbolExtractor {
    private final Optional<DocCommentLocator> comments;
    private final List<SymbolInfo> variables = new ArrayList<>();
    private final List<SymbolInfo> functions = new ArrayList<>();

    private SymbolExtractor(Optional<DocCommentLocator> comments) {
        this.comments = comments;
    }

    /**
     * Extract symbols with documentation taken from the comments in {@code text}.
     */
    public static SymbolTable extract(Program program, String text) {
        return extract(program, text, true);
    }

    public static SymbolTable extract(Program program, String text, boolean withDocumentation) {
        var comments = withDocumentation
                       ? Optional.of(DocCommentLocator.forText(text))
                       : Optional.<DocCommentLocator>empty();
        var extractor = new SymbolExtractor(comments);
        extractor.visitStatements(program.statements());
        return new SymbolTable(extractor.variables, extractor.functions);
    }

    private void visitStatements(List<Statement> statements) {
        for (var statement : statements) {
            visitStatement(statement);
        }
    }

    private void visitStatement(Statement statement) {
        if (statement instanceof Statement.Declaration declaration) {
            declare(declaration);
        }

        if (statement instanceof Statement.Set set) {
            visitExpression(set.value());
        } else if (statement instanceof Statement.LazyDefinition lazy) {
            visitExpression(lazy.expression());
        } else if (statement instanceof Statement.Routine routine) {
            visitStatements(routine.body());
        } else if (statement instanceof Statement.SetIndex setIndex) {
            visitExpression(setIndex.value());
        } else if (statement instanceof Statement.Return ret) {
            visitExpression(ret.value());
        } else if (statement instanceof Statement.Yield yieldStatement) {
            visitExpression(yieldStatement.value());
        } else if (statement instanceof Statement.Throw thrown) {
            visitExpression(thrown.value());
        } else if (statement instanceof Statement.While loop) {
            visitExpression(loop.condition());
            visitStatements(loop.body());
        } else if (statement instanceof Statement.For loop) {
            visitExpression(loop.iterable());
            visitStatements(loop.body());
        } else if (statement instanceof Statement.ForIndexed loop) {
            visitExpression(loop.iterable());
            visitStatements(loop.body());
        } else if (statement instanceof Statement.Switch switchStatement) {
            visitExpression(switchStatement.scrutinee());
            for (var switchCase : switchStatement.cases()) {
                visitStatements(switchCase.body());
            }
            switchStatement.defaultBody()
                           .ifPresent(this::visitStatements);
        } else if (statement instanceof Statement.ExpressionStatement expressionStatement) {
            visitExpression(expressionStatement.expression());
        }
    }

    private void visitExpression(Expression expression) {
        if (expression instanceof Expression.Conditional conditional) {
            visitExpression(conditional.condition());
            visitStatements(conditional.thenBranch());
            for (var branch : conditional.elifBranches()) {
                visitExpression(branch.condition());
                visitStatements(branch.body());
            }
            conditional.elseBranch()
                       .ifPresent(this::visitStatements);
        } else if (expression instanceof Expression.Lambda lambda) {
            visitStatements(lambda.body());
        } else if (expression instanceof Expression.Binary binary) {
            visitExpression(binary.left());
            visitExpression(binary.right());
        } else if (expression instanceof Expression.Unary unary) {
            visitExpression(unary.operand());
        } else if (expression instanceof Expression.Call call) {
            visitExpression(call.callee());
            call.arguments()
                .forEach(this::visitExpression);
        } else if (expression instanceof Expression.Index index) {
            visitExpression(index.target());
            visitExpression(index.index());
        } else if (expression instanceof Expression.ArrayLiteral array) {
            array.elements()
                 .forEach(this::visitExpression);
        } else if (expression instanceof Expression.DictLiteral dict) {
            dict.entries()
                .forEach(entry -> visitExpression(entry.value()));
        }
    }

    private void declare(Statement.Declaration declaration) {
        var kind = kindOf(declaration);
        var symbol = new SymbolInfo(
            declaration.name(),
            kind,
            declaration.span().toEditorRange(),
            declaration.nameSpan().toEditorRange(),
            detailOf(declaration, kind),
            comments.flatMap(locator -> locator.documentationAbove(declaration.span().start().line())));

        if (kind.isCallable()) {
            functions.add(symbol);
        } else {
            variables.add(symbol);
        }
    }

    private static SymbolKind kindOf(Statement.Declaration declaration) {
        if (declaration instanceof Statement.FunctionDefinition) {
            return SymbolKind.FUNCTION;
        }
        if (declaration instanceof Statement.GeneratorDefinition) {
            return SymbolKind.GENERATOR;
        }
        if (declaration instanceof Statement.LazyDefinition) {
            return SymbolKind.LAZY;
        }
        return SymbolKind.VARIABLE;
    }

    private static String detailOf(Statement.Declaration declaration, SymbolKind kind) {
        var detail = kind.label() + ": " + declaration.name();
        if (declaration instanceof Statement.Routine routine) {
            return detail + "(" + String.join(", ", routine.parameters()) + ")";
        }
        return detail;
    }
}
