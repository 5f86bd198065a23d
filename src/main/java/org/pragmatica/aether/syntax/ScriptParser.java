package org.pragmatica.aether.syntax;

import org.pragmatica.aether.ast.BinaryOperator;
import org.pragmatica.aether.ast.Expression;
import org.pragmatica.aether.ast.Program;
import org.pragmatica.aether.ast.Statement;
import org.pragmatica.aether.ast.UnaryOperator;
import org.pragmatica.aether.error.ParseError;
import org.pragmatica.aether.error.ParseException;
import org.pragmatica.aether.tree.SourceLocation;
import org.pragmatica.aether.tree.SourceSpan;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static org.pragmatica.aether.syntax.Token.Delimiter.COLON;
import static org.pragmatica.aether.syntax.Token.Delimiter.COMMA;
import static org.pragmatica.aether.syntax.Token.Delimiter.LEFT_BRACE;
import static org.pragmatica.aether.syntax.Token.Delimiter.LEFT_BRACKET;
import static org.pragmatica.aether.syntax.Token.Delimiter.LEFT_PAREN;
import static org.pragmatica.aether.syntax.Token.Delimiter.NEWLINE;
import static org.pragmatica.aether.syntax.Token.Delimiter.RIGHT_BRACE;
import static org.pragmatica.aether.syntax.Token.Delimiter.RIGHT_BRACKET;
import static org.pragmatica.aether.syntax.Token.Delimiter.RIGHT_PAREN;
import static org.pragmatica.aether.syntax.Token.Delimiter.SEMICOLON;

/**
 * Recursive-descent parser for Aether scripts with precedence climbing for expressions.
 *
 * <p>Reads tokens on demand from a {@link Scanner} through a two-token lookahead window.
 * Parsing stops at the first error: the result then carries exactly that error and no program.
 */
public final class ScriptParser {

    private final String source;
    private final Scanner scanner;
    private ScannedToken previous;
    private ScannedToken current;
    private ScannedToken peek;

    private ScriptParser(String source) {
        this.source = source;
        this.scanner = Scanner.of(source);
        this.current = scanner.next();
        this.peek = scanner.next();
        this.previous = current;
    }

    /**
     * Parse a complete script.
     */
    public static ParseResult parse(String source) {
        try {
            return new ParseResult.Success(new ScriptParser(source).parseProgram());
        } catch (ParseException e) {
            return new ParseResult.Failure(e.error());
        }
    }

    private Program parseProgram() {
        var statements = new ArrayList<Statement>();
        skipNewlines();
        while (!current.isEndOfInput()) {
            statements.add(parseStatement());
            skipNewlines();
        }
        return new Program(statements);
    }

    // === Statements ===

    private Statement parseStatement() {
        if (!(current.token() instanceof Token.Keyword keyword)) {
            return parseExpressionStatement();
        }
        return switch (keyword) {
            case SET -> parseSet();
            // "Func (" at statement start is an anonymous function used as a value
            case FUNC -> peek.is(LEFT_PAREN) ? parseExpressionStatement() : parseRoutine(false);
            case GENERATOR -> parseRoutine(true);
            case LAZY -> parseLazy();
            case RETURN -> parseReturn();
            case YIELD -> parseYield();
            case BREAK -> parseBreak();
            case CONTINUE -> parseContinue();
            case WHILE -> parseWhile();
            case FOR -> parseFor();
            case SWITCH -> parseSwitch();
            case IMPORT -> parseImport();
            case EXPORT -> parseExport();
            case THROW -> parseThrow();
            case ELIF, ELSE -> throw invalidStatement("'" + keyword.text() + "' without a preceding 'If'");
            case CASE, DEFAULT -> throw invalidStatement("'" + keyword.text() + "' outside of 'Switch'");
            case TRY, CATCH -> throw invalidStatement("'" + keyword.text() + "' blocks are not supported");
            default -> parseExpressionStatement();
        };
    }

    private Statement parseSet() {
        var start = startAndAdvance();
        var name = declarationName();

        // "Set A[0] 5" assigns into a container, "Set A [0]" binds an array
        if (current.is(LEFT_BRACKET) && !current.precededByWhitespace()) {
            advance();
            var index = parseExpression(Precedence.LOWEST);
            expect(RIGHT_BRACKET, "']' for index access");
            var value = parseExpression(Precedence.LOWEST);
            var span = spanFrom(start);
            consumeTerminator();
            var target = new Expression.Identifier(name.span(), name.text());
            return new Statement.SetIndex(span, target, index, value);
        }

        var value = parseExpression(Precedence.LOWEST);
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Set(span, name.text(), name.span(), value);
    }

    private Statement parseRoutine(boolean generator) {
        var start = startAndAdvance();
        var name = declarationName();
        expect(LEFT_PAREN);
        var parameters = parseParameterList();
        expect(RIGHT_PAREN);
        var body = parseBracedBlock();
        var span = spanFrom(start);
        return generator
               ? new Statement.GeneratorDefinition(span, name.text(), name.span(), parameters, body)
               : new Statement.FunctionDefinition(span, name.text(), name.span(), parameters, body);
    }

    private Statement parseLazy() {
        var start = startAndAdvance();
        var name = declarationName();
        expect(LEFT_PAREN);
        var expression = parseExpression(Precedence.LOWEST);
        expect(RIGHT_PAREN);
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.LazyDefinition(span, name.text(), name.span(), expression);
    }

    private Statement parseReturn() {
        var start = startAndAdvance();
        var value = parseOptionalValue();
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Return(span, value);
    }

    private Statement parseYield() {
        var start = startAndAdvance();
        var value = parseOptionalValue();
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Yield(span, value);
    }

    private Expression parseOptionalValue() {
        if (isValueOmitted()) {
            return new Expression.NullLiteral(SourceSpan.at(previous.span().end()));
        }
        return parseExpression(Precedence.LOWEST);
    }

    private boolean isValueOmitted() {
        return current.is(NEWLINE) || current.is(RIGHT_BRACE) || current.is(SEMICOLON) || current.isEndOfInput();
    }

    private Statement parseBreak() {
        var start = startAndAdvance();
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Break(span);
    }

    private Statement parseContinue() {
        var start = startAndAdvance();
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Continue(span);
    }

    private Statement parseWhile() {
        var start = startAndAdvance();
        var condition = parseParenthesized();
        var body = parseBracedBlock();
        return new Statement.While(spanFrom(start), condition, body);
    }

    private Statement parseFor() {
        var start = startAndAdvance();
        var first = binderName();

        if (current.is(COMMA)) {
            advance();
            var second = binderName();
            expect(Token.Keyword.IN);
            var iterable = parseExpression(Precedence.LOWEST);
            var body = parseBracedBlock();
            return new Statement.ForIndexed(spanFrom(start), first.text(), second.text(), iterable, body);
        }

        expect(Token.Keyword.IN);
        var iterable = parseExpression(Precedence.LOWEST);
        var body = parseBracedBlock();
        return new Statement.For(spanFrom(start), first.text(), iterable, body);
    }

    private Statement parseSwitch() {
        var start = startAndAdvance();
        var scrutinee = parseParenthesized();
        skipNewlines();
        expect(LEFT_BRACE);
        skipNewlines();

        var cases = new ArrayList<Statement.SwitchCase>();
        Optional<List<Statement>> defaultBody = Optional.empty();

        while (!current.is(RIGHT_BRACE) && !current.isEndOfInput()) {
            if (current.is(Token.Keyword.CASE)) {
                advance();
                var value = parseExpression(Precedence.LOWEST);
                expect(COLON);
                skipNewlines();
                var body = new ArrayList<Statement>();
                while (!isCaseBoundary()) {
                    body.add(parseStatement());
                    skipNewlines();
                }
                cases.add(new Statement.SwitchCase(value, body));
            } else if (current.is(Token.Keyword.DEFAULT)) {
                advance();
                expect(COLON);
                skipNewlines();
                var body = new ArrayList<Statement>();
                while (!current.is(RIGHT_BRACE) && !current.isEndOfInput()) {
                    body.add(parseStatement());
                    skipNewlines();
                }
                defaultBody = Optional.of(body);
                break;
            } else {
                throw unexpected("'Case', 'Default' or '}'");
            }
        }

        expect(RIGHT_BRACE);
        return new Statement.Switch(spanFrom(start), scrutinee, cases, defaultBody);
    }

    private boolean isCaseBoundary() {
        return current.is(Token.Keyword.CASE)
               || current.is(Token.Keyword.DEFAULT)
               || current.is(RIGHT_BRACE)
               || current.isEndOfInput();
    }

    private Statement parseImport() {
        var start = startAndAdvance();
        var names = new ArrayList<String>();
        var aliases = new ArrayList<Optional<String>>();

        if (current.is(LEFT_BRACE)) {
            advance();
            skipNewlines();
            while (!current.is(RIGHT_BRACE) && !current.isEndOfInput()) {
                parseImportName(names, aliases);
                skipNewlines();
                if (!current.is(COMMA)) {
                    break;
                }
                advance();
                skipNewlines();
            }
            expect(RIGHT_BRACE);
        } else {
            parseImportName(names, aliases);
        }

        expect(Token.Keyword.FROM);
        if (!(current.token() instanceof Token.StringLiteral path)) {
            throw unexpected("string");
        }
        advance();
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Import(span, names, path.value(), aliases);
    }

    private void parseImportName(List<String> names, List<Optional<String>> aliases) {
        names.add(expectIdentifier("identifier").text());
        if (current.is(Token.Keyword.AS)) {
            advance();
            aliases.add(Optional.of(expectIdentifier("alias name").text()));
        } else {
            aliases.add(Optional.empty());
        }
    }

    private Statement parseExport() {
        var start = startAndAdvance();
        var name = expectIdentifier("identifier");
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Export(span, name.text());
    }

    private Statement parseThrow() {
        var start = startAndAdvance();
        var value = parseExpression(Precedence.LOWEST);
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.Throw(span, value);
    }

    private Statement parseExpressionStatement() {
        var start = current.span().start();
        var expression = parseExpression(Precedence.LOWEST);
        var span = spanFrom(start);
        consumeTerminator();
        return new Statement.ExpressionStatement(span, expression);
    }

    private List<Statement> parseBracedBlock() {
        skipNewlines();
        expect(LEFT_BRACE);
        var body = parseBlock();
        expect(RIGHT_BRACE);
        return body;
    }

    private List<Statement> parseBlock() {
        var statements = new ArrayList<Statement>();
        skipNewlines();
        while (!current.is(RIGHT_BRACE) && !current.isEndOfInput()) {
            statements.add(parseStatement());
            skipNewlines();
        }
        return statements;
    }

    private List<String> parseParameterList() {
        var parameters = new ArrayList<String>();
        while (current.token() instanceof Token.Identifier) {
            parameters.add(binderName().text());
            if (!current.is(COMMA)) {
                break;
            }
            advance();
        }
        return parameters;
    }

    // === Expressions ===

    private Expression parseExpression(Precedence minimum) {
        var left = parsePrefix();
        while (minimum.isWeakerThan(Precedence.of(current.token()))) {
            left = parseInfix(left);
        }
        return left;
    }

    private Expression parsePrefix() {
        var token = current.token();
        var span = current.span();

        if (token instanceof Token.NumberLiteral number) {
            advance();
            return new Expression.NumberLiteral(span, number.value());
        }
        if (token instanceof Token.BigIntegerLiteral bigInteger) {
            advance();
            return new Expression.BigIntegerLiteral(span, bigInteger.digits());
        }
        if (token instanceof Token.StringLiteral string) {
            advance();
            return new Expression.StringLiteral(span, string.value());
        }
        if (token instanceof Token.BooleanLiteral bool) {
            advance();
            return new Expression.BooleanLiteral(span, bool.value());
        }
        if (token instanceof Token.NullLiteral) {
            advance();
            return new Expression.NullLiteral(span);
        }
        if (token instanceof Token.Identifier identifier) {
            advance();
            return new Expression.Identifier(span, identifier.name());
        }
        if (token instanceof Token.Illegal illegal) {
            throw illegalToken(illegal);
        }
        if (token instanceof Token.EndOfInput) {
            throw unexpected("expression");
        }
        if (token == Token.Keyword.FORCE) {
            // Force(X) is an ordinary call of the built-in forcing function
            advance();
            return new Expression.Identifier(span, Token.Keyword.FORCE.text());
        }
        if (token == LEFT_PAREN) {
            return parseParenthesized();
        }
        if (token == LEFT_BRACKET) {
            return parseArray();
        }
        if (token == LEFT_BRACE) {
            return parseDict();
        }
        if (token == Token.Operator.MINUS) {
            return parseUnary(UnaryOperator.NEGATE);
        }
        if (token == Token.Operator.NOT) {
            return parseUnary(UnaryOperator.NOT);
        }
        if (token == Token.Keyword.IF) {
            return parseConditional();
        }
        if (token == Token.Keyword.FUNC) {
            return parseBlockLambda();
        }
        if (token == Token.Keyword.LAMBDA) {
            return parseArrowLambda();
        }
        throw new ParseException(new ParseError.InvalidExpression(
            span, "Unexpected token in expression: " + token.describe()));
    }

    private Expression parseInfix(Expression left) {
        var token = current.token();
        if (token == LEFT_PAREN) {
            return parseCall(left);
        }
        if (token == LEFT_BRACKET) {
            return parseIndex(left);
        }
        var operator = binaryOperator((Token.Operator) token);
        var precedence = Precedence.of(token);
        advance();
        // same precedence on the right keeps equal-precedence chains left-associative
        var right = parseExpression(precedence);
        return new Expression.Binary(spanFrom(left.span().start()), left, operator, right);
    }

    private static BinaryOperator binaryOperator(Token.Operator operator) {
        return switch (operator) {
            case PLUS -> BinaryOperator.ADD;
            case MINUS -> BinaryOperator.SUBTRACT;
            case MULTIPLY -> BinaryOperator.MULTIPLY;
            case DIVIDE -> BinaryOperator.DIVIDE;
            case MODULO -> BinaryOperator.MODULO;
            case EQUAL -> BinaryOperator.EQUAL;
            case NOT_EQUAL -> BinaryOperator.NOT_EQUAL;
            case LESS -> BinaryOperator.LESS;
            case LESS_EQUAL -> BinaryOperator.LESS_EQUAL;
            case GREATER -> BinaryOperator.GREATER;
            case GREATER_EQUAL -> BinaryOperator.GREATER_EQUAL;
            case AND -> BinaryOperator.AND;
            case OR -> BinaryOperator.OR;
            default -> throw new IllegalStateException("Not an infix operator: " + operator);
        };
    }

    private Expression parseUnary(UnaryOperator operator) {
        var start = startAndAdvance();
        var operand = parseExpression(Precedence.PREFIX);
        return new Expression.Unary(spanFrom(start), operator, operand);
    }

    private Expression parseParenthesized() {
        expect(LEFT_PAREN);
        var expression = parseExpression(Precedence.LOWEST);
        expect(RIGHT_PAREN);
        return expression;
    }

    private Expression parseArray() {
        var start = startAndAdvance();
        skipNewlines();
        var elements = new ArrayList<Expression>();
        while (!current.is(RIGHT_BRACKET) && !current.isEndOfInput()) {
            elements.add(parseExpression(Precedence.LOWEST));
            skipNewlines();
            if (current.is(COMMA)) {
                advance();
                skipNewlines();
            } else if (current.is(RIGHT_BRACKET)) {
                break;
            }
        }
        expect(RIGHT_BRACKET);
        return new Expression.ArrayLiteral(spanFrom(start), elements);
    }

    private Expression parseDict() {
        var start = startAndAdvance();
        skipNewlines();
        var entries = new ArrayList<Expression.DictEntry>();
        while (!current.is(RIGHT_BRACE) && !current.isEndOfInput()) {
            var key = dictKey();
            advance();
            expect(COLON);
            var value = parseExpression(Precedence.LOWEST);
            entries.add(new Expression.DictEntry(key, value));
            skipNewlines();
            if (current.is(COMMA)) {
                advance();
                skipNewlines();
            } else if (current.is(RIGHT_BRACE)) {
                break;
            }
        }
        expect(RIGHT_BRACE);
        return new Expression.DictLiteral(spanFrom(start), entries);
    }

    private String dictKey() {
        if (current.token() instanceof Token.Identifier identifier) {
            return identifier.name();
        }
        if (current.token() instanceof Token.StringLiteral string) {
            return string.value();
        }
        throw unexpected("identifier or string");
    }

    private Expression parseCall(Expression callee) {
        advance();
        skipNewlines();
        var arguments = new ArrayList<Expression>();
        while (!current.is(RIGHT_PAREN) && !current.isEndOfInput()) {
            arguments.add(parseExpression(Precedence.LOWEST));
            skipNewlines();
            if (!current.is(COMMA)) {
                break;
            }
            advance();
            skipNewlines();
        }
        expect(RIGHT_PAREN);
        return new Expression.Call(spanFrom(callee.span().start()), callee, arguments);
    }

    private Expression parseIndex(Expression target) {
        advance();
        var index = parseExpression(Precedence.LOWEST);
        expect(RIGHT_BRACKET, "']' for index access");
        return new Expression.Index(spanFrom(target.span().start()), target, index);
    }

    private Expression parseConditional() {
        var start = startAndAdvance();
        var condition = parseParenthesized();
        var thenBranch = parseBracedBlock();
        var end = previous.span().end();
        skipNewlines();

        var elifBranches = new ArrayList<Expression.ElifBranch>();
        while (current.is(Token.Keyword.ELIF)) {
            advance();
            var elifCondition = parseParenthesized();
            var body = parseBracedBlock();
            end = previous.span().end();
            elifBranches.add(new Expression.ElifBranch(elifCondition, body));
            skipNewlines();
        }

        Optional<List<Statement>> elseBranch = Optional.empty();
        if (current.is(Token.Keyword.ELSE)) {
            advance();
            elseBranch = Optional.of(parseBracedBlock());
            end = previous.span().end();
        }

        return new Expression.Conditional(SourceSpan.of(start, end), condition, thenBranch, elifBranches, elseBranch);
    }

    private Expression parseBlockLambda() {
        var start = startAndAdvance();
        expect(LEFT_PAREN);
        var parameters = parseParameterList();
        expect(RIGHT_PAREN);
        var body = parseBracedBlock();
        return new Expression.Lambda(spanFrom(start), parameters, body);
    }

    private Expression parseArrowLambda() {
        var start = startAndAdvance();
        List<String> parameters;
        if (current.is(LEFT_PAREN)) {
            advance();
            parameters = parseParameterList();
            expect(RIGHT_PAREN);
        } else if (current.token() instanceof Token.Identifier) {
            parameters = List.of(binderName().text());
        } else {
            throw unexpected("identifier or '('");
        }
        expect(Token.Operator.ARROW);
        var expression = parseExpression(Precedence.LOWEST);
        var body = List.<Statement>of(new Statement.Return(expression.span(), expression));
        return new Expression.Lambda(spanFrom(start), parameters, body);
    }

    // === Names ===

    private record Name(String text, SourceSpan span) {}

    private Name declarationName() {
        var name = expectIdentifier("identifier");
        var violation = NamingRules.declarationViolation(name.text());
        if (violation.isPresent()) {
            throw new ParseException(new ParseError.InvalidIdentifier(name.span(), name.text(), violation.get()));
        }
        return name;
    }

    private Name binderName() {
        var name = expectIdentifier("identifier");
        var violation = NamingRules.binderViolation(name.text());
        if (violation.isPresent()) {
            throw new ParseException(new ParseError.InvalidIdentifier(name.span(), name.text(), violation.get()));
        }
        return name;
    }

    private Name expectIdentifier(String description) {
        if (current.token() instanceof Token.Identifier identifier) {
            var name = new Name(identifier.name(), current.span());
            advance();
            return name;
        }
        throw unexpected(description);
    }

    // === Token window ===

    private void advance() {
        previous = current;
        current = peek;
        peek = scanner.next();
    }

    private SourceLocation startAndAdvance() {
        var start = current.span().start();
        advance();
        return start;
    }

    private void expect(Token expected) {
        expect(expected, expected.describe());
    }

    private void expect(Token expected, String description) {
        if (!current.is(expected)) {
            throw unexpected(description);
        }
        advance();
    }

    private void skipNewlines() {
        while (current.is(NEWLINE)) {
            advance();
        }
    }

    private void consumeTerminator() {
        if (current.is(NEWLINE) || current.is(SEMICOLON)) {
            advance();
        }
    }

    private SourceSpan spanFrom(SourceLocation start) {
        return SourceSpan.of(start, previous.span().end());
    }

    private ParseException unexpected(String expected) {
        if (current.isEndOfInput()) {
            return new ParseException(new ParseError.UnexpectedEndOfInput(current.span(), expected));
        }
        if (current.token() instanceof Token.Illegal illegal) {
            return illegalToken(illegal);
        }
        return new ParseException(new ParseError.UnexpectedToken(current.span(), expected, current.token().describe()));
    }

    private ParseException illegalToken(Token.Illegal illegal) {
        var span = current.span();
        if (Character.isDigit(illegal.codePoint())) {
            return new ParseException(new ParseError.InvalidNumber(span, span.extract(source)));
        }
        if (illegal.codePoint() == '"') {
            return new ParseException(new ParseError.InvalidExpression(span, "Unterminated string literal"));
        }
        return new ParseException(new ParseError.InvalidExpression(span, "Illegal character '" + illegal.text() + "'"));
    }

    private ParseException invalidStatement(String reason) {
        return new ParseException(new ParseError.InvalidStatement(current.span(), reason));
    }
}
