package org.pragmatica.aether.syntax;

import com.google.common.collect.ImmutableList;
import org.pragmatica.aether.tree.SourceLocation;
import org.pragmatica.aether.tree.SourceSpan;

import java.util.List;

import static com.google.common.base.Preconditions.checkNotNull;

/**
 * On-demand scanner for Aether source text.
 *
 * <p>Works over Unicode code points. Spaces, tabs, carriage returns and comments are skipped;
 * the preceded-by-whitespace flag of the following token records only whitespace after the
 * last skipped comment. Newlines are tokens.
 * After {@link #next()} the position queries describe the token just returned.
 */
public final class Scanner {
    private static final int DEFAULT_TOKEN_CAPACITY = 32;
    private static final int MAX_EXACT_DIGITS = 15;

    private final String input;
    private final int[] codePoints;
    private final int[] offsets;
    private int pos;
    private int line;
    private int column;
    private ScannedToken last;

    private Scanner(String input) {
        this.input = input;
        this.codePoints = input.codePoints()
                               .toArray();
        this.offsets = new int[codePoints.length + 1];
        int offset = 0;
        for (int i = 0; i < codePoints.length; i++) {
            offsets[i] = offset;
            offset += Character.charCount(codePoints[i]);
        }
        offsets[codePoints.length] = offset;
        reset();
    }

    public static Scanner of(String input) {
        checkNotNull(input, "input");
        return new Scanner(input);
    }

    /**
     * Scan the whole input. The returned list always ends with an end-of-input token.
     */
    public static List<ScannedToken> tokenize(String input) {
        var scanner = of(input);
        var tokens = ImmutableList.<ScannedToken>builder();
        ScannedToken token;
        do {
            token = scanner.next();
            tokens.add(token);
        } while (!token.isEndOfInput());
        return tokens.build();
    }

    /**
     * Rewind to the beginning of the input.
     */
    public void reset() {
        pos = 0;
        line = 1;
        column = 1;
        last = null;
    }

    /**
     * Scan the next token. Once the input is exhausted every call returns end-of-input.
     */
    public ScannedToken next() {
        boolean whitespace = skipWhitespaceAndComments();
        var start = currentLocation();
        var token = isAtEnd()
                    ? Token.END_OF_INPUT
                    : nextToken();
        last = new ScannedToken(token, span(start), whitespace);
        return last;
    }

    public String input() {
        return input;
    }

    /**
     * Line of the token returned last (1-based).
     */
    public int line() {
        return last == null ? line : last.line();
    }

    /**
     * Column of the token returned last (1-based).
     */
    public int column() {
        return last == null ? column : last.column();
    }

    public boolean precededByWhitespace() {
        return last != null && last.precededByWhitespace();
    }

    private Token nextToken() {
        int begin = pos;
        int c = advance();
        return switch (c) {
            case '+' -> Token.Operator.PLUS;
            case '-' -> match('>') ? Token.Operator.ARROW : Token.Operator.MINUS;
            case '*' -> Token.Operator.MULTIPLY;
            case '/' -> Token.Operator.DIVIDE;
            case '%' -> Token.Operator.MODULO;
            case '=' -> match('=') ? Token.Operator.EQUAL : Token.Operator.ASSIGN;
            case '!' -> match('=') ? Token.Operator.NOT_EQUAL : Token.Operator.NOT;
            case '<' -> match('=') ? Token.Operator.LESS_EQUAL : Token.Operator.LESS;
            case '>' -> match('=') ? Token.Operator.GREATER_EQUAL : Token.Operator.GREATER;
            // no bitwise operators: a lone '&' or '|' is illegal
            case '&' -> match('&') ? Token.Operator.AND : new Token.Illegal('&');
            case '|' -> match('|') ? Token.Operator.OR : new Token.Illegal('|');
            case '(' -> Token.Delimiter.LEFT_PAREN;
            case ')' -> Token.Delimiter.RIGHT_PAREN;
            case '[' -> Token.Delimiter.LEFT_BRACKET;
            case ']' -> Token.Delimiter.RIGHT_BRACKET;
            case '{' -> Token.Delimiter.LEFT_BRACE;
            case '}' -> Token.Delimiter.RIGHT_BRACE;
            case ',' -> Token.Delimiter.COMMA;
            case ':' -> Token.Delimiter.COLON;
            case ';' -> Token.Delimiter.SEMICOLON;
            case '\n' -> Token.Delimiter.NEWLINE;
            case '"' -> scanString();
            default -> {
                if (isIdentifierStart(c)) {
                    yield scanIdentifier(begin);
                }
                if (Character.isDigit(c)) {
                    yield scanNumber(begin);
                }
                yield new Token.Illegal(c);
            }
        };
    }

    private Token scanIdentifier(int begin) {
        while (!isAtEnd() && isIdentifierPart(peek())) {
            advance();
        }
        return Token.lookupKeyword(text(begin, pos));
    }

    private Token scanNumber(int begin) {
        boolean hasDot = false;
        while (!isAtEnd()) {
            int c = peek();
            if (Character.isDigit(c)) {
                advance();
            } else if (c == '.' && !hasDot && Character.isDigit(peekAt(1))) {
                hasDot = true;
                advance();
            } else {
                break;
            }
        }
        var digits = text(begin, pos);
        // beyond 15 digits a double no longer holds every integer exactly
        if (!hasDot && digits.length() > MAX_EXACT_DIGITS) {
            return new Token.BigIntegerLiteral(digits);
        }
        try {
            return new Token.NumberLiteral(Double.parseDouble(digits));
        } catch (NumberFormatException e) {
            return new Token.Illegal(codePoints[begin]);
        }
    }

    private Token scanString() {
        if (!isAtEnd() && peek() == '"' && peekAt(1) == '"') {
            advance();
            advance();
            return scanTripleQuotedString();
        }
        int bodyStart = pos;
        while (!isAtEnd() && peek() != '"') {
            if (peek() == '\\') {
                advance();
                if (!isAtEnd()) {
                    advance();
                }
            } else {
                advance();
            }
        }
        if (isAtEnd()) {
            return new Token.Illegal('"');
        }
        var body = text(bodyStart, pos);
        advance();
        return new Token.StringLiteral(unescape(body));
    }

    private Token scanTripleQuotedString() {
        int bodyStart = pos;
        while (!isAtEnd()) {
            if (peek() == '"' && peekAt(1) == '"' && peekAt(2) == '"') {
                var body = text(bodyStart, pos);
                advance();
                advance();
                advance();
                return new Token.StringLiteral(unescape(body));
            }
            advance();
        }
        return new Token.Illegal('"');
    }

    static String unescape(String raw) {
        var sb = new StringBuilder(Math.max(DEFAULT_TOKEN_CAPACITY, raw.length()));
        int i = 0;
        while (i < raw.length()) {
            int c = raw.codePointAt(i);
            i += Character.charCount(c);
            if (c != '\\') {
                sb.appendCodePoint(c);
                continue;
            }
            if (i >= raw.length()) {
                sb.append('\\');
                break;
            }
            int escaped = raw.codePointAt(i);
            i += Character.charCount(escaped);
            switch (escaped) {
                case 'n' -> sb.append('\n');
                case 't' -> sb.append('\t');
                case 'r' -> sb.append('\r');
                case '\\' -> sb.append('\\');
                case '"' -> sb.append('"');
                default -> sb.append('\\')
                             .appendCodePoint(escaped);
            }
        }
        return sb.toString();
    }

    private boolean skipWhitespaceAndComments() {
        boolean skipped = false;
        while (!isAtEnd()) {
            int c = peek();
            if (c == ' ' || c == '\t' || c == '\r') {
                advance();
                skipped = true;
            } else if (c == '/' && peekAt(1) == '/') {
                skipLineComment();
                skipped = false;
            } else if (c == '/' && peekAt(1) == '*') {
                skipBlockComment();
                // only whitespace after the last comment counts
                skipped = false;
            } else {
                break;
            }
        }
        return skipped;
    }

    private void skipLineComment() {
        // the terminating newline stays in the input and becomes a token
        while (!isAtEnd() && peek() != '\n') {
            advance();
        }
    }

    private void skipBlockComment() {
        advance();
        advance();
        while (!isAtEnd() && !(peek() == '*' && peekAt(1) == '/')) {
            advance();
        }
        if (!isAtEnd()) {
            advance();
            advance();
        }
    }

    private boolean match(int expected) {
        if (!isAtEnd() && peek() == expected) {
            advance();
            return true;
        }
        return false;
    }

    private boolean isAtEnd() {
        return pos >= codePoints.length;
    }

    private int peek() {
        return codePoints[pos];
    }

    private int peekAt(int distance) {
        int index = pos + distance;
        return index < codePoints.length ? codePoints[index] : -1;
    }

    private int advance() {
        int c = codePoints[pos++];
        if (c == '\n') {
            line++;
            column = 1;
        } else {
            column++;
        }
        return c;
    }

    private String text(int from, int to) {
        return input.substring(offsets[from], offsets[to]);
    }

    private SourceLocation currentLocation() {
        return SourceLocation.at(line, column, offsets[pos]);
    }

    private SourceSpan span(SourceLocation start) {
        return SourceSpan.of(start, currentLocation());
    }

    private static boolean isIdentifierStart(int c) {
        return Character.isLetter(c) || c == '_';
    }

    private static boolean isIdentifierPart(int c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }
}
