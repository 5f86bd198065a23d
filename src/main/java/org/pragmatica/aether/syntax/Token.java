package org.pragmatica.aether.syntax;

import com.google.common.collect.ImmutableMap;

import java.util.Optional;

/**
 * Lexical categories of the Aether language.
 *
 * <p>Keywords, operators and delimiters carry no payload and are enum constants; literals,
 * identifiers and the illegal-character marker are records. Equality is structural.
 */
public sealed interface Token {

    Token NULL = new NullLiteral();
    Token END_OF_INPUT = new EndOfInput();

    /**
     * Human-readable form used in error messages.
     */
    String describe();

    enum Keyword implements Token {
        SET("Set"),
        FUNC("Func"),
        RETURN("Return"),
        IF("If"),
        ELIF("Elif"),
        ELSE("Else"),
        WHILE("While"),
        FOR("For"),
        IN("In"),
        BREAK("Break"),
        CONTINUE("Continue"),
        GENERATOR("Generator"),
        YIELD("Yield"),
        LAZY("Lazy"),
        FORCE("Force"),
        SWITCH("Switch"),
        CASE("Case"),
        DEFAULT("Default"),
        IMPORT("Import"),
        EXPORT("Export"),
        FROM("From"),
        AS("As"),
        LAMBDA("Lambda"),
        THROW("Throw"),
        TRY("Try"),
        CATCH("Catch");

        private final String text;

        Keyword(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }

        @Override
        public String describe() {
            return "keyword '" + text + "'";
        }
    }

    enum Operator implements Token {
        PLUS("+"),
        MINUS("-"),
        MULTIPLY("*"),
        DIVIDE("/"),
        MODULO("%"),
        ASSIGN("="),
        EQUAL("=="),
        NOT_EQUAL("!="),
        GREATER(">"),
        GREATER_EQUAL(">="),
        LESS("<"),
        LESS_EQUAL("<="),
        AND("&&"),
        OR("||"),
        NOT("!"),
        ARROW("->");

        private final String text;

        Operator(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }

        @Override
        public String describe() {
            return "'" + text + "'";
        }
    }

    enum Delimiter implements Token {
        LEFT_PAREN("("),
        RIGHT_PAREN(")"),
        LEFT_BRACKET("["),
        RIGHT_BRACKET("]"),
        LEFT_BRACE("{"),
        RIGHT_BRACE("}"),
        COMMA(","),
        COLON(":"),
        SEMICOLON(";"),
        NEWLINE("\n");

        private final String text;

        Delimiter(String text) {
            this.text = text;
        }

        public String text() {
            return text;
        }

        @Override
        public String describe() {
            return this == NEWLINE ? "newline" : "'" + text + "'";
        }
    }

    // Literals
    record NumberLiteral(double value) implements Token {
        @Override
        public String describe() {
            return "number " + value;
        }
    }

    record BigIntegerLiteral(String digits) implements Token {
        @Override
        public String describe() {
            return "number " + digits;
        }
    }

    record StringLiteral(String value) implements Token {
        @Override
        public String describe() {
            return "string \"" + value + "\"";
        }
    }

    record BooleanLiteral(boolean value) implements Token {
        @Override
        public String describe() {
            return value ? "'True'" : "'False'";
        }
    }

    record NullLiteral() implements Token {
        @Override
        public String describe() {
            return "'Null'";
        }
    }

    record Identifier(String name) implements Token {
        @Override
        public String describe() {
            return "identifier '" + name + "'";
        }
    }

    // Special
    record EndOfInput() implements Token {
        @Override
        public String describe() {
            return "end of input";
        }
    }

    record Illegal(int codePoint) implements Token {
        public String text() {
            return Character.toString(codePoint);
        }

        @Override
        public String describe() {
            return "illegal character '" + text() + "'";
        }
    }

    /**
     * Resolve identifier text to a keyword or literal token, or an {@link Identifier}.
     * Lookup is case-sensitive.
     */
    static Token lookupKeyword(String text) {
        return Optional.ofNullable(Keywords.TABLE.get(text))
                       .orElseGet(() -> new Identifier(text));
    }

    static boolean isKeyword(String text) {
        return Keywords.TABLE.containsKey(text);
    }

    final class Keywords {
        static final ImmutableMap<String, Token> TABLE = buildTable();

        private Keywords() {}

        private static ImmutableMap<String, Token> buildTable() {
            var builder = ImmutableMap.<String, Token>builder();
            for (var keyword : Keyword.values()) {
                builder.put(keyword.text(), keyword);
            }
            builder.put("True", new BooleanLiteral(true));
            builder.put("False", new BooleanLiteral(false));
            builder.put("Null", NULL);
            return builder.build();
        }
    }
}
