package org.pragmatica.aether.syntax;

/**
 * Binding power of infix and postfix tokens, weakest first.
 */
enum Precedence {
    LOWEST,
    OR,          // ||
    AND,         // &&
    EQUALS,      // == !=
    COMPARISON,  // < <= > >=
    SUM,         // + -
    PRODUCT,     // * / %
    PREFIX,      // -x !x
    CALL,        // f(x)
    INDEX;       // a[i]

    static Precedence of(Token token) {
        if (token instanceof Token.Operator operator) {
            return switch (operator) {
                case OR -> OR;
                case AND -> AND;
                case EQUAL, NOT_EQUAL -> EQUALS;
                case LESS, LESS_EQUAL, GREATER, GREATER_EQUAL -> COMPARISON;
                case PLUS, MINUS -> SUM;
                case MULTIPLY, DIVIDE, MODULO -> PRODUCT;
                default -> LOWEST;
            };
        }
        if (token == Token.Delimiter.LEFT_PAREN) {
            return CALL;
        }
        if (token == Token.Delimiter.LEFT_BRACKET) {
            return INDEX;
        }
        return LOWEST;
    }

    boolean isWeakerThan(Precedence other) {
        return compareTo(other) < 0;
    }
}
