package org.pragmatica.aether.syntax;

import org.pragmatica.aether.ast.Program;
import org.pragmatica.aether.error.ParseError;

import java.util.Optional;

/**
 * Outcome of a whole-program parse: a complete program or exactly one error, never both.
 */
public sealed interface ParseResult {

    boolean isSuccess();

    default boolean isFailure() {
        return !isSuccess();
    }

    /**
     * The parsed program, or {@link Program#EMPTY} when parsing failed.
     */
    Program programOrEmpty();

    Optional<ParseError> errorOpt();

    record Success(Program program) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return true;
        }

        @Override
        public Program programOrEmpty() {
            return program;
        }

        @Override
        public Optional<ParseError> errorOpt() {
            return Optional.empty();
        }
    }

    record Failure(ParseError error) implements ParseResult {
        @Override
        public boolean isSuccess() {
            return false;
        }

        @Override
        public Program programOrEmpty() {
            return Program.EMPTY;
        }

        @Override
        public Optional<ParseError> errorOpt() {
            return Optional.of(error);
        }
    }
}
