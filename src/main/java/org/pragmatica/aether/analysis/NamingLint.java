package org.pragmatica.aether.analysis;

import com.google.common.collect.ImmutableList;
import org.pragmatica.aether.error.Diagnostic;
import org.pragmatica.aether.syntax.NamingRules;
import org.pragmatica.aether.syntax.Scanner;
import org.pragmatica.aether.syntax.Token;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Warns about declared names that are not ASCII UPPER_SNAKE_CASE.
 *
 * <p>Runs its own scan of the text, independent of the parser: any identifier directly after
 * {@code Set}, {@code Func}, {@code Generator} or {@code Lazy} is checked.
 */
final class NamingLint {
    static final String CODE = "W001";

    private static final Set<Token.Keyword> DECLARING = EnumSet.of(
        Token.Keyword.SET, Token.Keyword.FUNC, Token.Keyword.GENERATOR, Token.Keyword.LAZY);

    private NamingLint() {}

    static List<Diagnostic> check(String text) {
        var warnings = ImmutableList.<Diagnostic>builder();
        Token previous = Token.END_OF_INPUT;

        for (var scanned : Scanner.tokenize(text)) {
            if (scanned.token() instanceof Token.Identifier identifier
                && isDeclaring(previous)
                && !NamingRules.isUpperSnakeCase(identifier.name())) {
                var name = identifier.name();
                var message = "Variable name '" + name + "' should use UPPER_SNAKE_CASE";
                warnings.add(Diagnostic.lintWarning(CODE, message, scanned.span().toEditorRange())
                                       .withHelp("rename to " + NamingRules.suggestUpperSnakeCase(name)));
            }
            previous = scanned.token();
        }
        return warnings.build();
    }

    private static boolean isDeclaring(Token token) {
        return token instanceof Token.Keyword keyword && DECLARING.contains(keyword);
    }
}
