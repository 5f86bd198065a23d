package org.pragmatica.aether.builtins;

import com.google.common.collect.ImmutableList;

import java.util.List;
import java.util.Optional;

/**
 * Keywords and literal words of the language with a short description and a usage example.
 */
public final class KeywordCatalog {

    public record KeywordInfo(String keyword, String description, String example) {
        public String toMarkdown() {
            return "**" + keyword + "**\n\n" + description + "\n\n```aether\n" + example + "\n```";
        }
    }

    private static final List<KeywordInfo> KEYWORDS = ImmutableList.of(
        new KeywordInfo("Set", "Variable assignment", "Set NAME value"),
        new KeywordInfo("Func", "Function definition", "Func NAME(params) { ... }"),
        new KeywordInfo("Return", "Return a value", "Return value"),
        new KeywordInfo("If", "Conditional", "If (condition) { ... }"),
        new KeywordInfo("Elif", "Further condition", "Elif (condition) { ... }"),
        new KeywordInfo("Else", "Fallback branch", "Else { ... }"),
        new KeywordInfo("While", "Loop while a condition holds", "While (condition) { ... }"),
        new KeywordInfo("For", "Iterate over a collection", "For VAR In collection { ... }"),
        new KeywordInfo("In", "Loop source", "For X In [1, 2, 3] { ... }"),
        new KeywordInfo("Break", "Leave the loop", "Break"),
        new KeywordInfo("Continue", "Next loop iteration", "Continue"),
        new KeywordInfo("Generator", "Generator definition", "Generator NAME(params) { ... }"),
        new KeywordInfo("Yield", "Produce a value", "Yield value"),
        new KeywordInfo("Lazy", "Lazily evaluated binding", "Lazy NAME(expr)"),
        new KeywordInfo("Force", "Force a lazy value", "Force(lazy_value)"),
        new KeywordInfo("Switch", "Multi-way branch", "Switch (value) { Case x: ... }"),
        new KeywordInfo("Case", "Switch branch", "Case value: statements"),
        new KeywordInfo("Default", "Switch fallback", "Default: statements"),
        new KeywordInfo("Import", "Import from a module", "Import {NAME} From \"path\""),
        new KeywordInfo("Export", "Export a name", "Export NAME"),
        new KeywordInfo("From", "Import source", "Import X From \"path\""),
        new KeywordInfo("As", "Import alias", "Import X As Y From \"path\""),
        new KeywordInfo("Lambda", "Anonymous function", "Lambda X -> expr"),
        new KeywordInfo("Throw", "Raise an error", "Throw \"message\""),
        new KeywordInfo("True", "Boolean true", "True"),
        new KeywordInfo("False", "Boolean false", "False"),
        new KeywordInfo("Null", "Absent value", "Null"));

    private KeywordCatalog() {}

    public static List<KeywordInfo> all() {
        return KEYWORDS;
    }

    public static Optional<KeywordInfo> find(String keyword) {
        return KEYWORDS.stream()
                       .filter(info -> info.keyword().equals(keyword))
                       .findFirst();
    }
}
