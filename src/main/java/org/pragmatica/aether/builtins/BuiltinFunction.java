package org.pragmatica.aether.builtins;

import com.google.common.collect.ImmutableList;

import java.util.List;

/**
 * Documentation of one built-in function.
 *
 * @param name        Upper case function name
 * @param signature   Call shape, e.g. {@code JOIN(array, separator)}
 * @param description One-line description
 * @param category    Functional group
 * @param examples    Aether snippets using the function
 */
public record BuiltinFunction(String name, String signature, String description, Category category, List<String> examples) {

    public BuiltinFunction {
        examples = ImmutableList.copyOf(examples);
    }

    public enum Category {
        IO("IO"),
        ARRAY("Array"),
        STRING("String"),
        MATH("Math"),
        TYPE("Type"),
        DICT("Dict"),
        JSON("JSON"),
        DATE_TIME("DateTime");

        private final String display;

        Category(String display) {
            this.display = display;
        }

        public String display() {
            return display;
        }
    }

    /**
     * Short detail line for completion lists: {@code SIGNATURE - Category}.
     */
    public String detail() {
        return signature + " - " + category.display();
    }

    /**
     * Markdown hover text with description, category and examples.
     */
    public String toMarkdown() {
        return "**" + signature + "**\n\n"
               + description + "\n\n"
               + "**Category**: " + category.display() + "\n\n"
               + "**Examples**:\n```aether\n" + String.join("\n", examples) + "\n```";
    }
}
