package org.pragmatica.aether.builtins;

import org.junit.jupiter.api.Test;
import org.pragmatica.aether.builtins.BuiltinFunction.Category;
import org.pragmatica.aether.syntax.ScriptParser;

import static org.assertj.core.api.Assertions.assertThat;

class BuiltinCatalogTest {

    @Test
    void all_containsEveryBuiltinOnce() {
        assertThat(BuiltinCatalog.all()).hasSize(53);
        assertThat(BuiltinCatalog.all()).extracting(BuiltinFunction::name).doesNotHaveDuplicates();
    }

    @Test
    void find_isCaseSensitive() {
        assertThat(BuiltinCatalog.find("JOIN")).isPresent();
        assertThat(BuiltinCatalog.find("join")).isEmpty();
        assertThat(BuiltinCatalog.find("MISSING")).isEmpty();
    }

    @Test
    void byCategory_keepsCatalogOrder() {
        assertThat(BuiltinCatalog.byCategory(Category.JSON))
            .extracting(BuiltinFunction::name)
            .containsExactly("JSONPARSE", "JSONSTRINGIFY");
        assertThat(BuiltinCatalog.byCategory(Category.IO))
            .extracting(BuiltinFunction::name)
            .containsExactly("PRINTLN", "PRINT", "INPUT");
    }

    @Test
    void detail_combinesSignatureAndCategory() {
        var join = BuiltinCatalog.find("JOIN").orElseThrow();

        assertThat(join.detail()).isEqualTo("JOIN(array, separator) - Array");
        assertThat(join.toMarkdown())
            .startsWith("**JOIN(array, separator)**")
            .contains("**Category**: Array")
            .endsWith("```");
    }

    @Test
    void examples_areValidScripts() {
        for (var function : BuiltinCatalog.all()) {
            assertThat(function.examples()).isNotEmpty();
            for (var example : function.examples()) {
                assertThat(ScriptParser.parse(example).isSuccess())
                    .as("example of %s: %s", function.name(), example)
                    .isTrue();
            }
        }
    }

    @Test
    void keywordCatalog_findsByExactSpelling() {
        assertThat(KeywordCatalog.all()).hasSize(27);
        assertThat(KeywordCatalog.find("Lambda")).map(KeywordCatalog.KeywordInfo::example).contains("Lambda X -> expr");
        assertThat(KeywordCatalog.find("lambda")).isEmpty();
        assertThat(KeywordCatalog.find("Set").orElseThrow().toMarkdown())
            .isEqualTo("**Set**\n\nVariable assignment\n\n```aether\nSet NAME value\n```");
    }
}
