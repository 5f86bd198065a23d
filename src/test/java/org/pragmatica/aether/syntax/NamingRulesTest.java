package org.pragmatica.aether.syntax;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class NamingRulesTest {

    @Test
    void declarationViolation_upperSnakeCase_isValid() {
        assertThat(NamingRules.declarationViolation("MY_VAR")).isEmpty();
        assertThat(NamingRules.declarationViolation("_PRIVATE2")).isEmpty();
        assertThat(NamingRules.declarationViolation("ÄPFEL")).isEmpty();
    }

    @Test
    void declarationViolation_lowerOrMixedCase_isRejected() {
        assertThat(NamingRules.declarationViolation("myVar")).contains(NamingRules.DECLARATION_REASON);
        assertThat(NamingRules.declarationViolation("My_Var")).contains(NamingRules.DECLARATION_REASON);
    }

    @Test
    void declarationViolation_leadingDigit_isRejected() {
        assertThat(NamingRules.declarationViolation("1ST")).contains(NamingRules.DIGIT_START_REASON);
    }

    @Test
    void binderViolation_anyCase_isValid() {
        assertThat(NamingRules.binderViolation("value")).isEmpty();
        assertThat(NamingRules.binderViolation("camelCase_2")).isEmpty();
    }

    @Test
    void binderViolation_leadingDigit_isRejected() {
        assertThat(NamingRules.binderViolation("2x")).contains(NamingRules.DIGIT_START_REASON);
    }

    @Test
    void isUpperSnakeCase_asciiOnly() {
        assertThat(NamingRules.isUpperSnakeCase("MAX_RETRIES")).isTrue();
        assertThat(NamingRules.isUpperSnakeCase("ÄPFEL")).isFalse();
        assertThat(NamingRules.isUpperSnakeCase("9LIVES")).isFalse();
        assertThat(NamingRules.isUpperSnakeCase("")).isFalse();
    }

    @Test
    void suggestUpperSnakeCase_splitsCamelCase() {
        assertThat(NamingRules.suggestUpperSnakeCase("myVar")).isEqualTo("MY_VAR");
        assertThat(NamingRules.suggestUpperSnakeCase("count")).isEqualTo("COUNT");
        assertThat(NamingRules.suggestUpperSnakeCase("parseHttp2Response")).isEqualTo("PARSE_HTTP2_RESPONSE");
        assertThat(NamingRules.suggestUpperSnakeCase("already_snake")).isEqualTo("ALREADY_SNAKE");
    }
}
