package dev.mispesos.records;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class ValueAliasesTest {

    @Test
    void foldsAccentsCaseAndSurroundingWhitespace() {
        assertThat(ValueAliases.canonical(" Educación ")).isEqualTo("educacion");
        assertThat(ValueAliases.canonical("pagué en EFECTIVO mañana")).isEqualTo("pague en efectivo manana");
    }

    @Test
    void treatsNullAsEmpty() {
        assertThat(ValueAliases.canonical(null)).isEmpty();
    }
}
