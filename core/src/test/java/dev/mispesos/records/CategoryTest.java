package dev.mispesos.records;

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

class CategoryTest {

    @Test
    void resolvesCanonicalValuesAndSpanishAliases() {
        assertThat(Category.fromValue("food")).isEqualTo(Category.FOOD);
        assertThat(Category.fromValue("alimentacion")).isEqualTo(Category.FOOD);
        assertThat(Category.fromValue(" Educación ")).isEqualTo(Category.EDUCATION);
        assertThat(Category.fromValue("CASA")).isEqualTo(Category.HOUSING);
    }

    @Test
    void unknownCategoriesMapToOther() {
        assertThat(Category.fromValue("groceries-and-more")).isEqualTo(Category.OTHER);
        assertThat(Category.fromValue(null)).isEqualTo(Category.OTHER);
        assertThat(Category.find("groceries-and-more")).isEmpty();
    }

    @Test
    void paymentMethodsDefaultToCard() {
        assertThat(PaymentMethod.fromValue("efectivo")).isEqualTo(PaymentMethod.CASH);
        assertThat(PaymentMethod.fromValue("Débito")).isEqualTo(PaymentMethod.DEBIT);
        assertThat(PaymentMethod.fromValue("transferencia")).isEqualTo(PaymentMethod.TRANSFER);
        assertThat(PaymentMethod.fromValue("bitcoin")).isEqualTo(PaymentMethod.CARD);
        assertThat(PaymentMethod.find("")).isEmpty();
    }
}
