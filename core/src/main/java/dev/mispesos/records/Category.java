package dev.mispesos.records;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;
import java.util.Set;

/**
 * Spending categories a structured record can be filed under. Declaration order is the
 * precedence order used by keyword detection.
 */
public enum Category {

    FOOD("food", Set.of("alimentacion", "comida")),
    TRANSPORT("transport", Set.of("transporte")),
    SERVICES("services", Set.of("servicios")),
    ENTERTAINMENT("entertainment", Set.of("entretenimiento")),
    HEALTH("health", Set.of("salud")),
    CLOTHING("clothing", Set.of("ropa")),
    EDUCATION("education", Set.of("educacion")),
    HOUSING("housing", Set.of("casa", "hogar", "vivienda")),
    OTHER("other", Set.of("otros", "otro"));

    private final String value;
    private final Set<String> aliases;

    Category(String value, Set<String> aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    @JsonValue
    public String value() {
        return value;
    }

    /**
     * Resolves a category name or one of its Spanish aliases.
     *
     * @return the matching category, or empty when the value is not recognised
     */
    public static Optional<Category> find(String raw) {
        String canonical = ValueAliases.canonical(raw);
        if (canonical.isEmpty()) {
            return Optional.empty();
        }
        for (Category category : values()) {
            if (category.value.equals(canonical) || category.aliases.contains(canonical)) {
                return Optional.of(category);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static Category fromValue(String raw) {
        return find(raw).orElse(OTHER);
    }
}
