package dev.mispesos.records;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;
import java.util.Optional;
import java.util.Set;

/**
 * How a purchase was paid. Unrecognised values fall back to {@link #CARD}.
 */
public enum PaymentMethod {

    CARD("card", Set.of("tarjeta", "credito", "tarjeta de credito")),
    CASH("cash", Set.of("efectivo")),
    TRANSFER("transfer", Set.of("transferencia")),
    DEBIT("debit", Set.of("debito", "tarjeta debito", "tarjeta de debito"));

    private final String value;
    private final Set<String> aliases;

    PaymentMethod(String value, Set<String> aliases) {
        this.value = value;
        this.aliases = aliases;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public static Optional<PaymentMethod> find(String raw) {
        String canonical = ValueAliases.canonical(raw);
        if (canonical.isEmpty()) {
            return Optional.empty();
        }
        for (PaymentMethod method : values()) {
            if (method.value.equals(canonical) || method.aliases.contains(canonical)) {
                return Optional.of(method);
            }
        }
        return Optional.empty();
    }

    @JsonCreator
    public static PaymentMethod fromValue(String raw) {
        return find(raw).orElse(CARD);
    }
}
