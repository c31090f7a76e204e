package dev.mispesos.interpreter.pattern;

import dev.mispesos.records.Category;
import dev.mispesos.records.PaymentMethod;
import dev.mispesos.records.RecordOrigin;
import dev.mispesos.records.StructuredRecord;
import dev.mispesos.records.ValueAliases;
import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Deterministic keyword and regular-expression extraction of financial records.
 *
 * <p>Used as the baseline extractor and as the fallback whenever inference fails or is not
 * confident enough. Instances are stateless and thread-safe.
 */
public class PatternExtractor {

    public static final String RAW_RESPONSE = "fallback_regex";

    static final int DESCRIPTION_LENGTH = 100;

    private static final BigDecimal THOUSAND = BigDecimal.valueOf(1000);

    private static final List<AmountPattern> AMOUNT_PATTERNS = List.of(
        new AmountPattern(Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*k(?:\\s|$)"), THOUSAND),
        new AmountPattern(Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*mil(?:\\s|$)"), THOUSAND),
        new AmountPattern(Pattern.compile("(\\d{4,})"), BigDecimal.ONE),
        new AmountPattern(Pattern.compile("(\\d+(?:\\.\\d+)?)\\s*(?:mil|k)"), THOUSAND));

    private static final Map<Category, Pattern> CATEGORY_KEYWORDS = categoryKeywords();

    private static final Map<PaymentMethod, Pattern> PAYMENT_KEYWORDS = paymentKeywords();

    private static final Pattern TWO_DAYS_AGO = word("anteayer|antier");
    private static final Pattern YESTERDAY = word("ayer");
    // "esta manana", "en la manana" and "por la manana" mean this morning
    private static final Pattern TOMORROW = Pattern.compile("(?<!\\b(?:esta|la)\\s{1,3})\\bmanana\\b",
        Pattern.UNICODE_CHARACTER_CLASS);

    private final double baselineConfidence;
    private final double fallbackConfidence;
    private final double failureConfidence;

    public PatternExtractor(double baselineConfidence, double fallbackConfidence, double failureConfidence) {
        this.baselineConfidence = baselineConfidence;
        this.fallbackConfidence = fallbackConfidence;
        this.failureConfidence = failureConfidence;
    }

    /**
     * Extraction used on its own, without any inference attempt.
     */
    public StructuredRecord extractBaseline(String text) {
        return extract(text, baselineConfidence);
    }

    /**
     * Extraction used after inference failed or produced a weak result.
     */
    public StructuredRecord extractFallback(String text) {
        return extract(text, fallbackConfidence);
    }

    private StructuredRecord extract(String text, double successConfidence) {
        String original = text != null ? text : "";
        String lowered = original.toLowerCase(Locale.ROOT);
        String canonical = ValueAliases.canonical(original);

        BigDecimal amount = findAmount(lowered);
        return StructuredRecord.builder()
            .amount(amount)
            .description(original.length() > DESCRIPTION_LENGTH ? original.substring(0, DESCRIPTION_LENGTH) : original)
            .category(findCategory(canonical))
            .paymentMethod(findPaymentMethod(canonical))
            .dateOffset(findDateOffset(canonical))
            .confidence(amount != null ? successConfidence : failureConfidence)
            .origin(RecordOrigin.PATTERN_FALLBACK)
            .rawResponse(RAW_RESPONSE)
            .build();
    }

    BigDecimal findAmount(String lowered) {
        for (AmountPattern amountPattern : AMOUNT_PATTERNS) {
            Matcher matcher = amountPattern.pattern().matcher(lowered);
            if (!matcher.find()) {
                continue;
            }
            BigDecimal value;
            try {
                value = new BigDecimal(matcher.group(1)).multiply(amountPattern.multiplier());
            } catch (NumberFormatException ex) {
                continue;
            }
            if (value.signum() > 0) {
                return plain(value);
            }
        }
        return null;
    }

    Category findCategory(String canonical) {
        for (Map.Entry<Category, Pattern> entry : CATEGORY_KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(canonical).find()) {
                return entry.getKey();
            }
        }
        return Category.OTHER;
    }

    PaymentMethod findPaymentMethod(String canonical) {
        for (Map.Entry<PaymentMethod, Pattern> entry : PAYMENT_KEYWORDS.entrySet()) {
            if (entry.getValue().matcher(canonical).find()) {
                return entry.getKey();
            }
        }
        return PaymentMethod.CARD;
    }

    int findDateOffset(String canonical) {
        if (TWO_DAYS_AGO.matcher(canonical).find()) {
            return -2;
        }
        if (YESTERDAY.matcher(canonical).find()) {
            return -1;
        }
        if (TOMORROW.matcher(canonical).find()) {
            return 1;
        }
        return 0;
    }

    private static BigDecimal plain(BigDecimal value) {
        BigDecimal stripped = value.stripTrailingZeros();
        return stripped.scale() < 0 ? stripped.setScale(0) : stripped;
    }

    private static Pattern word(String alternatives) {
        return Pattern.compile("\\b(?:" + alternatives + ")\\b", Pattern.UNICODE_CHARACTER_CLASS);
    }

    /**
     * Whole-word match of any keyword, plural forms included. A trailing {@code *} marks a stem
     * that matches any word starting with it.
     */
    private static Pattern keywords(String... keywords) {
        List<String> alternatives = new ArrayList<>();
        for (String keyword : keywords) {
            alternatives.add(keyword.endsWith("*")
                ? Pattern.quote(keyword.substring(0, keyword.length() - 1)) + "\\w*"
                : Pattern.quote(keyword) + "(?:e?s)?");
        }
        return word(String.join("|", alternatives));
    }

    private static Map<Category, Pattern> categoryKeywords() {
        Map<Category, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(Category.FOOD, keywords("almuerzo", "desayuno", "cena", "comida", "restaurante", "pizza",
            "hamburgues*", "mercado", "cafe"));
        patterns.put(Category.TRANSPORT, keywords("uber", "taxi", "bus", "transmilenio", "gasolina", "peaje",
            "parqueadero"));
        patterns.put(Category.SERVICES, keywords("internet", "telefono", "luz", "agua", "netflix", "spotify",
            "celular"));
        patterns.put(Category.ENTERTAINMENT, keywords("cine", "bar", "discoteca", "concierto"));
        patterns.put(Category.HEALTH, keywords("farmacia", "medico", "drogueria", "odontolog*"));
        patterns.put(Category.CLOTHING, keywords("ropa", "zapatos", "camisa"));
        patterns.put(Category.EDUCATION, keywords("libro", "curso", "universidad", "colegio"));
        patterns.put(Category.HOUSING, keywords("arriendo", "alquiler", "hipoteca", "administracion"));
        return patterns;
    }

    private static Map<PaymentMethod, Pattern> paymentKeywords() {
        Map<PaymentMethod, Pattern> patterns = new LinkedHashMap<>();
        patterns.put(PaymentMethod.CARD, keywords("tarjeta", "card"));
        patterns.put(PaymentMethod.CASH, keywords("efectivo", "cash"));
        patterns.put(PaymentMethod.TRANSFER, keywords("transfer*"));
        patterns.put(PaymentMethod.DEBIT, keywords("debito"));
        return patterns;
    }

    private record AmountPattern(Pattern pattern, BigDecimal multiplier) {
    }
}
