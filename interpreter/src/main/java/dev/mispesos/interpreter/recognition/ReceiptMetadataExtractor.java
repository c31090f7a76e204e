package dev.mispesos.interpreter.recognition;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Picks receipt number, tax amount and contact details out of recognised receipt text.
 */
public class ReceiptMetadataExtractor {

    public static final String RECEIPT_NUMBER = "receiptNumber";
    public static final String TAX_AMOUNT = "taxAmount";
    public static final String PHONE = "phone";
    public static final String EMAIL = "email";

    private static final List<Pattern> RECEIPT_NUMBER_PATTERNS = List.of(
        Pattern.compile("(?:recibo|ticket|factura)[\\s#:]*(\\d+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(?:no|num|number)[\\s.:]*(\\d+)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("(\\d{6,})"));

    private static final List<Pattern> TAX_PATTERNS = List.of(
        Pattern.compile("iva[\\s:]*(\\d+[.,]?\\d*)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("tax[\\s:]*(\\d+[.,]?\\d*)", Pattern.CASE_INSENSITIVE),
        Pattern.compile("impuesto[\\s:]*(\\d+[.,]?\\d*)", Pattern.CASE_INSENSITIVE));

    private static final Pattern PHONE_PATTERN = Pattern.compile("(\\d{3}[-.\\s]?\\d{3}[-.\\s]?\\d{4})");

    private static final Pattern EMAIL_PATTERN =
        Pattern.compile("([a-zA-Z0-9._%+-]+@[a-zA-Z0-9.-]+\\.[a-zA-Z]{2,})");

    public Map<String, String> extract(String text) {
        Map<String, String> metadata = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return metadata;
        }
        firstMatch(RECEIPT_NUMBER_PATTERNS, text).ifPresent(value -> metadata.put(RECEIPT_NUMBER, value));
        firstMatch(TAX_PATTERNS, text).ifPresent(value -> metadata.put(TAX_AMOUNT, value));
        firstMatch(List.of(PHONE_PATTERN), text).ifPresent(value -> metadata.put(PHONE, value));
        firstMatch(List.of(EMAIL_PATTERN), text).ifPresent(value -> metadata.put(EMAIL, value));
        return metadata;
    }

    private static Optional<String> firstMatch(List<Pattern> patterns, String text) {
        for (Pattern pattern : patterns) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return Optional.of(matcher.group(1));
            }
        }
        return Optional.empty();
    }
}
