package dev.mispesos.interpreter.interpretation;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import org.springframework.util.DigestUtils;

/**
 * Produces the canonical text and cache fingerprint of a statement. Statements that differ
 * only in surrounding whitespace or letter case share a fingerprint.
 */
public class MessageNormalizer {

    public NormalizedMessage normalize(String raw) {
        String text = raw != null ? raw.strip().toLowerCase(Locale.ROOT) : "";
        String fingerprint = DigestUtils.md5DigestAsHex(text.getBytes(StandardCharsets.UTF_8));
        return new NormalizedMessage(text, fingerprint);
    }
}
