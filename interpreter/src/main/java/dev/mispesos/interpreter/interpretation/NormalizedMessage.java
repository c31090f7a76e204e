package dev.mispesos.interpreter.interpretation;

/**
 * Canonical form of an incoming statement.
 *
 * @param text        trimmed, lower-cased text
 * @param fingerprint hex MD5 digest of {@code text}, used as the cache key
 */
public record NormalizedMessage(String text, String fingerprint) {
}
