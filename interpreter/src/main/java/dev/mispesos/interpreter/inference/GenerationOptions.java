package dev.mispesos.interpreter.inference;

/**
 * Sampling options sent with every generation request.
 *
 * @param temperature   sampling temperature
 * @param topP          nucleus sampling threshold
 * @param maxTokens     maximum number of generated tokens
 * @param contextWindow context window size in tokens
 */
public record GenerationOptions(double temperature, double topP, int maxTokens, int contextWindow) {

    public static GenerationOptions defaults() {
        return new GenerationOptions(0.1, 0.9, 150, 1024);
    }
}
