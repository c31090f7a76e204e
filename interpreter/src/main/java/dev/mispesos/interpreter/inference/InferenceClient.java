package dev.mispesos.interpreter.inference;

/**
 * Transport to a text-generation model.
 */
public interface InferenceClient {

    /**
     * Sends a single generation request.
     *
     * @return the generated text, never blank
     * @throws InferenceTimeoutException when the model does not answer in time
     * @throws InferenceException        on any other transport or protocol failure
     */
    String generate(String prompt);

    /**
     * @return {@code true} when the inference service answers a lightweight probe
     */
    boolean isAvailable();
}
