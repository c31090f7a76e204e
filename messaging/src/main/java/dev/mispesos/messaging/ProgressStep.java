package dev.mispesos.messaging;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Steps an extraction task reports while running, with the progress percentage reached
 * when the step starts.
 */
public enum ProgressStep {

    QUEUED("queued", 0),
    PREPROCESSING("preprocessing", 10),
    RECOGNITION("recognition", 30),
    INTERPRETATION("interpretation", 70),
    PERSISTENCE("persistence", 90),
    DONE("done", 100);

    private final String value;
    private final int percent;

    ProgressStep(String value, int percent) {
        this.value = value;
        this.percent = percent;
    }

    @JsonValue
    public String value() {
        return value;
    }

    public int percent() {
        return percent;
    }
}
