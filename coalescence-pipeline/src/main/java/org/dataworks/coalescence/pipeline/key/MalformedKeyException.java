package org.dataworks.coalescence.pipeline.key;

import lombok.Getter;

/**
 * Thrown when an object key does not have the structure of the active {@link KeyLayout}.
 */
public class MalformedKeyException extends Exception {
    @Getter
    private final String key;
    @Getter
    private final KeyLayout layout;

    public MalformedKeyException(String key, KeyLayout layout) {
        this(key, layout, null);
    }

    public MalformedKeyException(String key, KeyLayout layout, Throwable cause) {
        super("Key does not match the " + layout + " layout: " + key, cause);
        this.key = key;
        this.layout = layout;
    }
}
