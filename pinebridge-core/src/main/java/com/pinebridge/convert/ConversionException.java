package com.pinebridge.convert;

import java.util.List;

/**
 * Raised instead of emitting partial code. Carries every cause found.
 */
public class ConversionException extends RuntimeException {

    private final List<String> causes;

    public ConversionException(String message, List<String> causes) {
        super(message + ": " + String.join("; ", causes));
        this.causes = List.copyOf(causes);
    }

    public List<String> getCauses() {
        return causes;
    }
}
