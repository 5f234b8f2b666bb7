package com.qgen.ai;

import lombok.Getter;

/** A language-model collaborator could not deliver. */
@Getter
public class GenerationException extends Exception {

    public enum Reason {
        /** no chat model configured */
        UNAVAILABLE,
        MODEL_ERROR,
        NO_CODE
    }

    private final Reason reason;

    public GenerationException(Reason reason, String message) {
        super(message);
        this.reason = reason;
    }

    public GenerationException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
    }
}
