package io.surfworks.flowgrinder.core;

/**
 * Base exception for graph conversion failures.
 *
 * <p>Every failure aborts the whole run; no partial function is produced.
 * The assembler records the stage it was in, which then prefixes the message.
 */
public class ConversionException extends RuntimeException {

    private String stage;

    public ConversionException(String message) {
        super(message);
    }

    public ConversionException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Stage the failure happened in, or null if raised outside a conversion run.
     */
    public String getStage() {
        return stage;
    }

    /**
     * Records the stage unless one is already set.
     */
    public ConversionException inStage(String stageName) {
        if (this.stage == null) {
            this.stage = stageName;
        }
        return this;
    }

    @Override
    public String getMessage() {
        String message = super.getMessage();
        return stage == null ? message : "[" + stage + "] " + message;
    }
}
