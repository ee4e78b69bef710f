package io.surfworks.flowgrinder.ir;

/**
 * Exception thrown when an IR expression cannot be built or validated.
 */
public class IrException extends RuntimeException {

    public IrException(String message) {
        super(message);
    }

    public IrException(String message, Throwable cause) {
        super(message, cause);
    }
}
