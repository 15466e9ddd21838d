package org.spacompose;

/**
 * Base class of all errors raised while composing, addressing or validating a module tree.
 * <p>
 * This is a RuntimeException because construction failures are deterministic for a given
 * build script: retrying without changing the input cannot succeed.
 */
public class SpaModuleException extends RuntimeException {

    /**
     * Creates a SpaModuleException with the specified message.
     *
     * @param message Description of the failure
     */
    public SpaModuleException(String message) {
        super(message);
    }

    /**
     * Creates a SpaModuleException with the specified message and cause.
     *
     * @param message Description of the failure
     * @param cause The underlying exception that caused the failure
     */
    public SpaModuleException(String message, Throwable cause) {
        super(message, cause);
    }
}
