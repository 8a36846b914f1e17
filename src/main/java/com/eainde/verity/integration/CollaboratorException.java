package com.eainde.verity.integration;

/**
 * An external collaborator could not be reached or refused the call.
 * Always recoverable: stages catch it and continue with a fallback value.
 */
public class CollaboratorException extends RuntimeException {

    public CollaboratorException(String message) {
        super(message);
    }

    public CollaboratorException(String message, Throwable cause) {
        super(message, cause);
    }
}
