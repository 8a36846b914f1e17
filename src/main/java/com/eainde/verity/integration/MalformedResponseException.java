package com.eainde.verity.integration;

/**
 * A collaborator answered, but the payload could not be parsed into the expected shape.
 */
public class MalformedResponseException extends CollaboratorException {

    public MalformedResponseException(String message) {
        super(message);
    }

    public MalformedResponseException(String message, Throwable cause) {
        super(message, cause);
    }
}
