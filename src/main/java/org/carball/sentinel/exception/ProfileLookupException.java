package org.carball.sentinel.exception;

/**
 * Raised by profile sources when the profile for an execution cannot be retrieved.
 */
public class ProfileLookupException extends Exception {

    public ProfileLookupException(String message) {
        super(message);
    }

    public ProfileLookupException(String message, Throwable cause) {
        super(message, cause);
    }
}
