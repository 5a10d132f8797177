package org.dxworks.trustforge.error;

/**
 * Base class for all Trustforge domain errors.
 */
public class TrustforgeException extends RuntimeException {

    public TrustforgeException(String message) {
        super(message);
    }

    public TrustforgeException(String message, Throwable cause) {
        super(message, cause);
    }
}
