package org.dxworks.trustforge.error;

/**
 * Raised when a required system binary (the LaTeX engine) cannot be started.
 */
public class MissingDependencyException extends TrustforgeException {

    private final String binary;

    public MissingDependencyException(String binary, Throwable cause) {
        super("Missing required dependency: " + binary + ". Please install it and retry.", cause);
        this.binary = binary;
    }

    public String getBinary() {
        return binary;
    }
}
