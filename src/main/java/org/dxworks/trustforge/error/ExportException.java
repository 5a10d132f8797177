package org.dxworks.trustforge.error;

/**
 * CSV export problems: missing policies directory, unreadable risk register, write failures.
 */
public class ExportException extends TrustforgeException {

    private final String location;

    public ExportException(String location, String message) {
        super("Export error at [" + location + "]: " + message);
        this.location = location;
    }

    public ExportException(String location, String message, Throwable cause) {
        super("Export error at [" + location + "]: " + message, cause);
        this.location = location;
    }

    public String getLocation() {
        return location;
    }
}
