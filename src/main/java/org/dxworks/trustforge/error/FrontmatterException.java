package org.dxworks.trustforge.error;

/**
 * Raised when a policy file has a missing or invalid YAML front matter block.
 */
public class FrontmatterException extends TrustforgeException {

    private final String source;

    public FrontmatterException(String source, String message) {
        super(source + ": " + message);
        this.source = source;
    }

    public FrontmatterException(String source, String message, Throwable cause) {
        super(source + ": " + message, cause);
        this.source = source;
    }

    public String getSource() {
        return source;
    }
}
