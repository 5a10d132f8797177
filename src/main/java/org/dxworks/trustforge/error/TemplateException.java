package org.dxworks.trustforge.error;

/**
 * Raised when a template (HTML or LaTeX) is missing or breaks its placeholder contract.
 * Always raised before any external process is started.
 */
public class TemplateException extends TrustforgeException {

    private final String template;

    public TemplateException(String template, String message) {
        super("Template error [" + template + "]: " + message);
        this.template = template;
    }

    public TemplateException(String template, String message, Throwable cause) {
        super("Template error [" + template + "]: " + message, cause);
        this.template = template;
    }

    public String getTemplate() {
        return template;
    }
}
