package org.dxworks.trustforge.error;

public class ThemeException extends TrustforgeException {

    private final String themePath;

    public ThemeException(String themePath, String message) {
        super("Theme error [" + themePath + "]: " + message);
        this.themePath = themePath;
    }

    public ThemeException(String themePath, String message, Throwable cause) {
        super("Theme error [" + themePath + "]: " + message, cause);
        this.themePath = themePath;
    }

    public String getThemePath() {
        return themePath;
    }
}
