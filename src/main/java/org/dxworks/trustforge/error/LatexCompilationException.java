package org.dxworks.trustforge.error;

import java.nio.file.Path;

/**
 * Raised when the LaTeX engine exits with a non-zero status or does not finish in time.
 * Never retried; the caller fixes the input and re-runs.
 */
public class LatexCompilationException extends TrustforgeException {

    private final Path texFile;
    private final Path logFile;

    public LatexCompilationException(Path texFile, Path logFile, String detail) {
        super(buildMessage(texFile, logFile, detail));
        this.texFile = texFile;
        this.logFile = logFile;
    }

    private static String buildMessage(Path texFile, Path logFile, String detail) {
        StringBuilder msg = new StringBuilder("LaTeX failed compiling: ").append(texFile);
        if (detail != null && !detail.isEmpty()) {
            msg.append(" (").append(detail).append(")");
        }
        if (logFile != null) {
            msg.append(" (see log: ").append(logFile).append(")");
        }
        return msg.toString();
    }

    public Path getTexFile() {
        return texFile;
    }

    public Path getLogFile() {
        return logFile;
    }
}
