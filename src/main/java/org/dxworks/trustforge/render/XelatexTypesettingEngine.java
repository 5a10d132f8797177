package org.dxworks.trustforge.render;

import org.dxworks.trustforge.error.LatexCompilationException;
import org.dxworks.trustforge.error.MissingDependencyException;

import java.io.IOException;
import java.nio.file.Path;
import java.util.List;
import java.util.concurrent.TimeUnit;

/**
 * Spawns the LaTeX binary in non-interactive mode. The engine's console output is discarded;
 * it writes everything useful to {@code <stem>.log} anyway.
 */
public class XelatexTypesettingEngine implements TypesettingEngine {

    private final String binary;
    private final long timeoutSeconds;

    public XelatexTypesettingEngine(String binary, long timeoutSeconds) {
        this.binary = binary;
        this.timeoutSeconds = timeoutSeconds;
    }

    List<String> command(Path texFile) {
        return List.of(binary, "-interaction=nonstopmode", "-halt-on-error", texFile.getFileName().toString());
    }

    @Override
    public void compile(Path texFile, Path workDir) {
        ProcessBuilder builder = new ProcessBuilder(command(texFile))
                .directory(workDir.toFile())
                .redirectErrorStream(true)
                .redirectOutput(ProcessBuilder.Redirect.DISCARD);

        Process process;
        try {
            process = builder.start();
        } catch (IOException e) {
            throw new MissingDependencyException(binary, e);
        }

        Path logFile = workDir.resolve(stem(texFile) + ".log");
        try {
            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly();
                throw new LatexCompilationException(texFile, logFile, "timed out after " + timeoutSeconds + "s");
            }
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            throw new LatexCompilationException(texFile, logFile, "interrupted");
        }

        int exitCode = process.exitValue();
        if (exitCode != 0) {
            throw new LatexCompilationException(texFile, logFile, binary + " exited with code " + exitCode);
        }
    }

    static String stem(Path file) {
        String name = file.getFileName().toString();
        int dot = name.lastIndexOf('.');
        return dot > 0 ? name.substring(0, dot) : name;
    }
}
