package org.dxworks.trustforge.render;

import java.nio.file.Path;

/**
 * Runs one pass of a LaTeX engine over a {@code .tex} file.
 */
public interface TypesettingEngine {

    /**
     * Typesets {@code texFile} with {@code workDir} as working directory. Output lands next to
     * the input as {@code <stem>.pdf}.
     *
     * @throws org.dxworks.trustforge.error.MissingDependencyException when the engine binary is not installed
     * @throws org.dxworks.trustforge.error.LatexCompilationException when the pass fails or times out
     */
    void compile(Path texFile, Path workDir);
}
