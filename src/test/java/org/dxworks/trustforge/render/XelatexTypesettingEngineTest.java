package org.dxworks.trustforge.render;

import org.dxworks.trustforge.error.MissingDependencyException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

public class XelatexTypesettingEngineTest {

    @TempDir
    Path tempDir;

    @Test
    void command_NonInteractiveWithFileName() {
        XelatexTypesettingEngine engine = new XelatexTypesettingEngine("xelatex", 300);

        assertEquals(List.of("xelatex", "-interaction=nonstopmode", "-halt-on-error", "policy.tex"),
                engine.command(Paths.get("out/policy.tex")));
    }

    @Test
    void compile_MissingBinary() {
        XelatexTypesettingEngine engine = new XelatexTypesettingEngine("trustforge-no-such-latex-engine", 5);

        MissingDependencyException e = assertThrows(MissingDependencyException.class,
                () -> engine.compile(tempDir.resolve("policy.tex"), tempDir));

        assertEquals("trustforge-no-such-latex-engine", e.getBinary());
    }

    @Test
    void stem_DropsLastExtension() {
        assertEquals("policy.v2", XelatexTypesettingEngine.stem(Paths.get("a/policy.v2.md")));
        assertEquals("README", XelatexTypesettingEngine.stem(Paths.get("README")));
    }
}
