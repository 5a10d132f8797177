package org.dxworks.trustforge.render;

import org.dxworks.trustforge.TrustforgeConfig;
import org.dxworks.trustforge.error.TemplateException;
import org.dxworks.trustforge.latex.MarkdownToLatexTranspiler;
import org.dxworks.trustforge.latex.template.TemplateContext;
import org.dxworks.trustforge.latex.template.TemplateSubstitutionEngine;
import org.dxworks.trustforge.markdown.FrontMatterParser;
import org.dxworks.trustforge.model.ParsedPolicy;
import org.dxworks.trustforge.model.theme.ThemeTokens;
import org.dxworks.trustforge.theme.ThemeLoader;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.List;

/**
 * Policy Markdown to PDF: front matter, theme, LaTeX transpilation, template substitution, then
 * two typesetting passes so cross references and the table of contents settle.
 */
public class PdfRenderer {

    static final String TEMPLATE_NAME = "eisvogel-lite.tex";
    static final String LOGO_FILE = "logo.png";
    static final int PASSES = 2;

    private static final List<String> AUX_EXTENSIONS = List.of(".aux", ".toc", ".out", ".lof", ".lot", ".log");

    private final TrustforgeConfig config;
    private final TypesettingEngine engine;

    public PdfRenderer(TrustforgeConfig config) {
        this(config, new XelatexTypesettingEngine(config.getLatexEngine(), config.getLatexTimeoutSeconds()));
    }

    public PdfRenderer(TrustforgeConfig config, TypesettingEngine engine) {
        this.config = config;
        this.engine = engine;
    }

    public Path render(Path policyPath) throws IOException {
        return render(policyPath, ThemeLoader.resolveAndLoad(config.getThemePath()));
    }

    public Path render(Path policyPath, ThemeTokens theme) throws IOException {
        String template = loadTemplate();
        // fail before anything is written to the output directory
        TemplateSubstitutionEngine.checkBodyPlaceholder(template, TEMPLATE_NAME);

        ParsedPolicy policy = FrontMatterParser.read(policyPath);
        String body = MarkdownToLatexTranspiler.transpile(policy.body());

        Path outDir = config.getOutDir();
        Files.createDirectories(outDir);
        String stem = XelatexTypesettingEngine.stem(policyPath);
        Files.writeString(outDir.resolve(stem + ".body.tex"), body, StandardCharsets.UTF_8);

        String logoFile = copyLogo(theme, outDir);
        TemplateContext context = TemplateContext.of(policy.meta(), theme, logoFile, config.getDefaultFooter());
        String latex = TemplateSubstitutionEngine.render(template, TEMPLATE_NAME, context, body);

        Path texFile = outDir.resolve(stem + ".tex");
        Files.writeString(texFile, latex, StandardCharsets.UTF_8);

        cleanAuxFiles(outDir, stem);
        for (int pass = 1; pass <= PASSES; pass++) {
            System.out.println("[PdfRenderer] pass " + pass + "/" + PASSES + ": " + texFile.getFileName());
            engine.compile(texFile, outDir);
        }
        return outDir.resolve(stem + ".pdf");
    }

    String loadTemplate() throws IOException {
        Path override = config.getTemplatesDir().resolve("latex").resolve(TEMPLATE_NAME);
        if (Files.isRegularFile(override)) {
            return Files.readString(override, StandardCharsets.UTF_8);
        }
        try (InputStream in = PdfRenderer.class.getClassLoader().getResourceAsStream("templates/latex/" + TEMPLATE_NAME)) {
            if (in == null) {
                throw new TemplateException(TEMPLATE_NAME, "LaTeX template not found in " + override.getParent()
                        + " or on the classpath.");
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    /**
     * @return the logo file name the template should include, or null when the theme has no logo
     *         or the logo file is missing (the cover is then rendered without it)
     */
    private static String copyLogo(ThemeTokens theme, Path outDir) throws IOException {
        if (!theme.hasLogo()) {
            return null;
        }
        Path logo = Paths.get(theme.brand.logoPath);
        if (!Files.isRegularFile(logo)) {
            System.err.println("[PdfRenderer] Logo not found: " + logo + "; rendering without logo");
            return null;
        }
        Files.copy(logo, outDir.resolve(LOGO_FILE), StandardCopyOption.REPLACE_EXISTING);
        return LOGO_FILE;
    }

    static void cleanAuxFiles(Path outDir, String stem) throws IOException {
        for (String extension : AUX_EXTENSIONS) {
            Files.deleteIfExists(outDir.resolve(stem + extension));
        }
    }
}
