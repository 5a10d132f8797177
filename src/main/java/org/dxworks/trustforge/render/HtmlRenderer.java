package org.dxworks.trustforge.render;

import org.commonmark.ext.gfm.tables.TablesExtension;
import org.commonmark.ext.heading.anchor.HeadingAnchorExtension;
import org.commonmark.node.AbstractVisitor;
import org.commonmark.node.Heading;
import org.commonmark.node.Node;
import org.commonmark.node.Text;
import org.commonmark.parser.Parser;
import org.commonmark.renderer.html.AttributeProvider;
import org.dxworks.trustforge.TrustforgeConfig;
import org.dxworks.trustforge.error.AssetNotFoundException;
import org.dxworks.trustforge.error.TemplateException;
import org.dxworks.trustforge.markdown.FrontMatterParser;
import org.dxworks.trustforge.markdown.MarkdownPatterns;
import org.dxworks.trustforge.model.ParsedPolicy;
import org.dxworks.trustforge.model.PolicyMeta;
import org.dxworks.trustforge.model.theme.ThemeTokens;
import org.dxworks.trustforge.theme.CssVariables;
import org.dxworks.trustforge.theme.ThemeLoader;
import org.thymeleaf.TemplateEngine;
import org.thymeleaf.context.Context;
import org.thymeleaf.exceptions.TemplateEngineException;
import org.thymeleaf.templatemode.TemplateMode;
import org.thymeleaf.templateresolver.AbstractConfigurableTemplateResolver;
import org.thymeleaf.templateresolver.ClassLoaderTemplateResolver;
import org.thymeleaf.templateresolver.FileTemplateResolver;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;

/**
 * Policy Markdown to a standalone HTML page styled through {@code --tf-*} CSS variables.
 */
public class HtmlRenderer {

    static final String TEMPLATE_NAME = "base";
    static final String ASSETS_DIR = "assets";

    private final TrustforgeConfig config;
    private final Parser parser;
    private final org.commonmark.renderer.html.HtmlRenderer markdownRenderer;
    private final TemplateEngine templateEngine;

    public HtmlRenderer(TrustforgeConfig config) {
        this.config = config;
        List<org.commonmark.Extension> extensions = List.of(
                TablesExtension.create(),
                HeadingAnchorExtension.create()
        );
        this.parser = Parser.builder().extensions(extensions).build();
        // registered after the anchor extension so an explicit {#id} wins over the generated one
        this.markdownRenderer = org.commonmark.renderer.html.HtmlRenderer.builder()
                .extensions(extensions)
                .attributeProviderFactory(context -> new ExplicitHeadingIds())
                .build();
        this.templateEngine = new TemplateEngine();
        this.templateEngine.setTemplateResolver(templateResolver(config.getTemplatesDir()));
    }

    public Path render(Path policyPath) throws IOException {
        return render(policyPath, ThemeLoader.resolveAndLoad(config.getThemePath()));
    }

    public Path render(Path policyPath, ThemeTokens theme) throws IOException {
        ParsedPolicy policy = FrontMatterParser.read(policyPath);
        String bodyHtml = toHtml(policy.body());

        Path outDir = config.getOutDir();
        Files.createDirectories(outDir);
        String logo = copyLogo(theme, outDir);

        Context context = new Context();
        context.setVariable("meta", metaVariables(policy.meta()));
        context.setVariable("body", bodyHtml);
        context.setVariable("cssVars", CssVariables.fromTokens(theme));
        context.setVariable("rootCss", CssVariables.toRootRule(CssVariables.fromTokens(theme)));
        context.setVariable("tokens", theme);
        context.setVariable("logo", logo);
        context.setVariable("brandName", theme.brand.name);

        String html;
        try {
            html = templateEngine.process(TEMPLATE_NAME, context);
        } catch (TemplateEngineException e) {
            throw new TemplateException("html/" + TEMPLATE_NAME + ".html", e.getMessage(), e);
        }

        Path outFile = outDir.resolve(XelatexTypesettingEngine.stem(policyPath) + ".html");
        Files.writeString(outFile, html, StandardCharsets.UTF_8);
        return outFile;
    }

    String toHtml(String markdown) {
        Node document = parser.parse(markdown);
        return markdownRenderer.render(document);
    }

    private Map<String, Object> metaVariables(PolicyMeta meta) {
        Map<String, Object> vars = new HashMap<>();
        vars.put("title", meta.title);
        vars.put("version", meta.version);
        vars.put("owner", meta.owner);
        vars.put("lastReviewed", meta.lastReviewed);
        vars.put("appliesTo", meta.appliesTo);
        vars.put("refs", meta.refs);
        vars.put("subtitle", blankToNull(meta.subtitle));
        String footer = blankToNull(meta.footer);
        vars.put("footer", footer != null ? footer : config.getDefaultFooter());
        return vars;
    }

    /**
     * Copies the brand logo to {@code out/assets/}. Unlike the PDF cover, a configured logo that
     * does not exist fails the HTML render.
     *
     * @return the logo path relative to the HTML file, or null without a logo
     */
    private static String copyLogo(ThemeTokens theme, Path outDir) throws IOException {
        if (!theme.hasLogo()) {
            return null;
        }
        Path logo = Paths.get(theme.brand.logoPath);
        if (!Files.isRegularFile(logo)) {
            throw new AssetNotFoundException(logo.toString());
        }
        Path assets = Files.createDirectories(outDir.resolve(ASSETS_DIR));
        Files.copy(logo, assets.resolve(logo.getFileName()), StandardCopyOption.REPLACE_EXISTING);
        return ASSETS_DIR + "/" + logo.getFileName();
    }

    private static AbstractConfigurableTemplateResolver templateResolver(Path templatesDir) {
        Path htmlDir = templatesDir.resolve("html");
        AbstractConfigurableTemplateResolver resolver;
        if (Files.isRegularFile(htmlDir.resolve(TEMPLATE_NAME + ".html"))) {
            resolver = new FileTemplateResolver();
            resolver.setPrefix(htmlDir.toAbsolutePath() + "/");
        } else {
            resolver = new ClassLoaderTemplateResolver();
            resolver.setPrefix("templates/html/");
        }
        resolver.setSuffix(".html");
        resolver.setTemplateMode(TemplateMode.HTML);
        resolver.setCharacterEncoding(StandardCharsets.UTF_8.name());
        resolver.setCacheable(false);
        return resolver;
    }

    private static String blankToNull(String value) {
        return value == null || value.isBlank() ? null : value;
    }

    /**
     * Moves a trailing {@code {#id}} in heading text onto the heading's {@code id} attribute.
     */
    private static class ExplicitHeadingIds implements AttributeProvider {

        @Override
        public void setAttributes(Node node, String tagName, Map<String, String> attributes) {
            if (!(node instanceof Heading)) {
                return;
            }
            IdCollector collector = new IdCollector();
            node.accept(collector);
            if (collector.id != null) {
                attributes.put("id", collector.id);
            }
        }
    }

    private static class IdCollector extends AbstractVisitor {
        private String id;

        @Override
        public void visit(Text text) {
            Matcher matcher = MarkdownPatterns.HEADING_ID.matcher(text.getLiteral());
            if (matcher.find()) {
                id = matcher.group(1);
                text.setLiteral(text.getLiteral().substring(0, matcher.start()));
            }
        }
    }
}
