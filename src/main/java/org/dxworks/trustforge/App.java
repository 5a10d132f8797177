package org.dxworks.trustforge;

import org.dxworks.trustforge.error.AssetNotFoundException;
import org.dxworks.trustforge.error.ExportException;
import org.dxworks.trustforge.error.FrontmatterException;
import org.dxworks.trustforge.error.LatexCompilationException;
import org.dxworks.trustforge.error.MissingDependencyException;
import org.dxworks.trustforge.error.TemplateException;
import org.dxworks.trustforge.error.ThemeException;
import org.dxworks.trustforge.error.TrustforgeException;
import org.dxworks.trustforge.export.ControlMapExporter;
import org.dxworks.trustforge.export.PolicyIndexExporter;
import org.dxworks.trustforge.export.RiskRegister;
import org.dxworks.trustforge.render.HtmlRenderer;
import org.dxworks.trustforge.render.PdfRenderer;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

public class App {

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        int exitCode = run(args, TrustforgeConfig.load());
        if (exitCode != EXIT_OK) {
            System.exit(exitCode);
        }
    }

    static int run(String[] args, TrustforgeConfig config) {
        if (args.length < 1) {
            printUsage();
            return EXIT_USAGE;
        }

        String command = args[0];
        try {
            switch (command) {
                case "html": {
                    if (args.length < 2) {
                        printUsage();
                        return EXIT_USAGE;
                    }
                    Path policy = Paths.get(args[1]);
                    if (!Files.isRegularFile(policy)) {
                        return fail("Error: Policy file does not exist: " + policy);
                    }
                    Path out = new HtmlRenderer(config).render(policy);
                    System.out.println("HTML -> " + out);
                    return EXIT_OK;
                }
                case "pdf": {
                    if (args.length < 2) {
                        printUsage();
                        return EXIT_USAGE;
                    }
                    Path policy = Paths.get(args[1]);
                    if (!Files.isRegularFile(policy)) {
                        return fail("Error: Policy file does not exist: " + policy);
                    }
                    Path out = new PdfRenderer(config).render(policy);
                    System.out.println("PDF -> " + out);
                    return EXIT_OK;
                }
                case "index": {
                    Path out = args.length > 1 ? Paths.get(args[1]) : config.getOutDir().resolve("policies.csv");
                    Path policiesDir = args.length > 2 ? Paths.get(args[2]) : config.getPoliciesDir();
                    System.out.println("Index -> " + PolicyIndexExporter.export(policiesDir, out));
                    return EXIT_OK;
                }
                case "control-map": {
                    Path out = args.length > 1 ? Paths.get(args[1]) : config.getOutDir().resolve("control_map.csv");
                    System.out.println("Control map -> " + ControlMapExporter.export(out));
                    return EXIT_OK;
                }
                case "risk-export": {
                    if (args.length < 2) {
                        printUsage();
                        return EXIT_USAGE;
                    }
                    Path out = args.length > 2 ? Paths.get(args[2]) : config.getOutDir().resolve("risks.csv");
                    System.out.println("Risks -> " + RiskRegister.export(Paths.get(args[1]), out));
                    return EXIT_OK;
                }
                default:
                    System.err.println("Unknown command: " + command);
                    printUsage();
                    return EXIT_USAGE;
            }
        } catch (FrontmatterException e) {
            return fail("[frontmatter] " + e.getMessage());
        } catch (ThemeException e) {
            return fail("[theme] " + e.getMessage());
        } catch (AssetNotFoundException e) {
            return fail("[assets] " + e.getMessage());
        } catch (MissingDependencyException e) {
            return fail("[deps] " + e.getMessage() + "\nHint: install TeX Live (XeLaTeX).");
        } catch (LatexCompilationException e) {
            return fail("[pdf] " + e.getMessage());
        } catch (TemplateException e) {
            return fail(("pdf".equals(command) ? "[pdf] " : "[html] ") + e.getMessage());
        } catch (ExportException e) {
            return fail("[export] " + e.getMessage());
        } catch (TrustforgeException | IOException e) {
            return fail("[trustforge] " + e.getMessage());
        } catch (RuntimeException e) {
            return fail("[unexpected] " + e.getClass().getSimpleName() + ": " + e.getMessage());
        }
    }

    private static int fail(String message) {
        System.err.println(message);
        return EXIT_FAILURE;
    }

    private static void printUsage() {
        System.err.println("Usage: java -jar trustforge.jar <command> [args]");
        System.err.println("  html <policy.md>                     Render a policy to themed HTML");
        System.err.println("  pdf <policy.md>                      Render a policy to themed PDF (xelatex required)");
        System.err.println("  index [out.csv] [policies-dir]       CSV index of policy front matter");
        System.err.println("  control-map [out.csv]                NIST CSF 2.0 control map CSV");
        System.err.println("  risk-export <risks.yaml> [out.csv]   Risk register CSV");
    }
}
