package org.dxworks.trustforge.export;

import org.dxworks.trustforge.error.ExportException;
import org.dxworks.trustforge.markdown.FrontMatterParser;
import org.dxworks.trustforge.model.PolicyMeta;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * One CSV row per policy file, built from front matter only.
 */
public final class PolicyIndexExporter {

    static final List<String> COLUMNS = List.of("file", "title", "version", "owner", "last_reviewed", "applies_to", "refs");

    private PolicyIndexExporter() {}

    public static Path export(Path policiesDir, Path outCsv) throws IOException {
        if (!Files.isDirectory(policiesDir)) {
            throw new ExportException(policiesDir.toString(), "Policies directory does not exist.");
        }

        List<Path> policies;
        try (Stream<Path> stream = Files.list(policiesDir)) {
            policies = stream.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(".md"))
                    .sorted()
                    .collect(Collectors.toList());
        }

        List<String[]> rows = new ArrayList<>();
        for (Path policy : policies) {
            PolicyMeta meta = FrontMatterParser.read(policy).meta();
            rows.add(new String[]{
                    policy.getFileName().toString(),
                    meta.title,
                    meta.version,
                    meta.owner,
                    meta.lastReviewed,
                    CsvTableWriter.joinList(meta.appliesTo),
                    CsvTableWriter.joinList(meta.refs)
            });
        }
        System.out.println("[PolicyIndexExporter] Indexed " + rows.size() + " policies from " + policiesDir);
        return CsvTableWriter.write(outCsv, COLUMNS, rows);
    }
}
