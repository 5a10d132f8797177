package org.dxworks.trustforge.export;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.trustforge.error.ExportException;
import org.dxworks.trustforge.model.risk.RiskItem;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.List;

/**
 * Risk register: a YAML list of risks in, a flat CSV out.
 */
public final class RiskRegister {

    static final List<String> COLUMNS = List.of("id", "title", "description", "severity", "likelihood",
            "owner", "status", "treatment", "target_date", "control_refs");

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);

    private RiskRegister() {}

    public static List<RiskItem> load(Path risksYaml) throws IOException {
        String yaml = Files.readString(risksYaml, StandardCharsets.UTF_8);
        if (yaml.isBlank()) {
            return List.of();
        }
        List<RiskItem> risks;
        try {
            risks = YAML_MAPPER.readValue(yaml, new TypeReference<List<RiskItem>>() {});
        } catch (JsonProcessingException e) {
            throw new ExportException(risksYaml.toString(), "Invalid risk register: " + e.getOriginalMessage(), e);
        }
        if (risks == null) {
            return List.of();
        }
        for (int i = 0; i < risks.size(); i++) {
            validate(risks.get(i), i, risksYaml);
        }
        return risks;
    }

    private static void validate(RiskItem risk, int index, Path source) {
        String where = "risk #" + (index + 1);
        if (risk == null) {
            throw new ExportException(source.toString(), where + " is empty.");
        }
        if (risk.id == null || risk.id.isBlank()) {
            throw new ExportException(source.toString(), where + " is missing 'id'.");
        }
        where = "risk " + risk.id;
        if (risk.title == null || risk.title.isBlank()) {
            throw new ExportException(source.toString(), where + " is missing 'title'.");
        }
        if (risk.severity == null) {
            throw new ExportException(source.toString(), where + " is missing 'severity'.");
        }
        if (risk.likelihood == null) {
            throw new ExportException(source.toString(), where + " is missing 'likelihood'.");
        }
        if (risk.description == null) {
            risk.description = "";
        }
        if (risk.targetDate != null) {
            try {
                LocalDate.parse(risk.targetDate);
            } catch (DateTimeParseException e) {
                throw new ExportException(source.toString(),
                        where + " has a 'target_date' that is not an ISO date: " + risk.targetDate, e);
            }
        }
    }

    public static Path writeCsv(Path outCsv, List<RiskItem> risks) throws IOException {
        List<String[]> rows = new ArrayList<>();
        for (RiskItem risk : risks) {
            rows.add(new String[]{
                    risk.id,
                    risk.title,
                    CsvTableWriter.nullToEmpty(risk.description),
                    risk.severity.getLabel(),
                    risk.likelihood.getLabel(),
                    risk.owner,
                    risk.status.getLabel(),
                    risk.treatment.getLabel(),
                    CsvTableWriter.nullToEmpty(risk.targetDate),
                    CsvTableWriter.joinList(risk.controlRefs)
            });
        }
        return CsvTableWriter.write(outCsv, COLUMNS, rows);
    }

    public static Path export(Path risksYaml, Path outCsv) throws IOException {
        List<RiskItem> risks = load(risksYaml);
        System.out.println("[RiskRegister] Loaded " + risks.size() + " risks from " + risksYaml);
        return writeCsv(outCsv, risks);
    }
}
