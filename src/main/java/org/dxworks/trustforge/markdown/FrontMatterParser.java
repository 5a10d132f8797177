package org.dxworks.trustforge.markdown;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.dxworks.trustforge.error.FrontmatterException;
import org.dxworks.trustforge.model.ParsedPolicy;
import org.dxworks.trustforge.model.PolicyMeta;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Splits a policy file into its YAML front matter and Markdown body.
 */
public final class FrontMatterParser {

    // optional BOM, spaces after the dashes, \n or \r\n
    private static final Pattern FRONT_MATTER =
            Pattern.compile("^\\uFEFF?---[ \\t]*\\r?\\n(.*?)\\r?\\n---[ \\t]*(?:\\r?\\n|\\z)(.*)\\z", Pattern.DOTALL);

    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(DeserializationFeature.ACCEPT_SINGLE_VALUE_AS_ARRAY);

    private FrontMatterParser() {}

    public static ParsedPolicy read(Path policyPath) throws IOException {
        String text = Files.readString(policyPath, StandardCharsets.UTF_8);
        return parse(text, policyPath.toString());
    }

    public static ParsedPolicy parse(String text, String source) {
        Matcher matcher = FRONT_MATTER.matcher(text);
        if (!matcher.matches()) {
            throw new FrontmatterException(source,
                    "Missing or invalid frontmatter (--- ... ---) at top of file. "
                            + "Ensure the file begins with a YAML block delimited by '---' lines.");
        }

        PolicyMeta meta;
        try {
            meta = YAML_MAPPER.readValue(matcher.group(1), PolicyMeta.class);
        } catch (JsonProcessingException e) {
            throw new FrontmatterException(source, "Invalid YAML in frontmatter: " + e.getOriginalMessage(), e);
        }
        if (meta == null) {
            meta = new PolicyMeta();
        }
        validate(meta, source);
        return new ParsedPolicy(meta, matcher.group(2));
    }

    private static void validate(PolicyMeta meta, String source) {
        requireField("title", meta.title, source);
        requireField("version", meta.version, source);
        requireField("owner", meta.owner, source);
        requireField("last_reviewed", meta.lastReviewed, source);
        try {
            LocalDate.parse(meta.lastReviewed.strip());
        } catch (DateTimeParseException e) {
            throw new FrontmatterException(source,
                    "'last_reviewed' must be an ISO date like 2025-01-31 (got '" + meta.lastReviewed + "').", e);
        }
        meta.lastReviewed = meta.lastReviewed.strip();
    }

    private static void requireField(String name, String value, String source) {
        if (value == null || value.isBlank()) {
            throw new FrontmatterException(source, "Missing required frontmatter field '" + name + "'.");
        }
    }
}
