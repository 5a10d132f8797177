package org.dxworks.trustforge.markdown;

import org.dxworks.trustforge.error.FrontmatterException;
import org.dxworks.trustforge.model.ParsedPolicy;
import org.junit.jupiter.api.Test;

import java.nio.file.Paths;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

public class FrontMatterParserTest {

    private static final String VALID = "---\n"
            + "title: Acceptable Use\n"
            + "version: 1.0\n"
            + "owner: IT\n"
            + "last_reviewed: 2025-01-31\n"
            + "---\n"
            + "# Body\n";

    @Test
    void parse_ReadsMetaAndBody() {
        ParsedPolicy policy = FrontMatterParser.parse(VALID, "aup.md");

        assertEquals("Acceptable Use", policy.meta().title);
        assertEquals("1.0", policy.meta().version);
        assertEquals("IT", policy.meta().owner);
        assertEquals("2025-01-31", policy.meta().lastReviewed);
        assertNull(policy.meta().appliesTo);
        assertEquals("# Body\n", policy.body());
    }

    @Test
    void parse_ToleratesBomAndCrLf() {
        ParsedPolicy policy = FrontMatterParser.parse("\uFEFF" + VALID.replace("\n", "\r\n"), "aup.md");

        assertEquals("Acceptable Use", policy.meta().title);
        assertEquals("# Body\r\n", policy.body());
    }

    @Test
    void parse_SingleValueListBecomesList() {
        ParsedPolicy policy = FrontMatterParser.parse(VALID.replace("owner: IT\n", "owner: IT\napplies_to: Staff\n"), "aup.md");

        assertEquals(List.of("Staff"), policy.meta().appliesTo);
    }

    @Test
    void parse_MissingBlockNamesSource() {
        FrontmatterException e = assertThrows(FrontmatterException.class,
                () -> FrontMatterParser.parse("# No front matter", "plain.md"));

        assertTrue(e.getMessage().startsWith("plain.md"));
    }

    @Test
    void parse_MissingRequiredField() {
        FrontmatterException e = assertThrows(FrontmatterException.class,
                () -> FrontMatterParser.parse(VALID.replace("owner: IT\n", ""), "aup.md"));

        assertTrue(e.getMessage().contains("owner"));
    }

    @Test
    void parse_RejectsNonIsoDate() {
        assertThrows(FrontmatterException.class,
                () -> FrontMatterParser.parse(VALID.replace("2025-01-31", "31/01/2025"), "aup.md"));
    }

    @Test
    void parse_RejectsBrokenYaml() {
        assertThrows(FrontmatterException.class,
                () -> FrontMatterParser.parse("---\ntitle: [unclosed\n---\nbody", "broken.md"));
    }

    @Test
    void read_SamplePolicy() throws Exception {
        ParsedPolicy policy = FrontMatterParser.read(Paths.get("src/test/resources/samples/policies/access-control.md"));

        assertEquals("Access Control Policy", policy.meta().title);
        assertEquals(List.of("Employees", "Contractors"), policy.meta().appliesTo);
        assertEquals("Who gets in, and how", policy.meta().subtitle);
    }
}
