package org.dxworks.trustforge.export;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;

public class ControlMapExporterTest {

    @TempDir
    Path tempDir;

    @Test
    void export_SeedCatalog() throws Exception {
        Path csv = ControlMapExporter.export(tempDir.resolve("maps/control_map.csv"));

        List<String> lines = Files.readAllLines(csv);
        assertEquals(6, lines.size());
        assertEquals("framework,function,category,control_id,title,description", lines.get(0));
        assertEquals("NIST CSF 2.0,IDENTIFY,GV,ID.GV-01,Governance program established,"
                + "\"Roles, responsibilities, and authorities established and communicated.\"", lines.get(1));
        assertEquals("NIST CSF 2.0,RECOVER,RC,RC.CO-01,Recovery planning,"
                + "Documented recovery plans are maintained and tested.", lines.get(5));
    }

    @Test
    void all_OneControlPerFunction() {
        assertEquals(List.of("IDENTIFY", "PROTECT", "DETECT", "RESPOND", "RECOVER"),
                NistCsf20Controls.all().stream().map(c -> c.function()).toList());
    }
}
