package org.dxworks.trustforge.export;

import org.dxworks.trustforge.model.CsfControl;

import java.io.IOException;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

public final class ControlMapExporter {

    static final List<String> COLUMNS = List.of("framework", "function", "category", "control_id", "title", "description");

    private ControlMapExporter() {}

    public static Path export(Path outCsv) throws IOException {
        return export(outCsv, NistCsf20Controls.all());
    }

    public static Path export(Path outCsv, List<CsfControl> controls) throws IOException {
        List<String[]> rows = new ArrayList<>();
        for (CsfControl control : controls) {
            rows.add(new String[]{
                    NistCsf20Controls.FRAMEWORK,
                    control.function(),
                    control.category(),
                    control.subcategoryId(),
                    control.title(),
                    control.description()
            });
        }
        return CsvTableWriter.write(outCsv, COLUMNS, rows);
    }
}
