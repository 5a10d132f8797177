package org.dxworks.trustforge.export;

import com.fasterxml.jackson.databind.SequenceWriter;
import com.fasterxml.jackson.dataformat.csv.CsvGenerator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Writes a header row plus string rows as UTF-8 CSV. The header is always written, even when
 * there are no rows.
 */
final class CsvTableWriter {

    // quote only values that contain a separator, quote or line break
    private static final CsvMapper CSV_MAPPER = CsvMapper.builder()
            .enable(CsvGenerator.Feature.STRICT_CHECK_FOR_QUOTING)
            .build();

    private CsvTableWriter() {}

    static Path write(Path outCsv, List<String> header, List<String[]> rows) throws IOException {
        if (outCsv.toAbsolutePath().getParent() != null) {
            Files.createDirectories(outCsv.toAbsolutePath().getParent());
        }
        try (Writer out = Files.newBufferedWriter(outCsv, StandardCharsets.UTF_8);
             SequenceWriter csv = CSV_MAPPER.writer(CsvSchema.emptySchema()).writeValues(out)) {
            csv.write(header.toArray(new String[0]));
            for (String[] row : rows) {
                csv.write(row);
            }
        }
        return outCsv;
    }

    static String joinList(List<String> values) {
        return values == null ? "" : String.join(";", values);
    }

    static String nullToEmpty(String value) {
        return value == null ? "" : value;
    }
}
