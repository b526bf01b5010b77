package com.identity.resolution.io;

import com.identity.resolution.core.model.SourceRecord;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Reads source records from CSV.
 *
 * <p>Expected format:</p>
 * <pre>
 * source_id,source_system,raw_name,reference_number,owner
 * crm-1,crm,"Gippsland Health Alliance - Imaging Upgrade",Q-1001,jdoe
 * </pre>
 *
 * <p>The header is required. {@code source_id} and {@code raw_name} columns must be
 * present; a missing {@code source_system} column falls back to the reader's default.
 * Other columns become record attributes. Fields may be quoted; a doubled quote inside
 * a quoted field is a literal quote.</p>
 */
public class CsvSourceRecordReader {
    private static final Logger log = LoggerFactory.getLogger(CsvSourceRecordReader.class);

    static final String SOURCE_ID = "source_id";
    static final String SOURCE_SYSTEM = "source_system";
    static final String RAW_NAME = "raw_name";
    static final String REFERENCE_NUMBER = "reference_number";

    private final String defaultSourceSystem;

    public CsvSourceRecordReader() {
        this(null);
    }

    public CsvSourceRecordReader(String defaultSourceSystem) {
        this.defaultSourceSystem = defaultSourceSystem;
    }

    public List<SourceRecord> read(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader);
        }
    }

    /**
     * @throws IllegalArgumentException if the header lacks {@code source_id} or {@code raw_name}
     */
    public List<SourceRecord> read(Reader reader) throws IOException {
        BufferedReader br = reader instanceof BufferedReader b ? b : new BufferedReader(reader);
        String headerLine = br.readLine();
        if (headerLine == null) {
            return List.of();
        }
        List<String> header = parseLine(stripBom(headerLine)).stream()
                .map(h -> h.trim().toLowerCase(Locale.ROOT))
                .toList();
        int idColumn = header.indexOf(SOURCE_ID);
        int nameColumn = header.indexOf(RAW_NAME);
        if (idColumn < 0 || nameColumn < 0) {
            throw new IllegalArgumentException("CSV header must contain " + SOURCE_ID + " and " + RAW_NAME
                    + ", was " + header);
        }
        int systemColumn = header.indexOf(SOURCE_SYSTEM);
        int referenceColumn = header.indexOf(REFERENCE_NUMBER);

        List<SourceRecord> records = new ArrayList<>();
        String line;
        long lineNumber = 1;
        while ((line = br.readLine()) != null) {
            lineNumber++;
            if (line.isBlank()) {
                continue;
            }
            List<String> fields = parseLine(line);
            String sourceId = field(fields, idColumn);
            if (sourceId == null) {
                log.warn("csv.row.skipped line={} reason=missing-source-id", lineNumber);
                continue;
            }
            Map<String, String> attributes = new LinkedHashMap<>();
            for (int i = 0; i < header.size(); i++) {
                if (i == idColumn || i == nameColumn || i == systemColumn || i == referenceColumn) {
                    continue;
                }
                String value = field(fields, i);
                if (value != null && !header.get(i).isEmpty()) {
                    attributes.put(header.get(i), value);
                }
            }
            String system = systemColumn >= 0 ? field(fields, systemColumn) : null;
            records.add(new SourceRecord(
                    sourceId,
                    system != null ? system : defaultSourceSystem,
                    nameColumn < fields.size() ? fields.get(nameColumn) : null,
                    referenceColumn >= 0 ? field(fields, referenceColumn) : null,
                    attributes));
        }
        log.debug("csv.read records={} lines={}", records.size(), lineNumber);
        return records;
    }

    /**
     * Trimmed value, or null when the column is missing or blank.
     */
    private static String field(List<String> fields, int index) {
        if (index < 0 || index >= fields.size()) {
            return null;
        }
        String value = fields.get(index).trim();
        return value.isEmpty() ? null : value;
    }

    static List<String> parseLine(String line) {
        List<String> fields = new ArrayList<>();
        StringBuilder current = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (quoted) {
                if (c == '"') {
                    if (i + 1 < line.length() && line.charAt(i + 1) == '"') {
                        current.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    current.append(c);
                }
            } else if (c == '"') {
                quoted = true;
            } else if (c == ',') {
                fields.add(current.toString());
                current.setLength(0);
            } else {
                current.append(c);
            }
        }
        fields.add(current.toString());
        return fields;
    }

    private static String stripBom(String s) {
        return !s.isEmpty() && s.charAt(0) == '\uFEFF' ? s.substring(1) : s;
    }
}
