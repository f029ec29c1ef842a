package com.wmevs.pipeline.input;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.fasterxml.jackson.dataformat.csv.CsvSchema;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads tab-separated PsychoPy event logs and locates the main-task start.
 * Only needed for sessions recorded across several files; trial onsets are
 * taken from the trial table.
 */
public class EventLogReader {

    private final String marker;
    private final int markerColumn;
    private final CsvMapper mapper;

    public EventLogReader(String marker, int markerColumn) {
        this.marker = marker;
        this.markerColumn = markerColumn;
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Events logged after the first occurrence of the start marker.
     */
    public List<String[]> readTaskEvents(Path logFile) {
        List<String[]> rows = readRows(logFile);
        for (int i = 0; i < rows.size(); i++) {
            String[] row = rows.get(i);
            if (row.length > markerColumn && row[markerColumn] != null && marker.equals(row[markerColumn].trim())) {
                return rows.subList(i + 1, rows.size());
            }
        }
        throw new InputSchemaException("Task start marker '" + marker + "' not found in " + logFile);
    }

    private List<String[]> readRows(Path logFile) {
        if (!Files.isRegularFile(logFile)) {
            throw new InputSchemaException("Event log not found: " + logFile);
        }
        CsvSchema tsv = CsvSchema.emptySchema().withColumnSeparator('\t').withoutQuoteChar();
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).with(tsv).readValues(logFile.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new InputSchemaException("Failed to parse event log " + logFile + ": " + e.getMessage(), e);
        }
    }
}
