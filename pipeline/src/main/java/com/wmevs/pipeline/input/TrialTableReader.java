package com.wmevs.pipeline.input;

import com.fasterxml.jackson.databind.MappingIterator;
import com.fasterxml.jackson.dataformat.csv.CsvMapper;
import com.fasterxml.jackson.dataformat.csv.CsvParser;
import com.wmevs.pipeline.config.TrialFileConfig;
import com.wmevs.pipeline.trial.CueType;
import com.wmevs.pipeline.trial.Trial;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;

/**
 * Reads PsychoPy trial tables into {@link Trial}s. Columns are bound by header
 * name once per file; every file is checked completely before any trial is
 * returned.
 */
public class TrialTableReader {

    private static final Logger logger = LoggerFactory.getLogger(TrialTableReader.class);

    private static final Set<String> UNDEFINED_TOKENS = new HashSet<>(Arrays.asList("", "NA", "None", "NaN", "nan"));

    private final InputSchema schema;
    private final CsvMapper mapper;

    public TrialTableReader(InputSchema schema) {
        this.schema = schema;
        this.mapper = new CsvMapper();
        this.mapper.enable(CsvParser.Feature.WRAP_AS_ARRAY);
        this.mapper.enable(CsvParser.Feature.SKIP_EMPTY_LINES);
    }

    /**
     * Reads and concatenates the given files in order, renumbering trials
     * across files.
     */
    public List<Trial> read(List<TrialFileConfig> files, Function<String, Path> pathResolver) {
        List<Trial> trials = new ArrayList<>();
        for (TrialFileConfig file : files) {
            Path path = pathResolver.apply(file.path);
            List<Trial> fileTrials = read(path, file.skipLeadingRows, file.skipTrailingRows, trials.size());
            logger.info("Read {} trials from {}", fileTrials.size(), path);
            trials.addAll(fileTrials);
        }
        return trials;
    }

    public List<Trial> read(Path path, int skipLeadingRows, int skipTrailingRows, int firstOrdinal) {
        List<String[]> rows = readRows(path);
        if (rows.isEmpty()) {
            throw new InputSchemaException(path + " is empty, expected a header row");
        }
        Map<String, Integer> columns = bindColumns(path, rows.get(0));

        List<String[]> data = rows.subList(1, rows.size());
        if (skipLeadingRows + skipTrailingRows > data.size()) {
            throw new InputSchemaException(path + " has " + data.size() + " data rows, cannot skip "
                    + skipLeadingRows + " leading and " + skipTrailingRows + " trailing rows");
        }
        data = data.subList(skipLeadingRows, data.size() - skipTrailingRows);

        List<Trial> trials = new ArrayList<>(data.size());
        for (int i = 0; i < data.size(); i++) {
            // 1-based line number in the file, header included
            int line = skipLeadingRows + i + 2;
            trials.add(parseRow(new RowView(path, line, data.get(i), columns), firstOrdinal + i));
        }
        return trials;
    }

    private List<String[]> readRows(Path path) {
        if (!Files.isRegularFile(path)) {
            throw new InputSchemaException("Trial table not found: " + path);
        }
        try (MappingIterator<String[]> it = mapper.readerFor(String[].class).readValues(path.toFile())) {
            return it.readAll();
        } catch (IOException e) {
            throw new InputSchemaException("Failed to parse trial table " + path + ": " + e.getMessage(), e);
        }
    }

    private Map<String, Integer> bindColumns(Path path, String[] header) {
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < header.length; i++) {
            // first occurrence wins, the way R's read.csv keeps the unsuffixed name
            positions.putIfAbsent(header[i].trim(), i);
        }
        List<String> missing = new ArrayList<>();
        for (String column : schema.requiredColumns()) {
            if (!positions.containsKey(column)) {
                missing.add(column);
            }
        }
        if (!missing.isEmpty()) {
            throw new InputSchemaException(path + " is missing columns " + missing);
        }
        return positions;
    }

    private Trial parseRow(RowView row, int ordinal) {
        List<Integer> images = new ArrayList<>(schema.imageColumns.size());
        Integer firstImage = row.integer(schema.imageColumns.get(0));
        // an empty first slot marks a trial without a memory array
        if (firstImage != null) {
            for (String column : schema.imageColumns) {
                images.add(row.integer(column));
            }
        }

        Integer cueCode = row.integer(schema.cueTypeColumn);
        CueType cueType;
        try {
            cueType = cueCode == null ? null : CueType.fromCode(cueCode);
        } catch (IllegalArgumentException e) {
            throw row.error(schema.cueTypeColumn, e.getMessage());
        }

        Integer changeCode = row.integer(schema.changeColumn);
        Boolean change = null;
        if (changeCode != null) {
            if (changeCode != 0 && changeCode != 1) {
                throw row.error(schema.changeColumn, "expected 0 or 1, got " + changeCode);
            }
            change = changeCode == 1;
        }

        return new Trial(ordinal, images, cueType, row.integer(schema.cueLocationColumn), change,
                row.text(schema.responseKeyColumn), row.number(schema.responseTimeColumn),
                row.number(schema.memoryOnsetColumn), row.number(schema.testOnsetColumn));
    }

    private static class RowView {
        final Path path;
        final int line;
        final String[] cells;
        final Map<String, Integer> columns;

        RowView(Path path, int line, String[] cells, Map<String, Integer> columns) {
            this.path = path;
            this.line = line;
            this.cells = cells;
            this.columns = columns;
        }

        String text(String column) {
            int idx = columns.get(column);
            return idx < cells.length && cells[idx] != null ? cells[idx].trim() : "";
        }

        Double number(String column) {
            String raw = text(column);
            if (UNDEFINED_TOKENS.contains(raw)) {
                return null;
            }
            try {
                return Double.parseDouble(raw);
            } catch (NumberFormatException e) {
                throw error(column, "not a number: '" + raw + "'");
            }
        }

        Integer integer(String column) {
            Double value = number(column);
            if (value == null) {
                return null;
            }
            if (value != Math.rint(value)) {
                throw error(column, "expected a whole number, got " + value);
            }
            return value.intValue();
        }

        InputSchemaException error(String column, String detail) {
            return new InputSchemaException(path + " line " + line + ", column '" + column + "': " + detail);
        }
    }
}
