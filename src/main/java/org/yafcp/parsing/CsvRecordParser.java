package org.yafcp.parsing;

import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;
import org.yafcp.config.ParsingOptions;
import org.yafcp.plugin.ParseException;
import org.yafcp.plugin.RecordParser;

import java.io.IOException;
import java.io.StringReader;
import java.io.UncheckedIOException;
import java.nio.charset.Charset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * CSV implementation of {@link RecordParser} on top of Apache Commons CSV.
 * <p>
 * Rows shorter than the header are padded with empty strings; rows longer than the header are rejected as
 * malformed. A payload with a header and no data rows parses to an empty record set.
 * <p>
 * Header names are made unique: a blank name becomes {@code Unnamed: <index>} and a repeated name gets a
 * {@code .1}, {@code .2}, ... suffix, so every column keeps its own value in the row maps.
 */
public class CsvRecordParser implements RecordParser {

    private static final char BYTE_ORDER_MARK = '\uFEFF';

    @Override
    public RecordSet parse(String rawText, ParsingOptions options) throws ParseException {
        validate(options);
        if (rawText == null || rawText.isBlank()) {
            throw ParseException.malformed("No columns to parse from input", null);
        }
        final String text = stripByteOrderMark(rawText);

        CSVFormat format = csvFormat(options);
        try (CSVParser parser = format.parse(new StringReader(text))) {
            List<String> columns = new ArrayList<>();
            List<Map<String, String>> rows = new ArrayList<>();

            for (CSVRecord record : parser) {
                if (columns.isEmpty()) {
                    if (options.hasHeader()) {
                        columns.addAll(headerNames(record));
                        continue;
                    }
                    // headerless: name columns by position from the first record
                    for (int i = 0; i < record.size(); i++) columns.add(String.valueOf(i));
                }
                rows.add(toRow(columns, record));
            }
            if (columns.isEmpty()) throw ParseException.malformed("No columns to parse from input", null);
            return new RecordSet(columns, rows);
        } catch (IOException | UncheckedIOException | IllegalArgumentException | IllegalStateException e) {
            throw ParseException.malformed("Malformed CSV: " + e.getMessage(), e);
        }
    }

    private static String stripByteOrderMark(String text) {
        return !text.isEmpty() && text.charAt(0) == BYTE_ORDER_MARK ? text.substring(1) : text;
    }

    private static List<String> headerNames(CSVRecord header) {
        List<String> names = new ArrayList<>(header.size());
        Set<String> taken = new HashSet<>();
        Map<String, Integer> repeats = new HashMap<>();
        for (int i = 0; i < header.size(); i++) {
            String name = header.get(i).trim();
            if (name.isEmpty()) name = "Unnamed: " + i;
            String unique = name;
            while (taken.contains(unique)) {
                int n = repeats.merge(name, 1, Integer::sum);
                unique = name + "." + n;
            }
            taken.add(unique);
            names.add(unique);
        }
        return names;
    }

    private static Map<String, String> toRow(List<String> columns, CSVRecord record) throws ParseException {
        if (record.size() > columns.size()) {
            throw ParseException.malformed(String.format("Error tokenizing data. Expected %d fields in record %d, saw %d",
                    columns.size(), record.getRecordNumber(), record.size()), null);
        }
        Map<String, String> row = new LinkedHashMap<>();
        for (int i = 0; i < columns.size(); i++) {
            row.put(columns.get(i), i < record.size() ? record.get(i) : "");
        }
        return row;
    }

    private static CSVFormat csvFormat(ParsingOptions options) {
        CSVFormat.Builder builder = CSVFormat.DEFAULT.builder()
                .setDelimiter(options.delimiter().charAt(0))
                .setIgnoreSurroundingSpaces(true)
                .setIgnoreEmptyLines(true);
        return builder.build();
    }

    private static void validate(ParsingOptions options) throws ParseException {
        if (options == null) throw ParseException.unsupportedOptions("Parsing options cannot be null");
        try {
            if (!Charset.isSupported(options.encoding()))
                throw ParseException.unsupportedOptions("Unsupported encoding: " + options.encoding());
        } catch (IllegalArgumentException e) {
            throw ParseException.unsupportedOptions("Illegal encoding name: " + options.encoding());
        }
        if (options.delimiter().length() != 1)
            throw ParseException.unsupportedOptions("Delimiter must be a single character: '" + options.delimiter() + "'");
    }
}
