package org.yafcp.parsing;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Parsed table: ordered column names and rows keyed by column name, in column order.
 */
public record RecordSet(List<String> columns, List<Map<String, String>> rows) {

    public static final int PREVIEW_FIELDS = 5;

    public RecordSet {
        columns = List.copyOf(columns);
        List<Map<String, String>> copy = new ArrayList<>(rows.size());
        for (Map<String, String> row : rows) {
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        rows = Collections.unmodifiableList(copy);
    }

    public int rowCount() {
        return rows.size();
    }

    /**
     * First {@code maxFields} fields of the first row, in column order.
     *
     * @throws IllegalStateException if the record set has no rows
     */
    public Map<String, String> firstRowPreview(int maxFields) {
        if (rows.isEmpty()) throw new IllegalStateException("Record set has no rows to preview");
        Map<String, String> preview = new LinkedHashMap<>();
        for (Map.Entry<String, String> e : rows.get(0).entrySet()) {
            if (preview.size() >= maxFields) break;
            preview.put(e.getKey(), e.getValue());
        }
        return preview;
    }

    public Map<String, String> firstRowPreview() {
        return firstRowPreview(PREVIEW_FIELDS);
    }
}
