package org.yafcp.config;

/**
 * Options handed to the record parser for every payload.
 *
 * @param encoding  charset name used to decode fetched bytes, e.g. {@code utf-8}
 * @param delimiter single field separator character
 * @param hasHeader whether the first record names the columns; if not, columns are named {@code 0, 1, 2, ...}
 */
public record ParsingOptions(String encoding, String delimiter, Boolean hasHeader) {

    public static final String DEFAULT_ENCODING = "utf-8";
    public static final String DEFAULT_DELIMITER = ",";

    public ParsingOptions {
        encoding = encoding != null && !encoding.isBlank() ? encoding.trim() : DEFAULT_ENCODING;
        delimiter = delimiter != null && !delimiter.isEmpty() ? delimiter : DEFAULT_DELIMITER;
        hasHeader = hasHeader != null ? hasHeader : Boolean.TRUE;
    }

    public static ParsingOptions defaults() {
        return new ParsingOptions(null, null, null);
    }
}
