package org.yafcp.plugin;

import org.yafcp.config.ParsingOptions;
import org.yafcp.parsing.RecordSet;

/**
 * Turns raw text into a tabular record set. Must be deterministic for a given input and options, and must not
 * keep state between calls.
 */
@FunctionalInterface
public interface RecordParser {

    RecordSet parse(String rawText, ParsingOptions options) throws ParseException;
}
