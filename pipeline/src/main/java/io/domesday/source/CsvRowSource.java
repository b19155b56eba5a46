package io.domesday.source;

import io.domesday.core.Record;
import io.domesday.core.Source;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;

/**
 * Streams a headerless delimited text input as one record per row, the payload being the raw
 * field values in column order. Quoted fields are honoured; nothing is trimmed. The row width is
 * not checked here, so rows with stray delimiters come through wider than the schema.
 */
public class CsvRowSource implements Source<List<String>> {
    public static final CSVFormat FORMAT = CSVFormat.DEFAULT.builder()
            .setIgnoreSurroundingSpaces(false)
            .setIgnoreEmptyLines(true)
            .build();

    private final CSVParser parser;
    private final Iterator<CSVRecord> rows;
    private long seq = 0;

    public CsvRowSource(Reader reader) throws IOException {
        this(reader, FORMAT);
    }

    public CsvRowSource(Reader reader, CSVFormat format) throws IOException {
        this.parser = CSVParser.parse(reader, format);
        this.rows = parser.iterator();
    }

    @Override
    public Optional<Record<List<String>>> poll() throws IOException {
        try {
            if (!rows.hasNext()) return Optional.empty();
            CSVRecord row = rows.next();
            return Optional.of(Record.of(seq++, row.toList()));
        } catch (UncheckedIOException e) {
            throw e.getCause();
        }
    }

    @Override
    public boolean isFinished() {
        return !rows.hasNext();
    }

    /** Number of rows emitted so far. */
    public long rowsRead() {
        return seq;
    }

    @Override
    public void close() throws IOException {
        parser.close();
    }
}
