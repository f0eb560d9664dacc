package com.propertyintel.price.ingest;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvValidationException;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * Streams a CSV through opencsv and hands parsed rows to a sink in fixed-size batches,
 * so a multi-million-row file never has to sit in memory at once.
 */
@Slf4j
final class CsvBatchReader {

    private CsvBatchReader() {
    }

    /**
     * @param mapper returns null for a row that should be skipped
     */
    static <T> ParseStats read(Reader source, int skipLines, int batchSize,
                               Function<String[], T> mapper, Consumer<List<T>> sink) throws IOException {
        int read = 0;
        int parsed = 0;
        int skipped = 0;
        List<T> batch = new ArrayList<>(batchSize);

        // RFC 4180 parsing: no escape character, so literal backslashes such as \N survive
        try (CSVReader reader = new CSVReaderBuilder(source)
                .withCSVParser(new RFC4180ParserBuilder().build())
                .withSkipLines(skipLines)
                .build()) {
            String[] cols;
            while ((cols = reader.readNext()) != null) {
                read++;
                T row = mapper.apply(cols);
                if (row == null) {
                    skipped++;
                    continue;
                }
                batch.add(row);
                parsed++;
                if (batch.size() >= batchSize) {
                    sink.accept(List.copyOf(batch));
                    batch.clear();
                }
            }
        } catch (CsvValidationException e) {
            throw new IOException("Malformed CSV after " + read + " rows: " + e.getMessage(), e);
        }

        if (!batch.isEmpty()) {
            sink.accept(List.copyOf(batch));
        }
        log.debug("Read {} rows, parsed {}, skipped {}", read, parsed, skipped);
        return new ParseStats(read, parsed, skipped);
    }
}
