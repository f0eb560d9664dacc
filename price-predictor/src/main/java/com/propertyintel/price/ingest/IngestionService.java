package com.propertyintel.price.ingest;

import com.propertyintel.price.config.PricePredictorProperties;
import com.propertyintel.price.model.IngestionRun;
import com.propertyintel.price.store.StoreWriter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.LocalDateTime;
import java.util.List;
import java.util.UUID;

/**
 * Loads the raw datasets into the store: download (cached), parse, write in batches.
 *
 * Each dataset load is recorded as an {@link IngestionRun}. Failures are logged and
 * recorded on the run rather than thrown, since loads run in the background.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class IngestionService {

    private final PricePaidDownloader downloader;
    private final PricePaidCsvParser pricePaidParser;
    private final PostcodeCsvParser postcodeParser;
    private final StoreWriter storeWriter;
    private final PricePredictorProperties properties;

    /**
     * Postcodes first, then every configured year. This is the full backfill entry point.
     */
    public void loadAll() {
        List<Integer> years = properties.getIngestion().getYears();
        log.info("Starting full load: postcodes and price paid years {}", years);
        loadPostcodes();
        years.forEach(this::loadPricePaidYear);
        log.info("Full load complete.");
    }

    public IngestionRun loadPricePaidYear(int year) {
        int batchSize = properties.getIngestion().getBatchSize();
        return track("pp-" + year, run -> {
            Path file = downloader.downloadPricePaidYear(year);
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                return pricePaidParser.parse(reader, batchSize, batch -> {
                    storeWriter.writePricePaid(batch, batchSize);
                    run.setRowsWritten(run.getRowsWritten() + batch.size());
                });
            }
        });
    }

    public IngestionRun loadPostcodes() {
        int batchSize = properties.getIngestion().getBatchSize();
        return track("postcodes", run -> {
            Path file = downloader.downloadPostcodeData();
            try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
                return postcodeParser.parse(reader, batchSize, batch -> {
                    storeWriter.writePostcodes(batch, batchSize);
                    run.setRowsWritten(run.getRowsWritten() + batch.size());
                });
            }
        });
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    @FunctionalInterface
    interface Load {
        ParseStats run(IngestionRun run) throws Exception;
    }

    private IngestionRun track(String dataset, Load load) {
        IngestionRun run = IngestionRun.builder()
                .runId(UUID.randomUUID().toString())
                .dataset(dataset)
                .startedAt(LocalDateTime.now())
                .status("RUNNING")
                .build();

        log.info("Loading {} (run {})", dataset, run.getRunId());
        try {
            ParseStats stats = load.run(run);
            run.setRowsFound(stats.rowsRead());
            run.setRowsSkipped(stats.rowsSkipped());
            run.setStatus("SUCCESS");
            log.info("Loaded {}: {} rows written, {} skipped", dataset, run.getRowsWritten(), stats.rowsSkipped());

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.error("Load of {} interrupted", dataset);
            run.setStatus("FAILED");
            run.setErrorMessage("interrupted");
        } catch (Exception e) {
            log.error("Failed loading {}: {}", dataset, e.getMessage(), e);
            run.setStatus("FAILED");
            run.setErrorMessage(e.getMessage());
        } finally {
            run.setCompletedAt(LocalDateTime.now());
            storeWriter.writeIngestionRun(run);
        }
        return run;
    }
}
