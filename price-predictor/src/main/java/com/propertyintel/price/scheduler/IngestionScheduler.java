package com.propertyintel.price.scheduler;

import com.propertyintel.price.config.PricePredictorProperties;
import com.propertyintel.price.ingest.IngestionService;
import com.propertyintel.price.store.StoreWriter;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Startup hook for the store.
 *
 *  1. Always ensure the store tables exist
 *  2. Optionally load postcodes and the configured price paid years if RUN_ON_STARTUP=true
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class IngestionScheduler {

    private final IngestionService ingestionService;
    private final StoreWriter storeWriter;
    private final PricePredictorProperties properties;

    @PostConstruct
    public void onStartup() {
        try {
            storeWriter.ensureSchema();
        } catch (Exception e) {
            log.warn("Could not initialise store schema (store not reachable yet?): {}", e.getMessage());
        }

        if (properties.getIngestion().isRunOnStartup()) {
            log.info("RUN_ON_STARTUP=true, loading years {}", properties.getIngestion().getYears());
            try {
                ingestionService.loadAll();
            } catch (Exception e) {
                log.error("Startup load failed: {}", e.getMessage(), e);
            }
        } else {
            log.info("Predictor ready. Raw data loads are triggered through /ingest.");
        }
    }
}
