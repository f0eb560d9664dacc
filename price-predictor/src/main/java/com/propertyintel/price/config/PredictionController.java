package com.propertyintel.price.config;

import com.propertyintel.price.ingest.IngestionService;
import com.propertyintel.price.model.PricePrediction;
import com.propertyintel.price.model.PropertyType;
import com.propertyintel.price.service.PricePredictionService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.format.annotation.DateTimeFormat;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.time.LocalDate;
import java.util.Map;

@RestController
@Slf4j
@RequiredArgsConstructor
public class PredictionController {

    private final PricePredictionService predictionService;
    private final IngestionService ingestionService;

    // ── Prediction ────────────────────────────────────────────────────────────

    /**
     * Predict the sale price of a property.
     *
     * GET /predictions?latitude=52.2053&longitude=0.1218&date=2022-06-01&propertyType=D
     *
     * Trains a fresh model on sales within the configured window every time.
     * Failures are mapped by GlobalExceptionHandler; nothing is defaulted.
     */
    @GetMapping("/predictions")
    public ResponseEntity<PricePrediction> predict(
            @RequestParam double latitude,
            @RequestParam double longitude,
            @RequestParam @DateTimeFormat(iso = DateTimeFormat.ISO.DATE) LocalDate date,
            @RequestParam PropertyType propertyType) {
        return ResponseEntity.ok(predictionService.predict(latitude, longitude, date, propertyType));
    }

    // ── Ingestion triggers ────────────────────────────────────────────────────

    @PostMapping("/ingest/price-paid/{year}")
    public ResponseEntity<Map<String, String>> ingestYear(@PathVariable int year) {
        if (year < 1995 || year > LocalDate.now().getYear()) {
            return ResponseEntity.badRequest().body(Map.of("error", "year must be between 1995 and this year"));
        }
        new Thread(() -> ingestionService.loadPricePaidYear(year), "ingest-pp-" + year).start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "dataset", "pp-" + year));
    }

    @PostMapping("/ingest/postcodes")
    public ResponseEntity<Map<String, String>> ingestPostcodes() {
        new Thread(ingestionService::loadPostcodes, "ingest-postcodes").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "dataset", "postcodes"));
    }

    @PostMapping("/ingest/all")
    public ResponseEntity<Map<String, String>> ingestAll() {
        new Thread(ingestionService::loadAll, "ingest-all").start();
        return ResponseEntity.accepted().body(Map.of("status", "accepted", "dataset", "all"));
    }

    @GetMapping("/status")
    public ResponseEntity<Map<String, Object>> status() {
        return ResponseEntity.ok(Map.of(
                "service", "property-intel-price-predictor",
                "version", "1.0.0",
                "region", "England and Wales",
                "dataSource", "HM Land Registry price paid / open postcode geo / OpenStreetMap"
        ));
    }
}
