package com.propertyintel.price.store;

import com.propertyintel.price.model.IngestionRun;
import com.propertyintel.price.model.PostcodeEntry;
import com.propertyintel.price.model.PricePaidEntry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

import java.sql.Timestamp;
import java.util.List;
import java.util.function.Function;

/**
 * Owns the store tables: creates them and loads raw price-paid and postcode rows.
 *
 * db_id is derived from the Land Registry transaction id, so reloading a year
 * produces the same ids. ReplacingMergeTree only collapses the duplicates when
 * parts merge, so readers must query with FINAL.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class StoreWriter {

    static final String INSERT_PRICE_PAID = """
        INSERT INTO pp_data
        (transaction_unique_identifier, price, date_of_transfer, postcode, property_type,
         new_build_flag, tenure_type, primary_addressable_object_name,
         secondary_addressable_object_name, street, locality, town_city, district, county,
         ppd_category_type, record_status)
        VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
        """;

    static final String INSERT_POSTCODE = """
        INSERT INTO postcode_data
        (postcode, status, usertype, easting, northing, positional_quality_indicator, country,
         latitude, longitude, postcode_no_space, postcode_fixed_width_seven,
         postcode_fixed_width_eight, postcode_area, postcode_district, postcode_sector,
         outcode, incode)
        VALUES (?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?,?)
        """;

    private final JdbcTemplate jdbcTemplate;

    public void ensureSchema() {
        log.info("Ensuring store schema exists...");

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS pp_data
            (
                transaction_unique_identifier       String,
                price                               UInt32,
                date_of_transfer                    Date,
                postcode                            String,
                property_type                       LowCardinality(String),
                new_build_flag                      LowCardinality(String),
                tenure_type                         LowCardinality(String),
                primary_addressable_object_name     String,
                secondary_addressable_object_name   String,
                street                              String,
                locality                            String,
                town_city                           String,
                district                            String,
                county                              String,
                ppd_category_type                   LowCardinality(String),
                record_status                       LowCardinality(String),
                db_id                               Int64 DEFAULT toInt64(cityHash64(transaction_unique_identifier))
            )
            ENGINE = ReplacingMergeTree()
            PARTITION BY toYear(date_of_transfer)
            ORDER BY (postcode, date_of_transfer, db_id)
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS postcode_data
            (
                postcode                        String,
                status                          LowCardinality(String),
                usertype                        LowCardinality(String),
                easting                         Nullable(UInt32),
                northing                        Nullable(UInt32),
                positional_quality_indicator    Int32,
                country                         LowCardinality(String),
                latitude                        Decimal(11, 8),
                longitude                       Decimal(10, 8),
                postcode_no_space               String,
                postcode_fixed_width_seven      String,
                postcode_fixed_width_eight      String,
                postcode_area                   LowCardinality(String),
                postcode_district               String,
                postcode_sector                 String,
                outcode                         String,
                incode                          String
            )
            ENGINE = ReplacingMergeTree()
            ORDER BY postcode
        """);

        jdbcTemplate.execute("""
            CREATE TABLE IF NOT EXISTS ingestion_runs
            (
                run_id          String,
                dataset         LowCardinality(String),
                started_at      DateTime,
                completed_at    Nullable(DateTime),
                status          LowCardinality(String),
                rows_found      Int32,
                rows_written    Int32,
                rows_skipped    Int32,
                error_message   Nullable(String)
            )
            ENGINE = MergeTree()
            ORDER BY (started_at, dataset)
        """);

        log.info("Store schema ready.");
    }

    public void writePricePaid(List<PricePaidEntry> entries, int batchSize) {
        writeInBatches("pp_data", INSERT_PRICE_PAID, entries, batchSize, e -> new Object[]{
                e.getTransactionId(),
                e.getPrice(),
                e.getDateOfTransfer(),
                e.getPostcode(),
                e.getPropertyType(),
                e.getNewBuildFlag(),
                e.getTenureType(),
                str(e.getPrimaryAddressableObjectName()),
                str(e.getSecondaryAddressableObjectName()),
                str(e.getStreet()),
                str(e.getLocality()),
                str(e.getTownCity()),
                str(e.getDistrict()),
                str(e.getCounty()),
                str(e.getPpdCategoryType()),
                str(e.getRecordStatus())
        });
    }

    public void writePostcodes(List<PostcodeEntry> entries, int batchSize) {
        writeInBatches("postcode_data", INSERT_POSTCODE, entries, batchSize, e -> new Object[]{
                e.getPostcode(),
                e.getStatus(),
                e.getUsertype(),
                e.getEasting(),
                e.getNorthing(),
                e.getPositionalQualityIndicator(),
                e.getCountry(),
                e.getLatitude(),
                e.getLongitude(),
                str(e.getPostcodeNoSpace()),
                str(e.getPostcodeFixedWidthSeven()),
                str(e.getPostcodeFixedWidthEight()),
                str(e.getPostcodeArea()),
                str(e.getPostcodeDistrict()),
                str(e.getPostcodeSector()),
                str(e.getOutcode()),
                str(e.getIncode())
        });
    }

    public void writeIngestionRun(IngestionRun run) {
        try {
            jdbcTemplate.update("""
                INSERT INTO ingestion_runs
                (run_id, dataset, started_at, completed_at, status,
                 rows_found, rows_written, rows_skipped, error_message)
                VALUES (?,?,?,?,?,?,?,?,?)
                """,
                    run.getRunId(),
                    run.getDataset(),
                    Timestamp.valueOf(run.getStartedAt()),
                    run.getCompletedAt() != null ? Timestamp.valueOf(run.getCompletedAt()) : null,
                    run.getStatus(),
                    run.getRowsFound(),
                    run.getRowsWritten(),
                    run.getRowsSkipped(),
                    run.getErrorMessage());
        } catch (Exception e) {
            log.warn("Failed to write ingestion run {}: {}", run.getRunId(), e.getMessage());
        }
    }

    private <T> void writeInBatches(String table, String sql, List<T> rows, int batchSize,
                                    Function<T, Object[]> toArgs) {
        if (rows.isEmpty()) return;

        int total = rows.size();
        log.info("Writing {} rows to {} in batches of {}", total, table, batchSize);

        for (int i = 0; i < total; i += batchSize) {
            List<Object[]> batch = rows.subList(i, Math.min(i + batchSize, total)).stream()
                    .map(toArgs)
                    .toList();
            try {
                jdbcTemplate.batchUpdate(sql, batch);
                log.debug("Wrote batch {}/{}", Math.min(i + batchSize, total), total);
            } catch (Exception e) {
                log.error("Batch write to {} failed at offset {}: {}", table, i, e.getMessage(), e);
                throw e;
            }
        }

        log.info("Successfully wrote {} rows to {}", total, table);
    }

    private String str(String val) {
        return val == null ? "" : val;
    }
}
