package com.propertyintel.price.store;

import com.propertyintel.price.exception.InvalidQueryException;
import com.propertyintel.price.exception.SourceConnectionException;
import com.propertyintel.price.model.BoundingBox;
import com.propertyintel.price.model.PriceRecord;
import com.propertyintel.price.model.SpatialQuery;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Reads price-paid transactions joined to postcode coordinates.
 *
 * The postcode match is exact and case-sensitive. Coordinate bounds are
 * inclusive; the date window is half-open [start, end). There is no retry:
 * a failed fetch aborts whatever pipeline asked for it.
 *
 * Both tables are ReplacingMergeTree and reloads leave duplicate rows until a
 * background merge runs, so each side is read with FINAL.
 */
@Repository
@Slf4j
@RequiredArgsConstructor
public class PricePaidRepository {

    static final String REGION_QUERY = """
        SELECT
            pp.price            AS price,
            pp.date_of_transfer AS date_of_transfer,
            pp.postcode         AS postcode,
            pp.property_type    AS property_type,
            pp.new_build_flag   AS new_build_flag,
            pp.tenure_type      AS tenure_type,
            pp.locality         AS locality,
            pp.town_city        AS town_city,
            pp.district         AS district,
            pp.county           AS county,
            pc.country          AS country,
            pc.latitude         AS latitude,
            pc.longitude        AS longitude,
            pp.db_id            AS row_id
        FROM pp_data AS pp FINAL
        INNER JOIN (
            SELECT postcode, country, latitude, longitude
            FROM postcode_data FINAL
        ) AS pc
            ON pp.postcode = pc.postcode
        WHERE
            pc.latitude <= ?
            AND pc.latitude >= ?
            AND pc.longitude <= ?
            AND pc.longitude >= ?
            AND pp.date_of_transfer >= ?
            AND pp.date_of_transfer < ?
        """;

    private final JdbcTemplate jdbcTemplate;
    private final PriceRecordRowMapper rowMapper = new PriceRecordRowMapper();

    /**
     * Fetch every joined record inside the box and date window.
     *
     * @throws InvalidQueryException     when the box or interval is malformed, or the store rejects the query
     * @throws SourceConnectionException when the store cannot be reached
     */
    public List<PriceRecord> fetch(SpatialQuery query) {
        checkQuery(query);
        BoundingBox bbox = query.bbox();

        log.info("Fetching price-paid records for bbox N{} S{} E{} W{}, {} to {}",
                bbox.north(), bbox.south(), bbox.east(), bbox.west(),
                query.startDate(), query.endDate());

        try {
            List<PriceRecord> records = jdbcTemplate.query(REGION_QUERY, rowMapper,
                    bbox.north(), bbox.south(), bbox.east(), bbox.west(),
                    query.startDate(), query.endDate());
            log.info("Fetched {} records", records.size());
            return records;

        } catch (DataAccessResourceFailureException e) {
            throw new SourceConnectionException("Record store unreachable: " + e.getMessage(), e);
        } catch (DataAccessException e) {
            throw new InvalidQueryException("Record store rejected region query: " + e.getMessage(), e);
        }
    }

    private void checkQuery(SpatialQuery query) {
        if (query == null || query.bbox() == null || query.startDate() == null || query.endDate() == null) {
            throw new InvalidQueryException("Region query requires a bounding box and both dates");
        }
        BoundingBox bbox = query.bbox();
        if (!bbox.isWellFormed()) {
            throw new InvalidQueryException(String.format(
                    "Malformed bounding box: north=%s south=%s east=%s west=%s",
                    bbox.north(), bbox.south(), bbox.east(), bbox.west()));
        }
        if (!query.startDate().isBefore(query.endDate())) {
            throw new InvalidQueryException(String.format(
                    "Start date %s must be before end date %s", query.startDate(), query.endDate()));
        }
    }
}
