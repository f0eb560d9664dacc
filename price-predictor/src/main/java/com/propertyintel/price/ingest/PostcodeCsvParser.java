package com.propertyintel.price.ingest;

import com.propertyintel.price.model.PostcodeEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.util.List;
import java.util.function.Consumer;

/**
 * Parses the open postcode geo CSV (no header row).
 *
 * Columns: postcode, status, usertype, easting, northing, positional quality,
 * country, latitude, longitude, postcode without space, fixed width 7, fixed width 8,
 * area, district, sector, outcode, incode
 *
 * Terminated and unlocated postcodes carry "\N" or blanks instead of coordinates;
 * those rows are skipped because they cannot take part in a spatial query.
 */
@Component
@Slf4j
public class PostcodeCsvParser {

    private static final int COL_POSTCODE   = 0;
    private static final int COL_STATUS     = 1;
    private static final int COL_USERTYPE   = 2;
    private static final int COL_EASTING    = 3;
    private static final int COL_NORTHING   = 4;
    private static final int COL_QUALITY    = 5;
    private static final int COL_COUNTRY    = 6;
    private static final int COL_LATITUDE   = 7;
    private static final int COL_LONGITUDE  = 8;
    private static final int COL_NO_SPACE   = 9;
    private static final int COL_FIXED_7    = 10;
    private static final int COL_FIXED_8    = 11;
    private static final int COL_AREA       = 12;
    private static final int COL_DISTRICT   = 13;
    private static final int COL_SECTOR     = 14;
    private static final int COL_OUTCODE    = 15;
    private static final int COL_INCODE     = 16;

    private static final int EXPECTED_COLUMNS = 17;

    public ParseStats parse(Reader source, int batchSize, Consumer<List<PostcodeEntry>> sink) throws IOException {
        ParseStats stats = CsvBatchReader.read(source, 0, batchSize, this::toEntry, sink);
        log.info("Parsed postcode data: {} rows, {} without coordinates skipped",
                stats.rowsParsed(), stats.rowsSkipped());
        return stats;
    }

    PostcodeEntry toEntry(String[] cols) {
        if (cols.length < EXPECTED_COLUMNS) return null;

        Double lat = parseDouble(cols[COL_LATITUDE]);
        Double lng = parseDouble(cols[COL_LONGITUDE]);
        if (lat == null || lng == null) return null;

        Integer quality = parseInt(cols[COL_QUALITY]);

        return PostcodeEntry.builder()
                .postcode(cols[COL_POSTCODE].trim())
                .status(cols[COL_STATUS].trim())
                .usertype(cols[COL_USERTYPE].trim())
                .easting(parseInt(cols[COL_EASTING]))
                .northing(parseInt(cols[COL_NORTHING]))
                .positionalQualityIndicator(quality == null ? 0 : quality)
                .country(cols[COL_COUNTRY].trim())
                .latitude(lat)
                .longitude(lng)
                .postcodeNoSpace(cols[COL_NO_SPACE].trim())
                .postcodeFixedWidthSeven(cols[COL_FIXED_7].trim())
                .postcodeFixedWidthEight(cols[COL_FIXED_8].trim())
                .postcodeArea(cols[COL_AREA].trim())
                .postcodeDistrict(cols[COL_DISTRICT].trim())
                .postcodeSector(cols[COL_SECTOR].trim())
                .outcode(cols[COL_OUTCODE].trim())
                .incode(cols[COL_INCODE].trim())
                .build();
    }

    private Double parseDouble(String val) {
        if (isMissing(val)) return null;
        try { return Double.parseDouble(val.trim()); } catch (NumberFormatException e) { return null; }
    }

    private Integer parseInt(String val) {
        if (isMissing(val)) return null;
        try { return Integer.parseInt(val.trim()); } catch (NumberFormatException e) { return null; }
    }

    private boolean isMissing(String val) {
        return val == null || val.isBlank() || "\\N".equals(val.trim());
    }
}
