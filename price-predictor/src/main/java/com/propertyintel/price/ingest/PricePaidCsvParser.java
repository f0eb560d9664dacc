package com.propertyintel.price.ingest;

import com.propertyintel.price.model.PricePaidEntry;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.Reader;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.List;
import java.util.function.Consumer;

/**
 * Parses HM Land Registry price paid CSV files. The files have no header row.
 *
 * Columns: transaction id, price, date of transfer ("2021-06-25 00:00"), postcode,
 * property type, old/new, duration, PAON, SAON, street, locality, town/city,
 * district, county, PPD category type, record status
 */
@Component
@Slf4j
public class PricePaidCsvParser {

    private static final int COL_TRANSACTION_ID = 0;
    private static final int COL_PRICE          = 1;
    private static final int COL_DATE           = 2;
    private static final int COL_POSTCODE       = 3;
    private static final int COL_PROPERTY_TYPE  = 4;
    private static final int COL_OLD_NEW        = 5;
    private static final int COL_DURATION       = 6;
    private static final int COL_PAON           = 7;
    private static final int COL_SAON           = 8;
    private static final int COL_STREET         = 9;
    private static final int COL_LOCALITY       = 10;
    private static final int COL_TOWN_CITY      = 11;
    private static final int COL_DISTRICT       = 12;
    private static final int COL_COUNTY         = 13;
    private static final int COL_PPD_CATEGORY   = 14;
    private static final int COL_RECORD_STATUS  = 15;

    private static final int EXPECTED_COLUMNS = 16;

    public ParseStats parse(Reader source, int batchSize, Consumer<List<PricePaidEntry>> sink) throws IOException {
        ParseStats stats = CsvBatchReader.read(source, 0, batchSize, this::toEntry, sink);
        log.info("Parsed price paid data: {} rows, {} malformed/no-postcode skipped",
                stats.rowsParsed(), stats.rowsSkipped());
        return stats;
    }

    PricePaidEntry toEntry(String[] cols) {
        if (cols.length < EXPECTED_COLUMNS) return null;

        String postcode = cols[COL_POSTCODE].trim();
        // Transactions without a postcode can never be joined to coordinates
        if (postcode.isEmpty()) return null;

        Long price = parseLong(cols[COL_PRICE]);
        LocalDate date = parseDate(cols[COL_DATE]);
        if (price == null || date == null) return null;

        return PricePaidEntry.builder()
                .transactionId(cols[COL_TRANSACTION_ID].trim())
                .price(price)
                .dateOfTransfer(date)
                .postcode(postcode)
                .propertyType(cols[COL_PROPERTY_TYPE].trim())
                .newBuildFlag(cols[COL_OLD_NEW].trim())
                .tenureType(cols[COL_DURATION].trim())
                .primaryAddressableObjectName(cols[COL_PAON].trim())
                .secondaryAddressableObjectName(cols[COL_SAON].trim())
                .street(cols[COL_STREET].trim())
                .locality(cols[COL_LOCALITY].trim())
                .townCity(cols[COL_TOWN_CITY].trim())
                .district(cols[COL_DISTRICT].trim())
                .county(cols[COL_COUNTY].trim())
                .ppdCategoryType(cols[COL_PPD_CATEGORY].trim())
                .recordStatus(cols[COL_RECORD_STATUS].trim())
                .build();
    }

    private Long parseLong(String val) {
        if (val == null || val.isBlank()) return null;
        try { return Long.parseLong(val.trim()); } catch (NumberFormatException e) { return null; }
    }

    private LocalDate parseDate(String val) {
        if (val == null || val.isBlank()) return null;
        String datePart = val.trim().split(" ")[0];
        try { return LocalDate.parse(datePart); }
        catch (DateTimeParseException e) { return null; }
    }
}
