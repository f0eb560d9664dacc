package com.propertyintel.price.assess;

import com.propertyintel.price.model.PriceRecord;

import java.time.LocalDate;
import java.util.List;
import java.util.Set;
import java.util.function.Predicate;

/**
 * Ordered set of column rules a price-record dataset must satisfy.
 *
 * {@link #pricePaid()} is the ruleset for the joined price-paid/postcode data;
 * it is wired as a bean so tests and alternative datasets can supply their own.
 */
public record RecordSchema(String name, List<ColumnRule> rules) {

    public static final LocalDate EARLIEST_TRANSFER = LocalDate.of(2018, 1, 1);
    public static final LocalDate TRANSFER_CUTOFF = LocalDate.of(2023, 1, 1);

    public RecordSchema {
        rules = List.copyOf(rules);
    }

    public static RecordSchema pricePaid() {
        return new RecordSchema("prices-coordinates", List.of(
                ColumnRule.required("price", Long.class, PriceRecord::getPrice)
                        .withCheck(v -> (Long) v >= 0 && (Long) v < 1_000_000_000L, "in range [0, 1000000000)"),
                ColumnRule.required("date_of_transfer", LocalDate.class, PriceRecord::getDateOfTransfer)
                        .withCheck(v -> !((LocalDate) v).isBefore(EARLIEST_TRANSFER)
                                        && ((LocalDate) v).isBefore(TRANSFER_CUTOFF),
                                "in range [" + EARLIEST_TRANSFER + ", " + TRANSFER_CUTOFF + ")"),
                ColumnRule.required("postcode", String.class, PriceRecord::getPostcode)
                        .withCheck(v -> ((String) v).length() <= 8, "length <= 8"),
                ColumnRule.required("property_type", String.class, PriceRecord::getPropertyType)
                        .withCheck(oneOf(Set.of("F", "S", "D", "T", "O")), "isin [F, S, D, T, O]"),
                ColumnRule.required("new_build_flag", String.class, PriceRecord::getNewBuildFlag)
                        .withCheck(oneOf(Set.of("Y", "N")), "isin [Y, N]"),
                ColumnRule.required("tenure_type", String.class, PriceRecord::getTenureType)
                        .withCheck(oneOf(Set.of("F", "L")), "isin [F, L]"),
                ColumnRule.optional("locality", String.class, PriceRecord::getLocality),
                ColumnRule.required("town_city", String.class, PriceRecord::getTownCity),
                ColumnRule.optional("district", String.class, PriceRecord::getDistrict),
                ColumnRule.optional("county", String.class, PriceRecord::getCounty),
                ColumnRule.required("country", String.class, PriceRecord::getCountry),
                ColumnRule.required("latitude", Double.class, PriceRecord::getLatitude)
                        .withCheck(v -> (Double) v >= 49 && (Double) v <= 61, "in range [49, 61]"),
                ColumnRule.required("longitude", Double.class, PriceRecord::getLongitude)
                        .withCheck(v -> (Double) v >= -8 && (Double) v <= 2, "in range [-8, 2]"),
                ColumnRule.required("row_id", Long.class, PriceRecord::getRowId)
                        .asUnique()
        ));
    }

    private static Predicate<Object> oneOf(Set<String> allowed) {
        return allowed::contains;
    }
}
