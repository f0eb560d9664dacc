package com.propertyintel.price.assess;

import com.propertyintel.price.exception.SchemaViolationException;
import com.propertyintel.price.model.PriceRecord;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.catchThrowableOfType;

class SchemaValidatorTest {

    private final SchemaValidator validator = new SchemaValidator(RecordSchema.pricePaid());

    static PriceRecord valid(long rowId) {
        return PriceRecord.builder()
            .price(250_000L)
            .dateOfTransfer(LocalDate.of(2022, 3, 1))
            .postcode("CB2 1TN")
            .propertyType("D")
            .newBuildFlag("N")
            .tenureType("F")
            .townCity("CAMBRIDGE")
            .district("CAMBRIDGE")
            .county("CAMBRIDGESHIRE")
            .country("England")
            .latitude(52.2)
            .longitude(0.12)
            .rowId(rowId)
            .build();
    }

    @Test
    void validate_wellFormedRecords_passThroughUnchanged() {
        List<PriceRecord> records = List.of(valid(1), valid(2));

        ValidatedRecords result = validator.validate(records);

        assertThat(result.records()).containsExactlyElementsOf(records);
        assertThat(result.schemaName()).isEqualTo("prices-coordinates");
    }

    @Test
    void validate_emptyDataset_isValid() {
        assertThat(validator.validate(List.of()).isEmpty()).isTrue();
    }

    @Test
    void validate_optionalAddressFieldsMayBeNull() {
        PriceRecord sparse = valid(1).toBuilder().locality(null).district(null).county(null).build();

        assertThat(validator.validate(List.of(sparse)).size()).isEqualTo(1);
    }

    @Test
    void validate_negativePrice_isRejected() {
        PriceRecord bad = valid(2).toBuilder().price(-1L).build();

        SchemaViolationException e = catchThrowableOfType(
            () -> validator.validate(List.of(valid(1), bad)), SchemaViolationException.class);

        assertThat(e.getColumn()).isEqualTo("price");
        assertThat(e.getViolatingValues()).containsExactly(-1L);
        assertThat(e.getErrorCode()).isEqualTo("SCHEMA_ERROR");
    }

    @Test
    void validate_priceOfOneBillion_isRejected() {
        PriceRecord bad = valid(1).toBuilder().price(1_000_000_000L).build();

        assertThatThrownBy(() -> validator.validate(List.of(bad)))
            .isInstanceOf(SchemaViolationException.class)
            .hasMessageContaining("price");
    }

    @Test
    void validate_unknownPropertyType_isRejected() {
        PriceRecord bad = valid(1).toBuilder().propertyType("X").build();

        SchemaViolationException e = catchThrowableOfType(
            () -> validator.validate(List.of(bad)), SchemaViolationException.class);

        assertThat(e.getColumn()).isEqualTo("property_type");
        assertThat(e.getViolatingValues()).containsExactly("X");
        assertThat(e.getConstraint()).contains("isin");
    }

    @Test
    void validate_latitudeOutsideGreatBritain_isRejected() {
        PriceRecord bad = valid(1).toBuilder().latitude(90.0).build();

        SchemaViolationException e = catchThrowableOfType(
            () -> validator.validate(List.of(bad)), SchemaViolationException.class);

        assertThat(e.getColumn()).isEqualTo("latitude");
        assertThat(e.getViolatingValues()).containsExactly(90.0);
    }

    @Test
    void validate_transferOnCutoffDate_isRejected() {
        PriceRecord bad = valid(1).toBuilder().dateOfTransfer(LocalDate.of(2023, 1, 1)).build();

        assertThat(catchThrowableOfType(() -> validator.validate(List.of(bad)), SchemaViolationException.class)
            .getColumn()).isEqualTo("date_of_transfer");
    }

    @Test
    void validate_missingTownCity_isRejected() {
        PriceRecord bad = valid(1).toBuilder().townCity(null).build();

        SchemaViolationException e = catchThrowableOfType(
            () -> validator.validate(List.of(bad)), SchemaViolationException.class);

        assertThat(e.getColumn()).isEqualTo("town_city");
        assertThat(e.getConstraint()).isEqualTo("not nullable");
        assertThat(e.getViolatingValues()).hasSize(1).containsOnlyNulls();
    }

    @Test
    void validate_duplicateRowId_isRejected() {
        SchemaViolationException e = catchThrowableOfType(
            () -> validator.validate(List.of(valid(7), valid(8), valid(7))), SchemaViolationException.class);

        assertThat(e.getColumn()).isEqualTo("row_id");
        assertThat(e.getConstraint()).isEqualTo("unique");
        assertThat(e.getViolatingValues()).containsExactly(7L);
    }

    @Test
    void validate_reportsFirstFailingColumnInSchemaOrder() {
        PriceRecord bad = valid(1).toBuilder().price(-5L).latitude(0.0).build();

        assertThat(catchThrowableOfType(() -> validator.validate(List.of(bad)), SchemaViolationException.class)
            .getColumn()).isEqualTo("price");
    }

    @Test
    void validate_capsReportedValues() {
        List<PriceRecord> records = new ArrayList<>();
        for (int i = 0; i < 25; i++) {
            records.add(valid(i).toBuilder().postcode("TOO LONG POSTCODE").build());
        }

        SchemaViolationException e = catchThrowableOfType(
            () -> validator.validate(records), SchemaViolationException.class);

        assertThat(e.getColumn()).isEqualTo("postcode");
        assertThat(e.getViolatingValues()).hasSize(10);
    }

    @Test
    void validate_customSchema_replacesTheDefaultRules() {
        SchemaValidator priceOnly = new SchemaValidator(new RecordSchema("price-only", List.of(
            ColumnRule.required("price", Long.class, PriceRecord::getPrice)
                .withCheck(v -> (Long) v > 100_000L, "above 100000"))));

        PriceRecord noCoordinates = PriceRecord.builder().price(150_000L).build();

        assertThat(priceOnly.validate(List.of(noCoordinates)).schemaName()).isEqualTo("price-only");
        assertThatThrownBy(() -> priceOnly.validate(List.of(noCoordinates.toBuilder().price(50_000L).build())))
            .isInstanceOf(SchemaViolationException.class)
            .hasMessageContaining("above 100000");
    }
}
