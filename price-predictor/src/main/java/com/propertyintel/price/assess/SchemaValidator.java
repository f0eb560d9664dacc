package com.propertyintel.price.assess;

import com.propertyintel.price.exception.SchemaViolationException;
import com.propertyintel.price.model.PriceRecord;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * All-or-nothing gate between the record store and feature engineering.
 *
 * Columns are checked in schema order. Within a column every row is checked,
 * so the exception lists all offending values for the first column that fails.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class SchemaValidator {

    private static final int MAX_REPORTED_VALUES = 10;

    private final RecordSchema schema;

    public ValidatedRecords validate(List<PriceRecord> records) {
        for (ColumnRule rule : schema.rules()) {
            checkColumn(rule, records);
        }
        log.debug("{} records passed schema {}", records.size(), schema.name());
        return new ValidatedRecords(schema.name(), records);
    }

    private void checkColumn(ColumnRule rule, List<PriceRecord> records) {
        List<Object> nulls = new ArrayList<>();
        List<Object> wrongType = new ArrayList<>();
        List<Object> failed = new ArrayList<>();
        List<Object> duplicates = new ArrayList<>();
        Set<Object> seen = new HashSet<>();

        for (PriceRecord record : records) {
            Object value = rule.extractor().apply(record);
            if (value == null) {
                if (!rule.nullable()) nulls.add(null);
                continue;
            }
            if (!rule.type().isInstance(value)) {
                wrongType.add(value);
                continue;
            }
            if (!rule.check().test(value)) {
                failed.add(value);
            }
            if (rule.unique() && !seen.add(value)) {
                duplicates.add(value);
            }
        }

        reject(rule, nulls, "not nullable");
        reject(rule, wrongType, "type " + rule.type().getSimpleName());
        reject(rule, failed, rule.constraint());
        reject(rule, duplicates, "unique");
    }

    private void reject(ColumnRule rule, List<Object> values, String constraint) {
        if (values.isEmpty()) return;
        List<Object> reported = values.size() > MAX_REPORTED_VALUES
                ? new ArrayList<>(values.subList(0, MAX_REPORTED_VALUES))
                : values;
        throw new SchemaViolationException(rule.column(), reported, constraint);
    }
}
