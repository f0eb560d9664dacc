package com.propertyintel.price.assess;

import com.propertyintel.price.model.PriceRecord;

import java.util.List;

/**
 * Records that passed a {@link SchemaValidator}. Only the validator can create
 * one, so anything that takes this type never sees unvalidated data.
 */
public final class ValidatedRecords {

    private final String schemaName;
    private final List<PriceRecord> records;

    ValidatedRecords(String schemaName, List<PriceRecord> records) {
        this.schemaName = schemaName;
        this.records = List.copyOf(records);
    }

    public String schemaName() {
        return schemaName;
    }

    public List<PriceRecord> records() {
        return records;
    }

    public int size() {
        return records.size();
    }

    public boolean isEmpty() {
        return records.isEmpty();
    }
}
