package com.propertyintel.price.store;

import com.propertyintel.price.model.PriceRecord;
import org.springframework.jdbc.core.RowMapper;

import java.math.BigDecimal;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.LocalDate;

/**
 * Maps a row of the region query onto a {@link PriceRecord}. Nulls are kept as
 * nulls; the schema validator decides whether they are acceptable.
 */
class PriceRecordRowMapper implements RowMapper<PriceRecord> {

    @Override
    public PriceRecord mapRow(ResultSet rs, int rowNum) throws SQLException {
        return PriceRecord.builder()
                .price(nullableLong(rs, "price"))
                .dateOfTransfer(rs.getObject("date_of_transfer", LocalDate.class))
                .postcode(rs.getString("postcode"))
                .propertyType(rs.getString("property_type"))
                .newBuildFlag(rs.getString("new_build_flag"))
                .tenureType(rs.getString("tenure_type"))
                .locality(emptyToNull(rs.getString("locality")))
                .townCity(rs.getString("town_city"))
                .district(emptyToNull(rs.getString("district")))
                .county(emptyToNull(rs.getString("county")))
                .country(rs.getString("country"))
                .latitude(nullableDouble(rs, "latitude"))
                .longitude(nullableDouble(rs, "longitude"))
                .rowId(nullableLong(rs, "row_id"))
                .build();
    }

    private Long nullableLong(ResultSet rs, String column) throws SQLException {
        long value = rs.getLong(column);
        return rs.wasNull() ? null : value;
    }

    // Coordinates are stored as Decimal
    private Double nullableDouble(ResultSet rs, String column) throws SQLException {
        BigDecimal value = rs.getBigDecimal(column);
        return value == null ? null : value.doubleValue();
    }

    private String emptyToNull(String val) {
        return (val == null || val.isBlank()) ? null : val;
    }
}
