package com.propertyintel.price.store;

import com.propertyintel.price.model.IngestionRun;
import com.propertyintel.price.model.PricePaidEntry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.JdbcTemplate;

import java.time.LocalDate;
import java.time.LocalDateTime;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class StoreWriterTest {

    @Mock JdbcTemplate jdbcTemplate;
    @InjectMocks StoreWriter storeWriter;

    private PricePaidEntry entry(String id) {
        return PricePaidEntry.builder()
            .transactionId(id).price(250_000).dateOfTransfer(LocalDate.of(2021, 5, 1))
            .postcode("CB1 1AA").propertyType("T").newBuildFlag("N").tenureType("F")
            .townCity("CAMBRIDGE").build();
    }

    @Test
    @SuppressWarnings("unchecked")
    void writePricePaid_splitsIntoBatches() {
        storeWriter.writePricePaid(List.of(entry("{A}"), entry("{B}"), entry("{C}")), 2);

        ArgumentCaptor<List<Object[]>> batches = ArgumentCaptor.forClass(List.class);
        verify(jdbcTemplate, times(2)).batchUpdate(eq(StoreWriter.INSERT_PRICE_PAID), batches.capture());
        assertThat(batches.getAllValues()).extracting(List::size).containsExactly(2, 1);
        assertThat(batches.getAllValues().get(0).get(0)[0]).isEqualTo("{A}");
        // optional address parts are written as empty strings, never NULL
        assertThat(batches.getAllValues().get(0).get(0)[9]).isEqualTo("");
    }

    @Test
    void writePricePaid_emptyList_writesNothing() {
        storeWriter.writePricePaid(List.of(), 100);
        verifyNoInteractions(jdbcTemplate);
    }

    @Test
    void writeIngestionRun_failureIsLoggedNotThrown() {
        when(jdbcTemplate.update(anyString(), any(), any(), any(), any(), any(), any(), any(), any(), any()))
            .thenThrow(new DataAccessResourceFailureException("down"));

        IngestionRun run = IngestionRun.builder()
            .runId("r1").dataset("pp-2021").status("SUCCESS")
            .startedAt(LocalDateTime.now()).completedAt(LocalDateTime.now()).build();

        assertThatCode(() -> storeWriter.writeIngestionRun(run)).doesNotThrowAnyException();
    }

    @Test
    void ensureSchema_createsAllThreeTables() {
        storeWriter.ensureSchema();

        ArgumentCaptor<String> ddl = ArgumentCaptor.forClass(String.class);
        verify(jdbcTemplate, times(3)).execute(ddl.capture());
        assertThat(ddl.getAllValues())
            .anySatisfy(sql -> assertThat(sql).contains("CREATE TABLE IF NOT EXISTS pp_data"))
            .anySatisfy(sql -> assertThat(sql).contains("CREATE TABLE IF NOT EXISTS postcode_data"))
            .anySatisfy(sql -> assertThat(sql).contains("CREATE TABLE IF NOT EXISTS ingestion_runs"));
    }
}
