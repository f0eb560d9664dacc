package com.propertyintel.price.config;

import com.propertyintel.price.exception.GlobalExceptionHandler;
import com.propertyintel.price.exception.InsufficientTrainingDataException;
import com.propertyintel.price.exception.SchemaViolationException;
import com.propertyintel.price.exception.SourceConnectionException;
import com.propertyintel.price.exception.UnknownCategoryException;
import com.propertyintel.price.ingest.IngestionService;
import com.propertyintel.price.model.PricePrediction;
import com.propertyintel.price.model.PropertyType;
import com.propertyintel.price.service.PricePredictionService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Import;
import org.springframework.test.web.servlet.MockMvc;

import java.time.LocalDate;
import java.util.Arrays;
import java.util.Set;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(PredictionController.class)
@Import(GlobalExceptionHandler.class)
class PredictionControllerTest {

    @Autowired MockMvc mockMvc;

    @MockBean PricePredictionService predictionService;
    @MockBean IngestionService ingestionService;

    private static final LocalDate DATE = LocalDate.of(2022, 6, 1);

    @Test
    void predict_returnsPriceAndDiagnostics() throws Exception {
        when(predictionService.predict(52.2053, 0.1218, DATE, PropertyType.D)).thenReturn(
            PricePrediction.builder()
                .latitude(52.2053).longitude(0.1218).date(DATE).propertyType(PropertyType.D)
                .predictedPrice(512_345.0).trainingRows(120).validationRows(30).validationMae(48_000.0)
                .maeWithinThreshold(false).unavailablePoiKeys(Set.of())
                .build());

        mockMvc.perform(get("/predictions")
                .param("latitude", "52.2053")
                .param("longitude", "0.1218")
                .param("date", "2022-06-01")
                .param("propertyType", "D"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.predictedPrice").value(512_345.0))
            .andExpect(jsonPath("$.date").value("2022-06-01"))
            .andExpect(jsonPath("$.propertyType").value("D"))
            .andExpect(jsonPath("$.maeWithinThreshold").value(false));
    }

    @Test
    void predict_schemaViolation_is422WithOffendingColumn() throws Exception {
        when(predictionService.predict(anyDouble(), anyDouble(), any(), any()))
            .thenThrow(new SchemaViolationException("price", Arrays.asList(-1L, null), "in range [0, 1000000000)"));

        mockMvc.perform(get("/predictions")
                .param("latitude", "52.2").param("longitude", "0.12")
                .param("date", "2022-06-01").param("propertyType", "D"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("SCHEMA_ERROR"))
            .andExpect(jsonPath("$.column").value("price"))
            .andExpect(jsonPath("$.rejectedValues[0]").value(-1))
            .andExpect(jsonPath("$.path").value("/predictions"));
    }

    @Test
    void predict_storeUnreachable_is503() throws Exception {
        when(predictionService.predict(anyDouble(), anyDouble(), any(), any()))
            .thenThrow(new SourceConnectionException("Record store unreachable: Connection refused"));

        mockMvc.perform(get("/predictions")
                .param("latitude", "52.2").param("longitude", "0.12")
                .param("date", "2022-06-01").param("propertyType", "T"))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.errorCode").value("CONNECTION_ERROR"));
    }

    @Test
    void predict_unseenPropertyType_is422() throws Exception {
        when(predictionService.predict(anyDouble(), anyDouble(), any(), eq(PropertyType.O)))
            .thenThrow(new UnknownCategoryException("property_type", "O"));

        mockMvc.perform(get("/predictions")
                .param("latitude", "52.2").param("longitude", "0.12")
                .param("date", "2022-06-01").param("propertyType", "O"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("UNKNOWN_CATEGORY"))
            .andExpect(jsonPath("$.column").doesNotExist());
    }

    @Test
    void predict_emptyWindow_is422() throws Exception {
        when(predictionService.predict(anyDouble(), anyDouble(), any(), any()))
            .thenThrow(new InsufficientTrainingDataException("Found 0 sales"));

        mockMvc.perform(get("/predictions")
                .param("latitude", "57.0").param("longitude", "-5.0")
                .param("date", "2022-06-01").param("propertyType", "D"))
            .andExpect(status().isUnprocessableEntity())
            .andExpect(jsonPath("$.errorCode").value("INSUFFICIENT_DATA"));
    }

    @Test
    void predict_unknownPropertyTypeCode_is400() throws Exception {
        mockMvc.perform(get("/predictions")
                .param("latitude", "52.2").param("longitude", "0.12")
                .param("date", "2022-06-01").param("propertyType", "X"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(predictionService);
    }

    @Test
    void predict_missingDate_is400() throws Exception {
        mockMvc.perform(get("/predictions")
                .param("latitude", "52.2").param("longitude", "0.12").param("propertyType", "D"))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("Missing Parameter"));
    }

    @Test
    void ingestYear_outOfRange_is400() throws Exception {
        mockMvc.perform(post("/ingest/price-paid/1990"))
            .andExpect(status().isBadRequest());
        verifyNoInteractions(ingestionService);
    }

    @Test
    void ingestYear_startsBackgroundLoad() throws Exception {
        mockMvc.perform(post("/ingest/price-paid/2021"))
            .andExpect(status().isAccepted())
            .andExpect(jsonPath("$.dataset").value("pp-2021"));
        verify(ingestionService, timeout(2000)).loadPricePaidYear(2021);
    }
}
