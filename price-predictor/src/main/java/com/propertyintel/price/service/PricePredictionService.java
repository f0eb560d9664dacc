package com.propertyintel.price.service;

import com.propertyintel.price.assess.FeatureEncoder;
import com.propertyintel.price.assess.SchemaValidator;
import com.propertyintel.price.assess.ValidatedRecords;
import com.propertyintel.price.config.PricePredictorProperties;
import com.propertyintel.price.exception.InsufficientTrainingDataException;
import com.propertyintel.price.model.EncodedFrame;
import com.propertyintel.price.model.FeatureFrame;
import com.propertyintel.price.model.GeoPoint;
import com.propertyintel.price.model.PoiTagFilter;
import com.propertyintel.price.model.PriceRecord;
import com.propertyintel.price.model.PricePrediction;
import com.propertyintel.price.model.PropertyType;
import com.propertyintel.price.model.ProximityFeature;
import com.propertyintel.price.model.SpatialQuery;
import com.propertyintel.price.poi.ProximityEnricher;
import com.propertyintel.price.regression.ElasticNetRegression;
import com.propertyintel.price.regression.TrainedModel;
import com.propertyintel.price.store.PricePaidRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Random;
import java.util.Set;
import java.util.stream.IntStream;

/**
 * Predicts a sale price by training a fresh model on nearby recent sales.
 *
 * Phases run strictly in order, each consuming only the previous phase's output:
 * FETCH, VALIDATE, ENRICH, ENCODE, SPLIT, FIT, EVALUATE, PREDICT.
 * Any failure before FIT aborts the request. A poor validation score is only logged.
 * Nothing is cached between requests.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PricePredictionService {

    static final String TARGET = "price";
    static final String PROPERTY_TYPE = "property_type";
    static final String LATITUDE = "latitude";
    static final String LONGITUDE = "longitude";
    static final List<String> CATEGORICAL_FEATURES = List.of(PROPERTY_TYPE);

    private final PricePaidRepository repository;
    private final SchemaValidator schemaValidator;
    private final ProximityEnricher proximityEnricher;
    private final FeatureEncoder featureEncoder;
    private final PricePredictorProperties properties;

    /**
     * Point estimate of the price of a property of {@code propertyType} at the
     * given location, sold on {@code date}.
     */
    public double predictPrice(double latitude, double longitude, LocalDate date, PropertyType propertyType) {
        return predict(latitude, longitude, date, propertyType).getPredictedPrice();
    }

    /**
     * Same as {@link #predictPrice} but with fit diagnostics.
     */
    public PricePrediction predict(double latitude, double longitude, LocalDate date, PropertyType propertyType) {
        GeoPoint target = new GeoPoint(latitude, longitude);
        PoiTagFilter filter = poiFilter();

        log.info("Predicting {} price at ({}, {}) on {}", propertyType, latitude, longitude, date);

        TrainingSet training = trainingData(target, date, filter);
        Split split = split(training.encoded().frame());
        TrainedModel model = train(split.train());

        double mae = model.meanAbsoluteError(split.validation(), TARGET);
        boolean withinThreshold = mae <= properties.getModel().getMaeWarningThreshold();
        if (!withinThreshold) {
            log.warn("MAE on validation data is {} (threshold {}), returning prediction anyway",
                    mae, properties.getModel().getMaeWarningThreshold());
        }

        double predicted = makePrediction(model, training.encoded(), target, propertyType, filter);
        log.info("Predicted {} for {} at ({}, {}) from {} training rows, validation MAE {}",
                predicted, propertyType, latitude, longitude, split.train().rowCount(), mae);

        return PricePrediction.builder()
                .latitude(latitude)
                .longitude(longitude)
                .date(date)
                .propertyType(propertyType)
                .predictedPrice(predicted)
                .trainingRows(split.train().rowCount())
                .validationRows(split.validation().rowCount())
                .validationMae(mae)
                .maeWithinThreshold(withinThreshold)
                .unavailablePoiKeys(training.unavailablePoiKeys())
                .build();
    }

    // ── Phases ───────────────────────────────────────────────────────────────

    /**
     * FETCH, VALIDATE, ENRICH and ENCODE: the encoded training frame around a point and date.
     */
    TrainingSet trainingData(GeoPoint target, LocalDate date, PoiTagFilter filter) {
        PricePredictorProperties.Training config = properties.getTraining();
        SpatialQuery query = SpatialQuery.around(target, config.getBbox(), date, config.getWindowWeeks());

        List<PriceRecord> fetched = repository.fetch(query);
        ValidatedRecords records = schemaValidator.validate(fetched);
        if (records.size() < 2) {
            throw new InsufficientTrainingDataException(String.format(
                    "Found %d sales within %s degrees of (%s, %s) between %s and %s; at least 2 are needed",
                    records.size(), config.getBbox(), target.latitude(), target.longitude(),
                    query.startDate(), query.endDate()));
        }

        List<GeoPoint> locations = records.records().stream().map(PriceRecord::location).toList();
        ProximityFeature proximity = proximityEnricher.attachNearest(locations, filter);

        FeatureFrame frame = toFrame(records)
                .withNumeric(proximity.column(), proximity.distances())
                .select(List.of(TARGET, PROPERTY_TYPE, LATITUDE, LONGITUDE, proximity.column()));

        EncodedFrame encoded = featureEncoder.encode(frame, CATEGORICAL_FEATURES);
        return new TrainingSet(encoded, proximity.unavailableKeys());
    }

    /**
     * Random train/validation partition; the validation side gets ceil(n * testSize) rows.
     */
    Split split(FeatureFrame frame) {
        double testSize = properties.getTraining().getTestSize();
        if (testSize <= 0 || testSize >= 1) {
            throw new IllegalStateException("test-size must be in (0, 1), was " + testSize);
        }

        int n = frame.rowCount();
        int validationRows = (int) Math.ceil(n * testSize);
        int trainingRows = n - validationRows;
        if (trainingRows < 1 || validationRows < 1) {
            throw new InsufficientTrainingDataException(String.format(
                    "%d rows cannot be split with test-size %s", n, testSize));
        }

        List<Integer> order = new ArrayList<>(IntStream.range(0, n).boxed().toList());
        Collections.shuffle(order, random());

        int[] validationIdx = order.subList(0, validationRows).stream().mapToInt(Integer::intValue).toArray();
        int[] trainingIdx = order.subList(validationRows, n).stream().mapToInt(Integer::intValue).toArray();
        return new Split(frame.rows(trainingIdx), frame.rows(validationIdx));
    }

    TrainedModel train(FeatureFrame frame) {
        PricePredictorProperties.Model config = properties.getModel();
        ElasticNetRegression regression = new ElasticNetRegression(
                config.getAlpha(), config.getL1Weight(), config.getMaxIterations(), config.getTolerance(),
                config.isFitIntercept());
        TrainedModel model = regression.fit(frame, TARGET);
        log.debug("Fitted {} in {} iterations", model, model.iterations());
        return model;
    }

    /**
     * PREDICT: build the query row the same way as the training rows and score it.
     */
    double makePrediction(TrainedModel model, EncodedFrame training, GeoPoint target,
                          PropertyType propertyType, PoiTagFilter filter) {
        ProximityFeature proximity = proximityEnricher.attachNearest(List.of(target), filter);

        FeatureFrame query = FeatureFrame.empty(1)
                .withCategorical(PROPERTY_TYPE, List.of(propertyType.code()))
                .withNumeric(LATITUDE, new double[]{target.latitude()})
                .withNumeric(LONGITUDE, new double[]{target.longitude()})
                .withNumeric(proximity.column(), proximity.distances());

        FeatureFrame encoded = featureEncoder.encode(query, training.mappings()).frame();
        return model.predict(encoded)[0];
    }

    // ── Helpers ──────────────────────────────────────────────────────────────

    private FeatureFrame toFrame(ValidatedRecords records) {
        List<PriceRecord> rows = records.records();
        int n = rows.size();
        double[] prices = new double[n];
        double[] latitudes = new double[n];
        double[] longitudes = new double[n];
        List<String> propertyTypes = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            PriceRecord r = rows.get(i);
            prices[i] = r.getPrice();
            latitudes[i] = r.getLatitude();
            longitudes[i] = r.getLongitude();
            propertyTypes.add(r.getPropertyType());
        }
        return FeatureFrame.empty(n)
                .withNumeric(TARGET, prices)
                .withCategorical(PROPERTY_TYPE, propertyTypes)
                .withNumeric(LATITUDE, latitudes)
                .withNumeric(LONGITUDE, longitudes);
    }

    private PoiTagFilter poiFilter() {
        PricePredictorProperties.Poi poi = properties.getPoi();
        String value = poi.getTagValue();
        return new PoiTagFilter(poi.getTagKey(), value == null || value.isBlank() ? null : value);
    }

    private Random random() {
        Long seed = properties.getTraining().getRandomSeed();
        return seed != null ? new Random(seed) : new Random();
    }

    record TrainingSet(EncodedFrame encoded, Set<String> unavailablePoiKeys) {}

    record Split(FeatureFrame train, FeatureFrame validation) {}
}
