package com.propertyintel.price.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "price-predictor")
@Data
public class PricePredictorProperties {

    /** Cache directory for downloaded raw files */
    private String dataDirectory = "/data/raw";

    private Store store = new Store();
    private Training training = new Training();
    private Model model = new Model();
    private Poi poi = new Poi();
    private Ingestion ingestion = new Ingestion();

    /**
     * Store location. These are interpolated into spring.datasource.url;
     * credentials come from spring.datasource.username/password.
     */
    @Data
    public static class Store {
        private String url = "localhost";
        private String databaseName = "property_prices";
        private int port = 8123;
    }

    @Data
    public static class Training {
        /** Fraction of rows held out for validation */
        private double testSize = 0.2;
        /** Half-width in degrees of the spatial window around the query point */
        private double bbox = 0.5;
        /** Weeks either side of the query date */
        private int windowWeeks = 24;
        /** Fixed seed for the train/validation split; random when unset */
        private Long randomSeed;
    }

    @Data
    public static class Model {
        /** Overall regularisation strength */
        private double alpha = 2.0;
        /** Share of the penalty that is L1; the rest is L2 */
        private double l1Weight = 0.2;
        /** Fit an unpenalised constant term; off, the regression goes through the origin */
        private boolean fitIntercept = false;
        private int maxIterations = 1000;
        private double tolerance = 1e-6;
        private double maeWarningThreshold = 10_000;
    }

    @Data
    public static class Poi {
        private String baseUrl = "https://overpass-api.de/api/interpreter";
        private int timeoutSeconds = 60;
        /** Degrees added on every side of the input points' bounding box */
        private double paddingDegrees = 0.01;
        private String tagKey = "shop";
        /** Empty means any value of the key */
        private String tagValue;
        private List<String> attributeKeys = new ArrayList<>(List.of("name"));
    }

    @Data
    public static class Ingestion {
        private String pricePaidUrlTemplate =
                "http://prod.publicdata.landregistry.gov.uk.s3-website-eu-west-1.amazonaws.com/pp-%d.csv";
        private String postcodeUrl = "https://www.getthedata.com/downloads/open_postcode_geo.csv.zip";
        private String postcodeFileName = "open_postcode_geo.csv";
        private boolean runOnStartup = false;
        private List<Integer> years = new ArrayList<>(List.of(2018, 2019, 2020, 2021, 2022));
        private int batchSize = 10_000;
    }
}
