package com.propertyintel.price.poi;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.price.config.PricePredictorProperties;
import com.propertyintel.price.exception.InvalidQueryException;
import com.propertyintel.price.exception.SourceConnectionException;
import com.propertyintel.price.model.BoundingBox;
import com.propertyintel.price.model.PoiLookupResult;
import com.propertyintel.price.model.PoiTagFilter;
import com.propertyintel.price.model.PointOfInterest;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Thin client over the OpenStreetMap Overpass API.
 *
 * Nodes, ways and relations matching the tag filter are requested with
 * {@code out center}, so every element comes back with a single coordinate.
 * Overpass answers 429 or 504 when it is busy; those surface as
 * {@link SourceConnectionException} and are retried by Resilience4j.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class OverpassPoiClient implements PoiSource {

    private final ObjectMapper objectMapper;
    private final PricePredictorProperties properties;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(10))
            .build();

    @Override
    @Retry(name = "overpass")
    public PoiLookupResult fetch(BoundingBox bbox, PoiTagFilter filter, List<String> attributeKeys) {
        String query = buildQuery(bbox, filter);
        log.debug("Overpass query: {}", query);

        HttpResponse<String> response = send(query);

        switch (response.statusCode()) {
            case 200 -> { }
            case 400 -> throw new InvalidQueryException("Overpass rejected query: " + query);
            case 429, 504 -> throw new SourceConnectionException(
                    "Overpass busy (HTTP " + response.statusCode() + ")");
            default -> throw new SourceConnectionException(
                    "Overpass returned HTTP " + response.statusCode());
        }

        PoiLookupResult result = parse(response.body(), filter, attributeKeys);
        log.info("Overpass returned {} POIs matching {} in bbox N{} S{} E{} W{}",
                result.pois().size(), filter, bbox.north(), bbox.south(), bbox.east(), bbox.west());
        return result;
    }

    String buildQuery(BoundingBox bbox, PoiTagFilter filter) {
        String tag = filter.value() == null
                ? String.format("[\"%s\"]", filter.key())
                : String.format("[\"%s\"=\"%s\"]", filter.key(), filter.value());
        String box = String.format(Locale.ROOT, "(%.7f,%.7f,%.7f,%.7f)",
                bbox.south(), bbox.west(), bbox.north(), bbox.east());
        return "[out:json][timeout:" + properties.getPoi().getTimeoutSeconds() + "];"
                + "nwr" + tag + box + ";"
                + "out center tags;";
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    private HttpResponse<String> send(String query) {
        String body = "data=" + URLEncoder.encode(query, StandardCharsets.UTF_8);
        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(properties.getPoi().getBaseUrl()))
                .timeout(Duration.ofSeconds(properties.getPoi().getTimeoutSeconds() + 10L))
                .header("Content-Type", "application/x-www-form-urlencoded")
                .POST(HttpRequest.BodyPublishers.ofString(body))
                .build();
        try {
            return httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IOException e) {
            throw new SourceConnectionException("Overpass unreachable: " + e.getMessage(), e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new SourceConnectionException("Interrupted while calling Overpass", e);
        }
    }

    private PoiLookupResult parse(String body, PoiTagFilter filter, List<String> attributeKeys) {
        JsonNode elements;
        try {
            elements = objectMapper.readTree(body).path("elements");
        } catch (IOException e) {
            throw new SourceConnectionException("Unreadable Overpass response: " + e.getMessage(), e);
        }

        List<PointOfInterest> pois = new ArrayList<>();
        Set<String> seenKeys = new LinkedHashSet<>();
        int skipped = 0;

        for (JsonNode element : elements) {
            Map<String, String> tags = tags(element.path("tags"));
            if (!filter.matches(tags)) continue;

            JsonNode coords = element.has("lat") ? element : element.path("center");
            if (!coords.has("lat") || !coords.has("lon")) {
                skipped++;
                continue;
            }

            Map<String, String> attributes = new HashMap<>();
            for (String key : attributeKeys) {
                if (tags.containsKey(key)) {
                    attributes.put(key, tags.get(key));
                    seenKeys.add(key);
                }
            }

            pois.add(new PointOfInterest(
                    element.path("id").asLong(),
                    element.path("type").asText("node"),
                    coords.get("lat").asDouble(),
                    coords.get("lon").asDouble(),
                    Map.copyOf(attributes)));
        }

        if (skipped > 0) {
            log.debug("Skipped {} Overpass elements without coordinates", skipped);
        }

        Set<String> unavailable = new LinkedHashSet<>(attributeKeys);
        unavailable.removeAll(seenKeys);
        return new PoiLookupResult(pois, unavailable);
    }

    private Map<String, String> tags(JsonNode node) {
        Map<String, String> tags = new HashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = node.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            tags.put(field.getKey(), field.getValue().asText());
        }
        return tags;
    }
}
