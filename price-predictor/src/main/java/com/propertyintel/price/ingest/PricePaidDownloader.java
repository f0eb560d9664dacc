package com.propertyintel.price.ingest;

import com.propertyintel.price.config.PricePredictorProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.time.Duration;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Fetch-and-cache of the raw government datasets.
 *
 *   pp-{year}.csv            HM Land Registry price paid data, one file per year
 *   open_postcode_geo.csv    postcode centroids, shipped as a zip
 *
 * A file already present in the data directory is never downloaded again.
 * Downloads go to a temporary file first so an interrupted transfer does not
 * leave a truncated file that would later be mistaken for a cached copy.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class PricePaidDownloader {

    private static final String POSTCODE_ARCHIVE_NAME = "open_postcode_geo.csv.zip";

    private final PricePredictorProperties properties;

    private final HttpClient httpClient = HttpClient.newBuilder()
            .connectTimeout(Duration.ofSeconds(30))
            .followRedirects(HttpClient.Redirect.ALWAYS)
            .build();

    public Path downloadPricePaidYear(int year) throws IOException, InterruptedException {
        String url = String.format(properties.getIngestion().getPricePaidUrlTemplate(), year);
        return downloadToCache(url, "pp-" + year + ".csv");
    }

    /**
     * Download and unzip the postcode dataset, returning the extracted CSV.
     */
    public Path downloadPostcodeData() throws IOException, InterruptedException {
        Path csv = dataDirectory().resolve(properties.getIngestion().getPostcodeFileName());
        if (Files.exists(csv)) {
            log.info("Using cached {}", csv);
            return csv;
        }
        Path archive = downloadToCache(properties.getIngestion().getPostcodeUrl(), POSTCODE_ARCHIVE_NAME);
        unzip(archive, dataDirectory());
        if (!Files.exists(csv)) {
            throw new IOException("Archive " + archive + " did not contain " + csv.getFileName());
        }
        return csv;
    }

    // ── Internal ─────────────────────────────────────────────────────────────

    Path downloadToCache(String url, String filename) throws IOException, InterruptedException {
        Path dir = dataDirectory();
        Files.createDirectories(dir);
        Path target = dir.resolve(filename);

        if (Files.exists(target)) {
            log.info("Using cached {}", target);
            return target;
        }

        log.info("Downloading {} to {}", url, target);

        HttpRequest request = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofMinutes(30))  // yearly files run to hundreds of MB
                .GET()
                .build();

        HttpResponse<InputStream> response = httpClient.send(request,
                HttpResponse.BodyHandlers.ofInputStream());

        if (response.statusCode() != 200) {
            response.body().close();
            throw new IOException("Failed to download " + url + ": HTTP " + response.statusCode());
        }

        Path partial = dir.resolve(filename + ".part");
        try (InputStream body = response.body()) {
            Files.copy(body, partial, StandardCopyOption.REPLACE_EXISTING);
        }
        Files.move(partial, target, StandardCopyOption.REPLACE_EXISTING);

        log.info("Downloaded {} ({} bytes)", target, Files.size(target));
        return target;
    }

    private void unzip(Path archive, Path destination) throws IOException {
        Path root = destination.toAbsolutePath().normalize();
        try (ZipInputStream zis = new ZipInputStream(new BufferedInputStream(Files.newInputStream(archive), 65536))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                Path out = root.resolve(entry.getName()).normalize();
                if (!out.startsWith(root)) {
                    throw new IOException("Refusing to extract " + entry.getName() + " outside " + root);
                }
                if (entry.isDirectory()) {
                    Files.createDirectories(out);
                } else {
                    Files.createDirectories(out.getParent());
                    Files.copy(zis, out, StandardCopyOption.REPLACE_EXISTING);
                    log.info("Extracted {}", out);
                }
                zis.closeEntry();
            }
        }
    }

    private Path dataDirectory() {
        return Paths.get(properties.getDataDirectory());
    }
}
