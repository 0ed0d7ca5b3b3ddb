package com.geodatenbezug.exporter.service;

import com.geodatenbezug.exporter.config.GeodiensteProperties;
import io.github.resilience4j.retry.annotation.Retry;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpMethod;
import org.springframework.stereotype.Service;
import org.springframework.web.client.RequestCallback;
import org.springframework.web.client.RestTemplate;

import java.io.BufferedInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.net.URI;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;
import java.util.zip.ZipEntry;
import java.util.zip.ZipInputStream;

/**
 * Downloads a finished geodienste.ch export and unpacks it.
 *
 * The download_url of a successful status payload points to a zip archive,
 * typically holding one GeoPackage per topic:
 *   lwb_rebbaukataster_v2_0_lv95.gpkg
 *   ...
 *
 * The archive is streamed and every file entry is written below the
 * destination directory, so nothing is buffered in memory.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class ExportDownloader {

    private final RestTemplate restTemplate;
    private final GeodiensteProperties properties;

    /**
     * Download the export archive and extract it into {@code destination}.
     *
     * @param downloadUrl download_url from a success status payload
     * @param destination directory to extract into; created if missing
     * @return extracted files, in archive order
     */
    @Retry(name = "geodiensteDownload")
    public List<Path> download(String downloadUrl, Path destination) throws IOException {
        log.info("Downloading export from: {}", downloadUrl);
        Files.createDirectories(destination);

        List<Path> files = restTemplate.execute(URI.create(downloadUrl), HttpMethod.GET, credentials(),
                response -> extract(response.getBody(), destination));

        if (files == null || files.isEmpty()) {
            throw new IOException("Export archive from " + downloadUrl + " contained no files");
        }
        log.info("Extraction complete. {} files written to {}", files.size(), destination);
        return files;
    }

    private RequestCallback credentials() {
        GeodiensteProperties.Download download = properties.getDownload();
        return request -> {
            if (download.hasCredentials()) {
                request.getHeaders().setBasicAuth(download.getUsername(), download.getPassword());
            }
        };
    }

    private List<Path> extract(InputStream zipStream, Path destination) throws IOException {
        List<Path> files = new ArrayList<>();
        Path root = destination.toAbsolutePath().normalize();

        try (ZipInputStream zis = new ZipInputStream(new BufferedInputStream(zipStream, 65536))) {
            ZipEntry entry;
            while ((entry = zis.getNextEntry()) != null) {
                Path target = root.resolve(entry.getName()).normalize();
                if (!target.startsWith(root)) {
                    throw new IOException("Archive entry outside of target directory: " + entry.getName());
                }

                if (entry.isDirectory()) {
                    Files.createDirectories(target);
                } else {
                    Files.createDirectories(target.getParent());
                    Files.copy(zis, target, StandardCopyOption.REPLACE_EXISTING);
                    log.debug("Extracted {}", target);
                    files.add(target);
                }
                zis.closeEntry();
            }
        }
        return files;
    }
}
