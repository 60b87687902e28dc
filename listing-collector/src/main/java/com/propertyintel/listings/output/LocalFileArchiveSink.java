package com.propertyintel.listings.output;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.util.Map;

/**
 * Writes raw search responses and job metadata as pretty-printed JSON files.
 *
 * Output path pattern: {outputDir}/raw_responses/{yyyy-MM-dd}/{prefix}_p{page}.json
 * and {prefix}_meta.json for the run summary, where prefix is new_listings or full_scan.
 * e.g. /data/archive/raw_responses/2024-05-12/full_scan_p3.json
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class LocalFileArchiveSink implements ArchiveSink {

    private final ListingCollectorProperties properties;
    private final ObjectMapper objectMapper;

    @Override
    public String archivePage(LocalDate collectionDate, ScanMode mode, int pageNumber, Map<String, Object> payload) {
        Path target = dayDirectory(collectionDate)
                .resolve(String.format("%s_p%d.json", mode.archivePrefix(), pageNumber));
        writeJson(target, payload);
        log.info("Raw response saved: {}", target);
        return target.toString();
    }

    @Override
    public String archiveMetadata(LocalDate collectionDate, ScanMode mode, ScanSummary summary) {
        Path target = dayDirectory(collectionDate)
                .resolve(String.format("%s_meta.json", mode.archivePrefix()));
        writeJson(target, summary);
        log.info("Metadata saved: {}", target);
        return target.toString();
    }

    private Path dayDirectory(LocalDate collectionDate) {
        Path dir = Paths.get(properties.getArchive().getOutputDir(), "raw_responses", collectionDate.toString());
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new ArchiveWriteException("Cannot create archive directory: " + dir, e);
        }
        return dir;
    }

    private void writeJson(Path target, Object value) {
        try {
            objectMapper.writerWithDefaultPrettyPrinter().writeValue(target.toFile(), value);
        } catch (IOException e) {
            log.error("Failed to write archive file {}: {}", target, e.getMessage(), e);
            throw new ArchiveWriteException("Archive write failed: " + target, e);
        }
    }
}
