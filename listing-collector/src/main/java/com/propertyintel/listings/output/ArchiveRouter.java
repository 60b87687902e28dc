package com.propertyintel.listings.output;

import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;

/**
 * Routes archive writes to the sink selected by configuration.
 * Supports LOCAL, GCS, or NONE modes. Archive failures are logged and never abort a scan.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ArchiveRouter {

    private final LocalFileArchiveSink localFileArchiveSink;
    private final ObjectProvider<GcsArchiveSink> gcsArchiveSink;
    private final ListingCollectorProperties properties;

    public void archivePage(LocalDate collectionDate, ScanMode mode, int pageNumber, Map<String, Object> payload) {
        ArchiveSink sink = activeSink();
        if (sink == null) return;
        try {
            sink.archivePage(collectionDate, mode, pageNumber, payload);
        } catch (Exception e) {
            log.warn("Failed to archive {} page {}: {}", mode.archivePrefix(), pageNumber, e.getMessage());
        }
    }

    public void archiveMetadata(LocalDate collectionDate, ScanMode mode, ScanSummary summary) {
        ArchiveSink sink = activeSink();
        if (sink == null) return;
        try {
            sink.archiveMetadata(collectionDate, mode, summary);
        } catch (Exception e) {
            log.warn("Failed to archive {} metadata: {}", mode.archivePrefix(), e.getMessage());
        }
    }

    /** null in NONE mode */
    private ArchiveSink activeSink() {
        return switch (properties.getArchive().getMode()) {
            case LOCAL -> localFileArchiveSink;
            case GCS -> gcsArchiveSink.getObject();
            case NONE -> null;
        };
    }
}
