package com.propertyintel.listings.output;

import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanSummary;

import java.time.LocalDate;
import java.util.Map;

/**
 * Durable store for raw search responses and job metadata, keyed by collection date.
 */
public interface ArchiveSink {

    /**
     * @return location the page was written to
     */
    String archivePage(LocalDate collectionDate, ScanMode mode, int pageNumber, Map<String, Object> payload);

    String archiveMetadata(LocalDate collectionDate, ScanMode mode, ScanSummary summary);
}
