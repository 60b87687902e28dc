package com.propertyintel.listings.output;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.google.cloud.storage.BlobId;
import com.google.cloud.storage.BlobInfo;
import com.google.cloud.storage.Storage;
import com.google.cloud.storage.StorageException;
import com.propertyintel.listings.config.ListingCollectorProperties;
import com.propertyintel.listings.model.ScanMode;
import com.propertyintel.listings.model.ScanSummary;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.Map;

/**
 * Uploads raw search responses and job metadata to a Cloud Storage bucket.
 *
 * Object names mirror the local layout: raw_responses/{yyyy-MM-dd}/{prefix}_p{page}.json
 * and {prefix}_meta.json, e.g. gs://listings-raw/raw_responses/2024-05-12/new_listings_p1.json
 */
@Component
@Slf4j
@ConditionalOnProperty(prefix = "listing-collector.archive", name = "mode", havingValue = "GCS")
public class GcsArchiveSink implements ArchiveSink {

    private static final String CONTENT_TYPE = "application/json";

    private final Storage storage;
    private final ObjectMapper objectMapper;
    private final String bucket;

    public GcsArchiveSink(Storage storage, ListingCollectorProperties properties, ObjectMapper objectMapper) {
        String configured = properties.getArchive().getBucket();
        if (configured == null || configured.isBlank()) {
            throw new IllegalStateException("listing-collector.archive.bucket (GCS_BUCKET_NAME) must be set in GCS mode");
        }
        this.storage = storage;
        this.objectMapper = objectMapper;
        this.bucket = configured;
        log.info("GCS archive initialised for bucket {}", bucket);
    }

    @Override
    public String archivePage(LocalDate collectionDate, ScanMode mode, int pageNumber, Map<String, Object> payload) {
        String objectName = objectName(collectionDate, String.format("%s_p%d.json", mode.archivePrefix(), pageNumber));
        int size = upload(objectName, payload);
        log.info("Raw response uploaded: gs://{}/{} ({} bytes)", bucket, objectName, size);
        return objectName;
    }

    @Override
    public String archiveMetadata(LocalDate collectionDate, ScanMode mode, ScanSummary summary) {
        String objectName = objectName(collectionDate, String.format("%s_meta.json", mode.archivePrefix()));
        upload(objectName, summary);
        log.info("Metadata uploaded: gs://{}/{}", bucket, objectName);
        return objectName;
    }

    static String objectName(LocalDate collectionDate, String fileName) {
        return "raw_responses/" + collectionDate + "/" + fileName;
    }

    private int upload(String objectName, Object value) {
        byte[] content;
        try {
            content = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsBytes(value);
        } catch (JsonProcessingException e) {
            throw new ArchiveWriteException("Cannot serialise archive object: " + objectName, e);
        }
        BlobInfo blob = BlobInfo.newBuilder(BlobId.of(bucket, objectName))
                .setContentType(CONTENT_TYPE)
                .build();
        try {
            storage.create(blob, content);
        } catch (StorageException e) {
            log.error("Failed to upload gs://{}/{}: {}", bucket, objectName, e.getMessage(), e);
            throw new ArchiveWriteException("Archive upload failed: gs://" + bucket + "/" + objectName, e);
        }
        return content.length;
    }
}
