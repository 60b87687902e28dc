package com.propertyintel.listings.config;

import com.propertyintel.listings.model.ScanMode;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

@Component
@ConfigurationProperties(prefix = "listing-collector")
@Data
public class ListingCollectorProperties {

    private Api api = new Api();
    private Scan scan = new Scan();
    private Archive archive = new Archive();
    private Scheduling scheduling = new Scheduling();

    @Data
    public static class Api {
        private String baseUrl = "https://api.idealista.com/3.5";
        private String tokenUrl = "https://api.idealista.com/oauth/token";
        private String apiKey;
        private String apiSecret;
        private String country = "es";
        private long rateLimitDelayMs = 1000;
        private int timeoutSeconds = 30;
    }

    @Data
    public static class Scan {
        private String operation = "sale";
        private String propertyType = "homes";
        /** Madrid */
        private String locationId = "0-EU-ES-28";
        private int maxItems = 50;
        /** Publication window for incremental runs; "Y" means the last 2 days */
        private String incrementalSinceDate = "Y";
        /** Optional page cap; null fetches until the API's totalPages */
        private Integer maxPages;
    }

    @Data
    public static class Archive {
        private ArchiveMode mode = ArchiveMode.LOCAL;
        private String outputDir = "/data/archive";
        /** Target bucket in GCS mode */
        private String bucket;

        public enum ArchiveMode {
            LOCAL, GCS, NONE
        }
    }

    @Data
    public static class Scheduling {
        private String incrementalCron = "0 0 6 * * ?";
        private String fullScanCron = "0 0 3 ? * SUN";
        private boolean runOnStartup = false;
        private ScanMode startupMode = ScanMode.INCREMENTAL;
    }
}
