package com.chatintel.group.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

@Component
@ConfigurationProperties(prefix = "group-scraper")
@Data
public class GroupScraperProperties {

    private Source source = new Source();
    private Scraper scraper = new Scraper();
    private Scheduling scheduling = new Scheduling();
    private Retention retention = new Retention();
    private Export export = new Export();

    @Data
    public static class Source {
        /** Base URL of the chat bridge, e.g. http://localhost:3001/api */
        private String baseUrl = "http://localhost:3001/api";
        private Duration connectTimeout = Duration.ofSeconds(10);
        private Duration readTimeout = Duration.ofSeconds(60);
        /** Group ids to scrape on every ingestion tick, e.g. 120363041234567890@g.us */
        private List<String> monitoredGroups = new ArrayList<>();
        private CircuitBreaker circuitBreaker = new CircuitBreaker();

        @Data
        public static class CircuitBreaker {
            private float failureRateThreshold = 50;
            private int slidingWindowSize = 20;
            private Duration waitInOpenState = Duration.ofSeconds(30);
        }
    }

    @Data
    public static class Scraper {
        private int messageLimit = 100;
        private boolean scrapeMedia = false;
        private String mediaPath = "./data/media";
        /** Pause between two groups of the same tick */
        private Duration groupDelay = Duration.ofSeconds(2);
    }

    @Data
    public static class Scheduling {
        private String scrapeCron = "0 */5 * * * *";
        private String cleanupCron = "0 0 2 * * *";
        private String timezone = "Asia/Colombo";
        /** Arm both timers as soon as the source first reports READY */
        private boolean autoStart = true;
    }

    @Data
    public static class Retention {
        /** Days of messages to keep; 0 or less keeps messages forever */
        private int days = 30;
    }

    @Data
    public static class Export {
        private String outputDir = "./exports";
        private ExportFormat defaultFormat = ExportFormat.JSON;

        public enum ExportFormat {
            JSON, CSV
        }
    }
}
