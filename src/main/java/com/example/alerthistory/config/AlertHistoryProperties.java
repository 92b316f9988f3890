package com.example.alerthistory.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Central configuration for the suppression engine.
 * Maps to the 'alert-history' prefix in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "alert-history")
public class AlertHistoryProperties {

    private SuppressionConfig suppression = new SuppressionConfig();
    private SilenceConfig silences = new SilenceConfig();
    private InhibitionConfig inhibition = new InhibitionConfig();

    @Data
    public static class SuppressionConfig {
        /** Deadline applied to suppression queries issued without an explicit one */
        private long queryTimeoutMs = 500;
    }

    @Data
    public static class SilenceConfig {
        private boolean cacheEnabled = true;
        private int syncIntervalSeconds = 60;
        private int maxMatchers = 100;
        private int defaultPageSize = 100;
        private int maxPageSize = 1000;
    }

    @Data
    public static class InhibitionConfig {
        /** Alertmanager-style YAML with an inhibit_rules list; "classpath:" or file path */
        private String rulesFile;
        private List<RuleConfig> rules = new ArrayList<>();
        /** 0 keeps inhibition state until explicitly removed */
        private int stateTtlHours = 24;
        private int cleanupIntervalSeconds = 60;
        private int firingAlertCapacity = 1000;

        @Data
        public static class RuleConfig {
            private String name;
            private Map<String, String> sourceMatch = new LinkedHashMap<>();
            private Map<String, String> sourceMatchRe = new LinkedHashMap<>();
            private Map<String, String> targetMatch = new LinkedHashMap<>();
            private Map<String, String> targetMatchRe = new LinkedHashMap<>();
            private List<String> equal = new ArrayList<>();
        }
    }
}
