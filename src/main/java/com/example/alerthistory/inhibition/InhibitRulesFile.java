package com.example.alerthistory.inhibition;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Alertmanager-compatible rules document:
 * <pre>
 * inhibit_rules:
 *   - name: node-down
 *     source_match: { alertname: NodeDown }
 *     target_match: { alertname: InstanceDown }
 *     equal: [ node ]
 * </pre>
 * Other top-level sections of an Alertmanager configuration are ignored.
 */
@Data
@NoArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
public class InhibitRulesFile {

    @JsonProperty("inhibit_rules")
    private List<RuleDefinition> inhibitRules = new ArrayList<>();

    @Data
    @NoArgsConstructor
    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RuleDefinition {
        private String name;
        @JsonProperty("source_match")
        private Map<String, String> sourceMatch = new LinkedHashMap<>();
        @JsonProperty("source_match_re")
        private Map<String, String> sourceMatchRe = new LinkedHashMap<>();
        @JsonProperty("target_match")
        private Map<String, String> targetMatch = new LinkedHashMap<>();
        @JsonProperty("target_match_re")
        private Map<String, String> targetMatchRe = new LinkedHashMap<>();
        private List<String> equal = new ArrayList<>();
    }
}
