package com.example.alerthistory.inhibition;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.config.AlertHistoryProperties.InhibitionConfig.RuleConfig;
import com.example.alerthistory.error.ValidationException;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.time.Clock;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class InhibitionRuleLoaderTest {

    private final AlertHistoryProperties properties = new AlertHistoryProperties();
    private final InhibitionRuleLoader loader =
            new InhibitionRuleLoader(properties, new DefaultResourceLoader(), Clock.systemUTC());

    @Test
    void loadsAlertmanagerStyleFile() {
        InhibitionRuleSet rules = loader.loadFile("classpath:inhibition-rules.yml");

        assertEquals(3, rules.size());
        InhibitionRule nodeDown = rules.rules().get(0);
        assertEquals("node-down", nodeDown.getName());
        assertEquals(Map.of("alertname", "NodeDown"), nodeDown.getSourceMatch());
        assertEquals(List.of("node"), nodeDown.getEqual());
        assertEquals("rule-2", rules.rules().get(2).getName());
        assertTrue(rules.rules().get(2).matchesSource(Map.of("alertname", "ClusterUnreachable", "cluster", "eu")));
    }

    @Test
    void configuredFileTakesPrecedenceOverInlineRules() {
        properties.getInhibition().setRulesFile("classpath:inhibition-rules.yml");
        RuleConfig inline = new RuleConfig();
        inline.setSourceMatch(Map.of("a", "b"));
        inline.setTargetMatch(Map.of("c", "d"));
        properties.getInhibition().setRules(List.of(inline));

        assertEquals(3, loader.load().size());
    }

    @Test
    void loadsInlineRules() {
        RuleConfig rule = new RuleConfig();
        rule.setName("db-down");
        rule.setSourceMatch(Map.of("alertname", "DatabaseDown"));
        rule.setTargetMatchRe(Map.of("alertname", "Query.*"));
        rule.setEqual(List.of("cluster"));
        properties.getInhibition().setRules(List.of(rule));

        InhibitionRuleSet rules = loader.load();
        assertEquals(1, rules.size());
        assertTrue(rules.find("db-down").isPresent());
        assertTrue(rules.rules().get(0).matchesTarget(Map.of("alertname", "QueryLatencyHigh")));
    }

    @Test
    void rejectsInvalidRegexWithRulePath() {
        String yaml = """
                inhibit_rules:
                  - source_match_re:
                      severity: "(critical"
                    target_match:
                      severity: warning
                """;
        ValidationException e = assertThrows(ValidationException.class, () -> loader.parse(yaml, "test"));
        assertEquals("rules[0].source_match_re.severity", e.getField());
        assertEquals("valid_regex", e.getConstraint());
    }

    @Test
    void rejectsRuleWithoutTargetConditions() {
        String yaml = """
                inhibit_rules:
                  - source_match:
                      alertname: NodeDown
                    equal: [node]
                """;
        ValidationException e = assertThrows(ValidationException.class, () -> loader.parse(yaml, "test"));
        assertEquals("rules[0].target_match", e.getField());
        assertEquals("required", e.getConstraint());
    }

    @Test
    void rejectsInvalidEqualLabel() {
        String yaml = """
                inhibit_rules:
                  - source_match: { alertname: A }
                    target_match: { alertname: B }
                    equal: [node, "bad-label"]
                """;
        ValidationException e = assertThrows(ValidationException.class, () -> loader.parse(yaml, "test"));
        assertEquals("rules[0].equal[1]", e.getField());
    }

    @Test
    void rejectsDuplicateNames() {
        String yaml = """
                inhibit_rules:
                  - name: same
                    source_match: { alertname: A }
                    target_match: { alertname: B }
                  - name: same
                    source_match: { alertname: C }
                    target_match: { alertname: D }
                """;
        ValidationException e = assertThrows(ValidationException.class, () -> loader.parse(yaml, "test"));
        assertEquals("rules[1].name", e.getField());
    }

    @Test
    void missingFileIsRejected() {
        ValidationException e = assertThrows(ValidationException.class, () -> loader.loadFile("classpath:nope.yml"));
        assertEquals("rulesFile", e.getField());
    }
}
