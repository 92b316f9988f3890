package com.example.alerthistory.inhibition;

import com.example.alerthistory.config.AlertHistoryProperties;
import com.example.alerthistory.config.AlertHistoryProperties.InhibitionConfig.RuleConfig;
import com.example.alerthistory.error.ValidationException;
import com.example.alerthistory.matcher.Matcher;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Loads and validates inhibition rules, either from an Alertmanager-style YAML file
 * ({@code alert-history.inhibition.rules-file}) or from the inline {@code alert-history.inhibition.rules}.
 * A configured file takes precedence over inline rules.
 *
 * Validation errors carry the offending path, e.g. {@code rules[2].source_match_re.severity}.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class InhibitionRuleLoader {

    private final AlertHistoryProperties properties;
    private final ResourceLoader resourceLoader;
    private final Clock clock;

    private final ObjectMapper yamlMapper = new ObjectMapper(new YAMLFactory());

    /**
     * Loads the configured rules. Throws {@link ValidationException} on any invalid rule.
     */
    public InhibitionRuleSet load() {
        String rulesFile = properties.getInhibition().getRulesFile();
        if (rulesFile != null && !rulesFile.isBlank()) {
            return loadFile(rulesFile);
        }
        List<InhibitRulesFile.RuleDefinition> inline = properties.getInhibition().getRules().stream()
                .map(InhibitionRuleLoader::toDefinition)
                .toList();
        return build(inline, "application configuration");
    }

    public InhibitionRuleSet loadFile(String location) {
        Resource resource = resourceLoader.getResource(location.contains(":") ? location : "file:" + location);
        if (!resource.exists()) {
            throw new ValidationException("rulesFile", "exists", "Inhibition rules file not found: " + location);
        }
        try (InputStream in = resource.getInputStream()) {
            InhibitRulesFile file = yamlMapper.readValue(in, InhibitRulesFile.class);
            return build(file == null ? List.of() : file.getInhibitRules(), location);
        } catch (JsonProcessingException e) {
            throw new ValidationException("rulesFile", "valid_yaml",
                    "Failed to parse inhibition rules " + location + ": " + e.getOriginalMessage(), e);
        } catch (IOException e) {
            throw new ValidationException("rulesFile", "readable",
                    "Failed to read inhibition rules " + location + ": " + e.getMessage(), e);
        }
    }

    /**
     * Parses a rules document given as a string.
     */
    public InhibitionRuleSet parse(String yaml, String source) {
        try {
            InhibitRulesFile file = yamlMapper.readValue(yaml, InhibitRulesFile.class);
            return build(file == null ? List.of() : file.getInhibitRules(), source);
        } catch (JsonProcessingException e) {
            throw new ValidationException("rules", "valid_yaml", "Failed to parse inhibition rules: " + e.getOriginalMessage(), e);
        }
    }

    InhibitionRuleSet build(List<InhibitRulesFile.RuleDefinition> definitions, String source) {
        List<InhibitionRule> rules = new ArrayList<>(definitions.size());
        Set<String> names = new HashSet<>();
        for (int i = 0; i < definitions.size(); i++) {
            InhibitionRule rule = compile(i, definitions.get(i));
            if (!names.add(rule.getName())) {
                throw new ValidationException("rules[" + i + "].name", "unique", "Duplicate inhibition rule name: " + rule.getName());
            }
            rules.add(rule);
        }
        log.info("Loaded {} inhibition rules from {}", rules.size(), source);
        return new InhibitionRuleSet(rules, source, clock.instant());
    }

    private InhibitionRule compile(int index, InhibitRulesFile.RuleDefinition def) {
        String path = "rules[" + index + "]";
        if (def == null) {
            throw new ValidationException(path, "required", "Inhibition rule " + index + " is empty");
        }
        String name = def.getName() == null || def.getName().isBlank() ? "rule-" + index : def.getName().strip();

        if (isEmpty(def.getSourceMatch()) && isEmpty(def.getSourceMatchRe())) {
            throw new ValidationException(path + ".source_match", "required",
                    "rule " + index + ": at least one of source_match or source_match_re required");
        }
        if (isEmpty(def.getTargetMatch()) && isEmpty(def.getTargetMatchRe())) {
            throw new ValidationException(path + ".target_match", "required",
                    "rule " + index + ": at least one of target_match or target_match_re required");
        }

        List<Matcher> source = new ArrayList<>();
        addMatchers(source, def.getSourceMatch(), false, path + ".source_match");
        addMatchers(source, def.getSourceMatchRe(), true, path + ".source_match_re");
        List<Matcher> target = new ArrayList<>();
        addMatchers(target, def.getTargetMatch(), false, path + ".target_match");
        addMatchers(target, def.getTargetMatchRe(), true, path + ".target_match_re");

        List<String> equal = def.getEqual() == null ? List.of() : def.getEqual();
        for (int j = 0; j < equal.size(); j++) {
            if (!Matcher.isValidLabelName(equal.get(j))) {
                throw new ValidationException(path + ".equal[" + j + "]", "valid_label_name",
                        "Invalid label name in equal: " + equal.get(j));
            }
        }

        return new InhibitionRule(name, def.getSourceMatch(), def.getSourceMatchRe(),
                def.getTargetMatch(), def.getTargetMatchRe(), equal, source, target);
    }

    private static void addMatchers(List<Matcher> into, Map<String, String> conditions, boolean regex, String path) {
        if (conditions == null) {
            return;
        }
        conditions.forEach((label, value) -> {
            String field = path + "." + label;
            try {
                into.add(regex ? Matcher.regex(label, value) : Matcher.equal(label, value));
            } catch (ValidationException e) {
                throw new ValidationException(field, e.getConstraint(), field + ": " + e.getMessage(), e);
            }
        });
    }

    private static boolean isEmpty(Map<String, String> map) {
        return map == null || map.isEmpty();
    }

    private static InhibitRulesFile.RuleDefinition toDefinition(RuleConfig config) {
        InhibitRulesFile.RuleDefinition def = new InhibitRulesFile.RuleDefinition();
        def.setName(config.getName());
        def.setSourceMatch(config.getSourceMatch());
        def.setSourceMatchRe(config.getSourceMatchRe());
        def.setTargetMatch(config.getTargetMatch());
        def.setTargetMatchRe(config.getTargetMatchRe());
        def.setEqual(config.getEqual());
        return def;
    }
}
