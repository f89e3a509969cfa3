package com.podvalidation.backend.validation;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.podvalidation.backend.exception.ConfigurationException;
import com.podvalidation.backend.model.ValidationRuleSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.Resource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Reads the bundled client rule sets, keyed by client identifier.
 */
@Component
public class ClientRuleLoader {

    private static final Logger log = LoggerFactory.getLogger(ClientRuleLoader.class);

    private static final TypeReference<LinkedHashMap<String, ValidationRuleSet>> RULE_SETS_TYPE =
            new TypeReference<>() {};

    private final ObjectMapper objectMapper;
    private final Resource rulesLocation;

    public ClientRuleLoader(ObjectMapper objectMapper,
            @Value("${pod.validation.rules-location:classpath:client-rules.json}") Resource rulesLocation) {
        this.objectMapper = objectMapper;
        this.rulesLocation = rulesLocation;
    }

    public Map<String, ValidationRuleSet> load() {
        try (InputStream input = rulesLocation.getInputStream()) {
            Map<String, ValidationRuleSet> raw = objectMapper.readValue(input, RULE_SETS_TYPE);
            Map<String, ValidationRuleSet> ruleSets = new LinkedHashMap<>();
            raw.forEach((clientId, ruleSet) -> ruleSets.put(clientId.trim().toUpperCase(Locale.ROOT), ruleSet));
            log.info("[REGISTRY] Loaded {} bundled rule set(s) from {}", ruleSets.size(), rulesLocation.getDescription());
            return ruleSets;
        } catch (IOException e) {
            throw new ConfigurationException("Cannot read client rule sets from " + rulesLocation.getDescription(), e);
        }
    }
}
