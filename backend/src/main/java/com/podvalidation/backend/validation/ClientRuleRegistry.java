package com.podvalidation.backend.validation;

import com.podvalidation.backend.exception.ConfigurationException;
import com.podvalidation.backend.model.ClientConfig;
import com.podvalidation.backend.model.ValidationRuleSet;
import com.podvalidation.backend.repository.ClientConfigRepository;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolves a client identifier to its validator and rule set.
 * <p>
 * Lookups read an immutable snapshot that {@link #initialize()} and {@link #reload()} replace
 * atomically, so a reload never changes the rules of a validation run already in progress.
 * Unknown clients fall back to the default client.
 */
@Component
public class ClientRuleRegistry {

    private static final Logger log = LoggerFactory.getLogger(ClientRuleRegistry.class);

    private final List<DeliveryValidator> validators;
    private final ClientRuleLoader ruleLoader;
    private final ClientConfigRepository clientConfigRepository;
    private final String defaultClient;

    private volatile Snapshot snapshot;

    public ClientRuleRegistry(List<DeliveryValidator> validators,
            ClientRuleLoader ruleLoader,
            ClientConfigRepository clientConfigRepository,
            @Value("${pod.validation.default-client:DEFAULT}") String defaultClient) {
        this.validators = validators;
        this.ruleLoader = ruleLoader;
        this.clientConfigRepository = clientConfigRepository;
        this.defaultClient = normalize(defaultClient);
    }

    @PostConstruct
    public void initialize() {
        Map<String, DeliveryValidator> byClient = new LinkedHashMap<>();
        for (DeliveryValidator validator : validators) {
            DeliveryValidator previous = byClient.put(normalize(validator.getClientIdentifier()), validator);
            if (previous != null) {
                throw new ConfigurationException("Duplicate validator for client " + validator.getClientIdentifier()
                        + ": " + previous.getName() + ", " + validator.getName());
            }
        }

        Map<String, ValidationRuleSet> ruleSets = new LinkedHashMap<>(ruleLoader.load());
        for (ClientConfig config : clientConfigRepository.findByActiveTrue()) {
            if (config.getValidationRules() != null) {
                ruleSets.put(normalize(config.getClientId()), config.getValidationRules());
            }
        }

        snapshot = new Snapshot(Map.copyOf(byClient), Map.copyOf(ruleSets));
        log.info("[REGISTRY] Initialized | validators: {} | rule sets: {} | default: {}",
                byClient.keySet(), ruleSets.keySet(), defaultClient);
    }

    public void reload() {
        log.info("[REGISTRY] Reloading client rule sets");
        initialize();
    }

    public boolean isInitialized() {
        return snapshot != null;
    }

    public DeliveryValidator getValidator(String clientIdentifier) {
        Snapshot current = requireSnapshot();
        String client = normalize(clientIdentifier);
        DeliveryValidator validator = current.validators().get(client);
        if (validator != null) {
            return validator;
        }
        DeliveryValidator fallback = current.validators().get(defaultClient);
        if (fallback == null) {
            throw new ConfigurationException("No validator registered for client '" + client
                    + "' and no default validator '" + defaultClient + "'");
        }
        log.debug("[REGISTRY] No validator for client {} | using default {}", client, fallback.getName());
        return fallback;
    }

    public ValidationRuleSet getRuleSet(String clientIdentifier) {
        Snapshot current = requireSnapshot();
        String client = normalize(clientIdentifier);
        ValidationRuleSet ruleSet = current.ruleSets().get(client);
        if (ruleSet != null) {
            return ruleSet;
        }
        ValidationRuleSet fallback = current.ruleSets().get(defaultClient);
        if (fallback == null) {
            throw new ConfigurationException("No rule set configured for client '" + client
                    + "' and no default rule set '" + defaultClient + "'");
        }
        return fallback;
    }

    public RegistryInfo describe() {
        Snapshot current = snapshot;
        if (current == null) {
            return new RegistryInfo(false, defaultClient, List.of(), List.of());
        }
        List<RegistryInfo.ValidatorInfo> validatorInfos = current.validators().values().stream()
                .map(validator -> new RegistryInfo.ValidatorInfo(normalize(validator.getClientIdentifier()),
                        validator.getName(), validator.getVersion()))
                .sorted((a, b) -> a.clientIdentifier().compareTo(b.clientIdentifier()))
                .toList();
        List<String> ruleSetClients = current.ruleSets().keySet().stream().sorted().toList();
        return new RegistryInfo(true, defaultClient, validatorInfos, ruleSetClients);
    }

    private Snapshot requireSnapshot() {
        Snapshot current = snapshot;
        if (current == null) {
            throw new ConfigurationException("Client rule registry used before initialization");
        }
        return current;
    }

    public static String normalize(String clientIdentifier) {
        return clientIdentifier == null ? "" : clientIdentifier.trim().toUpperCase(Locale.ROOT);
    }

    private record Snapshot(Map<String, DeliveryValidator> validators, Map<String, ValidationRuleSet> ruleSets) {
    }
}
