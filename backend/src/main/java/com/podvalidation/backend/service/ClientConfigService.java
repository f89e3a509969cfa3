package com.podvalidation.backend.service;

import com.podvalidation.backend.dto.ClientConfigRequest;
import com.podvalidation.backend.exception.NotFoundException;
import com.podvalidation.backend.model.ClientConfig;
import com.podvalidation.backend.model.ValidationRuleSet;
import com.podvalidation.backend.repository.ClientConfigRepository;
import com.podvalidation.backend.validation.ClientRuleRegistry;
import com.podvalidation.backend.validation.RegistryInfo;
import com.podvalidation.backend.validation.Super8ChecklistValidator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.Set;

/**
 * Administration of stored client rule sets. Every change reloads the rule registry.
 */
@Service
public class ClientConfigService {

    private static final Logger log = LoggerFactory.getLogger(ClientConfigService.class);

    private static final Set<String> PROTECTED_CLIENTS = Set.of(Super8ChecklistValidator.CLIENT_IDENTIFIER);

    private final ClientConfigRepository clientConfigRepository;
    private final ClientRuleRegistry ruleRegistry;

    public ClientConfigService(ClientConfigRepository clientConfigRepository, ClientRuleRegistry ruleRegistry) {
        this.clientConfigRepository = clientConfigRepository;
        this.ruleRegistry = ruleRegistry;
    }

    public List<ClientConfig> listActive() {
        return clientConfigRepository.findByActiveTrue();
    }

    public ClientConfig getConfig(String clientId) {
        String client = ClientRuleRegistry.normalize(clientId);
        return clientConfigRepository.findByClientIdAndActiveTrue(client)
                .orElseThrow(() -> new NotFoundException("Client configuration not found: " + client));
    }

    /**
     * Rule set in force for a client, stored or bundled, after default fallback.
     */
    public ValidationRuleSet getEffectiveRules(String clientId) {
        return ruleRegistry.getRuleSet(clientId);
    }

    public ClientConfig saveConfig(String clientId, ClientConfigRequest request) {
        String client = ClientRuleRegistry.normalize(clientId);
        if (client.isEmpty()) {
            throw new IllegalArgumentException("clientId is required");
        }
        String actor = request.getUpdatedBy() == null || request.getUpdatedBy().isBlank()
                ? "system"
                : request.getUpdatedBy();

        ClientConfig config = clientConfigRepository.findByClientId(client)
                .orElseGet(() -> ClientConfig.builder().clientId(client).createdBy(actor).build());
        config.setClientName(request.getClientName());
        config.setDescription(request.getDescription());
        config.setValidationRules(request.getValidationRules());
        config.setActive(true);
        config.setUpdatedBy(actor);

        ClientConfig saved = clientConfigRepository.save(config);
        log.info("[CLIENT_CONFIG] Saved: {} | by: {}", client, actor);
        ruleRegistry.reload();
        return saved;
    }

    public ClientConfig deactivate(String clientId, String actor) {
        String client = ClientRuleRegistry.normalize(clientId);
        if (PROTECTED_CLIENTS.contains(client)) {
            throw new IllegalArgumentException("Client configuration " + client + " cannot be deactivated");
        }
        ClientConfig config = getConfig(client);
        config.setActive(false);
        config.setUpdatedBy(actor == null || actor.isBlank() ? "system" : actor);

        ClientConfig saved = clientConfigRepository.save(config);
        log.info("[CLIENT_CONFIG] Deactivated: {} | by: {}", client, saved.getUpdatedBy());
        ruleRegistry.reload();
        return saved;
    }

    public RegistryInfo describeRegistry() {
        return ruleRegistry.describe();
    }

    public RegistryInfo reloadRegistry() {
        ruleRegistry.reload();
        return ruleRegistry.describe();
    }
}
