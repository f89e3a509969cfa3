package com.podvalidation.backend.controller;

import com.podvalidation.backend.BaseE2ETest;
import com.podvalidation.backend.repository.ClientConfigRepository;
import com.podvalidation.backend.validation.ClientRuleRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class ClientConfigControllerE2ETest extends BaseE2ETest {

    private static final String ACME_CONFIG = """
            {
              "clientName": "Acme Retail",
              "updatedBy": "admin",
              "validationRules": {
                "invoiceValidation": {
                  "enabled": true,
                  "requirePOMatch": true,
                  "requireTotalCasesMatch": true,
                  "allowedVariancePercent": 5,
                  "requireItemLevelMatch": false,
                  "compareFields": ["poNumber", "totalCases"]
                }
              }
            }
            """;

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ClientConfigRepository clientConfigRepository;

    @Autowired
    private ClientRuleRegistry ruleRegistry;

    @BeforeEach
    void setUp() {
        clientConfigRepository.deleteAll();
        ruleRegistry.reload();
    }

    @Test
    void shouldServeBundledRulesForKnownClient() throws Exception {
        mockMvc.perform(get("/api/admin/clients/super8/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentCompleteness.requireLoscamDocument").value(true))
                .andExpect(jsonPath("$.invoiceValidation.requireItemLevelMatch").value(true));
    }

    @Test
    void shouldFallBackToDefaultRules() throws Exception {
        mockMvc.perform(get("/api/admin/clients/unknown-client/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.shipDocumentValidation.requireSecuritySignature").value(true))
                .andExpect(jsonPath("$.palletValidation.enabled").value(false));
    }

    @Test
    void shouldSaveConfigAndServeItAsEffectiveRules() throws Exception {
        mockMvc.perform(put("/api/admin/clients/acme")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ACME_CONFIG))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.clientId").value("ACME"))
                .andExpect(jsonPath("$.active").value(true))
                .andExpect(jsonPath("$.createdBy").value("admin"));

        mockMvc.perform(get("/api/admin/clients/ACME/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invoiceValidation.allowedVariancePercent").value(5.0))
                .andExpect(jsonPath("$.documentCompleteness.enabled").value(false));

        mockMvc.perform(get("/api/admin/clients"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].clientId").value("ACME"));

        mockMvc.perform(get("/api/admin/clients/registry"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.initialized").value(true))
                .andExpect(jsonPath("$.ruleSetClients").value(hasItem("ACME")));
    }

    @Test
    void shouldDeactivateStoredConfig() throws Exception {
        mockMvc.perform(put("/api/admin/clients/acme")
                .contentType(MediaType.APPLICATION_JSON)
                .content(ACME_CONFIG))
                .andExpect(status().isOk());

        mockMvc.perform(delete("/api/admin/clients/acme").param("actor", "admin"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.active").value(false));

        mockMvc.perform(get("/api/admin/clients/acme"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));

        mockMvc.perform(get("/api/admin/clients/acme/rules"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invoiceValidation.allowedVariancePercent").value(0.0));
    }

    @Test
    void shouldRefuseToDeactivateSuper8() throws Exception {
        mockMvc.perform(delete("/api/admin/clients/super8"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void shouldRejectConfigWithoutRules() throws Exception {
        mockMvc.perform(put("/api/admin/clients/acme")
                .contentType(MediaType.APPLICATION_JSON)
                .content("{\"clientName\": \"Acme Retail\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("validationRules is required"));
    }
}
