package com.podvalidation.backend.service;

import com.podvalidation.backend.dto.ClientConfigRequest;
import com.podvalidation.backend.exception.NotFoundException;
import com.podvalidation.backend.model.ClientConfig;
import com.podvalidation.backend.model.ValidationRuleSet;
import com.podvalidation.backend.repository.ClientConfigRepository;
import com.podvalidation.backend.validation.ClientRuleRegistry;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InjectMocks;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Optional;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ClientConfigServiceTest {

    @Mock
    private ClientConfigRepository clientConfigRepository;

    @Mock
    private ClientRuleRegistry ruleRegistry;

    @InjectMocks
    private ClientConfigService service;

    private final ValidationRuleSet rules = new ValidationRuleSet(null, null, null, null, null);

    @Test
    void shouldCreateConfigUnderNormalizedIdAndReload() {
        // Given
        when(clientConfigRepository.findByClientId("ACME")).thenReturn(Optional.empty());
        when(clientConfigRepository.save(any(ClientConfig.class))).thenAnswer(invocation -> invocation.getArgument(0));
        ClientConfigRequest request = ClientConfigRequest.builder()
                .clientName("Acme Retail")
                .validationRules(rules)
                .updatedBy("admin")
                .build();

        // When
        ClientConfig saved = service.saveConfig(" acme", request);

        // Then
        assertThat(saved.getClientId()).isEqualTo("ACME");
        assertThat(saved.getCreatedBy()).isEqualTo("admin");
        assertThat(saved.isActive()).isTrue();
        assertThat(saved.getValidationRules()).isSameAs(rules);
        verify(ruleRegistry).reload();
    }

    @Test
    void shouldReactivateExistingConfigOnSave() {
        // Given
        ClientConfig existing = ClientConfig.builder().id("cfg-1").clientId("ACME").active(false)
                .createdBy("first-admin").build();
        when(clientConfigRepository.findByClientId("ACME")).thenReturn(Optional.of(existing));
        when(clientConfigRepository.save(existing)).thenReturn(existing);

        // When
        ClientConfig saved = service.saveConfig("ACME", ClientConfigRequest.builder()
                .clientName("Acme Retail")
                .validationRules(rules)
                .build());

        // Then
        assertThat(saved.isActive()).isTrue();
        assertThat(saved.getCreatedBy()).isEqualTo("first-admin");
        assertThat(saved.getUpdatedBy()).isEqualTo("system");
    }

    @Test
    void shouldNotDeactivateSuper8() {
        assertThatThrownBy(() -> service.deactivate("super8", "admin"))
                .isInstanceOf(IllegalArgumentException.class);
        verify(clientConfigRepository, never()).save(any());
        verify(ruleRegistry, never()).reload();
    }

    @Test
    void shouldDeactivateAndReload() {
        // Given
        ClientConfig existing = ClientConfig.builder().clientId("ACME").build();
        when(clientConfigRepository.findByClientIdAndActiveTrue("ACME")).thenReturn(Optional.of(existing));
        when(clientConfigRepository.save(existing)).thenReturn(existing);

        // When
        ClientConfig saved = service.deactivate("acme", "admin");

        // Then
        assertThat(saved.isActive()).isFalse();
        assertThat(saved.getUpdatedBy()).isEqualTo("admin");
        verify(ruleRegistry).reload();
    }

    @Test
    void shouldReportMissingConfig() {
        when(clientConfigRepository.findByClientIdAndActiveTrue("ACME")).thenReturn(Optional.empty());

        assertThatThrownBy(() -> service.getConfig("acme"))
                .isInstanceOf(NotFoundException.class)
                .hasMessageContaining("ACME");
    }
}
