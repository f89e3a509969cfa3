package com.podvalidation.backend.controller;

import com.podvalidation.backend.dto.ClientConfigRequest;
import com.podvalidation.backend.model.ClientConfig;
import com.podvalidation.backend.model.ValidationRuleSet;
import com.podvalidation.backend.service.ClientConfigService;
import com.podvalidation.backend.validation.RegistryInfo;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.Valid;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.util.List;

@RestController
@RequestMapping("/api/admin/clients")
@Tag(name = "Client Configuration", description = "Client checklist rule sets")
public class ClientConfigController {

    private final ClientConfigService clientConfigService;

    public ClientConfigController(ClientConfigService clientConfigService) {
        this.clientConfigService = clientConfigService;
    }

    @GetMapping
    @Operation(summary = "List client configurations", description = "Active stored client rule sets")
    public ResponseEntity<List<ClientConfig>> listConfigs() {
        return ResponseEntity.ok(clientConfigService.listActive());
    }

    @GetMapping("/{clientId}")
    @Operation(summary = "Get client configuration")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Configuration found"),
            @ApiResponse(responseCode = "404", description = "No stored configuration")
    })
    public ResponseEntity<ClientConfig> getConfig(@Parameter(description = "Client ID") @PathVariable String clientId) {
        return ResponseEntity.ok(clientConfigService.getConfig(clientId));
    }

    @GetMapping("/{clientId}/rules")
    @Operation(summary = "Effective rules", description = "Rule set in force for a client after default fallback")
    public ResponseEntity<ValidationRuleSet> getEffectiveRules(
            @Parameter(description = "Client ID") @PathVariable String clientId) {
        return ResponseEntity.ok(clientConfigService.getEffectiveRules(clientId));
    }

    @PutMapping("/{clientId}")
    @Operation(summary = "Save client configuration", description = "Create or replace a client's rule set")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Configuration saved"),
            @ApiResponse(responseCode = "400", description = "Invalid request")
    })
    public ResponseEntity<ClientConfig> saveConfig(
            @Parameter(description = "Client ID") @PathVariable String clientId,
            @Valid @RequestBody ClientConfigRequest request) {
        return ResponseEntity.ok(clientConfigService.saveConfig(clientId, request));
    }

    @DeleteMapping("/{clientId}")
    @Operation(summary = "Deactivate client configuration")
    @ApiResponses({
            @ApiResponse(responseCode = "200", description = "Configuration deactivated"),
            @ApiResponse(responseCode = "400", description = "Configuration cannot be deactivated"),
            @ApiResponse(responseCode = "404", description = "No stored configuration")
    })
    public ResponseEntity<ClientConfig> deactivate(
            @Parameter(description = "Client ID") @PathVariable String clientId,
            @RequestParam(required = false) String actor) {
        return ResponseEntity.ok(clientConfigService.deactivate(clientId, actor));
    }

    @GetMapping("/registry")
    @Operation(summary = "Registry info", description = "Registered validators and configured clients")
    public ResponseEntity<RegistryInfo> getRegistryInfo() {
        return ResponseEntity.ok(clientConfigService.describeRegistry());
    }

    @PostMapping("/registry/reload")
    @Operation(summary = "Reload registry", description = "Rebuild the registry from bundled and stored rule sets")
    public ResponseEntity<RegistryInfo> reloadRegistry() {
        return ResponseEntity.ok(clientConfigService.reloadRegistry());
    }
}
