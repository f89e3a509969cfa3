package com.podvalidation.backend.controller;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.podvalidation.backend.BaseE2ETest;
import com.podvalidation.backend.dto.BatchValidationRequest;
import com.podvalidation.backend.dto.CreateDeliveryRequest;
import com.podvalidation.backend.dto.RevalidateRequest;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryDocumentRef;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.repository.DeliveryRepository;
import com.podvalidation.backend.repository.PodDocumentRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.http.MediaType;
import org.springframework.test.web.servlet.MockMvc;

import java.util.List;

import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.*;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.*;

@AutoConfigureMockMvc
class DeliveryControllerE2ETest extends BaseE2ETest {

    @Autowired
    private MockMvc mockMvc;

    @Autowired
    private ObjectMapper objectMapper;

    @Autowired
    private DeliveryRepository deliveryRepository;

    @Autowired
    private PodDocumentRepository podDocumentRepository;

    @BeforeEach
    void setUp() {
        deliveryRepository.deleteAll();
        podDocumentRepository.deleteAll();
    }

    @Test
    void shouldCreateDeliveryWithNormalizedClient() throws Exception {
        CreateDeliveryRequest request = CreateDeliveryRequest.builder()
                .deliveryReference("DR-2024-0001")
                .clientIdentifier(" super8 ")
                .build();

        mockMvc.perform(post("/api/deliveries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.id").exists())
                .andExpect(jsonPath("$.clientIdentifier").value("SUPER8"))
                .andExpect(jsonPath("$.status").value("PENDING"))
                .andExpect(jsonPath("$.documents").isEmpty());
    }

    @Test
    void shouldRejectDuplicateReference() throws Exception {
        deliveryRepository.save(Delivery.builder().deliveryReference("DR-1").clientIdentifier("DEFAULT").build());
        CreateDeliveryRequest request = CreateDeliveryRequest.builder()
                .deliveryReference("DR-1")
                .clientIdentifier("DEFAULT")
                .build();

        mockMvc.perform(post("/api/deliveries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("INVALID_ARGUMENT"));
    }

    @Test
    void shouldRejectDeliveryWithoutClient() throws Exception {
        CreateDeliveryRequest request = CreateDeliveryRequest.builder()
                .deliveryReference("DR-2")
                .build();

        mockMvc.perform(post("/api/deliveries")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(request)))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"))
                .andExpect(jsonPath("$.message").value("clientIdentifier is required"));
    }

    @Test
    void shouldReturnNotFoundForUnknownDelivery() throws Exception {
        mockMvc.perform(get("/api/deliveries/nonexistent"))
                .andExpect(status().isNotFound());

        mockMvc.perform(post("/api/deliveries/nonexistent/validate"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.code").value("NOT_FOUND"));
    }

    @Test
    void shouldAttachDocumentAndValidate() throws Exception {
        Delivery delivery = deliveryRepository.save(Delivery.builder()
                .deliveryReference("DR-3")
                .clientIdentifier("DEFAULT")
                .build());
        PodDocument document = podDocumentRepository.save(PodDocument.builder()
                .rawText("Sales Invoice\nInvoice No: 88213\nPO Number: 4500123")
                .ocrConfidence(92.0)
                .build());

        mockMvc.perform(post("/api/deliveries/" + delivery.getId() + "/documents/" + document.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documents[0].documentId").value(document.getId()))
                .andExpect(jsonPath("$.documents[0].detectedType").value("UNKNOWN"));

        mockMvc.perform(post("/api/deliveries/" + delivery.getId() + "/classify"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].documentId").value(document.getId()))
                .andExpect(jsonPath("$[0].detectedType").value("INVOICE"));

        mockMvc.perform(post("/api/deliveries/" + delivery.getId() + "/validate"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validatorName").value("Generic Checklist Validator"))
                .andExpect(jsonPath("$.status").exists());

        mockMvc.perform(get("/api/deliveries/" + delivery.getId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("COMPLETED"))
                .andExpect(jsonPath("$.documents[0].detectedType").value("INVOICE"))
                .andExpect(jsonPath("$.processingMetadata.documentsProcessed").value(1));
    }

    @Test
    void shouldRevalidateUnderNewClient() throws Exception {
        Delivery delivery = deliveryRepository.save(Delivery.builder()
                .deliveryReference("DR-4")
                .clientIdentifier("DEFAULT")
                .build());

        mockMvc.perform(post("/api/deliveries/" + delivery.getId() + "/revalidate")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new RevalidateRequest("super8"))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.validatorName").value("Super8 Checklist Validator"))
                .andExpect(jsonPath("$.clientIdentifier").value("SUPER8"));
    }

    @Test
    void shouldReportAndRepairStaleReferences() throws Exception {
        Delivery delivery = deliveryRepository.save(Delivery.builder()
                .deliveryReference("DR-5")
                .clientIdentifier("DEFAULT")
                .build());
        PodDocument document = podDocumentRepository.save(PodDocument.builder()
                .deliveryId(delivery.getId())
                .rawText("Invoice")
                .build());
        deliveryRepository.appendDocument(delivery.getId(), DeliveryDocumentRef.builder()
                .documentId(document.getId())
                .detectedType(DocumentType.RAR)
                .build());

        mockMvc.perform(get("/api/deliveries/" + delivery.getId() + "/consistency"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.staleReferences[0].documentId").value(document.getId()))
                .andExpect(jsonPath("$.staleReferences[0].cachedType").value("RAR"))
                .andExpect(jsonPath("$.staleReferences[0].actualType").value("UNKNOWN"))
                .andExpect(jsonPath("$.repaired").isEmpty());

        mockMvc.perform(post("/api/deliveries/" + delivery.getId() + "/reconcile"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.repaired[0].documentId").value(document.getId()));

        mockMvc.perform(get("/api/deliveries/" + delivery.getId() + "/consistency"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.staleReferences").isEmpty());
    }

    @Test
    void shouldValidateBatchAndRejectEmptyBatch() throws Exception {
        Delivery delivery = deliveryRepository.save(Delivery.builder()
                .deliveryReference("DR-6")
                .clientIdentifier("DEFAULT")
                .build());

        mockMvc.perform(post("/api/deliveries/validate-batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new BatchValidationRequest(List.of(delivery.getId(), "missing")))))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].success").value(true))
                .andExpect(jsonPath("$[1].success").value(false))
                .andExpect(jsonPath("$[1].error").value("Delivery not found: missing"));

        mockMvc.perform(post("/api/deliveries/validate-batch")
                .contentType(MediaType.APPLICATION_JSON)
                .content(objectMapper.writeValueAsString(new BatchValidationRequest(List.of()))))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.code").value("VALIDATION_ERROR"));
    }
}
