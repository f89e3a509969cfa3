package com.podvalidation.backend.validation;

import com.podvalidation.backend.model.CheckStatus;
import com.podvalidation.backend.model.ChecklistSectionType;
import com.podvalidation.backend.model.CompletenessSummary;
import com.podvalidation.backend.model.CrossDocumentValidationRules;
import com.podvalidation.backend.model.Delivery;
import com.podvalidation.backend.model.DeliveryItem;
import com.podvalidation.backend.model.DocumentClassification;
import com.podvalidation.backend.model.DocumentCompletenessRules;
import com.podvalidation.backend.model.DocumentType;
import com.podvalidation.backend.model.InvoiceValidationRules;
import com.podvalidation.backend.model.PalletScenario;
import com.podvalidation.backend.model.PalletValidationRules;
import com.podvalidation.backend.model.Peculiarity;
import com.podvalidation.backend.model.PeculiarityType;
import com.podvalidation.backend.model.PodDocument;
import com.podvalidation.backend.model.SectionResult;
import com.podvalidation.backend.model.Severity;
import com.podvalidation.backend.model.ShipDocumentValidationRules;
import com.podvalidation.backend.model.SignatureType;
import com.podvalidation.backend.model.SkippedSection;
import com.podvalidation.backend.model.StampDetection;
import com.podvalidation.backend.model.StampType;
import com.podvalidation.backend.model.ValidationCheck;
import com.podvalidation.backend.model.ValidationResult;
import com.podvalidation.backend.model.ValidationRuleSet;
import com.podvalidation.backend.model.ValidationSummary;

import java.time.Instant;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * Five-section checklist shared by all client validators.
 * <p>
 * Disabled sections are left out of the result. A section whose documents are missing is skipped
 * when the completeness section already reports them, so a missing document does not fail every
 * section that depends on it.
 * Subclasses adjust individual requirements through the protected hooks.
 */
public abstract class AbstractChecklistValidator implements DeliveryValidator {

    public static final double LOW_CONFIDENCE_THRESHOLD = 25.0;
    public static final double LOW_OCR_THRESHOLD = 60.0;

    static final String PALLET_DOCUMENTS_CHECK = "Pallet documents complete";

    protected final DocumentFieldExtractor fieldExtractor;

    protected AbstractChecklistValidator(DocumentFieldExtractor fieldExtractor) {
        this.fieldExtractor = fieldExtractor;
    }

    @Override
    public final ValidationResult validate(Delivery delivery, List<PodDocument> documents, ValidationRuleSet ruleSet) {
        Objects.requireNonNull(ruleSet, "ruleSet");
        DocumentIndex index = new DocumentIndex(documents == null ? List.of() : documents);

        DocumentCompletenessRules completeness = ruleSet.documentCompleteness();
        PalletScenario scenario = resolvePalletScenario(completeness.palletScenario(), index);
        Set<DocumentType> required = completeness.requiredTypes(scenario);
        Set<DocumentType> missingRequired = EnumSet.noneOf(DocumentType.class);
        required.stream().filter(type -> !index.has(type)).forEach(missingRequired::add);

        List<SectionResult> sections = new ArrayList<>();
        List<SkippedSection> skipped = new ArrayList<>();

        if (completeness.enabled()) {
            sections.add(section(ChecklistSectionType.DOCUMENT_COMPLETENESS,
                    checkCompleteness(completeness, scenario, required, index)));
        }

        PalletValidationRules palletRules = ruleSet.palletValidation();
        if (palletRules.enabled()) {
            if (scenario != PalletScenario.WITH_PALLETS) {
                skipped.add(skip(ChecklistSectionType.PALLET, "Delivery has no pallets"));
            } else if (DocumentType.PALLET_DOCUMENTS.stream().noneMatch(index::has)) {
                skipped.add(skip(ChecklistSectionType.PALLET, "No pallet documents present"));
            } else {
                sections.add(section(ChecklistSectionType.PALLET, checkPallet(palletRules, index)));
            }
        }

        ShipDocumentValidationRules shipRules = ruleSet.shipDocumentValidation();
        if (shipRules.enabled()) {
            runDependent(ChecklistSectionType.SHIP_DOCUMENT, EnumSet.of(DocumentType.SHIP_DOCUMENT),
                    missingRequired, index, sections, skipped,
                    () -> checkShipDocument(shipRules, scenario, index));
        }

        InvoiceValidationRules invoiceRules = ruleSet.invoiceValidation();
        if (invoiceRules.enabled()) {
            runDependent(ChecklistSectionType.INVOICE, EnumSet.of(DocumentType.INVOICE, DocumentType.RAR),
                    missingRequired, index, sections, skipped,
                    () -> checkInvoice(invoiceRules, index));
        }

        CrossDocumentValidationRules crossRules = ruleSet.crossDocumentValidation();
        if (crossRules.enabled()) {
            if (!crossRules.validateInvoiceRAR()) {
                skipped.add(skip(ChecklistSectionType.CROSS_DOCUMENT, "Invoice/RAR reconciliation disabled"));
            } else {
                runDependent(ChecklistSectionType.CROSS_DOCUMENT, EnumSet.of(DocumentType.INVOICE, DocumentType.RAR),
                        missingRequired, index, sections, skipped,
                        () -> checkCrossDocument(crossRules, index));
            }
        }

        return aggregate(delivery, scenario, sections, skipped, completenessSummary(required, missingRequired, index));
    }

    // Hooks

    protected PalletScenario resolvePalletScenario(PalletScenario configured, DocumentIndex index) {
        if (configured != null && configured != PalletScenario.AUTO_DETECT) {
            return configured;
        }
        boolean palletEvidence = DocumentType.PALLET_DOCUMENTS.stream().anyMatch(index::has)
                || index.anyStamp(StampType.PALLET);
        return palletEvidence ? PalletScenario.WITH_PALLETS : PalletScenario.WITHOUT_PALLETS;
    }

    protected boolean requiresSecuritySignature(ShipDocumentValidationRules rules, PalletScenario scenario) {
        return rules.requireSecuritySignature();
    }

    protected boolean requiresTimeOutField(ShipDocumentValidationRules rules, PalletScenario scenario) {
        return rules.requireTimeOutField();
    }

    // Sections

    private List<ValidationCheck> checkCompleteness(DocumentCompletenessRules rules, PalletScenario scenario,
            Set<DocumentType> required, DocumentIndex index) {
        List<ValidationCheck> checks = new ArrayList<>();
        for (DocumentType type : required) {
            String name = label(type) + " present";
            int count = index.of(type).size();
            if (count > 0) {
                checks.add(Checks.passed(name, count + " " + label(type) + " document(s) found"));
            } else {
                checks.add(Checks.failed(name, "Required document missing: " + type,
                        PeculiarityType.MISSING_REQUIRED_DOCUMENT, "documents"));
            }
        }

        if (rules.palletScenario() == PalletScenario.WITHOUT_PALLETS
                && DocumentType.PALLET_DOCUMENTS.stream().anyMatch(index::has)) {
            checks.add(Checks.warning("Pallet scenario",
                    "Pallet documents present although the delivery is configured without pallets",
                    PeculiarityType.CONFLICTING_INFORMATION, "documents"));
        }

        for (PodDocument document : index.all()) {
            DocumentClassification classification = document.getClassification();
            if (document.resolvedType() == DocumentType.UNKNOWN) {
                checks.add(Checks.warning("Document classified",
                        "Document " + document.displayName() + " could not be classified",
                        PeculiarityType.DOCUMENT_TYPE_UNKNOWN, "documents." + document.getId()));
            } else if (!classification.isManualOverride()
                    && (classification.getConfidence() < LOW_CONFIDENCE_THRESHOLD
                    || classification.isInferredFromContext())) {
                String basis = classification.isInferredFromContext()
                        ? "inferred from the other documents"
                        : String.format(Locale.ROOT, "classified with %.1f%% confidence", classification.getConfidence());
                checks.add(Checks.warning("Classification confidence",
                        "Document " + document.displayName() + " was " + basis + " as "
                                + classification.getDetectedType() + "; please review",
                        PeculiarityType.LOW_CLASSIFICATION_CONFIDENCE, "documents." + document.getId()));
            }
        }
        return checks;
    }

    private List<ValidationCheck> checkPallet(PalletValidationRules rules, DocumentIndex index) {
        List<ValidationCheck> checks = new ArrayList<>();

        List<DocumentType> missingPalletDocuments = DocumentType.PALLET_DOCUMENTS.stream()
                .filter(type -> !index.has(type))
                .toList();
        int palletDocumentsFound = DocumentType.PALLET_DOCUMENTS.size() - missingPalletDocuments.size();
        String countMessage = palletDocumentsFound + "/" + DocumentType.PALLET_DOCUMENTS.size()
                + " pallet documents found";
        if (missingPalletDocuments.isEmpty()) {
            checks.add(Checks.passed(PALLET_DOCUMENTS_CHECK, countMessage));
        } else {
            checks.add(Checks.failed(PALLET_DOCUMENTS_CHECK, countMessage + "; missing: "
                            + missingPalletDocuments.stream().map(DocumentType::name).collect(Collectors.joining(", ")),
                    PeculiarityType.MISSING_REQUIRED_DOCUMENT, "documents"));
        }

        List<PodDocument> notificationLetters = index.of(DocumentType.PALLET_NOTIFICATION_LETTER);
        if (!notificationLetters.isEmpty()) {
            if (rules.requireWarehouseStamp()) {
                checks.add(stampCheck("Pallet notification letter warehouse stamp", notificationLetters,
                        StampType.WAREHOUSE, false));
            }
            if (rules.requireWarehouseSignature()) {
                checks.add(signatureCheck("Pallet notification letter warehouse signature", notificationLetters,
                        EnumSet.of(SignatureType.WAREHOUSE_STAFF), false));
            }
        }

        List<PodDocument> loscamDocuments = index.of(DocumentType.LOSCAM_DOCUMENT);
        if (!loscamDocuments.isEmpty()) {
            if (rules.requireLoscamStamp()) {
                checks.add(stampCheck("Loscam stamp", loscamDocuments, StampType.LOSCAM, false));
            }
            if (rules.requireCustomerSignature()) {
                checks.add(signatureCheck("Loscam customer signature", loscamDocuments,
                        EnumSet.of(SignatureType.CUSTOMER, SignatureType.RECEIVER), false));
            }
        }

        List<PodDocument> receivingDocuments = index.of(DocumentType.CUSTOMER_PALLET_RECEIVING);
        if (!receivingDocuments.isEmpty() && rules.requireDriverSignature()) {
            checks.add(signatureCheck("Customer pallet receiving driver signature", receivingDocuments,
                    EnumSet.of(SignatureType.DRIVER), false));
        }
        return checks;
    }

    private List<ValidationCheck> checkShipDocument(ShipDocumentValidationRules rules, PalletScenario scenario,
            DocumentIndex index) {
        List<PodDocument> shipDocuments = index.of(DocumentType.SHIP_DOCUMENT);
        // an inferred ship document with poor OCR cannot be held to strict stamp checks
        boolean lenient = shipDocuments.stream().allMatch(this::isInferredWithPoorOcr);
        List<ValidationCheck> checks = new ArrayList<>();

        if (rules.requireDispatchStamp()) {
            checks.add(stampCheck("Dispatch stamp", shipDocuments, StampType.DISPATCH, lenient));
        }
        if (scenario == PalletScenario.WITH_PALLETS && rules.requirePalletStamp()) {
            checks.add(stampCheck("Pallet stamp", shipDocuments, StampType.PALLET, lenient));
        }
        if (scenario == PalletScenario.WITHOUT_PALLETS && rules.requireNoPalletStamp()) {
            checks.add(stampCheck("No pallet stamp", shipDocuments, StampType.NO_PALLET, lenient));
        }
        if (requiresSecuritySignature(rules, scenario)) {
            checks.add(signatureCheck("Security signature", shipDocuments, EnumSet.of(SignatureType.SECURITY), lenient));
        }
        if (rules.requireDriverSignature()) {
            checks.add(signatureCheck("Driver signature", shipDocuments, EnumSet.of(SignatureType.DRIVER), lenient));
        }
        if (requiresTimeOutField(rules, scenario)) {
            Optional<String> timeOut = shipDocuments.stream()
                    .map(document -> fieldExtractor.extractTimeOut(document.getRawText()))
                    .flatMap(Optional::stream)
                    .findFirst();
            if (timeOut.isPresent()) {
                checks.add(Checks.passed("Time-out field", "Time-out recorded at " + timeOut.get(),
                        Map.of("timeOut", timeOut.get())));
            } else {
                checks.add(Checks.warning("Time-out field", "Time-out field not found on ship document",
                        PeculiarityType.MISSING_REQUIRED_FIELD, "shipDocument.timeOut"));
            }
        }
        return checks;
    }

    private List<ValidationCheck> checkInvoice(InvoiceValidationRules rules, DocumentIndex index) {
        PodDocument invoice = index.first(DocumentType.INVOICE);
        PodDocument rar = index.first(DocumentType.RAR);
        List<ValidationCheck> checks = new ArrayList<>();

        if (rules.requirePOMatch() && rules.compares(InvoiceValidationRules.FIELD_PO_NUMBER)) {
            Optional<String> invoicePo = fieldExtractor.extractPoNumber(invoice.getRawText());
            Optional<String> rarPo = fieldExtractor.extractPoNumber(rar.getRawText());
            if (invoicePo.isEmpty() || rarPo.isEmpty()) {
                checks.add(Checks.warning("PO number match",
                        "poNumber could not be read from " + (invoicePo.isEmpty() ? "invoice" : "RAR"),
                        PeculiarityType.MISSING_REQUIRED_FIELD, "invoice.poNumber"));
            } else if (invoicePo.get().equals(rarPo.get())) {
                checks.add(Checks.passed("PO number match", "poNumber " + invoicePo.get() + " matches RAR",
                        Map.of("invoice", invoicePo.get(), "rar", rarPo.get())));
            } else {
                checks.add(Checks.of("PO number match", CheckStatus.FAILED,
                        "poNumber mismatch: invoice " + invoicePo.get() + ", RAR " + rarPo.get(),
                        PeculiarityType.CROSS_DOCUMENT_MISMATCH, "invoice.poNumber",
                        Map.of("invoice", invoicePo.get(), "rar", rarPo.get())));
            }
        }

        if (rules.requireTotalCasesMatch() && rules.compares(InvoiceValidationRules.FIELD_TOTAL_CASES)) {
            Optional<Integer> invoiceCases = totalCases(invoice);
            Optional<Integer> rarCases = totalCases(rar);
            if (invoiceCases.isEmpty() || rarCases.isEmpty()) {
                checks.add(Checks.warning("Total cases match",
                        "totalCases could not be determined from " + (invoiceCases.isEmpty() ? "invoice" : "RAR"),
                        PeculiarityType.DATA_UNAVAILABLE, "invoice.totalCases"));
            } else {
                int expected = invoiceCases.get();
                int actual = rarCases.get();
                double variance = variancePercent(expected, actual);
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("invoice", expected);
                details.put("rar", actual);
                details.put("variancePercent", variance);
                details.put("allowedVariancePercent", rules.allowedVariancePercent());
                if (variance <= rules.allowedVariancePercent()) {
                    checks.add(Checks.passed("Total cases match", String.format(Locale.ROOT,
                            "totalCases %d matches RAR %d within %.1f%%", expected, actual,
                            rules.allowedVariancePercent()), details));
                } else {
                    checks.add(Checks.of("Total cases match", CheckStatus.FAILED, String.format(Locale.ROOT,
                                    "totalCases mismatch: invoice %d, RAR %d (variance %.2f%% exceeds allowed %.1f%%)",
                                    expected, actual, variance, rules.allowedVariancePercent()),
                            PeculiarityType.QUANTITY_MISMATCH, "invoice.totalCases", details));
                }
            }
        }

        if (rules.requireItemLevelMatch() && rules.compares(InvoiceValidationRules.FIELD_ITEMS)) {
            Map<String, Integer> invoiceItems = itemQuantities(invoice);
            Map<String, Integer> rarItems = itemQuantities(rar);
            if (invoiceItems.isEmpty() || rarItems.isEmpty()) {
                checks.add(Checks.warning("Item level match",
                        "items not available on " + (invoiceItems.isEmpty() ? "invoice" : "RAR"),
                        PeculiarityType.DATA_UNAVAILABLE, "invoice.items"));
            } else {
                List<String> mismatches = itemMismatches(invoiceItems, rarItems);
                if (mismatches.isEmpty()) {
                    checks.add(Checks.passed("Item level match", invoiceItems.size() + " item(s) match RAR"));
                } else {
                    checks.add(Checks.of("Item level match", CheckStatus.FAILED,
                            "items mismatch: " + mismatches.size() + " line(s) differ",
                            PeculiarityType.QUANTITY_MISMATCH, "invoice.items", Map.of("mismatches", mismatches)));
                }
            }
        }
        return checks;
    }

    private List<ValidationCheck> checkCrossDocument(CrossDocumentValidationRules rules, DocumentIndex index) {
        PodDocument invoice = index.first(DocumentType.INVOICE);
        PodDocument rar = index.first(DocumentType.RAR);
        CheckStatus discrepancyStatus = rules.strictMode() ? CheckStatus.FAILED : CheckStatus.WARNING;
        List<ValidationCheck> checks = new ArrayList<>();
        int compared = 0;
        int discrepancies = 0;

        Optional<String> invoicePo = fieldExtractor.extractPoNumber(invoice.getRawText());
        Optional<String> rarPo = fieldExtractor.extractPoNumber(rar.getRawText());
        if (invoicePo.isPresent() && rarPo.isPresent()) {
            compared++;
            if (invoicePo.get().equals(rarPo.get())) {
                checks.add(Checks.passed("Invoice/RAR poNumber", "poNumber consistent"));
            } else {
                discrepancies++;
                checks.add(Checks.of("Invoice/RAR poNumber", discrepancyStatus,
                        "poNumber differs: invoice " + invoicePo.get() + ", RAR " + rarPo.get(),
                        PeculiarityType.CROSS_DOCUMENT_MISMATCH, "crossDocument.poNumber", null));
            }
        }

        Optional<Integer> invoiceCases = totalCases(invoice);
        Optional<Integer> rarCases = totalCases(rar);
        if (invoiceCases.isPresent() && rarCases.isPresent()) {
            compared++;
            if (invoiceCases.get().equals(rarCases.get())) {
                checks.add(Checks.passed("Invoice/RAR totalCases", "totalCases consistent"));
            } else {
                discrepancies++;
                checks.add(Checks.of("Invoice/RAR totalCases", discrepancyStatus,
                        "totalCases differs: invoice " + invoiceCases.get() + ", RAR " + rarCases.get(),
                        PeculiarityType.CROSS_DOCUMENT_MISMATCH, "crossDocument.totalCases", null));
            }
        }

        Map<String, Integer> invoiceItems = itemQuantities(invoice);
        Map<String, Integer> rarItems = itemQuantities(rar);
        if (!invoiceItems.isEmpty() && !rarItems.isEmpty()) {
            compared++;
            List<String> mismatches = itemMismatches(invoiceItems, rarItems);
            if (mismatches.isEmpty()) {
                checks.add(Checks.passed("Invoice/RAR items", "items consistent"));
            } else {
                discrepancies++;
                checks.add(Checks.of("Invoice/RAR items", discrepancyStatus,
                        "items differ on " + mismatches.size() + " line(s)",
                        PeculiarityType.CROSS_DOCUMENT_MISMATCH, "crossDocument.items",
                        Map.of("mismatches", mismatches)));
            }
        }

        if (compared == 0) {
            checks.add(Checks.warning("Invoice/RAR reconciliation",
                    "No comparable fields found on invoice and RAR",
                    PeculiarityType.DATA_UNAVAILABLE, "crossDocument"));
            return checks;
        }

        Map<String, Object> details = Map.of("discrepancies", discrepancies,
                "allowedDiscrepancyCount", rules.allowedDiscrepancyCount(), "strictMode", rules.strictMode());
        if (discrepancies == 0) {
            checks.add(Checks.passed("Invoice/RAR reconciliation", "No discrepancies between invoice and RAR", details));
        } else if (!rules.strictMode() && discrepancies <= rules.allowedDiscrepancyCount()) {
            checks.add(Checks.of("Invoice/RAR reconciliation", CheckStatus.WARNING,
                    discrepancies + " discrepancy(ies) within allowed " + rules.allowedDiscrepancyCount(),
                    PeculiarityType.CROSS_DOCUMENT_MISMATCH, "crossDocument", details));
        } else {
            String reason = rules.strictMode()
                    ? " (strict mode)"
                    : " exceed allowed " + rules.allowedDiscrepancyCount();
            checks.add(Checks.of("Invoice/RAR reconciliation", CheckStatus.FAILED,
                    discrepancies + " discrepancy(ies) between invoice and RAR" + reason,
                    PeculiarityType.CROSS_DOCUMENT_MISMATCH, "crossDocument", details));
        }
        return checks;
    }

    // Aggregation

    private ValidationResult aggregate(Delivery delivery, PalletScenario scenario, List<SectionResult> sections,
            List<SkippedSection> skipped, CompletenessSummary completeness) {
        List<ValidationCheck> all = sections.stream().flatMap(section -> section.getChecks().stream()).toList();
        List<ValidationCheck> failed = all.stream().filter(check -> check.getStatus() == CheckStatus.FAILED).toList();
        List<ValidationCheck> warnings = all.stream().filter(check -> check.getStatus() == CheckStatus.WARNING).toList();

        CheckStatus status;
        String message;
        if (!failed.isEmpty()) {
            status = CheckStatus.FAILED;
            message = "Validation failed: " + failed.get(0).getMessage() + more(failed.size() - 1, "failure");
        } else if (!warnings.isEmpty()) {
            status = CheckStatus.WARNING;
            message = "Validation passed with warnings: " + warnings.get(0).getMessage()
                    + more(warnings.size() - 1, "warning");
        } else {
            status = CheckStatus.PASSED;
            message = all.isEmpty() ? "No checks evaluated" : "All " + all.size() + " checks passed";
        }

        List<Peculiarity> peculiarities = new ArrayList<>();
        for (SectionResult section : sections) {
            for (ValidationCheck check : section.getChecks()) {
                if (check.getStatus() == CheckStatus.PASSED) {
                    continue;
                }
                peculiarities.add(Peculiarity.builder()
                        .type(check.getType() != null ? check.getType() : PeculiarityType.DATA_UNAVAILABLE)
                        .severity(check.getStatus() == CheckStatus.FAILED ? Severity.HIGH : Severity.MEDIUM)
                        .description(check.getMessage())
                        .section(section.getSection())
                        .fieldPath(check.getFieldPath())
                        .build());
            }
        }

        return ValidationResult.builder()
                .status(status)
                .message(message)
                .summary(ValidationSummary.builder()
                        .totalChecks(all.size())
                        .passed(all.size() - failed.size() - warnings.size())
                        .failed(failed.size())
                        .warnings(warnings.size())
                        .build())
                .validatorName(getName())
                .validatorVersion(getVersion())
                .clientIdentifier(delivery != null ? delivery.getClientIdentifier() : null)
                .palletScenario(scenario)
                .sections(sections)
                .skippedSections(skipped)
                .documentCompleteness(completeness)
                .peculiarities(peculiarities)
                .validatedAt(Instant.now())
                .build();
    }

    private CompletenessSummary completenessSummary(Set<DocumentType> required, Set<DocumentType> missing,
            DocumentIndex index) {
        List<DocumentType> extra = index.presentTypes().stream()
                .filter(type -> !required.contains(type))
                .toList();
        return CompletenessSummary.builder()
                .requiredDocuments(new ArrayList<>(required))
                .missingDocuments(new ArrayList<>(missing))
                .extraDocuments(new ArrayList<>(extra))
                .build();
    }

    // Helpers

    private void runDependent(ChecklistSectionType type, Set<DocumentType> needs, Set<DocumentType> missingRequired,
            DocumentIndex index, List<SectionResult> sections, List<SkippedSection> skipped,
            Supplier<List<ValidationCheck>> checks) {
        List<DocumentType> absent = needs.stream().filter(needed -> !index.has(needed)).toList();
        if (absent.isEmpty()) {
            sections.add(section(type, checks.get()));
            return;
        }
        String names = absent.stream().map(DocumentType::name).collect(Collectors.joining(", "));
        if (missingRequired.containsAll(absent)) {
            skipped.add(skip(type, "Missing required document: " + names));
            return;
        }
        // not reported by the completeness section, so surface it once here
        sections.add(section(type, List.of(Checks.warning("Documents available",
                "Section cannot run without " + names, PeculiarityType.DATA_UNAVAILABLE, "documents"))));
    }

    private ValidationCheck stampCheck(String name, List<PodDocument> documents, StampType stamp, boolean lenient) {
        if (documents.stream().allMatch(document -> document.getStampDetection() == null)) {
            return Checks.warning(name, "Stamp detection not available for " + describe(documents),
                    PeculiarityType.DATA_UNAVAILABLE, "stamps." + stamp);
        }
        if (documents.stream().anyMatch(document -> document.getStampDetection() != null
                && document.getStampDetection().hasStamp(stamp))) {
            return Checks.passed(name, stamp + " stamp found");
        }
        return Checks.of(name, lenient ? CheckStatus.WARNING : CheckStatus.FAILED,
                stamp + " stamp missing on " + describe(documents),
                PeculiarityType.MISSING_STAMP, "stamps." + stamp, null);
    }

    private ValidationCheck signatureCheck(String name, List<PodDocument> documents, Set<SignatureType> accepted,
            boolean lenient) {
        String wanted = accepted.stream().map(SignatureType::name).collect(Collectors.joining(" or "));
        if (documents.stream().allMatch(document -> document.getStampDetection() == null)) {
            return Checks.warning(name, "Signature detection not available for " + describe(documents),
                    PeculiarityType.DATA_UNAVAILABLE, "signatures." + wanted);
        }
        boolean found = documents.stream()
                .map(PodDocument::getStampDetection)
                .filter(Objects::nonNull)
                .anyMatch(detection -> hasAnySignature(detection, accepted));
        if (found) {
            return Checks.passed(name, wanted + " signature found");
        }
        return Checks.of(name, lenient ? CheckStatus.WARNING : CheckStatus.FAILED,
                wanted + " signature missing on " + describe(documents),
                PeculiarityType.SIGNATURE_MISSING, "signatures." + wanted, null);
    }

    private static boolean hasAnySignature(StampDetection detection, Set<SignatureType> accepted) {
        return accepted.stream().anyMatch(detection::hasSignature);
    }

    private boolean isInferredWithPoorOcr(PodDocument document) {
        DocumentClassification classification = document.getClassification();
        double ocr = document.getOcrConfidence() == null ? 100.0 : document.getOcrConfidence();
        return classification != null && classification.isInferredFromContext() && ocr < LOW_OCR_THRESHOLD;
    }

    /**
     * Line item sum when at least two items were read from a legible page, otherwise the summary
     * total printed on the page.
     */
    protected Optional<Integer> totalCases(PodDocument document) {
        List<Integer> quantities = document.getItems() == null ? List.of() : document.getItems().stream()
                .map(DeliveryItem::effectiveQuantity)
                .filter(Objects::nonNull)
                .toList();
        double ocr = document.getOcrConfidence() == null ? 100.0 : document.getOcrConfidence();
        if (quantities.size() >= 2 && ocr >= LOW_OCR_THRESHOLD) {
            int sum = quantities.stream().mapToInt(Integer::intValue).sum();
            if (sum <= DocumentFieldExtractor.MAX_PLAUSIBLE_CASES) {
                return Optional.of(sum);
            }
        }
        return fieldExtractor.extractTotalCases(document.getRawText());
    }

    private static Map<String, Integer> itemQuantities(PodDocument document) {
        Map<String, Integer> quantities = new LinkedHashMap<>();
        if (document.getItems() == null) {
            return quantities;
        }
        for (DeliveryItem item : document.getItems()) {
            if (item.getItemCode() == null || item.getItemCode().isBlank()) {
                continue;
            }
            Integer quantity = item.effectiveQuantity();
            quantities.merge(item.getItemCode().trim().toUpperCase(Locale.ROOT),
                    quantity == null ? 0 : quantity, Integer::sum);
        }
        return quantities;
    }

    private static List<String> itemMismatches(Map<String, Integer> invoiceItems, Map<String, Integer> rarItems) {
        List<String> mismatches = new ArrayList<>();
        invoiceItems.forEach((code, quantity) -> {
            Integer received = rarItems.get(code);
            if (received == null) {
                mismatches.add(code + " missing on RAR");
            } else if (!received.equals(quantity)) {
                mismatches.add(code + ": invoice " + quantity + ", RAR " + received);
            }
        });
        rarItems.keySet().stream()
                .filter(code -> !invoiceItems.containsKey(code))
                .forEach(code -> mismatches.add(code + " not on invoice"));
        return mismatches;
    }

    static double variancePercent(int expected, int actual) {
        int max = Math.max(Math.abs(expected), Math.abs(actual));
        if (max == 0) {
            return 0;
        }
        return Math.round(Math.abs(expected - actual) * 10000.0 / max) / 100.0;
    }

    private static String describe(List<PodDocument> documents) {
        return documents.stream().map(PodDocument::displayName).collect(Collectors.joining(", "));
    }

    private static String more(int count, String noun) {
        return count > 0 ? " (+" + count + " more " + noun + (count > 1 ? "s" : "") + ")" : "";
    }

    private static SectionResult section(ChecklistSectionType type, List<ValidationCheck> checks) {
        return SectionResult.builder().section(type).checks(new ArrayList<>(checks)).build();
    }

    private static SkippedSection skip(ChecklistSectionType type, String reason) {
        return SkippedSection.builder().section(type).reason(reason).build();
    }

    protected static String label(DocumentType type) {
        return switch (type) {
            case INVOICE -> "Invoice";
            case RAR -> "RAR";
            case PALLET_NOTIFICATION_LETTER -> "Pallet notification letter";
            case LOSCAM_DOCUMENT -> "Loscam document";
            case CUSTOMER_PALLET_RECEIVING -> "Customer pallet receiving";
            case SHIP_DOCUMENT -> "Ship document";
            case UNKNOWN -> "Unknown document";
        };
    }

    /**
     * Documents grouped by their classified type, in input order.
     */
    protected static final class DocumentIndex {

        private final List<PodDocument> all;
        private final Map<DocumentType, List<PodDocument>> byType = new EnumMap<>(DocumentType.class);

        DocumentIndex(List<PodDocument> documents) {
            this.all = List.copyOf(documents);
            for (PodDocument document : all) {
                byType.computeIfAbsent(document.resolvedType(), type -> new ArrayList<>()).add(document);
            }
        }

        public List<PodDocument> all() {
            return all;
        }

        public List<PodDocument> of(DocumentType type) {
            return byType.getOrDefault(type, List.of());
        }

        public boolean has(DocumentType type) {
            return !of(type).isEmpty();
        }

        public PodDocument first(DocumentType type) {
            return of(type).get(0);
        }

        public Set<DocumentType> presentTypes() {
            Set<DocumentType> present = EnumSet.noneOf(DocumentType.class);
            byType.keySet().stream().filter(type -> type != DocumentType.UNKNOWN).forEach(present::add);
            return present;
        }

        public boolean anyStamp(StampType stamp) {
            return all.stream().anyMatch(document -> document.getStampDetection() != null
                    && document.getStampDetection().hasStamp(stamp));
        }
    }
}
