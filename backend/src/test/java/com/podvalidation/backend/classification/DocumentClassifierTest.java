package com.podvalidation.backend.classification;

import com.podvalidation.backend.model.AlternativeType;
import com.podvalidation.backend.model.DocumentType;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class DocumentClassifierTest {

    private static final String INVOICE_WITH_RAR_PHRASE = """
            INVOICE
            Invoice No: 123
            PO Number: 4500
            Bill To: Store
            Receiving Acknowledgement Receipt
            Total Cases: 10
            """;

    private static final String SHIP_DOCUMENT_TEXT = """
            SHIPMENT DOCUMENT
            Dispatch
            Ship Document
            Driver: Juan
            Security Guard
            Time Out: 14:30
            Carrier: ABC
            """;

    private final DocumentClassifier classifier = new DocumentClassifier(ClassificationSettings.defaults());

    @Test
    @DisplayName("RAR phrase wins over a page full of invoice keywords")
    void shouldPreferRarOverInvoice() {
        // When
        AutomaticClassification result = classifier.classify(INVOICE_WITH_RAR_PHRASE, 95.0,
                ClassificationContext.standalone());

        // Then
        assertThat(result.detectedType()).isEqualTo(DocumentType.RAR);
        assertThat(result.confidence()).isEqualTo(55.0);
        assertThat(result.matchedKeywords()).contains("receiving acknowledgement receipt", "total cases");
        assertThat(result.alternativeTypes())
                .extracting(AlternativeType::type)
                .containsExactly(DocumentType.INVOICE);
        assertThat(result.inferredFromContext()).isFalse();
    }

    @Test
    @DisplayName("A short RAR phrase below the threshold still outranks an eligible invoice")
    void shouldPreferShortRarPhraseOverEligibleInvoice() {
        for (String phrase : List.of("RAR", "Delivery Receipt", "Receiving Report")) {
            // Given
            String text = """
                    SALES INVOICE
                    Invoice No: 88213
                    PO Number: 4500123
                    Bill To: Store
                    """ + phrase;

            // When
            AutomaticClassification result = classifier.classify(text, 95.0, ClassificationContext.standalone());

            // Then
            assertThat(result.detectedType()).as(phrase).isEqualTo(DocumentType.RAR);
            assertThat(result.confidence()).as(phrase).isEqualTo(25.0);
            assertThat(result.matchedKeywords()).as(phrase).containsExactly(phrase.toLowerCase());
            assertThat(result.alternativeTypes())
                    .extracting(AlternativeType::type)
                    .containsExactly(DocumentType.INVOICE);
            assertThat(result.alternativeTypes().get(0).confidence()).isEqualTo(40.0);
        }
    }

    @Test
    void shouldClassifyPlainInvoice() {
        // Given
        String text = """
                SALES INVOICE
                Invoice No: 88213
                PO Number: PO-4500123
                Bill To: Super8 Store
                Total Amount: 12,500.00
                """;

        // When
        AutomaticClassification result = classifier.classify(text, 92.0, ClassificationContext.standalone());

        // Then
        assertThat(result.detectedType()).isEqualTo(DocumentType.INVOICE);
        assertThat(result.confidence()).isEqualTo(43.33);
        assertThat(result.matchedKeywords())
                .containsExactly("invoice", "invoice no", "po number", "bill to", "total amount");
    }

    @Test
    void shouldReturnSameResultForSameInput() {
        // When
        AutomaticClassification first = classifier.classify(INVOICE_WITH_RAR_PHRASE, 80.0,
                ClassificationContext.standalone());
        AutomaticClassification second = classifier.classify(INVOICE_WITH_RAR_PHRASE, 80.0,
                ClassificationContext.standalone());

        // Then
        assertThat(second.detectedType()).isEqualTo(first.detectedType());
        assertThat(second.confidence()).isEqualTo(first.confidence());
        assertThat(second.matchedKeywords()).isEqualTo(first.matchedKeywords());
        assertThat(second.alternativeTypes()).isEqualTo(first.alternativeTypes());
    }

    @Test
    void shouldReturnUnknownForEmptyText() {
        assertThat(classifier.classify(null, 90.0, ClassificationContext.standalone()).detectedType())
                .isEqualTo(DocumentType.UNKNOWN);

        AutomaticClassification blank = classifier.classify("   \n ", 90.0, ClassificationContext.of(List.of()));
        assertThat(blank.detectedType()).isEqualTo(DocumentType.UNKNOWN);
        assertThat(blank.confidence()).isZero();
        assertThat(blank.alternativeTypes()).isEmpty();
        assertThat(blank.matchedKeywords()).isEmpty();
    }

    @Test
    void shouldCapConfidenceWhenOcrIsPoor() {
        // When
        AutomaticClassification clear = classifier.classify(SHIP_DOCUMENT_TEXT, null, ClassificationContext.standalone());
        AutomaticClassification poor = classifier.classify(SHIP_DOCUMENT_TEXT, 50.0, ClassificationContext.standalone());

        // Then
        assertThat(clear.detectedType()).isEqualTo(DocumentType.SHIP_DOCUMENT);
        assertThat(clear.confidence()).isEqualTo(100.0);
        assertThat(poor.detectedType()).isEqualTo(DocumentType.SHIP_DOCUMENT);
        assertThat(poor.confidence()).isEqualTo(50.0);
    }

    @Test
    @DisplayName("Detection threshold drops as OCR quality degrades")
    void shouldLowerThresholdForDegradedOcr() {
        // Given - invoice evidence worth 23.33% confidence
        String weakInvoice = "Bill To: Store\nPO Number 123\nInvoice";

        // When
        AutomaticClassification goodOcr = classifier.classify(weakInvoice, 90.0, ClassificationContext.standalone());
        AutomaticClassification degradedOcr = classifier.classify(weakInvoice, 70.0, ClassificationContext.standalone());

        // Then
        assertThat(goodOcr.detectedType()).isEqualTo(DocumentType.UNKNOWN);
        assertThat(goodOcr.confidence()).isEqualTo(23.33);
        assertThat(goodOcr.alternativeTypes())
                .extracting(AlternativeType::type)
                .containsExactly(DocumentType.INVOICE);
        assertThat(degradedOcr.detectedType()).isEqualTo(DocumentType.INVOICE);
    }

    @Test
    void shouldMatchOcrGarbledKeyword() {
        // Given
        String text = """
                1OSCAM PHILIPPINES
                Customer Transaction
                Pallet Exchange
                Docket No 5531
                """;

        // When
        AutomaticClassification result = classifier.classify(text, 85.0, ClassificationContext.standalone());

        // Then
        assertThat(result.detectedType()).isEqualTo(DocumentType.LOSCAM_DOCUMENT);
        assertThat(result.matchedKeywords()).contains("loscam (fuzzy: 1oscam)", "customer transaction");
    }

    @Test
    void shouldNotMatchKeywordInsideLongerWord() {
        // "rar" must not match inside "library"
        List<TypeScore> scores = classifier.score("library");

        assertThat(scores).allMatch(score -> score.score() == 0);
    }

    @Test
    void shouldInferMissingTypeFromDeliveryContext() {
        // Given - weak RAR evidence below the detection threshold
        String text = "Received by: Maria";
        ClassificationContext context = ClassificationContext.of(
                List.of(DocumentType.INVOICE, DocumentType.SHIP_DOCUMENT));

        // When
        AutomaticClassification inferred = classifier.classify(text, 90.0, context);
        AutomaticClassification standalone = classifier.classify(text, 90.0, ClassificationContext.standalone());

        // Then
        assertThat(inferred.detectedType()).isEqualTo(DocumentType.RAR);
        assertThat(inferred.inferredFromContext()).isTrue();
        assertThat(inferred.confidence()).isEqualTo(40.0);
        assertThat(standalone.detectedType()).isEqualTo(DocumentType.UNKNOWN);
        assertThat(standalone.inferredFromContext()).isFalse();
    }

    @Test
    void shouldInferShipDocumentWhenOnlyItIsMissing() {
        // Given
        String text = "Plate ABC-123\n14:30";
        List<DocumentType> siblings = List.of(
                DocumentType.PALLET_NOTIFICATION_LETTER,
                DocumentType.LOSCAM_DOCUMENT,
                DocumentType.CUSTOMER_PALLET_RECEIVING,
                DocumentType.INVOICE,
                DocumentType.RAR);

        // When
        AutomaticClassification result = classifier.classify(text, 55.0, ClassificationContext.of(siblings));

        // Then
        assertThat(result.detectedType()).isEqualTo(DocumentType.SHIP_DOCUMENT);
        assertThat(result.inferredFromContext()).isTrue();
        assertThat(result.confidence()).isEqualTo(40.0);
    }

    @Test
    void shouldNotInferShipDocumentWhileAnotherDocumentIsUnresolved() {
        // Given
        List<DocumentType> siblings = List.of(
                DocumentType.PALLET_NOTIFICATION_LETTER,
                DocumentType.LOSCAM_DOCUMENT,
                DocumentType.CUSTOMER_PALLET_RECEIVING,
                DocumentType.UNKNOWN);

        // When
        AutomaticClassification result = classifier.classify("Plate ABC-123", 90.0,
                ClassificationContext.of(siblings));

        // Then
        assertThat(result.detectedType()).isEqualTo(DocumentType.UNKNOWN);
        assertThat(result.inferredFromContext()).isFalse();
    }

    @Test
    void shouldRankScoresHighestFirst() {
        List<TypeScore> scores = classifier.score(INVOICE_WITH_RAR_PHRASE);

        assertThat(scores).hasSize(KeywordProfile.DEFAULTS.size());
        assertThat(scores.get(0).type()).isEqualTo(DocumentType.RAR);
        assertThat(scores.get(0).score()).isEqualTo(33.0);
        assertThat(scores.get(1).type()).isEqualTo(DocumentType.INVOICE);
        assertThat(scores.get(1).score()).isEqualTo(24.0);
    }

    @Test
    void shouldComputeEditDistance() {
        assertThat(DocumentClassifier.editDistance("kitten", "sitting")).isEqualTo(3);
        assertThat(DocumentClassifier.editDistance("loscam", "1oscam")).isEqualTo(1);
        assertThat(DocumentClassifier.editDistance("", "abc")).isEqualTo(3);
    }
}
