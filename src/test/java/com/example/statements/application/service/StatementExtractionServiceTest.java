package com.example.statements.application.service;

import com.example.statements.application.exception.ExtractionFailedException;
import com.example.statements.application.parser.AnchorDateLayoutParser;
import com.example.statements.application.parser.CompactDateLayoutParser;
import com.example.statements.application.parser.DotDateLayoutParser;
import com.example.statements.application.parser.LayoutParserSet;
import com.example.statements.config.ExtractionProperties;
import com.example.statements.config.TierPriority;
import com.example.statements.domain.exception.PdfFileRequiredException;
import com.example.statements.domain.exception.UnsupportedPdfFormatException;
import com.example.statements.domain.model.ExtractedDocument;
import com.example.statements.domain.model.ExtractionMethod;
import com.example.statements.domain.model.ExtractionReport;
import com.example.statements.domain.model.FailureKind;
import com.example.statements.domain.model.StatementDiagnostics;
import com.example.statements.domain.model.StatementTable;
import com.example.statements.domain.model.StatementValidation;
import com.example.statements.domain.model.TierResult;
import com.example.statements.domain.model.Transaction;
import com.example.statements.domain.model.ValidationErrorKind;
import com.example.statements.infrastructure.exception.OcrProcessingException;
import com.example.statements.infrastructure.ocr.ImagePreprocessor;
import com.example.statements.infrastructure.ocr.OcrEngine;
import com.example.statements.infrastructure.ocr.PdfPageRasterizer;
import com.example.statements.infrastructure.pdf.PdfBoxTextExtractor;
import com.example.statements.support.StatementFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;
import org.springframework.mock.web.MockMultipartFile;

import java.awt.image.BufferedImage;
import java.math.BigDecimal;
import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.LocalDate;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for the pipeline orchestration, with the text layer, OCR and language model stubbed.
 */
class StatementExtractionServiceTest {

    private static final byte[] PDF = "%PDF-1.7 stub".getBytes(StandardCharsets.US_ASCII);

    private final PdfBoxTextExtractor textExtractor = mock(PdfBoxTextExtractor.class);
    private final OpticalRecognitionService opticalRecognition = mock(OpticalRecognitionService.class);
    private final LlmTransactionExtractor llmExtractor = mock(LlmTransactionExtractor.class);
    private final BankSignatureRegistry registry =
            BankSignatureRegistry.load(new ObjectMapper(), new ClassPathResource("bank-signatures.json"));

    private StatementExtractionService service(TierPriority priority) {
        return service(priority, opticalRecognition);
    }

    private StatementExtractionService service(TierPriority priority, OpticalRecognitionService recognition) {
        ExtractionProperties properties = ExtractionProperties.defaults()
                .withDefaultYear(2025)
                .withTierPriority(priority);
        ScanDetector scanDetector = new ScanDetector(properties);
        LayoutParserSet layoutParsers = new LayoutParserSet(
                List.of(new DotDateLayoutParser(), new CompactDateLayoutParser(), new AnchorDateLayoutParser()),
                properties, Clock.systemUTC());
        return new StatementExtractionService(textExtractor, scanDetector, recognition,
                new BankStatementValidator(scanDetector, registry), registry, layoutParsers, llmExtractor,
                new StatementNormalizer(), properties);
    }

    private StatementExtractionService service() {
        return service(TierPriority.LAYOUT_FIRST);
    }

    private void givenNativeText(String text) {
        given(textExtractor.extract(any())).willReturn(ExtractedDocument.ofText(text));
    }

    /**
     * Ensures a native statement is parsed by the layout tier without OCR or language model.
     */
    @Test
    void extractUsesLayoutTierForNativeStatement() {
        givenNativeText(StatementFixtures.creditAgricoleStatement());

        ExtractionReport report = service().extract(PDF);

        assertThat(report.successful()).isTrue();
        assertThat(report.outcome().method()).isEqualTo(ExtractionMethod.NATIVE_REGEX);
        assertThat(report.outcome().bank()).isEqualTo("CA");
        assertThat(report.outcome().transactions()).extracting(Transaction::label)
                .containsExactly("BOULANGERIE PARIS", "PHARMACIE CENTRALE LYON");
        assertThat(report.outcome().transactions().get(0).occurredOn()).isEqualTo(LocalDate.of(2025, 3, 15));
        verify(opticalRecognition, never()).recognize(any());
        verify(llmExtractor, never()).extract(anyString(), anyString());
    }

    /**
     * Ensures the language model is tried when the layout parser finds nothing.
     */
    @Test
    void extractFallsBackToLanguageModel() {
        givenNativeText(StatementFixtures.creditAgricoleStatementWithoutOperations());
        Transaction transaction = new Transaction(LocalDate.of(2025, 10, 30), "CERTAS", new BigDecimal("-16.62"));
        given(llmExtractor.extract(anyString(), anyString())).willReturn(TierResult.of(List.of(transaction), "none"));

        ExtractionReport report = service().extract(PDF);

        assertThat(report.outcome().method()).isEqualTo(ExtractionMethod.LLM);
        assertThat(report.outcome().transactions()).containsExactly(transaction);
        verify(llmExtractor).extract(anyString(), eq("CA"));
    }

    @Test
    void extractReportsNoTransactionsWhenBothTiersFail() {
        givenNativeText(StatementFixtures.creditAgricoleStatementWithoutOperations());
        given(llmExtractor.extract(anyString(), anyString())).willReturn(TierResult.error("API key missing"));

        ExtractionReport report = service().extract(PDF);

        assertThat(report.successful()).isFalse();
        assertThat(report.failure().kind()).isEqualTo(FailureKind.NO_TRANSACTIONS_FOUND);
        assertThat(report.failure().reportable()).isTrue();
    }

    /**
     * Ensures the language model runs first and wins when configured so.
     */
    @Test
    void extractHonorsLanguageModelPriority() {
        givenNativeText(StatementFixtures.creditAgricoleStatement());
        Transaction transaction = new Transaction(LocalDate.of(2025, 3, 15), "BOULANGERIE", new BigDecimal("-12.50"));
        given(llmExtractor.extract(anyString(), anyString())).willReturn(TierResult.of(List.of(transaction), "none"));

        ExtractionReport report = service(TierPriority.LLM_FIRST).extract(PDF);

        assertThat(report.outcome().method()).isEqualTo(ExtractionMethod.LLM);
    }

    /**
     * Ensures a recognized scan proceeds through validation and is tagged as OCR output.
     */
    @Test
    void extractUsesOcrTextForScans() {
        givenNativeText("");
        given(opticalRecognition.recognize(PDF)).willReturn(StatementFixtures.creditAgricoleStatement());

        ExtractionReport report = service().extract(PDF);

        assertThat(report.successful()).isTrue();
        assertThat(report.outcome().method()).isEqualTo(ExtractionMethod.OCR_REGEX);
        assertThat(report.outcome().transactions()).hasSize(2);
    }

    @Test
    void extractReportsUnreadableWhenOcrFails() {
        givenNativeText("");
        given(opticalRecognition.recognize(PDF)).willThrow(new OcrProcessingException("Tesseract native library is not available."));

        ExtractionReport report = service().extract(PDF);

        assertThat(report.failure().kind()).isEqualTo(FailureKind.UNREADABLE);
    }

    /**
     * Ensures a Tesseract fault outside its own exception type still only empties the OCR tier.
     */
    @Test
    void extractReportsUnreadableWhenOcrEngineThrowsUnexpectedly() {
        givenNativeText("");
        PdfPageRasterizer rasterizer = mock(PdfPageRasterizer.class);
        given(rasterizer.rasterize(any(), anyInt()))
                .willReturn(List.of(new BufferedImage(20, 20, BufferedImage.TYPE_INT_RGB)));
        OcrEngine engine = image -> {
            throw new IllegalStateException("tessdata fra not found");
        };
        OpticalRecognitionService recognition = new OpticalRecognitionService(rasterizer, new ImagePreprocessor(),
                engine, ExtractionProperties.defaults());

        ExtractionReport report = service(TierPriority.LAYOUT_FIRST, recognition).extract(PDF);

        assertThat(report.successful()).isFalse();
        assertThat(report.failure().kind()).isEqualTo(FailureKind.UNREADABLE);
    }

    /**
     * Ensures the verdict taken on the leading pages wins over a full text that would pass the scan check.
     */
    @Test
    void extractKeepsScannedVerdictOfLeadingPages() {
        given(textExtractor.extract(any())).willReturn(
                new ExtractedDocument(List.of("p1", "p2", "p3", StatementFixtures.creditAgricoleStatement())));
        given(opticalRecognition.recognize(PDF)).willThrow(new OcrProcessingException("Tesseract failed."));

        ExtractionReport report = service().extract(PDF);

        assertThat(report.successful()).isFalse();
        assertThat(report.failure().kind()).isEqualTo(FailureKind.SCANNED);
        verify(llmExtractor, never()).extract(anyString(), any());
    }

    @Test
    void validateUploadUsesLeadingPagesForScanVerdict() {
        given(textExtractor.extract(any())).willReturn(
                new ExtractedDocument(List.of("p1", "p2", "p3", StatementFixtures.creditAgricoleStatement())));
        MockMultipartFile file = new MockMultipartFile("file", "releve.pdf", "application/pdf", PDF);

        StatementValidation validation = service().validate(file);

        assertThat(validation.result().compatible()).isFalse();
        assertThat(validation.result().errorKind()).isEqualTo(ValidationErrorKind.SCANNED);
        assertThat(validation.estimatedTransactions()).isZero();
    }

    /**
     * Ensures short native text that OCR cannot improve is rejected as a scan, which is not reportable.
     */
    @Test
    void extractRejectsShortTextAsScanned() {
        givenNativeText("CREDIT AGRICOLE releve de compte carte 15.03 BOULANGERIE PARIS 12,50 merci");
        given(opticalRecognition.recognize(PDF)).willReturn("   ");

        ExtractionReport report = service().extract(PDF);

        assertThat(report.failure().kind()).isEqualTo(FailureKind.SCANNED);
        assertThat(report.failure().reportable()).isFalse();
        assertThat(report.failure().validation()).isNotNull();
        verify(llmExtractor, never()).extract(anyString(), any());
    }

    @Test
    void extractRejectsUnsupportedBank() {
        givenNativeText(StatementFixtures.unknownBankStatement());

        ExtractionReport report = service().extract(PDF);

        assertThat(report.failure().kind()).isEqualTo(FailureKind.BANK_NOT_SUPPORTED);
        assertThat(report.failure().alertable()).isTrue();
        assertThat(report.failure().validation().supportedBanks()).containsOnlyKeys("CA", "BP", "LCL");
    }

    @Test
    void extractConvertsUnexpectedFaults() {
        given(textExtractor.extract(any())).willThrow(new IllegalStateException("boom"));

        ExtractionReport report = service().extract(PDF);

        assertThat(report.failure().kind()).isEqualTo(FailureKind.EXTRACTION_ERROR);
    }

    /**
     * Ensures uploads are checked before any processing.
     */
    @Test
    void extractRejectsInvalidUploads() {
        MockMultipartFile text = new MockMultipartFile("file", "note.txt", "text/plain", "plain".getBytes(StandardCharsets.UTF_8));
        MockMultipartFile empty = new MockMultipartFile("file", "empty.pdf", "application/pdf", new byte[0]);

        assertThrows(UnsupportedPdfFormatException.class, () -> service().extract(text));
        assertThrows(PdfFileRequiredException.class, () -> service().extract(empty));
        assertThrows(PdfFileRequiredException.class, () -> service().validate((MockMultipartFile) null));
    }

    @Test
    void validateUploadEstimatesTransactions() {
        givenNativeText(StatementFixtures.creditAgricoleStatement());
        MockMultipartFile file = new MockMultipartFile("file", "releve", "application/pdf", PDF);

        StatementValidation validation = service().validate(file);

        assertThat(validation.result().compatible()).isTrue();
        assertThat(validation.result().bank()).isEqualTo("CA");
        assertThat(validation.estimatedTransactions()).isEqualTo(2);
    }

    @Test
    void extractTableNormalizesSuccessfulOutcome() {
        givenNativeText(StatementFixtures.creditAgricoleStatement());
        MockMultipartFile file = new MockMultipartFile("file", "releve.pdf", "application/octet-stream", PDF);

        StatementTable table = service().extractTable(file);

        assertThat(table.rows()).extracting(StatementTable.Row::date).containsExactly("15/03/2025", "16/03/2025");
    }

    @Test
    void extractTableThrowsOnFailure() {
        givenNativeText(StatementFixtures.unknownBankStatement());
        MockMultipartFile file = new MockMultipartFile("file", "releve.pdf", "application/pdf", PDF);

        ExtractionFailedException ex = assertThrows(ExtractionFailedException.class, () -> service().extractTable(file));
        assertThat(ex.getFailure().kind()).isEqualTo(FailureKind.BANK_NOT_SUPPORTED);
    }

    /**
     * Ensures the diagnostics describe the native text layer.
     */
    @Test
    void diagnoseDescribesTextLayer() {
        givenNativeText(StatementFixtures.creditAgricoleStatement());

        StatementDiagnostics diagnostics = service().diagnose(PDF);

        assertThat(diagnostics.fileSizeBytes()).isEqualTo(PDF.length);
        assertThat(diagnostics.pageCount()).isEqualTo(1);
        assertThat(diagnostics.scanned()).isFalse();
        assertThat(diagnostics.extractionMethod()).isEqualTo("pdfbox");
        assertThat(diagnostics.bankDetected()).isEqualTo("CA");
        assertThat(diagnostics.keywordsFound()).containsOnlyKeys("CA");
        assertThat(diagnostics.validation().compatible()).isTrue();
        assertThat(diagnostics.firstLines()).startsWith("CREDIT AGRICOLE");
        assertThat(diagnostics.lineCount()).isEqualTo(9);
    }
}
