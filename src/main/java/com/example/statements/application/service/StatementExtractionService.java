package com.example.statements.application.service;

import com.example.statements.application.exception.ExtractionFailedException;
import com.example.statements.application.parser.LayoutParserSet;
import com.example.statements.config.ExtractionProperties;
import com.example.statements.config.TierPriority;
import com.example.statements.domain.exception.PdfFileRequiredException;
import com.example.statements.domain.exception.UnsupportedPdfFormatException;
import com.example.statements.domain.model.BankSignature;
import com.example.statements.domain.model.ExtractedDocument;
import com.example.statements.domain.model.ExtractionFailure;
import com.example.statements.domain.model.ExtractionMethod;
import com.example.statements.domain.model.ExtractionOutcome;
import com.example.statements.domain.model.ExtractionReport;
import com.example.statements.domain.model.FailureKind;
import com.example.statements.domain.model.StatementDiagnostics;
import com.example.statements.domain.model.StatementTable;
import com.example.statements.domain.model.StatementValidation;
import com.example.statements.domain.model.TierResult;
import com.example.statements.domain.model.TierStatus;
import com.example.statements.domain.model.ValidationResult;
import com.example.statements.infrastructure.exception.OcrProcessingException;
import com.example.statements.infrastructure.exception.PdfProcessingException;
import com.example.statements.infrastructure.pdf.PdfBoxTextExtractor;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Application service running the statement pipeline:
 * native text, scan check, optional OCR, validation, then the parsing tiers in priority order.
 * Only an incompatible verdict or exhausted tiers surface, as a typed {@link ExtractionFailure}.
 */
@Service
public class StatementExtractionService {

    private static final Logger log = LoggerFactory.getLogger(StatementExtractionService.class);

    private static final int PREVIEW_LENGTH = 2000;
    private static final int PREVIEW_LINES = 50;
    private static final String EXTRACTION_METHOD = "pdfbox";

    private final PdfBoxTextExtractor textExtractor;
    private final ScanDetector scanDetector;
    private final OpticalRecognitionService opticalRecognition;
    private final BankStatementValidator validator;
    private final BankSignatureRegistry registry;
    private final LayoutParserSet layoutParsers;
    private final LlmTransactionExtractor llmExtractor;
    private final StatementNormalizer normalizer;
    private final ExtractionProperties properties;

    public StatementExtractionService(PdfBoxTextExtractor textExtractor,
                                      ScanDetector scanDetector,
                                      OpticalRecognitionService opticalRecognition,
                                      BankStatementValidator validator,
                                      BankSignatureRegistry registry,
                                      LayoutParserSet layoutParsers,
                                      LlmTransactionExtractor llmExtractor,
                                      StatementNormalizer normalizer,
                                      ExtractionProperties properties) {
        this.textExtractor = textExtractor;
        this.scanDetector = scanDetector;
        this.opticalRecognition = opticalRecognition;
        this.validator = validator;
        this.registry = registry;
        this.layoutParsers = layoutParsers;
        this.llmExtractor = llmExtractor;
        this.normalizer = normalizer;
        this.properties = properties;
    }

	/**
	 * @param text statement text
	 * @return compatibility verdict
	 */
    public ValidationResult validate(String text) {
        return validator.validate(text);
    }

	/**
	 * Validates an upload on its native text layer and estimates how many lines the layout parser will read.
	 *
	 * @param file uploaded statement
	 * @return verdict and estimate
	 * @throws PdfFileRequiredException      when the file is null or empty
	 * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
	 * @throws PdfProcessingException        when the upload cannot be read
	 */
    public StatementValidation validate(MultipartFile file) {
        ExtractedDocument document = textExtractor.extract(readUpload(file));
        String text = document.text();
        ValidationResult result = validator.validate(text, scanDetector.isScanned(document));
        int estimate = result.compatible() ? estimateTransactions(text, result.bank()) : 0;
        return new StatementValidation(result, estimate);
    }

	/**
	 * Runs the full pipeline on an upload.
	 *
	 * @param file uploaded statement
	 * @return outcome or failure
	 * @throws PdfFileRequiredException      when the file is null or empty
	 * @throws UnsupportedPdfFormatException when the MIME type/name does not look like a PDF
	 * @throws PdfProcessingException        when the upload cannot be read
	 */
    public ExtractionReport extract(MultipartFile file) {
        return extract(readUpload(file));
    }

	/**
	 * Runs the pipeline and normalizes the result for export.
	 *
	 * @param file uploaded statement
	 * @return normalized table
	 * @throws ExtractionFailedException when the pipeline fails or no row survives normalization
	 */
    public StatementTable extractTable(MultipartFile file) {
        ExtractionReport report = extract(file);
        if (!report.successful()) {
            throw new ExtractionFailedException(report.failure());
        }
        return normalizer.normalizeTransactions(report.outcome().transactions())
                .orElseThrow(() -> new ExtractionFailedException(ExtractionFailure.of(
                        FailureKind.NO_TRANSACTIONS_FOUND, "No transaction with a valid date was found.")));
    }

	/**
	 * Runs the pipeline on raw PDF bytes. Never throws for document problems.
	 *
	 * @param pdfBytes raw PDF bytes
	 * @return outcome or failure
	 */
    public ExtractionReport extract(byte[] pdfBytes) {
        try {
            return runPipeline(pdfBytes);
        } catch (RuntimeException ex) {
            log.error("Unexpected extraction failure", ex);
            return ExtractionReport.failed(ExtractionFailure.of(FailureKind.EXTRACTION_ERROR,
                    "Unexpected error while extracting the statement."));
        }
    }

    private ExtractionReport runPipeline(byte[] pdfBytes) {
        ExtractedDocument document = textExtractor.extract(pdfBytes);
        String text = document.text();
        boolean scanned = scanDetector.isScanned(document);
        log.info("Native text: {} pages, {} characters, scanned={}", document.pageCount(), text.length(), scanned);

        boolean ocrApplied = false;
        if (scanned || text.strip().length() < properties.ocr().triggerLength()) {
            Optional<String> recognized = recognize(pdfBytes);
            if (recognized.isPresent()) {
                text = recognized.get();
                ocrApplied = true;
            }
        }

        if (text.strip().length() < properties.minimumTextLength()) {
            log.info("Text too short after extraction ({} characters)", text.strip().length());
            return ExtractionReport.failed(ExtractionFailure.of(FailureKind.UNREADABLE,
                    "The PDF contains no readable text."));
        }

        // recognized text gets its own scan check, native text keeps the page-based verdict
        ValidationResult validation = ocrApplied ? validator.validate(text) : validator.validate(text, scanned);
        if (!validation.compatible()) {
            return ExtractionReport.failed(ExtractionFailure.rejected(validation));
        }
        BankSignature bank = registry.find(validation.bank())
                .orElseThrow(() -> new IllegalStateException("Validated bank is missing from the registry: " + validation.bank()));

        for (ExtractionMethod method : tierOrder(ocrApplied)) {
            TierResult result = runTier(method, bank, text);
            log.info("Tier {} for {}: {} ({} transactions){}", method, bank.code(), result.status(),
                    result.transactions().size(), result.reason() == null ? "" : " - " + result.reason());
            if (result.status() == TierStatus.SUCCESS) {
                return ExtractionReport.success(new ExtractionOutcome(result.transactions(), method, bank.code()));
            }
        }
        return ExtractionReport.failed(ExtractionFailure.of(FailureKind.NO_TRANSACTIONS_FOUND,
                "No transaction could be extracted from this statement."));
    }

    private Optional<String> recognize(byte[] pdfBytes) {
        try {
            String recognized = opticalRecognition.recognize(pdfBytes);
            if (recognized == null || recognized.isBlank()) {
                log.warn("OCR produced no text, keeping the native text");
                return Optional.empty();
            }
            return Optional.of(recognized);
        } catch (OcrProcessingException ex) {
            log.warn("OCR failed, keeping the native text: {}", ex.getMessage());
            return Optional.empty();
        }
    }

    private List<ExtractionMethod> tierOrder(boolean ocrApplied) {
        ExtractionMethod layout = ocrApplied ? ExtractionMethod.OCR_REGEX : ExtractionMethod.NATIVE_REGEX;
        if (properties.tierPriority() == TierPriority.LLM_FIRST) {
            return List.of(ExtractionMethod.LLM, layout);
        }
        return List.of(layout, ExtractionMethod.LLM);
    }

    private TierResult runTier(ExtractionMethod method, BankSignature bank, String text) {
        if (method == ExtractionMethod.LLM) {
            return llmExtractor.extract(text, bank.code());
        }
        return layoutParsers.parse(bank.layoutKind(), text);
    }

	/**
	 * Counts the lines the bank's layout parser recognizes.
	 *
	 * @param text statement text
	 * @param bank signature code
	 * @return number of recognized transactions, 0 for unknown banks or parser failures
	 */
    public int estimateTransactions(String text, String bank) {
        return registry.find(bank)
                .map(signature -> layoutParsers.parse(signature.layoutKind(), text).transactions().size())
                .orElse(0);
    }

    public Map<String, String> supportedBanks() {
        return registry.supportedBanks();
    }

	/**
	 * Builds the troubleshooting view of an upload.
	 *
	 * @param file uploaded statement
	 * @return diagnostics of the native text layer
	 */
    public StatementDiagnostics diagnose(MultipartFile file) {
        return diagnose(readUpload(file));
    }

	/**
	 * Builds the troubleshooting view of a document without running the parsing tiers.
	 *
	 * @param pdfBytes raw PDF bytes
	 * @return diagnostics of the native text layer
	 */
    public StatementDiagnostics diagnose(byte[] pdfBytes) {
        ExtractedDocument document = textExtractor.extract(pdfBytes);
        String text = document.text();
        List<String> lines = LayoutParserSet.toLines(text);
        boolean scanned = scanDetector.isScanned(document);
        ValidationResult validation = validator.validate(text, scanned);
        return new StatementDiagnostics(
                pdfBytes == null ? 0 : pdfBytes.length,
                document.pageCount(),
                scanned,
                EXTRACTION_METHOD,
                text.length(),
                text.length() <= PREVIEW_LENGTH ? text : text.substring(0, PREVIEW_LENGTH),
                registry.detect(text).map(BankSignature::code).orElse(null),
                registry.keywordsFound(text),
                validation,
                lines.size(),
                lines.subList(0, Math.min(PREVIEW_LINES, lines.size()))
        );
    }

	/**
	 * Checks an upload and reads its bytes.
	 *
	 * @param file uploaded file
	 * @return file content
	 */
    private byte[] readUpload(MultipartFile file) {
        if (file == null || file.isEmpty()) {
            throw new PdfFileRequiredException();
        }
        if (!looksLikePdf(file)) {
            throw new UnsupportedPdfFormatException(file.getOriginalFilename());
        }
        try {
            return file.getBytes();
        } catch (IOException e) {
            throw new PdfProcessingException("Unable to read the uploaded PDF file.", e);
        }
    }

	/**
	 * Performs a lightweight MIME/extension check before handing the file to PDFBox.
	 *
	 * @param file uploaded file
	 * @return {@code true} when the file is declared as a PDF
	 */
    private boolean looksLikePdf(MultipartFile file) {
        String contentType = file.getContentType();
        if (contentType != null && contentType.equalsIgnoreCase("application/pdf")) {
            return true;
        }
        String fileName = file.getOriginalFilename();
        return fileName != null && fileName.toLowerCase(Locale.ROOT).endsWith(".pdf");
    }
}
