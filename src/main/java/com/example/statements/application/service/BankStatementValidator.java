package com.example.statements.application.service;

import com.example.statements.domain.model.BankSignature;
import com.example.statements.domain.model.ValidationErrorKind;
import com.example.statements.domain.model.ValidationResult;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.Map;
import java.util.Optional;

/**
 * Decides whether a statement text can be processed: not a scan, and issued by a supported bank.
 */
@Service
public class BankStatementValidator {

    private static final Logger log = LoggerFactory.getLogger(BankStatementValidator.class);

    static final String SCANNED_MESSAGE =
            "This PDF looks like a scanned image. Please upload the original statement downloaded from your bank.";
    static final String UNSUPPORTED_MESSAGE =
            "This bank is not supported yet. Supported banks: ";

    private final ScanDetector scanDetector;
    private final BankSignatureRegistry registry;

    public BankStatementValidator(ScanDetector scanDetector, BankSignatureRegistry registry) {
        this.scanDetector = scanDetector;
        this.registry = registry;
    }

    /**
     * Runs the scan check on the text itself, then looks for a bank signature.
     *
     * @param text statement text
     * @return verdict carrying the supported bank map
     */
    public ValidationResult validate(String text) {
        return validate(text, scanDetector.isScanned(text));
    }

    /**
     * Looks for a bank signature unless the source document was already classified as scanned.
     *
     * @param text    statement text
     * @param scanned scan verdict of the source document, usually from its leading pages
     * @return verdict carrying the supported bank map
     */
    public ValidationResult validate(String text, boolean scanned) {
        Map<String, String> supportedBanks = registry.supportedBanks();
        if (scanned) {
            log.info("Validation: scanned document");
            return ValidationResult.incompatible(ValidationErrorKind.SCANNED, SCANNED_MESSAGE, supportedBanks);
        }

        Optional<BankSignature> signature = registry.detect(text);
        if (signature.isEmpty()) {
            log.info("Validation: no bank signature matched");
            return ValidationResult.incompatible(ValidationErrorKind.BANK_NOT_SUPPORTED,
                    UNSUPPORTED_MESSAGE + String.join(", ", supportedBanks.values()) + ".", supportedBanks);
        }

        BankSignature bank = signature.get();
        log.info("Validation: recognized {}", bank.code());
        return ValidationResult.compatible(bank.code(), bank.description(), supportedBanks);
    }
}
