package com.example.statements.application.service;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.domain.model.ValidationErrorKind;
import com.example.statements.domain.model.ValidationResult;
import com.example.statements.support.StatementFixtures;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for the statement compatibility verdict.
 */
class BankStatementValidatorTest {

    private final BankStatementValidator validator = new BankStatementValidator(
            new ScanDetector(ExtractionProperties.defaults()),
            BankSignatureRegistry.load(new ObjectMapper(), new ClassPathResource("bank-signatures.json")));

    @Test
    void recognizesSupportedBank() {
        String text = StatementFixtures.nativeText(List.of("LCL Banque et assurance"), List.of());

        ValidationResult result = validator.validate(text);

        assertThat(result.compatible()).isTrue();
        assertThat(result.bank()).isEqualTo("LCL");
        assertThat(result.errorKind()).isNull();
        assertThat(result.supportedBanks()).containsOnlyKeys("CA", "BP", "LCL");
    }

    /**
     * Ensures the scan verdict wins over a matching signature.
     */
    @Test
    void shortTextIsRejectedAsScanned() {
        ValidationResult result = validator.validate("CREDIT AGRICOLE 15.03 BOULANGERIE 12,50");

        assertThat(result.compatible()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ValidationErrorKind.SCANNED);
        assertThat(result.bank()).isNull();
        assertThat(result.supportedBanks()).hasSize(3);
    }

    @Test
    void documentScanVerdictIsHonoredForNativeLookingText() {
        ValidationResult result = validator.validate(StatementFixtures.creditAgricoleStatement(), true);

        assertThat(result.compatible()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ValidationErrorKind.SCANNED);
        assertThat(result.bank()).isNull();
    }

    @Test
    void unknownBankIsNotSupported() {
        ValidationResult result = validator.validate(StatementFixtures.unknownBankStatement());

        assertThat(result.compatible()).isFalse();
        assertThat(result.errorKind()).isEqualTo(ValidationErrorKind.BANK_NOT_SUPPORTED);
        assertThat(result.message()).contains("Crédit Agricole", "Banque Populaire");
    }
}
