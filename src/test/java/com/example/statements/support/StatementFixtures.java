package com.example.statements.support;

import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.PDPage;
import org.apache.pdfbox.pdmodel.PDPageContentStream;
import org.apache.pdfbox.pdmodel.common.PDRectangle;
import org.apache.pdfbox.pdmodel.font.PDType1Font;
import org.apache.pdfbox.pdmodel.font.Standard14Fonts;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Statement texts and in-memory PDFs shared by the tests.
 */
public final class StatementFixtures {

    /** Neutral sentence with 13 alphabetic words and two banking keywords (compte, paiements). */
    public static final String FILLER =
            "Votre conseiller reste disponible pour toute question concernant votre compte bancaire et vos paiements";

    private StatementFixtures() {
    }

    /**
     * @param header     leading lines
     * @param operations transaction lines appended after the filler
     * @return text long and wordy enough to pass as a native statement
     */
    public static String nativeText(List<String> header, List<String> operations) {
        List<String> lines = new ArrayList<>(header);
        for (int i = 0; i < 5; i++) {
            lines.add(FILLER);
        }
        lines.addAll(operations);
        return String.join("\n", lines);
    }

    public static String creditAgricoleStatement() {
        return nativeText(
                List.of("CREDIT AGRICOLE", "RELEVE DE VOS OPERATIONS CARTE"),
                List.of("15.03 BOULANGERIE PARIS 12,50", "16.03 PHARMACIE CENTRALE LYON 8,20"));
    }

    public static String creditAgricoleStatementWithoutOperations() {
        return nativeText(List.of("CREDIT AGRICOLE", "RELEVE DE VOS OPERATIONS CARTE"), List.of());
    }

    public static String unknownBankStatement() {
        return nativeText(List.of("BANQUE EXEMPLE", "RELEVE DE COMPTE"), List.of("15.03 BOULANGERIE PARIS 12,50"));
    }

    /**
     * Writes one page per argument, each line of the page on its own text line.
     *
     * @param pages page texts, lines separated by {@code \n}; ASCII only
     * @return PDF bytes
     * @throws IOException when PDFBox cannot write the document
     */
    public static byte[] createPdf(String... pages) throws IOException {
        try (PDDocument document = new PDDocument();
             ByteArrayOutputStream outputStream = new ByteArrayOutputStream()) {
            for (String pageText : pages) {
                PDPage page = new PDPage(PDRectangle.LETTER);
                document.addPage(page);
                try (PDPageContentStream contentStream = new PDPageContentStream(document, page)) {
                    contentStream.beginText();
                    contentStream.setFont(new PDType1Font(Standard14Fonts.FontName.HELVETICA), 10);
                    contentStream.setLeading(14);
                    contentStream.newLineAtOffset(40, 740);
                    for (String line : Arrays.asList(pageText.split("\n"))) {
                        contentStream.showText(line);
                        contentStream.newLine();
                    }
                    contentStream.endText();
                }
            }
            document.save(outputStream);
            return outputStream.toByteArray();
        }
    }
}
