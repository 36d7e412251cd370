package com.example.statements.infrastructure.pdf;

import com.example.statements.domain.model.ExtractedDocument;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.text.PDFTextStripper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Infrastructure service that pulls the native text layer out of a statement PDF, page by page.
 * Unreadable documents are reported as empty; deciding what that means is left to the pipeline.
 */
@Service
public class PdfBoxTextExtractor {

    private static final Logger log = LoggerFactory.getLogger(PdfBoxTextExtractor.class);

    /**
     * Extracts the text of every page in order.
     *
     * @param pdfBytes raw PDF bytes
     * @return page texts, or {@link ExtractedDocument#empty()} when the bytes cannot be parsed
     */
    public ExtractedDocument extract(byte[] pdfBytes) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            return ExtractedDocument.empty();
        }
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFTextStripper stripper = new PDFTextStripper();
            configureStripper(stripper);
            List<String> pages = new ArrayList<>(document.getNumberOfPages());
            for (int pageNumber = 1; pageNumber <= document.getNumberOfPages(); pageNumber++) {
                stripper.setStartPage(pageNumber);
                stripper.setEndPage(pageNumber);
                String pageText = stripper.getText(document);
                pages.add(pageText == null ? "" : pageText.strip());
                log.debug("Page {}: {} characters", pageNumber, pages.get(pages.size() - 1).length());
            }
            return new ExtractedDocument(pages);
        } catch (IOException ex) {
            log.warn("Unable to read the PDF text layer ({} bytes): {}", pdfBytes.length, ex.getMessage());
            return ExtractedDocument.empty();
        }
    }

    /**
     * Applies the stripper settings used for statement text: reading order, plain line feeds.
     *
     * @param stripper stripper to configure
     */
    private void configureStripper(PDFTextStripper stripper) {
        stripper.setSortByPosition(true);
        stripper.setShouldSeparateByBeads(true);
        stripper.setSuppressDuplicateOverlappingText(true);
        stripper.setLineSeparator("\n");
        stripper.setWordSeparator(" ");
    }
}
