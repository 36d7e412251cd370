package com.example.statements.application.service;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.infrastructure.exception.OcrProcessingException;
import com.example.statements.infrastructure.ocr.ImagePreprocessor;
import com.example.statements.infrastructure.ocr.OcrEngine;
import com.example.statements.infrastructure.ocr.PdfPageRasterizer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.awt.image.BufferedImage;
import java.util.ArrayList;
import java.util.List;

/**
 * Recovers the text of scanned statements: rasterize, clean up, recognize, page by page.
 */
@Service
public class OpticalRecognitionService {

    private static final Logger log = LoggerFactory.getLogger(OpticalRecognitionService.class);
    private static final String PAGE_SEPARATOR = "\n\n";

    private final PdfPageRasterizer rasterizer;
    private final ImagePreprocessor preprocessor;
    private final OcrEngine engine;
    private final ExtractionProperties.Ocr settings;

    public OpticalRecognitionService(PdfPageRasterizer rasterizer,
                                     ImagePreprocessor preprocessor,
                                     OcrEngine engine,
                                     ExtractionProperties properties) {
        this.rasterizer = rasterizer;
        this.preprocessor = preprocessor;
        this.engine = engine;
        this.settings = properties.ocr();
    }

	/**
	 * Recognizes every page of the document.
	 *
	 * @param pdfBytes raw PDF bytes
	 * @return page texts separated by a blank line
	 * @throws OcrProcessingException when any page fails; partial results are discarded
	 */
    public String recognize(byte[] pdfBytes) {
        List<BufferedImage> pages;
        try {
            pages = rasterizer.rasterize(pdfBytes, settings.dpi());
        } catch (OcrProcessingException ex) {
            throw ex;
        } catch (RuntimeException ex) {
            throw new OcrProcessingException("Page rendering failed.", ex);
        }
        log.info("OCR: {} pages rendered at {} DPI", pages.size(), settings.dpi());

        List<String> texts = new ArrayList<>(pages.size());
        for (int i = 0; i < pages.size(); i++) {
            BufferedImage cleaned;
            try {
                cleaned = preprocessor.preprocess(pages.get(i));
            } catch (RuntimeException ex) {
                throw new OcrProcessingException("Image preprocessing failed on page " + (i + 1) + ".", ex);
            }
            String text;
            try {
                text = engine.recognize(cleaned);
            } catch (OcrProcessingException ex) {
                throw ex;
            } catch (RuntimeException ex) {
                throw new OcrProcessingException("Character recognition failed on page " + (i + 1) + ".", ex);
            }
            log.debug("OCR page {}: {} characters", i + 1, text == null ? 0 : text.length());
            texts.add(text == null ? "" : text.strip());
        }

        String result = String.join(PAGE_SEPARATOR, texts);
        log.info("OCR: {} characters recognized", result.length());
        return result;
    }
}
