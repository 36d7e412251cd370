package com.example.statements.infrastructure.ocr;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.infrastructure.exception.OcrProcessingException;

import net.sourceforge.tess4j.Tesseract;
import net.sourceforge.tess4j.TesseractException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;

/**
 * {@link OcrEngine} backed by the native Tesseract library through Tess4J.
 * A fresh {@link Tesseract} handle is created per page because the native API is not thread-safe.
 */
@Component
public class TesseractOcrEngine implements OcrEngine {

    private static final Logger log = LoggerFactory.getLogger(TesseractOcrEngine.class);

    private final ExtractionProperties.Ocr settings;

    public TesseractOcrEngine(ExtractionProperties properties) {
        this.settings = properties.ocr();
    }

    @Override
    public String recognize(BufferedImage image) {
        if (image == null) {
            throw new OcrProcessingException("No page image to recognize.");
        }
        try {
            String text = newTesseract().doOCR(image);
            return text == null ? "" : text;
        } catch (TesseractException ex) {
            throw new OcrProcessingException("Tesseract failed to recognize the page.", ex);
        } catch (LinkageError ex) {
            log.error("Tesseract native library could not be loaded: {}", ex.getMessage());
            throw new OcrProcessingException("Tesseract native library is not available.", ex);
        }
    }

    private Tesseract newTesseract() {
        Tesseract tesseract = new Tesseract();
        String dataPath = settings.dataPath() != null ? settings.dataPath() : System.getenv("TESSDATA_PREFIX");
        if (dataPath != null) {
            tesseract.setDatapath(dataPath);
        }
        tesseract.setLanguage(settings.language());
        tesseract.setPageSegMode(settings.pageSegMode());
        tesseract.setVariable("user_defined_dpi", String.valueOf(settings.dpi()));
        return tesseract;
    }
}
