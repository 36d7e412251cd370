package com.example.statements.infrastructure.ocr;

import java.awt.image.BufferedImage;

/**
 * Character recognition backend for one preprocessed page image.
 */
public interface OcrEngine {

    /**
     * @param image preprocessed page image
     * @return recognized text, possibly empty
     * @throws com.example.statements.infrastructure.exception.OcrProcessingException when recognition fails
     */
    String recognize(BufferedImage image);
}
