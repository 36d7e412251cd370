package com.example.statements.application.service;

import com.example.statements.config.ExtractionProperties;
import com.example.statements.infrastructure.exception.OcrProcessingException;
import com.example.statements.infrastructure.ocr.ImagePreprocessor;
import com.example.statements.infrastructure.ocr.OcrEngine;
import com.example.statements.infrastructure.ocr.PdfPageRasterizer;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.BDDMockito.given;
import static org.mockito.Mockito.mock;

/**
 * Unit tests for the page-by-page recognition flow.
 */
class OpticalRecognitionServiceTest {

    private final PdfPageRasterizer rasterizer = mock(PdfPageRasterizer.class);
    private final ImagePreprocessor preprocessor = mock(ImagePreprocessor.class);
    private final OcrEngine engine = mock(OcrEngine.class);
    private final OpticalRecognitionService service =
            new OpticalRecognitionService(rasterizer, preprocessor, engine, ExtractionProperties.defaults());

    private final BufferedImage first = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);
    private final BufferedImage second = new BufferedImage(10, 10, BufferedImage.TYPE_INT_RGB);

    /**
     * Ensures pages are rendered at the configured resolution and joined with a blank line.
     */
    @Test
    void recognizeJoinsPages() {
        byte[] pdf = {1, 2, 3};
        given(rasterizer.rasterize(pdf, 300)).willReturn(List.of(first, second));
        given(preprocessor.preprocess(any(BufferedImage.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(engine.recognize(first)).willReturn("page one\n");
        given(engine.recognize(second)).willReturn("page two");

        assertThat(service.recognize(pdf)).isEqualTo("page one\n\npage two");
    }

    @Test
    void recognizeAbortsOnEngineFailure() {
        given(rasterizer.rasterize(any(), eq(300))).willReturn(List.of(first, second));
        given(preprocessor.preprocess(any(BufferedImage.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(engine.recognize(first)).willReturn("page one");
        given(engine.recognize(second)).willThrow(new OcrProcessingException("Tesseract failed to recognize the page."));

        assertThrows(OcrProcessingException.class, () -> service.recognize(new byte[]{1}));
    }

    @Test
    void recognizeWrapsPreprocessingFailure() {
        given(rasterizer.rasterize(any(), eq(300))).willReturn(List.of(first));
        given(preprocessor.preprocess(any(BufferedImage.class))).willThrow(new IllegalArgumentException("bad raster"));

        OcrProcessingException ex = assertThrows(OcrProcessingException.class, () -> service.recognize(new byte[]{1}));
        assertThat(ex.getMessage()).contains("page 1");
    }

    @Test
    void recognizeWrapsUnexpectedEngineFailure() {
        given(rasterizer.rasterize(any(), eq(300))).willReturn(List.of(first, second));
        given(preprocessor.preprocess(any(BufferedImage.class))).willAnswer(invocation -> invocation.getArgument(0));
        given(engine.recognize(first)).willReturn("page one");
        given(engine.recognize(second)).willThrow(new IllegalStateException("tessdata fra not found"));

        OcrProcessingException ex = assertThrows(OcrProcessingException.class, () -> service.recognize(new byte[]{1}));
        assertThat(ex.getMessage()).contains("page 2");
        assertThat(ex.getCause()).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void recognizeWrapsUnexpectedRenderingFailure() {
        given(rasterizer.rasterize(any(), eq(300))).willThrow(new IllegalArgumentException("bad page tree"));

        OcrProcessingException ex = assertThrows(OcrProcessingException.class, () -> service.recognize(new byte[]{1}));
        assertThat(ex.getCause()).isInstanceOf(IllegalArgumentException.class);
    }
}
