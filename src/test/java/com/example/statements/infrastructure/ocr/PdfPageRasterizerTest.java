package com.example.statements.infrastructure.ocr;

import com.example.statements.infrastructure.exception.OcrProcessingException;
import com.example.statements.support.StatementFixtures;
import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class PdfPageRasterizerTest {

    private final PdfPageRasterizer rasterizer = new PdfPageRasterizer();

    /**
     * Ensures one image per page is rendered at the requested resolution.
     *
     * @throws Exception when the sample PDF cannot be created
     */
    @Test
    void rasterizeRendersEveryPage() throws Exception {
        List<BufferedImage> images = rasterizer.rasterize(StatementFixtures.createPdf("one", "two"), 72);

        assertThat(images).hasSize(2);
        // US letter is 612 x 792 points
        assertThat(images.get(0).getWidth()).isEqualTo(612);
        assertThat(images.get(0).getHeight()).isEqualTo(792);
    }

    @Test
    void rasterizeRejectsUnreadableInput() {
        assertThrows(OcrProcessingException.class, () -> rasterizer.rasterize(new byte[0], 300));
        assertThrows(OcrProcessingException.class,
                () -> rasterizer.rasterize("not a pdf".getBytes(StandardCharsets.UTF_8), 300));
    }
}
