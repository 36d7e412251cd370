package com.example.statements.infrastructure.ocr;

import com.example.statements.infrastructure.exception.OcrProcessingException;

import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * Renders every page of a PDF to an RGB image for optical recognition.
 */
@Component
public class PdfPageRasterizer {

    /**
     * @param pdfBytes raw PDF bytes
     * @param dpi      target resolution
     * @return one image per page, in page order
     * @throws OcrProcessingException when the document cannot be loaded or a page cannot be rendered
     */
    public List<BufferedImage> rasterize(byte[] pdfBytes, int dpi) {
        if (pdfBytes == null || pdfBytes.length == 0) {
            throw new OcrProcessingException("No PDF content to rasterize.");
        }
        try (PDDocument document = Loader.loadPDF(pdfBytes)) {
            PDFRenderer renderer = new PDFRenderer(document);
            List<BufferedImage> images = new ArrayList<>(document.getNumberOfPages());
            for (int pageIndex = 0; pageIndex < document.getNumberOfPages(); pageIndex++) {
                images.add(renderer.renderImageWithDPI(pageIndex, dpi, ImageType.RGB));
            }
            return images;
        } catch (IOException ex) {
            throw new OcrProcessingException("Unable to rasterize the PDF pages.", ex);
        }
    }
}
