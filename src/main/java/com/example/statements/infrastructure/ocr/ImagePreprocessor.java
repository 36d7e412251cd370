package com.example.statements.infrastructure.ocr;

import net.sourceforge.tess4j.util.ImageHelper;
import org.springframework.stereotype.Component;

import java.awt.image.BufferedImage;
import java.awt.image.WritableRaster;
import java.util.Arrays;

/**
 * Cleans a rendered page before character recognition:
 * grayscale, contrast-limited adaptive histogram equalization (CLAHE), 3x3 median denoising and
 * Gaussian adaptive binarization.
 */
@Component
public class ImagePreprocessor {

    private static final double CLIP_LIMIT = 2.0;
    private static final int TILE_GRID = 8;
    private static final int BLOCK_SIZE = 11;
    private static final double THRESHOLD_OFFSET = 2.0;
    private static final int MAX_VALUE = 255;

    /**
     * Runs the whole chain.
     *
     * @param source rendered page
     * @return binarized image of the same size, every pixel either 0 or 255
     */
    public BufferedImage preprocess(BufferedImage source) {
        BufferedImage gray = ImageHelper.convertImageToGrayscale(source);
        int width = gray.getWidth();
        int height = gray.getHeight();
        int[] pixels = gray.getRaster().getSamples(0, 0, width, height, 0, (int[]) null);

        int[] equalized = equalize(pixels, width, height);
        int[] denoised = median(equalized, width, height);
        int[] binary = adaptiveThreshold(denoised, width, height);
        return toImage(binary, width, height);
    }

    /**
     * CLAHE: per-tile clipped histogram equalization, bilinearly blended between tile centers.
     */
    int[] equalize(int[] pixels, int width, int height) {
        int tileWidth = Math.max(1, (int) Math.ceil(width / (double) TILE_GRID));
        int tileHeight = Math.max(1, (int) Math.ceil(height / (double) TILE_GRID));
        int tilesX = (int) Math.ceil(width / (double) tileWidth);
        int tilesY = (int) Math.ceil(height / (double) tileHeight);

        int[][][] lookup = new int[tilesY][tilesX][];
        for (int ty = 0; ty < tilesY; ty++) {
            for (int tx = 0; tx < tilesX; tx++) {
                lookup[ty][tx] = tileLookup(pixels, width, height,
                        tx * tileWidth, ty * tileHeight, tileWidth, tileHeight);
            }
        }

        int[] result = new int[pixels.length];
        for (int y = 0; y < height; y++) {
            double fy = (y + 0.5) / tileHeight - 0.5;
            int ty0 = clamp((int) Math.floor(fy), 0, tilesY - 1);
            int ty1 = clamp(ty0 + 1, 0, tilesY - 1);
            double ay = clampUnit(fy - ty0);
            for (int x = 0; x < width; x++) {
                double fx = (x + 0.5) / tileWidth - 0.5;
                int tx0 = clamp((int) Math.floor(fx), 0, tilesX - 1);
                int tx1 = clamp(tx0 + 1, 0, tilesX - 1);
                double ax = clampUnit(fx - tx0);
                int value = pixels[y * width + x];
                double top = (1 - ax) * lookup[ty0][tx0][value] + ax * lookup[ty0][tx1][value];
                double bottom = (1 - ax) * lookup[ty1][tx0][value] + ax * lookup[ty1][tx1][value];
                result[y * width + x] = clamp((int) Math.round((1 - ay) * top + ay * bottom), 0, MAX_VALUE);
            }
        }
        return result;
    }

    private int[] tileLookup(int[] pixels, int width, int height, int startX, int startY, int tileWidth, int tileHeight) {
        int endX = Math.min(startX + tileWidth, width);
        int endY = Math.min(startY + tileHeight, height);
        int area = Math.max(1, (endX - startX) * (endY - startY));

        int[] histogram = new int[MAX_VALUE + 1];
        for (int y = startY; y < endY; y++) {
            for (int x = startX; x < endX; x++) {
                histogram[pixels[y * width + x]]++;
            }
        }

        int clipLimit = Math.max(1, (int) (CLIP_LIMIT * area / histogram.length));
        int excess = 0;
        for (int i = 0; i < histogram.length; i++) {
            if (histogram[i] > clipLimit) {
                excess += histogram[i] - clipLimit;
                histogram[i] = clipLimit;
            }
        }
        int share = excess / histogram.length;
        int residual = excess - share * histogram.length;
        for (int i = 0; i < histogram.length; i++) {
            histogram[i] += share;
        }
        if (residual > 0) {
            int step = Math.max(1, histogram.length / residual);
            for (int i = 0; i < histogram.length && residual > 0; i += step, residual--) {
                histogram[i]++;
            }
        }

        int[] lookup = new int[histogram.length];
        long cumulative = 0;
        for (int i = 0; i < histogram.length; i++) {
            cumulative += histogram[i];
            lookup[i] = clamp((int) Math.round(cumulative * (double) MAX_VALUE / area), 0, MAX_VALUE);
        }
        return lookup;
    }

    int[] median(int[] pixels, int width, int height) {
        int[] result = new int[pixels.length];
        int[] window = new int[9];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                int n = 0;
                for (int dy = -1; dy <= 1; dy++) {
                    int sy = clamp(y + dy, 0, height - 1);
                    for (int dx = -1; dx <= 1; dx++) {
                        int sx = clamp(x + dx, 0, width - 1);
                        window[n++] = pixels[sy * width + sx];
                    }
                }
                Arrays.sort(window);
                result[y * width + x] = window[4];
            }
        }
        return result;
    }

    /**
     * A pixel turns white when it is brighter than its Gaussian-weighted neighborhood mean minus the offset.
     */
    int[] adaptiveThreshold(int[] pixels, int width, int height) {
        double[] kernel = gaussianKernel(BLOCK_SIZE);
        int radius = BLOCK_SIZE / 2;

        double[] horizontal = new double[pixels.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double sum = 0;
                for (int k = -radius; k <= radius; k++) {
                    sum += kernel[k + radius] * pixels[y * width + clamp(x + k, 0, width - 1)];
                }
                horizontal[y * width + x] = sum;
            }
        }

        int[] result = new int[pixels.length];
        for (int y = 0; y < height; y++) {
            for (int x = 0; x < width; x++) {
                double mean = 0;
                for (int k = -radius; k <= radius; k++) {
                    mean += kernel[k + radius] * horizontal[clamp(y + k, 0, height - 1) * width + x];
                }
                result[y * width + x] = pixels[y * width + x] > mean - THRESHOLD_OFFSET ? MAX_VALUE : 0;
            }
        }
        return result;
    }

    private double[] gaussianKernel(int size) {
        // same sigma OpenCV derives from the block size
        double sigma = 0.3 * ((size - 1) * 0.5 - 1) + 0.8;
        double[] kernel = new double[size];
        int radius = size / 2;
        double total = 0;
        for (int i = 0; i < size; i++) {
            int offset = i - radius;
            kernel[i] = Math.exp(-(offset * offset) / (2 * sigma * sigma));
            total += kernel[i];
        }
        for (int i = 0; i < size; i++) {
            kernel[i] /= total;
        }
        return kernel;
    }

    private BufferedImage toImage(int[] pixels, int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_BYTE_GRAY);
        WritableRaster raster = image.getRaster();
        raster.setSamples(0, 0, width, height, 0, pixels);
        return image;
    }

    private static int clamp(int value, int min, int max) {
        return Math.max(min, Math.min(max, value));
    }

    private static double clampUnit(double value) {
        return Math.max(0d, Math.min(1d, value));
    }
}
