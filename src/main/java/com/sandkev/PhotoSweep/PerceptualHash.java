package com.sandkev.PhotoSweep;

import org.apache.commons.codec.binary.Hex;

import javax.imageio.ImageIO;
import java.awt.image.AreaAveragingScaleFilter;
import java.awt.image.BufferedImage;
import java.awt.image.FilteredImageSource;
import java.awt.image.ImageObserver;
import java.awt.image.ImageProducer;
import java.awt.image.PixelGrabber;
import java.io.IOException;
import java.io.InputStream;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * DCT based perceptual hash for images.
 * <p>
 * The image is flattened to RGB, area-averaged down to a 32x32 grid, converted to luminance
 * and transformed with a 2-D DCT. Of the low frequency 8x8 corner only rows 1..7 are kept
 * (the DC row is dropped), each of the 56 coefficients becomes one bit (above the mean or not)
 * and the bits are packed into 7 bytes, giving a 14 character hex string.
 * <p>
 * Re-encodes and minor pixel noise keep the same hash; equal hashes are treated as duplicates,
 * there is no hamming distance tolerance.
 */
public class PerceptualHash implements HashProvider {

    static final int GRID = 32;
    static final int BLOCK = 8;
    static final int BITS = (BLOCK - 1) * BLOCK;

    private static final double[][] COSINES = cosineTable();

    @Override
    public String getHashHex(Path file) throws IOException {
        BufferedImage image;
        try (InputStream data = Files.newInputStream(file)) {
            image = ImageIO.read(data);
        }
        if (image == null) {
            throw new IOException("no image reader can decode " + file);
        }
        return hash(image);
    }

    public String hash(BufferedImage image) throws IOException {
        double[][] luminance = luminance(scale(flatten(image)));
        double[][] coefficients = lowFrequencies(luminance);
        return Hex.encodeHexString(toBits(coefficients));
    }

    @Override
    public String describe() {
        return "PHASH";
    }

    /**
     * drops the alpha channel, colour values are kept as they are
     */
    static BufferedImage flatten(BufferedImage image) {
        if (!image.getColorModel().hasAlpha()) {
            return image;
        }
        int width = image.getWidth();
        int height = image.getHeight();
        BufferedImage rgb = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        int[] row = new int[width];
        for (int y = 0; y < height; y++) {
            image.getRGB(0, y, width, 1, row, 0, width);
            for (int x = 0; x < width; x++) {
                row[x] &= 0x00FFFFFF;
            }
            rgb.setRGB(0, y, width, 1, row, 0, width);
        }
        return rgb;
    }

    static int[] scale(BufferedImage image) throws IOException {
        ImageProducer producer = new FilteredImageSource(image.getSource(), new AreaAveragingScaleFilter(GRID, GRID));
        int[] pixels = new int[GRID * GRID];
        PixelGrabber grabber = new PixelGrabber(producer, 0, 0, GRID, GRID, pixels, 0, GRID);
        try {
            if (!grabber.grabPixels() || (grabber.getStatus() & ImageObserver.ABORT) != 0) {
                throw new IOException("unable to scale image");
            }
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new InterruptedIOException("interrupted while scaling image");
        }
        return pixels;
    }

    static double[][] luminance(int[] pixels) {
        double[][] grey = new double[GRID][GRID];
        for (int y = 0; y < GRID; y++) {
            for (int x = 0; x < GRID; x++) {
                int rgb = pixels[y * GRID + x];
                int r = (rgb >> 16) & 0xFF;
                int g = (rgb >> 8) & 0xFF;
                int b = rgb & 0xFF;
                grey[y][x] = Math.round(0.299 * r + 0.587 * g + 0.114 * b);
            }
        }
        return grey;
    }

    /**
     * Orthonormal DCT-II of the grid, only the top-left BLOCK x BLOCK coefficients are computed.
     */
    static double[][] lowFrequencies(double[][] grid) {
        double[][] rows = new double[GRID][BLOCK];
        for (int y = 0; y < GRID; y++) {
            for (int v = 0; v < BLOCK; v++) {
                double sum = 0;
                for (int x = 0; x < GRID; x++) {
                    sum += COSINES[v][x] * grid[y][x];
                }
                rows[y][v] = sum;
            }
        }
        double[][] coefficients = new double[BLOCK][BLOCK];
        for (int u = 0; u < BLOCK; u++) {
            for (int v = 0; v < BLOCK; v++) {
                double sum = 0;
                for (int y = 0; y < GRID; y++) {
                    sum += COSINES[u][y] * rows[y][v];
                }
                coefficients[u][v] = sum;
            }
        }
        return coefficients;
    }

    static byte[] toBits(double[][] coefficients) {
        double mean = 0;
        for (int u = 1; u < BLOCK; u++) {
            for (int v = 0; v < BLOCK; v++) {
                mean += coefficients[u][v];
            }
        }
        mean /= BITS;

        byte[] packed = new byte[BITS / 8];
        int bit = 0;
        for (int u = 1; u < BLOCK; u++) {
            for (int v = 0; v < BLOCK; v++) {
                if (coefficients[u][v] > mean) {
                    packed[bit / 8] |= (byte) (0x80 >>> (bit % 8));
                }
                bit++;
            }
        }
        return packed;
    }

    private static double[][] cosineTable() {
        double[][] table = new double[BLOCK][GRID];
        for (int k = 0; k < BLOCK; k++) {
            double scale = k == 0 ? Math.sqrt(1.0 / GRID) : Math.sqrt(2.0 / GRID);
            for (int n = 0; n < GRID; n++) {
                table[k][n] = scale * Math.cos(Math.PI * (2 * n + 1) * k / (2.0 * GRID));
            }
        }
        return table;
    }
}
