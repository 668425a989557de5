package dev.nuclr.thumbgrid.pipeline;

import javax.imageio.ImageIO;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Scale-and-crop transform that fills a target box exactly, keeping the
 * source aspect ratio and cutting off the overflow around the centre.
 */
public final class CoverCrop {

    private CoverCrop() {}

    /** Height of the box for {@code width} at the given aspect ratio, at least 1. */
    public static int boxHeight(int width, int aspectWidth, int aspectHeight) {
        return Math.max(1, (int) Math.round(width * (double) aspectHeight / aspectWidth));
    }

    /**
     * Crop the centred region of {@code src} that has the target aspect ratio
     * and scale it to exactly {@code targetW x targetH}. Output is opaque RGB.
     */
    public static BufferedImage apply(BufferedImage src, int targetW, int targetH) {
        if (targetW <= 0 || targetH <= 0) {
            throw new IllegalArgumentException("Target box must be positive: " + targetW + "x" + targetH);
        }
        int srcW = src.getWidth();
        int srcH = src.getHeight();
        if (srcW <= 0 || srcH <= 0) {
            throw new IllegalArgumentException("Empty source image");
        }

        double targetRatio = (double) targetW / targetH;
        double srcRatio    = (double) srcW / srcH;

        int cropX = 0, cropY = 0, cropW = srcW, cropH = srcH;
        if (srcRatio > targetRatio) {
            // wider than the box: trim left and right
            cropW = Math.max(1, (int) (srcH * targetRatio));
            cropX = Math.max(0, (srcW - cropW) / 2);
        } else {
            // taller than the box: trim top and bottom
            cropH = Math.max(1, (int) (srcW / targetRatio));
            cropY = Math.max(0, (srcH - cropH) / 2);
        }

        BufferedImage out = new BufferedImage(targetW, targetH, BufferedImage.TYPE_INT_RGB);
        Graphics2D g2 = out.createGraphics();
        try {
            g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION, RenderingHints.VALUE_INTERPOLATION_BICUBIC);
            g2.setRenderingHint(RenderingHints.KEY_RENDERING,     RenderingHints.VALUE_RENDER_QUALITY);
            g2.drawImage(src,
                    0, 0, targetW, targetH,
                    cropX, cropY, cropX + cropW, cropY + cropH,
                    null);
        } finally {
            g2.dispose();
        }
        return out;
    }

    /** Decode any ImageIO-readable blob. */
    public static BufferedImage decode(byte[] data) throws IOException {
        BufferedImage img = ImageIO.read(new ByteArrayInputStream(data));
        if (img == null) {
            throw new IOException("Unsupported or corrupt image data (" + data.length + " bytes)");
        }
        return img;
    }

    public static byte[] encodePng(BufferedImage img) throws IOException {
        ByteArrayOutputStream out = new ByteArrayOutputStream(16 * 1024);
        if (!ImageIO.write(img, "png", out)) {
            throw new IOException("No PNG writer available");
        }
        return out.toByteArray();
    }
}
