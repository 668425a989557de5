package dev.nuclr.thumbgrid.source;

import lombok.extern.slf4j.Slf4j;
import org.apache.pdfbox.Loader;
import org.apache.pdfbox.pdmodel.PDDocument;
import org.apache.pdfbox.pdmodel.encryption.InvalidPasswordException;
import org.apache.pdfbox.rendering.ImageType;
import org.apache.pdfbox.rendering.PDFRenderer;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.util.Optional;

/**
 * Renders the first page of a PDF with Apache PDFBox 3.x and hands it on as PNG.
 * Encrypted documents yield no source. Each call opens its own document, so
 * the source is safe for several workers.
 */
@Slf4j
public class PdfboxThumbnailSource implements ThumbnailSource {

    private static final float DEFAULT_DPI = 48f;

    private final float dpi;

    public PdfboxThumbnailSource() {
        this(DEFAULT_DPI);
    }

    public PdfboxThumbnailSource(float dpi) {
        this.dpi = dpi;
    }

    @Override
    public String name() {
        return "PDFBox";
    }

    @Override
    public Optional<byte[]> fetchSourceBytes(String contentKey, String displayPath) throws IOException {
        if (displayPath == null || !"pdf".equals(FileThumbnailSource.extension(displayPath))) {
            return Optional.empty();
        }
        File file = new File(displayPath);
        if (!file.isFile()) {
            return Optional.empty();
        }

        try (PDDocument document = Loader.loadPDF(file)) {
            if (document.getNumberOfPages() == 0) {
                return Optional.empty();
            }
            PDFRenderer renderer = new PDFRenderer(document);
            renderer.setSubsamplingAllowed(true);
            log.debug("PDFBox: rendering first page of {} at {} DPI", displayPath, dpi);
            BufferedImage page = renderer.renderImageWithDPI(0, dpi, ImageType.RGB);

            ByteArrayOutputStream out = new ByteArrayOutputStream();
            ImageIO.write(page, "png", out);
            return Optional.of(out.toByteArray());
        } catch (InvalidPasswordException e) {
            log.debug("Encrypted PDF, no preview: {}", displayPath);
            return Optional.empty();
        }
    }
}
