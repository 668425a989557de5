package dev.nuclr.thumbgrid;

import dev.nuclr.thumbgrid.cache.ThumbnailDiskCache;
import dev.nuclr.thumbgrid.pipeline.GenerationPipeline;
import dev.nuclr.thumbgrid.source.CompositeThumbnailSource;
import dev.nuclr.thumbgrid.source.DirectoryResultProvider;
import dev.nuclr.thumbgrid.source.FileThumbnailSource;
import dev.nuclr.thumbgrid.source.PdfboxThumbnailSource;
import dev.nuclr.thumbgrid.view.ThumbnailGridPanel;
import lombok.extern.slf4j.Slf4j;

import javax.swing.JFrame;
import javax.swing.SwingUtilities;
import javax.swing.WindowConstants;
import java.awt.event.WindowAdapter;
import java.awt.event.WindowEvent;
import java.nio.file.Path;
import java.util.List;

/**
 * Desktop entry point: shows the previewable files of one directory as a
 * thumbnail grid.
 *
 * <p>Usage: {@code thumbnail-grid [directory]} (default: the user's home).
 */
@Slf4j
public final class ThumbnailGridApp {

    private ThumbnailGridApp() {}

    public static void main(String[] args) {
        Path dir = Path.of(args.length > 0 ? args[0] : System.getProperty("user.home"));
        ThumbnailGridSettings settings = ThumbnailGridSettings.load();
        SwingUtilities.invokeLater(() -> open(settings, dir));
    }

    static GenerationPipeline createPipeline(ThumbnailGridSettings settings) {
        ThumbnailDiskCache diskCache = new ThumbnailDiskCache(settings.getDiskCacheDir(), settings.isDiskCacheEnabled());
        CompositeThumbnailSource source = new CompositeThumbnailSource(List.of(
                new FileThumbnailSource(),
                new PdfboxThumbnailSource()));
        return new GenerationPipeline(diskCache, source,
                settings.getThumbnailSize(),
                settings.getAspectWidth(),
                settings.getAspectHeight(),
                settings.getWorkerThreads());
    }

    private static void open(ThumbnailGridSettings settings, Path dir) {
        ThumbnailGridPanel panel = new ThumbnailGridPanel(settings, createPipeline(settings));

        JFrame frame = new JFrame("Thumbnails \u2013 " + dir);
        frame.setDefaultCloseOperation(WindowConstants.DISPOSE_ON_CLOSE);
        frame.addWindowListener(new WindowAdapter() {
            @Override
            public void windowClosed(WindowEvent e) {
                panel.close();
            }
        });
        frame.setContentPane(panel);
        frame.setSize(1100, 750);
        frame.setLocationRelativeTo(null);
        frame.setVisible(true);

        log.info("Opening thumbnail grid for {}", dir);
        panel.load(new DirectoryResultProvider(dir));
    }
}
