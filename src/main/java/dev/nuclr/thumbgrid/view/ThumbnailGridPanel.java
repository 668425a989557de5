package dev.nuclr.thumbgrid.view;

import dev.nuclr.thumbgrid.ResultItem;
import dev.nuclr.thumbgrid.ThumbnailGridSettings;
import dev.nuclr.thumbgrid.pipeline.GenerationPipeline;
import dev.nuclr.thumbgrid.source.ResultProvider;
import lombok.extern.slf4j.Slf4j;

import javax.swing.*;
import java.awt.*;
import java.awt.event.ComponentAdapter;
import java.awt.event.ComponentEvent;
import java.awt.event.KeyAdapter;
import java.awt.event.KeyEvent;
import java.awt.event.MouseAdapter;
import java.awt.event.MouseEvent;
import java.awt.image.BufferedImage;
import java.io.File;
import java.io.IOException;
import java.util.List;

/**
 * Swing panel showing a virtualized grid of thumbnails.
 *
 * <p>Only the cards of the slot pool are painted; the scrollbar spans the
 * whole virtual height. All fields are touched on the EDT only. Result sets
 * are loaded on a background thread and handed back via invokeLater.
 */
@Slf4j
public class ThumbnailGridPanel extends JPanel implements GridView {

    private static final Color CARD_BG       = Color.WHITE;
    private static final Color CARD_BORDER   = new Color(0xD0D0D0);
    private static final Color TEXT_COLOR    = Color.BLACK;
    private static final Color HINT_COLOR    = new Color(0x666666);
    private static final int   LABEL_MARGIN  = 10;

    private final GridController controller;
    private final GridCanvas     canvas;
    private final JScrollBar     scrollBar;
    private final JLabel         statusLabel;
    private final PathLabels     pathLabels;

    private int contentHeight = 1;
    private boolean loading;

    // ============================================================ constructor

    public ThumbnailGridPanel(ThumbnailGridSettings settings, GenerationPipeline pipeline) {
        setLayout(new BorderLayout());
        setFocusable(true);

        canvas      = new GridCanvas();
        scrollBar   = new JScrollBar(JScrollBar.VERTICAL, 0, 1, 0, 1);
        statusLabel = new JLabel("Ready");
        statusLabel.setBorder(BorderFactory.createEmptyBorder(4, 10, 4, 10));

        add(canvas, BorderLayout.CENTER);
        add(scrollBar, BorderLayout.EAST);
        add(statusLabel, BorderLayout.SOUTH);

        controller = new GridController(settings, pipeline, this, new SwingUiScheduler());
        FontMetrics fm = canvas.getFontMetrics(canvas.getFont());
        pathLabels = new PathLabels(fm::stringWidth);

        scrollBar.setUnitIncrement(GridController.SCROLL_UNIT_PX);
        scrollBar.addAdjustmentListener(e -> controller.onScroll());

        canvas.addComponentListener(new ComponentAdapter() {
            @Override
            public void componentResized(ComponentEvent e) {
                controller.onResize();
            }
        });
        canvas.addMouseWheelListener(e -> controller.onWheel(e.getWheelRotation() * 3));
        canvas.addMouseListener(new MouseAdapter() {
            @Override
            public void mouseEntered(MouseEvent e) {
                requestFocusInWindow();
            }

            @Override
            public void mouseClicked(MouseEvent e) {
                if (e.getClickCount() == 2 && SwingUtilities.isLeftMouseButton(e)) {
                    int idx = controller.indexAt(e.getX(), e.getY());
                    if (idx >= 0) openFile(controller.itemAt(idx));
                }
            }
        });
        addKeyListener(new KeyAdapter() {
            @Override
            public void keyPressed(KeyEvent e) {
                int code = e.getKeyCode();
                if (code == KeyEvent.VK_DOWN)      controller.onWheel(3);
                if (code == KeyEvent.VK_UP)        controller.onWheel(-3);
                if (code == KeyEvent.VK_PAGE_DOWN) scrollTo(scrollOffset() + viewportHeight());
                if (code == KeyEvent.VK_PAGE_UP)   scrollTo(scrollOffset() - viewportHeight());
                if (code == KeyEvent.VK_HOME)      scrollTo(0);
                if (code == KeyEvent.VK_END)       scrollTo(contentHeight);
            }
        });
        ToolTipManager.sharedInstance().registerComponent(canvas);
    }

    // ============================================================ public API

    /** Load results off the EDT and show them when ready. */
    public void load(ResultProvider provider) {
        if (loading) return;
        loading = true;
        statusLabel.setText("Searching\u2026");
        Thread worker = new Thread(() -> {
            try {
                List<ResultItem> items = provider.results();
                SwingUtilities.invokeLater(() -> onResults(items));
            } catch (IOException | RuntimeException e) {
                log.error("Failed to load results", e);
                SwingUtilities.invokeLater(() -> onLoadError(e.getMessage()));
            }
        }, "result-load");
        worker.setDaemon(true);
        worker.start();
    }

    public void showResults(List<ResultItem> items) {
        controller.setResults(items);
        statusLabel.setText("Matches: " + items.size());
    }

    /** Stop timers and the generation pipeline. */
    public void close() {
        controller.close();
    }

    // ============================================================ GridView

    @Override
    public int viewportWidth() {
        return Math.max(1, canvas.getWidth());
    }

    @Override
    public int viewportHeight() {
        return Math.max(1, canvas.getHeight());
    }

    @Override
    public int scrollOffset() {
        return scrollBar.getValue();
    }

    @Override
    public void scrollTo(int offsetPx) {
        int max = Math.max(0, contentHeight - viewportHeight());
        scrollBar.setValue(Math.max(0, Math.min(offsetPx, max)));
    }

    @Override
    public void setContentSize(int widthPx, int heightPx) {
        contentHeight = heightPx;
        int extent = Math.min(viewportHeight(), heightPx);
        int value = Math.min(scrollBar.getValue(), Math.max(0, heightPx - extent));
        scrollBar.setValues(value, extent, 0, heightPx);
        scrollBar.setBlockIncrement(Math.max(1, viewportHeight() - GridController.SCROLL_UNIT_PX));
    }

    @Override
    public void slotsUpdated() {
        canvas.repaint();
    }

    // ============================================================ private helpers

    private void onResults(List<ResultItem> items) {
        loading = false;
        showResults(items);
    }

    private void onLoadError(String msg) {
        loading = false;
        statusLabel.setText("Error");
        JOptionPane.showMessageDialog(this, msg, "Search error", JOptionPane.ERROR_MESSAGE);
    }

    private void openFile(ResultItem item) {
        File file = new File(item.displayPath());
        if (!file.exists()) {
            JOptionPane.showMessageDialog(this, "The selected file does not exist.", "File not found",
                    JOptionPane.ERROR_MESSAGE);
            return;
        }
        try {
            Desktop.getDesktop().open(file);
        } catch (IOException | UnsupportedOperationException e) {
            log.warn("Could not open {}: {}", file, e.getMessage());
            JOptionPane.showMessageDialog(this, e.getMessage(), "Open error", JOptionPane.ERROR_MESSAGE);
        }
    }

    // ============================================================ inner canvas

    private class GridCanvas extends JPanel {

        GridCanvas() {
            setBackground(new Color(0xF0F0F0));
            setOpaque(true);
        }

        @Override
        public String getToolTipText(MouseEvent e) {
            int idx = controller.indexAt(e.getX(), e.getY());
            return idx >= 0 ? controller.itemAt(idx).displayPath() : null;
        }

        @Override
        protected void paintComponent(Graphics g) {
            super.paintComponent(g);
            Graphics2D g2 = (Graphics2D) g.create();
            try {
                g2.setRenderingHint(RenderingHints.KEY_TEXT_ANTIALIASING, RenderingHints.VALUE_TEXT_ANTIALIAS_ON);
                g2.setRenderingHint(RenderingHints.KEY_INTERPOLATION,     RenderingHints.VALUE_INTERPOLATION_BILINEAR);
                g2.translate(0, -scrollOffset());
                CardGeometry geo = controller.geometry();
                for (GridSlot slot : controller.slots()) {
                    if (slot.isVisible()) {
                        drawCard(g2, slot, geo);
                    }
                }
            } finally {
                g2.dispose();
            }
        }

        private void drawCard(Graphics2D g2, GridSlot slot, CardGeometry geo) {
            int x = slot.getX();
            int y = slot.getY();
            g2.setColor(CARD_BG);
            g2.fillRect(x, y, slot.getWidth(), slot.getHeight());
            g2.setColor(CARD_BORDER);
            g2.drawRect(x, y, slot.getWidth(), slot.getHeight());

            int previewX = x + (slot.getWidth() - geo.previewWidth()) / 2;
            int previewY = y + 10;
            BufferedImage img = slot.getImage();
            if (slot.getState() == SlotState.IMAGE && img != null) {
                g2.drawImage(img, previewX, previewY, geo.previewWidth(), geo.previewHeight(), null);
            } else {
                String hint = slot.getState() == SlotState.UNAVAILABLE ? "No preview" : "Loading";
                drawCentered(g2, hint, previewX, previewY, geo.previewWidth(), geo.previewHeight());
            }

            int labelPx = Math.max(60, slot.getWidth() - LABEL_MARGIN * 2);
            String label = pathLabels.fit(slot.getPath(), labelPx);
            g2.setColor(TEXT_COLOR);
            FontMetrics fm = g2.getFontMetrics();
            g2.drawString(label, x + LABEL_MARGIN, previewY + geo.previewHeight() + 12 + fm.getAscent());
        }

        private void drawCentered(Graphics2D g2, String msg, int x, int y, int w, int h) {
            g2.setColor(HINT_COLOR);
            FontMetrics fm = g2.getFontMetrics();
            g2.drawString(msg, x + (w - fm.stringWidth(msg)) / 2, y + (h + fm.getAscent()) / 2);
        }
    }
}
