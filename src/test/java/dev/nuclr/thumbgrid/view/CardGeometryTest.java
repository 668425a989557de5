package dev.nuclr.thumbgrid.view;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class CardGeometryTest {

    @Test
    void forThumbnail_defaults_previewMatchesGeneratedThumbnail() {
        CardGeometry geo = CardGeometry.forThumbnail(200, 230, 16, 9);

        assertThat(geo.previewWidth()).isEqualTo(200);
        assertThat(geo.previewHeight()).isEqualTo(113);
        assertThat(geo.cardWidth()).isEqualTo(232);
        assertThat(geo.cardHeight()).isEqualTo(113 + CardGeometry.TEXT_HEIGHT + CardGeometry.CHROME_HEIGHT);
    }

    @Test
    void forThumbnail_wideConfiguredCard_keepsPreviewAtThumbnailSize() {
        CardGeometry geo = CardGeometry.forThumbnail(120, 300, 1, 1);

        assertThat(geo.cardWidth()).isEqualTo(300);
        assertThat(geo.previewWidth()).isEqualTo(120);
        assertThat(geo.previewHeight()).isEqualTo(120);
    }
}
