package com.ogt.buildings.provider;

import org.junit.jupiter.api.Test;
import org.locationtech.jts.geom.Envelope;

import static org.assertj.core.api.Assertions.assertThat;

class QuadKeysTest {

    @Test
    void encodesTileCoordinates() {
        assertThat(QuadKeys.toQuadKey(3, 5, 3)).isEqualTo("213");
        assertThat(QuadKeys.toQuadKey(0, 0, 1)).isEqualTo("0");
        assertThat(QuadKeys.toQuadKey(1, 1, 1)).isEqualTo("3");
    }

    @Test
    void smallEnvelopeIsCoveredBySingleTile() {
        assertThat(QuadKeys.covering(new Envelope(0.001, 0.002, 0.001, 0.002), 1)).containsExactly("1");
    }

    @Test
    void envelopeAcrossTheEquatorAndMeridianCoversFourTiles() {
        assertThat(QuadKeys.covering(new Envelope(-1, 1, -1, 1), 1)).containsExactlyInAnyOrder("0", "1", "2", "3");
    }

    @Test
    void latitudeIsClippedToMercatorBounds() {
        assertThat(QuadKeys.tileXY(0.5, 89.9, 2)).containsExactly(2, 0);
        assertThat(QuadKeys.tileXY(179.99, -89.9, 2)).containsExactly(3, 3);
    }

    @Test
    void quadKeyLengthMatchesZoom() {
        assertThat(QuadKeys.covering(new Envelope(-40.31, -40.29, -20.31, -20.29), 9))
                .allSatisfy(key -> assertThat(key).hasSize(9));
    }
}
