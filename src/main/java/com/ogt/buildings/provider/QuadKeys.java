package com.ogt.buildings.provider;

import org.locationtech.jts.geom.Envelope;

import java.util.LinkedHashSet;
import java.util.Set;

/** Quadkeys de Bing Maps (Web Mercator) usados para particionar el dataset de Microsoft. */
final class QuadKeys {

    private static final double MAX_LATITUDE = 85.05112878;

    private QuadKeys() {}

    static Set<String> covering(Envelope envelope, int zoom) {
        int[] min = tileXY(envelope.getMinX(), envelope.getMaxY(), zoom);
        int[] max = tileXY(envelope.getMaxX(), envelope.getMinY(), zoom);
        Set<String> keys = new LinkedHashSet<>();
        for (int x = min[0]; x <= max[0]; x++) {
            for (int y = min[1]; y <= max[1]; y++) {
                keys.add(toQuadKey(x, y, zoom));
            }
        }
        return keys;
    }

    static int[] tileXY(double lon, double lat, int zoom) {
        double clippedLat = Math.max(-MAX_LATITUDE, Math.min(MAX_LATITUDE, lat));
        double x = (lon + 180.0) / 360.0;
        double sinLat = Math.sin(Math.toRadians(clippedLat));
        double y = 0.5 - Math.log((1 + sinLat) / (1 - sinLat)) / (4 * Math.PI);
        int size = 1 << zoom;
        int tileX = (int) Math.min(size - 1, Math.max(0, Math.floor(x * size)));
        int tileY = (int) Math.min(size - 1, Math.max(0, Math.floor(y * size)));
        return new int[]{tileX, tileY};
    }

    static String toQuadKey(int tileX, int tileY, int zoom) {
        StringBuilder key = new StringBuilder(zoom);
        for (int i = zoom; i > 0; i--) {
            int digit = 0;
            int mask = 1 << (i - 1);
            if ((tileX & mask) != 0) digit += 1;
            if ((tileY & mask) != 0) digit += 2;
            key.append(digit);
        }
        return key.toString();
    }
}
