package com.ogt.buildings.service;

import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.CoordinateSequence;
import org.locationtech.jts.geom.CoordinateSequenceFilter;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.proj4j.CRSFactory;
import org.locationtech.proj4j.CoordinateReferenceSystem;
import org.locationtech.proj4j.CoordinateTransform;
import org.locationtech.proj4j.CoordinateTransformFactory;
import org.locationtech.proj4j.ProjCoordinate;
import org.springframework.stereotype.Service;

import java.util.Collection;
import java.util.Locale;

/**
 * Mide áreas reproyectando desde WGS84 a una Lambert Azimutal Equivalente (LAEA)
 * centrada en la geometría de referencia. Nunca se mide en grados.
 */
@Service
@Slf4j
public class AreaCalculator {

    private static final String WGS84 = "+proj=longlat +datum=WGS84 +no_defs";

    private final CRSFactory crsFactory = new CRSFactory();
    private final CoordinateTransformFactory transformFactory = new CoordinateTransformFactory();
    private final CoordinateReferenceSystem wgs84 = crsFactory.createFromParameters("WGS84", WGS84);

    public double areaSquareMeters(Geometry geometry) {
        if (geometry == null || geometry.isEmpty()) {
            return 0.0;
        }
        return projectorFor(geometry.getEnvelopeInternal()).area(geometry);
    }

    public double areaSquareKilometers(Geometry geometry) {
        return areaSquareMeters(geometry) / 1_000_000d;
    }

    /** Suma de áreas usando una única proyección centrada en el envolvente común. */
    public double totalAreaSquareMeters(Collection<? extends Geometry> geometries) {
        Envelope envelope = new Envelope();
        geometries.forEach(g -> envelope.expandToInclude(g.getEnvelopeInternal()));
        if (envelope.isNull()) {
            return 0.0;
        }
        EqualAreaProjection projection = projectorFor(envelope);
        double total = 0.0;
        for (Geometry g : geometries) {
            total += projection.area(g);
        }
        return total;
    }

    public EqualAreaProjection projectorFor(Envelope reference) {
        double lon0 = (reference.getMinX() + reference.getMaxX()) / 2;
        double lat0 = (reference.getMinY() + reference.getMaxY()) / 2;
        String params = String.format(Locale.ROOT,
                "+proj=laea +lat_0=%.6f +lon_0=%.6f +x_0=0 +y_0=0 +datum=WGS84 +units=m +no_defs", lat0, lon0);
        CoordinateReferenceSystem laea = crsFactory.createFromParameters("LAEA", params);
        return new EqualAreaProjection(transformFactory.createTransform(wgs84, laea));
    }

    /** Transformación WGS84 -> LAEA reutilizable para muchas geometrías cercanas. */
    public static class EqualAreaProjection {

        private final CoordinateTransform transform;

        EqualAreaProjection(CoordinateTransform transform) {
            this.transform = transform;
        }

        public Geometry project(Geometry geometry) {
            Geometry copy = geometry.copy();
            copy.apply(new CoordinateSequenceFilter() {
                private final ProjCoordinate src = new ProjCoordinate();
                private final ProjCoordinate dst = new ProjCoordinate();

                @Override
                public void filter(CoordinateSequence seq, int i) {
                    src.x = seq.getX(i);
                    src.y = seq.getY(i);
                    transform.transform(src, dst);
                    seq.setOrdinate(i, CoordinateSequence.X, dst.x);
                    seq.setOrdinate(i, CoordinateSequence.Y, dst.y);
                }

                @Override
                public boolean isDone() {
                    return false;
                }

                @Override
                public boolean isGeometryChanged() {
                    return true;
                }
            });
            return copy;
        }

        public double area(Geometry geometry) {
            if (geometry == null || geometry.isEmpty()) {
                return 0.0;
            }
            return project(geometry).getArea();
        }
    }
}
