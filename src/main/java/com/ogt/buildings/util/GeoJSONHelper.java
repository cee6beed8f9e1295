package com.ogt.buildings.util;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.PrecisionModel;
import org.locationtech.jts.io.ParseException;
import org.locationtech.jts.io.geojson.GeoJsonReader;
import org.locationtech.jts.io.geojson.GeoJsonWriter;

import java.util.Map;

/**
 * Helpers to convert JTS Geometry <-> GeoJSON (as Map or String), always in WGS84.
 */
public final class GeoJSONHelper {

    public static final int WGS84_SRID = 4326;

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final GeometryFactory GF = new GeometryFactory(new PrecisionModel(), WGS84_SRID);

    private GeoJSONHelper() {}

    public static GeometryFactory wgs84Factory() {
        return GF;
    }

    /** Convert JTS Geometry -> GeoJSON string (coordinates with 8 decimals, no crs member) */
    public static String geometryToJson(Geometry geom) {
        if (geom == null) return null;
        GeoJsonWriter writer = new GeoJsonWriter(8);
        writer.setEncodeCRS(false);
        return writer.write(geom);
    }

    /** Convert JTS Geometry -> GeoJSON Map */
    public static Map<String, Object> geometryToGeoJson(Geometry geom) throws Exception {
        if (geom == null) return null;
        return MAPPER.readValue(geometryToJson(geom), new TypeReference<Map<String, Object>>() {});
    }

    /** Convert GeoJSON object (Map or JSON string) -> JTS Geometry with SRID 4326 */
    public static Geometry geoJsonToGeometry(Object geoJsonObj) throws Exception {
        if (geoJsonObj == null) return null;
        String json = geoJsonObj instanceof String s ? s : MAPPER.writeValueAsString(geoJsonObj);
        return readGeometry(json);
    }

    public static Geometry readGeometry(String json) throws ParseException {
        Geometry geom = new GeoJsonReader(GF).read(json);
        if (geom != null) geom.setSRID(WGS84_SRID);
        return geom;
    }
}
