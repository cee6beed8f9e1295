package com.ogt.buildings.service;

import com.ogt.buildings.config.BuildingExtractorProperties;
import com.ogt.buildings.exception.ExportConfigurationException;
import com.ogt.buildings.util.GeoJSONHelper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.operation.valid.IsValidOp;
import org.locationtech.jts.operation.valid.TopologyValidationError;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Validación del área de interés: un único Polygon topológicamente válido en WGS84
 * y con un área (medida en proyección equivalente) dentro del máximo configurado.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class AoiValidationService {

    private final AreaCalculator areaCalculator;
    private final BuildingExtractorProperties properties;

    /**
     * Valida la geometría y la devuelve como Polygon con SRID 4326.
     *
     * @throws ExportConfigurationException si no es un Polygon válido o excede el área máxima
     */
    public Polygon requireValid(Geometry geometry) {
        Map<String, Object> report = describe(geometry);
        if (!Boolean.TRUE.equals(report.get("valid"))) {
            throw new ExportConfigurationException("Invalid area of interest: " + report.get("errorMessage"));
        }
        Polygon polygon = (Polygon) geometry;
        polygon.setSRID(GeoJSONHelper.WGS84_SRID);
        return polygon;
    }

    /** Diagnóstico de un AOI recibido como GeoJSON (objeto o texto). */
    public Map<String, Object> validateGeoJson(Object geoJson) {
        try {
            return describe(GeoJSONHelper.geoJsonToGeometry(geoJson));
        } catch (Exception e) {
            Map<String, Object> result = new LinkedHashMap<>();
            result.put("valid", false);
            result.put("errorType", "PARSE_ERROR");
            result.put("errorMessage", "Invalid GeoJSON: " + e.getMessage());
            return result;
        }
    }

    public Map<String, Object> describe(Geometry geometry) {
        Map<String, Object> result = new LinkedHashMap<>();

        // 1. Presencia y tipo
        if (geometry == null || geometry.isEmpty()) {
            result.put("valid", false);
            result.put("errorType", "MISSING");
            result.put("errorMessage", "Area of interest is required");
            return result;
        }
        result.put("geometryType", geometry.getGeometryType());
        result.put("vertexCount", geometry.getNumPoints());
        if (!(geometry instanceof Polygon)) {
            result.put("valid", false);
            result.put("errorType", "NOT_A_POLYGON");
            result.put("errorMessage", "Area of interest must be a Polygon, got " + geometry.getGeometryType());
            return result;
        }

        // 2. Validez topológica
        IsValidOp validOp = new IsValidOp(geometry);
        if (!validOp.isValid()) {
            TopologyValidationError error = validOp.getValidationError();
            result.put("valid", false);
            result.put("errorType", getErrorTypeName(error.getErrorType()));
            result.put("errorMessage", error.getMessage());
            if (error.getCoordinate() != null) {
                result.put("errorLocation", Map.of("x", error.getCoordinate().x, "y", error.getCoordinate().y));
            }
            return result;
        }

        // 3. Área máxima
        double areaKm2 = areaCalculator.areaSquareKilometers(geometry);
        double maxKm2 = properties.getExtraction().getMaxAoiAreaKm2();
        result.put("area_km2", areaKm2);
        if (areaKm2 > maxKm2) {
            result.put("valid", false);
            result.put("errorType", "AREA_TOO_LARGE");
            result.put("errorMessage", String.format("Area of interest is %.1f km², maximum is %.0f km²", areaKm2, maxKm2));
            return result;
        }

        result.put("valid", true);
        return result;
    }

    private String getErrorTypeName(int errorType) {
        return switch (errorType) {
            case TopologyValidationError.REPEATED_POINT -> "REPEATED_POINT";
            case TopologyValidationError.HOLE_OUTSIDE_SHELL -> "HOLE_OUTSIDE_SHELL";
            case TopologyValidationError.NESTED_HOLES -> "NESTED_HOLES";
            case TopologyValidationError.DISCONNECTED_INTERIOR -> "DISCONNECTED_INTERIOR";
            case TopologyValidationError.SELF_INTERSECTION -> "SELF_INTERSECTION";
            case TopologyValidationError.RING_SELF_INTERSECTION -> "RING_SELF_INTERSECTION";
            case TopologyValidationError.TOO_FEW_POINTS -> "TOO_FEW_POINTS";
            case TopologyValidationError.INVALID_COORDINATE -> "INVALID_COORDINATE";
            case TopologyValidationError.RING_NOT_CLOSED -> "RING_NOT_CLOSED";
            default -> "TOPOLOGY_ERROR_" + errorType;
        };
    }
}
