package com.ogt.buildings.format;

import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import lombok.Value;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Columnas de atributos de una colección: unión ordenada de las claves de propiedades,
 * tipadas según el primer valor no nulo encontrado.
 */
@Value
public class AttributeSchema {

    public enum ColumnType { INTEGER, REAL, BOOLEAN, TEXT }

    @Value
    public static class Column {
        String name;
        ColumnType type;
    }

    List<Column> columns;

    public static AttributeSchema of(BuildingFeatureCollection collection) {
        Map<String, ColumnType> types = new LinkedHashMap<>();
        for (BuildingFeature feature : collection.getFeatures()) {
            feature.getProperties().forEach((name, value) -> {
                if (value != null && types.get(name) == null) {
                    types.put(name, typeOf(value));
                } else if (!types.containsKey(name)) {
                    types.put(name, null);
                }
            });
        }
        List<Column> columns = new ArrayList<>();
        types.forEach((name, type) -> columns.add(new Column(name, type != null ? type : ColumnType.TEXT)));
        return new AttributeSchema(List.copyOf(columns));
    }

    static ColumnType typeOf(Object value) {
        if (value instanceof Integer || value instanceof Long || value instanceof Short || value instanceof Byte) {
            return ColumnType.INTEGER;
        }
        if (value instanceof Number) return ColumnType.REAL;
        if (value instanceof Boolean) return ColumnType.BOOLEAN;
        return ColumnType.TEXT;
    }

    // Conversión tolerante: un valor que no encaja en el tipo de la columna queda nulo

    public static Long asLong(Object value) {
        if (value instanceof Number n) return n.longValue();
        if (value instanceof String s) {
            try {
                return Long.parseLong(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Double asDouble(Object value) {
        if (value instanceof Number n) return n.doubleValue();
        if (value instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }

    public static Boolean asBoolean(Object value) {
        if (value instanceof Boolean b) return b;
        if (value instanceof String s) return Boolean.parseBoolean(s.trim());
        return null;
    }

    public static String asText(Object value) {
        return value == null ? null : String.valueOf(value);
    }
}
