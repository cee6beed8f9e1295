package com.ogt.buildings.format;

import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.model.BuildingFeature;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ConvertedArtifact;
import lombok.extern.slf4j.Slf4j;
import org.locationtech.jts.algorithm.Orientation;
import org.locationtech.jts.geom.Coordinate;
import org.locationtech.jts.geom.Envelope;
import org.locationtech.jts.geom.Geometry;
import org.locationtech.jts.geom.LinearRing;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.Polygonal;
import org.springframework.stereotype.Component;

import java.io.BufferedOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * ESRI Shapefile de polígonos: {@code .shp} + {@code .shx} + {@code .dbf} (dBase III)
 * + {@code .prj} (WGS84) + {@code .cpg} (UTF-8). Escrito a mano, sin GeoTools.
 */
@Component
@Slf4j
public class ShapefileFormatWriter implements FormatWriter {

    private static final int FILE_CODE = 9994;
    private static final int VERSION = 1000;
    private static final int SHAPE_NULL = 0;
    private static final int SHAPE_POLYGON = 5;
    private static final int HEADER_BYTES = 100;

    private static final int DBF_NAME_LENGTH = 10;
    private static final int DBF_TEXT_MAX = 254;
    // Long.MIN_VALUE con signo ocupa 20 caracteres
    private static final int DBF_INTEGER_WIDTH = 20;

    static final String WGS84_PRJ = "GEOGCS[\"GCS_WGS_1984\",DATUM[\"D_WGS_1984\","
            + "SPHEROID[\"WGS_1984\",6378137.0,298.257223563]],PRIMEM[\"Greenwich\",0.0],"
            + "UNIT[\"Degree\",0.0174532925199433]]";

    private final Clock clock;

    public ShapefileFormatWriter(Clock clock) {
        this.clock = clock;
    }

    @Override
    public OutputFormat getFormat() {
        return OutputFormat.SHAPEFILE;
    }

    @Override
    public ConvertedArtifact write(BuildingFeatureCollection features, Path directory, String baseName) throws IOException {
        Path shp = directory.resolve(baseName + ".shp");
        Path shx = directory.resolve(baseName + ".shx");
        Path dbf = directory.resolve(baseName + ".dbf");
        Path prj = directory.resolve(baseName + ".prj");
        Path cpg = directory.resolve(baseName + ".cpg");

        writeGeometries(features.getFeatures(), shp, shx);
        writeAttributes(features, dbf);
        Files.writeString(prj, WGS84_PRJ, StandardCharsets.US_ASCII);
        Files.writeString(cpg, "UTF-8", StandardCharsets.US_ASCII);

        long size = 0;
        for (Path p : List.of(shp, shx, dbf, prj, cpg)) {
            size += Files.size(p);
        }

        return ConvertedArtifact.builder()
                .source(features.getSource())
                .format(OutputFormat.SHAPEFILE)
                .primaryFile(shp)
                .companionFile(shx)
                .companionFile(dbf)
                .companionFile(prj)
                .companionFile(cpg)
                .sizeBytes(size)
                .buildingCount(features.size())
                .build();
    }

    // ============================================================
    // .shp / .shx
    // ============================================================
    private void writeGeometries(List<BuildingFeature> features, Path shp, Path shx) throws IOException {
        List<byte[]> records = new ArrayList<>(features.size());
        Envelope bounds = new Envelope();
        for (BuildingFeature feature : features) {
            records.add(encodeShape(feature.getGeometry()));
            if (feature.getGeometry() instanceof Polygonal) {
                bounds.expandToInclude(feature.getGeometry().getEnvelopeInternal());
            }
        }

        int shpLength = HEADER_BYTES;
        for (byte[] content : records) {
            shpLength += 8 + content.length;
        }
        int shxLength = HEADER_BYTES + 8 * records.size();

        try (OutputStream shpOut = new BufferedOutputStream(Files.newOutputStream(shp));
             OutputStream shxOut = new BufferedOutputStream(Files.newOutputStream(shx))) {
            shpOut.write(header(shpLength, bounds));
            shxOut.write(header(shxLength, bounds));

            int offset = HEADER_BYTES;
            int recordNumber = 1;
            for (byte[] content : records) {
                ByteBuffer recordHeader = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
                recordHeader.putInt(recordNumber++);
                recordHeader.putInt(content.length / 2);
                shpOut.write(recordHeader.array());
                shpOut.write(content);

                ByteBuffer index = ByteBuffer.allocate(8).order(ByteOrder.BIG_ENDIAN);
                index.putInt(offset / 2);
                index.putInt(content.length / 2);
                shxOut.write(index.array());

                offset += 8 + content.length;
            }
        }
    }

    private byte[] header(int fileLengthBytes, Envelope bounds) {
        ByteBuffer buffer = ByteBuffer.allocate(HEADER_BYTES);
        buffer.order(ByteOrder.BIG_ENDIAN);
        buffer.putInt(FILE_CODE);
        for (int i = 0; i < 5; i++) buffer.putInt(0);
        buffer.putInt(fileLengthBytes / 2); // en palabras de 16 bits
        buffer.order(ByteOrder.LITTLE_ENDIAN);
        buffer.putInt(VERSION);
        buffer.putInt(SHAPE_POLYGON);
        boolean empty = bounds.isNull();
        buffer.putDouble(empty ? 0 : bounds.getMinX());
        buffer.putDouble(empty ? 0 : bounds.getMinY());
        buffer.putDouble(empty ? 0 : bounds.getMaxX());
        buffer.putDouble(empty ? 0 : bounds.getMaxY());
        for (int i = 0; i < 4; i++) buffer.putDouble(0); // Z y M
        return buffer.array();
    }

    private byte[] encodeShape(Geometry geometry) {
        if (!(geometry instanceof Polygonal) || geometry.isEmpty()) {
            ByteBuffer nullShape = ByteBuffer.allocate(4).order(ByteOrder.LITTLE_ENDIAN);
            nullShape.putInt(SHAPE_NULL);
            return nullShape.array();
        }

        // Anillo exterior en sentido horario, huecos antihorario
        List<Coordinate[]> rings = new ArrayList<>();
        for (int i = 0; i < geometry.getNumGeometries(); i++) {
            Polygon polygon = (Polygon) geometry.getGeometryN(i);
            rings.add(oriented(polygon.getExteriorRing(), false));
            for (int h = 0; h < polygon.getNumInteriorRing(); h++) {
                rings.add(oriented(polygon.getInteriorRingN(h), true));
            }
        }
        int numPoints = rings.stream().mapToInt(r -> r.length).sum();

        ByteBuffer buffer = ByteBuffer.allocate(44 + 4 * rings.size() + 16 * numPoints)
                .order(ByteOrder.LITTLE_ENDIAN);
        Envelope env = geometry.getEnvelopeInternal();
        buffer.putInt(SHAPE_POLYGON);
        buffer.putDouble(env.getMinX());
        buffer.putDouble(env.getMinY());
        buffer.putDouble(env.getMaxX());
        buffer.putDouble(env.getMaxY());
        buffer.putInt(rings.size());
        buffer.putInt(numPoints);
        int start = 0;
        for (Coordinate[] ring : rings) {
            buffer.putInt(start);
            start += ring.length;
        }
        for (Coordinate[] ring : rings) {
            for (Coordinate c : ring) {
                buffer.putDouble(c.x);
                buffer.putDouble(c.y);
            }
        }
        return buffer.array();
    }

    private Coordinate[] oriented(LinearRing ring, boolean counterClockwise) {
        Coordinate[] coords = ring.getCoordinates();
        if (Orientation.isCCW(coords) != counterClockwise) {
            Coordinate[] reversed = new Coordinate[coords.length];
            for (int i = 0; i < coords.length; i++) {
                reversed[i] = coords[coords.length - 1 - i];
            }
            return reversed;
        }
        return coords;
    }

    // ============================================================
    // .dbf (dBase III)
    // ============================================================
    private void writeAttributes(BuildingFeatureCollection features, Path dbf) throws IOException {
        List<DbfField> fields = dbfFields(features);
        int recordLength = 1 + fields.stream().mapToInt(f -> f.length).sum();
        int headerLength = 32 + 32 * fields.size() + 1;
        LocalDate today = LocalDate.now(clock);

        try (OutputStream out = new BufferedOutputStream(Files.newOutputStream(dbf))) {
            ByteBuffer header = ByteBuffer.allocate(32).order(ByteOrder.LITTLE_ENDIAN);
            header.put((byte) 0x03);
            header.put((byte) (today.getYear() - 1900));
            header.put((byte) today.getMonthValue());
            header.put((byte) today.getDayOfMonth());
            header.putInt(features.size());
            header.putShort((short) headerLength);
            header.putShort((short) recordLength);
            out.write(header.array());

            for (DbfField field : fields) {
                ByteBuffer descriptor = ByteBuffer.allocate(32);
                byte[] name = field.dbfName.getBytes(StandardCharsets.US_ASCII);
                descriptor.put(name, 0, Math.min(name.length, DBF_NAME_LENGTH));
                descriptor.position(11);
                descriptor.put((byte) field.type);
                descriptor.position(16);
                descriptor.put((byte) field.length);
                descriptor.put((byte) field.decimals);
                out.write(descriptor.array());
            }
            out.write(0x0D);

            int fid = 0;
            for (BuildingFeature feature : features.getFeatures()) {
                out.write(' '); // registro no borrado
                for (DbfField field : fields) {
                    Object value = field.column == null ? (Object) fid : feature.property(field.column.getName());
                    out.write(field.encode(value));
                }
                fid++;
            }
            out.write(0x1A);
        }
    }

    private List<DbfField> dbfFields(BuildingFeatureCollection features) {
        AttributeSchema schema = AttributeSchema.of(features);
        List<DbfField> fields = new ArrayList<>();
        Set<String> used = new HashSet<>();
        fields.add(new DbfField(uniqueName("fid", used), null, 'N', 10, 0));

        for (AttributeSchema.Column column : schema.getColumns()) {
            String name = uniqueName(column.getName(), used);
            switch (column.getType()) {
                case INTEGER -> fields.add(new DbfField(name, column, 'N', DBF_INTEGER_WIDTH, 0));
                case REAL -> fields.add(new DbfField(name, column, 'N', 24, 8));
                case BOOLEAN -> fields.add(new DbfField(name, column, 'L', 1, 0));
                case TEXT -> fields.add(new DbfField(name, column, 'C', textWidth(features, column), 0));
            }
        }
        return fields;
    }

    private int textWidth(BuildingFeatureCollection features, AttributeSchema.Column column) {
        int width = 1;
        for (BuildingFeature feature : features.getFeatures()) {
            String text = AttributeSchema.asText(feature.property(column.getName()));
            if (text != null) {
                width = Math.max(width, text.getBytes(StandardCharsets.UTF_8).length);
            }
        }
        return Math.min(width, DBF_TEXT_MAX);
    }

    /** Nombres DBF: ASCII, máximo 10 caracteres, únicos tras truncar. */
    static String uniqueName(String name, Set<String> used) {
        String base = name.replaceAll("[^A-Za-z0-9_]", "_");
        if (base.isEmpty()) base = "field";
        base = base.length() > DBF_NAME_LENGTH ? base.substring(0, DBF_NAME_LENGTH) : base;
        String candidate = base;
        int suffix = 1;
        while (!used.add(candidate.toLowerCase(Locale.ROOT))) {
            String tail = String.valueOf(suffix++);
            candidate = base.substring(0, Math.min(base.length(), DBF_NAME_LENGTH - tail.length())) + tail;
        }
        return candidate;
    }

    private static final class DbfField {
        final String dbfName;
        final AttributeSchema.Column column;
        final char type;
        final int length;
        final int decimals;

        DbfField(String dbfName, AttributeSchema.Column column, char type, int length, int decimals) {
            this.dbfName = dbfName;
            this.column = column;
            this.type = type;
            this.length = length;
            this.decimals = decimals;
        }

        byte[] encode(Object value) {
            String text = switch (type) {
                case 'N' -> number(value);
                case 'L' -> {
                    Boolean b = AttributeSchema.asBoolean(value);
                    yield b == null ? "?" : (b ? "T" : "F");
                }
                default -> AttributeSchema.asText(value);
            };
            byte[] out = new byte[length];
            Arrays.fill(out, (byte) ' ');
            if (text != null) {
                byte[] bytes = truncateUtf8(text, length);
                if (type == 'N') {
                    System.arraycopy(bytes, 0, out, length - bytes.length, bytes.length); // alineado a la derecha
                } else {
                    System.arraycopy(bytes, 0, out, 0, bytes.length);
                }
            }
            return out;
        }

        private String number(Object value) {
            if (decimals == 0) {
                Long v = AttributeSchema.asLong(value);
                return v == null ? null : String.valueOf(v);
            }
            Double v = AttributeSchema.asDouble(value);
            if (v == null || v.isNaN() || v.isInfinite()) return null;
            String formatted = String.format(Locale.ROOT, "%." + decimals + "f", v);
            return formatted.length() > length ? null : formatted;
        }

        private static byte[] truncateUtf8(String text, int maxBytes) {
            byte[] bytes = text.getBytes(StandardCharsets.UTF_8);
            if (bytes.length <= maxBytes) return bytes;
            // no cortar un carácter multibyte por la mitad
            int end = maxBytes;
            while (end > 0 && (bytes[end] & 0xC0) == 0x80) end--;
            return Arrays.copyOf(bytes, end);
        }
    }
}
