package com.ogt.buildings.util;

import org.apache.parquet.column.page.PageReadStore;
import org.apache.parquet.example.data.Group;
import org.apache.parquet.example.data.simple.convert.GroupRecordConverter;
import org.apache.parquet.hadoop.ParquetFileReader;
import org.apache.parquet.io.ColumnIOFactory;
import org.apache.parquet.io.MessageColumnIO;
import org.apache.parquet.io.RecordReader;
import org.apache.parquet.schema.MessageType;
import org.apache.parquet.schema.PrimitiveType;
import org.apache.parquet.schema.Type;

import java.io.IOException;
import java.nio.file.Path;
import java.util.function.Consumer;

/** Lectura fila a fila de archivos Parquet como {@link Group} del modelo de ejemplo. */
public final class ParquetGroups {

    private ParquetGroups() {}

    public static MessageType schemaOf(ParquetFileReader reader) {
        return reader.getFooter().getFileMetaData().getSchema();
    }

    public static long forEach(Path file, Consumer<Group> consumer) throws IOException {
        long rows = 0;
        try (ParquetFileReader reader = ParquetFileReader.open(new LocalParquetInputFile(file))) {
            MessageType schema = schemaOf(reader);
            MessageColumnIO columnIO = new ColumnIOFactory().getColumnIO(schema);
            PageReadStore pages;
            while ((pages = reader.readNextRowGroup()) != null) {
                RecordReader<Group> recordReader = columnIO.getRecordReader(pages, new GroupRecordConverter(schema));
                for (long i = 0; i < pages.getRowCount(); i++) {
                    consumer.accept(recordReader.read());
                    rows++;
                }
            }
        }
        return rows;
    }

    public static boolean has(Group group, String field) {
        return group.getType().containsField(field) && group.getFieldRepetitionCount(field) > 0;
    }

    /** Lee un campo numérico (FLOAT, DOUBLE, INT32 o INT64) como double. */
    public static double number(Group group, String field) {
        Type type = group.getType().getType(field);
        PrimitiveType.PrimitiveTypeName name = type.asPrimitiveType().getPrimitiveTypeName();
        return switch (name) {
            case FLOAT -> group.getFloat(field, 0);
            case DOUBLE -> group.getDouble(field, 0);
            case INT32 -> group.getInteger(field, 0);
            case INT64 -> group.getLong(field, 0);
            default -> throw new IllegalArgumentException("Campo no numérico: " + field + " (" + name + ")");
        };
    }
}
