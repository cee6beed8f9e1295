package com.ogt.buildings.storage;

import java.nio.file.Path;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Almacenamiento de los binarios de una ejecución (archivo principal y tiles),
 * direccionables por una ruta relativa que se guarda en el ExportRun.
 */
public interface ArtifactStorage {

    /** Mueve el ZIP a {@code exports/yyyy/MM/dd/} sin pisar otro archivo y devuelve su ruta relativa. */
    String storeArchive(Path archive, LocalDate date);

    /** Mueve los tiles a {@code tiles/<runId>.pmtiles} y devuelve su ruta relativa. */
    String storeTiles(Path tiles, UUID runId);

    Path resolve(String storedPath);

    long sizeOf(String storedPath);

    boolean delete(String storedPath);
}
