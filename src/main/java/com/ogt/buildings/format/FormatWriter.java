package com.ogt.buildings.format;

import com.ogt.buildings.entity.OutputFormat;
import com.ogt.buildings.model.BuildingFeatureCollection;
import com.ogt.buildings.model.ConvertedArtifact;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Re-serializa una colección de edificios a un formato concreto, sin transformar
 * la semántica. La colección nunca llega vacía (lo filtra {@link FormatConversionService}).
 */
public interface FormatWriter {

    OutputFormat getFormat();

    ConvertedArtifact write(BuildingFeatureCollection features, Path directory, String baseName) throws IOException;
}
