package com.ogt.buildings.model;

import lombok.AccessLevel;
import lombok.Getter;
import lombok.RequiredArgsConstructor;

import java.util.LinkedHashMap;
import java.util.Map;

@Getter
@RequiredArgsConstructor(access = AccessLevel.PRIVATE)
public class ConversionResult {

    public static final String NOTHING_TO_SAVE = "No data to save";

    private final ConvertedArtifact artifact;
    private final String error;
    private final boolean nothingToSave;

    public static ConversionResult converted(ConvertedArtifact artifact) {
        return new ConversionResult(artifact, null, false);
    }

    public static ConversionResult nothingToSave() {
        return new ConversionResult(null, NOTHING_TO_SAVE, true);
    }

    public static ConversionResult failed(String error) {
        return new ConversionResult(null, error, false);
    }

    public boolean isSuccess() {
        return artifact != null;
    }

    public Map<String, Object> toResultMap() {
        if (artifact != null) {
            return artifact.toResultMap();
        }
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("error", error);
        return map;
    }
}
