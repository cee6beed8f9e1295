package com.ogt.buildings.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotEmpty;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ExportRequest {

    @NotBlank(message = "El nombre es obligatorio")
    @Size(max = 200)
    private String name;

    private String description;

    // Geometría GeoJSON (Polygon, WGS84)
    @NotNull(message = "El área de interés es obligatoria")
    private Map<String, Object> areaOfInterest;

    @NotEmpty(message = "Se requiere al menos una fuente")
    @Builder.Default
    private List<String> sources = new ArrayList<>();

    @NotEmpty(message = "Se requiere al menos un formato")
    @Builder.Default
    private List<String> outputFormats = new ArrayList<>();

    // source id -> opciones
    @Builder.Default
    private Map<String, Map<String, Object>> sourceConfig = new HashMap<>();

    private Boolean isPublic;

    private String ownerId;
    private String ownerEmail;
    private Boolean ownerEmailVerified;
    private Boolean emailNotifications;
}
