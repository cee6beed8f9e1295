package com.ogt.buildings.entity;

import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;
import org.locationtech.jts.geom.Polygon;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "exports")
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class Export {

    @Id
    @UuidGenerator
    private UUID id;

    // Snapshot del dueño (la gestión de cuentas es externa)
    @Column(name = "owner_id", length = 100)
    private String ownerId;

    @Column(name = "owner_email")
    private String ownerEmail;

    @Builder.Default
    @Column(name = "owner_email_verified")
    private Boolean ownerEmailVerified = false;

    @Builder.Default
    @Column(name = "email_notifications")
    private Boolean emailNotifications = false;

    @Column(nullable = false, length = 200)
    private String name;

    @Column(columnDefinition = "NVARCHAR(MAX)")
    private String description;

    @Column(name = "area_of_interest", columnDefinition = "geometry", nullable = false)
    private Polygon areaOfInterest; // WGS84 (EPSG:4326)

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "export_sources", joinColumns = @JoinColumn(name = "export_id"))
    @OrderColumn(name = "position")
    @Enumerated(EnumType.STRING)
    @Column(name = "source", length = 20)
    private List<BuildingSource> sources = new ArrayList<>();

    @Builder.Default
    @ElementCollection(fetch = FetchType.EAGER)
    @CollectionTable(name = "export_output_formats", joinColumns = @JoinColumn(name = "export_id"))
    @OrderColumn(name = "position")
    @Enumerated(EnumType.STRING)
    @Column(name = "output_format", length = 20)
    private List<OutputFormat> outputFormats = new ArrayList<>();

    // source id -> opciones de la fuente (validadas por SourceConfigParser)
    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(name = "source_config", columnDefinition = "NVARCHAR(MAX)")
    private Map<String, Map<String, Object>> sourceConfig = new HashMap<>();

    @Builder.Default
    @Column(name = "is_public")
    private Boolean isPublic = false;

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public Map<String, Object> configFor(BuildingSource source) {
        if (sourceConfig == null) {
            return Map.of();
        }
        Map<String, Object> config = sourceConfig.get(source.getId());
        return config != null ? config : Map.of();
    }

    public boolean wantsCompletionEmail() {
        return Boolean.TRUE.equals(emailNotifications)
                && Boolean.TRUE.equals(ownerEmailVerified)
                && ownerEmail != null && !ownerEmail.isBlank();
    }
}
