package com.ogt.buildings.entity;

import com.ogt.buildings.exception.BusinessException;
import jakarta.persistence.*;
import lombok.*;
import org.hibernate.annotations.CreationTimestamp;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.annotations.UpdateTimestamp;
import org.hibernate.annotations.UuidGenerator;
import org.hibernate.type.SqlTypes;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.UUID;

@Entity
@Table(name = "export_runs", indexes = {
        @Index(name = "ix_export_runs_export", columnList = "export_id, created_at"),
        @Index(name = "ix_export_runs_status", columnList = "status, created_at"),
        @Index(name = "ix_export_runs_task", columnList = "task_id")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class ExportRun {

    @Id
    @UuidGenerator
    private UUID id;

    @ManyToOne(fetch = FetchType.EAGER, optional = false)
    @JoinColumn(name = "export_id", nullable = false)
    private Export export;

    @Builder.Default
    @Enumerated(EnumType.STRING)
    @Column(nullable = false, length = 20)
    private ExportRunStatus status = ExportRunStatus.PENDING;

    @Builder.Default
    @JdbcTypeCode(SqlTypes.JSON)
    @Column(columnDefinition = "NVARCHAR(MAX)")
    private Map<String, Object> results = new LinkedHashMap<>();

    @Column(name = "output_file", length = 1000)
    private String outputFile;

    @Column(name = "tiles_file", length = 1000)
    private String tilesFile;

    @Column(name = "started_at")
    private LocalDateTime startedAt;

    @Column(name = "completed_at")
    private LocalDateTime completedAt;

    @Column(name = "error_message", columnDefinition = "NVARCHAR(MAX)")
    private String errorMessage;

    @Column(name = "task_id")
    private String taskId; // handle opaco de la cola

    @CreationTimestamp
    @Column(name = "created_at", updatable = false)
    private LocalDateTime createdAt;

    @UpdateTimestamp
    @Column(name = "updated_at")
    private LocalDateTime updatedAt;

    public void markQueued() {
        transitionTo(ExportRunStatus.QUEUED);
    }

    public void markCompleted(LocalDateTime now, Map<String, Object> finalResults) {
        transitionTo(ExportRunStatus.COMPLETED);
        this.results = new LinkedHashMap<>(finalResults);
        this.completedAt = now;
    }

    public void markFailed(LocalDateTime now, String message) {
        transitionTo(ExportRunStatus.FAILED);
        this.errorMessage = message;
        this.completedAt = now;
    }

    private void transitionTo(ExportRunStatus target) {
        if (!status.canTransitionTo(target)) {
            throw new BusinessException("Transición inválida de " + status + " a " + target + " en run " + id);
        }
        this.status = target;
    }

    public Duration getDuration() {
        if (startedAt != null && completedAt != null) {
            return Duration.between(startedAt, completedAt);
        }
        return null;
    }

    public long getBuildingCount() {
        Object count = results != null ? results.get("building_count") : null;
        return count instanceof Number n ? n.longValue() : 0L;
    }
}
