package com.ogt.buildings.repository;

import com.ogt.buildings.entity.ExportRun;
import com.ogt.buildings.entity.ExportRunStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.transaction.annotation.Transactional;

import java.time.LocalDateTime;
import java.util.Collection;
import java.util.List;
import java.util.UUID;

public interface ExportRunRepository extends JpaRepository<ExportRun, UUID> {

    List<ExportRun> findByExportIdOrderByCreatedAtDesc(UUID exportId);

    boolean existsByExportIdAndStatusIn(UUID exportId, Collection<ExportRunStatus> statuses);

    // Transición atómica (compare-and-set): 0 filas = otro worker ya la tomó o el estado no corresponde
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("""
            UPDATE ExportRun r
            SET r.status = :target, r.startedAt = :startedAt
            WHERE r.id = :id AND r.status IN :expected
            """)
    int claimForProcessing(
            @Param("id") UUID id,
            @Param("expected") Collection<ExportRunStatus> expected,
            @Param("target") ExportRunStatus target,
            @Param("startedAt") LocalDateTime startedAt
    );

    // Sólo el handle de la cola, sin pisar el estado que el worker pudo haber cambiado
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Transactional
    @Query("UPDATE ExportRun r SET r.taskId = :taskId WHERE r.id = :id")
    int updateTaskId(@Param("id") UUID id, @Param("taskId") String taskId);

    // Para limpieza de exportaciones privadas antiguas
    @Query("""
            SELECT r
            FROM ExportRun r
            JOIN r.export e
            WHERE r.createdAt < :cutoff AND e.isPublic = false
            """)
    List<ExportRun> findPrivateRunsCreatedBefore(@Param("cutoff") LocalDateTime cutoff);
}
