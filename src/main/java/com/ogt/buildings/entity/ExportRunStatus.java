package com.ogt.buildings.entity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

/**
 * Máquina de estados de una ejecución: PENDING -> QUEUED -> PROCESSING -> {COMPLETED, FAILED}.
 * Un run QUEUED cuyo job no pudo programarse pasa directamente a FAILED.
 * Sólo se avanza; los estados terminales no admiten cambios.
 */
public enum ExportRunStatus {

    PENDING,
    QUEUED,
    PROCESSING,
    COMPLETED,
    FAILED;

    public static final Set<ExportRunStatus> IN_FLIGHT = EnumSet.of(PENDING, QUEUED, PROCESSING);

    public boolean isTerminal() {
        return this == COMPLETED || this == FAILED;
    }

    public boolean canTransitionTo(ExportRunStatus target) {
        return switch (this) {
            case PENDING -> target == QUEUED;
            // QUEUED -> FAILED sólo cuando el job no llegó a encolarse
            case QUEUED -> target == PROCESSING || target == FAILED;
            case PROCESSING -> target == COMPLETED || target == FAILED;
            case COMPLETED, FAILED -> false;
        };
    }

    public String getId() {
        return name().toLowerCase(Locale.ROOT);
    }
}
