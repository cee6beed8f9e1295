package com.ogt.buildings.repository;

import com.ogt.buildings.entity.Export;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.UUID;

public interface ExportRepository extends JpaRepository<Export, UUID> {
}
