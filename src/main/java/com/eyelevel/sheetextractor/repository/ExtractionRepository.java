package com.eyelevel.sheetextractor.repository;

import com.eyelevel.sheetextractor.model.Extraction;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link Extraction} entity.
 */
@Repository
public interface ExtractionRepository extends JpaRepository<Extraction, UUID> {

    Optional<Extraction> findByJobId(UUID jobId);

    List<Extraction> findByDocumentIdOrderByExtractedAtDesc(UUID documentId);

    boolean existsByJobId(UUID jobId);
}
