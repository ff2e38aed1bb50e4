package com.eyelevel.sheetextractor.repository;

import com.eyelevel.sheetextractor.model.Document;
import com.eyelevel.sheetextractor.model.DocumentStatus;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.UUID;

/**
 * Spring Data JPA repository for the {@link Document} entity.
 */
@Repository
public interface DocumentRepository extends JpaRepository<Document, UUID> {

    /**
     * Mirrors a job outcome onto its document. Callers invoke this in the same transaction as the
     * job update it reflects, after that update has won.
     */
    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Query("UPDATE Document d SET d.status = :status, d.error = :error, d.updatedAt = :now WHERE d.id = :id")
    int updateStatus(@Param("id") UUID id, @Param("status") DocumentStatus status, @Param("error") String error,
                     @Param("now") LocalDateTime now);
}
