package com.eyelevel.sheetextractor.dto.extraction;

import com.eyelevel.sheetextractor.model.Extraction;

import java.time.LocalDateTime;
import java.util.Map;
import java.util.UUID;

public record ExtractionResponse(UUID id, UUID jobId, UUID documentId, Map<String, Object> extractedData,
                                 double confidenceScore, String formatType, Map<String, Object> validationResults,
                                 LocalDateTime extractedAt, String notes) {

    public static ExtractionResponse from(final Extraction extraction) {
        return new ExtractionResponse(extraction.getId(), extraction.getJobId(), extraction.getDocumentId(),
                                      extraction.getExtractedData(), extraction.getConfidenceScore(),
                                      extraction.getFormatType(), extraction.getValidationResults(),
                                      extraction.getExtractedAt(), extraction.getNotes());
    }
}
