package com.eyelevel.sheetextractor.exception.processing;

import com.eyelevel.sheetextractor.pipeline.PipelineStage;
import lombok.Getter;

import java.io.Serial;

/**
 * Wraps a failure with the pipeline stage it happened in. {@link #getMessage()} is the collapsed
 * {@code "<stage>: <kind>: <message>"} form stored on the failed job.
 */
@Getter
public class StageExecutionException extends RuntimeException {
    @Serial
    private static final long serialVersionUID = -4539062716318416301L;

    private final PipelineStage stage;
    private final ErrorKind kind;

    public StageExecutionException(final PipelineStage stage, final ProcessingException cause) {
        super(stage.label() + ": " + cause.getKind().label() + ": " + cause.getMessage(), cause);
        this.stage = stage;
        this.kind = cause.getKind();
    }
}
