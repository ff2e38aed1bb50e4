package com.eyelevel.sheetextractor.pipeline;

/**
 * The stages of the extraction pipeline, in execution order, with the share of overall progress each one
 * covers.
 */
public enum PipelineStage {
    PARSE(0, 30),
    EXTRACT(30, 80),
    VALIDATE(80, 100);

    private final double startPercent;
    private final double endPercent;

    PipelineStage(final double startPercent, final double endPercent) {
        this.startPercent = startPercent;
        this.endPercent = endPercent;
    }

    public double startPercent() {
        return startPercent;
    }

    public double endPercent() {
        return endPercent;
    }

    /**
     * Maps a fraction of this stage's work onto overall job progress.
     *
     * @param fraction Completed share of the stage, clamped to [0,1].
     * @return Overall progress in percent.
     */
    public double progressAt(final double fraction) {
        final double clamped = Math.max(0.0, Math.min(1.0, fraction));
        return startPercent + (endPercent - startPercent) * clamped;
    }

    public String label() {
        return name().toLowerCase();
    }
}
