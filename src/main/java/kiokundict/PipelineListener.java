package kiokundict;

/**
 * Receives progress callbacks from {@link BuildPipeline}. Artifact callbacks arrive from
 * worker threads.
 */
public interface PipelineListener {

    PipelineListener NONE = new PipelineListener() {
    };

    default void stageStarted(String stage) {
    }

    default void artifactsWritten(int done, int total) {
    }
}
