package ai.catalog.translator.pipeline;

/**
 * Lifecycle event names observers can subscribe to.
 */
public final class PipelineEvents {

    public static final String TRANSLATION_STARTED = "translation.started";
    public static final String TRANSLATION_COMPLETED = "translation.completed";
    public static final String TRANSLATION_FAILED = "translation.failed";

    private PipelineEvents() {
    }

    public static String stageStarted(String stage) {
        return "stage." + stage + ".started";
    }

    public static String stageCompleted(String stage) {
        return "stage." + stage + ".completed";
    }
}
