package ai.catalog.translator.pipeline;

import java.util.List;

/**
 * Stage names. TRANSLATION, VALIDATION and OUTPUT are always present; the remaining common stages
 * are conventions plugins bind to, and callers may add their own.
 */
public final class PipelineStages {

    public static final String PRE_PROCESS = "pre_process";
    public static final String DIFF_DETECTION = "diff_detection";
    public static final String PREPARATION = "preparation";
    public static final String CHUNKING = "chunking";
    public static final String TRANSLATION = "translation";
    public static final String CONSENSUS = "consensus";
    public static final String VALIDATION = "validation";
    public static final String POST_PROCESS = "post_process";
    public static final String OUTPUT = "output";

    private PipelineStages() {
    }

    public static List<String> essentials() {
        return List.of(TRANSLATION, VALIDATION, OUTPUT);
    }

    public static List<String> common() {
        return List.of(PRE_PROCESS, DIFF_DETECTION, PREPARATION, CHUNKING, TRANSLATION, CONSENSUS, VALIDATION, POST_PROCESS, OUTPUT);
    }

    public static boolean isEssential(String stage) {
        return essentials().contains(stage);
    }
}
