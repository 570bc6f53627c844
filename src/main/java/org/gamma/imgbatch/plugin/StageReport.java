package org.gamma.imgbatch.plugin;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records what happened to each optional sub-stage of an adapter for one image.
 * <p>
 * A stage without configuration is {@link StageStatus#DISABLED} and passes its input through silently.
 * A configured stage that throws is {@link StageStatus#FAILED} and logged as a warning.
 */
public final class StageReport {

    private static final Logger LOGGER = Logger.getLogger(StageReport.class.getName());

    public enum StageStatus {
        APPLIED,
        DISABLED,
        FAILED,
        REJECTED
    }

    @FunctionalInterface
    public interface StageAction<T> {
        T apply() throws Exception;
    }

    private final String itemName;
    private final Map<String, StageStatus> stages = new LinkedHashMap<>();

    public StageReport(String itemName) {
        this.itemName = itemName;
    }

    /**
     * Runs a stage when {@code params} is present.
     *
     * @return the stage's result, or {@code passThrough} when the stage is disabled or failed
     */
    public <T> T run(String stage, Object params, T passThrough, StageAction<T> action) {
        if (params == null) {
            stages.put(stage, StageStatus.DISABLED);
            return passThrough;
        }
        try {
            T result = action.apply();
            stages.put(stage, StageStatus.APPLIED);
            return result;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            failed(stage, e);
            return passThrough;
        } catch (Exception e) {
            failed(stage, e);
            return passThrough;
        }
    }

    /**
     * Runs a screening check when {@code params} is present. A check returning {@code false} rejects the image.
     */
    public void check(String stage, Object params, StageAction<Boolean> check) {
        Boolean passed = run(stage, params, Boolean.TRUE, check);
        if (stages.get(stage) == StageStatus.APPLIED && !Boolean.TRUE.equals(passed)) {
            stages.put(stage, StageStatus.REJECTED);
            LOGGER.log(Level.FINE, "{0}: {1} check did not pass", new Object[]{itemName, stage});
        }
    }

    private void failed(String stage, Exception e) {
        stages.put(stage, StageStatus.FAILED);
        LOGGER.log(Level.WARNING, "{0}: skipping {1}, stage failed: {2}", new Object[]{itemName, stage, e.getMessage()});
    }

    public StageStatus status(String stage) {
        return stages.get(stage);
    }

    public int degradedCount() {
        return (int) stages.values().stream()
                .filter(s -> s == StageStatus.FAILED || s == StageStatus.REJECTED)
                .count();
    }

    public Map<String, StageStatus> stages() {
        return Collections.unmodifiableMap(stages);
    }
}
