package org.janelia.noise.client;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import org.janelia.noise.json.JsonUtils;
import org.janelia.noise.level.LevelMapper;
import org.janelia.noise.model.NoiseConfiguration;
import org.janelia.noise.model.NoiseModelSpec;
import org.janelia.noise.model.NoiseType;

/**
 * Success and failure counts for a dataset generation run.
 * Counting methods are synchronized so that worker threads can share one report.
 */
public class ProcessingReport
        implements Serializable {

    public static class TypeCounts
            implements Serializable {

        private int processed;
        private int failed;

        public int getProcessed() {
            return processed;
        }

        public int getFailed() {
            return failed;
        }
    }

    private int originalImages;
    private int failedImages;
    private int totalProcessed;
    private int totalFailed;
    private String successRate;
    private final Map<String, TypeCounts> noiseTypes;
    private final Map<String, String> noiseParameters;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private ProcessingReport() {
        this.noiseTypes = new LinkedHashMap<>();
        this.noiseParameters = new LinkedHashMap<>();
    }

    /**
     * @param  originalImages  number of source images found.
     * @param  types           noise types being generated.
     * @param  levels          number of levels per type.
     * @param  configuration   configuration used to describe each type's parameter range.
     */
    public ProcessingReport(final int originalImages,
                            final List<NoiseType> types,
                            final int levels,
                            final NoiseConfiguration configuration) {
        this.originalImages = originalImages;
        this.noiseTypes = new LinkedHashMap<>();
        this.noiseParameters = new LinkedHashMap<>();

        final LevelMapper levelMapper = new LevelMapper(configuration);
        for (final NoiseType type : types) {
            this.noiseTypes.put(type.getName(), new TypeCounts());
            final NoiseModelSpec spec = configuration.getSpec(type);
            this.noiseParameters.put(type.getName(),
                                     String.format(Locale.US, "%s: %s from level 1 (%s) to level %d (%s)",
                                                   spec.getDescription(),
                                                   spec.getParameterName(),
                                                   levelMapper.mapLevel(type, 1, levels),
                                                   levels,
                                                   levelMapper.mapLevel(type, levels, levels)));
        }
        updateSuccessRate();
    }

    public synchronized void recordSuccess(final NoiseType type) {
        totalProcessed++;
        noiseTypes.get(type.getName()).processed++;
        updateSuccessRate();
    }

    public synchronized void recordFailure(final NoiseType type) {
        totalFailed++;
        noiseTypes.get(type.getName()).failed++;
        updateSuccessRate();
    }

    /**
     * Records a source image that could not be loaded (and therefore produced no variants).
     */
    public synchronized void recordImageFailure() {
        failedImages++;
        totalFailed++;
        updateSuccessRate();
    }

    public synchronized int getOriginalImages() {
        return originalImages;
    }

    public synchronized int getFailedImages() {
        return failedImages;
    }

    public synchronized int getTotalProcessed() {
        return totalProcessed;
    }

    public synchronized int getTotalFailed() {
        return totalFailed;
    }

    public synchronized String getSuccessRate() {
        return successRate;
    }

    public synchronized TypeCounts getCounts(final NoiseType type) {
        return noiseTypes.get(type.getName());
    }

    public synchronized Map<String, String> getNoiseParameters() {
        return noiseParameters;
    }

    public synchronized void writeJson(final Path path)
            throws IOException {
        JsonUtils.writeJsonFile(this, path);
    }

    public static ProcessingReport fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private void updateSuccessRate() {
        final int total = totalProcessed + totalFailed;
        successRate = total == 0 ? "0%" : String.format(Locale.US, "%.1f%%", totalProcessed * 100.0 / total);
    }

    private static final JsonUtils.Helper<ProcessingReport> JSON_HELPER =
            new JsonUtils.Helper<>(ProcessingReport.class);
}
