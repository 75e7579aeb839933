package org.janelia.noise.client;

import java.io.IOException;
import java.io.Serializable;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.janelia.noise.json.JsonUtils;
import org.janelia.noise.metrics.MetricsRecord;
import org.janelia.noise.metrics.QualityTier;
import org.janelia.noise.model.NoiseType;

/**
 * Per noise type statistics over a set of {@link MetricsRecord}s along with
 * noise type rankings by mean PSNR and mean SSIM (best first).
 */
public class MetricsSummary
        implements Serializable {

    /**
     * Mean and sample standard deviation of one metric.
     * Infinite values (identical images) are left out and counted separately.
     */
    public static class Statistic
            implements Serializable {

        private double mean;
        private double std;
        private int count;
        private int infiniteCount;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private Statistic() {
        }

        public Statistic(final List<Double> values) {
            double sum = 0.0;
            for (final Double value : values) {
                if (Double.isInfinite(value)) {
                    infiniteCount++;
                } else {
                    sum += value;
                    count++;
                }
            }
            mean = count == 0 ? Double.NaN : sum / count;

            double squaredDeviationSum = 0.0;
            for (final Double value : values) {
                if (! Double.isInfinite(value)) {
                    squaredDeviationSum += (value - mean) * (value - mean);
                }
            }
            std = count < 2 ? 0.0 : Math.sqrt(squaredDeviationSum / (count - 1));
        }

        public double getMean() {
            return mean;
        }

        public double getStd() {
            return std;
        }

        public int getCount() {
            return count;
        }

        public int getInfiniteCount() {
            return infiniteCount;
        }
    }

    public static class TypeSummary
            implements Serializable {

        private Statistic psnr;
        private Statistic ssim;
        private Statistic mse;
        private Statistic snr;
        private int samples;
        private Map<String, Integer> tierCounts;

        // no-arg constructor needed for JSON deserialization
        @SuppressWarnings("unused")
        private TypeSummary() {
        }

        TypeSummary(final List<MetricsRecord> records) {
            final List<Double> psnrValues = new ArrayList<>();
            final List<Double> ssimValues = new ArrayList<>();
            final List<Double> mseValues = new ArrayList<>();
            final List<Double> snrValues = new ArrayList<>();
            this.tierCounts = new LinkedHashMap<>();
            for (final QualityTier tier : QualityTier.values()) {
                tierCounts.put(tier.getName(), 0);
            }
            for (final MetricsRecord record : records) {
                psnrValues.add(record.getPsnr());
                ssimValues.add(record.getSsim());
                mseValues.add(record.getMse());
                snrValues.add(record.getSnr());
                tierCounts.merge(record.getQualityTier().getName(), 1, Integer::sum);
            }
            this.psnr = new Statistic(psnrValues);
            this.ssim = new Statistic(ssimValues);
            this.mse = new Statistic(mseValues);
            this.snr = new Statistic(snrValues);
            this.samples = records.size();
        }

        public Statistic getPsnr() {
            return psnr;
        }

        public Statistic getSsim() {
            return ssim;
        }

        public Statistic getMse() {
            return mse;
        }

        public Statistic getSnr() {
            return snr;
        }

        public int getSamples() {
            return samples;
        }

        public Map<String, Integer> getTierCounts() {
            return tierCounts;
        }
    }

    private int imageCount;
    private int recordCount;
    private Map<String, TypeSummary> noiseTypes;
    private List<String> psnrRanking;
    private List<String> ssimRanking;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private MetricsSummary() {
    }

    /**
     * Builds a summary for the specified records.
     */
    public MetricsSummary(final List<MetricsRecord> records) {

        final Set<String> imageIds = new HashSet<>();
        this.noiseTypes = new LinkedHashMap<>();
        for (final NoiseType type : NoiseType.values()) {
            final List<MetricsRecord> typeRecords = new ArrayList<>();
            for (final MetricsRecord record : records) {
                if (type.getName().equals(record.getNoiseType())) {
                    typeRecords.add(record);
                }
            }
            if (! typeRecords.isEmpty()) {
                noiseTypes.put(type.getName(), new TypeSummary(typeRecords));
            }
        }
        for (final MetricsRecord record : records) {
            imageIds.add(record.getImageId());
        }

        this.imageCount = imageIds.size();
        this.recordCount = records.size();

        // types with only identical samples rank first
        this.psnrRanking = new ArrayList<>(noiseTypes.keySet());
        this.psnrRanking.sort(Comparator.comparingDouble(
                (String name) -> rankValue(noiseTypes.get(name).getPsnr())).reversed());

        this.ssimRanking = new ArrayList<>(noiseTypes.keySet());
        this.ssimRanking.sort(Comparator.comparingDouble(
                (String name) -> rankValue(noiseTypes.get(name).getSsim())).reversed());
    }

    public int getImageCount() {
        return imageCount;
    }

    public int getRecordCount() {
        return recordCount;
    }

    public Map<String, TypeSummary> getNoiseTypes() {
        return noiseTypes;
    }

    public List<String> getPsnrRanking() {
        return psnrRanking;
    }

    public List<String> getSsimRanking() {
        return ssimRanking;
    }

    public void writeJson(final Path path)
            throws IOException {
        JsonUtils.writeJsonFile(this, path);
    }

    public static MetricsSummary fromJson(final String json) {
        return JSON_HELPER.fromJson(json);
    }

    private static double rankValue(final Statistic statistic) {
        return statistic.getCount() == 0 ? Double.POSITIVE_INFINITY : statistic.getMean();
    }

    private static final JsonUtils.Helper<MetricsSummary> JSON_HELPER =
            new JsonUtils.Helper<>(MetricsSummary.class);

}
