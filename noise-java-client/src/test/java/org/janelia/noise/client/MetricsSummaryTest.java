package org.janelia.noise.client;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import org.janelia.noise.image.DataType;
import org.janelia.noise.json.JsonUtils;
import org.janelia.noise.metrics.BandMetrics;
import org.janelia.noise.metrics.MetricsRecord;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link MetricsSummary} class.
 */
public class MetricsSummaryTest {

    @Test
    public void testStatistics() {
        final MetricsSummary summary = new MetricsSummary(buildRecords());

        Assert.assertEquals("invalid image count", 2, summary.getImageCount());
        Assert.assertEquals("invalid record count", 4, summary.getRecordCount());
        Assert.assertEquals("types should be listed in declaration order",
                            Arrays.asList("gaussian", "salt_pepper", "motion_blur"),
                            new ArrayList<>(summary.getNoiseTypes().keySet()));

        final MetricsSummary.TypeSummary gaussian = summary.getNoiseTypes().get("gaussian");
        Assert.assertEquals("invalid sample count", 2, gaussian.getSamples());
        Assert.assertEquals("invalid psnr mean", 25.0, gaussian.getPsnr().getMean(), 1e-9);
        Assert.assertEquals("invalid psnr std", Math.sqrt(50.0), gaussian.getPsnr().getStd(), 1e-9);
        Assert.assertEquals("invalid ssim mean", 0.8, gaussian.getSsim().getMean(), 1e-9);
        Assert.assertEquals("invalid mse mean", 20.0, gaussian.getMse().getMean(), 1e-9);
        Assert.assertEquals("invalid good count", 1, gaussian.getTierCounts().get("good").intValue());
        Assert.assertEquals("invalid moderate count", 1, gaussian.getTierCounts().get("moderate").intValue());
        Assert.assertEquals("tiers without samples should be listed", 0,
                            gaussian.getTierCounts().get("excellent").intValue());

        final MetricsSummary.TypeSummary saltPepper = summary.getNoiseTypes().get("salt_pepper");
        Assert.assertEquals("single sample should have zero std", 0.0, saltPepper.getPsnr().getStd(), 0.0);
        Assert.assertEquals("invalid poor count", 1, saltPepper.getTierCounts().get("poor").intValue());
    }

    @Test
    public void testIdenticalSamples() {
        final MetricsSummary summary = new MetricsSummary(buildRecords());

        final MetricsSummary.TypeSummary motionBlur = summary.getNoiseTypes().get("motion_blur");
        final MetricsSummary.Statistic psnr = motionBlur.getPsnr();
        Assert.assertEquals("infinite psnr should be excluded", 0, psnr.getCount());
        Assert.assertEquals("infinite psnr should be counted", 1, psnr.getInfiniteCount());
        Assert.assertTrue("mean without finite values should be NaN", Double.isNaN(psnr.getMean()));
        Assert.assertEquals("identical ssim should be kept", 1.0, motionBlur.getSsim().getMean(), 0.0);
        Assert.assertEquals("invalid excellent count", 1, motionBlur.getTierCounts().get("excellent").intValue());
    }

    @Test
    public void testRankings() {
        final MetricsSummary summary = new MetricsSummary(buildRecords());

        Assert.assertEquals("invalid psnr ranking",
                            Arrays.asList("motion_blur", "gaussian", "salt_pepper"), summary.getPsnrRanking());
        Assert.assertEquals("invalid ssim ranking",
                            Arrays.asList("motion_blur", "gaussian", "salt_pepper"), summary.getSsimRanking());

        final MetricsSummary empty = new MetricsSummary(Collections.emptyList());
        Assert.assertEquals("empty summary should have no types", 0, empty.getNoiseTypes().size());
        Assert.assertEquals("empty summary should have no ranking", 0, empty.getPsnrRanking().size());
    }

    @Test
    public void testJson() throws Exception {
        final MetricsSummary summary = new MetricsSummary(buildRecords());
        final String json = JSON_HELPER.toJson(summary);

        final MetricsSummary parsedSummary = MetricsSummary.fromJson(json);
        Assert.assertEquals("ranking should survive round trip",
                            summary.getPsnrRanking(), parsedSummary.getPsnrRanking());
        Assert.assertEquals("mean should survive round trip",
                            25.0, parsedSummary.getNoiseTypes().get("gaussian").getPsnr().getMean(), 1e-9);
        Assert.assertTrue("NaN should survive round trip",
                          Double.isNaN(parsedSummary.getNoiseTypes().get("motion_blur").getPsnr().getMean()));
    }

    private static List<MetricsRecord> buildRecords() {
        return Arrays.asList(
                buildRecord("a", "gaussian", 1, new BandMetrics(0, 30.0, 0.9, 10.0, 20.0)),
                buildRecord("b", "gaussian", 1, new BandMetrics(0, 20.0, 0.7, 30.0, 10.0)),
                buildRecord("a", "motion_blur", 1,
                            new BandMetrics(0, Double.POSITIVE_INFINITY, 1.0, 0.0, Double.POSITIVE_INFINITY)),
                buildRecord("b", "salt_pepper", 1, new BandMetrics(0, 12.0, 0.5, 100.0, 5.0)));
    }

    private static MetricsRecord buildRecord(final String imageId,
                                             final String noiseType,
                                             final int level,
                                             final BandMetrics bandMetrics) {
        return new MetricsRecord(imageId, noiseType, level, 1, 8, 8, DataType.UINT8,
                                 Collections.singletonList(bandMetrics), false);
    }

    private static final JsonUtils.Helper<MetricsSummary> JSON_HELPER =
            new JsonUtils.Helper<>(MetricsSummary.class);

}
