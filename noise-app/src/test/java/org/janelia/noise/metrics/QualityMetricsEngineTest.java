package org.janelia.noise.metrics;

import java.util.ArrayList;
import java.util.List;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.DataType;
import org.janelia.noise.image.SyntheticImages;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link QualityMetricsEngine} class.
 */
public class QualityMetricsEngineTest {

    private final QualityMetricsEngine engine = new QualityMetricsEngine();

    @Test
    public void testIdenticalImages() {
        final CanonicalImage image = SyntheticImages.uniform(DataType.UINT16, 4, 40, 30, 100, 60000, 3L);

        final MetricsRecord record = engine.compare("scene", "gaussian", 1, image, image.duplicate());

        Assert.assertTrue("record should be flagged identical", record.isIdentical());
        Assert.assertEquals("MSE should be 0", 0.0, record.getMse(), 0.0);
        Assert.assertEquals("SSIM should be exactly 1", 1.0, record.getSsim(), 0.0);
        Assert.assertTrue("PSNR should be infinite", Double.isInfinite(record.getPsnr()));
        Assert.assertTrue("SNR should be infinite", Double.isInfinite(record.getSnr()));
        Assert.assertEquals("wrong tier", QualityTier.EXCELLENT, record.getQualityTier());
        Assert.assertEquals("wrong band count", 4, record.getBands().size());
        for (final BandMetrics bandMetrics : record.getBands()) {
            Assert.assertTrue("band " + bandMetrics.getBand() + " should be identical", bandMetrics.isIdentical());
            Assert.assertEquals("band SSIM should be exactly 1", 1.0, bandMetrics.getSsim(), 0.0);
        }
    }

    @Test
    public void testConstantOffset() {
        final CanonicalImage original = SyntheticImages.uniform(DataType.UINT8, 1, 64, 64, 20, 200, 5L);
        final List<float[]> shifted = new ArrayList<>();
        final float[] values = original.getBandValues(0);
        for (int i = 0; i < values.length; i++) {
            values[i] += 10;
        }
        shifted.add(values);
        final CanonicalImage degraded = original.withBandValues(shifted);

        final MetricsRecord record = engine.compare(original, degraded);

        Assert.assertEquals("invalid MSE", 100.0, record.getMse(), 1e-9);
        Assert.assertEquals("invalid PSNR", 10.0 * Math.log10(255.0 * 255.0 / 100.0), record.getPsnr(), 1e-9);
        Assert.assertEquals("invalid PSNR", 28.1308, record.getPsnr(), 1e-4);
        Assert.assertFalse("record should not be identical", record.isIdentical());
        Assert.assertTrue("SSIM should be below 1", record.getSsim() < 1.0);
        Assert.assertTrue("SSIM should stay high for a small offset", record.getSsim() > 0.9);
    }

    @Test
    public void testOriginalIsTheReference() {
        final CanonicalImage dark = SyntheticImages.constant(DataType.UINT8, 1, 16, 16, 10);
        final CanonicalImage bright = SyntheticImages.constant(DataType.UINT8, 1, 16, 16, 110);

        final MetricsRecord darkReference = engine.compare(dark, bright);
        final MetricsRecord brightReference = engine.compare(bright, dark);

        Assert.assertEquals("MSE should be symmetric", darkReference.getMse(), brightReference.getMse(), 0.0);
        Assert.assertEquals("SNR should use the original's signal",
                            10.0 * Math.log10(100.0 / 10000.0), darkReference.getSnr(), 1e-9);
        Assert.assertEquals("SNR should use the original's signal",
                            10.0 * Math.log10(12100.0 / 10000.0), brightReference.getSnr(), 1e-9);
    }

    @Test
    public void testPartiallyIdenticalBands() {
        final CanonicalImage original = SyntheticImages.ramp(DataType.UINT8, 2, 20, 20, 0, 200);
        final List<float[]> degradedValues = new ArrayList<>();
        degradedValues.add(original.getBandValues(0));
        final float[] secondBand = original.getBandValues(1);
        for (int i = 0; i < secondBand.length; i++) {
            secondBand[i] += 5;
        }
        degradedValues.add(secondBand);

        final MetricsRecord record = engine.compare(original, original.withBandValues(degradedValues));

        Assert.assertFalse("record should not be identical", record.isIdentical());
        Assert.assertTrue("first band should be identical", record.getBands().get(0).isIdentical());
        Assert.assertEquals("aggregate PSNR should only include the differing band",
                            record.getBands().get(1).getPsnr(), record.getPsnr(), 0.0);
        Assert.assertEquals("aggregate SNR should only include the differing band",
                            record.getBands().get(1).getSnr(), record.getSnr(), 0.0);
        Assert.assertEquals("aggregate MSE should average all bands",
                            12.5, record.getMse(), 1e-9);
    }

    @Test
    public void testShapeMismatch() {
        final CanonicalImage a = SyntheticImages.constant(DataType.UINT8, 3, 10, 10, 1);
        final CanonicalImage b = SyntheticImages.constant(DataType.UINT8, 2, 10, 10, 1);
        try {
            engine.compare("scene", "speckle", 2, a, b);
            Assert.fail("mismatched shapes should have been rejected");
        } catch (final ShapeMismatchException e) {
            Assert.assertTrue("message should include both shapes",
                              e.getMessage().contains("(3, 10, 10)") && e.getMessage().contains("(2, 10, 10)"));
        }
    }

    @Test
    public void testSsimDownsampling() {
        final CanonicalImage wide = SyntheticImages.ramp(DataType.UINT16, 1, 900, 12, 0, 50000);
        final MetricsRecord downsampled = engine.compare(wide, wide);
        Assert.assertTrue("wide image should be downsampled for SSIM", downsampled.isSsimDownsampled());
        Assert.assertEquals("identical downsampled bands should have SSIM 1", 1.0, downsampled.getSsim(), 1e-12);

        final MetricsRecord fullSize = new QualityMetricsEngine(1000).compare(wide, wide);
        Assert.assertFalse("larger limit should avoid downsampling", fullSize.isSsimDownsampled());
    }

    @Test
    public void testRecordJson() {
        final CanonicalImage image = SyntheticImages.ramp(DataType.UINT8, 2, 16, 16, 0, 255);
        final MetricsRecord record = engine.compare("scene", "atmospheric", 3, image, image);

        final String json = record.toJson();
        Assert.assertTrue("infinite PSNR should be written as Infinity", json.contains("\"Infinity\""));
        Assert.assertTrue("tier should be written in lower case", json.contains("\"excellent\""));

        final MetricsRecord parsed = MetricsRecord.fromJson(json);
        Assert.assertEquals("image id lost", "scene", parsed.getImageId());
        Assert.assertEquals("level lost", Integer.valueOf(3), parsed.getLevel());
        Assert.assertTrue("infinite PSNR lost", Double.isInfinite(parsed.getPsnr()));
        Assert.assertEquals("tier lost", QualityTier.EXCELLENT, parsed.getQualityTier());
        Assert.assertEquals("bands lost", 2, parsed.getBands().size());
    }

}
