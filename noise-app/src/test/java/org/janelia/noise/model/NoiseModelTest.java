package org.janelia.noise.model;

import java.util.Arrays;
import java.util.List;

import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.DataType;
import org.janelia.noise.image.SyntheticImages;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link NoiseModel} implementations provided by every {@link NoiseType}.
 */
public class NoiseModelTest {

    private static final List<CanonicalImage> TEST_IMAGES = Arrays.asList(
            SyntheticImages.uniform(DataType.UINT8, 3, 48, 32, 0, 255, 1L),
            SyntheticImages.uniform(DataType.UINT16, 5, 40, 24, 5296, 65520, 2L),
            SyntheticImages.ramp(DataType.FLOAT32, 2, 30, 20, 0.1, 0.9),
            SyntheticImages.ramp(DataType.UINT8, 1, 25, 9, 30, 220));

    @Test
    public void testShapeTypeAndRangeArePreserved() {
        for (final NoiseType type : NoiseType.values()) {
            final double parameter = getMidRangeParameter(type);
            for (final CanonicalImage image : TEST_IMAGES) {
                final CanonicalImage noisy = type.getModel().apply(image, parameter, 7L);
                final String context = type + " applied to " + image;

                Assert.assertEquals(context + " changed shape", image.getShapeString(), noisy.getShapeString());
                Assert.assertEquals(context + " changed data type", image.getDataType(), noisy.getDataType());
                assertLegalValues(context, noisy);
            }
        }
    }

    @Test
    public void testInputIsNotModified() {
        for (final NoiseType type : NoiseType.values()) {
            for (final CanonicalImage image : TEST_IMAGES) {
                final CanonicalImage before = image.duplicate();
                type.getModel().apply(image, type.getDefaultSpec().getMaxParameter(), 3L);
                Assert.assertTrue(type + " modified its input " + image, SyntheticImages.hasSameSamples(before, image));
            }
        }
    }

    @Test
    public void testSameSeedIsReproducible() {
        for (final NoiseType type : NoiseType.values()) {
            final double parameter = getMidRangeParameter(type);
            for (final CanonicalImage image : TEST_IMAGES) {
                final CanonicalImage first = type.getModel().apply(image, parameter, 99L);
                final CanonicalImage second = type.getModel().apply(image, parameter, 99L);
                Assert.assertTrue(type + " is not reproducible for " + image,
                                  SyntheticImages.hasSameSamples(first, second));
            }
        }
    }

    @Test
    public void testDifferentSeedsDiffer() {
        final List<NoiseType> stochasticTypes = Arrays.asList(NoiseType.GAUSSIAN, NoiseType.SALT_PEPPER,
                                                              NoiseType.POISSON, NoiseType.SPECKLE,
                                                              NoiseType.ISO_NOISE);
        final CanonicalImage image = TEST_IMAGES.get(1);
        for (final NoiseType type : stochasticTypes) {
            final double parameter = type.getDefaultSpec().getMaxParameter();
            final CanonicalImage first = type.getModel().apply(image, parameter, 1L);
            final CanonicalImage second = type.getModel().apply(image, parameter, 2L);
            Assert.assertTrue(type + " should depend on the seed",
                              SyntheticImages.countDifferentSamples(first, second) > 0);
        }
    }

    @Test
    public void testConstantBands() {
        final CanonicalImage constant = SyntheticImages.constant(DataType.UINT16, 2, 16, 12, 1200);
        for (final NoiseType type : NoiseType.values()) {
            final CanonicalImage noisy = type.getModel().apply(constant, getMidRangeParameter(type), 5L);
            Assert.assertEquals(type + " changed shape of constant image",
                                constant.getShapeString(), noisy.getShapeString());
            assertLegalValues(type + " applied to constant image", noisy);
        }

        for (final NoiseType type : Arrays.asList(NoiseType.POISSON, NoiseType.SPECKLE,
                                                  NoiseType.COMPRESSION, NoiseType.MOTION_BLUR)) {
            final CanonicalImage noisy = type.getModel().apply(constant, getMidRangeParameter(type), 5L);
            Assert.assertTrue(type + " should leave constant bands unchanged",
                              SyntheticImages.hasSameSamples(constant, noisy));
        }

        final CanonicalImage gaussianNoisy = NoiseType.GAUSSIAN.getModel().apply(constant, 20, 5L);
        Assert.assertTrue("gaussian noise should still be added to constant bands",
                          SyntheticImages.countDifferentSamples(constant, gaussianNoisy) > 0);
    }

    @Test
    public void testGaussianSigmaIsScaledByBandRange() {
        final CanonicalImage image = SyntheticImages.uniform(DataType.FLOAT32, 1, 256, 256, 0.2, 0.8, 4L);
        final double sigma = 10.0;
        final CanonicalImage noisy = NoiseType.GAUSSIAN.getModel().apply(image, sigma, 8L);

        final float[] original = image.getBandValues(0);
        final float[] degraded = noisy.getBandValues(0);
        double min = Double.MAX_VALUE;
        double max = -Double.MAX_VALUE;
        double sum = 0;
        double sumOfSquares = 0;
        for (int i = 0; i < original.length; i++) {
            min = Math.min(min, original[i]);
            max = Math.max(max, original[i]);
            final double difference = degraded[i] - original[i];
            sum += difference;
            sumOfSquares += difference * difference;
        }
        final double mean = sum / original.length;
        final double standardDeviation = Math.sqrt(sumOfSquares / original.length - mean * mean);
        final double expectedStandardDeviation = sigma * (max - min) / 255.0;

        Assert.assertEquals("noise should have zero mean", 0.0, mean, expectedStandardDeviation * 0.02);
        Assert.assertEquals("noise has wrong standard deviation",
                            expectedStandardDeviation, standardDeviation, expectedStandardDeviation * 0.05);
    }

    @Test
    public void testSaltAndPepper() {
        final CanonicalImage image = SyntheticImages.constant(DataType.UINT8, 1, 200, 200, 100);
        final CanonicalImage noisy = NoiseType.SALT_PEPPER.getModel().apply(image, 0.5, 12L);

        int saltCount = 0;
        int pepperCount = 0;
        int unchangedCount = 0;
        for (final float value : noisy.getBandValues(0)) {
            if (value == 255f) {
                saltCount++;
            } else if (value == 0f) {
                pepperCount++;
            } else if (value == 100f) {
                unchangedCount++;
            }
        }

        final int n = 200 * 200;
        Assert.assertEquals("unexpected sample values found", n, saltCount + pepperCount + unchangedCount);
        Assert.assertEquals("wrong fraction of salt", 0.25, (double) saltCount / n, 0.02);
        Assert.assertEquals("wrong fraction of pepper", 0.25, (double) pepperCount / n, 0.02);
    }

    @Test
    public void testAtmosphericHaze() {
        final CanonicalImage image = SyntheticImages.constant(DataType.UINT8, 2, 10, 10, 100);

        final CanonicalImage halfHaze = NoiseType.ATMOSPHERIC.getModel().apply(image, 0.5, 0L);
        Assert.assertEquals("invalid hazy value", 178.0, halfHaze.getValue(1, 3, 3), 0.0);

        final CanonicalImage fullHaze = NoiseType.ATMOSPHERIC.getModel().apply(image, 1.0, 0L);
        Assert.assertEquals("full haze should reach the airlight", 255.0, fullHaze.getValue(0, 9, 9), 0.0);

        final CanonicalImage noHaze = NoiseType.ATMOSPHERIC.getModel().apply(image, 0.0, 0L);
        Assert.assertTrue("zero haze should be the identity", SyntheticImages.hasSameSamples(image, noHaze));
    }

    @Test
    public void testMotionBlur() {
        Assert.assertEquals(1, MotionBlur.getOddKernelSize(1.0));
        Assert.assertEquals(3, MotionBlur.getOddKernelSize(3.0));
        Assert.assertEquals(5, MotionBlur.getOddKernelSize(4.0));
        Assert.assertEquals(21, MotionBlur.getOddKernelSize(21.0));

        // rows are constant so a horizontal blur changes nothing
        final float[] rowValues = new float[20 * 10];
        for (int y = 0; y < 10; y++) {
            for (int x = 0; x < 20; x++) {
                rowValues[y * 20 + x] = 20 * y;
            }
        }
        final CanonicalImage rows = SyntheticImages.build(DataType.UINT8, 20, 10, Arrays.asList(rowValues));
        final CanonicalImage blurredRows = NoiseType.MOTION_BLUR.getModel().apply(rows, 9, 0L);
        Assert.assertTrue("horizontal blur should not change constant rows",
                          SyntheticImages.hasSameSamples(rows, blurredRows));

        final float[] edgeValues = new float[20 * 10];
        for (int i = 0; i < edgeValues.length; i++) {
            edgeValues[i] = (i % 20) < 10 ? 0 : 200;
        }
        final CanonicalImage edge = SyntheticImages.build(DataType.UINT8, 20, 10, Arrays.asList(edgeValues));
        final CanonicalImage blurredEdge = NoiseType.MOTION_BLUR.getModel().apply(edge, 5, 0L);
        Assert.assertEquals("far left should be unchanged", 0.0, blurredEdge.getValue(0, 2, 4), 0.0);
        Assert.assertEquals("pixel left of edge should be blurred", 80.0, blurredEdge.getValue(0, 9, 4), 0.0);
        Assert.assertEquals("pixel right of edge should be blurred", 120.0, blurredEdge.getValue(0, 10, 4), 0.0);
    }

    @Test
    public void testPoissonPreservesMean() {
        final CanonicalImage image = SyntheticImages.uniform(DataType.UINT16, 1, 200, 200, 1000, 11000, 6L);
        final CanonicalImage noisy = NoiseType.POISSON.getModel().apply(image, 0.5, 17L);

        final float[] original = image.getBandValues(0);
        final float[] degraded = noisy.getBandValues(0);
        double originalSum = 0;
        double degradedSum = 0;
        for (int i = 0; i < original.length; i++) {
            originalSum += original[i];
            degradedSum += degraded[i];
        }
        Assert.assertEquals("poisson noise should roughly preserve the mean",
                            originalSum / original.length, degradedSum / degraded.length, 200.0);
        Assert.assertTrue("poisson noise should change samples",
                          SyntheticImages.countDifferentSamples(image, noisy) > original.length / 2);
    }

    @Test
    public void testPoissonScaleIncreasesNoise() {
        final CanonicalImage image = SyntheticImages.uniform(DataType.UINT16, 1, 100, 100, 1000, 11000, 8L);
        final double fewPhotonsError = getMeanSquaredError(image, NoiseType.POISSON.getModel().apply(image, 1.0, 3L));
        final double manyPhotonsError = getMeanSquaredError(image, NoiseType.POISSON.getModel().apply(image, 0.1, 3L));
        Assert.assertTrue("larger scale should give larger error (" + fewPhotonsError + " vs " + manyPhotonsError + ")",
                          fewPhotonsError > manyPhotonsError);
    }

    @Test
    public void testCompressionQuality() {
        final CanonicalImage colour = TEST_IMAGES.get(0);
        final double lowQualityError = getMeanSquaredError(colour, NoiseType.COMPRESSION.getModel().apply(colour, 50, 0L));
        final double highQualityError = getMeanSquaredError(colour, NoiseType.COMPRESSION.getModel().apply(colour, 95, 0L));
        Assert.assertTrue("lower quality should give larger error (" + lowQualityError + " vs " + highQualityError + ")",
                          lowQualityError > highQualityError);
        Assert.assertTrue("compression should change a noisy image", highQualityError > 0);
    }

    @Test
    public void testIsoNoiseSigmas() {
        Assert.assertEquals(5.0, IsoNoise.getLuminanceSigma(1), 0.0);
        Assert.assertEquals(95.0, IsoNoise.getLuminanceSigma(10), 0.0);
        Assert.assertEquals(2.0, IsoNoise.getChrominanceSigma(1), 0.0);
        Assert.assertEquals(29.0, IsoNoise.getChrominanceSigma(10), 0.0);

        final CanonicalImage image = TEST_IMAGES.get(0);
        final double lowIsoError = getMeanSquaredError(image, NoiseType.ISO_NOISE.getModel().apply(image, 1, 3L));
        final double highIsoError = getMeanSquaredError(image, NoiseType.ISO_NOISE.getModel().apply(image, 10, 3L));
        Assert.assertTrue("higher ISO should give larger error", highIsoError > lowIsoError);
    }

    @Test
    public void testInvalidParameters() {
        final CanonicalImage image = TEST_IMAGES.get(3);
        final Object[][] invalidParameters = {
                { NoiseType.GAUSSIAN, -1.0 },
                { NoiseType.GAUSSIAN, Double.NaN },
                { NoiseType.SALT_PEPPER, 1.5 },
                { NoiseType.POISSON, 0.0 },
                { NoiseType.ATMOSPHERIC, -0.1 },
                { NoiseType.COMPRESSION, 0.0 },
                { NoiseType.ISO_NOISE, Double.POSITIVE_INFINITY },
                { NoiseType.MOTION_BLUR, 0.0 }
        };
        for (final Object[] typeAndParameter : invalidParameters) {
            final NoiseType type = (NoiseType) typeAndParameter[0];
            final double parameter = (Double) typeAndParameter[1];
            try {
                type.getModel().apply(image, parameter, 0L);
                Assert.fail(type + " should have rejected " + parameter);
            } catch (final InvalidNoiseParameterException e) {
                Assert.assertEquals("wrong type name in exception", type.getName(), e.getNoiseTypeName());
            }
        }
    }

    @Test
    public void testRandomStreams() {
        Assert.assertEquals("derived seeds should be reproducible",
                            RandomStreams.deriveSeed(42L, "scene", "gaussian", 3),
                            RandomStreams.deriveSeed(42L, "scene", "gaussian", 3));
        Assert.assertNotEquals("level should change derived seed",
                               RandomStreams.deriveSeed(42L, "scene", "gaussian", 3),
                               RandomStreams.deriveSeed(42L, "scene", "gaussian", 4));
        Assert.assertNotEquals("key order should change derived seed",
                               RandomStreams.deriveSeed(42L, "a", "b"),
                               RandomStreams.deriveSeed(42L, "b", "a"));
        Assert.assertNotEquals("bands should have different streams",
                               RandomStreams.forBand(42L, 0).nextLong(),
                               RandomStreams.forBand(42L, 1).nextLong());
    }

    static double getMidRangeParameter(final NoiseType type) {
        final NoiseModelSpec spec = type.getDefaultSpec();
        return (spec.getMinParameter() + spec.getMaxParameter()) / 2.0;
    }

    static double getMeanSquaredError(final CanonicalImage a,
                                      final CanonicalImage b) {
        double sum = 0;
        for (int band = 0; band < a.getBandCount(); band++) {
            final float[] aValues = a.getBandValues(band);
            final float[] bValues = b.getBandValues(band);
            for (int i = 0; i < aValues.length; i++) {
                final double difference = aValues[i] - bValues[i];
                sum += difference * difference;
            }
        }
        return sum / a.getSampleCount();
    }

    private static void assertLegalValues(final String context,
                                          final CanonicalImage image) {
        final DataType dataType = image.getDataType();
        for (int b = 0; b < image.getBandCount(); b++) {
            for (final float value : image.getBandValues(b)) {
                Assert.assertFalse(context + " produced NaN in band " + b, Float.isNaN(value));
                Assert.assertTrue(context + " produced " + value + " below minimum in band " + b,
                                  value >= dataType.getMinValue());
                Assert.assertTrue(context + " produced " + value + " above maximum in band " + b,
                                  value <= dataType.getMaxValue());
                if (dataType.isIntegral()) {
                    Assert.assertEquals(context + " produced non-integral value in band " + b,
                                        Math.rint(value), value, 0.0);
                }
            }
        }
    }

}
