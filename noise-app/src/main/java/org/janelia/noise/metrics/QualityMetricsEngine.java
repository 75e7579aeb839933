package org.janelia.noise.metrics;

import ij.process.ImageProcessor;

import java.util.ArrayList;
import java.util.List;

import org.janelia.noise.image.CanonicalImage;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Computes PSNR, SSIM, MSE and SNR for degraded images relative to their originals.
 *
 * The original is always the reference: PSNR uses the original's data type maximum and SNR
 * uses the original's signal power.  SSIM for bands whose longest side exceeds the configured
 * bound is computed on area averaged copies of both bands, and records are flagged when that
 * approximation was used.
 *
 * Record level PSNR and SNR are means over the bands that differ from the original.  Identical
 * bands have infinite PSNR and SNR and are left out of those means, so one untouched band does
 * not make the record infinite.  Both are infinite only when every band is identical.  SSIM and
 * MSE are means over all bands.
 */
public class QualityMetricsEngine {

    public static final int DEFAULT_SSIM_MAX_DIMENSION = 800;

    private final int ssimMaxDimension;
    private final StructuralSimilarity structuralSimilarity;

    public QualityMetricsEngine() {
        this(DEFAULT_SSIM_MAX_DIMENSION);
    }

    /**
     * @param  ssimMaxDimension  longest side above which SSIM is computed on downsampled bands.
     */
    public QualityMetricsEngine(final int ssimMaxDimension) {
        if (ssimMaxDimension < 1) {
            throw new IllegalArgumentException("ssimMaxDimension must be at least 1");
        }
        this.ssimMaxDimension = ssimMaxDimension;
        this.structuralSimilarity = new StructuralSimilarity();
    }

    /**
     * @return metrics for the degraded image relative to the original.
     *
     * @throws ShapeMismatchException
     *   if the images do not have identical (bands, height, width) shapes.
     */
    public MetricsRecord compare(final CanonicalImage original,
                                 final CanonicalImage degraded)
            throws ShapeMismatchException {
        return compare(null, null, null, original, degraded);
    }

    /**
     * @param  imageId    identifier of the original image (e.g. its base name).
     * @param  noiseType  name of the noise applied to produce the degraded image.
     * @param  level      level of the noise applied to produce the degraded image.
     * @param  original   reference image.
     * @param  degraded   degraded image.
     *
     * @return labelled metrics for the degraded image relative to the original.
     *
     * @throws ShapeMismatchException
     *   if the images do not have identical (bands, height, width) shapes.
     */
    public MetricsRecord compare(final String imageId,
                                 final String noiseType,
                                 final Integer level,
                                 final CanonicalImage original,
                                 final CanonicalImage degraded)
            throws ShapeMismatchException {

        if (! original.hasSameShape(degraded)) {
            throw new ShapeMismatchException(
                    "original shape " + original.getShapeString() + " differs from degraded shape " +
                    (degraded == null ? null : degraded.getShapeString()) +
                    (imageId == null ? "" : " for " + imageId + " " + noiseType + " level " + level));
        }

        final double maxValue = original.getDataType().getMaxValue();
        final boolean downsample = Math.max(original.getWidth(), original.getHeight()) > ssimMaxDimension;

        final List<BandMetrics> bandMetricsList = new ArrayList<>(original.getBandCount());
        for (int b = 0; b < original.getBandCount(); b++) {

            final ImageProcessor originalBand = original.getBand(b);
            final ImageProcessor degradedBand = degraded.getBand(b);

            final double[] errorAndSignal = getSquaredErrorAndSignal(originalBand, degradedBand);
            final double mse = errorAndSignal[0];
            final double meanSignalPower = errorAndSignal[1];

            final double psnr = mse == 0.0 ? Double.POSITIVE_INFINITY : 10.0 * Math.log10(maxValue * maxValue / mse);
            final double snr = mse == 0.0 ? Double.POSITIVE_INFINITY : 10.0 * Math.log10(meanSignalPower / mse);

            final double ssim;
            if (downsample) {
                ssim = structuralSimilarity.calculate(StructuralSimilarity.downsample(originalBand, ssimMaxDimension),
                                                      StructuralSimilarity.downsample(degradedBand, ssimMaxDimension),
                                                      maxValue);
            } else {
                ssim = structuralSimilarity.calculate(originalBand, degradedBand, maxValue);
            }

            bandMetricsList.add(new BandMetrics(b, psnr, ssim, mse, snr));
        }

        final MetricsRecord record = new MetricsRecord(imageId,
                                                       noiseType,
                                                       level,
                                                       original.getBandCount(),
                                                       original.getHeight(),
                                                       original.getWidth(),
                                                       original.getDataType(),
                                                       bandMetricsList,
                                                       downsample);

        LOG.debug("compare: returning {}", record);

        return record;
    }

    /**
     * @return mean squared error and mean squared original value for the specified bands.
     */
    private static double[] getSquaredErrorAndSignal(final ImageProcessor original,
                                                     final ImageProcessor degraded) {
        final int n = original.getWidth() * original.getHeight();
        double squaredErrorSum = 0.0;
        double signalSum = 0.0;
        for (int i = 0; i < n; i++) {
            final double value = original.getf(i);
            final double difference = value - degraded.getf(i);
            squaredErrorSum += difference * difference;
            signalSum += value * value;
        }
        return new double[] { squaredErrorSum / n, signalSum / n };
    }

    private static final Logger LOG = LoggerFactory.getLogger(QualityMetricsEngine.class);
}
