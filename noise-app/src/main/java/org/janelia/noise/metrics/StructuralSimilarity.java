package org.janelia.noise.metrics;

import ij.process.FloatProcessor;
import ij.process.ImageProcessor;

/**
 * Mean structural similarity (Wang, Bovik, Sheikh and Simoncelli) of two single band images.
 *
 * Samples are divided by the data range before comparison, so the stabilizing constants are
 * C1 = K1^2 and C2 = K2^2.  Local statistics come from a uniform square window (7 x 7 unless the
 * image is smaller) evaluated at every position where the window fits completely inside the image,
 * with sample (N - 1) normalization for variances and covariance.  The result is the mean of the
 * local SSIM values.
 */
public class StructuralSimilarity {

    public static final int DEFAULT_WINDOW_SIZE = 7;
    public static final double K1 = 0.01;
    public static final double K2 = 0.03;

    private static final double C1 = K1 * K1;
    private static final double C2 = K2 * K2;

    private final int windowSize;

    public StructuralSimilarity() {
        this(DEFAULT_WINDOW_SIZE);
    }

    public StructuralSimilarity(final int windowSize) {
        if (windowSize < 1) {
            throw new IllegalArgumentException("window size must be at least 1");
        }
        this.windowSize = windowSize;
    }

    /**
     * @param  reference  reference band.
     * @param  distorted  distorted band (must have the same size as the reference).
     * @param  dataRange  range of legal sample values (e.g. 255 for 8-bit data).
     *
     * @return mean SSIM of the two bands.
     */
    public double calculate(final ImageProcessor reference,
                            final ImageProcessor distorted,
                            final double dataRange) {

        final int width = reference.getWidth();
        final int height = reference.getHeight();
        if ((distorted.getWidth() != width) || (distorted.getHeight() != height)) {
            throw new IllegalArgumentException("reference is " + width + "x" + height + " but distorted is " +
                                               distorted.getWidth() + "x" + distorted.getHeight());
        }

        final int window = Math.min(windowSize, Math.min(width, height));
        final double n = window * window;
        final double covarianceNormalization = (window * window > 1) ? n / (n - 1) : 1.0;

        final SummedAreaTables tables = new SummedAreaTables(reference, distorted, dataRange);

        double totalSsim = 0.0;
        long windowCount = 0;
        for (int y = 0; y + window <= height; y++) {
            for (int x = 0; x + window <= width; x++) {

                final double meanX = tables.sum(tables.x, x, y, window) / n;
                final double meanY = tables.sum(tables.y, x, y, window) / n;

                final double varianceX = covarianceNormalization * (tables.sum(tables.xx, x, y, window) / n - meanX * meanX);
                final double varianceY = covarianceNormalization * (tables.sum(tables.yy, x, y, window) / n - meanY * meanY);
                final double covariance = covarianceNormalization * (tables.sum(tables.xy, x, y, window) / n - meanX * meanY);

                final double numerator = (2 * meanX * meanY + C1) * (2 * covariance + C2);
                final double denominator = (meanX * meanX + meanY * meanY + C1) * (varianceX + varianceY + C2);

                totalSsim += numerator / denominator;
                windowCount++;
            }
        }

        return windowCount == 0 ? 1.0 : totalSsim / windowCount;
    }

    /**
     * @return copy of the specified band reduced with area averaging so that its longest side is
     *         the specified maximum (or an unmodified float copy if it is already small enough).
     */
    public static FloatProcessor downsample(final ImageProcessor band,
                                            final int maxDimension) {
        final FloatProcessor fp = (band instanceof FloatProcessor) ?
                                  (FloatProcessor) band.duplicate() : band.convertToFloatProcessor();
        final int longestSide = Math.max(band.getWidth(), band.getHeight());
        if (longestSide <= maxDimension) {
            return fp;
        }
        final double factor = (double) maxDimension / longestSide;
        final int width = Math.max(1, (int) Math.round(band.getWidth() * factor));
        final int height = Math.max(1, (int) Math.round(band.getHeight() * factor));
        fp.setInterpolationMethod(ImageProcessor.BILINEAR);
        return (FloatProcessor) fp.resize(width, height, true);
    }

    /**
     * Integral images of x, y, x^2, y^2 and xy with one row and column of zero padding.
     */
    private static class SummedAreaTables {

        private final int stride;
        private final double[] x;
        private final double[] y;
        private final double[] xx;
        private final double[] yy;
        private final double[] xy;

        SummedAreaTables(final ImageProcessor reference,
                         final ImageProcessor distorted,
                         final double dataRange) {

            final int width = reference.getWidth();
            final int height = reference.getHeight();
            this.stride = width + 1;
            final int size = stride * (height + 1);
            this.x = new double[size];
            this.y = new double[size];
            this.xx = new double[size];
            this.yy = new double[size];
            this.xy = new double[size];

            for (int row = 0; row < height; row++) {
                double rowX = 0;
                double rowY = 0;
                double rowXX = 0;
                double rowYY = 0;
                double rowXY = 0;
                for (int column = 0; column < width; column++) {
                    final double a = reference.getf(column, row) / dataRange;
                    final double b = distorted.getf(column, row) / dataRange;
                    rowX += a;
                    rowY += b;
                    rowXX += a * a;
                    rowYY += b * b;
                    rowXY += a * b;
                    final int index = (row + 1) * stride + column + 1;
                    final int above = index - stride;
                    x[index] = x[above] + rowX;
                    y[index] = y[above] + rowY;
                    xx[index] = xx[above] + rowXX;
                    yy[index] = yy[above] + rowYY;
                    xy[index] = xy[above] + rowXY;
                }
            }
        }

        double sum(final double[] table,
                   final int left,
                   final int top,
                   final int window) {
            final int topLeft = top * stride + left;
            final int bottomLeft = (top + window) * stride + left;
            return table[bottomLeft + window] - table[bottomLeft] - table[topLeft + window] + table[topLeft];
        }
    }

}
