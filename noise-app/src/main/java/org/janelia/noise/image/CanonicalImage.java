package org.janelia.noise.image;

import ij.ImageStack;
import ij.process.ImageProcessor;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Multiband image held in band-first (bands, height, width) order.
 *
 * Every band is a separate ImageJ {@link ImageProcessor}, so the band axis is always the outermost axis
 * no matter how the source file stored its samples.  All bands share width, height and {@link DataType}.
 *
 * Instances are treated as values: code that derives a new image from an existing one must work on
 * copies of the band processors (see {@link #getBandCopy}) and never modify the processors returned by
 * {@link #getBand}.
 */
public class CanonicalImage {

    private final DataType dataType;
    private final int width;
    private final int height;
    private final List<ImageProcessor> bands;

    /**
     * @param  bands  band processors in band order (at least one, all with the same size and type).
     *
     * @throws IllegalArgumentException
     *   if the bands are missing or inconsistent.
     */
    public CanonicalImage(final List<? extends ImageProcessor> bands)
            throws IllegalArgumentException {

        if ((bands == null) || bands.isEmpty()) {
            throw new IllegalArgumentException("image must have at least one band");
        }

        final ImageProcessor first = bands.get(0);
        this.dataType = DataType.forProcessor(first);
        this.width = first.getWidth();
        this.height = first.getHeight();

        for (int b = 1; b < bands.size(); b++) {
            final ImageProcessor band = bands.get(b);
            if ((band.getWidth() != width) || (band.getHeight() != height)) {
                throw new IllegalArgumentException("band " + b + " is " + band.getWidth() + "x" +
                                                   band.getHeight() + " but band 0 is " + width + "x" + height);
            }
            if (DataType.forProcessor(band) != dataType) {
                throw new IllegalArgumentException("band " + b + " has type " + DataType.forProcessor(band) +
                                                   " but band 0 has type " + dataType);
            }
        }

        this.bands = Collections.unmodifiableList(new ArrayList<>(bands));
    }

    /**
     * Lifts a single 2-D band into a (1, height, width) image.
     */
    public static CanonicalImage fromSingleBand(final ImageProcessor band) {
        return new CanonicalImage(Collections.singletonList(band));
    }

    /**
     * @return image with one band per stack slice.
     */
    public static CanonicalImage fromStack(final ImageStack stack) {
        final List<ImageProcessor> bands = new ArrayList<>(stack.getSize());
        for (int slice = 1; slice <= stack.getSize(); slice++) {
            bands.add(stack.getProcessor(slice));
        }
        return new CanonicalImage(bands);
    }

    public DataType getDataType() {
        return dataType;
    }

    public int getBandCount() {
        return bands.size();
    }

    public int getHeight() {
        return height;
    }

    public int getWidth() {
        return width;
    }

    public int getPixelsPerBand() {
        return width * height;
    }

    public long getSampleCount() {
        return (long) bands.size() * width * height;
    }

    /**
     * @return the processor backing the specified band (must not be modified).
     */
    public ImageProcessor getBand(final int band) {
        return bands.get(band);
    }

    /**
     * @return independent copy of the specified band's processor.
     */
    public ImageProcessor getBandCopy(final int band) {
        return bands.get(band).duplicate();
    }

    /**
     * @return copy of the specified band's samples as floats (integral samples are converted unsigned).
     */
    public float[] getBandValues(final int band) {
        final ImageProcessor ip = bands.get(band);
        final int n = getPixelsPerBand();
        final float[] values = new float[n];
        for (int i = 0; i < n; i++) {
            values[i] = ip.getf(i);
        }
        return values;
    }

    /**
     * @return sample value at the specified location.
     */
    public double getValue(final int band,
                           final int x,
                           final int y) {
        return bands.get(band).getf(x, y);
    }

    /**
     * @return image with independent copies of all bands.
     */
    public CanonicalImage duplicate() {
        final List<ImageProcessor> copies = new ArrayList<>(bands.size());
        for (final ImageProcessor band : bands) {
            copies.add(band.duplicate());
        }
        return new CanonicalImage(copies);
    }

    /**
     * @return new image of the same size and type built from per-band values
     *         (values are clipped to this image's legal range).
     */
    public CanonicalImage withBandValues(final List<float[]> bandValues) {
        final List<ImageProcessor> newBands = new ArrayList<>(bandValues.size());
        for (final float[] values : bandValues) {
            newBands.add(dataType.createProcessor(width, height, values));
        }
        return new CanonicalImage(newBands);
    }

    public boolean hasSameShape(final CanonicalImage that) {
        return (that != null) &&
               (bands.size() == that.bands.size()) &&
               (height == that.height) &&
               (width == that.width);
    }

    /**
     * @return shape formatted as "(bands, height, width)".
     */
    public String getShapeString() {
        return "(" + bands.size() + ", " + height + ", " + width + ")";
    }

    @Override
    public String toString() {
        return "CanonicalImage{shape=" + getShapeString() + ", dataType=" + dataType + '}';
    }

}
