package org.janelia.noise.metrics;

import java.io.Serializable;

/**
 * Quality metrics for one band of a compared image pair.
 * PSNR and SNR are positive infinity when the bands are identical.
 */
public class BandMetrics
        implements Serializable {

    private final int band;
    private final double psnr;
    private final double ssim;
    private final double mse;
    private final double snr;

    // no-arg constructor needed for JSON deserialization
    @SuppressWarnings("unused")
    private BandMetrics() {
        this(0, 0, 0, 0, 0);
    }

    public BandMetrics(final int band,
                       final double psnr,
                       final double ssim,
                       final double mse,
                       final double snr) {
        this.band = band;
        this.psnr = psnr;
        this.ssim = ssim;
        this.mse = mse;
        this.snr = snr;
    }

    public int getBand() {
        return band;
    }

    public double getPsnr() {
        return psnr;
    }

    public double getSsim() {
        return ssim;
    }

    public double getMse() {
        return mse;
    }

    public double getSnr() {
        return snr;
    }

    public boolean isIdentical() {
        return mse == 0.0;
    }

    @Override
    public String toString() {
        return "{band: " + band + ", psnr: " + psnr + ", ssim: " + ssim + ", mse: " + mse + ", snr: " + snr + '}';
    }
}
