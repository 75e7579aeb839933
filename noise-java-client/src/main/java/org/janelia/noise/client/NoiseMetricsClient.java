package org.janelia.noise.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;
import com.fasterxml.jackson.core.type.TypeReference;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.noise.client.parameter.CommandLineParameters;
import org.janelia.noise.client.parameter.NoiseSelectionParameters;
import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.io.CanonicalImageIO;
import org.janelia.noise.json.JsonUtils;
import org.janelia.noise.metrics.BandMetrics;
import org.janelia.noise.metrics.MetricsRecord;
import org.janelia.noise.metrics.QualityMetricsEngine;
import org.janelia.noise.model.NoiseConfiguration;
import org.janelia.noise.model.NoiseType;
import org.janelia.noise.util.BatchProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for measuring how much each noise variant of a generated dataset differs from
 * its clean original.
 *
 * Variants are located with the {@link DatasetLayout} naming convention.  Missing variants are
 * skipped and unreadable or mismatched ones are logged and counted without stopping the batch.
 */
public class NoiseMetricsClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--originalDirectory",
                description = "Directory containing the clean source images",
                required = true)
        public String originalDirectory;

        @Parameter(
                names = "--noisyDirectory",
                description = "Output directory of a dataset generation run",
                required = true)
        public String noisyDirectory;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for metrics files (default is the noisy directory)")
        public String outputDirectory;

        @ParametersDelegate
        public NoiseSelectionParameters noise = new NoiseSelectionParameters();

        @Parameter(
                names = "--ssimMaxDimension",
                description = "Bands with a longer side are downsampled to this size before SSIM is computed")
        public Integer ssimMaxDimension = QualityMetricsEngine.DEFAULT_SSIM_MAX_DIMENSION;

        @Parameter(
                names = "--numberOfThreads",
                description = "Number of threads used to compare variants of each image")
        public Integer numberOfThreads = 1;

        @Override
        protected void validate() throws IllegalArgumentException {
            if (numberOfThreads < 1) {
                throw new IllegalArgumentException("--numberOfThreads must be at least 1");
            }
            if (ssimMaxDimension < 1) {
                throw new IllegalArgumentException("--ssimMaxDimension must be at least 1");
            }
            noise.getNoiseTypes();
        }

        public Path getOutputDirectory() {
            final String directory = outputDirectory == null ? noisyDirectory : outputDirectory;
            return Paths.get(directory).toAbsolutePath();
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(NoiseMetricsClient.class, args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final NoiseMetricsClient client = new NoiseMetricsClient(parameters);
                client.analyzeDataset();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final QualityMetricsEngine engine;
    private final CanonicalImageIO imageIO;
    private final DatasetLayout noisyLayout;
    private final List<NoiseType> noiseTypes;
    private final int levels;

    private int failureCount;

    public NoiseMetricsClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.parameters = parameters;
        final NoiseConfiguration configuration = parameters.noise.getConfiguration();
        this.engine = new QualityMetricsEngine(parameters.ssimMaxDimension);
        this.imageIO = new CanonicalImageIO();
        this.noisyLayout = new DatasetLayout(Paths.get(parameters.noisyDirectory).toAbsolutePath());
        this.noiseTypes = parameters.noise.getNoiseTypes();
        this.levels = parameters.noise.getLevels(configuration);
        this.failureCount = 0;
    }

    /**
     * Compares every available variant with its original and writes raw, CSV and summary metrics.
     *
     * @return all collected records ordered by image, noise type and level.
     *
     * @throws IOException
     *   if the original directory cannot be listed or a metrics file cannot be written.
     *
     * @throws InterruptedException
     *   if the batch is interrupted (checked between images).
     *
     * @throws ExecutionException
     *   if a worker fails with an error that is not tied to a single variant.
     */
    public List<MetricsRecord> analyzeDataset()
            throws IOException, InterruptedException, ExecutionException {

        final Path originalDirectory = Paths.get(parameters.originalDirectory).toAbsolutePath();
        final List<Path> originalImages = DatasetLayout.listSourceImages(originalDirectory);

        LOG.info("analyzeDataset: entry, found {} originals in {}, checking {} levels for {}",
                 originalImages.size(), originalDirectory, levels, noiseTypes);

        final List<MetricsRecord> records = new ArrayList<>();
        final BatchProgress progress = new BatchProgress("originals", originalImages.size());

        final ExecutorService executorService = Executors.newFixedThreadPool(Math.max(1, parameters.numberOfThreads));
        try {
            for (final Path originalImage : originalImages) {

                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("analyzeDataset: interrupted after " + progress);
                }

                records.addAll(analyzeVariants(originalImage, executorService));

                if (progress.completeUnit()) {
                    LOG.info("analyzeDataset: processed {}, {} records, {} failures",
                             progress, records.size(), getFailureCount());
                }
            }
        } finally {
            executorService.shutdownNow();
        }

        final DatasetLayout outputLayout = new DatasetLayout(parameters.getOutputDirectory());

        final Path rawPath = outputLayout.getReportPath(DatasetLayout.RAW_METRICS_FILE_NAME);
        JsonUtils.writeJsonFile(records, rawPath);

        final Path csvPath = outputLayout.getReportPath(DatasetLayout.METRICS_CSV_FILE_NAME);
        writeCsv(records, csvPath);

        final Path summaryPath = outputLayout.getReportPath(DatasetLayout.METRICS_SUMMARY_FILE_NAME);
        final MetricsSummary summary = new MetricsSummary(records);
        summary.writeJson(summaryPath);

        LOG.info("analyzeDataset: exit, collected {} records with {} failures in {}, psnrRanking={}, wrote {}",
                 records.size(), getFailureCount(), progress.getElapsedTime(), summary.getPsnrRanking(),
                 outputLayout.getOutputDirectory());

        return records;
    }

    public synchronized int getFailureCount() {
        return failureCount;
    }

    /**
     * Writes one row per record with aggregate metrics followed by PSNR and SSIM columns
     * for every band (up to the largest band count among the records).
     */
    public static void writeCsv(final List<MetricsRecord> records,
                                final Path path)
            throws IOException {

        int maxBandCount = 0;
        for (final MetricsRecord record : records) {
            maxBandCount = Math.max(maxBandCount, record.getBands().size());
        }

        final StringBuilder header = new StringBuilder(
                "image_id,noise_type,level,bands,height,width,data_type,psnr,ssim,mse,snr,identical,quality_tier");
        for (int b = 0; b < maxBandCount; b++) {
            header.append(",band_").append(b).append("_psnr");
            header.append(",band_").append(b).append("_ssim");
        }

        final List<String> lines = new ArrayList<>(records.size() + 1);
        lines.add(header.toString());
        for (final MetricsRecord record : records) {
            final StringBuilder line = new StringBuilder();
            line.append(record.getImageId()).append(',');
            line.append(record.getNoiseType()).append(',');
            line.append(record.getLevel()).append(',');
            line.append(record.getBandCount()).append(',');
            line.append(record.getHeight()).append(',');
            line.append(record.getWidth()).append(',');
            line.append(record.getDataType()).append(',');
            line.append(formatValue(record.getPsnr())).append(',');
            line.append(formatValue(record.getSsim())).append(',');
            line.append(formatValue(record.getMse())).append(',');
            line.append(formatValue(record.getSnr())).append(',');
            line.append(record.isIdentical()).append(',');
            line.append(record.getQualityTier().getName());
            final List<BandMetrics> bands = record.getBands();
            for (int b = 0; b < maxBandCount; b++) {
                if (b < bands.size()) {
                    line.append(',').append(formatValue(bands.get(b).getPsnr()));
                    line.append(',').append(formatValue(bands.get(b).getSsim()));
                } else {
                    line.append(",,");
                }
            }
            lines.add(line.toString());
        }

        final Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.write(path, lines, StandardCharsets.UTF_8);

        LOG.info("writeCsv: wrote {} rows to {}", records.size(), path);
    }

    /**
     * @return records previously written by {@link #analyzeDataset()}.
     */
    public static List<MetricsRecord> readRawMetrics(final Path path)
            throws IOException, IllegalArgumentException {
        return RECORD_LIST_HELPER.readJsonFile(path);
    }

    private List<MetricsRecord> analyzeVariants(final Path originalImage,
                                                final ExecutorService executorService)
            throws InterruptedException, ExecutionException {

        final CanonicalImage original;
        try {
            original = imageIO.load(originalImage).getImage();
        } catch (final IOException | IllegalArgumentException e) {
            LOG.warn("analyzeVariants: failed to load " + originalImage + ", skipping it", e);
            recordFailure();
            return Collections.emptyList();
        }

        final String imageId = DatasetLayout.getBaseName(originalImage);
        final List<Future<MetricsRecord>> futures = new ArrayList<>();
        for (final NoiseType type : noiseTypes) {
            for (int level = 1; level <= levels; level++) {
                final Path noisyImage = noisyLayout.getNoisyImagePath(originalImage, type, level);
                if (Files.exists(noisyImage)) {
                    final int variantLevel = level;
                    futures.add(executorService.submit(
                            () -> analyzeVariant(imageId, original, type, variantLevel, noisyImage)));
                } else {
                    LOG.debug("analyzeVariants: skipping missing variant {}", noisyImage);
                }
            }
        }

        final List<MetricsRecord> records = new ArrayList<>(futures.size());
        for (final Future<MetricsRecord> future : futures) {
            final MetricsRecord record = future.get();
            if (record != null) {
                records.add(record);
            }
        }

        LOG.info("analyzeVariants: collected {} records for {}", records.size(), originalImage);

        return records;
    }

    private MetricsRecord analyzeVariant(final String imageId,
                                         final CanonicalImage original,
                                         final NoiseType type,
                                         final int level,
                                         final Path noisyImage) {
        MetricsRecord record = null;
        try {
            final CanonicalImage noisy = imageIO.load(noisyImage).getImage();
            record = engine.compare(imageId, type.getName(), level, original, noisy);
        } catch (final IOException | RuntimeException e) {
            LOG.warn("analyzeVariant: failed to compare " + noisyImage + " with original " + imageId, e);
            recordFailure();
        }
        return record;
    }

    private synchronized void recordFailure() {
        failureCount++;
    }

    private static String formatValue(final double value) {
        final String formattedValue;
        if (Double.isNaN(value)) {
            formattedValue = "NaN";
        } else if (Double.isInfinite(value)) {
            formattedValue = value > 0 ? "inf" : "-inf";
        } else {
            formattedValue = String.format(Locale.US, "%.6f", value);
        }
        return formattedValue;
    }

    private static final JsonUtils.Helper<List<MetricsRecord>> RECORD_LIST_HELPER =
            new JsonUtils.Helper<>(new TypeReference<List<MetricsRecord>>() {});

    private static final Logger LOG = LoggerFactory.getLogger(NoiseMetricsClient.class);
}
