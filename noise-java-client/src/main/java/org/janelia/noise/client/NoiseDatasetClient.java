package org.janelia.noise.client;

import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParametersDelegate;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.janelia.noise.client.parameter.CommandLineParameters;
import org.janelia.noise.client.parameter.NoiseSelectionParameters;
import org.janelia.noise.image.CanonicalImage;
import org.janelia.noise.image.LoadedImage;
import org.janelia.noise.image.MetadataEnvelope;
import org.janelia.noise.io.CanonicalImageIO;
import org.janelia.noise.io.StandardImageCodec;
import org.janelia.noise.model.NoiseConfiguration;
import org.janelia.noise.model.NoiseSynthesizer;
import org.janelia.noise.model.NoiseType;
import org.janelia.noise.model.RandomStreams;
import org.janelia.noise.util.BatchProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Java client for generating a labelled noise dataset: every source image in a directory is
 * degraded with each selected noise type at every level and the results are written next to a
 * processing report.
 *
 * A failure for one image, type or level is logged and counted but never stops the batch.
 */
public class NoiseDatasetClient {

    public static class Parameters extends CommandLineParameters {

        @Parameter(
                names = "--inputDirectory",
                description = "Directory containing source images (tif, tiff, png, jpg, jpeg)",
                required = true)
        public String inputDirectory;

        @Parameter(
                names = "--outputDirectory",
                description = "Directory for generated images and the processing report",
                required = true)
        public String outputDirectory;

        @ParametersDelegate
        public NoiseSelectionParameters noise = new NoiseSelectionParameters();

        @Parameter(
                names = "--seed",
                description = "Base seed from which the seed for every image, type and level is derived")
        public Long seed = 42L;

        @Parameter(
                names = "--numberOfThreads",
                description = "Number of threads used to generate variants of each image")
        public Integer numberOfThreads = 1;

        @Parameter(
                names = "--uncompressedTiff",
                description = "Write TIFF output without LZW compression",
                arity = 0)
        public boolean uncompressedTiff = false;

        @Parameter(
                names = "--jpegQuality",
                description = "Quality (0 to 1) for JPEG output")
        public Float jpegQuality = StandardImageCodec.DEFAULT_JPEG_QUALITY;

        @Override
        protected void validate() throws IllegalArgumentException {
            if (numberOfThreads < 1) {
                throw new IllegalArgumentException("--numberOfThreads must be at least 1");
            }
            if ((jpegQuality < 0.0f) || (jpegQuality > 1.0f)) {
                throw new IllegalArgumentException("--jpegQuality must be between 0 and 1");
            }
            noise.getNoiseTypes();
        }
    }

    public static void main(final String[] args) {
        final ClientRunner clientRunner = new ClientRunner(NoiseDatasetClient.class, args) {
            @Override
            public void runClient(final String[] args) throws Exception {

                final Parameters parameters = new Parameters();
                parameters.parse(args);

                LOG.info("runClient: entry, parameters={}", parameters);

                final NoiseDatasetClient client = new NoiseDatasetClient(parameters);
                client.generateDataset();
            }
        };
        clientRunner.run();
    }

    private final Parameters parameters;
    private final NoiseConfiguration configuration;
    private final NoiseSynthesizer synthesizer;
    private final CanonicalImageIO imageIO;
    private final DatasetLayout layout;
    private final List<NoiseType> noiseTypes;
    private final int levels;

    public NoiseDatasetClient(final Parameters parameters)
            throws IllegalArgumentException {
        this.parameters = parameters;
        this.configuration = parameters.noise.getConfiguration();
        this.synthesizer = new NoiseSynthesizer(configuration);
        this.imageIO = new CanonicalImageIO(! parameters.uncompressedTiff, parameters.jpegQuality);
        this.layout = new DatasetLayout(Paths.get(parameters.outputDirectory).toAbsolutePath());
        this.noiseTypes = parameters.noise.getNoiseTypes();
        this.levels = parameters.noise.getLevels(configuration);
    }

    /**
     * Generates all variants and writes the processing report.
     *
     * @return the processing report.
     *
     * @throws IOException
     *   if the input directory cannot be listed or the report cannot be written.
     *
     * @throws InterruptedException
     *   if the batch is interrupted (checked between images).
     *
     * @throws ExecutionException
     *   if a worker fails with an error that is not tied to a single variant.
     */
    public ProcessingReport generateDataset()
            throws IOException, InterruptedException, ExecutionException {

        final Path inputDirectory = Paths.get(parameters.inputDirectory).toAbsolutePath();
        final List<Path> sourceImages = DatasetLayout.listSourceImages(inputDirectory);

        LOG.info("generateDataset: entry, found {} images in {}, generating {} levels for {}",
                 sourceImages.size(), inputDirectory, levels, noiseTypes);

        final ProcessingReport report = new ProcessingReport(sourceImages.size(), noiseTypes, levels, configuration);
        final BatchProgress progress = new BatchProgress("images", sourceImages.size());

        final ExecutorService executorService = Executors.newFixedThreadPool(Math.max(1, parameters.numberOfThreads));
        try {
            for (final Path sourceImage : sourceImages) {

                if (Thread.currentThread().isInterrupted()) {
                    throw new InterruptedException("generateDataset: interrupted after " + progress);
                }

                generateVariants(sourceImage, report, executorService);

                if (progress.completeUnit()) {
                    LOG.info("generateDataset: processed {}, {} variants written, {} failures",
                             progress, report.getTotalProcessed(), report.getTotalFailed());
                }
            }
        } finally {
            executorService.shutdownNow();
        }

        final Path reportPath = layout.getReportPath(DatasetLayout.PROCESSING_REPORT_FILE_NAME);
        report.writeJson(reportPath);

        LOG.info("generateDataset: exit, wrote {} variants with {} failures ({} success rate) in {}, report is {}",
                 report.getTotalProcessed(), report.getTotalFailed(), report.getSuccessRate(),
                 progress.getElapsedTime(), reportPath);

        return report;
    }

    private void generateVariants(final Path sourceImage,
                                  final ProcessingReport report,
                                  final ExecutorService executorService)
            throws InterruptedException, ExecutionException {

        final LoadedImage loadedImage;
        try {
            loadedImage = imageIO.load(sourceImage);
        } catch (final IOException | IllegalArgumentException e) {
            LOG.warn("generateVariants: failed to load " + sourceImage + ", skipping it", e);
            report.recordImageFailure();
            return;
        }

        LOG.info("generateVariants: loaded {} from {}", loadedImage.getImage(), sourceImage);

        final String baseName = DatasetLayout.getBaseName(sourceImage);
        final List<Future<?>> futures = new ArrayList<>();
        for (final NoiseType type : noiseTypes) {
            for (int level = 1; level <= levels; level++) {
                final int variantLevel = level;
                futures.add(executorService.submit(
                        () -> generateVariant(sourceImage, baseName, loadedImage, type, variantLevel, report)));
            }
        }

        for (final Future<?> future : futures) {
            future.get();
        }
    }

    private void generateVariant(final Path sourceImage,
                                 final String baseName,
                                 final LoadedImage loadedImage,
                                 final NoiseType type,
                                 final int level,
                                 final ProcessingReport report) {

        final Path outputPath = layout.getNoisyImagePath(sourceImage, type, level);
        final long seed = RandomStreams.deriveSeed(parameters.seed, baseName, type.getName(), level);
        try {
            final CanonicalImage noisyImage = synthesizer.apply(loadedImage.getImage(), type, level, levels, seed);
            final MetadataEnvelope metadata = loadedImage.getMetadata()
                    .withProperty("noise_type", type.getName())
                    .withProperty("noise_level", String.valueOf(level));
            imageIO.save(noisyImage, metadata, outputPath);
            report.recordSuccess(type);
        } catch (final IOException | RuntimeException e) {
            LOG.warn("generateVariant: failed to apply " + type + " level " + level + " to " + sourceImage, e);
            report.recordFailure(type);
        }
    }

    private static final Logger LOG = LoggerFactory.getLogger(NoiseDatasetClient.class);
}
