package org.janelia.noise.client;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.stream.Stream;

import org.janelia.noise.io.ImageFormat;
import org.janelia.noise.model.NoiseType;

/**
 * Naming conventions for generated datasets:
 * <pre>
 *   [outputDirectory]/[noise_type]/[base]_[noise_type]_level_[NN].[extension]
 * </pre>
 */
public class DatasetLayout {

    public static final String PROCESSING_REPORT_FILE_NAME = "noise_processing_report.json";
    public static final String RAW_METRICS_FILE_NAME = "noise_metrics_raw.json";
    public static final String METRICS_CSV_FILE_NAME = "noise_metrics.csv";
    public static final String METRICS_SUMMARY_FILE_NAME = "noise_metrics_summary.json";

    private final Path outputDirectory;

    public DatasetLayout(final Path outputDirectory) {
        this.outputDirectory = outputDirectory;
    }

    public Path getOutputDirectory() {
        return outputDirectory;
    }

    public Path getNoiseTypeDirectory(final NoiseType type) {
        return outputDirectory.resolve(type.getName());
    }

    /**
     * @return path of the noisy variant of the specified source image.
     */
    public Path getNoisyImagePath(final Path sourceImage,
                                  final NoiseType type,
                                  final int level) {
        final String fileName = String.format("%s_%s_level_%02d.%s",
                                              getBaseName(sourceImage), type.getName(), level,
                                              getExtension(sourceImage));
        return getNoiseTypeDirectory(type).resolve(fileName);
    }

    public Path getReportPath(final String fileName) {
        return outputDirectory.resolve(fileName);
    }

    /**
     * @return sorted list of supported image files directly within the specified directory.
     *
     * @throws IOException
     *   if the directory cannot be listed.
     */
    public static List<Path> listSourceImages(final Path inputDirectory)
            throws IOException {

        final List<Path> images = new ArrayList<>();
        try (final Stream<Path> paths = Files.list(inputDirectory)) {
            paths.filter(Files::isRegularFile)
                 .filter(path -> ImageFormat.forFileName(path.getFileName().toString()) != null)
                 .forEach(images::add);
        }
        Collections.sort(images);
        return images;
    }

    /**
     * @return file name without its extension.
     */
    public static String getBaseName(final Path path) {
        final String fileName = path.getFileName().toString();
        final int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(0, dotIndex) : fileName;
    }

    /**
     * @return lower case extension without the dot (empty if there is none).
     */
    public static String getExtension(final Path path) {
        final String fileName = path.getFileName().toString();
        final int dotIndex = fileName.lastIndexOf('.');
        return dotIndex > 0 ? fileName.substring(dotIndex + 1).toLowerCase(Locale.US) : "";
    }

}
