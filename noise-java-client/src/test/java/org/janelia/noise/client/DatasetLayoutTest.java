package org.janelia.noise.client;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

import org.janelia.noise.model.NoiseType;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link DatasetLayout} class.
 */
public class DatasetLayoutTest {

    @Test
    public void testNoisyImagePath() {
        final DatasetLayout layout = new DatasetLayout(Paths.get("/data/noisy"));

        final Path path = layout.getNoisyImagePath(Paths.get("/data/clean/scene_01.TIF"), NoiseType.SALT_PEPPER, 3);
        Assert.assertEquals("invalid noisy image path",
                            Paths.get("/data/noisy/salt_pepper/scene_01_salt_pepper_level_03.tif"), path);

        final Path levelTenPath = layout.getNoisyImagePath(Paths.get("photo.jpeg"), NoiseType.COMPRESSION, 10);
        Assert.assertEquals("invalid file name", "photo_compression_level_10.jpeg",
                            levelTenPath.getFileName().toString());

        Assert.assertEquals("invalid report path",
                            Paths.get("/data/noisy/noise_metrics.csv"),
                            layout.getReportPath(DatasetLayout.METRICS_CSV_FILE_NAME));
    }

    @Test
    public void testNameParts() {
        Assert.assertEquals("archive.v2", DatasetLayout.getBaseName(Paths.get("/x/archive.v2.png")));
        Assert.assertEquals("png", DatasetLayout.getExtension(Paths.get("/x/archive.v2.PNG")));
        Assert.assertEquals("README", DatasetLayout.getBaseName(Paths.get("README")));
        Assert.assertEquals("", DatasetLayout.getExtension(Paths.get("README")));
        Assert.assertEquals(".hidden", DatasetLayout.getBaseName(Paths.get(".hidden")));
    }

    @Test
    public void testListSourceImages() throws Exception {
        final Path directory = Files.createTempDirectory("dataset_layout_test_");
        try {
            DatasetFixtures.writeSourceImages(directory);

            final List<Path> images = DatasetLayout.listSourceImages(directory);

            Assert.assertEquals("wrong number of images listed", 3, images.size());
            Assert.assertEquals("images should be sorted", "broken.tif", images.get(0).getFileName().toString());
            Assert.assertEquals("images should be sorted", "street.png", images.get(1).getFileName().toString());
            Assert.assertEquals("images should be sorted", "survey.tif", images.get(2).getFileName().toString());
        } finally {
            DatasetFixtures.deleteRecursive(directory);
        }
    }

}
