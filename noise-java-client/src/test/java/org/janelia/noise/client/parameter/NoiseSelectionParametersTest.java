package org.janelia.noise.client.parameter;

import com.beust.jcommander.JCommander;

import java.util.Arrays;
import java.util.List;

import org.janelia.noise.model.NoiseConfiguration;
import org.janelia.noise.model.NoiseType;
import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link NoiseSelectionParameters} class.
 */
public class NoiseSelectionParametersTest {

    @Test
    public void testDefaults() {
        final NoiseSelectionParameters parameters = parse();

        Assert.assertEquals("all types should be selected by default",
                            Arrays.asList(NoiseType.values()), parameters.getNoiseTypes());

        final NoiseConfiguration configuration = parameters.getConfiguration();
        Assert.assertEquals("configured levels should be used by default",
                            NoiseConfiguration.DEFAULT_LEVELS, parameters.getLevels(configuration));
    }

    @Test
    public void testSelection() {
        final NoiseSelectionParameters parameters =
                parse("--noiseType", "COMPRESSION", "gaussian", "--levels", "3");

        final List<NoiseType> types = parameters.getNoiseTypes();
        Assert.assertEquals("types should be in declaration order",
                            Arrays.asList(NoiseType.GAUSSIAN, NoiseType.COMPRESSION), types);
        Assert.assertEquals("explicit levels should be used",
                            3, parameters.getLevels(new NoiseConfiguration()));
    }

    @Test
    public void testInvalidSelection() {
        try {
            parse("--noiseType", "gaussian", "plasma").getNoiseTypes();
            Assert.fail("unknown type should have been rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should include unknown name", e.getMessage().contains("plasma"));
        }

        try {
            parse("--levels", "0").getLevels(new NoiseConfiguration());
            Assert.fail("zero levels should have been rejected");
        } catch (final IllegalArgumentException e) {
            Assert.assertTrue("message should mention levels", e.getMessage().contains("--levels"));
        }
    }

    private static NoiseSelectionParameters parse(final String... args) {
        final NoiseSelectionParameters parameters = new NoiseSelectionParameters();
        new JCommander(parameters).parse(args);
        return parameters;
    }

}
