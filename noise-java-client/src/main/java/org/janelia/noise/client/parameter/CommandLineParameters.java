package org.janelia.noise.client.parameter;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.beust.jcommander.Parameters;

import java.io.Serializable;

import org.janelia.noise.json.JsonUtils;

/**
 * Base parameters for the batch clients.
 *
 * Subclasses declare their options with JCommander annotations and override
 * {@link #validate()} for checks that annotations cannot express.
 */
@Parameters
public class CommandLineParameters implements Serializable {

    @Parameter(
            names = "--help",
            description = "Display this note",
            help = true)
    public transient boolean help;

    public CommandLineParameters() {
        this.help = false;
    }

    /**
     * Parses the arguments for the client that encloses this parameters class,
     * printing usage and exiting the JVM if help was requested or the arguments are invalid.
     */
    public void parse(final String[] args) {
        parse(args, getClass().getEnclosingClass(), true);
    }

    /**
     * @param  args                  command line arguments.
     * @param  programClass          client class shown in the usage text.
     * @param  exitOnHelpOrFailure   if true, exit the JVM after printing usage.
     *
     * @return true if the arguments are valid and help was not requested.
     */
    public boolean parse(final String[] args,
                         final Class<?> programClass,
                         final boolean exitOnHelpOrFailure) {

        final String programName = programClass == null ? getClass().getName() : programClass.getName();
        final JCommander jCommander = JCommander.newBuilder()
                .addObject(this)
                .programName("java -cp noise-java-client-standalone.jar " + programName)
                .build();

        String failureMessage = null;
        try {
            jCommander.parse(args);
            if (! help) {
                validate();
            }
        } catch (final ParameterException | IllegalArgumentException e) {
            failureMessage = e.getMessage();
        }

        final boolean isValid = (failureMessage == null) && (! help);
        if (! isValid) {
            final StringBuilder usage = new StringBuilder("\n");
            if (failureMessage != null) {
                usage.append("ERROR: invalid command line arguments\n\n").append(failureMessage).append("\n\n");
            }
            jCommander.getUsageFormatter().usage(usage);
            jCommander.getConsole().println(usage.toString());
            if (exitOnHelpOrFailure) {
                System.exit(1);
            }
        }

        return isValid;
    }

    /**
     * Checks parsed values.
     *
     * @throws IllegalArgumentException
     *   if any value is invalid.
     */
    protected void validate() throws IllegalArgumentException {
    }

    @Override
    public String toString() {
        try {
            return JsonUtils.MAPPER.writeValueAsString(this);
        } catch (final Exception e) {
            return getClass().getName() + " (unprintable: " + e.getMessage() + ")";
        }
    }

    /**
     * Requests help without exiting so that tests can verify parameter annotations.
     */
    public static void parseHelp(final CommandLineParameters parameters) {
        parameters.parse(new String[] { "--help" },
                         parameters.getClass().getEnclosingClass(),
                         false);
    }

}
