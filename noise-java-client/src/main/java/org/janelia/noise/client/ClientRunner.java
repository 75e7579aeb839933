package org.janelia.noise.client;

import org.janelia.noise.util.BatchProgress;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Wraps a batch client so that every run ends with an exit log line and a process exit status.
 * A missing exit line in a batch log means the JVM was killed before the client finished.
 */
public abstract class ClientRunner {

    public static final int SUCCESS_STATUS = 0;
    public static final int FAILURE_STATUS = 1;

    private final Class<?> clientClass;
    private final String[] args;

    /**
     * @param  clientClass  client being wrapped (for log messages).
     * @param  args         command line arguments for client.
     */
    public ClientRunner(final Class<?> clientClass,
                        final String[] args) {
        this.clientClass = clientClass;
        this.args = args;
    }

    /**
     * Runs the client and exits the JVM with the resulting status.
     */
    public void run() {
        System.exit(runWithoutExit());
    }

    /**
     * @return {@link #SUCCESS_STATUS} if the client completed, otherwise {@link #FAILURE_STATUS}.
     */
    public int runWithoutExit() {

        final String clientName = clientClass.getSimpleName();
        final long startMillis = System.currentTimeMillis();

        LOG.info("runWithoutExit: entry, running {}", clientName);

        int status = FAILURE_STATUS;
        try {
            runClient(args);
            status = SUCCESS_STATUS;
        } catch (final InterruptedException e) {
            Thread.currentThread().interrupt();
            LOG.error("runWithoutExit: " + clientName + " was interrupted", e);
        } catch (final Throwable t) {
            LOG.error("runWithoutExit: " + clientName + " failed", t);
        }

        LOG.info("runWithoutExit: exit, {} {} after {}",
                 clientName,
                 status == SUCCESS_STATUS ? "completed" : "failed",
                 BatchProgress.formatDuration(System.currentTimeMillis() - startMillis));

        return status;
    }

    /**
     * Runs the wrapped client.
     *
     * @throws Exception
     *   if the client fails for any reason.
     */
    public abstract void runClient(final String[] args) throws Exception;

    private static final Logger LOG = LoggerFactory.getLogger(ClientRunner.class);
}
