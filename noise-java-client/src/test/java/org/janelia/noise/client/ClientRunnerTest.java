package org.janelia.noise.client;

import java.io.IOException;

import org.junit.Assert;
import org.junit.Test;

/**
 * Tests the {@link ClientRunner} class.
 */
public class ClientRunnerTest {

    @Test
    public void testStatus() {
        final String[] args = { "--levels", "2" };

        final ClientRunner completing = new ClientRunner(ClientRunnerTest.class, args) {
            @Override
            public void runClient(final String[] args) {
                Assert.assertEquals("arguments should be passed through", "2", args[1]);
            }
        };
        Assert.assertEquals("invalid status for completed client",
                            ClientRunner.SUCCESS_STATUS, completing.runWithoutExit());

        final ClientRunner failing = new ClientRunner(ClientRunnerTest.class, args) {
            @Override
            public void runClient(final String[] args) throws Exception {
                throw new IOException("disk full");
            }
        };
        Assert.assertEquals("invalid status for failed client",
                            ClientRunner.FAILURE_STATUS, failing.runWithoutExit());
    }

    @Test
    public void testInterruptedClient() {
        final ClientRunner interrupted = new ClientRunner(ClientRunnerTest.class, new String[0]) {
            @Override
            public void runClient(final String[] args) throws Exception {
                throw new InterruptedException("stop");
            }
        };
        try {
            Assert.assertEquals("invalid status for interrupted client",
                                ClientRunner.FAILURE_STATUS, interrupted.runWithoutExit());
            Assert.assertTrue("interrupt flag should be restored", Thread.currentThread().isInterrupted());
        } finally {
            // clears the flag for the remaining tests
            Thread.interrupted();
        }
    }

}
