package com.phillippitts.speakstream.testutil;

import java.util.concurrent.Executor;

/**
 * Runs tasks immediately on the calling thread so session tests are deterministic.
 */
public class SyncExecutor implements Executor {
    @Override
    public void execute(Runnable command) {
        command.run();
    }
}
