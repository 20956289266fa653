/*
 * Copyright Syncbase Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */
package io.syncbase.connector.postgresql;

import java.io.File;
import java.io.IOException;
import java.util.concurrent.CountDownLatch;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.syncbase.SyncbaseException;
import io.syncbase.config.Configuration;
import io.syncbase.engine.ChangeSyncEngine;
import io.syncbase.engine.SyncEngine;
import io.syncbase.sink.LoggingBatchSink;

/**
 * Runs a {@link ChangeSyncEngine} against PostgreSQL until the process is asked to terminate, logging every delivered
 * batch. The only argument is the path of a properties file holding the {@link PostgresConnectorConfig} settings.
 *
 * @author Syncbase Authors
 */
public class PostgresSyncMain implements Runnable {

    private static final Logger LOGGER = LoggerFactory.getLogger(PostgresSyncMain.class);

    private final PostgresConnectorConfig config;
    private final CountDownLatch terminated = new CountDownLatch(1);

    public PostgresSyncMain(Configuration config) {
        this.config = new PostgresConnectorConfig(config);
    }

    @Override
    public void run() {
        final SyncEngine engine = ChangeSyncEngine.create()
                .using(config.getConfig())
                .using(config.createQueryPool())
                .using(new PostgresNotificationTransport(config))
                .notifying(new LoggingBatchSink(config.getKeyColumn()))
                .build();

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            LOGGER.info("Shutdown requested");
            try {
                engine.stop();
            }
            catch (SyncbaseException e) {
                LOGGER.error("Engine did not stop cleanly", e);
            }
            finally {
                terminated.countDown();
            }
            LOGGER.info("Shutdown hook completed");
        }));

        engine.start();
        try {
            terminated.await();
        }
        catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    public static void main(String[] args) throws IOException {
        if (args.length != 1) {
            System.err.println("Usage: PostgresSyncMain <config.properties>");
            System.exit(1);
        }
        new PostgresSyncMain(Configuration.load(new File(args[0]))).run();
    }
}
