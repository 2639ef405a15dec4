package io.landdata.command.common;

/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

import io.landdata.collection.tasks.CollectionConfigurationException;
import io.landdata.collection.tasks.TaskRangeException;
import io.landdata.collection.tasks.collection.CsvResourceCollection;
import io.landdata.collection.tasks.fetch.ConcurrentFetcher;
import io.landdata.collection.tasks.fetch.FetchFailedException;
import io.landdata.collection.transport.FetchTransports;
import io.landdata.collection.transport.ObjectStorageClients;
import io.landdata.status.ProgressReporter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import picocli.CommandLine;

import java.nio.file.Path;
import java.util.concurrent.Callable;

/**
 * Common lifecycle of the collection subcommands: log level, progress reporter, the collection
 * directory, and mapping of failures to exit codes.
 */
public abstract class CollectionCommand implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CollectionCommand.class);

    @CommandLine.Option(names = {"--collection-dir"}, required = true,
        description = "Path to the collection directory")
    protected Path collectionDir;

    @CommandLine.Mixin
    protected final VerbosityOption verbosity = new VerbosityOption();

    @CommandLine.Mixin
    protected final ConsoleProgressOption progress = new ConsoleProgressOption();

    @Override
    public Integer call() {
        verbosity.apply();
        try (ConsoleProgressOption.Scope scope = progress.scopedProperty();
             ProgressReporter reporter = progress.reporter()) {
            return execute(CsvResourceCollection.load(collectionDir), reporter);
        } catch (CollectionConfigurationException | TaskRangeException e) {
            logger.error(e.getMessage());
            System.err.println("\nError: " + e.getMessage());
            return 1;
        } catch (FetchFailedException e) {
            System.err.println("\nError: " + e.getFailedUrls().size() + " of " + e.getAttempted()
                + " downloads failed");
            return 1;
        }
    }

    /**
     * @param collection the loaded collection
     * @param reporter the progress reporter for this run
     * @return the exit code
     */
    protected abstract int execute(CsvResourceCollection collection, ProgressReporter reporter);

    /**
     * @return a fetcher with the standard transports; the object storage client is built on first use
     */
    protected static ConcurrentFetcher newFetcher(ProgressReporter reporter) {
        return new ConcurrentFetcher(FetchTransports.standard(ObjectStorageClients::fromEnvironment), reporter);
    }
}
