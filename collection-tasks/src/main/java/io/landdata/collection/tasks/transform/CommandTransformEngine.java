package io.landdata.collection.tasks.transform;

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

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InterruptedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Runs an external pipeline command as a child process, one process per request.
 * <p>
 * The command is followed by the request's arguments:
 * <pre>
 *   --dataset D --input-path IN --output-path OUT --collection-dir C --pipeline-dir P
 *   --specification-dir S --cache-dir CACHE --issue-dir I --operational-issue-dir OI
 *   --column-field-dir CF --dataset-resource-dir DR --converted-resource-dir CR
 *   --output-log-dir L --organisation-path ORG --config-path CFG [--endpoint E]...
 *   [--organisation O]... [--entry-date DATE] [--resource REQUESTED]
 * </pre>
 * Standard output and error go to {@code <outputLogDir>/<dataset>/<resource>.log}. A non-zero
 * exit status fails the request.
 */
public class CommandTransformEngine implements TransformEngine {
    private static final Logger logger = LogManager.getLogger(CommandTransformEngine.class);

    private final List<String> command;
    private final String codeVersion;

    /**
     * @param command the executable and any leading arguments
     * @param codeVersion the engine version recorded in fingerprints
     */
    public CommandTransformEngine(List<String> command, String codeVersion) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("A transform command is required");
        }
        this.command = List.copyOf(command);
        this.codeVersion = Objects.requireNonNull(codeVersion, "codeVersion");
    }

    @Override
    public String codeVersion() {
        return codeVersion;
    }

    @Override
    public void transform(TransformRequest request) throws IOException {
        TransformDirectories dirs = request.directories();
        String dataset = request.dataset();
        for (Path dir : List.of(dirs.transformedDir(dataset), dirs.issueDir(dataset), dirs.operationalIssueDir(),
            dirs.outputLogDir(), dirs.columnFieldDir(dataset), dirs.datasetResourceDir(dataset),
            dirs.convertedResourceDir(dataset))) {
            Files.createDirectories(dir);
        }
        Path logFile = logFile(request);
        Files.createDirectories(logFile.getParent());

        List<String> args = arguments(request);
        logger.debug("Running {}", args);
        Process process = new ProcessBuilder(args)
            .redirectErrorStream(true)
            .redirectOutput(logFile.toFile())
            .start();
        process.getOutputStream().close();
        int exit;
        try {
            exit = process.waitFor();
        } catch (InterruptedException e) {
            process.destroyForcibly();
            Thread.currentThread().interrupt();
            InterruptedIOException interrupted =
                new InterruptedIOException("Interrupted while transforming " + request.task().id());
            interrupted.initCause(e);
            throw interrupted;
        }
        if (exit != 0) {
            throw new IOException("Transform of " + request.task().id() + " exited with status " + exit
                + ", see " + logFile);
        }
    }

    /**
     * @return where the child's output for a request is written
     */
    public static Path logFile(TransformRequest request) {
        return request.directories().outputLogDir().resolve(request.dataset())
            .resolve(request.requestedResource() + ".log");
    }

    List<String> arguments(TransformRequest request) {
        TransformDirectories dirs = request.directories();
        String dataset = request.dataset();
        List<String> args = new ArrayList<>(command);
        add(args, "--dataset", dataset);
        add(args, "--input-path", request.inputPath());
        add(args, "--output-path", request.outputPath());
        add(args, "--collection-dir", dirs.collectionDir());
        add(args, "--pipeline-dir", dirs.pipelineDir());
        add(args, "--specification-dir", dirs.specificationDir());
        add(args, "--cache-dir", dirs.cacheDir());
        add(args, "--issue-dir", dirs.issueDir(dataset));
        add(args, "--operational-issue-dir", dirs.operationalIssueDir());
        add(args, "--column-field-dir", dirs.columnFieldDir(dataset));
        add(args, "--dataset-resource-dir", dirs.datasetResourceDir(dataset));
        add(args, "--converted-resource-dir", dirs.convertedResourceDir(dataset));
        add(args, "--output-log-dir", dirs.outputLogDir());
        add(args, "--organisation-path", dirs.organisationPath());
        add(args, "--config-path", dirs.configPath());
        for (String endpoint : request.endpoints()) {
            add(args, "--endpoint", endpoint);
        }
        for (String organisation : request.organisations()) {
            add(args, "--organisation", organisation);
        }
        if (!request.entryDate().isEmpty()) {
            add(args, "--entry-date", request.entryDate());
        }
        request.resourceOverride().ifPresent(r -> add(args, "--resource", r));
        return args;
    }

    private static void add(List<String> args, String flag, Object value) {
        args.add(flag);
        args.add(String.valueOf(value));
    }
}
