package io.landdata.command;

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

import io.landdata.command.subcommands.CMD_download_dataset_resource;
import io.landdata.command.subcommands.CMD_download_resources;
import io.landdata.command.subcommands.CMD_download_transformed;
import io.landdata.command.subcommands.CMD_transform_resources;
import picocli.CommandLine;

import java.util.concurrent.Callable;

/// Batch tasks for a collection: download resources and artifacts, and transform resources
///
/// Every subcommand selects the same canonical (dataset, resource) task order, so independent
/// invocations with contiguous `--offset`/`--limit` windows split the work without overlap.
@CommandLine.Command(name = "collection",
    header = "Collection batch tasks",
    mixinStandardHelpOptions = true,
    subcommands = {
        CMD_download_resources.class,
        CMD_download_transformed.class,
        CMD_download_dataset_resource.class,
        CMD_transform_resources.class,
        CommandLine.HelpCommand.class
    })
public class CMD_collection implements Callable<Integer> {

    /// Run a collection command
    /// @param args command line arguments
    public static void main(String[] args) {
        System.exit(commandLine().execute(args));
    }

    /// @return the configured command line, shared by {@link #main(String[])} and tests
    public static CommandLine commandLine() {
        return new CommandLine(new CMD_collection())
            .setCaseInsensitiveEnumValuesAllowed(true);
    }

    @Override
    public Integer call() {
        CommandLine.usage(this, System.out);
        return 0;
    }
}
