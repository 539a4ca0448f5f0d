/*
 * Copyright (c) nosqlbench
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package io.phylodist.command.unifrac;

import io.phylodist.command.common.DistanceNormalizationOption;
import io.phylodist.command.common.OutputFileOption;
import io.phylodist.command.common.ParallelExecutionOption;
import io.phylodist.command.common.TableFileOption;
import io.phylodist.command.common.TreeFileOption;
import io.phylodist.command.common.VerbosityOption;
import io.phylodist.core.PhyloDistException;
import io.phylodist.core.table.SampleTable;
import io.phylodist.core.tree.PhyloTree;
import io.phylodist.core.unifrac.UniFracPipeline;
import io.phylodist.core.unifrac.UniFracResult;
import io.phylodist.readers.NewickTreeReader;
import io.phylodist.readers.SampleTableReader;
import io.phylodist.writers.DistanceMatrixWriter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.apache.logging.log4j.core.config.Configurator;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Path;
import java.util.concurrent.Callable;

/// Compute the pairwise unweighted UniFrac distance matrix for all samples of a table
///
/// The tree is flattened into postorder arrays, each sample's taxa are turned into a presence
/// distribution, and every sample pair is compared with a single upward propagation pass over
/// the tree (EMDUniFrac). Pairs are computed in parallel.
///
/// Taxa of the table without a matching tip are ignored and reported as a warning. Cells that
/// are not numbers are read as zero.
@CommandLine.Command(name = "unifrac",
    header = "Fast unweighted UniFrac using EMDUniFrac",
    description = "Compute pairwise unweighted UniFrac distances between all samples of a table",
    exitCodeListHeading = "Exit Codes:%n",
    exitCodeList = {"0:success", "2:error"})
public class CMD_unifrac implements Callable<Integer> {
    private static final Logger logger = LogManager.getLogger(CMD_unifrac.class);

    private static final int EXIT_SUCCESS = 0;
    private static final int EXIT_ERROR = 2;

    @CommandLine.Mixin
    private TreeFileOption treeFileOption = new TreeFileOption();

    @CommandLine.Mixin
    private TableFileOption tableFileOption = new TableFileOption();

    @CommandLine.Mixin
    private OutputFileOption outputFileOption = new OutputFileOption();

    @CommandLine.Mixin
    private ParallelExecutionOption parallelExecutionOption = new ParallelExecutionOption();

    @CommandLine.Mixin
    private DistanceNormalizationOption normalizationOption = new DistanceNormalizationOption();

    @CommandLine.Mixin
    private VerbosityOption verbosityOption = new VerbosityOption();

    @CommandLine.Option(names = {"-h", "--help"}, usageHelp = true, description = "Show this help message and exit")
    private boolean helpRequested;

    @CommandLine.Spec
    private CommandLine.Model.CommandSpec spec;

    /**
     * Validates the input and output paths and the numeric options before execution.
     */
    private void validateOptions() {
        try {
            verbosityOption.validate();
            treeFileOption.validate();
            tableFileOption.validate();
            outputFileOption.validate();
            parallelExecutionOption.validate();
        } catch (IllegalStateException e) {
            throw new CommandLine.ParameterException(spec.commandLine(), "Error: " + e.getMessage());
        }
    }

    @Override
    public Integer call() {
        try {
            validateOptions();
        } catch (CommandLine.ParameterException e) {
            System.err.println(e.getMessage());
            return EXIT_ERROR;
        }
        Configurator.setRootLevel(verbosityOption.getLogLevel());

        Path treePath = treeFileOption.getNormalizedTreePath();
        Path tablePath = tableFileOption.getNormalizedTablePath();
        Path outputPath = outputFileOption.getNormalizedOutputPath();

        int threads = parallelExecutionOption.getOptimalThreadCount();
        if (parallelExecutionOption.exceedsAvailableCores()) {
            logger.warn("Specified thread count ({}) > available cores ({}). This may cause contention.",
                threads, Runtime.getRuntime().availableProcessors());
        }

        try {
            PhyloTree tree = NewickTreeReader.read(treePath);
            SampleTableReader tableReader = new SampleTableReader();
            SampleTable table = tableReader.read(tablePath);
            if (tableReader.malformedCells() > 0) {
                logger.info("{} table values were not numbers and were read as 0", tableReader.malformedCells());
            }

            UniFracResult result = new UniFracPipeline(threads, normalizationOption.getNormalization())
                .run(tree, table);

            new DistanceMatrixWriter(outputPath).write(result.matrix());

            if (verbosityOption.showNormalOutput()) {
                System.out.printf("Wrote %d x %d UniFrac distance matrix to %s%n",
                    result.matrix().size(), result.matrix().size(), outputPath);
                if (result.unmatchedCount() > 0) {
                    System.out.printf("%d taxa were not found in the tree and were ignored%n",
                        result.unmatchedCount());
                }
            }
            return EXIT_SUCCESS;
        } catch (PhyloDistException e) {
            logger.error("UniFrac computation failed: {}", e.getMessage());
            logger.debug("Failure details", e);
            System.err.println("Error: " + e.getMessage());
            return EXIT_ERROR;
        } catch (IOException e) {
            logger.error("Unable to write {}: {}", outputPath, e.getMessage());
            System.err.println("Error: unable to write output file " + outputPath + ": " + e.getMessage());
            return EXIT_ERROR;
        }
    }
}
