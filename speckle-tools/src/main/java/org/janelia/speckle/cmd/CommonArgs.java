package org.janelia.speckle.cmd;

import com.beust.jcommander.Parameter;

/**
 * Arguments shared by all commands.
 */
class CommonArgs {
    @Parameter(names = "--config", description = "Configuration properties file; overrides the default configuration")
    String configFileName;

    @Parameter(names = {"--outputDir", "-od"}, description = "Output directory")
    String outputDir;

    @Parameter(names = "--task-concurrency", description = "Number of concurrent tasks; if not set it uses all but one available processor")
    int taskConcurrency = -1;

    @Parameter(names = "--no-pretty-print", description = "Write JSON output without pretty printing", arity = 0)
    boolean noPrettyPrint = false;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
