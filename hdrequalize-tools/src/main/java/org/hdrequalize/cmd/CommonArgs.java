package org.hdrequalize.cmd;

import java.io.Serializable;

import com.beust.jcommander.Parameter;

/**
 * Options shared by all commands.
 */
class CommonArgs implements Serializable {
    @Parameter(names = {"--config"}, description = "Properties file that overrides the default settings")
    String configFileName;

    @Parameter(names = {"--task-concurrency"}, description = "Number of worker threads; if not set one less than the available processors")
    int taskConcurrency = 0;

    @Parameter(names = {"-h", "--help"}, description = "Display the help message", help = true, arity = 0)
    boolean displayHelpMessage = false;
}
