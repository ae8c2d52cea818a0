package kiokundictcli;

import kiokundict.PipelineLogging;
import picocli.CommandLine.Option;

/**
 * {@code -v/--verbose}, shared by every subcommand.
 */
class VerboseOption {

    @Option(names = {"-v", "--verbose"}, description = "Log pipeline progress (INFO level)")
    void setVerbose(boolean verbose) {
        PipelineLogging.setVerboseLogging(verbose);
    }
}
