package kiokundictcli;

import com.fasterxml.jackson.databind.ObjectMapper;
import kiokundict.ArtifactStore;
import kiokundict.BuildConfig;
import kiokundict.DictionaryPipelineException;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.Spec;

import java.io.IOException;
import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "inspect", description = "\033[1;34mPrint the decompressed artifact for a word\033[0m",
        mixinStandardHelpOptions = true)
public class InspectCommand implements Callable<Integer> {
    private static final Logger LOGGER = Logger.getLogger(InspectCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Mixin
    VerboseOption verbose;

    @Mixin
    ConfigOption configOption;

    @Parameters(index = "0", paramLabel = "<word>", description = "Word to look up")
    String word;

    @Option(names = {"-o", "--output-dir"}, paramLabel = "<dir>", description = "Artifact output directory")
    String outputDir;

    @Option(names = {"-p", "--pretty"}, description = "Pretty-print the JSON")
    boolean pretty;

    @Override
    public Integer call() {
        PrintWriter out = spec.commandLine().getOut();
        PrintWriter err = spec.commandLine().getErr();
        try {
            BuildConfig config = configOption.load();
            Path root = outputDir != null ? Paths.get(outputDir) : config.outputDirPath();
            Optional<String> json = new ArtifactStore(root, config.getArtifactSuffix()).lookup(word);
            if (json.isEmpty()) {
                err.println("❌ Not found: " + word);
                return 1;
            }
            if (pretty) {
                ObjectMapper mapper = new ObjectMapper();
                out.println(mapper.writerWithDefaultPrettyPrinter().writeValueAsString(mapper.readTree(json.get())));
            } else {
                out.println(json.get());
            }
            out.flush();
            return 0;
        } catch (DictionaryPipelineException | IllegalArgumentException | IOException e) {
            LOGGER.log(Level.SEVERE, "Inspect failed", e);
            err.println("❌ " + e.getMessage());
            return 1;
        }
    }
}
