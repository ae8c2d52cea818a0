package kiokundictcli;

import kiokundict.ArtifactStore;
import kiokundict.BuildConfig;
import kiokundict.DictionaryPipelineException;
import kiokundict.OutputVerifier;
import kiokundict.Shard;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "verify", description = "\033[1;34mCheck a build output: marker, round-trip and shards\033[0m",
        mixinStandardHelpOptions = true)
public class VerifyCommand implements Callable<Integer> {
    private static final Logger LOGGER = Logger.getLogger(VerifyCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Mixin
    VerboseOption verbose;

    @Mixin
    ConfigOption configOption;

    @Option(names = {"-o", "--output-dir"}, paramLabel = "<dir>", description = "Artifact output directory")
    String outputDir;

    @Option(names = {"-s", "--sample"}, paramLabel = "<n>", description = "Artifacts to decode (default: from config)")
    Integer sample;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            BuildConfig config = configOption.load();
            Path root = outputDir != null ? Paths.get(outputDir) : config.outputDirPath();
            int sampleSize = sample != null ? sample : config.getVerifySampleSize();
            Map<Shard, Integer> shards = new OutputVerifier(new ArtifactStore(root, config.getArtifactSuffix()))
                    .verify(sampleSize);
            if (shards != null) {
                err.println("✅ Shards consistent: " + shards);
            }
            err.println("✅ " + root.toAbsolutePath() + " verified");
            return 0;
        } catch (DictionaryPipelineException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Verification failed", e);
            err.println("❌ " + e.getMessage());
            return 1;
        }
    }
}
