package kiokundictcli;

import kiokundict.ArtifactStore;
import kiokundict.BuildConfig;
import kiokundict.BuildPipeline;
import kiokundict.DictionaryPipelineException;
import kiokundict.Shard;
import kiokundict.ShardDistributor;
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

@Command(name = "shard", description = "\033[1;34mCopy built artifacts into the four shard directories\033[0m",
        mixinStandardHelpOptions = true)
public class ShardCommand implements Callable<Integer> {
    private static final Logger LOGGER = Logger.getLogger(ShardCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Mixin
    VerboseOption verbose;

    @Mixin
    ConfigOption configOption;

    @Option(names = {"-o", "--output-dir"}, paramLabel = "<dir>", description = "Artifact output directory")
    String outputDir;

    @Option(names = "--force", description = "Shard even if the directory has no valid completion marker")
    boolean force;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            BuildConfig config = configOption.load();
            Path root = outputDir != null ? Paths.get(outputDir) : config.outputDirPath();
            if (!force && !BuildPipeline.isComplete(root, config.getArtifactSuffix())) {
                err.println("❌ " + root + " is not a completed build output (use --force to shard anyway)");
                return 1;
            }
            Map<Shard, Integer> counts = new ShardDistributor(new ArtifactStore(root, config.getArtifactSuffix())).distribute();
            int total = 0;
            for (Map.Entry<Shard, Integer> e : counts.entrySet()) {
                err.println("   " + e.getKey().directoryName() + ": " + e.getValue());
                total += e.getValue();
            }
            err.println("✅ Sharded " + total + " artifacts under " + root.toAbsolutePath());
            return 0;
        } catch (DictionaryPipelineException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Sharding failed", e);
            err.println("❌ " + e.getMessage());
            return 1;
        }
    }
}
