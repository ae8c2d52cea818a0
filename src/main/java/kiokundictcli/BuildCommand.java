package kiokundictcli;

import kiokundict.BuildConfig;
import kiokundict.BuildPipeline;
import kiokundict.BuildReport;
import kiokundict.DictionaryPipelineException;
import kiokundict.PipelineListener;
import kiokundict.SearchIndexFormat;
import kiokundict.Shard;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.util.Map;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs the full pipeline. Command-line options override the configuration file.
 */
@Command(name = "build", description = "\033[1;34mUnify the corpora and write artifacts and search index\033[0m",
        mixinStandardHelpOptions = true)
public class BuildCommand implements Callable<Integer> {
    private static final Logger LOGGER = Logger.getLogger(BuildCommand.class.getName());

    @Spec
    CommandSpec spec;

    @Mixin
    VerboseOption verbose;

    @Mixin
    ConfigOption configOption;

    @Option(names = "--chinese", paramLabel = "<file>", description = "Chinese corpus (JSON Lines or JSON document)")
    String chineseCorpus;

    @Option(names = "--japanese", paramLabel = "<file>", description = "JMdict corpus (JSON document or JSON Lines)")
    String japaneseCorpus;

    @Option(names = {"-m", "--mapping"}, paramLabel = "<file>", description = "Kanji to Traditional Chinese mapping")
    String mappingFile;

    @Option(names = {"-o", "--output-dir"}, paramLabel = "<dir>", description = "Artifact output directory")
    String outputDir;

    @Option(names = {"-i", "--search-index"}, paramLabel = "<file>", description = "Search index output file")
    String searchIndexFile;

    @Option(names = {"-f", "--format"}, paramLabel = "<format>", description = "Search index format: csv or sql")
    String format;

    @Option(names = "--unified-only", description = "Only emit entries present in both languages")
    Boolean unifiedOnly;

    @Option(names = "--shard", description = "Copy artifacts into the four shard directories after the build")
    Boolean shardOutput;

    @Option(names = {"-j", "--workers"}, paramLabel = "<n>", description = "Worker threads")
    Integer workers;

    @Option(names = {"-l", "--level"}, paramLabel = "<0-9>", description = "Deflate compression level")
    Integer compressionLevel;

    @Option(names = "--no-progress", description = "Do not draw the progress bar")
    boolean noProgress;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        try {
            BuildConfig config = configOption.load();
            applyOverrides(config);
            config.validate();

            ConsoleProgressBar bar = new ConsoleProgressBar("Artifacts", 40, System.err);
            BuildPipeline pipeline = new BuildPipeline(config).setListener(new PipelineListener() {
                @Override
                public void stageStarted(String stage) {
                    err.println("ℹ️ Stage: " + stage);
                    err.flush();
                }

                @Override
                public void artifactsWritten(int done, int total) {
                    if (!noProgress) bar.update(done, total);
                }
            });

            BuildReport report = pipeline.run();
            err.println("✅ " + report.getStatistics());
            err.println("✅ " + report.getArtifacts() + " in " + config.outputDirPath().toAbsolutePath());
            for (Map.Entry<Shard, Integer> e : report.getShardCounts().entrySet()) {
                err.println("   " + e.getKey() + ": " + e.getValue());
            }
            err.println("✅ " + report.getSearchIndexRows() + " search index rows in "
                    + config.searchIndexPath().toAbsolutePath());
            if (report.getMalformedRecords() > 0) {
                err.println("ℹ️ Skipped " + report.getMalformedRecords() + " malformed corpus records");
            }
            return 0;
        } catch (DictionaryPipelineException | IllegalArgumentException e) {
            LOGGER.log(Level.SEVERE, "Build failed", e);
            err.println("❌ " + e.getMessage());
            return 1;
        }
    }

    void applyOverrides(BuildConfig config) {
        if (chineseCorpus != null) config.setChineseCorpus(chineseCorpus);
        if (japaneseCorpus != null) config.setJapaneseCorpus(japaneseCorpus);
        if (mappingFile != null) config.setMappingFile(mappingFile);
        if (outputDir != null) config.setOutputDir(outputDir);
        if (searchIndexFile != null) config.setSearchIndexFile(searchIndexFile);
        if (format != null) config.setSearchIndexFormat(SearchIndexFormat.parse(format));
        if (unifiedOnly != null) config.setUnifiedOnly(unifiedOnly);
        if (shardOutput != null) config.setShardOutput(shardOutput);
        if (workers != null) config.setWorkers(workers);
        if (compressionLevel != null) config.setCompressionLevel(compressionLevel);
    }
}
