package kiokundict;

import java.io.IOException;
import java.nio.file.DirectoryNotEmptyException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.logging.Logger;
import java.util.stream.Collectors;

/**
 * Runs the whole build: load mapping and corpora, unify, then shard, compress and flatten
 * in parallel, verify, and mark the output directory complete.
 *
 * <p>A stage only starts when the previous one succeeded. The completion marker is removed
 * before anything is written and restored only after every check passed, so an output
 * directory without it must not be served.</p>
 */
public class BuildPipeline {
    private static final Logger LOGGER = Logger.getLogger(BuildPipeline.class.getName());

    private final BuildConfig config;
    private PipelineListener listener = PipelineListener.NONE;

    public BuildPipeline(BuildConfig config) {
        this.config = Objects.requireNonNull(config, "config");
        config.validate();
    }

    public BuildPipeline setListener(PipelineListener listener) {
        this.listener = listener == null ? PipelineListener.NONE : listener;
        return this;
    }

    /**
     * Runs the build described by the configuration.
     *
     * @return what was produced
     * @throws DictionaryPipelineException on any fatal error; the output directory is then
     *                                     left without a completion marker
     */
    public BuildReport run() {
        Path outputDir = config.outputDirPath();
        rejectFilesInCleanupScope(outputDir, config.getArtifactSuffix());
        prepareOutputDir(outputDir, config.getArtifactSuffix());

        listener.stageStarted("mapping");
        CharacterMapping mapping = CharacterMapping.fromJsonIfExists(config.mappingFilePath());
        if (mapping.isEmpty()) {
            LOGGER.warning("No character mapping at " + config.mappingFilePath()
                    + "; Japanese kanji are matched by their raw spelling");
        }

        listener.stageStarted("load");
        ExecutorService pool = Executors.newFixedThreadPool(config.getWorkers());
        try {
            CompletableFuture<LoadedCorpus<ChineseEntry>> zhFuture = CompletableFuture.supplyAsync(
                    () -> new ChineseCorpusLoader().load(config.chineseCorpusPath()), pool);
            CompletableFuture<LoadedCorpus<JapaneseEntry>> jaFuture = CompletableFuture.supplyAsync(
                    () -> new JapaneseCorpusLoader().load(config.japaneseCorpusPath()), pool);
            LoadedCorpus<ChineseEntry> chinese = join(zhFuture);
            LoadedCorpus<JapaneseEntry> japanese = join(jaFuture);

            listener.stageStarted("unify");
            UnificationResult unification = new Unifier(mapping).unify(chinese, japanese);
            List<UnifiedEntry> entries = config.isUnifiedOnly()
                    ? unification.unifiedOnly()
                    : unification.getEntries();
            if (config.isUnifiedOnly()) {
                LOGGER.info("Unified-only mode: keeping " + entries.size() + " of "
                        + unification.getEntries().size() + " entries");
            }

            listener.stageStarted("emit");
            ArtifactCompressor compressor = new ArtifactCompressor(outputDir,
                    config.getArtifactSuffix(), config.getCompressionLevel());
            int total = entries.size();
            CompletableFuture<Map<Shard, Integer>> shardFuture = CompletableFuture.supplyAsync(
                    () -> Sharder.countByShard(entries.stream().map(UnifiedEntry::getWord).collect(Collectors.toList())), pool);
            CompletableFuture<ArtifactWriteReport> artifactFuture = CompletableFuture.supplyAsync(
                    () -> compressor.writeAll(entries, done -> listener.artifactsWritten(done, total)), pool);
            CompletableFuture<Integer> indexFuture = CompletableFuture.supplyAsync(() -> {
                List<SearchIndexRow> rows = SearchIndexFlattener.flatten(entries);
                SearchIndexWriter.forFormat(config.getSearchIndexFormat(), config.getSqlTable(), config.getSqlBatchSize())
                        .writeTo(rows, config.searchIndexPath());
                return rows.size();
            }, pool);
            Map<Shard, Integer> shardCounts = join(shardFuture);
            ArtifactWriteReport artifacts = join(artifactFuture);
            int indexRows = join(indexFuture);

            listener.stageStarted("verify");
            int verified = compressor.verifySample(entries, config.getVerifySampleSize());
            ArtifactStore store = new ArtifactStore(outputDir, config.getArtifactSuffix());
            List<Path> files = store.listArtifacts();
            if (files.size() != total || artifacts.getFileCount() != total) {
                throw new InvariantViolationException("Expected " + total + " artifacts in " + outputDir
                        + " but found " + files.size());
            }
            if (config.isShardOutput()) {
                listener.stageStarted("shard");
                Map<Shard, Integer> copied = new ShardDistributor(store).distribute();
                if (!copied.equals(shardCounts)) {
                    throw new InvariantViolationException("Shard directories " + copied
                            + " disagree with word classification " + shardCounts);
                }
            }

            CompletionMarker marker = CompletionMarker.compute(files);
            marker.write(outputDir);
            BuildReport report = new BuildReport(unification.getStatistics(), shardCounts, artifacts,
                    indexRows, verified, marker, chinese.getMalformedCount() + japanese.getMalformedCount());
            LOGGER.info("Build complete: " + report);
            return report;
        } finally {
            pool.shutdownNow();
        }
    }

    /**
     * @return {@code true} if {@code outputDir} carries a completion marker whose digest still
     * matches the artifacts on disk
     */
    public static boolean isComplete(Path outputDir, String suffix) {
        CompletionMarker marker = CompletionMarker.read(outputDir);
        if (marker == null) return false;
        return marker.equals(CompletionMarker.compute(new ArtifactStore(outputDir, suffix).listArtifacts()));
    }

    /**
     * Fails before anything is deleted if a configured input or the search index would be
     * swept up by {@link #prepareOutputDir}.
     *
     * @throws PipelineIOException naming the first such file
     */
    private void rejectFilesInCleanupScope(Path outputDir, String suffix) {
        Map<String, Path> files = new LinkedHashMap<>();
        files.put("Chinese corpus", config.chineseCorpusPath());
        files.put("Japanese corpus", config.japaneseCorpusPath());
        files.put("character mapping", config.mappingFilePath());
        files.put("search index", config.searchIndexPath());
        for (Map.Entry<String, Path> e : files.entrySet()) {
            if (inCleanupScope(outputDir, e.getValue(), suffix)) {
                throw new PipelineIOException("use " + e.getKey(), e.getValue(),
                        new IOException("file lies in output directory " + outputDir + " and ends with the artifact suffix "
                                + suffix + ", so the build would delete it; move it or change artifactSuffix"));
            }
        }
    }

    /**
     * @return {@code true} if {@code file} is a direct child of the output root or of one of its
     * shard directories and carries the artifact suffix
     */
    static boolean inCleanupScope(Path outputDir, Path file, String suffix) {
        Path root = outputDir.toAbsolutePath().normalize();
        Path abs = file.toAbsolutePath().normalize();
        Path parent = abs.getParent();
        if (parent == null || ArtifactNames.stem(abs.getFileName().toString(), suffix) == null) return false;
        if (parent.equals(root)) return true;
        for (Shard shard : Shard.values()) {
            if (parent.equals(root.resolve(shard.directoryName()))) return true;
        }
        return false;
    }

    /**
     * Clears the marker, stale artifacts and shard directories from a previous run so the
     * directory only ever holds the current run's output.
     */
    private static void prepareOutputDir(Path outputDir, String suffix) {
        try {
            Files.createDirectories(outputDir);
        } catch (IOException e) {
            throw new PipelineIOException("create output directory", outputDir, e);
        }
        CompletionMarker.delete(outputDir);
        ArtifactStore store = new ArtifactStore(outputDir, suffix);
        int removed = deleteArtifacts(store.listArtifacts());
        for (Shard shard : Shard.values()) {
            Path dir = outputDir.resolve(shard.directoryName());
            if (!Files.isDirectory(dir)) continue;
            removed += deleteArtifacts(store.listArtifacts(dir));
            try {
                Files.delete(dir);
            } catch (DirectoryNotEmptyException e) {
                LOGGER.warning("Keeping " + dir + ": it holds files that are not artifacts");
            } catch (IOException e) {
                throw new PipelineIOException("remove shard directory", dir, e);
            }
        }
        if (removed > 0) {
            LOGGER.info("Removed " + removed + " artifacts left by a previous run");
        }
    }

    private static int deleteArtifacts(List<Path> stale) {
        for (Path file : stale) {
            try {
                Files.delete(file);
            } catch (IOException e) {
                throw new PipelineIOException("remove stale artifact", file, e);
            }
        }
        return stale.size();
    }

    private static <T> T join(CompletableFuture<T> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new DictionaryPipelineException("Build interrupted", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof CompletionException && cause.getCause() != null) {
                cause = cause.getCause();
            }
            if (cause instanceof RuntimeException) throw (RuntimeException) cause;
            if (cause instanceof Error) throw (Error) cause;
            throw new DictionaryPipelineException("Build stage failed", cause);
        }
    }
}
