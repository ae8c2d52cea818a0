package kiokundict;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

/**
 * Summary of a successful {@link BuildPipeline#run()}.
 */
public final class BuildReport {
    private final MergeStatistics statistics;
    private final Map<Shard, Integer> shardCounts;
    private final ArtifactWriteReport artifacts;
    private final int searchIndexRows;
    private final int verifiedArtifacts;
    private final CompletionMarker marker;
    private final long malformedRecords;

    BuildReport(MergeStatistics statistics, Map<Shard, Integer> shardCounts, ArtifactWriteReport artifacts,
                int searchIndexRows, int verifiedArtifacts, CompletionMarker marker, long malformedRecords) {
        this.statistics = statistics;
        this.shardCounts = Collections.unmodifiableMap(new EnumMap<>(shardCounts));
        this.artifacts = artifacts;
        this.searchIndexRows = searchIndexRows;
        this.verifiedArtifacts = verifiedArtifacts;
        this.marker = marker;
        this.malformedRecords = malformedRecords;
    }

    public MergeStatistics getStatistics() {
        return statistics;
    }

    public Map<Shard, Integer> getShardCounts() {
        return shardCounts;
    }

    public ArtifactWriteReport getArtifacts() {
        return artifacts;
    }

    public int getSearchIndexRows() {
        return searchIndexRows;
    }

    public int getVerifiedArtifacts() {
        return verifiedArtifacts;
    }

    public CompletionMarker getMarker() {
        return marker;
    }

    /**
     * @return corpus records skipped during loading, both languages
     */
    public long getMalformedRecords() {
        return malformedRecords;
    }

    @Override
    public String toString() {
        return statistics + "; " + artifacts + "; shards " + shardCounts + "; "
                + searchIndexRows + " index rows; " + verifiedArtifacts + " round-trips verified; "
                + malformedRecords + " malformed records skipped";
    }
}
