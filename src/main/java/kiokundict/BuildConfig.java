package kiokundict;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

/**
 * Build configuration, bound from JSON by Jackson.
 *
 * <p>Resolution order used by {@link #load(Path)}:</p>
 * <ol>
 *   <li>an explicitly given file</li>
 *   <li>{@code config/kiokun-build.json} in the working directory</li>
 *   <li>the classpath resource {@code /config/kiokun-build.json}</li>
 *   <li>built-in defaults</li>
 * </ol>
 * <p>Unknown keys are rejected so a misspelled option fails loudly.</p>
 */
@JsonPropertyOrder({"chineseCorpus", "japaneseCorpus", "mappingFile", "outputDir",
        "searchIndexFile", "searchIndexFormat", "sqlBatchSize", "sqlTable", "artifactSuffix",
        "compressionLevel", "verifySampleSize", "shardOutput", "unifiedOnly", "workers", "oracleCommand"})
public class BuildConfig {
    private static final Logger LOGGER = Logger.getLogger(BuildConfig.class.getName());

    /**
     * Working-directory location checked when no explicit file is given.
     */
    public static final String DEFAULT_CONFIG_FILE = "config/kiokun-build.json";
    static final String DEFAULT_CONFIG_RESOURCE = "/config/kiokun-build.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    private String chineseCorpus = "data/chinese_dictionary.jsonl";
    private String japaneseCorpus = "data/jmdict-eng.json";
    private String mappingFile = "data/japanese_to_traditional_mapping.json";
    private String outputDir = "output_dictionary";
    private String searchIndexFile = "output/search_index.csv";
    private SearchIndexFormat searchIndexFormat = SearchIndexFormat.CSV;
    private int sqlBatchSize = 500;
    private String sqlTable = "dictionary_search";
    private String artifactSuffix = ".json";
    private int compressionLevel = 9;
    private int verifySampleSize = 64;
    private boolean shardOutput = false;
    private boolean unifiedOnly = false;
    private int workers = Runtime.getRuntime().availableProcessors();
    private List<String> oracleCommand = new ArrayList<>(ProcessConversionOracle.DEFAULT_COMMAND);

    /**
     * Resolves and loads the configuration.
     *
     * @param explicit file given by the user, or {@code null}
     * @return the validated configuration
     * @throws PipelineIOException       if a config file exists but cannot be read or parsed
     * @throws IllegalArgumentException  if a value is out of range
     */
    public static BuildConfig load(Path explicit) {
        BuildConfig config;
        if (explicit != null) {
            config = fromJson(explicit);
        } else if (Files.isRegularFile(Paths.get(DEFAULT_CONFIG_FILE))) {
            config = fromJson(Paths.get(DEFAULT_CONFIG_FILE));
        } else {
            try (InputStream in = BuildConfig.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {
                if (in != null) {
                    config = MAPPER.readValue(in, BuildConfig.class);
                    LOGGER.info("Using bundled configuration " + DEFAULT_CONFIG_RESOURCE);
                } else {
                    config = new BuildConfig();
                    LOGGER.info("Using built-in default configuration");
                }
            } catch (IOException e) {
                throw new PipelineIOException("read bundled configuration", Paths.get(DEFAULT_CONFIG_RESOURCE), e);
            }
        }
        config.validate();
        return config;
    }

    public static BuildConfig fromJson(Path path) {
        try {
            BuildConfig config = MAPPER.readValue(path.toFile(), BuildConfig.class);
            LOGGER.info("Loaded configuration from " + path);
            return config;
        } catch (IOException e) {
            throw new PipelineIOException("read configuration", path, e);
        }
    }

    /**
     * @throws IllegalArgumentException if any value is out of range
     */
    public void validate() {
        require(compressionLevel >= 0 && compressionLevel <= 9, "compressionLevel must be 0-9");
        require(sqlBatchSize >= 1, "sqlBatchSize must be positive");
        require(verifySampleSize >= 0, "verifySampleSize must not be negative");
        require(workers >= 1, "workers must be positive");
        require(artifactSuffix != null && !artifactSuffix.isEmpty(), "artifactSuffix must not be empty");
        require(oracleCommand != null && !oracleCommand.isEmpty(), "oracleCommand must not be empty");
        require(searchIndexFormat != null, "searchIndexFormat must be csv or sql");
        require(sqlTable != null && sqlTable.matches("[A-Za-z_][A-Za-z0-9_]*"), "sqlTable must be a plain identifier");
    }

    private static void require(boolean condition, String message) {
        if (!condition) throw new IllegalArgumentException("Invalid configuration: " + message);
    }

    public String getChineseCorpus() {
        return chineseCorpus;
    }

    public void setChineseCorpus(String chineseCorpus) {
        this.chineseCorpus = chineseCorpus;
    }

    public String getJapaneseCorpus() {
        return japaneseCorpus;
    }

    public void setJapaneseCorpus(String japaneseCorpus) {
        this.japaneseCorpus = japaneseCorpus;
    }

    public String getMappingFile() {
        return mappingFile;
    }

    public void setMappingFile(String mappingFile) {
        this.mappingFile = mappingFile;
    }

    public String getOutputDir() {
        return outputDir;
    }

    public void setOutputDir(String outputDir) {
        this.outputDir = outputDir;
    }

    public String getSearchIndexFile() {
        return searchIndexFile;
    }

    public void setSearchIndexFile(String searchIndexFile) {
        this.searchIndexFile = searchIndexFile;
    }

    public SearchIndexFormat getSearchIndexFormat() {
        return searchIndexFormat;
    }

    public void setSearchIndexFormat(SearchIndexFormat searchIndexFormat) {
        this.searchIndexFormat = searchIndexFormat;
    }

    public int getSqlBatchSize() {
        return sqlBatchSize;
    }

    public void setSqlBatchSize(int sqlBatchSize) {
        this.sqlBatchSize = sqlBatchSize;
    }

    public String getSqlTable() {
        return sqlTable;
    }

    public void setSqlTable(String sqlTable) {
        this.sqlTable = sqlTable;
    }

    public String getArtifactSuffix() {
        return artifactSuffix;
    }

    public void setArtifactSuffix(String artifactSuffix) {
        this.artifactSuffix = artifactSuffix;
    }

    public int getCompressionLevel() {
        return compressionLevel;
    }

    public void setCompressionLevel(int compressionLevel) {
        this.compressionLevel = compressionLevel;
    }

    public int getVerifySampleSize() {
        return verifySampleSize;
    }

    public void setVerifySampleSize(int verifySampleSize) {
        this.verifySampleSize = verifySampleSize;
    }

    public boolean isShardOutput() {
        return shardOutput;
    }

    public void setShardOutput(boolean shardOutput) {
        this.shardOutput = shardOutput;
    }

    public boolean isUnifiedOnly() {
        return unifiedOnly;
    }

    public void setUnifiedOnly(boolean unifiedOnly) {
        this.unifiedOnly = unifiedOnly;
    }

    public int getWorkers() {
        return workers;
    }

    public void setWorkers(int workers) {
        this.workers = workers;
    }

    public List<String> getOracleCommand() {
        return oracleCommand;
    }

    public void setOracleCommand(List<String> oracleCommand) {
        this.oracleCommand = oracleCommand == null ? null : new ArrayList<>(oracleCommand);
    }

    @JsonIgnore
    public Path chineseCorpusPath() {
        return Paths.get(chineseCorpus);
    }

    @JsonIgnore
    public Path japaneseCorpusPath() {
        return Paths.get(japaneseCorpus);
    }

    @JsonIgnore
    public Path mappingFilePath() {
        return Paths.get(mappingFile);
    }

    @JsonIgnore
    public Path outputDirPath() {
        return Paths.get(outputDir);
    }

    @JsonIgnore
    public Path searchIndexPath() {
        return Paths.get(searchIndexFile);
    }
}
