package kiokundictcli;

import kiokundict.CharacterMapping;
import kiokundict.ConversionOracle;
import kiokundict.DictionaryConversionOracle;
import kiokundict.DictionaryPipelineException;
import kiokundict.MappingMergeResult;
import kiokundict.ProcessConversionOracle;
import kiokundict.ScriptMapper;
import picocli.CommandLine.Command;
import picocli.CommandLine.Mixin;
import picocli.CommandLine.Model.CommandSpec;
import picocli.CommandLine.Option;
import picocli.CommandLine.Spec;

import java.io.PrintWriter;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Builds or extends the kanji → Traditional Chinese mapping.
 */
@Command(name = "mapping", description = "\033[1;34mGenerate the Japanese kanji to Traditional Chinese mapping\033[0m",
        mixinStandardHelpOptions = true)
public class MappingCommand implements Callable<Integer> {
    private static final Logger LOGGER = Logger.getLogger(MappingCommand.class.getName());

    enum OracleKind {process, dictionary}

    @Spec
    CommandSpec spec;

    @Mixin
    VerboseOption verbose;

    @Option(names = "--jmdict", paramLabel = "<file>", description = "JMdict JSON document (word-level kanji)")
    Path jmdict;

    @Option(names = "--kanjidic", paramLabel = "<file>", description = "KANJIDIC2 JSON document (single characters)")
    Path kanjidic;

    @Option(names = "--oracle", paramLabel = "<kind>", defaultValue = "process",
            description = "Conversion oracle: ${COMPLETION-CANDIDATES} (default: ${DEFAULT-VALUE})")
    OracleKind oracle;

    @Option(names = "--oracle-command", paramLabel = "<arg>", split = " ",
            description = "External converter command (default: opencc -c jp2t)")
    List<String> oracleCommand;

    @Option(names = "--timeout", paramLabel = "<seconds>", defaultValue = "600",
            description = "External converter timeout in seconds (default: ${DEFAULT-VALUE})")
    long timeoutSeconds;

    @Option(names = "--dict-dir", paramLabel = "<dir>", defaultValue = "dicts",
            description = "Directory of OpenCC jp2t text dictionaries for --oracle dictionary (default: ${DEFAULT-VALUE})")
    String dictDir;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>",
            defaultValue = "data/japanese_to_traditional_mapping.json",
            description = "Mapping file to write (default: ${DEFAULT-VALUE})")
    Path output;

    @Option(names = "--merge", negatable = true, defaultValue = "true", fallbackValue = "true",
            description = "Merge into an existing mapping file, keeping its entries (default: ${DEFAULT-VALUE})")
    boolean merge;

    @Override
    public Integer call() {
        PrintWriter err = spec.commandLine().getErr();
        if (jmdict == null && kanjidic == null) {
            err.println("❌ Give at least one of --jmdict or --kanjidic");
            return 2;
        }
        try {
            SortedSet<String> spellings = new TreeSet<>();
            if (jmdict != null) {
                spellings.addAll(ScriptMapper.extractJmdictKanji(jmdict));
            }
            if (kanjidic != null) {
                spellings.addAll(ScriptMapper.extractKanjidicLiterals(kanjidic));
            }
            err.println("ℹ️ Converting " + spellings.size() + " kanji spellings with the " + oracle + " oracle");

            ScriptMapper mapper = new ScriptMapper(createOracle());
            if (merge) {
                MappingMergeResult result = mapper.generateAndMerge(spellings, output);
                err.println("✅ " + result);
            } else {
                CharacterMapping mapping = mapper.buildMapping(spellings);
                mapping.writeJson(output);
                err.println("✅ Wrote " + mapping.size() + " mappings");
            }
            err.println("✅ Mapping saved at: " + output.toAbsolutePath());
            return 0;
        } catch (DictionaryPipelineException e) {
            LOGGER.log(Level.SEVERE, "Mapping generation failed", e);
            err.println("❌ " + e.getMessage());
            return 1;
        }
    }

    private ConversionOracle createOracle() {
        if (oracle == OracleKind.dictionary) {
            return DictionaryConversionOracle.fromDicts(dictDir);
        }
        List<String> command = oracleCommand != null && !oracleCommand.isEmpty()
                ? new ArrayList<>(oracleCommand)
                : ProcessConversionOracle.DEFAULT_COMMAND;
        return new ProcessConversionOracle(command, timeoutSeconds);
    }
}
