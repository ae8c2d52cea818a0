package kiokundict;

import java.io.IOException;
import java.io.InputStream;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.List;

public final class Fixtures {

    private Fixtures() {
    }

    public static Path path(String name) {
        URL url = Fixtures.class.getResource("/fixtures/" + name);
        if (url == null) throw new IllegalStateException("Missing fixture " + name);
        try {
            return Paths.get(url.toURI());
        } catch (URISyntaxException e) {
            throw new IllegalStateException(e);
        }
    }

    public static Path copy(String name, Path dir) throws IOException {
        Path target = dir.resolve(name);
        try (InputStream in = Fixtures.class.getResourceAsStream("/fixtures/" + name)) {
            Files.copy(in, target, StandardCopyOption.REPLACE_EXISTING);
        }
        return target;
    }

    /**
     * A build configuration over the fixture corpora, writing everything under {@code dir}.
     */
    public static BuildConfig config(Path dir) throws IOException {
        BuildConfig config = new BuildConfig();
        config.setChineseCorpus(copy("chinese.jsonl", dir).toString());
        config.setJapaneseCorpus(copy("jmdict.json", dir).toString());
        config.setMappingFile(copy("mapping.json", dir).toString());
        config.setOutputDir(dir.resolve("out").toString());
        config.setSearchIndexFile(dir.resolve("index/search_index.csv").toString());
        config.setWorkers(2);
        config.setVerifySampleSize(100);
        return config;
    }

    public static ChineseEntry chinese(String simp, String trad, String... definitions) {
        return new ChineseEntry(simp, trad, definitions.length > 0 ? definitions[0] : null,
                List.of(new ChineseEntry.Item(ChineseEntry.Source.CEDICT, "pin yin",
                        ChineseEntry.SimpTrad.BOTH, List.of(definitions))),
                null);
    }

    public static JapaneseEntry kanjiWord(String id, String kanji, String kana, boolean common, String... glosses) {
        return new JapaneseEntry(id,
                List.of(new JapaneseEntry.Spelling(kanji, common)),
                List.of(new JapaneseEntry.Spelling(kana, common)),
                List.of(sense(glosses)));
    }

    public static JapaneseEntry kanaWord(String id, String kana, String... glosses) {
        return new JapaneseEntry(id, List.of(),
                List.of(new JapaneseEntry.Spelling(kana, false)),
                List.of(sense(glosses)));
    }

    private static JapaneseEntry.Sense sense(String... glosses) {
        List<JapaneseEntry.Gloss> out = new ArrayList<>();
        for (String g : glosses) out.add(new JapaneseEntry.Gloss("eng", g));
        return new JapaneseEntry.Sense(List.of("n"), out);
    }
}
