package kiokundictcli;

import kiokundict.BuildConfig;
import picocli.CommandLine.Option;

import java.nio.file.Path;

/**
 * {@code -c/--config}: build configuration file. Without it the usual lookup applies.
 */
class ConfigOption {

    @Option(names = {"-c", "--config"}, paramLabel = "<file>",
            description = "Build configuration JSON (default: " + BuildConfig.DEFAULT_CONFIG_FILE + ", then bundled defaults)")
    Path configFile;

    BuildConfig load() {
        return BuildConfig.load(configFile);
    }
}
