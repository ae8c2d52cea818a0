package kiokundict;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Controls log verbosity for the whole {@code kiokundict} package.
 */
public final class PipelineLogging {
    private static final Logger ROOT = Logger.getLogger("kiokundict");

    static {
        ROOT.setLevel(Level.WARNING);
    }

    private PipelineLogging() {
    }

    /**
     * Enables or disables verbose logging for all pipeline classes.
     * <p>
     * When enabled, progress messages at {@code INFO} level are shown. When disabled only
     * warnings and errors are logged.
     *
     * @param enabled {@code true} to log at {@code INFO}
     */
    public static void setVerboseLogging(boolean enabled) {
        ROOT.setLevel(enabled ? Level.INFO : Level.WARNING);
    }
}
