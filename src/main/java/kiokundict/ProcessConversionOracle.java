package kiokundict;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs an external converter such as {@code opencc -c jp2t}: the newline-joined batch is fed
 * on standard input and standard output is split back into lines.
 *
 * <p>All three standard streams are redirected through temporary files, so a large batch
 * cannot dead-lock on full pipe buffers and the timeout bounds the whole run, even for a
 * converter that never closes its output.</p>
 */
public class ProcessConversionOracle implements ConversionOracle {
    private static final Logger LOGGER = Logger.getLogger(ProcessConversionOracle.class.getName());

    /**
     * Default command line: OpenCC with its Japanese Shinjitai → Traditional configuration.
     */
    public static final List<String> DEFAULT_COMMAND =
            Collections.unmodifiableList(Arrays.asList("opencc", "-c", "jp2t"));

    private final List<String> command;
    private final long timeoutSeconds;

    public ProcessConversionOracle() {
        this(DEFAULT_COMMAND, 600);
    }

    /**
     * @param command        executable and arguments
     * @param timeoutSeconds how long to wait for the converter before giving up
     */
    public ProcessConversionOracle(List<String> command, long timeoutSeconds) {
        if (command == null || command.isEmpty()) {
            throw new IllegalArgumentException("Oracle command cannot be empty");
        }
        this.command = Collections.unmodifiableList(new ArrayList<>(command));
        this.timeoutSeconds = timeoutSeconds;
    }

    public List<String> getCommand() {
        return command;
    }

    @Override
    public List<String> convertBatch(List<String> lines) {
        if (lines.isEmpty()) return Collections.emptyList();

        Path stdin = null;
        Path stdout = null;
        Path stderr = null;
        try {
            stdin = Files.createTempFile("kiokun-oracle-in", ".txt");
            stdout = Files.createTempFile("kiokun-oracle-out", ".txt");
            stderr = Files.createTempFile("kiokun-oracle-err", ".txt");
            Files.write(stdin, String.join("\n", lines).getBytes(StandardCharsets.UTF_8));

            LOGGER.info("Running " + String.join(" ", command) + " on " + lines.size() + " lines");
            Process process = new ProcessBuilder(command)
                    .redirectInput(stdin.toFile())
                    .redirectOutput(stdout.toFile())
                    .redirectError(stderr.toFile())
                    .start();

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                process.destroyForcibly().waitFor(5, TimeUnit.SECONDS);
                throw new OracleContractException("Conversion oracle timed out after " + timeoutSeconds + "s");
            }
            int exit = process.exitValue();
            if (exit != 0) {
                String err = new String(Files.readAllBytes(stderr), StandardCharsets.UTF_8).trim();
                throw new OracleContractException("Conversion oracle exited with status " + exit
                        + (err.isEmpty() ? "" : ": " + err));
            }
            return splitLines(new String(Files.readAllBytes(stdout), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new OracleContractException("Failed to run conversion oracle " + command, e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new OracleContractException("Interrupted while waiting for conversion oracle", e);
        } finally {
            deleteQuietly(stdin);
            deleteQuietly(stdout);
            deleteQuietly(stderr);
        }
    }

    /**
     * Splits converter output into lines. One trailing line break is ignored and CRLF is
     * accepted; an empty output is zero lines.
     */
    static List<String> splitLines(String output) {
        if (output.isEmpty()) return Collections.emptyList();
        String body = output;
        if (body.endsWith("\r\n")) {
            body = body.substring(0, body.length() - 2);
        } else if (body.endsWith("\n")) {
            body = body.substring(0, body.length() - 1);
        }
        String[] parts = body.split("\r?\n", -1);
        return Arrays.asList(parts);
    }

    private static void deleteQuietly(Path path) {
        if (path == null) return;
        try {
            Files.deleteIfExists(path);
        } catch (IOException e) {
            LOGGER.log(Level.WARNING, "Could not remove temporary file " + path, e);
        }
    }
}
