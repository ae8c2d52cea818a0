package kiokundict;

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;

/**
 * Maps words to artifact filenames.
 * <p>
 * The filename is the word itself plus a fixed suffix. Characters that common filesystems
 * reject ({@code / \ : * ? " < > |} and C0/C1 control characters) become {@code _}. Han
 * characters are never replaced, so a sanitized name shards exactly like its word.
 */
public final class ArtifactNames {

    private ArtifactNames() {
    }

    public static String sanitize(String word) {
        StringBuilder sb = new StringBuilder(word.length());
        word.codePoints().forEach(cp -> {
            if (Character.getType(cp) == Character.CONTROL || "/\\:*?\"<>|".indexOf(cp) >= 0) {
                sb.append('_');
            } else {
                sb.appendCodePoint(cp);
            }
        });
        return sb.toString();
    }

    public static String fileName(String word, String suffix) {
        return sanitize(word) + suffix;
    }

    /**
     * Resolves an artifact filename under {@code dir}.
     *
     * @throws PipelineIOException if the platform cannot encode the name, typically because the
     *                             JVM runs with a non-UTF-8 {@code sun.jnu.encoding}
     */
    public static Path resolve(Path dir, String fileName) {
        try {
            return dir.resolve(fileName);
        } catch (InvalidPathException e) {
            throw new PipelineIOException("resolve artifact file name '" + fileName + "' in", dir,
                    new IOException(e.getReason() + "; artifact names are UTF-8, so run with a UTF-8 locale"
                            + " (e.g. LANG=C.UTF-8, or -Dsun.jnu.encoding=UTF-8 -Dfile.encoding=UTF-8)", e));
        }
    }

    /**
     * @return the filename with {@code suffix} removed, or {@code null} if it does not end with it
     */
    public static String stem(String fileName, String suffix) {
        if (!fileName.endsWith(suffix) || fileName.length() == suffix.length()) return null;
        return fileName.substring(0, fileName.length() - suffix.length());
    }
}
