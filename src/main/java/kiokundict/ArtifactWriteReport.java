package kiokundict;

/**
 * Totals for one artifact write pass.
 */
public final class ArtifactWriteReport {
    private final int fileCount;
    private final long rawBytes;
    private final long compressedBytes;

    ArtifactWriteReport(int fileCount, long rawBytes, long compressedBytes) {
        this.fileCount = fileCount;
        this.rawBytes = rawBytes;
        this.compressedBytes = compressedBytes;
    }

    public int getFileCount() {
        return fileCount;
    }

    public long getRawBytes() {
        return rawBytes;
    }

    public long getCompressedBytes() {
        return compressedBytes;
    }

    public double getCompressionRatio() {
        return rawBytes == 0 ? 0.0 : (double) compressedBytes / rawBytes;
    }

    @Override
    public String toString() {
        return String.format("%d artifacts (%d bytes JSON -> %d bytes deflated, %.1f%%)",
                fileCount, rawBytes, compressedBytes, getCompressionRatio() * 100);
    }
}
