package tech.btreeidx;

/**
 * Thrown when an index file does not follow the expected layout: unsupported version,
 * bad magic, file too short, inconsistent section lengths or oversized partitions.
 * Not retryable, reading the same file again gives the same result.
 */
public class IndexFormatException extends RuntimeException {
    public IndexFormatException(String message) {
        super(message);
    }
}
