package tech.btreeidx.cache;

import tech.btreeidx.codec.CompressionCodec;
import tech.btreeidx.io.IndexFileStream;

import java.io.IOException;

/**
 * Serves byte ranges of index files. Implementations must be thread safe.
 */
public interface SectionCache {
    /**
     * get the span for (file, offset, length), reading it from the stream on a miss
     *
     * @param codec applied to the raw bytes before caching, {@code CodecFactory.NONE} keeps them as is
     */
    CachedByteSpan get(IndexFileStream stream, long offset, int length, CompressionCodec codec) throws IOException;

    /**
     * cache raw bytes already read by the caller for (file, offset, bytes.length)
     */
    CachedByteSpan put(IndexFileStream stream, long offset, byte[] bytes);

    static CachedByteSpan read(IndexFileStream stream, long offset, int length, CompressionCodec codec) throws IOException {
        byte[] raw = new byte[length];
        stream.readFully(offset, raw);
        return new CachedByteSpan(offset, codec.decompress(raw));
    }
}
