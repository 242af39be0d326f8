package tech.btreeidx.cache;

import tech.btreeidx.codec.CompressionCodec;
import tech.btreeidx.io.IndexFileStream;

import java.io.IOException;

/**
 * Reads through on every call, nothing is retained.
 */
public final class NoOpSectionCache implements SectionCache {
    public static final NoOpSectionCache INSTANCE = new NoOpSectionCache();

    private NoOpSectionCache() {
    }

    @Override
    public CachedByteSpan get(IndexFileStream stream, long offset, int length, CompressionCodec codec) throws IOException {
        return SectionCache.read(stream, offset, length, codec);
    }

    @Override
    public CachedByteSpan put(IndexFileStream stream, long offset, byte[] bytes) {
        return new CachedByteSpan(offset, bytes);
    }
}
