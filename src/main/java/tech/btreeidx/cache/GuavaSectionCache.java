package tech.btreeidx.cache;

import com.google.common.cache.Cache;
import com.google.common.cache.CacheBuilder;
import com.google.common.cache.CacheStats;
import com.google.common.cache.Weigher;
import com.google.common.util.concurrent.ExecutionError;
import com.google.common.util.concurrent.UncheckedExecutionException;
import org.apache.commons.configuration2.Configuration;
import org.apache.hadoop.fs.Path;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.btreeidx.codec.CodecFactory;
import tech.btreeidx.codec.CompressionCodec;
import tech.btreeidx.io.IndexFileStream;
import tech.btreeidx.util.Common;

import java.io.IOException;
import java.util.Objects;
import java.util.concurrent.ExecutionException;

/**
 * Section cache backed by a size bounded Guava cache. Concurrent misses on the same
 * (file, offset, length, codec) key are loaded once, other callers wait for that load.
 */
public class GuavaSectionCache implements SectionCache {
    private final Cache<SpanKey, CachedByteSpan> cache;
    Logger logger = LoggerFactory.getLogger(GuavaSectionCache.class);

    public GuavaSectionCache(Configuration config) {
        this(config.getLong(Common.CONFIG_KEY_CACHE_MAX_BYTES, Common.DEFAULT_CACHE_MAX_BYTES));
    }

    public GuavaSectionCache(long maxBytes) {
        this.cache = CacheBuilder.newBuilder()
                .maximumWeight(maxBytes)
                .weigher((Weigher<SpanKey, CachedByteSpan>) (key, span) -> span.size())
                .recordStats()
                .build();
        logger.debug("section cache created, max bytes:{}", maxBytes);
    }

    @Override
    public CachedByteSpan get(IndexFileStream stream, long offset, int length, CompressionCodec codec) throws IOException {
        SpanKey key = new SpanKey(stream.path(), offset, length, codec.name());
        try {
            return cache.get(key, () -> SectionCache.read(stream, offset, length, codec));
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof IOException) {
                throw (IOException) cause;
            }
            throw new IOException("fail to load " + key, cause);
        } catch (UncheckedExecutionException | ExecutionError e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            if (cause instanceof Error) {
                throw (Error) cause;
            }
            throw e;
        }
    }

    @Override
    public CachedByteSpan put(IndexFileStream stream, long offset, byte[] bytes) {
        CachedByteSpan span = new CachedByteSpan(offset, bytes);
        cache.put(new SpanKey(stream.path(), offset, bytes.length, CodecFactory.NONE.name()), span);
        return span;
    }

    /**
     * drop all cached spans of one index file
     */
    public void invalidate(Path file) {
        cache.asMap().keySet().removeIf(key -> key.path.equals(file));
    }

    public long size() {
        return cache.size();
    }

    public CacheStats stats() {
        return cache.stats();
    }

    private static final class SpanKey {
        final Path path;
        final long offset;
        final int length;
        final String codec;

        SpanKey(Path path, long offset, int length, String codec) {
            this.path = path;
            this.offset = offset;
            this.length = length;
            this.codec = codec;
        }

        @Override
        public boolean equals(Object o) {
            if (this == o) return true;
            if (!(o instanceof SpanKey)) return false;
            SpanKey that = (SpanKey) o;
            return offset == that.offset && length == that.length && path.equals(that.path) && codec.equals(that.codec);
        }

        @Override
        public int hashCode() {
            return Objects.hash(path, offset, length, codec);
        }

        @Override
        public String toString() {
            return path + "@" + offset + "+" + length + "(" + codec + ")";
        }
    }
}
