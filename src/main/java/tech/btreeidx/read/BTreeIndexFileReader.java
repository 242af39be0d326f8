package tech.btreeidx.read;

import org.apache.commons.configuration2.Configuration;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;
import org.apache.hadoop.util.ShutdownHookManager;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tech.btreeidx.IndexFile;
import tech.btreeidx.IndexFormatException;
import tech.btreeidx.cache.CachedByteSpan;
import tech.btreeidx.cache.SectionCache;
import tech.btreeidx.codec.CodecFactory;
import tech.btreeidx.codec.CompressionCodec;
import tech.btreeidx.io.HadoopIndexFileStream;
import tech.btreeidx.io.IndexFileStream;
import tech.btreeidx.util.Common;

import java.io.Closeable;
import java.io.IOException;
import java.util.function.BooleanSupplier;

/**
 * Reads the sections of one btree index file through a {@link SectionCache}.
 * <p>
 * The file is opened and its layout resolved on first access, once. Reads are blocking and
 * a single instance must not be used by several threads at the same time, use one reader
 * per thread instead. The cache may be shared.
 */
public class BTreeIndexFileReader implements Closeable {
    // section ids for callers tagging cache usage
    public static final int FOOTER_SECTION_ID = 0;
    public static final int ROW_ID_LIST_SECTION_ID = 1;
    public static final int NODE_SECTION_ID = 2;

    private final Path file;
    private final IndexFileStream.Opener opener;
    private final SectionCache cache;
    private final CompressionCodec codec;
    private final int rowIdListSizePerSection;
    private final BooleanSupplier inShutdown;
    private final Logger logger;

    private IndexFileStream stream;
    private volatile IndexLayout layout;
    private boolean closed;

    public BTreeIndexFileReader(Configuration config, Path file, SectionCache cache) {
        this(config, file, () -> HadoopIndexFileStream.open(file), cache);
    }

    public BTreeIndexFileReader(Configuration config, FileSystem fs, Path file, SectionCache cache) {
        this(config, file, () -> HadoopIndexFileStream.open(fs, file), cache);
    }

    public BTreeIndexFileReader(Configuration config, Path file, IndexFileStream.Opener opener, SectionCache cache) {
        this(config, file, opener, cache, () -> ShutdownHookManager.get().isShutdownInProgress(),
                LoggerFactory.getLogger(BTreeIndexFileReader.class));
    }

    public BTreeIndexFileReader(Configuration config, Path file, IndexFileStream.Opener opener, SectionCache cache,
                                BooleanSupplier inShutdown, Logger logger) {
        this.file = file;
        this.opener = opener;
        this.cache = cache;
        this.codec = CodecFactory.getCodec(config);
        this.rowIdListSizePerSection = Common.getRowListPartSize(config);
        this.inShutdown = inShutdown;
        this.logger = logger;
    }

    public Path getFile() {
        return file;
    }

    public int rowIdListSizePerSection() {
        return rowIdListSizePerSection;
    }

    /**
     * section offsets of the file, resolved from the trailer on first call
     */
    public IndexLayout layout() throws IOException {
        IndexLayout l = layout;
        if (l == null) {
            l = resolveLayout();
        }
        return l;
    }

    private synchronized IndexLayout resolveLayout() throws IOException {
        if (layout != null) {
            return layout;
        }
        IndexLayout l = LayoutResolver.resolve(openStream());
        logger.debug("resolved {}: {}", file, l);
        layout = l;
        return l;
    }

    private synchronized IndexFileStream openStream() throws IOException {
        if (closed) {
            throw new IllegalStateException("index file reader already closed: " + file);
        }
        if (stream == null) {
            stream = opener.open();
        }
        return stream;
    }

    private synchronized IndexFileStream stream() {
        if (closed) {
            throw new IllegalStateException("index file reader already closed: " + file);
        }
        return stream;
    }

    /**
     * read the version number from the header, uncached. Callers should pass it to
     * {@link #checkVersionNum(int)} before reading other sections. Does not need a valid trailer.
     */
    public int readVersionNum() throws IOException {
        byte[] header = new byte[IndexFile.VERSION_LENGTH];
        openStream().readFully(0, header);
        return IndexFile.parseVersionNum(header);
    }

    public void checkVersionNum(int versionNum) {
        IndexFile.checkVersionNum(versionNum);
    }

    public CachedByteSpan readFooter() throws IOException {
        IndexLayout l = layout();
        return cache.get(stream(), l.footerIndex(), l.footerLength(), codec);
    }

    /**
     * number of row id list partitions, the last one may be shorter than the others
     */
    public int rowIdListPartitionCount() throws IOException {
        long partSize = partSize();
        long count = (layout().rowIdListLength() + partSize - 1) / partSize;
        if (count > Integer.MAX_VALUE) {
            throw new IndexFormatException("too many row id list partitions: " + count);
        }
        return (int) count;
    }

    /**
     * read one partition of the row id list, each holds {@link #rowIdListSizePerSection()} int
     * entries except the last one which holds the remainder
     */
    public CachedByteSpan readRowIdListPartition(int partIdx) throws IOException {
        IndexLayout l = layout();
        int partitions = rowIdListPartitionCount();
        if (partIdx < 0 || partIdx >= partitions) {
            throw new IndexOutOfBoundsException("row id list partition " + partIdx + " out of [0, " + partitions + ")");
        }
        long partSize = partSize();
        long readLength = partIdx * partSize + partSize > l.rowIdListLength() ? l.rowIdListLength() % partSize : partSize;
        checkPartLength(readLength, "Size of each row id list partition is too large!");
        return cache.get(stream(), l.rowIdListIndex() + partIdx * partSize, (int) readLength, codec);
    }

    /**
     * Read raw bytes of the row id list at an explicit offset, then hand them to the cache
     * without decompression. Kept for callers addressing the row id list by byte offset,
     * prefer {@link #readRowIdListPartition(int)}.
     */
    public CachedByteSpan readRowIdListPart(int i, int offset, int size) throws IOException {
        IndexLayout l = layout();
        checkRange(offset, size, l.rowIdListLength(), "row id list");
        byte[] bytes = new byte[size];
        IndexFileStream in = stream();
        in.readFully(l.rowIdListIndex() + offset, bytes);
        logger.debug("read row id list part:{}, offset:{}, length:{}", i, l.rowIdListIndex() + offset, size);
        return cache.put(in, l.rowIdListIndex() + offset, bytes);
    }

    /**
     * @deprecated loads the whole row id list in one buffer, use {@link #readRowIdListPartition(int)}
     */
    @Deprecated
    public CachedByteSpan readRowIdListFull() throws IOException {
        IndexLayout l = layout();
        checkPartLength(l.rowIdListLength(), "Row id list is too large to read at once!");
        return cache.get(stream(), l.rowIdListIndex(), (int) l.rowIdListLength(), CodecFactory.NONE);
    }

    /**
     * read size bytes of the node section at offset, relative to the start of the section
     */
    public CachedByteSpan readNode(int offset, int size) throws IOException {
        IndexLayout l = layout();
        checkRange(offset, size, l.nodesLength(), "node section");
        return cache.get(stream(), l.nodesIndex() + offset, size, codec);
    }

    /**
     * Release the underlying stream. Failures are logged as warnings, or ignored while the
     * JVM is shutting down.
     */
    @Override
    public void close() {
        IndexFileStream toClose;
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            toClose = stream;
            stream = null;
        }
        if (toClose == null) {
            return;
        }
        try {
            toClose.close();
        } catch (Exception e) {
            if (!inShutdown.getAsBoolean()) {
                logger.warn("Exception in closing index file {}", file, e);
            }
        }
    }

    private long partSize() {
        return (long) rowIdListSizePerSection * Common.INT_SIZE;
    }

    private static void checkPartLength(long length, String message) {
        if (length > Integer.MAX_VALUE) {
            throw new IndexFormatException(message + " length: " + length);
        }
    }

    private static void checkRange(int offset, int size, long sectionLength, String section) {
        if (offset < 0 || size < 0 || (long) offset + size > sectionLength) {
            throw new IndexOutOfBoundsException(section + " range [" + offset + ", +" + size + ") out of section length " + sectionLength);
        }
    }
}
