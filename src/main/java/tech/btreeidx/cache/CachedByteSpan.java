package tech.btreeidx.cache;

import tech.btreeidx.IndexFile;

import java.nio.ByteBuffer;

/**
 * Immutable bytes of one cached section range, after decompression if a codec was attached.
 * Owned by the {@link SectionCache} that produced it, callers must not hold on to it longer
 * than they need the data.
 */
public final class CachedByteSpan {
    private final long sourceOffset;
    private final byte[] bytes;
    private final ByteBuffer view;

    public CachedByteSpan(long sourceOffset, byte[] bytes) {
        this.sourceOffset = sourceOffset;
        this.bytes = bytes;
        this.view = ByteBuffer.wrap(bytes).order(IndexFile.BYTE_ORDER);
    }

    /**
     * offset in the index file the span was read from
     */
    public long sourceOffset() {
        return sourceOffset;
    }

    public int size() {
        return bytes.length;
    }

    public byte getByte(int index) {
        return bytes[index];
    }

    public int getInt(int index) {
        return view.getInt(index);
    }

    public long getLong(int index) {
        return view.getLong(index);
    }

    public byte[] toByteArray() {
        return bytes.clone();
    }

    public ByteBuffer asReadOnlyBuffer() {
        return view.asReadOnlyBuffer().order(IndexFile.BYTE_ORDER);
    }

    @Override
    public String toString() {
        return "CachedByteSpan{offset=" + sourceOffset + ", size=" + bytes.length + "}";
    }
}
