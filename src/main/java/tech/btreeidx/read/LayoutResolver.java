package tech.btreeidx.read;

import tech.btreeidx.IndexFile;
import tech.btreeidx.IndexFormatException;
import tech.btreeidx.io.IndexFileStream;
import tech.btreeidx.util.Common;

import java.io.IOException;
import java.nio.ByteBuffer;

/**
 * Derives section offsets backwards from the trailer at the end of an index file:
 * <pre>
 * [0, VERSION_LENGTH)                 version header
 * [VERSION_LENGTH, rowIdListIndex)    nodes
 * [rowIdListIndex, footerIndex)       row id list
 * [footerIndex, trailerOffset)        footer
 * [trailerOffset, +8)                 row id list length, int64
 * [trailerOffset + 8, +4)             footer length, int32
 * </pre>
 * Trailer integers use {@link IndexFile#BYTE_ORDER}.
 */
public final class LayoutResolver {
    public static final int FOOTER_LENGTH_SIZE = Common.INT_SIZE;
    public static final int ROW_ID_LIST_LENGTH_SIZE = Common.LONG_SIZE;
    public static final int TRAILER_SIZE = ROW_ID_LIST_LENGTH_SIZE + FOOTER_LENGTH_SIZE;
    public static final long MIN_FILE_LENGTH = IndexFile.VERSION_LENGTH + TRAILER_SIZE;

    private LayoutResolver() {
    }

    public static IndexLayout resolve(IndexFileStream stream) throws IOException {
        long fileLength = stream.length();
        if (fileLength < MIN_FILE_LENGTH) {
            throw new IndexFormatException("index file " + stream.path() + " too short: " + fileLength + " < " + MIN_FILE_LENGTH);
        }
        byte[] trailer = new byte[TRAILER_SIZE];
        stream.readFully(fileLength - TRAILER_SIZE, trailer);
        ByteBuffer buf = ByteBuffer.wrap(trailer).order(IndexFile.BYTE_ORDER);
        long rowIdListLength = buf.getLong(0);
        int footerLength = buf.getInt(ROW_ID_LIST_LENGTH_SIZE);
        return compute(fileLength, rowIdListLength, footerLength);
    }

    /**
     * compute section offsets from the file length and the two trailer fields
     */
    public static IndexLayout compute(long fileLength, long rowIdListLength, int footerLength) {
        if (fileLength < MIN_FILE_LENGTH) {
            throw new IndexFormatException("index file too short: " + fileLength + " < " + MIN_FILE_LENGTH);
        }
        if (rowIdListLength < 0 || footerLength < 0) {
            throw new IndexFormatException("negative section length in trailer, row id list:" + rowIdListLength + ", footer:" + footerLength);
        }
        long nodesIndex = IndexFile.VERSION_LENGTH;
        long footerIndex = fileLength - FOOTER_LENGTH_SIZE - ROW_ID_LIST_LENGTH_SIZE - footerLength;
        long rowIdListIndex = footerIndex - rowIdListLength;
        if (footerIndex < nodesIndex || rowIdListIndex < nodesIndex) {
            throw new IndexFormatException("sections overlap header, file length:" + fileLength
                    + ", row id list:" + rowIdListLength + ", footer:" + footerLength);
        }
        return new IndexLayout(fileLength, nodesIndex, rowIdListIndex, footerIndex, rowIdListLength, footerLength);
    }
}
