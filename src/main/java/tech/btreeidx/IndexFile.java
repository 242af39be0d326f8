package tech.btreeidx;

import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.nio.charset.StandardCharsets;

/**
 * On-disk format constants of a btree index file.
 * <p>
 * Header is {@link #VERSION_PREFIX} followed by a 16 bit version number. All integers in the
 * header and in the trailer (row id list length, footer length) are stored in {@link #BYTE_ORDER}.
 */
public final class IndexFile {
    public static final String VERSION_PREFIX = "BTRIDX";
    public static final int VERSION_NUM = 1;
    public static final int VERSION_LENGTH = VERSION_PREFIX.length() + Short.BYTES;

    public static final ByteOrder BYTE_ORDER = ByteOrder.LITTLE_ENDIAN;

    private static final byte[] PREFIX_BYTES = VERSION_PREFIX.getBytes(StandardCharsets.US_ASCII);

    private IndexFile() {
    }

    /**
     * parse the version number out of raw header bytes
     *
     * @param header at least {@link #VERSION_LENGTH} bytes read from offset 0
     * @return version number stored in the header
     */
    public static int parseVersionNum(byte[] header) {
        if (header.length < VERSION_LENGTH) {
            throw new IndexFormatException("index header too short: " + header.length);
        }
        for (int i = 0; i < PREFIX_BYTES.length; i++) {
            if (header[i] != PREFIX_BYTES[i]) {
                throw new IndexFormatException("not a btree index file, bad magic");
            }
        }
        return ByteBuffer.wrap(header).order(BYTE_ORDER).getShort(PREFIX_BYTES.length) & 0xFFFF;
    }

    public static void checkVersionNum(int versionNum) {
        if (VERSION_NUM != versionNum) {
            throw new IndexFormatException("Btree Index File version is not compatible! expected " + VERSION_NUM + ", found " + versionNum);
        }
    }
}
