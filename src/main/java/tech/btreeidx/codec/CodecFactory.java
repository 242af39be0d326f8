package tech.btreeidx.codec;

import com.github.luben.zstd.Zstd;
import com.github.luben.zstd.ZstdException;
import org.apache.commons.configuration2.Configuration;
import tech.btreeidx.util.Common;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.ByteOrder;
import java.util.Locale;

/**
 * Codecs attached to cached section reads, selected by {@link Common#CONFIG_KEY_COMPRESSION_CODEC}.
 */
public class CodecFactory {
    private static final int ZSTD_MAGIC = 0xFD2FB528;

    public static final CompressionCodec NONE = new CompressionCodec() {
        @Override
        public String name() {
            return "none";
        }

        @Override
        public byte[] decompress(byte[] input) {
            return input;
        }
    };

    //frames must be written with content size, which is zstd's default
    public static final CompressionCodec ZSTD = new CompressionCodec() {
        @Override
        public String name() {
            return "zstd";
        }

        @Override
        public byte[] decompress(byte[] input) throws IOException {
            if (input.length < Integer.BYTES || ByteBuffer.wrap(input).order(ByteOrder.LITTLE_ENDIAN).getInt(0) != ZSTD_MAGIC) {
                throw new IOException("not a zstd frame");
            }
            long size = Zstd.decompressedSize(input);
            if (size < 0 || size > Integer.MAX_VALUE) {
                throw new IOException("invalid zstd content size: " + size);
            }
            if (size == 0) {
                return new byte[0];
            }
            try {
                return Zstd.decompress(input, (int) size);
            } catch (ZstdException e) {
                throw new IOException("fail to decompress zstd frame", e);
            }
        }
    };

    public static CompressionCodec getCodec(Configuration config) {
        return forName(config.getString(Common.CONFIG_KEY_COMPRESSION_CODEC, Common.DEFAULT_COMPRESSION_CODEC));
    }

    public static CompressionCodec forName(String name) {
        switch (name.trim().toLowerCase(Locale.ROOT)) {
            case "none":
            case "":
                return NONE;
            case "zstd":
                return ZSTD;
            default:
                throw new IllegalArgumentException("unsupported compression codec: " + name);
        }
    }
}
