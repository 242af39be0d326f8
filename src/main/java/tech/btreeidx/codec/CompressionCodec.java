package tech.btreeidx.codec;

import java.io.IOException;

public interface CompressionCodec {
    String name();

    byte[] decompress(byte[] input) throws IOException;
}
