package tech.btreeidx.io;

import org.apache.hadoop.fs.Path;

import java.io.Closeable;
import java.io.IOException;

/**
 * Random access handle on one index file. Implementations are not required to support
 * concurrent reads.
 */
public interface IndexFileStream extends Closeable {
    Path path();

    long length();

    /**
     * read exactly buffer.length bytes starting at position
     *
     * @throws java.io.EOFException if the file ends before the buffer is filled
     */
    void readFully(long position, byte[] buffer) throws IOException;

    interface Opener {
        IndexFileStream open() throws IOException;
    }
}
