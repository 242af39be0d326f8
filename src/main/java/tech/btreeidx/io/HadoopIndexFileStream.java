package tech.btreeidx.io;

import org.apache.hadoop.conf.Configuration;
import org.apache.hadoop.fs.FSDataInputStream;
import org.apache.hadoop.fs.FileSystem;
import org.apache.hadoop.fs.Path;

import java.io.IOException;

public class HadoopIndexFileStream implements IndexFileStream {
    private final Path path;
    private final FSDataInputStream in;
    private final long length;

    HadoopIndexFileStream(Path path, FSDataInputStream in, long length) {
        this.path = path;
        this.in = in;
        this.length = length;
    }

    public static HadoopIndexFileStream open(Path path) throws IOException {
        return open(path.getFileSystem(new Configuration()), path);
    }

    public static HadoopIndexFileStream open(FileSystem fs, Path path) throws IOException {
        FSDataInputStream in = fs.open(path);
        try {
            return new HadoopIndexFileStream(path, in, fs.getFileStatus(path).getLen());
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    @Override
    public Path path() {
        return path;
    }

    @Override
    public long length() {
        return length;
    }

    @Override
    public void readFully(long position, byte[] buffer) throws IOException {
        in.readFully(position, buffer);
    }

    @Override
    public void close() throws IOException {
        in.close();
    }
}
