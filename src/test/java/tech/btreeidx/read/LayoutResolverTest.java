package tech.btreeidx.read;

import org.apache.hadoop.fs.Path;
import tech.btreeidx.IndexFile;
import tech.btreeidx.IndexFileFixture;
import tech.btreeidx.IndexFormatException;
import tech.btreeidx.io.MemoryIndexFileStream;

import junit.framework.TestCase;

import java.util.Arrays;

public class LayoutResolverTest extends TestCase {

    public void testComputeOffsets() {
        IndexLayout layout = LayoutResolver.compute(1000, 200, 50);
        assertEquals(938, layout.footerIndex());
        assertEquals(738, layout.rowIdListIndex());
        assertEquals(IndexFile.VERSION_LENGTH, layout.nodesIndex());
        assertEquals(738 - IndexFile.VERSION_LENGTH, layout.nodesLength());
        assertEquals(200, layout.rowIdListLength());
        assertEquals(50, layout.footerLength());
        assertEquals(1000, layout.fileLength());
    }

    public void testEmptySections() {
        IndexLayout layout = LayoutResolver.compute(LayoutResolver.MIN_FILE_LENGTH, 0, 0);
        assertEquals(IndexFile.VERSION_LENGTH, layout.nodesIndex());
        assertEquals(IndexFile.VERSION_LENGTH, layout.rowIdListIndex());
        assertEquals(IndexFile.VERSION_LENGTH, layout.footerIndex());
        assertEquals(0, layout.nodesLength());
    }

    public void testResolveFromTrailer() throws Exception {
        byte[] content = new IndexFileFixture()
                .node(new byte[]{1, 2, 3})
                .rowIds(10, 20, 30)
                .footer(new byte[]{9, 9})
                .build();
        MemoryIndexFileStream stream = new MemoryIndexFileStream(new Path("/idx/a.index"), content);
        IndexLayout layout = LayoutResolver.resolve(stream);

        assertEquals(1, stream.reads.get());
        assertEquals(content.length, layout.fileLength());
        assertEquals(IndexFile.VERSION_LENGTH, layout.nodesIndex());
        assertEquals(3, layout.nodesLength());
        assertEquals(IndexFile.VERSION_LENGTH + 3, layout.rowIdListIndex());
        assertEquals(12, layout.rowIdListLength());
        assertEquals(IndexFile.VERSION_LENGTH + 3 + 12, layout.footerIndex());
        assertEquals(2, layout.footerLength());
        assertTrue(layout.footerIndex() + layout.footerLength() <= layout.fileLength() - LayoutResolver.TRAILER_SIZE);
    }

    public void testFileTooShort() throws Exception {
        for (int len = 0; len < LayoutResolver.MIN_FILE_LENGTH; len++) {
            MemoryIndexFileStream stream = new MemoryIndexFileStream(new Path("/idx/short.index"), new byte[len]);
            try {
                LayoutResolver.resolve(stream);
                fail("file of " + len + " bytes should be rejected");
            } catch (IndexFormatException e) {
                assertEquals(0, stream.reads.get());
            }
        }
    }

    public void testInconsistentTrailer() throws Exception {
        byte[] content = new IndexFileFixture().rowIds(1, 2).footer(new byte[4]).build();
        // row id list claims more bytes than the file holds
        byte[] trailer = IndexFileFixture.trailer(content.length, 4);
        System.arraycopy(trailer, 0, content, content.length - trailer.length, trailer.length);
        try {
            LayoutResolver.resolve(new MemoryIndexFileStream(new Path("/idx/bad.index"), content));
            fail("overlapping sections should be rejected");
        } catch (IndexFormatException e) {
            // expected
        }

        try {
            LayoutResolver.compute(100, -1, 0);
            fail("negative row id list length should be rejected");
        } catch (IndexFormatException e) {
            // expected
        }
        try {
            LayoutResolver.compute(100, 0, -5);
            fail("negative footer length should be rejected");
        } catch (IndexFormatException e) {
            // expected
        }
    }

    public void testOffsetsOrdered() {
        for (long fileLength : Arrays.asList(20L, 100L, 4096L, 1L << 40)) {
            long room = fileLength - LayoutResolver.MIN_FILE_LENGTH;
            for (long rowIds : Arrays.asList(0L, room / 3, room / 2)) {
                int footer = (int) Math.min(Integer.MAX_VALUE, room - rowIds);
                IndexLayout layout = LayoutResolver.compute(fileLength, rowIds, footer);
                assertTrue(layout.nodesIndex() <= layout.rowIdListIndex());
                assertTrue(layout.rowIdListIndex() <= layout.footerIndex());
                assertTrue(layout.footerIndex() <= fileLength - LayoutResolver.TRAILER_SIZE);
            }
        }
    }
}
