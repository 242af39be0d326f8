package tech.btreeidx.read;

/**
 * Resolved section offsets of one index file, all absolute file positions.
 */
public final class IndexLayout {
    private final long fileLength;
    private final long nodesIndex;
    private final long rowIdListIndex;
    private final long footerIndex;
    private final long rowIdListLength;
    private final int footerLength;

    IndexLayout(long fileLength, long nodesIndex, long rowIdListIndex, long footerIndex, long rowIdListLength, int footerLength) {
        this.fileLength = fileLength;
        this.nodesIndex = nodesIndex;
        this.rowIdListIndex = rowIdListIndex;
        this.footerIndex = footerIndex;
        this.rowIdListLength = rowIdListLength;
        this.footerLength = footerLength;
    }

    public long fileLength() {
        return fileLength;
    }

    public long nodesIndex() {
        return nodesIndex;
    }

    public long nodesLength() {
        return rowIdListIndex - nodesIndex;
    }

    public long rowIdListIndex() {
        return rowIdListIndex;
    }

    public long rowIdListLength() {
        return rowIdListLength;
    }

    public long footerIndex() {
        return footerIndex;
    }

    public int footerLength() {
        return footerLength;
    }

    @Override
    public String toString() {
        return "IndexLayout{fileLength=" + fileLength +
                ", nodesIndex=" + nodesIndex +
                ", rowIdListIndex=" + rowIdListIndex +
                ", rowIdListLength=" + rowIdListLength +
                ", footerIndex=" + footerIndex +
                ", footerLength=" + footerLength + "}";
    }
}
