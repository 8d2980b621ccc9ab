/**
 * Rectangular block of cells. Corners are always normalized: start is top-left, end is bottom-right.
 */
public final class CellRange {

    private final int startRow, startCol, endRow, endCol;

    public CellRange(int row1, int col1, int row2, int col2) {
        this.startRow = Math.min(row1, row2);
        this.startCol = Math.min(col1, col2);
        this.endRow = Math.max(row1, row2);
        this.endCol = Math.max(col1, col2);
    }

    public static CellRange of(CellReference from, CellReference to) {
        return new CellRange(from.getRow(), from.getCol(), to.getRow(), to.getCol());
    }

    public int getStartRow() {
        return startRow;
    }

    public int getStartCol() {
        return startCol;
    }

    public int getEndRow() {
        return endRow;
    }

    public int getEndCol() {
        return endCol;
    }

    public boolean isSingleCell() {
        return startRow == endRow && startCol == endCol;
    }

    public boolean isWithin(int rows, int cols) {
        return startRow >= 0 && startCol >= 0 && endRow < rows && endCol < cols;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellRange)) {
            return false;
        }
        CellRange that = (CellRange) o;
        return startRow == that.startRow && startCol == that.startCol
                && endRow == that.endRow && endCol == that.endCol;
    }

    @Override
    public int hashCode() {
        int result = startRow;
        result = 31 * result + startCol;
        result = 31 * result + endRow;
        result = 31 * result + endCol;
        return result;
    }

    @Override
    public String toString() {
        String start = CellReference.buildCellRef(startRow, startCol);
        if (isSingleCell()) {
            return start;
        }
        return start + ":" + CellReference.buildCellRef(endRow, endCol);
    }
}
