/**
 * Grid access for formula evaluation. Supplied by the host for the duration of one call.
 */
public interface CellContext {

    int getRows();

    int getCols();

    /**
     * Numeric value of a cell: 0 for empty, out-of-range, non-numeric or error-bearing cells.
     */
    double getCellValue(int row, int col);

    /**
     * Raw display text of a cell, empty string if there is none.
     */
    String getCellText(int row, int col);

    static CellContext of(String[][] data, int rows, int cols) {
        return new GridCellContext(data, rows, cols);
    }
}
