/**
 * {@link CellContext} over a host-owned data matrix. Reads the live matrix, so values written
 * during a recalculation pass are visible to cells evaluated later in the same pass.
 */
public class GridCellContext implements CellContext {

    private final String[][] data;
    private final int rows, cols;

    public GridCellContext(String[][] data, int rows, int cols) {
        this.data = data;
        this.rows = rows;
        this.cols = cols;
    }

    @Override
    public int getRows() {
        return rows;
    }

    @Override
    public int getCols() {
        return cols;
    }

    @Override
    public double getCellValue(int row, int col) {
        return CellValues.toNumber(getCellText(row, col));
    }

    @Override
    public String getCellText(int row, int col) {
        if (row < 0 || col < 0 || row >= rows || col >= cols || row >= data.length) {
            return "";
        }
        String[] line = data[row];
        if (line == null || col >= line.length || line[col] == null) {
            return "";
        }
        return line[col];
    }
}
