import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.*;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;

/**
 * Spreadsheet grid: display values plus formulas of every cell.
 * Owns both matrices and passes them to {@link RecalculationScheduler} on every recalculation.
 */
public class Spreadsheet {
    private static final Logger LOG = LoggerFactory.getLogger(Spreadsheet.class);

    private final SpreadsheetConfig config;
    private final RecalculationScheduler scheduler = new RecalculationScheduler();

    private String[][] data;
    private String[][] formulas;
    private int rows, cols;

    public Spreadsheet(SpreadsheetReader reader) {
        this(reader.getHeight(), reader.getWidth(), reader.getConfig());
    }

    public Spreadsheet(SpreadsheetConfig config) {
        this(config.getDefaultRows(), config.getDefaultCols(), config);
    }

    public Spreadsheet(int rows, int cols, SpreadsheetConfig config) {
        this.config = config;
        checkDimensions(rows, cols);
        this.rows = rows;
        this.cols = cols;
        this.data = createEmpty(rows, cols);
        this.formulas = createEmpty(rows, cols);
    }

    public int getRows() {
        return rows;
    }

    public int getCols() {
        return cols;
    }

    public RecalculationScheduler.State getState() {
        return scheduler.getState();
    }

    public String getValue(int row, int col) {
        checkCell(row, col);
        return data[row][col];
    }

    /**
     * @return formula text or empty string for plain cells
     */
    public String getFormula(int row, int col) {
        checkCell(row, col);
        return formulas[row][col];
    }

    /**
     * Store text typed or imported into a cell. Text starting with '=' becomes a live formula only if it
     * passes {@link FormulaValidator}; rejected formula text is kept as plain text.
     *
     * @return true if the cell now holds a formula
     */
    public boolean setCell(int row, int col, String text) {
        checkCell(row, col);
        String value = text == null ? "" : text;
        boolean formula = value.startsWith("=") && FormulaValidator.isValidFormula(value);
        if (value.startsWith("=") && !formula) {
            LOG.debug("Rejected formula in {}: {}", getCellName(row, col), value);
        }
        formulas[row][col] = formula ? value : "";
        data[row][col] = value;
        scheduler.markDirty();
        return formula;
    }

    public void clearCell(int row, int col) {
        checkCell(row, col);
        formulas[row][col] = "";
        data[row][col] = "";
        scheduler.markDirty();
    }

    /**
     * Change grid size keeping the overlapping top-left block. Cells outside the new size are dropped.
     */
    public void resize(int newRows, int newCols) {
        checkDimensions(newRows, newCols);
        String[][] newData = createEmpty(newRows, newCols);
        String[][] newFormulas = createEmpty(newRows, newCols);
        for (int r = 0; r < Math.min(rows, newRows); r++) {
            for (int c = 0; c < Math.min(cols, newCols); c++) {
                newData[r][c] = data[r][c];
                newFormulas[r][c] = formulas[r][c];
            }
        }
        LOG.debug("Grid resized from {}x{} to {}x{}", rows, cols, newRows, newCols);
        this.data = newData;
        this.formulas = newFormulas;
        this.rows = newRows;
        this.cols = newCols;
        scheduler.markDirty();
    }

    public RecalculationScheduler.RecalculationResult recalculate() {
        return scheduler.recalculate(formulas, data, rows, cols);
    }

    /**
     * Convenience method returns cell reference in spreadsheet format.
     * (0, 0) -> "A1", (1, 0) -> "A2", (0, 1) -> "B1" and so on.
     */
    public static String getCellName(int row, int column) {
        return CellReference.buildCellRef(row, column);
    }

    private void checkDimensions(int rows, int cols) {
        if (rows < 1 || cols < 1 || rows > config.getMaxRows() || cols > config.getMaxCols()) {
            throw new IllegalArgumentException(String.format(
                    "Grid size %d x %d is outside limits 1..%d x 1..%d",
                    rows, cols, config.getMaxRows(), config.getMaxCols()));
        }
    }

    private void checkCell(int row, int col) {
        if (row < 0 || col < 0 || row >= rows || col >= cols) {
            throw new IndexOutOfBoundsException(String.format(
                    "Cell (%d, %d) is outside %d x %d grid", row, col, rows, cols));
        }
    }

    private static String[][] createEmpty(int rows, int cols) {
        String[][] matrix = new String[rows][cols];
        for (String[] line : matrix) {
            Arrays.fill(line, "");
        }
        return matrix;
    }

    /**
     * Builds spreadsheet from header line {@code "<cols> <rows>"} followed by row-major cell lines.
     *
     * @throws IllegalArgumentException if input is empty or does not match header
     */
    static Spreadsheet read(BufferedReader input, SpreadsheetConfig config) throws IOException {
        String header = input.readLine();
        if (header == null) {
            throw new IllegalArgumentException("Missing header \"<cols> <rows>\"");
        }
        SpreadsheetReader reader = new SpreadsheetReader(header, config);
        return reader.build(input.lines().iterator());
    }

    private static InputStream openInput(String[] args) throws IOException {
        for (String arg : args) {
            if (!arg.startsWith("--")) {
                return new FileInputStream(arg);
            }
        }
        return System.in;
    }

    public static void main(String[] args) throws IOException {
        // 0. Read sheet file from first plain argument, stdin otherwise
        SpreadsheetConfig config = SpreadsheetConfig.load(args, SpreadsheetConfig.DEFAULT_RESOURCE);

        // 1. Build spreadsheet
        Spreadsheet spreadsheet;
        try (BufferedReader input = new BufferedReader(new InputStreamReader(openInput(args), StandardCharsets.UTF_8))) {
            spreadsheet = read(input, config);
        } catch (IllegalArgumentException e) {
            LOG.error("Invalid spreadsheet input: {}", e.getMessage());
            System.exit(-1);
            return;
        }

        // 2. Calculate and output cells
        RecalculationScheduler.RecalculationResult result = spreadsheet.recalculate();
        LOG.info("Recalculated {}x{} grid: {}", spreadsheet.getRows(), spreadsheet.getCols(), result);

        PrintStream out = new PrintStream(new BufferedOutputStream(System.out, 64000), false, "UTF-8");
        out.println(String.format("%d %d", spreadsheet.getCols(), spreadsheet.getRows()));
        for (int r = 0; r < spreadsheet.getRows(); r++) {
            for (int c = 0; c < spreadsheet.getCols(); c++) {
                out.println(spreadsheet.getValue(r, c));
            }
        }
        out.flush();
    }
}
