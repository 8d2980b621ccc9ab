import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Zero-based cell coordinates together with conversions to and from spreadsheet "A1" notation.
 * Columns are letters (bijective base-26: A..Z, AA, AB, ...), rows are 1-based numbers in text.
 */
public final class CellReference {

    /**
     * Returned by {@link #lettersToColumn(String)} for text that is not a column name.
     */
    public static final int INVALID_COLUMN = -1;

    private static final Pattern CELL_REF = Pattern.compile("^([A-Z]+)([0-9]+)$", Pattern.CASE_INSENSITIVE);

    private final int row;
    private final int col;

    public CellReference(int row, int col) {
        this.row = row;
        this.col = col;
    }

    public int getRow() {
        return row;
    }

    public int getCol() {
        return col;
    }

    public boolean isWithin(int rows, int cols) {
        return row >= 0 && col >= 0 && row < rows && col < cols;
    }

    /**
     * 0 -> "A", 25 -> "Z", 26 -> "AA", 701 -> "ZZ", 702 -> "AAA".
     */
    public static String columnToLetters(int index) {
        if (index < 0) {
            throw new IllegalArgumentException("Column index must not be negative: " + index);
        }
        StringBuilder letters = new StringBuilder(4);
        long n = index + 1L;
        while (n > 0) {
            int digit = (int) ((n - 1) % 26);
            letters.append((char) ('A' + digit));
            n = (n - 1) / 26;
        }
        return letters.reverse().toString();
    }

    /**
     * Inverse of {@link #columnToLetters(int)}, case-insensitive.
     *
     * @return column index or {@link #INVALID_COLUMN} for empty or non-alphabetic input
     */
    public static int lettersToColumn(String letters) {
        if (letters == null || letters.isEmpty()) {
            return INVALID_COLUMN;
        }
        long col = 0;
        for (int i = 0; i < letters.length(); i++) {
            char c = Character.toUpperCase(letters.charAt(i));
            if (c < 'A' || c > 'Z') {
                return INVALID_COLUMN;
            }
            col = col * 26 + (c - 'A' + 1);
            if (col - 1 > Integer.MAX_VALUE) {
                return INVALID_COLUMN;
            }
        }
        return (int) (col - 1);
    }

    /**
     * "A1" -> (0, 0), "b3" -> (2, 1). Row digits are not required to be in range, "A0" gives row -1.
     *
     * @return parsed reference or null if text does not look like a cell reference
     */
    public static CellReference parseCellRef(String text) {
        if (text == null) {
            return null;
        }
        Matcher m = CELL_REF.matcher(text);
        if (!m.matches()) {
            return null;
        }
        int col = lettersToColumn(m.group(1));
        int row;
        try {
            row = Integer.parseInt(m.group(2)) - 1;
        } catch (NumberFormatException e) {
            // Row number does not fit into int
            return null;
        }
        if (col == INVALID_COLUMN) {
            return null;
        }
        return new CellReference(row, col);
    }

    /**
     * "B5:A1" -> rows 0..4, cols 0..1.
     *
     * @return normalized range or null unless text is exactly two cell references joined by ':'
     */
    public static CellRange parseRange(String text) {
        if (text == null) {
            return null;
        }
        String[] parts = text.split(":", -1);
        if (parts.length != 2) {
            return null;
        }
        CellReference start = parseCellRef(parts[0].trim());
        CellReference end = parseCellRef(parts[1].trim());
        if (start == null || end == null) {
            return null;
        }
        return CellRange.of(start, end);
    }

    public static String buildCellRef(int row, int col) {
        return columnToLetters(col) + (row + 1);
    }

    /**
     * Builds "A1:B5" for any corner order. Range of a single cell is rendered as plain cell reference.
     */
    public static String buildRangeRef(int startRow, int startCol, int endRow, int endCol) {
        return new CellRange(startRow, startCol, endRow, endCol).toString();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof CellReference)) {
            return false;
        }
        CellReference that = (CellReference) o;
        return row == that.row && col == that.col;
    }

    @Override
    public int hashCode() {
        return 31 * row + col;
    }

    @Override
    public String toString() {
        return buildCellRef(row, col);
    }
}
