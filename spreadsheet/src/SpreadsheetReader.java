import java.util.Iterator;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Read Spreadsheet data from formatted string input stream.
 * Sample usage:
 * // 1. Init reader by header of spreadsheet of 3 columns and 2 rows.
 * SpreadsheetReader reader = new SpreadsheetReader("3 2", SpreadsheetConfig.defaults());
 * // 2. Pass cell texts row by row, formulas start with '='
 * spreadsheet = reader.build(Stream.of("1", "2", "=A1+B1", "4", "5", "=SUM(A2:B2)").iterator());
 */
public class SpreadsheetReader {
    public static final Pattern REGEX_HEADER = Pattern.compile("^(?<width>\\d+)\\s+(?<height>\\d+)$");

    private final int width, height;
    private final SpreadsheetConfig config;

    public SpreadsheetReader(String header) {
        this(header, SpreadsheetConfig.defaults());
    }

    public SpreadsheetReader(String header, SpreadsheetConfig config) {
        Matcher m = REGEX_HEADER.matcher(header.trim());
        if (!m.find()) {
            throw new IllegalArgumentException(String.format(
                    "Invalid spreadsheet header format: %s", header));
        }
        try {
            this.width = Integer.parseInt(m.group("width"));
            this.height = Integer.parseInt(m.group("height"));
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(String.format(
                    "Invalid spreadsheet header format: %s", header), e);
        }
        this.config = config;
    }

    public int getWidth() {
        return width;
    }

    public int getHeight() {
        return height;
    }

    public SpreadsheetConfig getConfig() {
        return config;
    }

    public Spreadsheet build(Iterator<String> lineIterator) {
        Spreadsheet spreadsheet = new Spreadsheet(this);
        int cellNumber = 0, size = this.width * this.height;

        while (lineIterator.hasNext() && cellNumber < size) {
            String text = lineIterator.next();
            spreadsheet.setCell(cellNumber / this.width, cellNumber % this.width, text);
            cellNumber++;
        }
        if (cellNumber != size) {
            throw new IllegalArgumentException(String.format(
                    "Input table is of incorrect size. Must be: %d cells, but got: %d",
                    size, cellNumber));
        }
        return spreadsheet;
    }
}
