/**
 * Built-in range functions. Argument is a single cell or a rectangular range.
 */
public enum AggregateFunction {

    SUM("SUM(range)", "Adds numbers in a range") {
        @Override
        protected double aggregate(CellRange range, CellContext context) {
            double sum = 0;
            for (int r = range.getStartRow(); r <= range.getEndRow(); r++) {
                for (int c = range.getStartCol(); c <= range.getEndCol(); c++) {
                    sum += context.getCellValue(r, c);
                }
            }
            return sum;
        }
    },

    AVG("AVG(range)", "Average of numbers in a range") {
        @Override
        protected double aggregate(CellRange range, CellContext context) {
            double sum = 0;
            int count = 0;
            for (int r = range.getStartRow(); r <= range.getEndRow(); r++) {
                for (int c = range.getStartCol(); c <= range.getEndCol(); c++) {
                    // Blank cells do not count, unlike SUM which reads them as zero
                    String text = CellValues.stripTags(context.getCellText(r, c)).trim();
                    if (text.isEmpty()) {
                        continue;
                    }
                    double value = CellValues.parseLeadingNumber(text);
                    if (Double.isNaN(value)) {
                        continue;
                    }
                    sum += value;
                    count++;
                }
            }
            return count == 0 ? 0 : sum / count;
        }
    };

    private final String signature;
    private final String description;

    AggregateFunction(String signature, String description) {
        this.signature = signature;
        this.description = description;
    }

    public String getSignature() {
        return signature;
    }

    public String getDescription() {
        return description;
    }

    /**
     * @param name uppercase function name
     * @return function or null if name is not a built-in
     */
    public static AggregateFunction lookup(String name) {
        for (AggregateFunction function : values()) {
            if (function.name().equals(name)) {
                return function;
            }
        }
        return null;
    }

    /**
     * Range must lie inside the grid, otherwise the whole formula is {@link FormulaError#REF}.
     */
    public double apply(CellRange range, CellContext context) {
        if (!range.isWithin(context.getRows(), context.getCols())) {
            throw new FormulaErrorException(FormulaError.REF, "Range out of grid: " + range);
        }
        return aggregate(range, context);
    }

    protected abstract double aggregate(CellRange range, CellContext context);
}
