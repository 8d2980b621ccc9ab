import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Recalculates all formula cells of a grid until values stop changing.
 * <p>
 * There is no dependency graph: every pass evaluates every formula, top to bottom and left to right,
 * against the live data matrix. Values written earlier in a pass are visible to later cells, so a chain
 * ordered like the sweep settles in one pass and any acyclic chain settles in at most depth + 1 passes.
 * The number of passes is capped by the cell count. A circular reference that never settles simply
 * exhausts the cap and leaves the last computed values in place.
 * <p>
 * NOT THREAD-SAFE. The host must serialize edits and recalculations of one grid.
 */
public class RecalculationScheduler {
    private static final Logger LOG = LoggerFactory.getLogger(RecalculationScheduler.class);

    public enum State {
        IDLE, CONVERGING
    }

    private State state = State.IDLE;

    public State getState() {
        return state;
    }

    /**
     * Formula matrix was written or grid was resized; values may be stale until next recalculation.
     */
    public void markDirty() {
        state = State.CONVERGING;
    }

    /**
     * Run passes in place over host matrices.
     *
     * @param formulas formula text per cell, null or empty for plain cells
     * @param data     display values, formula cells receive their results here
     */
    public RecalculationResult recalculate(String[][] formulas, String[][] data, int rows, int cols) {
        state = State.CONVERGING;
        CellContext context = new GridCellContext(data, rows, cols);
        int maxPasses = rows * cols;
        int passes = 0, writes = 0;
        boolean converged = false;

        while (passes < maxPasses) {
            passes++;
            int changed = sweep(formulas, data, rows, cols, context);
            writes += changed;
            if (changed == 0) {
                converged = true;
                break;
            }
        }

        if (converged) {
            LOG.debug("Recalculation of {}x{} grid converged after {} passes, {} cells written",
                    rows, cols, passes, writes);
        } else {
            LOG.warn("Recalculation of {}x{} grid did not converge in {} passes, possible circular reference",
                    rows, cols, maxPasses);
        }
        state = State.IDLE;
        return new RecalculationResult(passes, writes, converged);
    }

    /**
     * @return number of cells whose value changed
     */
    private int sweep(String[][] formulas, String[][] data, int rows, int cols, CellContext context) {
        int changed = 0;
        for (int r = 0; r < rows; r++) {
            for (int c = 0; c < cols; c++) {
                String formula = formulas[r][c];
                if (formula == null || formula.isEmpty() || FormulaValidator.isVisualFormula(formula)) {
                    continue;
                }
                String value = Formula.evaluate(formula, context);
                if (!value.equals(data[r][c])) {
                    data[r][c] = value;
                    changed++;
                }
            }
        }
        return changed;
    }

    /**
     * Outcome of one {@link #recalculate} call.
     */
    public static class RecalculationResult {
        private final int passes;
        private final int cellsWritten;
        private final boolean converged;

        public RecalculationResult(int passes, int cellsWritten, boolean converged) {
            this.passes = passes;
            this.cellsWritten = cellsWritten;
            this.converged = converged;
        }

        public int getPasses() {
            return passes;
        }

        public int getCellsWritten() {
            return cellsWritten;
        }

        /**
         * False only if the pass cap was reached while values were still changing.
         */
        public boolean isConverged() {
            return converged;
        }

        @Override
        public String toString() {
            return String.format("passes=%d, written=%d, converged=%b", passes, cellsWritten, converged);
        }
    }
}
