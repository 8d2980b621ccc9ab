/**
 * Error sentinels. A failed formula stores sentinel text as its cell value, exactly like a number.
 */
public enum FormulaError {
    /** Division by zero at runtime. */
    DIV_ZERO("#DIV/0!"),
    /** Cell or range outside the grid. */
    REF("#REF!"),
    /** Unknown function or bad function argument. */
    NAME("#NAME?"),
    /** Malformed expression or tokenization failure. */
    ERROR("#ERROR!");

    private final String text;

    FormulaError(String text) {
        this.text = text;
    }

    public String getText() {
        return text;
    }

    @Override
    public String toString() {
        return text;
    }
}

/**
 * Unwinds recursive descent as soon as an error sentinel is known. Never leaves {@link Formula#evaluate}.
 */
class FormulaErrorException extends RuntimeException {
    private final FormulaError error;

    FormulaErrorException(FormulaError error, String message) {
        super(message, null, false, false);
        this.error = error;
    }

    FormulaError getError() {
        return error;
    }
}
