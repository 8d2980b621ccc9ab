import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.function.DoubleBinaryOperator;

/**
 * Spreadsheet formula evaluator.
 * Formula is parsed by recursive descent directly over lexer tokens and calculated during parsing,
 * no expression tree is built. Grammar, lowest precedence first:
 * <pre>
 * expr     := term (("+"|"-") term)*
 * term     := factor (("*"|"/") factor)*
 * factor   := ["+"|"-"] factor | NUMBER | CELL_REF | call | "(" expr ")"
 * call     := IDENTIFIER "(" argrange ")"
 * argrange := CELL_REF [":" CELL_REF]
 * </pre>
 * Any failure is reported as one of {@link FormulaError} sentinels, never as exception.
 */
public final class Formula {

    private Formula() {
    }

    /**
     * Evaluate formula text to cell display value.
     *
     * @param formula cell text, formulas start with '='. Other text is returned unchanged.
     * @param context grid to resolve references against
     * @return formatted number or error sentinel
     */
    public static String evaluate(String formula, CellContext context) {
        if (formula == null || !formula.startsWith("=")) {
            return formula;
        }
        List<Token> tokens;
        try {
            tokens = FormulaLexer.tokenize(formula.substring(1).trim());
        } catch (InvalidFormulaException e) {
            return FormulaError.ERROR.getText();
        }
        if (tokens.isEmpty()) {
            return FormulaError.ERROR.getText();
        }
        try {
            return format(evaluateTokens(tokens, context));
        } catch (FormulaErrorException e) {
            return e.getError().getText();
        }
    }

    /**
     * Calculate complete token stream.
     *
     * @throws FormulaErrorException with the sentinel of the first failure met
     */
    static double evaluateTokens(List<Token> tokens, CellContext context) {
        return new Parser(tokens, context).parseFormula();
    }

    /**
     * Parse without resolving references and without runtime checks.
     *
     * @throws FormulaErrorException if tokens do not form a formula or name unknown function
     */
    static void checkSyntax(List<Token> tokens) {
        new Parser(tokens, null).parseFormula();
    }

    /**
     * Integers are rendered without fraction, other values are rounded to 10 decimal digits
     * to hide floating point artifacts like 0.1 + 0.2 = 0.30000000000000004.
     */
    static String format(double value) {
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            return FormulaError.ERROR.getText();
        }
        BigDecimal decimal = BigDecimal.valueOf(value);
        if (value == Math.rint(value)) {
            return decimal.toBigInteger().toString();
        }
        // Ties go towards positive infinity for both signs
        BigDecimal rounded = decimal.setScale(10, value < 0 ? RoundingMode.HALF_DOWN : RoundingMode.HALF_UP);
        if (rounded.signum() == 0) {
            return "0";
        }
        return rounded.stripTrailingZeros().toPlainString();
    }

    /**
     * One-shot recursive descent state: token cursor plus grid. Null context means syntax check only.
     */
    private static final class Parser {
        // Unary signs plus open parentheses allowed on the descent stack
        static final int MAX_NESTING = 1000;

        private final List<Token> tokens;
        private final CellContext context;
        private int pos;
        private int nesting;

        Parser(List<Token> tokens, CellContext context) {
            this.tokens = tokens;
            this.context = context;
        }

        double parseFormula() {
            double value = parseExpr();
            if (pos < tokens.size()) {
                throw error(FormulaError.ERROR, "Unexpected token: " + peek());
            }
            return value;
        }

        private double parseExpr() {
            double left = parseTerm();
            while (peekOperator('+') || peekOperator('-')) {
                Operator op = Operator.parse(consume().getOperator());
                double right = parseTerm();
                left = op.calc(left, right);
            }
            return left;
        }

        private double parseTerm() {
            double left = parseFactor();
            while (peekOperator('*') || peekOperator('/')) {
                Operator op = Operator.parse(consume().getOperator());
                double right = parseFactor();
                if (op == Operator.DIVIDE && right == 0 && context != null) {
                    throw error(FormulaError.DIV_ZERO, "Division by zero");
                }
                left = op.calc(left, right);
            }
            return left;
        }

        private double parseFactor() {
            Token token = peek();
            if (token == null) {
                throw error(FormulaError.ERROR, "Unexpected end of formula");
            }
            switch (token.getKind()) {
                case OPERATOR:
                    if (token.isOperator('-') || token.isOperator('+')) {
                        consume();
                        enterNested();
                        double operand = parseFactor();
                        nesting--;
                        return token.isOperator('-') ? -operand : operand;
                    }
                    throw error(FormulaError.ERROR, "Unexpected operator: " + token);

                case NUMBER:
                    consume();
                    return token.getNumber();

                case CELL_REF:
                    consume();
                    return resolveCell(token.getText());

                case IDENTIFIER:
                    consume();
                    return parseCall(token.getText());

                case LPAREN:
                    consume();
                    enterNested();
                    double value = parseExpr();
                    expect(TokenKind.RPAREN, FormulaError.ERROR);
                    nesting--;
                    return value;

                default:
                    throw error(FormulaError.ERROR, "Unexpected token: " + token);
            }
        }

        private void enterNested() {
            if (++nesting > MAX_NESTING) {
                throw error(FormulaError.ERROR, "Formula nested too deeply");
            }
        }

        private double resolveCell(String ref) {
            CellReference cell = CellReference.parseCellRef(ref);
            if (cell == null) {
                throw error(FormulaError.REF, "Invalid cell reference: " + ref);
            }
            if (context == null) {
                return 0;
            }
            if (!cell.isWithin(context.getRows(), context.getCols())) {
                throw error(FormulaError.REF, "Cell out of grid: " + ref);
            }
            return context.getCellValue(cell.getRow(), cell.getCol());
        }

        private double parseCall(String name) {
            AggregateFunction function = AggregateFunction.lookup(name);
            if (function == null) {
                throw error(FormulaError.NAME, "Unknown function: " + name);
            }
            expect(TokenKind.LPAREN, FormulaError.ERROR);
            CellReference start = expectCellRef();
            CellReference end = start;
            if (peekKind(TokenKind.COLON)) {
                consume();
                end = expectCellRef();
            }
            expect(TokenKind.RPAREN, FormulaError.ERROR);

            if (context == null) {
                return 0;
            }
            return function.apply(CellRange.of(start, end), context);
        }

        private CellReference expectCellRef() {
            Token token = expect(TokenKind.CELL_REF, FormulaError.NAME);
            CellReference cell = CellReference.parseCellRef(token.getText());
            if (cell == null) {
                throw error(FormulaError.NAME, "Invalid function argument: " + token);
            }
            return cell;
        }

        private Token expect(TokenKind kind, FormulaError onMismatch) {
            if (!peekKind(kind)) {
                Token token = peek();
                throw error(onMismatch, "Expected " + kind + " but got " + (token == null ? "end of formula" : token));
            }
            return consume();
        }

        private Token peek() {
            return pos < tokens.size() ? tokens.get(pos) : null;
        }

        private boolean peekKind(TokenKind kind) {
            Token token = peek();
            return token != null && token.is(kind);
        }

        private boolean peekOperator(char op) {
            Token token = peek();
            return token != null && token.isOperator(op);
        }

        private Token consume() {
            return tokens.get(pos++);
        }

        private static FormulaErrorException error(FormulaError error, String message) {
            return new FormulaErrorException(error, message);
        }
    }
}

enum Operator {
    PLUS('+', (left, right) -> left + right),
    MINUS('-', (left, right) -> left - right),
    MULTIPLY('*', (left, right) -> left * right),
    DIVIDE('/', (left, right) -> left / right);

    private static final Map<Character, Operator> opMap = new HashMap<>();

    static {
        for (Operator op : values()) {
            opMap.put(op.opChar, op);
        }
    }

    public static Operator parse(char opChar) {
        Operator op = opMap.get(opChar);
        if (op == null) {
            throw new IllegalArgumentException("Invalid operator: " + opChar);
        }
        return op;
    }

    private final char opChar;
    private final DoubleBinaryOperator opFunc;

    Operator(char opChar, DoubleBinaryOperator opFunc) {
        this.opChar = opChar;
        this.opFunc = opFunc;
    }

    public double calc(double left, double right) {
        return opFunc.applyAsDouble(left, right);
    }
}
