import java.util.ArrayList;
import java.util.List;

/**
 * Single forward pass tokenizer for formula body (text after leading '=').
 * Produces flat list of tokens without any nesting, parentheses are separate tokens.
 */
public final class FormulaLexer {

    private FormulaLexer() {
    }

    /**
     * @param body formula text without leading '='
     * @return tokens in source order, empty list for blank body
     * @throws InvalidFormulaException on malformed number or unknown character
     */
    public static List<Token> tokenize(String body) throws InvalidFormulaException {
        List<Token> tokens = new ArrayList<>();
        int len = body.length();
        int i = 0;
        while (i < len) {
            char c = body.charAt(i);

            if (Character.isWhitespace(c)) {
                i++;
                continue;
            }

            if (isDigit(c) || c == '.') {
                int start = i;
                while (i < len && (isDigit(body.charAt(i)) || body.charAt(i) == '.')) {
                    i++;
                }
                String number = body.substring(start, i);
                if (!isWellFormedNumber(number)) {
                    throw new InvalidFormulaException("Invalid number: " + number);
                }
                tokens.add(Token.number(Double.parseDouble(number)));
                continue;
            }

            if (isLetter(c)) {
                int start = i;
                while (i < len && isLetter(body.charAt(i))) {
                    i++;
                }
                int lettersEnd = i;
                while (i < len && isDigit(body.charAt(i))) {
                    i++;
                }
                String word = body.substring(start, i).toUpperCase();
                // Letters glued to digits are always a cell reference, never a function name
                tokens.add(i > lettersEnd ? Token.cellRef(word) : Token.identifier(word));
                continue;
            }

            switch (c) {
                case '+':
                case '-':
                case '*':
                case '/':
                    tokens.add(Token.operator(c));
                    break;
                case ':':
                    tokens.add(Token.COLON);
                    break;
                case '(':
                    tokens.add(Token.LPAREN);
                    break;
                case ')':
                    tokens.add(Token.RPAREN);
                    break;
                default:
                    throw new InvalidFormulaException("Unexpected character: " + c);
            }
            i++;
        }
        return tokens;
    }

    /**
     * Accepts "12", "12.5" and ".5" only.
     */
    static boolean isWellFormedNumber(CharSequence run) {
        int len = run.length();
        int dot = -1;
        for (int i = 0; i < len; i++) {
            if (run.charAt(i) == '.') {
                if (dot >= 0) {
                    return false;
                }
                dot = i;
            }
        }
        if (dot < 0) {
            return len > 0;
        }
        // At least one digit must follow the decimal point
        return dot < len - 1;
    }

    private static boolean isDigit(char c) {
        return c >= '0' && c <= '9';
    }

    private static boolean isLetter(char c) {
        return (c >= 'A' && c <= 'Z') || (c >= 'a' && c <= 'z');
    }
}

enum TokenKind {
    NUMBER, CELL_REF, IDENTIFIER, OPERATOR, COLON, LPAREN, RPAREN
}

/**
 * Lexer output. Tokens live only during one evaluation call.
 * Payload depends on kind: numeric value, uppercase reference/name text or operator character.
 */
final class Token {
    static final Token COLON = new Token(TokenKind.COLON, 0, null);
    static final Token LPAREN = new Token(TokenKind.LPAREN, 0, null);
    static final Token RPAREN = new Token(TokenKind.RPAREN, 0, null);

    private final TokenKind kind;
    private final double number;
    private final String text;

    private Token(TokenKind kind, double number, String text) {
        this.kind = kind;
        this.number = number;
        this.text = text;
    }

    static Token number(double value) {
        return new Token(TokenKind.NUMBER, value, null);
    }

    static Token cellRef(String ref) {
        return new Token(TokenKind.CELL_REF, 0, ref);
    }

    static Token identifier(String name) {
        return new Token(TokenKind.IDENTIFIER, 0, name);
    }

    static Token operator(char op) {
        return new Token(TokenKind.OPERATOR, 0, String.valueOf(op));
    }

    TokenKind getKind() {
        return kind;
    }

    boolean is(TokenKind kind) {
        return this.kind == kind;
    }

    boolean isOperator(char op) {
        return kind == TokenKind.OPERATOR && text.charAt(0) == op;
    }

    double getNumber() {
        return number;
    }

    String getText() {
        return text;
    }

    char getOperator() {
        return text.charAt(0);
    }

    @Override
    public String toString() {
        switch (kind) {
            case NUMBER:
                return Double.toString(number);
            case COLON:
                return ":";
            case LPAREN:
                return "(";
            case RPAREN:
                return ")";
            default:
                return text;
        }
    }
}

class InvalidFormulaException extends IllegalArgumentException {
    public InvalidFormulaException(String message) {
        super(message);
    }
}
