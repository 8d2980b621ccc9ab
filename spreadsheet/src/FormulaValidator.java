import java.util.Arrays;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Whitelist gate for text that is about to be stored as a live formula (typed edit, import, decoded state).
 * Uses the same lexer and parser as {@link Formula} so both always agree on what a formula is.
 */
public final class FormulaValidator {

    /**
     * Formulas drawn by the grid renderer (progress bars, tags, ratings). Their arguments are not
     * interpreted here.
     */
    public static final Set<String> VISUAL_FUNCTIONS =
            Collections.unmodifiableSet(new HashSet<>(Arrays.asList("PROGRESS", "TAG", "RATING")));

    private static final Pattern VISUAL_FORMULA =
            Pattern.compile("^=\\s*([A-Za-z]+)\\s*\\((.*)\\)\\s*$", Pattern.DOTALL);

    private FormulaValidator() {
    }

    public static boolean isValidFormula(String text) {
        if (text == null || !text.startsWith("=")) {
            return false;
        }
        if (isVisualFormula(text)) {
            return true;
        }
        String body = text.substring(1).trim();
        if (body.isEmpty()) {
            return false;
        }

        List<Token> tokens;
        try {
            tokens = FormulaLexer.tokenize(body);
        } catch (InvalidFormulaException e) {
            return false;
        }
        if (tokens.isEmpty() || !hasBalancedParentheses(tokens)) {
            return false;
        }
        try {
            Formula.checkSyntax(tokens);
        } catch (FormulaErrorException e) {
            return false;
        }
        return true;
    }

    public static boolean isVisualFormula(String text) {
        if (text == null) {
            return false;
        }
        Matcher m = VISUAL_FORMULA.matcher(text);
        return m.matches() && VISUAL_FUNCTIONS.contains(m.group(1).toUpperCase());
    }

    static boolean hasBalancedParentheses(List<Token> tokens) {
        int depth = 0;
        for (Token token : tokens) {
            if (token.is(TokenKind.LPAREN)) {
                depth++;
            } else if (token.is(TokenKind.RPAREN)) {
                depth--;
                if (depth < 0) {
                    return false;
                }
            }
        }
        return depth == 0;
    }
}
