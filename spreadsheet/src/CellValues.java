import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Numeric coercion of cell text. Empty, non-numeric and error-bearing cells count as zero
 * when used as operands, errors are never propagated through arithmetic.
 */
public final class CellValues {

    // Leading decimal literal, the remainder of the text is ignored: "12abc" -> 12
    private static final Pattern LEADING_NUMBER =
            Pattern.compile("^[+-]?(?:\\d+\\.?\\d*|\\.\\d+)(?:[eE][+-]?\\d+)?");
    private static final Pattern TAG = Pattern.compile("<[^>]*>");

    private CellValues() {
    }

    /**
     * @return number at the start of text (after leading whitespace) or NaN if there is none
     */
    public static double parseLeadingNumber(String text) {
        if (text == null) {
            return Double.NaN;
        }
        Matcher m = LEADING_NUMBER.matcher(text.trim());
        if (!m.find()) {
            return Double.NaN;
        }
        return Double.parseDouble(m.group());
    }

    public static double toNumber(String text) {
        double value = parseLeadingNumber(text);
        return Double.isNaN(value) ? 0 : value;
    }

    /**
     * Removes markup the editor may leave in cell text ("<b>5</b>" -> "5").
     */
    public static String stripTags(String text) {
        if (text == null) {
            return "";
        }
        return TAG.matcher(text).replaceAll("");
    }
}
