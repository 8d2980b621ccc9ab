import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Function name completion for the cell editor: "=S" suggests SUM, "=" suggests everything.
 */
public final class FormulaSuggestions {

    private static final Pattern QUERY = Pattern.compile("^=\\s*([A-Za-z]*)$");

    private FormulaSuggestions() {
    }

    /**
     * @return uppercase name prefix being typed, or null if text is not a bare "=NAME" prefix
     */
    public static String query(String rawValue) {
        if (rawValue == null) {
            return null;
        }
        Matcher m = QUERY.matcher(rawValue);
        return m.matches() ? m.group(1).toUpperCase() : null;
    }

    public static List<AggregateFunction> suggest(String rawValue) {
        String query = query(rawValue);
        List<AggregateFunction> result = new ArrayList<>();
        if (query == null) {
            return result;
        }
        for (AggregateFunction function : AggregateFunction.values()) {
            if (function.name().startsWith(query)) {
                result.add(function);
            }
        }
        return result;
    }
}
