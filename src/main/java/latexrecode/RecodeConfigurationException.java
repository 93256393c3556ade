package latexrecode;

/**
 * Raised when a requested recode set cannot produce a table, either because
 * the data set is empty or because no definition belongs to the set.
 *
 * <p>{@link LatexRecode} treats this as non-fatal and falls back to identity
 * behavior for the affected direction.</p>
 */
public class RecodeConfigurationException extends RuntimeException {

    public RecodeConfigurationException(String message) {
        super(message);
    }
}
