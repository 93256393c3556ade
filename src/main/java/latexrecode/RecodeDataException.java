package latexrecode;

/**
 * Raised for malformed recode data: an ill-formed macro definition, or a data
 * file that cannot be read or parsed.
 */
public class RecodeDataException extends RuntimeException {

    public RecodeDataException(String message) {
        super(message);
    }

    public RecodeDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
