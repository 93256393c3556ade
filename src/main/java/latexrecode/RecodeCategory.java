package latexrecode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.*;

/**
 * The closed set of macro categories understood by the recoder.
 *
 * <p>Each category has its own surrounding LaTeX syntax (for example
 * {@code \not\in} for negated symbols or {@code \ding{33}} for dingbats).
 * The order in which categories are applied differs between the two
 * directions and is fixed by {@link #DECODE_ORDER} and {@link #ENCODE_ORDER}.</p>
 */
public enum RecodeCategory {
    LETTERS,
    DIACRITICS,
    PUNCTUATION,
    SYMBOLS,
    NEGATEDSYMBOLS,
    SUPERSCRIPTS,
    CMDSUPERSCRIPTS,
    DINGS,
    GREEK;

    /**
     * Category passes applied by the decoder, in this exact order.
     */
    public static final List<RecodeCategory> DECODE_ORDER = Collections.unmodifiableList(Arrays.asList(
            GREEK, DINGS, PUNCTUATION, SYMBOLS, NEGATEDSYMBOLS,
            SUPERSCRIPTS, CMDSUPERSCRIPTS, LETTERS, DIACRITICS));

    /**
     * Category passes applied by the encoder, in this exact order.
     */
    public static final List<RecodeCategory> ENCODE_ORDER = Collections.unmodifiableList(Arrays.asList(
            GREEK, DINGS, NEGATEDSYMBOLS, SUPERSCRIPTS, CMDSUPERSCRIPTS,
            DIACRITICS, LETTERS, PUNCTUATION, SYMBOLS));

    private static final Map<String, RecodeCategory> LOOKUP = buildLookup();

    private static Map<String, RecodeCategory> buildLookup() {
        Map<String, RecodeCategory> m = new HashMap<>();
        for (RecodeCategory c : values()) {
            m.put(c.asStr(), c);
        }
        return Collections.unmodifiableMap(m);
    }

    /**
     * Returns the lowercase name used in recode data files (e.g. {@code "negatedsymbols"}).
     *
     * @return the data file name of this category
     */
    @JsonValue
    public String asStr() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a category name, ignoring case and surrounding whitespace.
     *
     * @param value the category name, e.g. {@code "letters"}
     * @return the matching category
     * @throws IllegalArgumentException if {@code value} is {@code null} or unknown
     */
    @JsonCreator
    public static RecodeCategory fromStr(String value) {
        RecodeCategory c = tryParse(value);
        if (c == null) {
            throw new IllegalArgumentException("Unknown recode category: " + value);
        }
        return c;
    }

    /**
     * Tolerant variant of {@link #fromStr(String)}.
     *
     * @param value the category name; may be {@code null}
     * @return the matching category, or {@code null} if none matches
     */
    public static RecodeCategory tryParse(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        if (trimmed.isEmpty()) return null;
        return LOOKUP.get(trimmed.toLowerCase(Locale.ROOT));
    }
}
