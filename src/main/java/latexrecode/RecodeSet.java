package latexrecode;

import java.util.*;

/**
 * The published recoding sets.
 *
 * <p>Set identifiers are data driven, so {@link LatexRecode#initSets(String, String)}
 * accepts any identifier present in the recode data. This enum names the sets
 * shipped with the bundled data file:</p>
 * <ul>
 *   <li><b>null</b> – no conversion at all</li>
 *   <li><b>base</b> – common letters and diacritics, enough for Western languages</li>
 *   <li><b>full</b> – also punctuation, symbols, Greek, dingbats, negated symbols,
 *       superscripts and a wider range of diacritics</li>
 * </ul>
 */
public enum RecodeSet {
    NULL,
    BASE,
    FULL;

    /**
     * Identifier of the virtual set that disables conversion.
     */
    public static final String NULL_ID = "null";

    /**
     * Returns the default set used when none is configured ({@link #BASE}).
     *
     * @return the default recoding set
     */
    public static RecodeSet defaultSet() {
        return BASE;
    }

    /**
     * Returns the identifier of this set as used in recode data files.
     *
     * @return the lowercase identifier, e.g. {@code "base"}
     */
    public String id() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * Parses a set identifier, ignoring case.
     *
     * @param value the identifier, e.g. {@code "full"}
     * @return the matching set
     * @throws IllegalArgumentException if {@code value} is {@code null}, empty or unknown
     */
    public static RecodeSet fromStr(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Recode set cannot be null");
        }
        RecodeSet s = tryParse(value);
        if (s == null) {
            throw new IllegalArgumentException("Unknown recode set: " + value);
        }
        return s;
    }

    /**
     * Tolerant variant of {@link #fromStr(String)}.
     *
     * @param value the identifier; may be {@code null}
     * @return the matching set, or {@code null} if none matches
     */
    public static RecodeSet tryParse(String value) {
        if (value == null) return null;
        String trimmed = value.trim();
        for (RecodeSet s : values()) {
            if (s.id().equalsIgnoreCase(trimmed)) {
                return s;
            }
        }
        return null;
    }

    /**
     * Whether {@code setId} names the virtual null set.
     *
     * @param setId a set identifier; may be {@code null}
     * @return {@code true} if the identifier is {@code "null"} (any case)
     */
    public static boolean isNull(String setId) {
        return setId != null && NULL_ID.equalsIgnoreCase(setId.trim());
    }
}
