package latexrecode;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.text.Normalizer;
import java.util.*;

/**
 * One LaTeX macro ⇄ Unicode glyph pairing from the recode data.
 *
 * <p>The macro text is stored without its leading backslash (e.g. {@code "ss"},
 * {@code "="}), the glyph in canonically decomposed form (NFD). Instances are
 * immutable.</p>
 */
public final class MacroDefinition {
    private final RecodeCategory category;
    private final String from;
    private final String to;
    private final boolean preferred;
    private final boolean raw;
    private final Set<String> sets;

    /**
     * Creates a definition. Text values are NFD-normalized; {@code null} text is
     * kept as {@code null} so that {@link #validate()} can report it.
     *
     * @param category  the category; {@code null} if the data named an unknown one
     * @param from      macro text, without backslash
     * @param to        the Unicode glyph
     * @param preferred whether this definition wins on encode for a shared glyph
     * @param raw       whether the encoder emits the macro text bare
     * @param sets      identifiers of the sets this definition belongs to
     */
    @JsonCreator
    public MacroDefinition(@JsonProperty("category") RecodeCategory category,
                           @JsonProperty("from") String from,
                           @JsonProperty("to") String to,
                           @JsonProperty("preferred") boolean preferred,
                           @JsonProperty("raw") boolean raw,
                           @JsonProperty("sets") Collection<String> sets) {
        this.category = category;
        this.from = nfd(from);
        this.to = nfd(to);
        this.preferred = preferred;
        this.raw = raw;
        this.sets = sets == null
                ? Collections.emptySet()
                : Collections.unmodifiableSet(new LinkedHashSet<>(sets));
    }

    private static String nfd(String s) {
        return s == null ? null : Normalizer.normalize(s, Normalizer.Form.NFD);
    }

    @JsonProperty("category")
    public RecodeCategory getCategory() {
        return category;
    }

    @JsonProperty("from")
    public String getFrom() {
        return from;
    }

    @JsonProperty("to")
    public String getTo() {
        return to;
    }

    @JsonProperty("preferred")
    public boolean isPreferred() {
        return preferred;
    }

    @JsonProperty("raw")
    public boolean isRaw() {
        return raw;
    }

    @JsonProperty("sets")
    public Set<String> getSets() {
        return sets;
    }

    /**
     * Whether this definition belongs to the given set.
     *
     * @param setId a set identifier
     * @return {@code true} if {@code setId} is one of {@link #getSets()}
     */
    public boolean isMemberOf(String setId) {
        return sets.contains(setId);
    }

    /**
     * Checks that this definition can be put into a table.
     *
     * @throws RecodeDataException if the category is unknown or the macro or glyph text is missing
     */
    public void validate() {
        if (category == null) {
            throw new RecodeDataException("Unknown category for macro '" + from + "'");
        }
        if (from == null || from.isEmpty()) {
            throw new RecodeDataException("Missing macro text in " + category.asStr() + " definition for glyph '" + to + "'");
        }
        if (to == null || to.isEmpty()) {
            throw new RecodeDataException("Missing glyph in " + category.asStr() + " definition for macro '" + from + "'");
        }
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof MacroDefinition)) return false;
        MacroDefinition that = (MacroDefinition) o;
        return preferred == that.preferred
                && raw == that.raw
                && category == that.category
                && Objects.equals(from, that.from)
                && Objects.equals(to, that.to)
                && sets.equals(that.sets);
    }

    @Override
    public int hashCode() {
        return Objects.hash(category, from, to, preferred, raw, sets);
    }

    @Override
    public String toString() {
        return (category == null ? "?" : category.asStr()) + ":\\" + from + "->" + to
                + (preferred ? " preferred" : "")
                + (raw ? " raw" : "")
                + " " + sets;
    }
}
