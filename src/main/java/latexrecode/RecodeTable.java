package latexrecode;

import java.util.*;
import java.util.regex.Pattern;

/**
 * Lookup tables for one recoding direction, one {@link CategoryTable} per category.
 *
 * <p>Decode tables are keyed by macro text (without backslash) and map to glyphs;
 * encode tables are keyed by glyph and map to macro text. All keys are NFD.
 * Tables are immutable once built and safe to share between threads.</p>
 */
public final class RecodeTable {

    /**
     * Recoding direction.
     */
    public enum Direction {
        /**
         * LaTeX → Unicode.
         */
        DECODE,
        /**
         * Unicode → LaTeX.
         */
        ENCODE
    }

    private final Direction direction;
    private final String setId;
    private final Map<RecodeCategory, CategoryTable> categories;

    RecodeTable(Direction direction, String setId, Map<RecodeCategory, CategoryTable> categories) {
        this.direction = direction;
        this.setId = setId;
        EnumMap<RecodeCategory, CategoryTable> m = new EnumMap<>(RecodeCategory.class);
        m.putAll(categories);
        this.categories = Collections.unmodifiableMap(m);
    }

    /**
     * Creates a table that converts nothing.
     *
     * @param direction the direction
     * @param setId     the set identifier this table stands in for
     * @return an empty table
     */
    public static RecodeTable identity(Direction direction, String setId) {
        return new RecodeTable(direction, setId, Collections.emptyMap());
    }

    public Direction getDirection() {
        return direction;
    }

    public String getSetId() {
        return setId;
    }

    /**
     * Whether this table converts nothing, either because the null set was chosen
     * or because no category has any entry.
     *
     * @return {@code true} if recoding in this direction is the identity
     */
    public boolean isIdentity() {
        return RecodeSet.isNull(setId) || categories.isEmpty();
    }

    /**
     * Returns the table for a category.
     *
     * @param category the category
     * @return the category table, or {@code null} if the category has no entries in this set
     */
    public CategoryTable get(RecodeCategory category) {
        return categories.get(category);
    }

    /**
     * Returns the categories that have entries, in declaration order.
     *
     * @return the populated categories
     */
    public Set<RecodeCategory> categories() {
        return categories.keySet();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder("<RecodeTable ")
                .append(direction.name().toLowerCase(Locale.ROOT))
                .append(" set=").append(setId);
        for (Map.Entry<RecodeCategory, CategoryTable> e : categories.entrySet()) {
            sb.append(' ').append(e.getKey().asStr()).append('=').append(e.getValue().size());
        }
        return sb.append('>').toString();
    }

    /**
     * Mapping and compiled alternation pattern for one category.
     */
    public static final class CategoryTable {
        /**
         * Orders keys longest first so that no key is shadowed by one of its prefixes;
         * equal lengths fall back to natural order for a stable pattern.
         */
        static final Comparator<String> LONGEST_FIRST =
                Comparator.comparingInt(String::length).reversed().thenComparing(Comparator.naturalOrder());

        private final Map<String, String> mapping;
        private final Set<String> rawKeys;
        private final List<String> keys;
        private final String alternation;
        private final Pattern pattern;

        CategoryTable(Map<String, String> mapping, Set<String> rawKeys) {
            this.mapping = Collections.unmodifiableMap(new HashMap<>(mapping));
            this.rawKeys = Collections.unmodifiableSet(new HashSet<>(rawKeys));

            List<String> sorted = new ArrayList<>(mapping.keySet());
            sorted.sort(LONGEST_FIRST);
            this.keys = Collections.unmodifiableList(sorted);

            StringJoiner alt = new StringJoiner("|", "(?:", ")");
            for (String k : sorted) {
                alt.add(Pattern.quote(k));
            }
            this.alternation = alt.toString();
            this.pattern = Pattern.compile(alternation);
        }

        /**
         * Looks up the replacement for a key.
         *
         * @param key a macro name (decode) or glyph (encode)
         * @return the replacement, or {@code null} if unmapped
         */
        public String get(String key) {
            return mapping.get(key);
        }

        /**
         * Whether the encode definition that won for this glyph is a raw one.
         *
         * @param key a glyph
         * @return {@code true} if the macro text must be emitted bare
         */
        public boolean isRaw(String key) {
            return rawKeys.contains(key);
        }

        /**
         * Returns the keys, longest first.
         *
         * @return the sorted keys
         */
        public List<String> keys() {
            return keys;
        }

        /**
         * Returns the non-capturing regex alternation of all keys, longest first,
         * for embedding in category-specific surrounding syntax.
         *
         * @return the alternation source, e.g. {@code (?:\Qsscript\E|\Qss\E)}
         */
        public String alternation() {
            return alternation;
        }

        /**
         * Returns the compiled alternation.
         *
         * @return the pattern matching any single key
         */
        public Pattern pattern() {
            return pattern;
        }

        public Map<String, String> mapping() {
            return mapping;
        }

        public int size() {
            return mapping.size();
        }
    }
}
