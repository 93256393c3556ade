package latexrecode;

import latexrecode.RecodeTable.CategoryTable;
import latexrecode.RecodeTable.Direction;

import java.util.*;
import java.util.logging.Logger;

/**
 * Builds decode and encode {@link RecodeTable}s from {@link RecodeData} for a chosen set.
 *
 * <p>The two directions are built independently so that decoding can use a richer
 * or narrower set than encoding. Malformed definitions are skipped one by one and
 * reported through {@link #getRejected()}; they never abort a build.</p>
 */
public final class RecodeTableBuilder {
    private static final Logger LOGGER = Logger.getLogger(RecodeTableBuilder.class.getName());

    private final RecodeData data;
    private final List<MacroDefinition> valid;
    private final List<String> rejected;

    /**
     * Creates a builder over the given data and validates its definitions.
     *
     * @param data the recode data
     */
    public RecodeTableBuilder(RecodeData data) {
        this.data = Objects.requireNonNull(data, "data");
        this.valid = new ArrayList<>(data.getDefinitions().size());
        this.rejected = new ArrayList<>();

        for (MacroDefinition d : data.getDefinitions()) {
            try {
                d.validate();
                valid.add(d);
            } catch (RecodeDataException e) {
                LOGGER.warning("Rejected recode definition " + d + ": " + e.getMessage());
                rejected.add(e.getMessage());
            }
        }
    }

    /**
     * Returns the messages for every definition rejected as malformed.
     *
     * @return an unmodifiable list of rejection messages
     */
    public List<String> getRejected() {
        return Collections.unmodifiableList(rejected);
    }

    /**
     * Builds the decode table: macro text → glyph, per category.
     *
     * @param setId the decode set identifier
     * @return the decode table; an identity table for the null set
     * @throws RecodeConfigurationException if the data is empty or nothing belongs to {@code setId}
     */
    public RecodeTable buildDecode(String setId) {
        if (RecodeSet.isNull(setId)) {
            return RecodeTable.identity(Direction.DECODE, RecodeSet.NULL_ID);
        }
        checkSet(setId);

        Map<RecodeCategory, CategoryTable> tables = new EnumMap<>(RecodeCategory.class);
        for (RecodeCategory category : RecodeCategory.values()) {
            Map<String, String> map = new LinkedHashMap<>();
            for (MacroDefinition d : valid) {
                if (d.getCategory() == category && d.isMemberOf(setId)) {
                    map.put(d.getFrom(), d.getTo());
                }
            }
            // Things that break surrounding syntax when decoded
            map.keySet().removeAll(data.getDecodeExclude());

            if (!map.isEmpty()) {
                tables.put(category, new CategoryTable(map, Collections.emptySet()));
            }
        }

        RecodeTable table = new RecodeTable(Direction.DECODE, setId, tables);
        LOGGER.fine(() -> "Built " + table);
        return table;
    }

    /**
     * Builds the encode table: glyph → macro text, per category.
     *
     * <p>When several definitions share a glyph the last one wins, except that
     * definitions marked preferred are applied again afterwards and so always win.
     * Whether the glyph is emitted raw is taken from the winning definition.</p>
     *
     * @param setId the encode set identifier
     * @return the encode table; an identity table for the null set
     * @throws RecodeConfigurationException if the data is empty or nothing belongs to {@code setId}
     */
    public RecodeTable buildEncode(String setId) {
        if (RecodeSet.isNull(setId)) {
            return RecodeTable.identity(Direction.ENCODE, RecodeSet.NULL_ID);
        }
        checkSet(setId);

        Map<RecodeCategory, CategoryTable> tables = new EnumMap<>(RecodeCategory.class);
        for (RecodeCategory category : RecodeCategory.values()) {
            Map<String, MacroDefinition> winners = new LinkedHashMap<>();
            for (MacroDefinition d : valid) {
                if (d.getCategory() == category && d.isMemberOf(setId)) {
                    winners.put(d.getTo(), d);
                }
            }
            for (MacroDefinition d : valid) {
                if (d.getCategory() == category && d.isMemberOf(setId) && d.isPreferred()) {
                    winners.put(d.getTo(), d);
                }
            }
            // Things that would break LaTeX when encoded
            winners.keySet().removeAll(data.getEncodeExclude());

            if (winners.isEmpty()) continue;

            Map<String, String> map = new LinkedHashMap<>();
            Set<String> raw = new HashSet<>();
            for (Map.Entry<String, MacroDefinition> e : winners.entrySet()) {
                map.put(e.getKey(), e.getValue().getFrom());
                if (e.getValue().isRaw()) raw.add(e.getKey());
            }
            tables.put(category, new CategoryTable(map, raw));
        }

        RecodeTable table = new RecodeTable(Direction.ENCODE, setId, tables);
        LOGGER.fine(() -> "Built " + table);
        return table;
    }

    private void checkSet(String setId) {
        if (data.isEmpty()) {
            throw new RecodeConfigurationException("Recode data holds no macro definitions");
        }
        for (MacroDefinition d : valid) {
            if (d.isMemberOf(setId)) return;
        }
        throw new RecodeConfigurationException("No recode definitions belong to set '" + setId + "'");
    }
}
