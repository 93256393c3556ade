package latexrecode;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * LatexRecode converts between LaTeX macros and Unicode text, in both directions.
 *
 * <p>Which macros are recognized is decided by named recoding sets from the
 * recode data ({@code base}, {@code full} in the bundled file). Decoding and
 * encoding are configured independently by {@link #initSets(String, String)};
 * the virtual set {@code null} turns a direction off.</p>
 *
 * <p>Typical use:</p>
 * <pre>{@code
 * LatexRecode recode = new LatexRecode();
 * recode.initSets("full", "base");
 * String unicode = recode.decode("Mu\\d{h}ammad ibn M\\=us\\=a");
 * String latex = recode.encode(unicode);
 * }</pre>
 *
 * <p>Decode and encode calls only read the current {@link RecodePlan}, which is
 * immutable, so they may run concurrently with each other and with
 * {@code initSets}.</p>
 */
public class LatexRecode {
    /**
     * Internal logger used for diagnostic and fallback messages.
     * Logging is disabled by default to keep library output quiet.
     */
    private static final Logger LOGGER = Logger.getLogger(LatexRecode.class.getName());

    /**
     * Parent of every logger in this package; its level governs them all.
     */
    private static final Logger PACKAGE_LOGGER = Logger.getLogger(LatexRecode.class.getPackage().getName());

    static {
        // Disable logging by default
        PACKAGE_LOGGER.setLevel(Level.OFF);
    }

    /**
     * Enables or disables verbose logging for LatexRecode.
     *
     * <p>When enabled, set resolution, fallbacks and rejected definitions are
     * reported through {@code java.util.logging}.</p>
     *
     * @param enabled {@code true} to enable logging, {@code false} to disable it
     */
    public static void setVerboseLogging(boolean enabled) {
        PACKAGE_LOGGER.setLevel(enabled ? Level.INFO : Level.OFF);
    }

    private final RecodeData data;

    /**
     * The active plan; {@code null} until {@link #initSets} has run.
     */
    private volatile RecodePlan plan;

    private volatile VerbatimGuard guard = VerbatimGuard.disabled();

    /**
     * Stores the last error message encountered, if any.
     */
    private volatile String lastError;

    /**
     * Creates an instance over the shared default recode data
     * ({@link RecodeData.DataHolder#get()}).
     */
    public LatexRecode() {
        this(RecodeData.DataHolder.get());
    }

    /**
     * Creates an instance over the given recode data.
     *
     * @param data the recode data
     */
    public LatexRecode(RecodeData data) {
        this.data = Objects.requireNonNull(data, "data");
    }

    /**
     * Selects the decode and encode sets and rebuilds all lookup tables.
     *
     * <p>Tables from a previous call are discarded. If a direction cannot be
     * configured, because the data is empty or the identifier names no set, a
     * warning is logged, {@link #getLastError()} is set, and that direction
     * falls back to doing nothing.</p>
     *
     * @param decodeSet decode set identifier, e.g. {@code "base"}, {@code "full"} or {@code "null"}
     * @param encodeSet encode set identifier
     */
    public synchronized void initSets(String decodeSet, String encodeSet) {
        RecodeTableBuilder builder = new RecodeTableBuilder(data);
        lastError = null;

        RecodeTable decodeTable = buildOrIdentity(builder, RecodeTable.Direction.DECODE, decodeSet);
        RecodeTable encodeTable = buildOrIdentity(builder, RecodeTable.Direction.ENCODE, encodeSet);

        RecodePlan next = new RecodePlan(decodeTable, encodeTable, builder.getRejected());
        if (!next.getRejected().isEmpty()) {
            LOGGER.warning("Skipped " + next.getRejected().size() + " malformed recode definition(s)");
        }
        LOGGER.info("Recode sets: decode=" + decodeTable.getSetId() + ", encode=" + encodeTable.getSetId());

        this.plan = next;
    }

    /**
     * Selects the decode and encode sets by their published names.
     *
     * @param decodeSet the decode set
     * @param encodeSet the encode set
     */
    public void initSets(RecodeSet decodeSet, RecodeSet encodeSet) {
        initSets(decodeSet.id(), encodeSet.id());
    }

    private RecodeTable buildOrIdentity(RecodeTableBuilder builder, RecodeTable.Direction direction, String setId) {
        String id = setId == null ? RecodeSet.defaultSet().id() : setId.trim();
        try {
            return direction == RecodeTable.Direction.DECODE
                    ? builder.buildDecode(id)
                    : builder.buildEncode(id);
        } catch (RecodeConfigurationException e) {
            lastError = e.getMessage();
            LOGGER.warning("Cannot configure " + direction.name().toLowerCase(Locale.ROOT)
                    + " set '" + id + "': " + e.getMessage() + "; no conversion will be done");
            return RecodeTable.identity(direction, id);
        }
    }

    /**
     * Sets the data model whose verbatim fields and lists are protected while
     * decoding. Pass {@code null} to protect nothing.
     *
     * @param helper the data model helper
     */
    public void setDataModelHelper(DataModelHelper helper) {
        this.guard = VerbatimGuard.of(helper);
    }

    /**
     * Converts LaTeX macros in {@code text} to Unicode, normalized to NFD.
     *
     * @param text the text to decode
     * @return the decoded text
     * @throws IllegalStateException if {@link #initSets} has not been called
     */
    public String decode(String text) {
        return decode(text, DecodeOptions.DEFAULT);
    }

    /**
     * Converts LaTeX macros in {@code text} to Unicode.
     *
     * @param text    the text to decode
     * @param options normalization of the result
     * @return the decoded text
     * @throws IllegalStateException if {@link #initSets} has not been called
     */
    public String decode(String text, DecodeOptions options) {
        return currentPlan().getDecoder().decode(text, guard, options == null ? DecodeOptions.DEFAULT : options);
    }

    /**
     * Converts Unicode characters in {@code text} to LaTeX macros.
     *
     * @param text NFD text to encode
     * @return the encoded text
     * @throws IllegalStateException if {@link #initSets} has not been called
     */
    public String encode(String text) {
        return currentPlan().getEncoder().encode(text);
    }

    private RecodePlan currentPlan() {
        RecodePlan p = plan;
        if (p == null) {
            throw new IllegalStateException("Recode sets not initialised, call initSets first");
        }
        return p;
    }

    /**
     * Returns the active plan.
     *
     * @return the plan, or {@code null} before the first {@link #initSets}
     */
    public RecodePlan getPlan() {
        return plan;
    }

    public String getDecodeSet() {
        RecodePlan p = plan;
        return p == null ? null : p.getDecodeSetId();
    }

    public String getEncodeSet() {
        RecodePlan p = plan;
        return p == null ? null : p.getEncodeSetId();
    }

    public RecodeData getData() {
        return data;
    }

    /**
     * Returns the most recent error message encountered.
     *
     * @return the last error message, or null if none
     */
    public String getLastError() {
        return lastError;
    }
}
