package latexrecode;

import java.util.*;

/**
 * The decode and encode tables chosen by one {@link LatexRecode#initSets} call,
 * with the decoder and encoder compiled from them.
 *
 * <p>A plan is never modified. Reconfiguring builds a new plan and swaps it in whole.</p>
 */
public final class RecodePlan {
    private final RecodeTable decodeTable;
    private final RecodeTable encodeTable;
    private final List<String> rejected;
    private final LatexDecoder decoder;
    private final LatexEncoder encoder;

    public RecodePlan(RecodeTable decodeTable, RecodeTable encodeTable, List<String> rejected) {
        this.decodeTable = Objects.requireNonNull(decodeTable, "decodeTable");
        this.encodeTable = Objects.requireNonNull(encodeTable, "encodeTable");
        this.rejected = rejected == null
                ? Collections.emptyList()
                : Collections.unmodifiableList(new ArrayList<>(rejected));
        this.decoder = new LatexDecoder(decodeTable);
        this.encoder = new LatexEncoder(encodeTable);
    }

    /**
     * Builds both tables from {@code data}. Unlike {@link LatexRecode#initSets},
     * configuration errors are not softened here.
     *
     * @param data        the recode data
     * @param decodeSetId the decode set identifier
     * @param encodeSetId the encode set identifier
     * @return the plan
     * @throws RecodeConfigurationException if either set cannot be built
     */
    public static RecodePlan build(RecodeData data, String decodeSetId, String encodeSetId) {
        RecodeTableBuilder builder = new RecodeTableBuilder(data);
        return new RecodePlan(builder.buildDecode(decodeSetId),
                builder.buildEncode(encodeSetId),
                builder.getRejected());
    }

    public String getDecodeSetId() {
        return decodeTable.getSetId();
    }

    public String getEncodeSetId() {
        return encodeTable.getSetId();
    }

    public RecodeTable getDecodeTable() {
        return decodeTable;
    }

    public RecodeTable getEncodeTable() {
        return encodeTable;
    }

    /**
     * Returns the reasons malformed definitions were skipped while building this plan.
     *
     * @return an unmodifiable list, empty if every definition was accepted
     */
    public List<String> getRejected() {
        return rejected;
    }

    public LatexDecoder getDecoder() {
        return decoder;
    }

    public LatexEncoder getEncoder() {
        return encoder;
    }

    @Override
    public String toString() {
        return "RecodePlan{decode=" + decodeTable + ", encode=" + encodeTable
                + ", rejected=" + rejected.size() + '}';
    }
}
