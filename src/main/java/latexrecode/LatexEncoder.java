package latexrecode;

import latexrecode.RecodeTable.CategoryTable;

import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Converts Unicode text to LaTeX macros using an encode {@link RecodeTable}.
 *
 * <p>Input is expected in NFD, so that accented letters arrive as a base letter
 * followed by combining marks. Each category is one pass in
 * {@link RecodeCategory#ENCODE_ORDER}; the output is not normalized.</p>
 */
public final class LatexEncoder {
    private static final Logger LOGGER = Logger.getLogger(LatexEncoder.class.getName());

    private final RecodeTable table;
    private final Map<RecodeCategory, Pattern> passes;

    // Diacritic rules, highest priority first
    private final Pattern dotlessI;
    private final Pattern bracedBase;
    private final Pattern markedBase;
    private final Pattern triple;
    private final Pattern doubled;
    private final Pattern single;

    /**
     * Creates an encoder and compiles the per-category patterns.
     *
     * @param table an encode table
     */
    public LatexEncoder(RecodeTable table) {
        if (table.getDirection() != RecodeTable.Direction.ENCODE) {
            throw new IllegalArgumentException("Not an encode table: " + table);
        }
        this.table = table;
        this.passes = new EnumMap<>(RecodeCategory.class);

        for (RecodeCategory category : RecodeCategory.ENCODE_ORDER) {
            CategoryTable t = table.get(category);
            if (t != null && category != RecodeCategory.DIACRITICS) {
                passes.put(category, Pattern.compile("(" + t.alternation() + ")"));
            }
        }

        CategoryTable diacritics = table.get(RecodeCategory.DIACRITICS);
        if (diacritics != null) {
            String re = "(" + diacritics.alternation() + ")";
            this.dotlessI = Pattern.compile("i" + re + "(?!\\p{M})");
            this.bracedBase = Pattern.compile("\\{(\\p{L}\\p{M}*)\\}" + re);
            this.markedBase = Pattern.compile("(\\p{L}\\p{M}*)" + re);
            this.triple = Pattern.compile("(\\P{M})" + re + re + re);
            this.doubled = Pattern.compile("(\\P{M})" + re + re);
            this.single = Pattern.compile("(\\P{M})" + re);
        } else {
            this.dotlessI = null;
            this.bracedBase = null;
            this.markedBase = null;
            this.triple = null;
            this.doubled = null;
            this.single = null;
        }
    }

    public RecodeTable getTable() {
        return table;
    }

    /**
     * Encodes {@code text}.
     *
     * @param text NFD Unicode text
     * @return the LaTeX text; {@code text} itself for the null set
     */
    public String encode(String text) {
        if (text == null || text.isEmpty()) return text;

        // Virtual null set: do nothing
        if (table.isIdentity()) return text;

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("String before encode -> '" + text + "'");
        }

        String s = text;
        for (RecodeCategory category : RecodeCategory.ENCODE_ORDER) {
            CategoryTable t = table.get(category);
            if (t == null) continue; // not present in this set
            s = category == RecodeCategory.DIACRITICS
                    ? encodeAccents(t, s)
                    : encodeCategory(category, t, s);
        }

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("String after encode -> '" + s + "'");
        }
        return s;
    }

    private String encodeCategory(RecodeCategory category, CategoryTable t, String s) {
        Pattern p = passes.get(category);
        switch (category) {
            case NEGATEDSYMBOLS:
                return Rewrites.replace(p, s, m -> "{$\\not\\" + t.get(m.group(1)) + "$}");
            case SUPERSCRIPTS:
                return Rewrites.replace(p, s, m -> "\\textsuperscript{" + t.get(m.group(1)) + "}");
            case CMDSUPERSCRIPTS:
                return Rewrites.replace(p, s, m -> "\\textsuperscript{\\" + t.get(m.group(1)) + "}");
            case DINGS:
                return Rewrites.replace(p, s, m -> "\\ding{" + t.get(m.group(1)) + "}");
            case LETTERS:
                return Rewrites.replace(p, s, m -> {
                    String glyph = m.group(1);
                    return t.isRaw(glyph) ? t.get(glyph) : "\\" + t.get(glyph) + "{}";
                });
            default:
                // punctuation, symbols, greek
                return Rewrites.replace(p, s, m -> wrap(t, m.group(1)));
        }
    }

    /**
     * Text-mode macros are emitted bare, everything else that is not raw goes into
     * inline math so that it also works outside math mode.
     */
    private static String wrap(CategoryTable t, String glyph) {
        String macro = t.get(glyph);
        if (macro.startsWith("text")) {
            return "\\" + macro;
        }
        if (t.isRaw(glyph)) {
            return macro;
        }
        return "{$\\" + macro + "$}";
    }

    private String encodeAccents(CategoryTable t, String s) {
        // i + accent -> accent over dotless i
        s = Rewrites.replace(dotlessI, s, m -> "\\" + t.get(m.group(1)) + "{\\i}");

        // {x}m and x'm, where x may already carry marks: wrap the whole base
        s = Rewrites.replace(bracedBase, s, m -> "\\" + t.get(m.group(2)) + "{" + m.group(1) + "}");
        s = Rewrites.replace(markedBase, s, m -> "\\" + t.get(m.group(2)) + "{" + m.group(1) + "}");

        s = Rewrites.replace(triple, s, m -> "\\" + t.get(m.group(4))
                + "{\\" + t.get(m.group(3))
                + "{\\" + t.get(m.group(2))
                + "{" + m.group(1) + "}}}");
        s = Rewrites.replace(doubled, s, m -> "\\" + t.get(m.group(3))
                + "{\\" + t.get(m.group(2))
                + "{" + m.group(1) + "}}");
        return Rewrites.replace(single, s, m -> "\\" + t.get(m.group(2)) + "{" + m.group(1) + "}");
    }
}
