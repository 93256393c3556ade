package latexrecode;

import latexrecode.RecodeTable.CategoryTable;

import java.text.Normalizer;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Pattern;

/**
 * Converts LaTeX macros to Unicode text using a decode {@link RecodeTable}.
 *
 * <p>Decoding runs these steps over the whole input:</p>
 * <ol>
 *   <li>fast exits for the null set and for text without any backslash</li>
 *   <li>masking of verbatim field values ({@link VerbatimGuard})</li>
 *   <li>raw {@code \char} escapes (hex, octal, decimal)</li>
 *   <li>macro boundary fixes ({@code \foo\ bar}, {@code \o,}) and dotless
 *       {@code \i}/{@code \j} accent bases</li>
 *   <li>one pass per category in {@link RecodeCategory#DECODE_ORDER}</li>
 *   <li>unwrapping of {@code {$glyph$}} math groups</li>
 *   <li>removal of braces around a single accented letter</li>
 *   <li>restoration of verbatim values and final normalization</li>
 * </ol>
 *
 * <p>Macros without a mapping are left untouched. Instances are immutable and
 * thread-safe; all per-call state lives on the stack.</p>
 */
public final class LatexDecoder {
    private static final Logger LOGGER = Logger.getLogger(LatexDecoder.class.getName());

    private static final Pattern CHAR_HEX = Pattern.compile("\\\\char\\s*\"(\\p{XDigit}+)");
    private static final Pattern CHAR_OCT = Pattern.compile("\\\\char\\s*'([0-7]+)");
    private static final Pattern CHAR_DEC = Pattern.compile("\\\\char\\s*(\\d+)");

    // \foo\ bar -> \foo{} bar
    private static final Pattern CONTROL_SPACE = Pattern.compile("(\\\\[a-zA-Z]+)\\\\(\\s+)");
    // Aaaa\o, -> Aaaa\o{},
    private static final Pattern SINGLE_BEFORE_PUNCT = Pattern.compile("(?<!\\{)(\\\\\\w)(?=[;,.:%])");

    private static final Pattern DINGS = Pattern.compile("\\\\ding\\{([2-9A-F][0-9A-F])\\}");
    // {$α$} or {$≠$}: one decoded glyph alone in inline math
    private static final Pattern MATH_GLYPH = Pattern.compile(
            "\\{\\$((?:[^\\x00-\\x7F]\\p{M}*)|(?:[\\x21-\\x7E&&[^${}\\\\]]\\p{M}+))\\$\\}");

    private final RecodeTable table;
    private final Map<RecodeCategory, Pattern> passes;
    private final Pattern dotlessBase;
    private final Pattern bracedAccent;

    /**
     * Creates a decoder and compiles the per-category patterns.
     *
     * @param table a decode table
     */
    public LatexDecoder(RecodeTable table) {
        if (table.getDirection() != RecodeTable.Direction.DECODE) {
            throw new IllegalArgumentException("Not a decode table: " + table);
        }
        this.table = table;
        this.passes = new EnumMap<>(RecodeCategory.class);

        for (RecodeCategory category : RecodeCategory.DECODE_ORDER) {
            CategoryTable t = table.get(category);
            if (t == null) continue;
            String re = t.alternation();
            switch (category) {
                case NEGATEDSYMBOLS:
                    passes.put(category, Pattern.compile("\\\\not\\\\(" + re + ")"));
                    break;
                case SUPERSCRIPTS:
                    passes.put(category, Pattern.compile("\\\\textsuperscript\\{(" + re + ")\\}"));
                    break;
                case CMDSUPERSCRIPTS:
                    passes.put(category, Pattern.compile("\\\\textsuperscript\\{\\\\(" + re + ")\\}"));
                    break;
                case DINGS:
                    passes.put(category, DINGS);
                    break;
                case DIACRITICS:
                    // rule (b) is a scanner, see applyUnbracedAccents
                    break;
                default:
                    // letters, punctuation, symbols, greek; \not\x belongs to negatedsymbols
                    passes.put(category, Pattern.compile("(?<!\\\\not)\\\\(" + re + ")(?:\\{\\}|\\s+|\\b)"));
                    break;
            }
        }

        CategoryTable diacritics = table.get(RecodeCategory.DIACRITICS);
        if (diacritics != null) {
            String re = diacritics.alternation();
            this.dotlessBase = Pattern.compile("\\\\(" + re + ")\\s*\\{\\\\([ij])\\}");
            this.bracedAccent = Pattern.compile("\\\\(" + re + ")\\s*\\{(\\p{L}\\p{M}*)\\}");
        } else {
            this.dotlessBase = null;
            this.bracedAccent = null;
        }
    }

    public RecodeTable getTable() {
        return table;
    }

    /**
     * Decodes {@code text}.
     *
     * @param text    the LaTeX text
     * @param guard   verbatim guard for this data model; use {@link VerbatimGuard#disabled()} if none
     * @param options normalization options
     * @return the Unicode text
     */
    public String decode(String text, VerbatimGuard guard, DecodeOptions options) {
        if (text == null || text.isEmpty()) return text;

        // Virtual null set: do nothing
        if (table.isIdentity()) return text;

        // No macros, no point doing anything
        if (text.indexOf('\\') < 0 && !guard.mentionsProtectedName(text)) return text;

        VerbatimGuard.Markers markers = guard.open();
        String s = markers.protect(text);

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("String before decode -> '" + s + "'");
        }

        s = decodeCharEscapes(s);

        s = Rewrites.replace(CONTROL_SPACE, s, m -> m.group(1) + "{}" + m.group(2));
        s = Rewrites.replace(SINGLE_BEFORE_PUNCT, s, m -> m.group(1) + "{}");

        if (dotlessBase != null) {
            CategoryTable diacritics = table.get(RecodeCategory.DIACRITICS);
            s = Rewrites.replace(dotlessBase, s, m -> m.group(2) + diacritics.get(m.group(1)));
        }

        for (RecodeCategory category : RecodeCategory.DECODE_ORDER) {
            CategoryTable t = table.get(category);
            if (t == null) continue; // not present in this set
            s = applyCategory(category, t, s);
        }

        s = Rewrites.replace(MATH_GLYPH, s, m -> m.group(1));
        s = removeAccentBraces(s);
        s = markers.restore(s);

        if (LOGGER.isLoggable(Level.FINEST)) {
            LOGGER.finest("String after decode -> '" + s + "'");
        }

        return options.isNormalize() ? Normalizer.normalize(s, options.getForm()) : s;
    }

    private String applyCategory(RecodeCategory category, CategoryTable t, String s) {
        switch (category) {
            case DINGS:
                // unknown codes stay as they are
                return Rewrites.replace(DINGS, s, m -> t.get(m.group(1)));
            case DIACRITICS:
                return applyAccents(t, s);
            default:
                return Rewrites.replace(passes.get(category), s, m -> t.get(m.group(1)));
        }
    }

    // ------------------------------------------------------------------ \char

    static String decodeCharEscapes(String s) {
        if (!s.contains("\\char")) return s;
        s = Rewrites.replace(CHAR_HEX, s, m -> codePoint(m.group(1), 16));
        s = Rewrites.replace(CHAR_OCT, s, m -> codePoint(m.group(1), 8));
        return Rewrites.replace(CHAR_DEC, s, m -> codePoint(m.group(1), 10));
    }

    private static String codePoint(String digits, int radix) {
        try {
            int cp = Integer.parseInt(digits, radix);
            if (Character.isValidCodePoint(cp)) {
                return new String(Character.toChars(cp));
            }
        } catch (NumberFormatException e) {
            LOGGER.fine(() -> "Ignoring out of range \\char value " + digits);
        }
        return null;
    }

    // -------------------------------------------------------------- accents

    private String applyAccents(CategoryTable t, String s) {
        // \d{h} -> h + mark; repeated so that \={\d{a}} resolves from the inside out
        String prev;
        do {
            prev = s;
            s = Rewrites.replace(bracedAccent, s, m -> m.group(2) + t.get(m.group(1)));
        } while (!s.equals(prev));

        return applyUnbracedAccents(t, s);
    }

    /**
     * Rewrites {@code \macro[spaces]X} to {@code X + mark} where {@link UnbracedAccent}
     * admits the pair. Candidates are tried longest first at every backslash.
     */
    static String applyUnbracedAccents(CategoryTable t, String s) {
        int slash = s.indexOf('\\');
        if (slash < 0) return s;

        final int n = s.length();
        StringBuilder out = new StringBuilder(n);
        int copied = 0;

        while (slash >= 0) {
            int next = slash + 1;
            for (String macro : t.keys()) {
                if (!s.startsWith(macro, slash + 1)) continue;

                int j = slash + 1 + macro.length();
                int k = j;
                while (k < n && isSpace(s.charAt(k))) k++;
                if (k >= n) continue;

                int cp = s.codePointAt(k);
                if (!UnbracedAccent.admits(macro, k > j, cp)) continue;

                int end = Rewrites.skipMarks(s, k + Character.charCount(cp));
                out.append(s, copied, slash)
                        .append(s, k, end)
                        .append(t.get(macro));
                copied = end;
                next = end;
                break;
            }
            slash = next < n ? s.indexOf('\\', next) : -1;
        }

        if (copied == 0) return s;
        out.append(s, copied, n);
        return out.toString();
    }

    private static boolean isSpace(char c) {
        return c == ' ' || c == '\t' || c == '\n' || c == '\r' || c == '\f' || c == '\u000B';
    }

    // -------------------------------------------------------- brace cleanup

    /**
     * Removes braces around one letter carrying at least one combining mark, as in
     * {@code {é}}, unless the group directly follows a control word such as
     * {@code \textupper}, where the braces are an argument.
     */
    static String removeAccentBraces(String s) {
        if (s.indexOf('{') < 0) return s;

        final int n = s.length();
        StringBuilder out = new StringBuilder(n);
        boolean afterBackslash = false;
        boolean inControlWord = false;

        int i = 0;
        while (i < n) {
            char c = s.charAt(i);

            if (c == '{' && !inControlWord) {
                int end = accentedLetterGroupEnd(s, i);
                if (end > 0) {
                    out.append(s, i + 1, end - 1);
                    i = end;
                    afterBackslash = false;
                    inControlWord = false;
                    continue;
                }
            }

            if (c == '\\') {
                afterBackslash = !afterBackslash;
                inControlWord = false;
            } else if (Character.isLetter(c) && (afterBackslash || inControlWord)) {
                inControlWord = true;
                afterBackslash = false;
            } else {
                afterBackslash = false;
                inControlWord = false;
            }
            out.append(c);
            i++;
        }
        return out.toString();
    }

    /**
     * If {@code s} has {@code {<letter><mark>+}} at {@code open}, returns the index
     * just past the closing brace, else -1.
     */
    private static int accentedLetterGroupEnd(String s, int open) {
        int i = open + 1;
        if (i >= s.length()) return -1;
        int cp = s.codePointAt(i);
        if (!Character.isLetter(cp)) return -1;
        i += Character.charCount(cp);

        int marksEnd = Rewrites.skipMarks(s, i);
        if (marksEnd == i) return -1;
        if (marksEnd >= s.length() || s.charAt(marksEnd) != '}') return -1;
        return marksEnd + 1;
    }
}
