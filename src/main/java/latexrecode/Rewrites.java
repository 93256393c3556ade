package latexrecode;

import java.util.function.Function;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Regex rewriting helpers shared by the decoder and encoder.
 */
final class Rewrites {

    private Rewrites() {
    }

    /**
     * Replaces every match of {@code pattern} with the result of {@code replacer}.
     * A {@code null} replacement keeps the matched text as it was.
     *
     * @param pattern  the pattern to search for
     * @param text     the input text
     * @param replacer computes the replacement from the current match
     * @return the rewritten text, or {@code text} itself if nothing matched
     */
    static String replace(Pattern pattern, String text, Function<Matcher, String> replacer) {
        Matcher matcher = pattern.matcher(text);
        if (!matcher.find()) return text;

        StringBuffer sb = new StringBuffer(text.length() + 16);
        do {
            String replacement = replacer.apply(matcher);
            if (replacement == null) {
                replacement = matcher.group(); // fallback: keep original
            }
            matcher.appendReplacement(sb, Matcher.quoteReplacement(replacement));
        } while (matcher.find());
        matcher.appendTail(sb);
        return sb.toString();
    }

    /**
     * Whether the code point is a combining mark (general category M).
     */
    static boolean isMark(int cp) {
        int type = Character.getType(cp);
        return type == Character.NON_SPACING_MARK
                || type == Character.ENCLOSING_MARK
                || type == Character.COMBINING_SPACING_MARK;
    }

    static boolean isAsciiLetter(int cp) {
        return (cp >= 'A' && cp <= 'Z') || (cp >= 'a' && cp <= 'z');
    }

    /**
     * Returns the index just past the run of combining marks starting at {@code from}.
     */
    static int skipMarks(String text, int from) {
        int i = from;
        while (i < text.length()) {
            int cp = text.codePointAt(i);
            if (!isMark(cp)) break;
            i += Character.charCount(cp);
        }
        return i;
    }
}
