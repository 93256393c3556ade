package latexrecode;

/**
 * Context rule deciding whether an accent macro written without braces applies
 * to the character that follows it.
 *
 * <ul>
 *   <li>A macro that does not end in an ASCII letter (e.g. {@code \=}) takes any
 *       following letter: {@code \=u}.</li>
 *   <li>A macro ending in a letter (e.g. {@code \c}) takes a letter only after a
 *       space ({@code \c c}), since {@code \cS} would be read as a different
 *       control word; without a space it takes only a non-letter ({@code \c-}).</li>
 * </ul>
 *
 * <p>Whitespace, braces and backslashes are never accent bases.</p>
 */
final class UnbracedAccent {

    private UnbracedAccent() {
    }

    /**
     * @param macro  the accent macro text, without backslash
     * @param spaced whether whitespace separates the macro from {@code next}
     * @param next   the candidate base code point
     * @return {@code true} if the accent applies to {@code next}
     */
    static boolean admits(String macro, boolean spaced, int next) {
        if (Character.isWhitespace(next) || next == '{' || next == '}' || next == '\\') {
            return false;
        }
        int last = macro.codePointBefore(macro.length());
        if (!Rewrites.isAsciiLetter(last)) {
            return Character.isLetter(next);
        }
        if (spaced) {
            return Character.isLetter(next);
        }
        return !Rewrites.isAsciiLetter(next);
    }
}
