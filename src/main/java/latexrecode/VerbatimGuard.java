package latexrecode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.text.Normalizer;
import java.util.*;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Shields the values of verbatim fields from macro rewriting during a decode.
 *
 * <p>Both assignment forms {@code name = "value"} and {@code name = {value}} are
 * recognized, the name matched case-insensitively. The value is swapped for the
 * MD5 hex digest of its NFC form; after decoding the digest is swapped back.</p>
 *
 * <p>The guard itself is immutable. The digest → value store lives in a
 * {@link Markers} session obtained from {@link #open()}, one per decode call, so
 * concurrent calls never see each other's markers.</p>
 */
public final class VerbatimGuard {
    private static final Pattern DIGEST = Pattern.compile("[a-f0-9]{32}");

    private static final VerbatimGuard DISABLED = new VerbatimGuard(Collections.emptySet());

    private final Pattern mention;
    private final Pattern quoted;
    private final Pattern braced;

    private VerbatimGuard(Set<String> names) {
        if (names.isEmpty()) {
            this.mention = null;
            this.quoted = null;
            this.braced = null;
            return;
        }
        StringJoiner alt = new StringJoiner("|", "(?:", ")");
        for (String n : names) {
            alt.add(Pattern.quote(n));
        }
        String vs = alt.toString();
        this.mention = Pattern.compile(vs, Pattern.CASE_INSENSITIVE);
        this.quoted = Pattern.compile("\\b(" + vs + "\\s*=\\s*)(\")(\\s*)([^\"]+)(\")", Pattern.CASE_INSENSITIVE);
        this.braced = Pattern.compile("\\b(" + vs + "\\s*=\\s*)(\\{)(\\s*)([^}]+)(\\})", Pattern.CASE_INSENSITIVE);
    }

    /**
     * Creates a guard for the verbatim names of a data model.
     *
     * @param helper the data model helper; {@code null} disables guarding
     * @return a guard
     */
    public static VerbatimGuard of(DataModelHelper helper) {
        return helper == null ? DISABLED : of(helper.verbatimNames());
    }

    /**
     * Creates a guard protecting the given field or list names.
     *
     * @param names protected names; {@code null} or empty disables guarding
     * @return a guard
     */
    public static VerbatimGuard of(Collection<String> names) {
        if (names == null || names.isEmpty()) return DISABLED;
        return new VerbatimGuard(new LinkedHashSet<>(names));
    }

    /**
     * Returns a guard that protects nothing.
     *
     * @return the disabled guard
     */
    public static VerbatimGuard disabled() {
        return DISABLED;
    }

    /**
     * Whether any names are protected.
     *
     * @return {@code false} for the disabled guard
     */
    public boolean isEnabled() {
        return mention != null;
    }

    /**
     * Whether the text mentions a protected name anywhere (case-insensitive).
     *
     * @param text the text to scan
     * @return {@code true} if a protected name occurs
     */
    public boolean mentionsProtectedName(String text) {
        return mention != null && mention.matcher(text).find();
    }

    /**
     * Opens a marker session for one decode call.
     *
     * @return a fresh, empty marker store
     */
    public Markers open() {
        return new Markers();
    }

    /**
     * Digest → original value store scoped to a single decode call.
     */
    public final class Markers {
        private final Map<String, String> saved = new HashMap<>();

        private Markers() {
        }

        /**
         * Replaces every protected value in {@code text} with its digest token.
         *
         * @param text the text to protect
         * @return the text with protected values masked
         */
        public String protect(String text) {
            if (!isEnabled()) return text;
            String out = mask(quoted, text);
            return mask(braced, out);
        }

        private String mask(Pattern p, String text) {
            Matcher m = p.matcher(text);
            if (!m.find()) return text;
            StringBuffer sb = new StringBuffer(text.length());
            do {
                String value = m.group(4);
                String digest = md5Hex(Normalizer.normalize(value, Normalizer.Form.NFC));
                saved.put(digest, value);
                String replacement = m.group(1) + m.group(2) + m.group(3) + digest + m.group(5);
                m.appendReplacement(sb, Matcher.quoteReplacement(replacement));
            } while (m.find());
            m.appendTail(sb);
            return sb.toString();
        }

        /**
         * Puts every recorded original value back in place of its digest token.
         * Hex runs that are not recorded digests are left alone.
         *
         * @param text the decoded text
         * @return the text with protected values restored verbatim
         */
        public String restore(String text) {
            if (saved.isEmpty()) return text;
            Matcher m = DIGEST.matcher(text);
            StringBuffer sb = new StringBuffer(text.length());
            while (m.find()) {
                String original = saved.get(m.group());
                m.appendReplacement(sb, Matcher.quoteReplacement(original != null ? original : m.group()));
            }
            m.appendTail(sb);
            return sb.toString();
        }

        /**
         * Returns how many distinct values were masked in this session.
         *
         * @return the number of recorded markers
         */
        public int size() {
            return saved.size();
        }
    }

    static String md5Hex(String s) {
        try {
            MessageDigest md = MessageDigest.getInstance("MD5");
            byte[] digest = md.digest(s.getBytes(StandardCharsets.UTF_8));
            StringBuilder hex = new StringBuilder(32);
            for (byte b : digest) {
                hex.append(Character.forDigit((b >> 4) & 0xF, 16));
                hex.append(Character.forDigit(b & 0xF, 16));
            }
            return hex.toString();
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("MD5 not available", e);
        }
    }
}
