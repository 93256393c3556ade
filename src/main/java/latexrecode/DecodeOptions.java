package latexrecode;

import java.text.Normalizer;
import java.util.Locale;
import java.util.Objects;

/**
 * Options for {@link LatexRecode#decode(String, DecodeOptions)}.
 *
 * <p>By default decoded text is normalized to NFD.</p>
 */
public final class DecodeOptions {

    /**
     * Normalize to NFD.
     */
    public static final DecodeOptions DEFAULT = new DecodeOptions(true, Normalizer.Form.NFD);

    private final boolean normalize;
    private final Normalizer.Form form;

    private DecodeOptions(boolean normalize, Normalizer.Form form) {
        this.normalize = normalize;
        this.form = Objects.requireNonNull(form, "form");
    }

    /**
     * @param normalize whether to normalize the decoded text
     * @param form      the normalization form to apply
     * @return the options
     */
    public static DecodeOptions of(boolean normalize, Normalizer.Form form) {
        return new DecodeOptions(normalize, form);
    }

    /**
     * @param normalize whether to normalize the decoded text
     * @param form      form name, one of {@code NFD}, {@code NFC}, {@code NFKD}, {@code NFKC} (any case)
     * @return the options
     * @throws IllegalArgumentException if {@code form} is not a known normalization form
     */
    public static DecodeOptions of(boolean normalize, String form) {
        return new DecodeOptions(normalize, parseForm(form));
    }

    /**
     * Options that leave decoded text unnormalized.
     *
     * @return the options
     */
    public static DecodeOptions unnormalized() {
        return new DecodeOptions(false, Normalizer.Form.NFD);
    }

    /**
     * Parses a normalization form name, ignoring case and surrounding whitespace.
     *
     * @param value the form name, e.g. {@code "nfc"}
     * @return the matching form
     * @throws IllegalArgumentException if {@code value} is {@code null} or unknown
     */
    public static Normalizer.Form parseForm(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Normalization form cannot be null");
        }
        try {
            return Normalizer.Form.valueOf(value.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            throw new IllegalArgumentException("Unknown normalization form: " + value, e);
        }
    }

    public boolean isNormalize() {
        return normalize;
    }

    public Normalizer.Form getForm() {
        return form;
    }

    @Override
    public String toString() {
        return normalize ? "normalize=" + form : "normalize=off";
    }
}
