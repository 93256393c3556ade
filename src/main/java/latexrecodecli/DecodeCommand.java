package latexrecodecli;

import latexrecode.DataModelHelper;
import latexrecode.DecodeOptions;
import latexrecode.LatexRecode;
import latexrecode.RecodeSet;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Subcommand converting LaTeX macros to Unicode.
 */
@Command(name = "decode", description = "\033[1;34mConvert LaTeX macros to Unicode\033[0m", mixinStandardHelpOptions = true)
public class DecodeCommand extends TextCommand {

    @Option(names = "--verbatim", paramLabel = "<name>", split = ",",
            description = "Field or list names whose values are left undecoded, e.g. url,doi")
    private List<String> verbatim = new ArrayList<>();

    @Option(names = "--no-normalize", description = "Do not normalize the decoded text")
    private boolean noNormalize;

    @Option(names = "--form", paramLabel = "<form>", defaultValue = "NFD",
            description = "Normalization form: NFD, NFC, NFKD or NFKC (default: ${DEFAULT-VALUE})")
    private String form;

    @Override
    String action() {
        return "decode";
    }

    @Override
    String convert(LatexRecode recode, String text) {
        DecodeOptions options = DecodeOptions.of(!noNormalize, form);
        recode.initSets(set, RecodeSet.NULL_ID);
        requireConfigured(recode);
        if (!verbatim.isEmpty()) {
            recode.setDataModelHelper(new DataModelHelper(verbatim, Collections.emptyList()));
        }
        return recode.decode(text, options);
    }
}
