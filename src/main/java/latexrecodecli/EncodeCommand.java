package latexrecodecli;

import latexrecode.LatexRecode;
import latexrecode.RecodeSet;
import picocli.CommandLine.Command;

import java.text.Normalizer;

/**
 * Subcommand converting Unicode text to LaTeX macros.
 */
@Command(name = "encode", description = "\033[1;34mConvert Unicode text to LaTeX macros\033[0m", mixinStandardHelpOptions = true)
public class EncodeCommand extends TextCommand {

    @Override
    String action() {
        return "encode";
    }

    @Override
    String convert(LatexRecode recode, String text) {
        recode.initSets(RecodeSet.NULL_ID, set);
        requireConfigured(recode);
        // Accented letters must arrive decomposed
        return recode.encode(Normalizer.normalize(text, Normalizer.Form.NFD));
    }
}
