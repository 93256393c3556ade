package latexrecodecli;

import latexrecode.LatexRecode;
import latexrecode.RecodeData;
import picocli.CommandLine.Option;

import java.io.File;
import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Shared options and text I/O of the {@code decode} and {@code encode} subcommands.
 */
abstract class TextCommand implements Callable<Integer> {
    @Option(names = "--list-sets", description = "List the recoding sets found in the recode data")
    boolean listSets;

    @Option(names = {"-i", "--input"}, paramLabel = "<file>", description = "Input file (default: stdin)")
    File input;

    @Option(names = {"-o", "--output"}, paramLabel = "<file>", description = "Output file (default: stdout)")
    File output;

    @Option(names = {"-s", "--set"}, paramLabel = "<set>", defaultValue = "base",
            description = "Recoding set: null, base, full or any set in the data file (default: ${DEFAULT-VALUE})")
    String set;

    @Option(names = {"-d", "--data"}, paramLabel = "<file>",
            description = "Recode data file (.xml or .json) instead of the bundled one")
    File data;

    @Option(names = {"--in-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Input encoding")
    String inEncoding;

    @Option(names = {"--out-enc"}, paramLabel = "<encoding>", defaultValue = "UTF-8", description = "Output encoding")
    String outEncoding;

    @Option(names = {"-v", "--verbose"}, description = "Log set resolution and rejected definitions")
    boolean verbose;

    private static final Logger LOGGER = Logger.getLogger(TextCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    /**
     * Name used in messages, e.g. {@code "decode"}.
     */
    abstract String action();

    /**
     * Configures {@code recode} for this command's direction and converts {@code text}.
     */
    abstract String convert(LatexRecode recode, String text);

    @Override
    public Integer call() {
        try {
            LatexRecode.setVerboseLogging(verbose);
            RecodeData recodeData = data != null
                    ? RecodeData.fromFile(data.toPath())
                    : RecodeData.DataHolder.get();

            if (listSets) {
                System.out.println("Available recoding sets:");
                System.out.println("  null");
                recodeData.setIds().forEach(id -> System.out.println("  " + id));
                return 0;
            }

            String inputText = readInput();
            String outputText = convert(new LatexRecode(recodeData), inputText);
            writeOutput(outputText);

            String inFrom = (input != null) ? input.getPath() : "<stdin>";
            String outTo = (output != null) ? output.getPath() : "stdout";
            if (System.console() != null) {
                System.err.println(BLUE + "Recoding completed (" + action() + ", " + set + "): "
                        + inFrom + " → " + outTo + RESET);
            }
            return 0;
        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Error during " + action(), e);
            System.err.println("❌ Exception occurred: " + e.getMessage());
            return 1;
        }
    }

    /**
     * Fails the command when {@link LatexRecode#initSets} had to fall back to no conversion.
     */
    static void requireConfigured(LatexRecode recode) {
        String error = recode.getLastError();
        if (error != null) {
            throw new IllegalArgumentException(error);
        }
    }

    private String readInput() throws IOException {
        Charset inputCharset = Charset.forName(inEncoding);
        if (input != null) {
            return Files.readString(input.toPath(), inputCharset);
        }
        if (System.console() != null) {
            System.err.println("Input text to " + action() + ", <Ctrl+D> (Unix) <Ctrl-Z> (Windows) to submit:");
        }
        return new String(System.in.readAllBytes(), inputCharset);
    }

    private void writeOutput(String outputText) throws IOException {
        Charset outputCharset = Charset.forName(outEncoding);
        if (output != null) {
            Files.writeString(output.toPath(), outputText, outputCharset);
        } else {
            System.out.write(outputText.getBytes(outputCharset));
            System.out.flush();
        }
    }
}
