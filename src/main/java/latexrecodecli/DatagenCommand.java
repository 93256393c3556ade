package latexrecodecli;

import latexrecode.RecodeData;
import picocli.CommandLine.*;

import java.io.File;
import java.nio.file.Paths;
import java.util.concurrent.Callable;
import java.util.logging.Level;
import java.util.logging.Logger;

@Command(name = "datagen", description = "\033[1;34mConvert recode data XML to JSON\033[0m", mixinStandardHelpOptions = true)
public class DatagenCommand implements Callable<Integer> {

    @Option(names = {"-f", "--format"}, description = "Output format: [json]", defaultValue = "json")
    private String format;

    @Option(names = {"-d", "--data"}, paramLabel = "<file>", description = "Source XML (default: bundled recode data)")
    private File data;

    @Option(names = {"-o", "--output"}, paramLabel = "<filename>", description = "Output filename")
    private String output;

    private static final Logger LOGGER = Logger.getLogger(DatagenCommand.class.getName());
    private static final String BLUE = "\033[1;34m";
    private static final String RESET = "\033[0m";

    @Override
    public Integer call() {
        try {
            if (!"json".equals(format)) {
                LOGGER.severe("Unsupported format: " + format);
                return 1;
            }

            String outputFile = (output != null) ? output : "recode_data.json";
            File outputPath = Paths.get(outputFile).toAbsolutePath().toFile();

            RecodeData recodeData = data != null
                    ? RecodeData.fromXml(data.toPath())
                    : RecodeData.DataHolder.get();

            recodeData.serializeToJson(outputPath.toPath());
            System.out.println(BLUE + "Recode data saved in JSON format at: " + outputPath + RESET);
            return 0;

        } catch (Exception e) {
            LOGGER.log(Level.SEVERE, "Exception during recode data generation", e);
            return 1;
        }
    }
}
