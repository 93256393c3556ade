package latexrecodecli;

import picocli.CommandLine;
import picocli.CommandLine.Command;

@Command(
        name = "latexrecode",
        mixinStandardHelpOptions = true,
        version = "1.0.0",
        description = "\033[1;34mLaTeX <-> Unicode recoding CLI\033[0m",
        subcommands = {
                DecodeCommand.class,
                EncodeCommand.class,
                DatagenCommand.class
        }
)
public class Main implements Runnable {

    @Override
    public void run() {
        // Called when no subcommand is provided
        System.out.println("Use --help or a subcommand (decode / encode / datagen)");
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }
}
