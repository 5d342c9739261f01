package typesafeschwalbe.arafura.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.Result;
import typesafeschwalbe.arafura.compiler.Transpiler;

public class Main {

    private static final Logger LOGGER = LoggerFactory.getLogger(Main.class);

    public static final String VERSION = "arafura 0.1.0";

    private static final Cli.OptionalArgument OUTPUT = new Cli.OptionalArgument(
        'o', "output",
        "specifies the output file path (default: standard output)",
        "output file path"
    );
    private static final Cli.Flag CHECK = new Cli.Flag(
        'k', "check", "only checks whether the input can be translated"
    );
    private static final Cli.Flag VERSION_FLAG = new Cli.Flag(
        'v', "version", "displays the version"
    );
    private static final Cli.Flag NO_COLOR = new Cli.Flag(
        'n', "nocolor", "disables colored output"
    );

    public static void main(String[] args) {
        System.exit(Main.run(args, System.out, System.err));
    }

    public static int run(String[] args, PrintStream out, PrintStream err) {
        // color is always disabled if we think we are on Windows
        boolean onWindows = System.getProperty("os.name")
            .toLowerCase().contains("win");
        Cli cli = new Cli("arafura <input> [options]")
            .add(OUTPUT).add(CHECK).add(VERSION_FLAG).add(NO_COLOR);
        Result<Cli.Values> cliParseResult = cli.parse(args);
        if(cliParseResult.isError()) {
            return Main.reportErrors(
                err, cliParseResult.getError(), Map.of(), !onWindows
            );
        }
        Cli.Values cliValues = cliParseResult.getValue();
        boolean colored = !cliValues.get(NO_COLOR) && !onWindows;
        if(cliValues.get(Cli.HELP)) {
            out.print(cli.help());
            return 0;
        }
        if(cliValues.get(VERSION_FLAG)) {
            out.println(VERSION);
            return 0;
        }
        if(cliValues.free().size() != 1) {
            return Main.reportErrors(
                err,
                List.of(new Error(
                    Error.Kind.USAGE,
                    "Expected exactly one input file, but got "
                        + cliValues.free().size()
                        + " (see '--help')"
                )),
                Map.of(), colored
            );
        }
        String inputName = cliValues.free().get(0);
        // read the input
        String source;
        try {
            byte[] fileBytes = Files.readAllBytes(Paths.get(inputName));
            source = new String(fileBytes, StandardCharsets.UTF_8);
        } catch(NoSuchFileException e) {
            return Main.reportErrors(
                err,
                List.of(new Error(
                    Error.Kind.FILE_ACCESS,
                    "Input file '" + inputName + "' not found"
                )),
                Map.of(), colored
            );
        } catch(IOException e) {
            return Main.reportErrors(
                err,
                List.of(new Error(
                    Error.Kind.FILE_ACCESS,
                    "Unable to read file '" + inputName + "': "
                        + "'" + e.getMessage() + "'"
                )),
                Map.of(), colored
            );
        }
        // translate
        LOGGER.debug("Translating '{}'", inputName);
        Result<String> result = Transpiler.transpile(inputName, source);
        if(result.isError()) {
            return Main.reportErrors(
                err, result.getError(), Map.of(inputName, source), colored
            );
        }
        if(cliValues.get(CHECK)) {
            out.println("OK: " + inputName + " transpiles successfully");
            return 0;
        }
        if(cliValues.get(OUTPUT).isEmpty()) {
            out.println(result.getValue());
            return 0;
        }
        // write the output
        String outputName = cliValues.get(OUTPUT).get();
        Path outputPath = Paths.get(outputName);
        try {
            Files.write(
                outputPath, result.getValue().getBytes(StandardCharsets.UTF_8)
            );
        } catch(IOException e) {
            return Main.reportErrors(
                err,
                List.of(new Error(
                    Error.Kind.FILE_ACCESS,
                    "Unable to write to file '" + outputName + "': "
                        + "'" + e.getMessage() + "'"
                )),
                Map.of(), colored
            );
        }
        out.println("OK: Generated " + outputName);
        return 0;
    }

    private static int reportErrors(
        PrintStream err, List<Error> errors, Map<String, String> files,
        boolean colored
    ) {
        for(Error error: errors) {
            err.print(error.render(files, colored));
        }
        return 1;
    }

}
