package typesafeschwalbe.arafura.cli;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import java.util.Optional;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.Result;

public class CliTest {

    private static final Cli.OptionalArgument OUTPUT = new Cli.OptionalArgument(
        'o', "output", "output path", "path"
    );
    private static final Cli.Flag CHECK = new Cli.Flag(
        'k', "check", "only check"
    );

    private static Cli cli() {
        return new Cli("tool <input>").add(OUTPUT).add(CHECK);
    }

    @Test
    void parsesArgumentsAndFlags() {
        Result<Cli.Values> result = CliTest.cli().parse(
            new String[] { "in.py", "-o", "out.c", "--check" }
        );
        assertFalse(result.isError());
        Cli.Values values = result.getValue();
        assertEquals(Optional.of("out.c"), values.get(OUTPUT));
        assertTrue(values.get(CHECK));
        assertFalse(values.get(Cli.HELP));
        assertEquals(List.of("in.py"), values.free());
    }

    @Test
    void defaultsToAbsentValues() {
        Cli.Values values = CliTest.cli().parse(new String[] { "-" }).getValue();
        assertEquals(Optional.empty(), values.get(OUTPUT));
        assertFalse(values.get(CHECK));
        assertEquals(List.of("-"), values.free());
    }

    @Test
    void rejectsInvalidArguments() {
        for(String[] args: List.of(
            new String[] { "--nope" },
            new String[] { "-x" },
            new String[] { "-ko" },
            new String[] { "in.py", "--output" },
            new String[] { "--output", "--check" }
        )) {
            Result<Cli.Values> result = CliTest.cli().parse(args);
            assertTrue(result.isError());
            assertEquals(Error.Kind.USAGE, result.getError().get(0).kind());
        }
    }

    @Test
    void listsArgumentsInHelp() {
        String help = CliTest.cli().help();
        assertTrue(help.startsWith("Usage: tool <input>\n"));
        assertTrue(help.contains("    -o <path>\n    --output <path>\n"));
        assertTrue(help.contains("    --help\n"));
        assertTrue(help.contains("only check"));
    }

    @Test
    void rejectsDuplicateRegistrations() {
        Cli cli = CliTest.cli();
        assertThrows(IllegalArgumentException.class, () -> cli.add(CHECK));
    }

    @Test
    void rejectsUnregisteredLookups() {
        Cli.Values values = new Cli("tool").parse(new String[0]).getValue();
        assertThrows(IllegalArgumentException.class, () -> values.get(CHECK));
    }

}
