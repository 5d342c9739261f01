package typesafeschwalbe.arafura.compiler;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.Map;

import org.junit.jupiter.api.Test;

public class TranspilerTest {

    @Test
    void translatesValidInput() {
        Result<String> result = Transpiler.transpile(
            "main.py",
            "def main() -> int:\n    printf(\"hi\\n\")\n    return 0\n"
        );
        assertTrue(result.isValue());
        assertEquals(
            "int main(void) {\n    printf(\"hi\\n\");\n    return 0;\n}",
            result.getValue()
        );
    }

    @Test
    void reportsSyntaxErrors() {
        Result<String> result = Transpiler.transpile("bad.py", "x = (1,\n");
        assertTrue(result.isError());
        assertEquals(Error.Kind.FRONT_END, result.getError().get(0).kind());
    }

    @Test
    void reportsTranslationErrors() {
        Result<String> doWhile = Transpiler.transpile(
            "loop.py", "while ():\n    x = 1\n"
        );
        assertTrue(doWhile.isError());
        assertEquals(
            Error.Kind.MALFORMED_DO_WHILE, doWhile.getError().get(0).kind()
        );
        Result<String> power = Transpiler.transpile("power.py", "x = a ** b\n");
        assertTrue(power.isError());
        assertEquals(
            Error.Kind.UNSUPPORTED_CONSTRUCT, power.getError().get(0).kind()
        );
    }

    @Test
    void rendersErrorsAgainstTheSource() {
        String source = "x = 1\nraise\n";
        Result<String> result = Transpiler.transpile("jump.py", source);
        assertTrue(result.isError());
        Error error = result.getError().get(0);
        assertEquals(Error.Kind.INVALID_GOTO, error.kind());
        String rendered = error.render(Map.of("jump.py", source), false);
        assertTrue(rendered.startsWith("error: "));
        assertTrue(rendered.contains("jump.py:2:1"));
        assertTrue(rendered.contains("raise"));
    }

}
