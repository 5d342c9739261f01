package typesafeschwalbe.arafura.compiler.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.List;

import org.junit.jupiter.api.Test;

public class OutputTest {

    @Test
    void indentsLinesByLevel() {
        Output out = new Output();
        out.line("void f(void) {");
        out.enter();
        out.line("if (x) {");
        out.enter();
        out.line("g();");
        out.exit();
        out.line("}");
        out.exit();
        out.line("}");
        assertEquals(
            "void f(void) {\n    if (x) {\n        g();\n    }\n}", out.text()
        );
        assertEquals(0, out.indentation());
    }

    @Test
    void rawLinesIgnoreIndentation() {
        Output out = new Output();
        out.enter();
        out.rawLine("end:");
        out.line("return;");
        assertEquals(List.of("end:", "    return;"), out.lines());
    }

    @Test
    void nestedBuffersStartAtTheCurrentLevel() {
        Output out = new Output();
        out.enter();
        Output nested = out.nested();
        nested.line("x = 1;");
        assertEquals(List.of("    x = 1;"), nested.lines());
        assertEquals(List.of(), out.lines());
    }

    @Test
    void emptyBufferHasNoText() {
        assertEquals("", new Output().text());
    }

    @Test
    void leavingTheOutermostLevelFails() {
        Output out = new Output();
        assertThrows(IllegalStateException.class, out::exit);
    }

}
