package typesafeschwalbe.arafura.compiler.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;
import typesafeschwalbe.arafura.compiler.frontend.Lexer;
import typesafeschwalbe.arafura.compiler.frontend.SourceParser;

public class ExpressionEncoderTest {

    private static ExpressionEncoder expressions;

    @BeforeAll
    static void collectTypes() throws ErrorException {
        AstNode module = new SourceParser(new Lexer(
            "types.py",
            "class Point:\n    x: int\n    y: int\n"
                + "@typedef(Vec)\nclass Vector:\n    x: int\n"
                + "class Value(Union):\n    i: int\n"
        )).parseModule();
        expressions = new ExpressionEncoder(
            TypeRegistry.collect(module.<AstNode.Block>getValue().statements())
        );
    }

    private static String encode(String expression) throws ErrorException {
        AstNode statement = new SourceParser(
            new Lexer("test.py", expression + "\n")
        ).parseModule().<AstNode.Block>getValue().statements().get(0);
        return expressions.encode(
            statement.<AstNode.MonoOp>getValue().value()
        );
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "True        | 1",
        "False       | 0",
        "None        | NULL",
        "42          | 42",
        "0x1F        | 31",
        "0o17        | 15",
        "0b101       | 5",
        "1_000_000   | 1000000",
        "3.14        | 3.14",
        "1_0.5e3     | 10.5e3",
        "__LINE__    | LINE__",
        "value       | value"
    })
    void encodesLiteralsAndNames(String expression, String expected)
        throws ErrorException {
        assertEquals(expected, ExpressionEncoderTest.encode(expression));
    }

    @Test
    void escapesStrings() throws ErrorException {
        assertEquals(
            "\"a\\\"b\\\\c\\n\\t\"",
            ExpressionEncoderTest.encode("'a\"b\\\\c\\n\\t'")
        );
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "a + b * c         | (a + (b * c))",
        "(a + b) * c       | ((a + b) * c)",
        "a % b - c         | ((a % b) - c)",
        "'a << 2 | b & 1'  | '((a << 2) | (b & 1))'",
        "a ^ ~b            | (a ^ ~b)",
        "a // b            | (a / b)",
        "a < b <= c        | a < b <= c",
        "a != None         | a != NULL",
        "not done          | !done",
        "not a < b         | !(a < b)",
        "not a == b and c  | ((!(a == b)) && (c))",
        "~(a != b)         | ~(a != b)",
        "a and b           | ((a) && (b))",
        "'a or b or c'     | '((a) || (b) || (c))'",
        "-x                | -x",
        "- -x              | -(-x)",
        "+ +x              | +(+x)",
        "x if c else y     | (c ? x : y)",
        "(n := 3)          | (n = 3)"
    })
    void encodesOperators(String expression, String expected)
        throws ErrorException {
        assertEquals(expected, ExpressionEncoderTest.encode(expression));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "i ** _            | i++",
        "_ ** i            | ++i",
        "i // _            | i--",
        "_ // i            | --i",
        "arr[i ** _]       | arr[i++]",
        "p._.next._.x ** _ | p->next->x++"
    })
    void encodesIncrementsAndDecrements(String expression, String expected)
        throws ErrorException {
        assertEquals(expected, ExpressionEncoderTest.encode(expression));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "_.x              | &x",
        "_.arr[0]         | &arr[0]",
        "p._              | (*p)",
        "p._._            | (*(*p))",
        "p._.x            | p->x",
        "head._.next._.x  | head->next->x",
        "point.x          | point.x",
        "m[1][2]          | m[1][2]"
    })
    void encodesAccesses(String expression, String expected)
        throws ErrorException {
        assertEquals(expected, ExpressionEncoderTest.encode(expression));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "[int](3.5)           | ((int)(3.5))",
        "[-void](p)           | ((void*)(p))",
        "cast[-char](p)       | ((char*)(p))",
        "cast[Point](v)       | ((struct Point)(v))",
        "sizeof(int)          | sizeof(int)",
        "sizeof(Point)        | sizeof(struct Point)",
        "sizeof(Vec)          | sizeof(Vec)",
        "sizeof(-int)         | sizeof(int*)",
        "sizeof(type[Other])  | sizeof(struct Other)",
        "sizeof(buffer)       | sizeof(buffer)",
        "sizeof(a + 1)        | sizeof((a + 1))",
        "alignof[int]         | _Alignof(int)",
        "alignof[type[Point]] | _Alignof(struct Point)"
    })
    void encodesTypeOperators(String expression, String expected)
        throws ErrorException {
        assertEquals(expected, ExpressionEncoderTest.encode(expression));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "'Point(1, 2)'           | '{1, 2}'",
        "'Point(x=1, y=2)'       | '{.x = 1, .y = 2}'",
        "'Vec(1, x=2)'           | '{1, .x = 2}'",
        "'_(a=1, b=2)'           | '{.a = 1, .b = 2}'",
        "'Value(1)'              | 'Value(1)'",
        "'printf(\"%d\", x)'     | 'printf(\"%d\", x)'",
        "'[1, 2, 3]'             | '{1, 2, 3}'",
        "'[[1, 2], [3, 4]]'      | '{{1, 2}, {3, 4}}'",
        "'{0: 1, 5: 6}'          | '{[0] = 1, [5] = 6}'",
        "'static_assert(n > 0, \"n\")' | '_Static_assert(n > 0, \"n\")'"
    })
    void encodesCallsAndInitializers(String expression, String expected)
        throws ErrorException {
        assertEquals(expected, ExpressionEncoderTest.encode(expression));
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "a ** b",
        "a @ b",
        "f(x=1)",
        "Value(i=1)",
        "cast[int](a, b)",
        "f(...)"
    })
    void rejectsUntranslatableExpressions(String expression) {
        ErrorException e = assertThrows(
            ErrorException.class,
            () -> ExpressionEncoderTest.encode(expression)
        );
        assertEquals(Error.Kind.UNSUPPORTED_CONSTRUCT, e.kind());
    }

}
