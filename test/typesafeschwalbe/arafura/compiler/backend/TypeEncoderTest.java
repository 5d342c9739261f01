package typesafeschwalbe.arafura.compiler.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;
import typesafeschwalbe.arafura.compiler.frontend.Lexer;
import typesafeschwalbe.arafura.compiler.frontend.SourceParser;

public class TypeEncoderTest {

    private static final String TYPES = String.join("\n",
        "class Node:",
        "    next: -Node",
        "@typedef(Alias)",
        "class Alias:",
        "    x: int",
        "class Color(Enum):",
        "    RED = 0",
        ""
    );

    private static TypeEncoder types;

    @BeforeAll
    static void collectTypes() throws ErrorException {
        TypeRegistry registry = TypeRegistry.collect(
            TypeEncoderTest.parse(TYPES)
        );
        types = new ExpressionEncoder(registry).types();
    }

    private static List<AstNode> parse(String source) throws ErrorException {
        return new SourceParser(new Lexer("test.py", source))
            .parseModule().<AstNode.Block>getValue().statements();
    }

    private static AstNode parseType(String type) throws ErrorException {
        AstNode declaration = TypeEncoderTest.parse("x: " + type + "\n")
            .get(0);
        return declaration.<AstNode.Declaration>getValue().annotation();
    }

    private static String declare(String type, String name)
        throws ErrorException {
        return types.encode(TypeEncoderTest.parseType(type), name);
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "int                      | int x",
        "--char                   | char **x",
        "int[2][3]                | int x[2][3]",
        "list[int, 10]            | int x[10]",
        "list[-char, 5]           | char *x[5]",
        "list[char]               | char x[]",
        "+int[4]                  | int (*x)[4]",
        "-+int[4]                 | int (**x)[4]",
        "Node                     | struct Node x",
        "-Node                    | struct Node *x",
        "Alias                    | Alias x",
        "Color                    | enum Color x",
        "Unknown                  | Unknown x",
        "type[Node]               | struct Node x",
        "type[Alias]              | struct Alias x",
        "type[Node][3]            | struct Node x[3]",
        "type[Node[3]]            | struct Node x[3]",
        "union[Data]              | union Data x",
        "enum[Color]              | enum Color x",
        "const[int]               | const int x",
        "unsigned[long[long]]     | unsigned long long x",
        "volatile[unsigned][int]  | volatile unsigned int x",
        "const[-char]             | const char *x",
        "long[4]                  | long x[4]",
        "bit[unsigned[int], 3]    | unsigned int x : 3",
        "atomic[int]              | _Atomic int x",
        "-atomic[int]             | _Atomic int *x",
        "thread_local[int]        | _Thread_local int x",
        "static[thread_local[int]]| static _Thread_local int x",
        "'alignas[16, int]'       | _Alignas(16) int x",
        "'alignas[8, int[4]]'     | _Alignas(8) int x[4]",
        "'(int, int)(int)'        | int x(int, int)",
        "()(void)                 | void x(void)",
        "'(-char, ...)(int)'      | int x(char*, ...)",
        "'-(int, int)(int)'       | int (*x)(int, int)",
        "-()(void)                | void (*x)(void)",
        "'int(int, char)'         | int (*x)(int, char)"
    })
    void encodesDeclarations(String type, String expected)
        throws ErrorException {
        assertEquals(expected, TypeEncoderTest.declare(type, "x"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
        "int               | int",
        "-int              | int*",
        "--void            | void**",
        "int[3]            | int[3]",
        "Node              | struct Node",
        "-Alias            | Alias*",
        "'-(int, int)(int)'| int (*)(int, int)"
    })
    void encodesAbstractTypes(String type, String expected)
        throws ErrorException {
        assertEquals(
            expected, types.encodeAbstract(TypeEncoderTest.parseType(type))
        );
    }

    @Test
    void escapesDeclaredNames() throws ErrorException {
        assertEquals("int FILE__", TypeEncoderTest.declare("int", "__FILE__"));
        assertEquals("int _", TypeEncoderTest.declare("int", "___"));
    }

    @Test
    void rejectsPointersToArraysWrittenWithMinus() {
        ErrorException e = assertThrows(
            ErrorException.class,
            () -> TypeEncoderTest.declare("-int[4]", "x")
        );
        assertEquals(Error.Kind.UNSUPPORTED_CONSTRUCT, e.kind());
    }

    @Test
    void rejectsNonTypeExpressions() {
        assertEquals(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            assertThrows(
                ErrorException.class,
                () -> TypeEncoderTest.declare("a + b", "x")
            ).kind()
        );
        assertEquals(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            assertThrows(
                ErrorException.class,
                () -> TypeEncoderTest.declare("_", "x")
            ).kind()
        );
        assertEquals(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            assertThrows(
                ErrorException.class,
                () -> TypeEncoderTest.declare("+int", "x")
            ).kind()
        );
        assertEquals(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            assertThrows(
                ErrorException.class,
                () -> TypeEncoderTest.declare("(int,)(int, char)", "x")
            ).kind()
        );
    }

    @Test
    void recognizesTypeReferences() throws ErrorException {
        assertTrue(
            types.isTypeReference(TypeEncoderTest.parseType("Node"))
        );
        assertTrue(
            types.isTypeReference(TypeEncoderTest.parseType("-int"))
        );
        assertTrue(
            types.isTypeReference(TypeEncoderTest.parseType("type[Other]"))
        );
        assertFalse(
            types.isTypeReference(TypeEncoderTest.parseType("count"))
        );
        assertFalse(
            types.isTypeReference(TypeEncoderTest.parseType("a + b"))
        );
    }

}
