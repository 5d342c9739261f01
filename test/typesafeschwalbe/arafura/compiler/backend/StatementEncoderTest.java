package typesafeschwalbe.arafura.compiler.backend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;
import typesafeschwalbe.arafura.compiler.frontend.Lexer;
import typesafeschwalbe.arafura.compiler.frontend.SourceParser;

public class StatementEncoderTest {

    private static String generate(String source) throws ErrorException {
        AstNode module = new SourceParser(new Lexer("test.py", source))
            .parseModule();
        return new CCodeGen().generate(module);
    }

    private static Error.Kind failureOf(String source) {
        return assertThrows(
            ErrorException.class, () -> StatementEncoderTest.generate(source)
        ).kind();
    }

    @Test
    void emitsIncludes() throws ErrorException {
        assertEquals(
            """
            #include "sys/types.h"
            #include "util.h"
            #include "config.h"
            #include <stdio.h>""",
            StatementEncoderTest.generate(
                "import sys.types, util\nfrom config import VALUE\n"
                    + "from stdio import *\n"
            )
        );
    }

    @Test
    void emitsMacrosAndUndefinitions() throws ErrorException {
        assertEquals(
            """
            #define SIZE 16
            #define ENABLED
            #undef SIZE
            #undef ENABLED""",
            StatementEncoderTest.generate(
                "SIZE: macro = 16\nENABLED: macro\ndel SIZE, ENABLED\n"
            )
        );
    }

    @Test
    void emitsAssignments() throws ErrorException {
        assertEquals(
            """
            a = 0;
            b = 0;
            x += 1;
            x /= 2;
            x <<= 1;
            y = x;""",
            StatementEncoderTest.generate(
                "a = b = 0\nx += 1\nx //= 2\nx <<= 1\ny = x\n"
            )
        );
    }

    @Test
    void emitsElseIfChains() throws ErrorException {
        assertEquals(
            """
            void f(int x) {
                if (x > 0) {
                    pos();
                } else if (x < 0) {
                    neg();
                } else {
                    if (x) {
                        odd();
                    }
                    zero();
                }
            }""",
            StatementEncoderTest.generate(
                """
                def f(x: int) -> void:
                    if x > 0:
                        pos()
                    elif x < 0:
                        neg()
                    else:
                        if x:
                            odd()
                        zero()
                """
            )
        );
    }

    @Test
    void emitsPreprocessorChains() throws ErrorException {
        assertEquals(
            """
            #if VERSION > 2
            x = 1;
            #elif !defined(LEGACY)
            x = 2;
            #elif MODE == 3
            x = 3;
            #else
            x = 4;
            #endif""",
            StatementEncoderTest.generate(
                """
                if [VERSION > 2]:
                    x = 1
                elif [not LEGACY]:
                    x = 2
                elif [MODE == 3]:
                    x = 3
                else:
                    x = 4
                """
            )
        );
    }

    @Test
    void keepsPreprocessorBodiesAtTheCurrentIndentation() throws ErrorException {
        assertEquals(
            """
            void f(void) {
                #ifdef DEBUG
                trace();
                #endif
            }""",
            StatementEncoderTest.generate(
                "def f() -> void:\n    if [DEBUG]:\n        trace()\n"
            )
        );
    }

    @Test
    void emitsLoops() throws ErrorException {
        assertEquals(
            """
            void f(void) {
                while (i < 3) {
                    i++;
                }
                for (; ; ) {
                    break;
                }
                for (int i = 0, j = 9; i < j; i++, j--) {
                    continue;
                }
            }""",
            StatementEncoderTest.generate(
                """
                def f() -> void:
                    while i < 3:
                        i ** _
                    for i in int()()():
                        break
                    for (i, j) in (int, int)((i := 0, j := 9))(i < j)((i ** _, j // _)):
                        continue
                """
            )
        );
    }

    @Test
    void sharesOneLoopTypeBetweenVariables() throws ErrorException {
        assertEquals(
            """
            for (int i = 0, j = 10; i < 5; i++, j--) {
            }
            for (char *p = s, *q = t; p != q; p++, q--) {
            }
            for (long a = 0, b = 1; a < b; a++) {
            }""",
            StatementEncoderTest.generate(
                """
                for i, j in int((i := 0, j := 10))(i < 5)((i ** _, j // _)):
                    pass
                for p, q in (-char)((p := s, q := t))(p != q)((p ** _, q // _)):
                    pass
                for (a, b) in (long, long)((a := 0, b := 1))(a < b)(a ** _):
                    pass
                """
            )
        );
    }

    @Test
    void emitsDoWhileLoops() throws ErrorException {
        assertEquals(
            """
            void f(void) {
                do {
                    step();
                } while (running);
            }""",
            StatementEncoderTest.generate(
                """
                def f() -> void:
                    while ():
                        step()
                        if running:
                            continue
                """
            )
        );
    }

    @Test
    void emitsFunctionsAndPrototypes() throws ErrorException {
        assertEquals(
            """
            int add(int a, int b);
            void log(char *fmt, ...);
            char* name(void) {
                return "x";
            }""",
            StatementEncoderTest.generate(
                """
                def add(a: int, b: int) -> int: ...
                def log(fmt: -char, *args) -> void: ...
                def name() -> -char:
                    return "x"
                """
            )
        );
    }

    @Test
    void wrapsFunctionDeclaratorsAroundReturnedPointers() throws ErrorException {
        assertEquals(
            """
            int (*pick(int op))(int, int) {
                return table[op];
            }
            int (**handlers(void))(int);
            int (*rows(void))[4];""",
            StatementEncoderTest.generate(
                """
                def pick(op: int) -> int(int, int):
                    return table[op]
                def handlers() -> -int(int): ...
                def rows() -> +int[4]: ...
                """
            )
        );
    }

    @Test
    void emitsMacros() throws ErrorException {
        assertEquals(
            """
            #define ANSWER() (42)
            #define TWICE(x) ((x * 2))
            #define SWAP(a, b) do { \\
                t = a; \\
                a = b; \\
                b = t; \\
            } while(0)
            #define LOG(fmt, ...) (printf(fmt, __VA_ARGS__))""",
            StatementEncoderTest.generate(
                """
                def ANSWER():
                    42
                def TWICE(x):
                    x * 2
                def SWAP(a, b):
                    t = a
                    a = b
                    b = t
                def LOG(fmt, *args):
                    printf(fmt, __VA_ARGS__)
                """
            )
        );
    }

    @Test
    void emitsLabelsAtTheLineStart() throws ErrorException {
        assertEquals(
            """
            void f(void) {
            retry:
                if (failed()) {
                    goto retry;
                }
            }""",
            StatementEncoderTest.generate(
                """
                def f() -> void:
                    retry: label
                    if failed():
                        raise retry
                """
            )
        );
    }

    @Test
    void emitsSwitches() throws ErrorException {
        assertEquals(
            """
            void f(int x) {
                switch (x) {
                case 1:
                case 2:
                    small();
                    break;
                default:
                    big();
                }
            }""",
            StatementEncoderTest.generate(
                """
                def f(x: int) -> void:
                    match x:
                        case 1 | 2:
                            small()
                            break
                        case _:
                            big()
                """
            )
        );
    }

    @Test
    void emitsComposites() throws ErrorException {
        assertEquals(
            """
            typedef struct P {
                int x;
                struct {
                    int a;
                } inner;
            } P;
            enum E {
                A,
                B = 5,
                C,
            };
            P origin = {.x = 0};""",
            StatementEncoderTest.generate(
                """
                @typedef
                class P:
                    \"""A point.\"""
                    x: int
                    @var(inner)
                    class _:
                        a: int
                class E(Enum):
                    A
                    B = 5
                    C: int
                    pass
                origin: P(x=0)
                """
            )
        );
    }

    @Test
    void emitsTypeAliases() throws ErrorException {
        assertEquals(
            """
            typedef unsigned char byte;
            typedef void (*Handler)(int);""",
            StatementEncoderTest.generate(
                "type byte = unsigned[char]\ntype Handler = -(int,)(void)\n"
            )
        );
    }

    @Test
    void translatesBasicDeclarations() throws ErrorException {
        assertEquals(
            """
            int x = 5;
            struct Point {
                int x;
                int y;
            };
            enum Color {
                RED = 0,
                GREEN = 1,
            };
            struct Point p = {10, 20};
            node->data = value;""",
            StatementEncoderTest.generate(
                """
                x: int = 5
                class Point:
                    x: int
                    y: int
                class Color(Enum):
                    RED = 0
                    GREEN = 1
                p: Point = Point(10, 20)
                node._.data = value
                """
            )
        );
    }

    @Test
    void rejectsMalformedDoWhileLoops() {
        assertEquals(
            Error.Kind.MALFORMED_DO_WHILE,
            StatementEncoderTest.failureOf(
                "while ():\n    i ** _\n    if i > 10:\n        break\n"
            )
        );
        assertEquals(
            Error.Kind.MALFORMED_DO_WHILE,
            StatementEncoderTest.failureOf(
                "while ():\n    if i < 10:\n        continue\n    else:\n"
                    + "        pass\n"
            )
        );
        assertEquals(
            Error.Kind.MALFORMED_DO_WHILE,
            StatementEncoderTest.failureOf(
                "while ():\n    if i < 10:\n        i ** _\n        continue\n"
            )
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "for i in range(10):\n    pass\n",
        "for i in int(j := 0)(i < 3)(i ** _):\n    pass\n",
        "for i in (int, int)(i := 0)(i < 3)(i ** _):\n    pass\n",
        "for i in int(i = 0)(i < 3)(i ** _):\n    pass\n",
        "for a.b in int(a := 0)(1)(2):\n    pass\n",
        "for i in int(i := 0)(i < 3, 1)(i ** _):\n    pass\n",
        "for i, j in (int, long)((i := 0, j := 1))(i < j)(i ** _):\n"
            + "    pass\n"
    })
    void rejectsInvalidForLoops(String source) {
        assertEquals(
            Error.Kind.INVALID_FOR_LOOP, StatementEncoderTest.failureOf(source)
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "raise\n",
        "raise END from START\n",
        "raise error()\n"
    })
    void rejectsInvalidGotos(String source) {
        assertEquals(
            Error.Kind.INVALID_GOTO, StatementEncoderTest.failureOf(source)
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "def f(a: int, b):\n    return a\n",
        "def f(a: int):\n    pass\n",
        "def f(a) -> int:\n    return a\n"
    })
    void rejectsPartiallyAnnotatedDefinitions(String source) {
        assertEquals(
            Error.Kind.AMBIGUOUS_DEFINITION,
            StatementEncoderTest.failureOf(source)
        );
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "def f(a: int = 1) -> int: ...\n",
        "def f(*, a: int) -> int: ...\n",
        "@inline\ndef f() -> int: ...\n",
        "while x:\n    pass\nelse:\n    pass\n",
        "for i in int(i := 0)(i < 3)(i ** _):\n    pass\nelse:\n    pass\n",
        "x **= 2\n",
        "x @= 2\n",
        "class S:\n    x: int = 5\n",
        "class S:\n    def f() -> int: ...\n",
        "class E(Enum):\n    A, B = 1\n",
        "@packed\nclass S:\n    x: int\n",
        "class A:\n    x: int\nclass A(Union):\n    y: int\n",
        "match x:\n    case 1 if y:\n        pass\n",
        "del a.b\n",
        "end: label = 3\n",
        "p: Point(x=1) = q\n",
        "f(...)\n"
    })
    void rejectsUnsupportedConstructs(String source) {
        assertEquals(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            StatementEncoderTest.failureOf(source)
        );
    }

}
