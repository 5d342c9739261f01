package typesafeschwalbe.arafura.compiler.frontend;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.Test;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;

public class LexerTest {

    private static List<Token> tokensOf(String source) throws ErrorException {
        Lexer lexer = new Lexer("test.py", source);
        List<Token> tokens = new ArrayList<>();
        while(true) {
            Token token = lexer.nextToken();
            tokens.add(token);
            if(token.type == Token.Type.FILE_END) { return tokens; }
        }
    }

    private static List<Token.Type> typesOf(String source)
        throws ErrorException {
        List<Token.Type> types = new ArrayList<>();
        for(Token token: LexerTest.tokensOf(source)) {
            types.add(token.type);
        }
        return types;
    }

    @Test
    void emitsIndentationTokens() throws ErrorException {
        assertEquals(
            List.of(
                Token.Type.KEYWORD_IF, Token.Type.IDENTIFIER, Token.Type.COLON,
                Token.Type.NEWLINE, Token.Type.INDENT, Token.Type.IDENTIFIER,
                Token.Type.NEWLINE, Token.Type.DEDENT, Token.Type.IDENTIFIER,
                Token.Type.NEWLINE, Token.Type.FILE_END
            ),
            LexerTest.typesOf("if x:\n    y\nz\n")
        );
    }

    @Test
    void closesOpenBlocksAtFileEnd() throws ErrorException {
        assertEquals(
            List.of(
                Token.Type.KEYWORD_WHILE, Token.Type.IDENTIFIER,
                Token.Type.COLON, Token.Type.NEWLINE, Token.Type.INDENT,
                Token.Type.KEYWORD_PASS, Token.Type.NEWLINE,
                Token.Type.DEDENT, Token.Type.FILE_END
            ),
            LexerTest.typesOf("while x:\n    pass")
        );
    }

    @Test
    void skipsCommentsAndBlankLines() throws ErrorException {
        assertEquals(
            List.of(
                Token.Type.IDENTIFIER, Token.Type.NEWLINE,
                Token.Type.IDENTIFIER, Token.Type.NEWLINE, Token.Type.FILE_END
            ),
            LexerTest.typesOf("x  # trailing\n\n    # indented comment\ny\n")
        );
    }

    @Test
    void joinsLinesInsideBrackets() throws ErrorException {
        assertEquals(
            List.of(
                Token.Type.IDENTIFIER, Token.Type.PAREN_OPEN,
                Token.Type.IDENTIFIER, Token.Type.COMMA,
                Token.Type.IDENTIFIER, Token.Type.PAREN_CLOSE,
                Token.Type.NEWLINE, Token.Type.FILE_END
            ),
            LexerTest.typesOf("f(a,\n        b)\n")
        );
    }

    @Test
    void joinsLinesAfterBackslash() throws ErrorException {
        assertEquals(
            List.of(
                Token.Type.IDENTIFIER, Token.Type.EQUALS, Token.Type.INTEGER,
                Token.Type.PLUS, Token.Type.INTEGER, Token.Type.NEWLINE,
                Token.Type.FILE_END
            ),
            LexerTest.typesOf("x = 1 + \\\n    2\n")
        );
    }

    @Test
    void lexesNumbers() throws ErrorException {
        List<Token> tokens = LexerTest.tokensOf("0x1F 1_000 1.5e3 .5 0b101");
        assertEquals(Token.Type.INTEGER, tokens.get(0).type);
        assertEquals("0x1F", tokens.get(0).content);
        assertEquals(Token.Type.INTEGER, tokens.get(1).type);
        assertEquals("1_000", tokens.get(1).content);
        assertEquals(Token.Type.FRACTION, tokens.get(2).type);
        assertEquals("1.5e3", tokens.get(2).content);
        assertEquals(Token.Type.FRACTION, tokens.get(3).type);
        assertEquals(Token.Type.INTEGER, tokens.get(4).type);
    }

    @Test
    void lexesOperatorsLongestFirst() throws ErrorException {
        List<Token> tokens = LexerTest.tokensOf("a **= b // c -> ...");
        assertEquals(Token.Type.AUGMENTED_ASSIGNMENT, tokens.get(1).type);
        assertEquals("**=", tokens.get(1).content);
        assertEquals(Token.Type.DOUBLE_SLASH, tokens.get(3).type);
        assertEquals(Token.Type.ARROW, tokens.get(5).type);
        assertEquals(Token.Type.ELLIPSIS, tokens.get(6).type);
    }

    @Test
    void decodesStringEscapes() throws ErrorException {
        List<Token> tokens = LexerTest.tokensOf(
            "\"a\\tb\\n\" 'it\\'s' r\"\\d\" \"\"\"multi\nline\"\"\""
        );
        assertEquals("a\tb\n", tokens.get(0).content);
        assertEquals("it's", tokens.get(1).content);
        assertEquals("\\d", tokens.get(2).content);
        assertEquals("multi\nline", tokens.get(3).content);
    }

    @Test
    void keepsSoftKeywordsAsIdentifiers() throws ErrorException {
        List<Token> tokens = LexerTest.tokensOf("match case type");
        assertEquals(Token.Type.IDENTIFIER, tokens.get(0).type);
        assertEquals(Token.Type.IDENTIFIER, tokens.get(1).type);
        assertEquals(Token.Type.IDENTIFIER, tokens.get(2).type);
    }

    @Test
    void rejectsInconsistentDedent() {
        ErrorException e = assertThrows(
            ErrorException.class,
            () -> LexerTest.tokensOf("if x:\n    y\n  z\n")
        );
        assertEquals(Error.Kind.FRONT_END, e.kind());
    }

    @Test
    void rejectsMalformedLiterals() {
        assertEquals(
            Error.Kind.FRONT_END,
            assertThrows(
                ErrorException.class, () -> LexerTest.tokensOf("12abc")
            ).kind()
        );
        assertEquals(
            Error.Kind.FRONT_END,
            assertThrows(
                ErrorException.class, () -> LexerTest.tokensOf("0b102")
            ).kind()
        );
        assertEquals(
            Error.Kind.FRONT_END,
            assertThrows(
                ErrorException.class, () -> LexerTest.tokensOf("f\"{x}\"")
            ).kind()
        );
        assertEquals(
            Error.Kind.FRONT_END,
            assertThrows(
                ErrorException.class, () -> LexerTest.tokensOf("\"open\n\"")
            ).kind()
        );
        assertEquals(
            Error.Kind.FRONT_END,
            assertThrows(
                ErrorException.class, () -> LexerTest.tokensOf("a $ b")
            ).kind()
        );
    }

}
