package typesafeschwalbe.arafura.compiler.frontend;

import typesafeschwalbe.arafura.compiler.Source;

public class Token {

    public enum Type {
        NEWLINE("a line break"),
        INDENT("an indented block"),
        DEDENT("the end of an indented block"),
        FILE_END("the end of the file"),

        IDENTIFIER("an identifier"),
        INTEGER("an integer"),
        FRACTION("a fractional number"),
        STRING("a string"),
        EQUALS("'='"),
        WALRUS("':='"),
        DOT("'.'"),
        ELLIPSIS("'...'"),
        COMMA("','"),
        COLON("':'"),
        SEMICOLON("';'"),
        ARROW("'->'"),
        AT("'@'", 4),
        DOUBLE_ASTERISK("'**'", 2),
        ASTERISK("'*'", 4),
        SLASH("'/'", 4),
        DOUBLE_SLASH("'//'", 4),
        PERCENT("'%'", 4),
        PLUS("'+'", 5),
        MINUS("'-'", 5),
        LEFT_SHIFT("'<<'", 6),
        RIGHT_SHIFT("'>>'", 6),
        AMPERSAND("'&'", 7),
        CARET("'^'", 8),
        PIPE("'|'", 9),
        TILDE("'~'"),
        LESS_THAN("'<'", 10),
        GREATER_THAN("'>'", 10),
        LESS_THAN_EQUAL("'<='", 10),
        GREATER_THAN_EQUAL("'>='", 10),
        DOUBLE_EQUALS("'=='", 10),
        NOT_EQUALS("'!='", 10),
        AUGMENTED_ASSIGNMENT("an augmented assignment"),
        PAREN_OPEN("'('"),
        PAREN_CLOSE("')'"),
        BRACKET_OPEN("'['"),
        BRACKET_CLOSE("']'"),
        BRACE_OPEN("'{'"),
        BRACE_CLOSE("'}'"),
        KEYWORD_DEF("'def'"),
        KEYWORD_CLASS("'class'"),
        KEYWORD_IF("'if'", 14),
        KEYWORD_ELIF("'elif'"),
        KEYWORD_ELSE("'else'"),
        KEYWORD_WHILE("'while'"),
        KEYWORD_FOR("'for'"),
        KEYWORD_IN("'in'"),
        KEYWORD_IS("'is'"),
        KEYWORD_NOT("'not'"),
        KEYWORD_AND("'and'", 12),
        KEYWORD_OR("'or'", 13),
        KEYWORD_TRUE("'True'"),
        KEYWORD_FALSE("'False'"),
        KEYWORD_NONE("'None'"),
        KEYWORD_RETURN("'return'"),
        KEYWORD_RAISE("'raise'"),
        KEYWORD_FROM("'from'"),
        KEYWORD_IMPORT("'import'"),
        KEYWORD_AS("'as'"),
        KEYWORD_DEL("'del'"),
        KEYWORD_PASS("'pass'"),
        KEYWORD_BREAK("'break'"),
        KEYWORD_CONTINUE("'continue'"),
        KEYWORD_LAMBDA("'lambda'"),
        KEYWORD_TRY("'try'"),
        KEYWORD_EXCEPT("'except'"),
        KEYWORD_FINALLY("'finally'"),
        KEYWORD_WITH("'with'"),
        KEYWORD_ASYNC("'async'"),
        KEYWORD_AWAIT("'await'"),
        KEYWORD_YIELD("'yield'"),
        KEYWORD_GLOBAL("'global'"),
        KEYWORD_NONLOCAL("'nonlocal'"),
        KEYWORD_ASSERT("'assert'");

        public static final int PREFIX_UNARY_PRECEDENCE = 3;
        public static final int PREFIX_NOT_PRECEDENCE = 11;
        public static final int WALRUS_PRECEDENCE = 16;

        public final String description;
        public final int infixPrecedence;

        private Type(String description, int infixPrecedence) {
            this.description = description;
            this.infixPrecedence = infixPrecedence;
        }
        private Type(String description) {
            this.description = description;
            this.infixPrecedence = 0;
        }
    }

    public final Type type;
    public final String content;
    public final Source source;

    Token(Type type, String content, Source source) {
        this.type = type;
        this.content = content;
        this.source = source;
    }

    @Override
    public String toString() {
        StringBuilder output = new StringBuilder();
        output.append("[");
        output.append(this.type);
        output.append(" - '");
        output.append(this.content);
        output.append("']");
        return output.toString();
    }

}
