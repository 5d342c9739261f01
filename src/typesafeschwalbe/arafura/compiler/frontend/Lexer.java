package typesafeschwalbe.arafura.compiler.frontend;

import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.Source;

public class Lexer {

    private static final int TAB_WIDTH = 8;

    private static final Map<String, Token.Type> KEYWORDS = Map.ofEntries(
        Map.entry("def", Token.Type.KEYWORD_DEF),
        Map.entry("class", Token.Type.KEYWORD_CLASS),
        Map.entry("if", Token.Type.KEYWORD_IF),
        Map.entry("elif", Token.Type.KEYWORD_ELIF),
        Map.entry("else", Token.Type.KEYWORD_ELSE),
        Map.entry("while", Token.Type.KEYWORD_WHILE),
        Map.entry("for", Token.Type.KEYWORD_FOR),
        Map.entry("in", Token.Type.KEYWORD_IN),
        Map.entry("is", Token.Type.KEYWORD_IS),
        Map.entry("not", Token.Type.KEYWORD_NOT),
        Map.entry("and", Token.Type.KEYWORD_AND),
        Map.entry("or", Token.Type.KEYWORD_OR),
        Map.entry("True", Token.Type.KEYWORD_TRUE),
        Map.entry("False", Token.Type.KEYWORD_FALSE),
        Map.entry("None", Token.Type.KEYWORD_NONE),
        Map.entry("return", Token.Type.KEYWORD_RETURN),
        Map.entry("raise", Token.Type.KEYWORD_RAISE),
        Map.entry("from", Token.Type.KEYWORD_FROM),
        Map.entry("import", Token.Type.KEYWORD_IMPORT),
        Map.entry("as", Token.Type.KEYWORD_AS),
        Map.entry("del", Token.Type.KEYWORD_DEL),
        Map.entry("pass", Token.Type.KEYWORD_PASS),
        Map.entry("break", Token.Type.KEYWORD_BREAK),
        Map.entry("continue", Token.Type.KEYWORD_CONTINUE),
        Map.entry("lambda", Token.Type.KEYWORD_LAMBDA),
        Map.entry("try", Token.Type.KEYWORD_TRY),
        Map.entry("except", Token.Type.KEYWORD_EXCEPT),
        Map.entry("finally", Token.Type.KEYWORD_FINALLY),
        Map.entry("with", Token.Type.KEYWORD_WITH),
        Map.entry("async", Token.Type.KEYWORD_ASYNC),
        Map.entry("await", Token.Type.KEYWORD_AWAIT),
        Map.entry("yield", Token.Type.KEYWORD_YIELD),
        Map.entry("global", Token.Type.KEYWORD_GLOBAL),
        Map.entry("nonlocal", Token.Type.KEYWORD_NONLOCAL),
        Map.entry("assert", Token.Type.KEYWORD_ASSERT)
    );

    // longest operators first
    private static final List<String> OPERATORS = List.of(
        "**=", "//=", ">>=", "<<=", "...",
        "**", "//", "<<", ">>", "<=", ">=", "==", "!=", "->", ":=",
        "+=", "-=", "*=", "/=", "%=", "&=", "|=", "^=", "@=",
        "+", "-", "*", "/", "%", "@", "&", "|", "^", "~", "<", ">",
        "(", ")", "[", "]", "{", "}", ",", ":", ";", ".", "="
    );

    private final String fileName;
    private final String fileContent;

    private int currentPos = 0;
    private int bracketDepth = 0;
    private boolean atLineStart = true;
    private boolean ended = false;
    private Token.Type lastType = Token.Type.NEWLINE;
    private final Deque<Integer> indentations = new ArrayDeque<>();
    private final Deque<Token> pending = new ArrayDeque<>();

    public Lexer(String fileName, String fileContent) {
        this.fileName = fileName;
        this.fileContent = fileContent;
        this.indentations.push(0);
    }

    public static boolean isDigit(char c) {
        return '0' <= c && c <= '9';
    }

    public static boolean isAlphanumeral(char c) {
        return ('0' <= c && c <= '9')
            || ('A' <= c && c <= 'Z')
            || ('a' <= c && c <= 'z')
            || c == '_'
            || (c > 127 && Character.isLetterOrDigit(c));
    }

    private static boolean isIdentifierStart(char c) {
        return Lexer.isAlphanumeral(c) && !Lexer.isDigit(c);
    }

    private char current() {
        if(this.atEnd()) { return '\0'; }
        return this.fileContent.charAt(this.currentPos);
    }

    private char peek(int offset) {
        int pos = this.currentPos + offset;
        if(pos >= this.fileContent.length()) { return '\0'; }
        return this.fileContent.charAt(pos);
    }

    private void next() {
        this.currentPos += 1;
    }

    public boolean atEnd() {
        return this.currentPos >= this.fileContent.length();
    }

    private int find(int from, Function<Character, Boolean> f) {
        int pos = from;
        while(true) {
            if(pos >= this.fileContent.length()) { break; }
            if(f.apply(this.fileContent.charAt(pos))) { break; }
            pos += 1;
        }
        return pos;
    }

    private Source sourceFrom(int startPos) {
        return new Source(this.fileName, startPos, this.currentPos);
    }

    private ErrorException error(
        String message, int startPos, int endPos, String note
    ) {
        return new ErrorException(new Error(
            Error.Kind.FRONT_END,
            message,
            Error.Marking.error(
                new Source(this.fileName, startPos, endPos), note
            )
        ));
    }

    private Token emit(Token token) {
        this.lastType = token.type;
        return token;
    }

    public Token nextToken() throws ErrorException {
        if(!this.pending.isEmpty()) {
            return this.emit(this.pending.poll());
        }
        if(this.atLineStart && this.bracketDepth == 0) {
            this.atLineStart = false;
            if(this.measureIndentation()) {
                return this.emit(this.pending.poll());
            }
        }
        this.skipIgnored();
        if(this.atEnd()) {
            return this.emit(this.endOfFile());
        }
        char c = this.current();
        if(c == '\n' || c == '\r') {
            int startPos = this.currentPos;
            this.next();
            if(c == '\r' && this.current() == '\n') { this.next(); }
            if(this.bracketDepth > 0) {
                return this.nextToken();
            }
            this.atLineStart = true;
            return this.emit(new Token(
                Token.Type.NEWLINE, "\n", this.sourceFrom(startPos)
            ));
        }
        if(Lexer.isDigit(c) || (c == '.' && Lexer.isDigit(this.peek(1)))) {
            return this.emit(this.lexNumber());
        }
        if(c == '"' || c == '\'') {
            return this.emit(this.lexString(this.currentPos, ""));
        }
        if(Lexer.isIdentifierStart(c)) {
            int startPos = this.currentPos;
            int endIdx = this.find(startPos, ch -> !Lexer.isAlphanumeral(ch));
            String content = this.fileContent.substring(startPos, endIdx);
            char after = endIdx < this.fileContent.length()
                ? this.fileContent.charAt(endIdx) : '\0';
            if((after == '"' || after == '\'') && content.length() <= 2) {
                this.currentPos = endIdx;
                return this.emit(this.lexString(startPos, content));
            }
            this.currentPos = endIdx;
            Token.Type type = Lexer.KEYWORDS.getOrDefault(
                content, Token.Type.IDENTIFIER
            );
            return this.emit(
                new Token(type, content, this.sourceFrom(startPos))
            );
        }
        return this.emit(this.lexOperator());
    }

    private boolean measureIndentation() throws ErrorException {
        while(true) {
            int startPos = this.currentPos;
            int width = 0;
            while(this.current() == ' ' || this.current() == '\t'
                    || this.current() == '\f') {
                if(this.current() == '\t') {
                    width = (width / TAB_WIDTH + 1) * TAB_WIDTH;
                } else if(this.current() == ' ') {
                    width += 1;
                }
                this.next();
            }
            char c = this.current();
            if(c == '#') {
                this.currentPos = this.find(
                    this.currentPos, ch -> ch == '\n' || ch == '\r'
                );
                c = this.current();
            }
            if(this.atEnd()) { return false; }
            if(c == '\n' || c == '\r') {
                this.next();
                if(c == '\r' && this.current() == '\n') { this.next(); }
                continue;
            }
            if(c == '\\' && (this.peek(1) == '\n' || this.peek(1) == '\r')) {
                return false;
            }
            int top = this.indentations.peek();
            if(width > top) {
                this.indentations.push(width);
                this.pending.add(new Token(
                    Token.Type.INDENT, "", this.sourceFrom(startPos)
                ));
                return true;
            }
            if(width < top) {
                while(width < this.indentations.peek()) {
                    this.indentations.pop();
                    this.pending.add(new Token(
                        Token.Type.DEDENT, "",
                        new Source(
                            this.fileName, this.currentPos, this.currentPos
                        )
                    ));
                }
                if(width != this.indentations.peek()) {
                    throw this.error(
                        "Inconsistent indentation", startPos, this.currentPos,
                        "this does not match any outer indentation level"
                    );
                }
                return true;
            }
            return false;
        }
    }

    private void skipIgnored() throws ErrorException {
        while(!this.atEnd()) {
            char c = this.current();
            if(c == ' ' || c == '\t' || c == '\f') {
                this.next();
                continue;
            }
            if(c == '#') {
                this.currentPos = this.find(
                    this.currentPos, ch -> ch == '\n' || ch == '\r'
                );
                continue;
            }
            if(c == '\\') {
                char n = this.peek(1);
                if(n == '\n' || n == '\r') {
                    this.next();
                    this.next();
                    if(n == '\r' && this.current() == '\n') { this.next(); }
                    continue;
                }
                throw this.error(
                    "Invalid line continuation",
                    this.currentPos, this.currentPos + 1,
                    "'\\' must be the last character on a line"
                );
            }
            if((c == '\n' || c == '\r') && this.bracketDepth > 0) {
                this.next();
                continue;
            }
            break;
        }
    }

    private Token endOfFile() {
        int end = this.fileContent.length();
        Source location = new Source(this.fileName, end, end);
        if(!this.ended) {
            this.ended = true;
            if(this.lastType != Token.Type.NEWLINE
                    && this.lastType != Token.Type.DEDENT
                    && this.lastType != Token.Type.INDENT) {
                this.pending.add(
                    new Token(Token.Type.NEWLINE, "", location)
                );
            }
            while(this.indentations.peek() > 0) {
                this.indentations.pop();
                this.pending.add(new Token(Token.Type.DEDENT, "", location));
            }
            this.pending.add(new Token(Token.Type.FILE_END, "", location));
            return this.pending.poll();
        }
        return new Token(Token.Type.FILE_END, "", location);
    }

    private Token lexNumber() throws ErrorException {
        int startPos = this.currentPos;
        boolean isFraction = false;
        char c = this.current();
        char radix = Character.toLowerCase(this.peek(1));
        if(c == '0' && (radix == 'x' || radix == 'o' || radix == 'b')) {
            this.next();
            this.next();
            this.currentPos = this.find(
                this.currentPos,
                ch -> !(Lexer.isAlphanumeral(ch))
            );
            String digits = this.fileContent
                .substring(startPos + 2, this.currentPos)
                .replace("_", "");
            int base = radix == 'x'? 16 : radix == 'o'? 8 : 2;
            try {
                new BigInteger(digits, base);
            } catch(NumberFormatException e) {
                throw this.error(
                    "Invalid number literal", startPos, this.currentPos,
                    "'" + this.fileContent.substring(startPos, this.currentPos)
                        + "' is not a valid base " + base + " number"
                );
            }
        } else {
            while(Lexer.isDigit(this.current()) || this.current() == '_') {
                this.next();
            }
            if(this.current() == '.' && this.peek(1) != '.') {
                isFraction = true;
                this.next();
                while(Lexer.isDigit(this.current()) || this.current() == '_') {
                    this.next();
                }
            }
            char e = this.current();
            if(e == 'e' || e == 'E') {
                char sign = this.peek(1);
                int digitOffset = (sign == '+' || sign == '-') ? 2 : 1;
                if(Lexer.isDigit(this.peek(digitOffset))) {
                    isFraction = true;
                    this.currentPos += digitOffset;
                    while(Lexer.isDigit(this.current())
                            || this.current() == '_') {
                        this.next();
                    }
                }
            }
        }
        if(Lexer.isAlphanumeral(this.current())) {
            int endIdx = this.find(
                this.currentPos, ch -> !Lexer.isAlphanumeral(ch)
            );
            throw this.error(
                "Invalid number literal", startPos, endIdx,
                "'" + this.fileContent.substring(startPos, endIdx) + "'"
                    + " is not a supported number"
            );
        }
        String content = this.fileContent.substring(startPos, this.currentPos);
        return new Token(
            isFraction? Token.Type.FRACTION : Token.Type.INTEGER,
            content,
            this.sourceFrom(startPos)
        );
    }

    private Token lexString(int startPos, String prefix) throws ErrorException {
        String lowerPrefix = prefix.toLowerCase();
        if(lowerPrefix.contains("f")) {
            throw this.error(
                "Formatted string literals are not supported",
                startPos, this.currentPos + 1,
                "f-strings have no C equivalent"
            );
        }
        if(lowerPrefix.contains("b")) {
            throw this.error(
                "Byte string literals are not supported",
                startPos, this.currentPos + 1,
                "use a plain string literal instead"
            );
        }
        if(!lowerPrefix.isEmpty() && !lowerPrefix.equals("r")
                && !lowerPrefix.equals("u")) {
            throw this.error(
                "Invalid string prefix", startPos, this.currentPos,
                "'" + prefix + "' is not a valid string prefix"
            );
        }
        boolean raw = lowerPrefix.equals("r");
        char quote = this.current();
        boolean triple = this.peek(1) == quote && this.peek(2) == quote;
        this.currentPos += triple? 3 : 1;
        StringBuilder content = new StringBuilder();
        while(true) {
            if(this.atEnd()) {
                throw this.error(
                    "Unclosed string literal", startPos, startPos + 1,
                    "starts here"
                );
            }
            char c = this.current();
            if(c == quote) {
                if(!triple) {
                    this.next();
                    break;
                }
                if(this.peek(1) == quote && this.peek(2) == quote) {
                    this.currentPos += 3;
                    break;
                }
            }
            if(!triple && (c == '\n' || c == '\r')) {
                throw this.error(
                    "Unclosed string literal", startPos, startPos + 1,
                    "starts here, but the line ends before it is closed"
                );
            }
            if(c != '\\') {
                content.append(c);
                this.next();
                continue;
            }
            this.next();
            char escaped = this.current();
            if(raw) {
                content.append('\\');
                content.append(escaped);
                this.next();
                continue;
            }
            this.next();
            switch(escaped) {
                case '\n': break;
                case '\r':
                    if(this.current() == '\n') { this.next(); }
                    break;
                case '\\': content.append('\\'); break;
                case '\'': content.append('\''); break;
                case '"': content.append('"'); break;
                case 'a': content.append((char) 7); break;
                case 'b': content.append('\b'); break;
                case 'f': content.append('\f'); break;
                case 'n': content.append('\n'); break;
                case 'r': content.append('\r'); break;
                case 't': content.append('\t'); break;
                case 'v': content.append((char) 11); break;
                case 'x': {
                    int value = 0;
                    for(int digit = 0; digit < 2; digit += 1) {
                        value = value * 16 + this.parseHexDigit();
                        this.next();
                    }
                    content.append((char) value);
                    break;
                }
                default:
                    if('0' <= escaped && escaped <= '7') {
                        int value = escaped - '0';
                        for(int digit = 0; digit < 2; digit += 1) {
                            char o = this.current();
                            if(o < '0' || o > '7') { break; }
                            value = value * 8 + (o - '0');
                            this.next();
                        }
                        content.append((char) value);
                    } else {
                        content.append('\\');
                        content.append(escaped);
                    }
            }
        }
        return new Token(
            Token.Type.STRING, content.toString(), this.sourceFrom(startPos)
        );
    }

    private int parseHexDigit() throws ErrorException {
        if(this.atEnd()) {
            throw this.error(
                "Hexadecimal character escape incomplete",
                this.fileContent.length() - 1, this.fileContent.length(),
                "expected [0-9], [a-f] or [A-F] here, but file ends instead"
            );
        }
        char c = this.current();
        if('0' <= c && c <= '9') { return c - '0'; }
        if('a' <= c && c <= 'f') { return c - 'a' + 10; }
        if('A' <= c && c <= 'F') { return c - 'A' + 10; }
        throw this.error(
            "Invalid hexadecimal digit in hexadecimal character escape",
            this.currentPos, this.currentPos + 1,
            "should be [0-9], [a-f] or [A-F]"
        );
    }

    private Token lexOperator() throws ErrorException {
        int startPos = this.currentPos;
        for(String operator: Lexer.OPERATORS) {
            if(!this.fileContent.startsWith(operator, startPos)) {
                continue;
            }
            this.currentPos += operator.length();
            Source source = this.sourceFrom(startPos);
            Token.Type type;
            switch(operator) {
                case "(": this.bracketDepth += 1; type = Token.Type.PAREN_OPEN; break;
                case "[": this.bracketDepth += 1; type = Token.Type.BRACKET_OPEN; break;
                case "{": this.bracketDepth += 1; type = Token.Type.BRACE_OPEN; break;
                case ")": this.closeBracket(); type = Token.Type.PAREN_CLOSE; break;
                case "]": this.closeBracket(); type = Token.Type.BRACKET_CLOSE; break;
                case "}": this.closeBracket(); type = Token.Type.BRACE_CLOSE; break;
                case "...": type = Token.Type.ELLIPSIS; break;
                case "**": type = Token.Type.DOUBLE_ASTERISK; break;
                case "//": type = Token.Type.DOUBLE_SLASH; break;
                case "<<": type = Token.Type.LEFT_SHIFT; break;
                case ">>": type = Token.Type.RIGHT_SHIFT; break;
                case "<=": type = Token.Type.LESS_THAN_EQUAL; break;
                case ">=": type = Token.Type.GREATER_THAN_EQUAL; break;
                case "==": type = Token.Type.DOUBLE_EQUALS; break;
                case "!=": type = Token.Type.NOT_EQUALS; break;
                case "->": type = Token.Type.ARROW; break;
                case ":=": type = Token.Type.WALRUS; break;
                case "+": type = Token.Type.PLUS; break;
                case "-": type = Token.Type.MINUS; break;
                case "*": type = Token.Type.ASTERISK; break;
                case "/": type = Token.Type.SLASH; break;
                case "%": type = Token.Type.PERCENT; break;
                case "@": type = Token.Type.AT; break;
                case "&": type = Token.Type.AMPERSAND; break;
                case "|": type = Token.Type.PIPE; break;
                case "^": type = Token.Type.CARET; break;
                case "~": type = Token.Type.TILDE; break;
                case "<": type = Token.Type.LESS_THAN; break;
                case ">": type = Token.Type.GREATER_THAN; break;
                case ",": type = Token.Type.COMMA; break;
                case ":": type = Token.Type.COLON; break;
                case ";": type = Token.Type.SEMICOLON; break;
                case ".": type = Token.Type.DOT; break;
                case "=": type = Token.Type.EQUALS; break;
                default: type = Token.Type.AUGMENTED_ASSIGNMENT;
            }
            return new Token(type, operator, source);
        }
        throw this.error(
            "Invalid character", this.currentPos, this.currentPos + 1,
            "'" + this.current() + "' is not a valid character"
        );
    }

    private void closeBracket() {
        if(this.bracketDepth > 0) { this.bracketDepth -= 1; }
    }

}
