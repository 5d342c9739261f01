package typesafeschwalbe.arafura.compiler.frontend;

import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;

public abstract class Parser {

    private final List<Token> tokens;
    private int position;
    protected Token current;

    public Parser(Lexer lexer) throws ErrorException {
        this.tokens = new ArrayList<>();
        while(true) {
            Token token = lexer.nextToken();
            this.tokens.add(token);
            if(token.type == Token.Type.FILE_END) { break; }
        }
        this.position = 0;
        this.current = this.tokens.get(0);
    }

    protected void throwUnexpected(String expected) throws ErrorException {
        throw new ErrorException(new Error(
            Error.Kind.FRONT_END,
            "Unexpected syntax",
            Error.Marking.error(
                this.current.source,
                "expected " + expected + ", but " + (
                    this.current.type == Token.Type.FILE_END
                        ? "reached the end of the file"
                        : "got " + this.current.type.description + " instead"
                )
            )
        ));
    }

    protected void throwUnsupported(String what) throws ErrorException {
        throw new ErrorException(new Error(
            Error.Kind.FRONT_END,
            "Unsupported syntax",
            Error.Marking.error(
                this.current.source,
                what + " cannot be translated to C"
            )
        ));
    }

    protected void next() {
        if(this.position < this.tokens.size() - 1) {
            this.position += 1;
        }
        this.current = this.tokens.get(this.position);
    }

    protected Token previous() {
        return this.tokens.get(Math.max(0, this.position - 1));
    }

    protected Token peek(int offset) {
        int index = Math.min(this.position + offset, this.tokens.size() - 1);
        return this.tokens.get(index);
    }

    /**
     * Checks whether the logical line starting at the current token ends
     * with a colon, as the head of a compound statement does.
     */
    protected boolean lineEndsWithColon() {
        int depth = 0;
        Token last = this.current;
        for(int index = this.position; index < this.tokens.size(); index += 1) {
            Token token = this.tokens.get(index);
            switch(token.type) {
                case PAREN_OPEN: case BRACKET_OPEN: case BRACE_OPEN:
                    depth += 1;
                    break;
                case PAREN_CLOSE: case BRACKET_CLOSE: case BRACE_CLOSE:
                    depth -= 1;
                    break;
                case NEWLINE: case FILE_END:
                    return depth == 0 && last.type == Token.Type.COLON;
                default:
                    break;
            }
            last = token;
        }
        return false;
    }

    protected void expect(Token.Type... allowedTypes) throws ErrorException {
        if(!List.of(allowedTypes).contains(this.current.type)) {
            StringBuilder expected = new StringBuilder();
            for(int expIdx = 0; expIdx < allowedTypes.length; expIdx += 1) {
                if(expIdx > 0) { expected.append(
                    expIdx < allowedTypes.length - 1? ", " : " or "
                ); }
                expected.append(allowedTypes[expIdx].description);
            }
            this.throwUnexpected(expected.toString());
        }
    }

}
