package typesafeschwalbe.arafura.compiler.frontend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.Source;

public class SourceParser extends Parser {

    private static final int POSTFIX_PRECEDENCE = 1;
    private static final int COMPARISON_PRECEDENCE = 10;
    private static final int BITWISE_OR_PRECEDENCE = 9;

    public SourceParser(Lexer lexer) throws ErrorException {
        super(lexer);
    }

    public AstNode parseModule() throws ErrorException {
        Token start = this.current;
        List<AstNode> statements = new ArrayList<>();
        while(this.current.type != Token.Type.FILE_END) {
            if(this.current.type == Token.Type.NEWLINE) {
                this.next();
                continue;
            }
            statements.addAll(this.parseStatement());
        }
        return new AstNode(
            AstNode.Type.MODULE,
            new AstNode.Block(statements),
            new Source(start.source, this.current.source)
        );
    }

    private List<AstNode> parseBlock() throws ErrorException {
        this.expect(Token.Type.COLON);
        this.next();
        if(this.current.type != Token.Type.NEWLINE) {
            return this.parseSimpleStatements();
        }
        this.next();
        this.expect(Token.Type.INDENT);
        this.next();
        List<AstNode> statements = new ArrayList<>();
        while(this.current.type != Token.Type.DEDENT
                && this.current.type != Token.Type.FILE_END) {
            statements.addAll(this.parseStatement());
        }
        this.expect(Token.Type.DEDENT);
        this.next();
        return statements;
    }

    private static Source blockSource(Token start, List<AstNode> body) {
        if(body.isEmpty()) { return start.source; }
        return new Source(start.source, body.get(body.size() - 1).source);
    }

    private List<AstNode> parseStatement() throws ErrorException {
        Token start = this.current;
        switch(this.current.type) {
            case AT: {
                List<AstNode> decorators = new ArrayList<>();
                while(this.current.type == Token.Type.AT) {
                    this.next();
                    decorators.add(this.parseExpression());
                    this.expect(Token.Type.NEWLINE);
                    this.next();
                }
                this.expect(Token.Type.KEYWORD_DEF, Token.Type.KEYWORD_CLASS);
                if(this.current.type == Token.Type.KEYWORD_DEF) {
                    return List.of(this.parseDefinition(start, decorators));
                }
                return List.of(this.parseComposite(start, decorators));
            }
            case KEYWORD_DEF: {
                return List.of(this.parseDefinition(start, List.of()));
            }
            case KEYWORD_CLASS: {
                return List.of(this.parseComposite(start, List.of()));
            }
            case KEYWORD_IF: {
                return List.of(this.parseConditional());
            }
            case KEYWORD_WHILE: {
                this.next();
                AstNode condition = this.parseExpression();
                List<AstNode> body = this.parseBlock();
                List<AstNode> elseBody = this.parseElse();
                return List.of(new AstNode(
                    AstNode.Type.WHILE_LOOP,
                    new AstNode.Loop(condition, body, elseBody),
                    SourceParser.blockSource(start, body)
                ));
            }
            case KEYWORD_FOR: {
                this.next();
                AstNode target = this.parseTargetList();
                this.expect(Token.Type.KEYWORD_IN);
                this.next();
                AstNode iterated = this.parseExpressionList();
                List<AstNode> body = this.parseBlock();
                List<AstNode> elseBody = this.parseElse();
                return List.of(new AstNode(
                    AstNode.Type.FOR_LOOP,
                    new AstNode.ForLoop(target, iterated, body, elseBody),
                    SourceParser.blockSource(start, body)
                ));
            }
            case IDENTIFIER: {
                if(this.current.content.equals("match")
                        && this.startsMatchStatement()) {
                    return List.of(this.parseMatch());
                }
                return this.parseSimpleStatements();
            }
            case KEYWORD_TRY:
            case KEYWORD_EXCEPT:
            case KEYWORD_FINALLY:
                this.throwUnsupported("exception handling");
            case KEYWORD_WITH:
                this.throwUnsupported("a 'with'-statement");
            case KEYWORD_ASYNC:
                this.throwUnsupported("asynchronous code");
            default:
                return this.parseSimpleStatements();
        }
    }

    private boolean startsMatchStatement() {
        switch(this.peek(1).type) {
            case EQUALS: case COLON: case DOT: case AUGMENTED_ASSIGNMENT:
            case NEWLINE: case COMMA:
                return false;
            default:
                return this.lineEndsWithColon();
        }
    }

    private List<AstNode> parseElse() throws ErrorException {
        if(this.current.type != Token.Type.KEYWORD_ELSE) {
            return List.of();
        }
        this.next();
        return this.parseBlock();
    }

    private AstNode parseConditional() throws ErrorException {
        Token start = this.current;
        this.expect(Token.Type.KEYWORD_IF, Token.Type.KEYWORD_ELIF);
        this.next();
        AstNode condition = this.parseExpression();
        List<AstNode> body = this.parseBlock();
        List<AstNode> elseBody;
        if(this.current.type == Token.Type.KEYWORD_ELIF) {
            elseBody = List.of(this.parseConditional());
        } else {
            elseBody = this.parseElse();
        }
        return new AstNode(
            AstNode.Type.CONDITIONAL,
            new AstNode.Conditional(condition, body, elseBody),
            SourceParser.blockSource(
                start, elseBody.isEmpty()? body : elseBody
            )
        );
    }

    private AstNode parseMatch() throws ErrorException {
        Token start = this.current;
        this.next();
        AstNode subject = this.parseExpressionList();
        this.expect(Token.Type.COLON);
        this.next();
        this.expect(Token.Type.NEWLINE);
        this.next();
        this.expect(Token.Type.INDENT);
        this.next();
        List<AstNode.SwitchCase> cases = new ArrayList<>();
        Source end = start.source;
        while(this.current.type != Token.Type.DEDENT
                && this.current.type != Token.Type.FILE_END) {
            Token caseStart = this.current;
            if(this.current.type != Token.Type.IDENTIFIER
                    || !this.current.content.equals("case")) {
                this.throwUnexpected("'case'");
            }
            this.next();
            List<AstNode> patterns = new ArrayList<>();
            patterns.add(this.parseExpression(BITWISE_OR_PRECEDENCE));
            while(this.current.type == Token.Type.PIPE) {
                this.next();
                patterns.add(this.parseExpression(BITWISE_OR_PRECEDENCE));
            }
            Optional<AstNode> guard = Optional.empty();
            if(this.current.type == Token.Type.KEYWORD_IF) {
                this.next();
                guard = Optional.of(this.parseExpression());
            }
            List<AstNode> body = this.parseBlock();
            Source caseSource = SourceParser.blockSource(caseStart, body);
            cases.add(new AstNode.SwitchCase(
                patterns, guard, body, caseSource
            ));
            end = caseSource;
        }
        this.expect(Token.Type.DEDENT);
        this.next();
        return new AstNode(
            AstNode.Type.SWITCH,
            new AstNode.Switch(subject, cases),
            new Source(start.source, end)
        );
    }

    private AstNode.Parameter parseParameter() throws ErrorException {
        this.expect(Token.Type.IDENTIFIER);
        Token name = this.current;
        this.next();
        Optional<AstNode> annotation = Optional.empty();
        if(this.current.type == Token.Type.COLON) {
            this.next();
            annotation = Optional.of(this.parseExpression());
        }
        Optional<AstNode> defaultValue = Optional.empty();
        if(this.current.type == Token.Type.EQUALS) {
            this.next();
            defaultValue = Optional.of(this.parseExpression());
        }
        Source source = name.source;
        if(defaultValue.isPresent()) {
            source = new Source(name.source, defaultValue.get().source);
        } else if(annotation.isPresent()) {
            source = new Source(name.source, annotation.get().source);
        }
        return new AstNode.Parameter(
            name.content, annotation, defaultValue, source
        );
    }

    private AstNode parseDefinition(
        Token start, List<AstNode> decorators
    ) throws ErrorException {
        this.expect(Token.Type.KEYWORD_DEF);
        this.next();
        this.expect(Token.Type.IDENTIFIER);
        String name = this.current.content;
        this.next();
        this.expect(Token.Type.PAREN_OPEN);
        this.next();
        List<AstNode.Parameter> parameters = new ArrayList<>();
        Optional<AstNode.Parameter> variadic = Optional.empty();
        List<AstNode.Parameter> keywordOnly = new ArrayList<>();
        boolean afterStar = false;
        while(this.current.type != Token.Type.PAREN_CLOSE) {
            switch(this.current.type) {
                case ASTERISK: {
                    if(afterStar) {
                        this.throwUnexpected("a parameter name");
                    }
                    this.next();
                    afterStar = true;
                    if(this.current.type == Token.Type.IDENTIFIER) {
                        variadic = Optional.of(this.parseParameter());
                    }
                    break;
                }
                case DOUBLE_ASTERISK:
                    this.throwUnsupported("a keyword argument collector");
                case SLASH:
                    this.throwUnsupported("a positional-only marker");
                default: {
                    AstNode.Parameter parameter = this.parseParameter();
                    if(afterStar) {
                        keywordOnly.add(parameter);
                    } else {
                        parameters.add(parameter);
                    }
                }
            }
            this.expect(Token.Type.COMMA, Token.Type.PAREN_CLOSE);
            if(this.current.type == Token.Type.COMMA) {
                this.next();
            }
        }
        this.next();
        Optional<AstNode> returnType = Optional.empty();
        if(this.current.type == Token.Type.ARROW) {
            this.next();
            returnType = Optional.of(this.parseExpression());
        }
        List<AstNode> body = this.parseBlock();
        return new AstNode(
            AstNode.Type.DEFINITION,
            new AstNode.Definition(
                name, parameters, variadic, keywordOnly, returnType,
                decorators, body
            ),
            SourceParser.blockSource(start, body)
        );
    }

    private AstNode parseComposite(
        Token start, List<AstNode> decorators
    ) throws ErrorException {
        this.expect(Token.Type.KEYWORD_CLASS);
        this.next();
        this.expect(Token.Type.IDENTIFIER);
        String name = this.current.content;
        this.next();
        List<AstNode> bases = new ArrayList<>();
        if(this.current.type == Token.Type.PAREN_OPEN) {
            this.next();
            while(this.current.type != Token.Type.PAREN_CLOSE) {
                if(this.current.type == Token.Type.IDENTIFIER
                        && this.peek(1).type == Token.Type.EQUALS) {
                    this.throwUnsupported("a class keyword");
                }
                bases.add(this.parseExpression());
                this.expect(Token.Type.COMMA, Token.Type.PAREN_CLOSE);
                if(this.current.type == Token.Type.COMMA) {
                    this.next();
                }
            }
            this.next();
        }
        List<AstNode> body = this.parseBlock();
        return new AstNode(
            AstNode.Type.COMPOSITE_DEFINITION,
            new AstNode.CompositeDefinition(name, bases, decorators, body),
            SourceParser.blockSource(start, body)
        );
    }

    private List<AstNode> parseSimpleStatements() throws ErrorException {
        List<AstNode> statements = new ArrayList<>();
        while(true) {
            statements.add(this.parseSimpleStatement());
            if(this.current.type == Token.Type.SEMICOLON) {
                this.next();
                if(this.current.type == Token.Type.NEWLINE
                        || this.current.type == Token.Type.FILE_END) {
                    break;
                }
                continue;
            }
            break;
        }
        this.expect(Token.Type.NEWLINE, Token.Type.FILE_END);
        this.next();
        return statements;
    }

    private boolean atStatementEnd() {
        switch(this.current.type) {
            case NEWLINE: case SEMICOLON: case FILE_END:
                return true;
            default:
                return false;
        }
    }

    private AstNode parseSimpleStatement() throws ErrorException {
        Token start = this.current;
        switch(this.current.type) {
            case KEYWORD_PASS: {
                this.next();
                return new AstNode(AstNode.Type.PASS, null, start.source);
            }
            case KEYWORD_BREAK: {
                this.next();
                return new AstNode(AstNode.Type.BREAK, null, start.source);
            }
            case KEYWORD_CONTINUE: {
                this.next();
                return new AstNode(AstNode.Type.CONTINUE, null, start.source);
            }
            case KEYWORD_RETURN: {
                this.next();
                if(this.atStatementEnd()) {
                    return new AstNode(AstNode.Type.RETURN, null, start.source);
                }
                AstNode value = this.parseExpressionList();
                return new AstNode(
                    AstNode.Type.RETURN,
                    new AstNode.MonoOp(value),
                    new Source(start.source, value.source)
                );
            }
            case KEYWORD_RAISE: {
                this.next();
                Optional<AstNode> target = Optional.empty();
                Optional<AstNode> cause = Optional.empty();
                if(!this.atStatementEnd()) {
                    target = Optional.of(this.parseExpression());
                    if(this.current.type == Token.Type.KEYWORD_FROM) {
                        this.next();
                        cause = Optional.of(this.parseExpression());
                    }
                }
                return new AstNode(
                    AstNode.Type.JUMP,
                    new AstNode.Jump(target, cause),
                    new Source(start.source, this.previous().source)
                );
            }
            case KEYWORD_IMPORT: {
                this.next();
                List<String> modules = new ArrayList<>();
                modules.add(this.parseDottedName());
                while(this.current.type == Token.Type.COMMA) {
                    this.next();
                    modules.add(this.parseDottedName());
                }
                return new AstNode(
                    AstNode.Type.IMPORT,
                    new AstNode.Import(modules),
                    new Source(start.source, this.previous().source)
                );
            }
            case KEYWORD_FROM: {
                this.next();
                if(this.current.type == Token.Type.DOT
                        || this.current.type == Token.Type.ELLIPSIS) {
                    this.throwUnsupported("a relative import");
                }
                String module = this.parseDottedName();
                this.expect(Token.Type.KEYWORD_IMPORT);
                this.next();
                List<String> names = new ArrayList<>();
                if(this.current.type == Token.Type.ASTERISK) {
                    names.add("*");
                    this.next();
                } else {
                    boolean parenthesized
                        = this.current.type == Token.Type.PAREN_OPEN;
                    if(parenthesized) { this.next(); }
                    while(true) {
                        names.add(this.parseImportedName());
                        if(this.current.type != Token.Type.COMMA) { break; }
                        this.next();
                        if(this.current.type == Token.Type.PAREN_CLOSE) {
                            break;
                        }
                    }
                    if(parenthesized) {
                        this.expect(Token.Type.PAREN_CLOSE);
                        this.next();
                    }
                }
                return new AstNode(
                    AstNode.Type.FROM_IMPORT,
                    new AstNode.FromImport(module, names),
                    new Source(start.source, this.previous().source)
                );
            }
            case KEYWORD_DEL: {
                this.next();
                List<AstNode> targets = new ArrayList<>();
                targets.add(this.parseExpression());
                while(this.current.type == Token.Type.COMMA) {
                    this.next();
                    targets.add(this.parseExpression());
                }
                return new AstNode(
                    AstNode.Type.UNDEFINE,
                    new AstNode.ArrayLiteral(targets),
                    new Source(start.source, this.previous().source)
                );
            }
            case KEYWORD_GLOBAL:
            case KEYWORD_NONLOCAL:
                this.throwUnsupported("a scope declaration");
            case KEYWORD_ASSERT:
                this.throwUnsupported("an 'assert'-statement");
            case IDENTIFIER: {
                if(this.current.content.equals("type")
                        && this.peek(1).type == Token.Type.IDENTIFIER) {
                    return this.parseTypeAlias();
                }
                break;
            }
            default:
                break;
        }
        AstNode first = this.parseExpressionList();
        switch(this.current.type) {
            case COLON: {
                this.next();
                AstNode annotation = this.parseExpression();
                Optional<AstNode> value = Optional.empty();
                if(this.current.type == Token.Type.EQUALS) {
                    this.next();
                    value = Optional.of(this.parseExpressionList());
                }
                return new AstNode(
                    AstNode.Type.DECLARATION,
                    new AstNode.Declaration(first, annotation, value),
                    new Source(start.source, this.previous().source)
                );
            }
            case AUGMENTED_ASSIGNMENT: {
                AstNode.Type operator = SourceParser
                    .augmentedOperatorOf(this.current);
                this.next();
                AstNode value = this.parseExpressionList();
                return new AstNode(
                    AstNode.Type.AUGMENTED_ASSIGNMENT,
                    new AstNode.AugmentedAssignment(first, operator, value),
                    new Source(first.source, value.source)
                );
            }
            case EQUALS: {
                List<AstNode> targets = new ArrayList<>();
                AstNode value = first;
                while(this.current.type == Token.Type.EQUALS) {
                    targets.add(value);
                    this.next();
                    value = this.parseExpressionList();
                }
                return new AstNode(
                    AstNode.Type.ASSIGNMENT,
                    new AstNode.Assignment(targets, value),
                    new Source(first.source, value.source)
                );
            }
            default: {
                return new AstNode(
                    AstNode.Type.EXPRESSION_STATEMENT,
                    new AstNode.MonoOp(first),
                    first.source
                );
            }
        }
    }

    private AstNode parseTypeAlias() throws ErrorException {
        Token start = this.current;
        this.next();
        this.expect(Token.Type.IDENTIFIER);
        String name = this.current.content;
        this.next();
        if(this.current.type == Token.Type.BRACKET_OPEN) {
            this.throwUnsupported("a generic type alias");
        }
        this.expect(Token.Type.EQUALS);
        this.next();
        AstNode value = this.parseExpression();
        return new AstNode(
            AstNode.Type.TYPE_ALIAS,
            new AstNode.TypeAlias(name, value),
            new Source(start.source, value.source)
        );
    }

    private String parseDottedName() throws ErrorException {
        this.expect(Token.Type.IDENTIFIER);
        StringBuilder name = new StringBuilder(this.current.content);
        this.next();
        while(this.current.type == Token.Type.DOT) {
            this.next();
            this.expect(Token.Type.IDENTIFIER);
            name.append(".");
            name.append(this.current.content);
            this.next();
        }
        if(this.current.type == Token.Type.KEYWORD_AS) {
            this.throwUnsupported("an import alias");
        }
        return name.toString();
    }

    private String parseImportedName() throws ErrorException {
        this.expect(Token.Type.IDENTIFIER);
        String name = this.current.content;
        this.next();
        if(this.current.type == Token.Type.KEYWORD_AS) {
            this.throwUnsupported("an import alias");
        }
        return name;
    }

    private static AstNode.Type augmentedOperatorOf(Token token) {
        switch(token.content) {
            case "+=": return AstNode.Type.ADD;
            case "-=": return AstNode.Type.SUBTRACT;
            case "*=": return AstNode.Type.MULTIPLY;
            case "/=": return AstNode.Type.DIVIDE;
            case "//=": return AstNode.Type.FLOOR_DIVIDE;
            case "%=": return AstNode.Type.MODULO;
            case "**=": return AstNode.Type.POWER;
            case "@=": return AstNode.Type.MATRIX_MULTIPLY;
            case "&=": return AstNode.Type.BITWISE_AND;
            case "|=": return AstNode.Type.BITWISE_OR;
            case "^=": return AstNode.Type.BITWISE_XOR;
            case "<<=": return AstNode.Type.LEFT_SHIFT;
            case ">>=": return AstNode.Type.RIGHT_SHIFT;
            default:
                throw new IllegalStateException(
                    "unhandled augmented assignment '" + token.content + "'"
                );
        }
    }

    private AstNode parseTargetList() throws ErrorException {
        AstNode first = this.parseExpression(COMPARISON_PRECEDENCE);
        if(this.current.type != Token.Type.COMMA) {
            return first;
        }
        List<AstNode> targets = new ArrayList<>();
        targets.add(first);
        while(this.current.type == Token.Type.COMMA) {
            this.next();
            if(this.current.type == Token.Type.KEYWORD_IN) { break; }
            targets.add(this.parseExpression(COMPARISON_PRECEDENCE));
        }
        return new AstNode(
            AstNode.Type.TUPLE_LITERAL,
            new AstNode.ArrayLiteral(targets),
            new Source(first.source, this.previous().source)
        );
    }

    private boolean endsExpressionList() {
        switch(this.current.type) {
            case NEWLINE: case SEMICOLON: case FILE_END: case EQUALS:
            case COLON: case AUGMENTED_ASSIGNMENT: case PAREN_CLOSE:
            case BRACKET_CLOSE:
                return true;
            default:
                return false;
        }
    }

    private AstNode parseExpressionList() throws ErrorException {
        AstNode first = this.parseExpression();
        if(this.current.type != Token.Type.COMMA) {
            return first;
        }
        List<AstNode> values = new ArrayList<>();
        values.add(first);
        while(this.current.type == Token.Type.COMMA) {
            this.next();
            if(this.endsExpressionList()) { break; }
            values.add(this.parseExpression());
        }
        return new AstNode(
            AstNode.Type.TUPLE_LITERAL,
            new AstNode.ArrayLiteral(values),
            new Source(first.source, this.previous().source)
        );
    }

    private AstNode parseExpression() throws ErrorException {
        return this.parseExpression(999);
    }

    private int infixPrecedenceOf(Token token) {
        switch(token.type) {
            case PAREN_OPEN:
            case BRACKET_OPEN:
            case DOT:
                return POSTFIX_PRECEDENCE;
            case KEYWORD_IN:
            case KEYWORD_IS:
                return COMPARISON_PRECEDENCE;
            case KEYWORD_NOT:
                return this.peek(1).type == Token.Type.KEYWORD_IN
                    ? COMPARISON_PRECEDENCE : 0;
            case WALRUS:
                return Token.Type.WALRUS_PRECEDENCE;
            default:
                return token.type.infixPrecedence;
        }
    }

    private static AstNode.Type infixBiOpNodeType(Token token) {
        switch(token.type) {
            case DOUBLE_ASTERISK: return AstNode.Type.POWER;
            case ASTERISK: return AstNode.Type.MULTIPLY;
            case SLASH: return AstNode.Type.DIVIDE;
            case DOUBLE_SLASH: return AstNode.Type.FLOOR_DIVIDE;
            case PERCENT: return AstNode.Type.MODULO;
            case AT: return AstNode.Type.MATRIX_MULTIPLY;
            case PLUS: return AstNode.Type.ADD;
            case MINUS: return AstNode.Type.SUBTRACT;
            case LEFT_SHIFT: return AstNode.Type.LEFT_SHIFT;
            case RIGHT_SHIFT: return AstNode.Type.RIGHT_SHIFT;
            case AMPERSAND: return AstNode.Type.BITWISE_AND;
            case CARET: return AstNode.Type.BITWISE_XOR;
            case PIPE: return AstNode.Type.BITWISE_OR;
            default:
                throw new IllegalStateException(
                    "unhandled binary operator " + token.type
                );
        }
    }

    private static AstNode.Comparator comparatorOf(Token token) {
        switch(token.type) {
            case DOUBLE_EQUALS: return AstNode.Comparator.EQUALS;
            case NOT_EQUALS: return AstNode.Comparator.NOT_EQUALS;
            case LESS_THAN: return AstNode.Comparator.LESS_THAN;
            case LESS_THAN_EQUAL: return AstNode.Comparator.LESS_THAN_EQUAL;
            case GREATER_THAN: return AstNode.Comparator.GREATER_THAN;
            case GREATER_THAN_EQUAL:
                return AstNode.Comparator.GREATER_THAN_EQUAL;
            default:
                throw new IllegalStateException(
                    "unhandled comparison operator " + token.type
                );
        }
    }

    private AstNode parseExpression(int precedence) throws ErrorException {
        Token start = this.current;
        Optional<AstNode> previous = Optional.empty();
        while(true) {
            int currentPrecedence = this.infixPrecedenceOf(this.current);
            if(previous.isPresent()) {
                if(currentPrecedence == 0 || currentPrecedence >= precedence) {
                    return previous.get();
                }
                switch(this.current.type) {
                    case PAREN_OPEN: {
                        previous = Optional.of(this.parseCall(previous.get()));
                        continue;
                    }
                    case BRACKET_OPEN: {
                        AstNode accessed = previous.get();
                        this.next();
                        if(this.current.type == Token.Type.COLON) {
                            this.throwUnsupported("a slice");
                        }
                        AstNode index = this.parseExpressionList();
                        if(this.current.type == Token.Type.COLON) {
                            this.throwUnsupported("a slice");
                        }
                        this.expect(Token.Type.BRACKET_CLOSE);
                        Token end = this.current;
                        this.next();
                        previous = Optional.of(new AstNode(
                            AstNode.Type.INDEX_ACCESS,
                            new AstNode.IndexAccess(accessed, index),
                            new Source(accessed.source, end.source)
                        ));
                        continue;
                    }
                    case DOT: {
                        AstNode accessed = previous.get();
                        this.next();
                        this.expect(Token.Type.IDENTIFIER);
                        Token member = this.current;
                        this.next();
                        previous = Optional.of(new AstNode(
                            AstNode.Type.MEMBER_ACCESS,
                            new AstNode.MemberAccess(accessed, member.content),
                            new Source(accessed.source, member.source)
                        ));
                        continue;
                    }
                    case DOUBLE_ASTERISK: {
                        AstNode left = previous.get();
                        this.next();
                        AstNode right = this.parseExpression(
                            Token.Type.PREFIX_UNARY_PRECEDENCE
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.POWER,
                            new AstNode.BiOp(left, right),
                            new Source(left.source, right.source)
                        ));
                        continue;
                    }
                    case ASTERISK:
                    case SLASH:
                    case DOUBLE_SLASH:
                    case PERCENT:
                    case AT:
                    case PLUS:
                    case MINUS:
                    case LEFT_SHIFT:
                    case RIGHT_SHIFT:
                    case AMPERSAND:
                    case CARET:
                    case PIPE: {
                        Token operator = this.current;
                        AstNode left = previous.get();
                        this.next();
                        AstNode right = this.parseExpression(currentPrecedence);
                        previous = Optional.of(new AstNode(
                            SourceParser.infixBiOpNodeType(operator),
                            new AstNode.BiOp(left, right),
                            new Source(left.source, right.source)
                        ));
                        continue;
                    }
                    case KEYWORD_IN:
                    case KEYWORD_IS:
                    case KEYWORD_NOT:
                        this.throwUnsupported("an identity or membership test");
                    case LESS_THAN:
                    case GREATER_THAN:
                    case LESS_THAN_EQUAL:
                    case GREATER_THAN_EQUAL:
                    case DOUBLE_EQUALS:
                    case NOT_EQUALS: {
                        AstNode first = previous.get();
                        List<AstNode.Comparator> operators = new ArrayList<>();
                        List<AstNode> operands = new ArrayList<>();
                        AstNode last = first;
                        while(this.infixPrecedenceOf(this.current)
                                == COMPARISON_PRECEDENCE) {
                            if(this.current.type == Token.Type.KEYWORD_IN
                                    || this.current.type == Token.Type.KEYWORD_IS
                                    || this.current.type == Token.Type.KEYWORD_NOT) {
                                this.throwUnsupported(
                                    "an identity or membership test"
                                );
                            }
                            operators.add(SourceParser.comparatorOf(this.current));
                            this.next();
                            last = this.parseExpression(COMPARISON_PRECEDENCE);
                            operands.add(last);
                        }
                        previous = Optional.of(new AstNode(
                            AstNode.Type.COMPARISON,
                            new AstNode.Comparison(first, operators, operands),
                            new Source(first.source, last.source)
                        ));
                        continue;
                    }
                    case KEYWORD_AND:
                    case KEYWORD_OR: {
                        Token.Type operator = this.current.type;
                        AstNode first = previous.get();
                        List<AstNode> operands = new ArrayList<>();
                        operands.add(first);
                        while(this.current.type == operator) {
                            this.next();
                            operands.add(this.parseExpression(currentPrecedence));
                        }
                        previous = Optional.of(new AstNode(
                            operator == Token.Type.KEYWORD_AND
                                ? AstNode.Type.AND : AstNode.Type.OR,
                            new AstNode.Junction(operands),
                            new Source(
                                first.source,
                                operands.get(operands.size() - 1).source
                            )
                        ));
                        continue;
                    }
                    case KEYWORD_IF: {
                        AstNode ifValue = previous.get();
                        this.next();
                        AstNode condition = this.parseExpression(
                            currentPrecedence
                        );
                        this.expect(Token.Type.KEYWORD_ELSE);
                        this.next();
                        AstNode elseValue = this.parseExpression(
                            currentPrecedence + 1
                        );
                        previous = Optional.of(new AstNode(
                            AstNode.Type.TERNARY,
                            new AstNode.Ternary(condition, ifValue, elseValue),
                            new Source(ifValue.source, elseValue.source)
                        ));
                        continue;
                    }
                    case WALRUS: {
                        AstNode target = previous.get();
                        if(!target.isIdentifier()) {
                            throw new ErrorException(new Error(
                                Error.Kind.FRONT_END,
                                "Invalid assignment expression",
                                Error.Marking.error(
                                    target.source,
                                    "only a name may be assigned to here"
                                )
                            ));
                        }
                        this.next();
                        AstNode value = this.parseExpression(currentPrecedence);
                        previous = Optional.of(new AstNode(
                            AstNode.Type.ASSIGNMENT_VALUE,
                            new AstNode.BiOp(target, value),
                            new Source(target.source, value.source)
                        ));
                        continue;
                    }
                    default: {
                        return previous.get();
                    }
                }
            }
            switch(this.current.type) {
                case PLUS:
                case MINUS:
                case TILDE: {
                    Token operator = this.current;
                    this.next();
                    AstNode value = this.parseExpression(
                        Token.Type.PREFIX_UNARY_PRECEDENCE
                    );
                    AstNode.Type type = operator.type == Token.Type.PLUS
                        ? AstNode.Type.POSITIVE
                        : operator.type == Token.Type.MINUS
                            ? AstNode.Type.NEGATE
                            : AstNode.Type.BITWISE_NOT;
                    previous = Optional.of(new AstNode(
                        type,
                        new AstNode.MonoOp(value),
                        new Source(start.source, value.source)
                    ));
                    continue;
                }
                case KEYWORD_NOT: {
                    this.next();
                    AstNode value = this.parseExpression(
                        Token.Type.PREFIX_NOT_PRECEDENCE
                    );
                    previous = Optional.of(new AstNode(
                        AstNode.Type.NOT,
                        new AstNode.MonoOp(value),
                        new Source(start.source, value.source)
                    ));
                    continue;
                }
                case IDENTIFIER: {
                    this.next();
                    previous = Optional.of(new AstNode(
                        AstNode.Type.IDENTIFIER,
                        new AstNode.Identifier(start.content),
                        start.source
                    ));
                    continue;
                }
                case INTEGER:
                case FRACTION: {
                    this.next();
                    previous = Optional.of(new AstNode(
                        start.type == Token.Type.INTEGER
                            ? AstNode.Type.INTEGER_LITERAL
                            : AstNode.Type.FLOAT_LITERAL,
                        new AstNode.SimpleLiteral(start.content),
                        start.source
                    ));
                    continue;
                }
                case STRING: {
                    StringBuilder content = new StringBuilder();
                    Token end = this.current;
                    while(this.current.type == Token.Type.STRING) {
                        content.append(this.current.content);
                        end = this.current;
                        this.next();
                    }
                    previous = Optional.of(new AstNode(
                        AstNode.Type.STRING_LITERAL,
                        new AstNode.SimpleLiteral(content.toString()),
                        new Source(start.source, end.source)
                    ));
                    continue;
                }
                case KEYWORD_TRUE:
                case KEYWORD_FALSE: {
                    this.next();
                    previous = Optional.of(new AstNode(
                        AstNode.Type.BOOLEAN_LITERAL,
                        new AstNode.SimpleLiteral(start.content),
                        start.source
                    ));
                    continue;
                }
                case KEYWORD_NONE: {
                    this.next();
                    previous = Optional.of(new AstNode(
                        AstNode.Type.NONE_LITERAL, null, start.source
                    ));
                    continue;
                }
                case ELLIPSIS: {
                    this.next();
                    previous = Optional.of(new AstNode(
                        AstNode.Type.ELLIPSIS_LITERAL, null, start.source
                    ));
                    continue;
                }
                case PAREN_OPEN: {
                    previous = Optional.of(this.parseParenthesized());
                    continue;
                }
                case BRACKET_OPEN: {
                    this.next();
                    List<AstNode> values = this.parseSequence(
                        Token.Type.BRACKET_CLOSE
                    );
                    Token end = this.current;
                    this.next();
                    previous = Optional.of(new AstNode(
                        AstNode.Type.LIST_LITERAL,
                        new AstNode.ArrayLiteral(values),
                        new Source(start.source, end.source)
                    ));
                    continue;
                }
                case BRACE_OPEN: {
                    previous = Optional.of(this.parseMapping());
                    continue;
                }
                case ASTERISK:
                case DOUBLE_ASTERISK:
                    this.throwUnsupported("an unpacking expression");
                case KEYWORD_LAMBDA:
                    this.throwUnsupported("a lambda");
                case KEYWORD_AWAIT:
                case KEYWORD_YIELD:
                    this.throwUnsupported("a suspending expression");
                default: {
                    this.throwUnexpected("an expression");
                }
            }
        }
    }

    private List<AstNode> parseSequence(Token.Type closing)
        throws ErrorException {
        List<AstNode> values = new ArrayList<>();
        while(this.current.type != closing) {
            values.add(this.parseExpression());
            if(this.current.type == Token.Type.KEYWORD_FOR) {
                this.throwUnsupported("a comprehension");
            }
            this.expect(Token.Type.COMMA, closing);
            if(this.current.type == Token.Type.COMMA) {
                this.next();
            }
        }
        return values;
    }

    private AstNode parseParenthesized() throws ErrorException {
        Token start = this.current;
        this.next();
        if(this.current.type == Token.Type.PAREN_CLOSE) {
            Token end = this.current;
            this.next();
            return new AstNode(
                AstNode.Type.TUPLE_LITERAL,
                new AstNode.ArrayLiteral(List.of()),
                new Source(start.source, end.source)
            );
        }
        if(this.current.type == Token.Type.KEYWORD_YIELD) {
            this.throwUnsupported("a suspending expression");
        }
        AstNode first = this.parseExpression();
        if(this.current.type == Token.Type.KEYWORD_FOR) {
            this.throwUnsupported("a generator expression");
        }
        this.expect(Token.Type.COMMA, Token.Type.PAREN_CLOSE);
        if(this.current.type == Token.Type.PAREN_CLOSE) {
            this.next();
            return first;
        }
        this.next();
        List<AstNode> values = new ArrayList<>();
        values.add(first);
        values.addAll(this.parseSequence(Token.Type.PAREN_CLOSE));
        Token end = this.current;
        this.next();
        return new AstNode(
            AstNode.Type.TUPLE_LITERAL,
            new AstNode.ArrayLiteral(values),
            new Source(start.source, end.source)
        );
    }

    private AstNode parseMapping() throws ErrorException {
        Token start = this.current;
        this.next();
        List<AstNode> keys = new ArrayList<>();
        List<AstNode> values = new ArrayList<>();
        while(this.current.type != Token.Type.BRACE_CLOSE) {
            if(this.current.type == Token.Type.DOUBLE_ASTERISK) {
                this.throwUnsupported("an unpacking expression");
            }
            keys.add(this.parseExpression());
            if(this.current.type != Token.Type.COLON) {
                this.throwUnsupported("a set literal");
            }
            this.next();
            values.add(this.parseExpression());
            if(this.current.type == Token.Type.KEYWORD_FOR) {
                this.throwUnsupported("a comprehension");
            }
            this.expect(Token.Type.COMMA, Token.Type.BRACE_CLOSE);
            if(this.current.type == Token.Type.COMMA) {
                this.next();
            }
        }
        Token end = this.current;
        this.next();
        return new AstNode(
            AstNode.Type.DICT_LITERAL,
            new AstNode.MappingLiteral(keys, values),
            new Source(start.source, end.source)
        );
    }

    private AstNode parseCall(AstNode called) throws ErrorException {
        this.next();
        List<AstNode> arguments = new ArrayList<>();
        List<AstNode.KeywordArgument> keywordArguments = new ArrayList<>();
        while(this.current.type != Token.Type.PAREN_CLOSE) {
            if(this.current.type == Token.Type.ASTERISK
                    || this.current.type == Token.Type.DOUBLE_ASTERISK) {
                this.throwUnsupported("an argument unpacking");
            }
            if(this.current.type == Token.Type.IDENTIFIER
                    && this.peek(1).type == Token.Type.EQUALS) {
                Token name = this.current;
                this.next();
                this.next();
                AstNode value = this.parseExpression();
                keywordArguments.add(new AstNode.KeywordArgument(
                    name.content, value, new Source(name.source, value.source)
                ));
            } else {
                AstNode value = this.parseExpression();
                if(!keywordArguments.isEmpty()) {
                    throw new ErrorException(new Error(
                        Error.Kind.FRONT_END,
                        "Positional argument follows keyword argument",
                        Error.Marking.error(
                            value.source,
                            "move this before the keyword arguments"
                        )
                    ));
                }
                arguments.add(value);
            }
            if(this.current.type == Token.Type.KEYWORD_FOR) {
                this.throwUnsupported("a generator expression");
            }
            this.expect(Token.Type.COMMA, Token.Type.PAREN_CLOSE);
            if(this.current.type == Token.Type.COMMA) {
                this.next();
            }
        }
        Token end = this.current;
        this.next();
        return new AstNode(
            AstNode.Type.CALL,
            new AstNode.Call(called, arguments, keywordArguments),
            new Source(called.source, end.source)
        );
    }

}
