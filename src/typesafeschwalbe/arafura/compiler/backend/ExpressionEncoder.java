package typesafeschwalbe.arafura.compiler.backend;

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;

public class ExpressionEncoder {

    private final TypeRegistry registry;
    private final TypeEncoder types;

    public ExpressionEncoder(TypeRegistry registry) {
        this.registry = registry;
        this.types = new TypeEncoder(registry, this);
    }

    public TypeEncoder types() {
        return this.types;
    }

    private static ErrorException unsupported(
        AstNode node, String message, String note
    ) {
        return new ErrorException(new Error(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            message,
            Error.Marking.error(node.source, note)
        ));
    }

    public String encode(AstNode node) throws ErrorException {
        switch(node.type) {
            case BOOLEAN_LITERAL: {
                String value = node.<AstNode.SimpleLiteral>getValue().value();
                return value.equals("True")? "1" : "0";
            }
            case INTEGER_LITERAL: {
                return ExpressionEncoder.encodeInteger(
                    node.<AstNode.SimpleLiteral>getValue().value()
                );
            }
            case FLOAT_LITERAL: {
                return node.<AstNode.SimpleLiteral>getValue().value()
                    .replace("_", "");
            }
            case STRING_LITERAL: {
                return ExpressionEncoder.encodeString(
                    node.<AstNode.SimpleLiteral>getValue().value()
                );
            }
            case NONE_LITERAL: {
                return "NULL";
            }
            case IDENTIFIER: {
                return Names.escape(node.identifierName());
            }
            case NEGATE:
                return this.encodePrefixed("-", node);
            case POSITIVE:
                return this.encodePrefixed("+", node);
            case BITWISE_NOT:
                return this.encodePrefixed("~", node);
            case NOT:
                return this.encodePrefixed("!", node);
            case POWER: {
                AstNode.BiOp data = node.getValue();
                if(data.right().isIdentifier(Names.PLACEHOLDER)) {
                    return this.encode(data.left()) + "++";
                }
                if(data.left().isIdentifier(Names.PLACEHOLDER)) {
                    return "++" + this.encode(data.right());
                }
                throw new ErrorException(new Error(
                    Error.Kind.UNSUPPORTED_CONSTRUCT,
                    "Exponentiation has no C operator",
                    Error.Marking.error(node.source, "this raises to a power"),
                    Error.Marking.help(
                        node.source,
                        "'x ** _' and '_ ** x' increment 'x'"
                    )
                ));
            }
            case FLOOR_DIVIDE: {
                AstNode.BiOp data = node.getValue();
                if(data.right().isIdentifier(Names.PLACEHOLDER)) {
                    return this.encode(data.left()) + "--";
                }
                if(data.left().isIdentifier(Names.PLACEHOLDER)) {
                    return "--" + this.encode(data.right());
                }
                return this.encodeBinary(node, "/");
            }
            case MATRIX_MULTIPLY: {
                throw ExpressionEncoder.unsupported(
                    node, "Matrix multiplication has no C operator",
                    "'@' cannot be translated"
                );
            }
            case ADD: return this.encodeBinary(node, "+");
            case SUBTRACT: return this.encodeBinary(node, "-");
            case MULTIPLY: return this.encodeBinary(node, "*");
            case DIVIDE: return this.encodeBinary(node, "/");
            case MODULO: return this.encodeBinary(node, "%");
            case BITWISE_AND: return this.encodeBinary(node, "&");
            case BITWISE_OR: return this.encodeBinary(node, "|");
            case BITWISE_XOR: return this.encodeBinary(node, "^");
            case LEFT_SHIFT: return this.encodeBinary(node, "<<");
            case RIGHT_SHIFT: return this.encodeBinary(node, ">>");
            case COMPARISON: {
                AstNode.Comparison data = node.getValue();
                StringBuilder output = new StringBuilder();
                output.append(this.encode(data.first()));
                for(int i = 0; i < data.operators().size(); i += 1) {
                    output.append(" ");
                    output.append(
                        ExpressionEncoder.comparatorToken(data.operators().get(i))
                    );
                    output.append(" ");
                    output.append(this.encode(data.operands().get(i)));
                }
                return output.toString();
            }
            case AND:
                return this.encodeJunction(node, " && ");
            case OR:
                return this.encodeJunction(node, " || ");
            case TERNARY: {
                AstNode.Ternary data = node.getValue();
                return "(" + this.encode(data.condition())
                    + " ? " + this.encode(data.ifValue())
                    + " : " + this.encode(data.elseValue()) + ")";
            }
            case ASSIGNMENT_VALUE: {
                AstNode.BiOp data = node.getValue();
                return "(" + this.encode(data.left())
                    + " = " + this.encode(data.right()) + ")";
            }
            case CALL:
                return this.encodeCall(node);
            case MEMBER_ACCESS:
                return this.encodeMemberAccess(node);
            case INDEX_ACCESS: {
                AstNode.IndexAccess data = node.getValue();
                if(data.accessed().isIdentifier("alignof")) {
                    return "_Alignof("
                        + this.types.encodeAbstract(data.index()) + ")";
                }
                return this.encode(data.accessed())
                    + "[" + this.encode(data.index()) + "]";
            }
            case LIST_LITERAL: {
                List<AstNode> values = node.<AstNode.ArrayLiteral>getValue()
                    .values();
                return "{" + this.encodeAll(values) + "}";
            }
            case DICT_LITERAL: {
                AstNode.MappingLiteral data = node.getValue();
                List<String> entries = new ArrayList<>();
                for(int i = 0; i < data.keys().size(); i += 1) {
                    entries.add(
                        "[" + this.encode(data.keys().get(i)) + "] = "
                            + this.encode(data.values().get(i))
                    );
                }
                return "{" + String.join(", ", entries) + "}";
            }
            case TUPLE_LITERAL: {
                return this.encodeAll(
                    node.<AstNode.ArrayLiteral>getValue().values()
                );
            }
            case ELLIPSIS_LITERAL: {
                throw ExpressionEncoder.unsupported(
                    node, "Unsupported expression",
                    "'...' has no value in C"
                );
            }
            default:
                throw new IllegalStateException(
                    "unhandled expression type " + node.type
                );
        }
    }

    public String encodeAll(List<AstNode> nodes) throws ErrorException {
        List<String> encoded = new ArrayList<>();
        for(AstNode node: nodes) {
            encoded.add(this.encode(node));
        }
        return String.join(", ", encoded);
    }

    static String encodeInteger(String literal) {
        String digits = literal.replace("_", "").toLowerCase();
        if(digits.startsWith("0x")) {
            return new BigInteger(digits.substring(2), 16).toString();
        }
        if(digits.startsWith("0o")) {
            return new BigInteger(digits.substring(2), 8).toString();
        }
        if(digits.startsWith("0b")) {
            return new BigInteger(digits.substring(2), 2).toString();
        }
        return new BigInteger(digits).toString();
    }

    static String encodeString(String value) {
        String escaped = value
            .replace("\\", "\\\\")
            .replace("\"", "\\\"")
            .replace("\n", "\\n")
            .replace("\r", "\\r")
            .replace("\t", "\\t");
        return "\"" + escaped + "\"";
    }

    private static String comparatorToken(AstNode.Comparator comparator) {
        switch(comparator) {
            case EQUALS: return "==";
            case NOT_EQUALS: return "!=";
            case LESS_THAN: return "<";
            case LESS_THAN_EQUAL: return "<=";
            case GREATER_THAN: return ">";
            case GREATER_THAN_EQUAL: return ">=";
            default:
                throw new IllegalStateException(
                    "unhandled comparator " + comparator
                );
        }
    }

    private String encodePrefixed(String operator, AstNode node)
        throws ErrorException {
        AstNode operand = node.<AstNode.MonoOp>getValue().value();
        String value = this.encode(operand);
        // comparisons are the only operands rendered without parentheses
        if(operand.type == AstNode.Type.COMPARISON) {
            return operator + "(" + value + ")";
        }
        // '- -x' must not become the decrement '--x'
        if((operator.equals("-") || operator.equals("+"))
                && value.startsWith(operator)) {
            return operator + "(" + value + ")";
        }
        return operator + value;
    }

    private String encodeBinary(AstNode node, String operator)
        throws ErrorException {
        AstNode.BiOp data = node.getValue();
        return "(" + this.encode(data.left()) + " " + operator + " "
            + this.encode(data.right()) + ")";
    }

    private String encodeJunction(AstNode node, String operator)
        throws ErrorException {
        List<String> operands = new ArrayList<>();
        for(AstNode operand: node.<AstNode.Junction>getValue().operands()) {
            operands.add("(" + this.encode(operand) + ")");
        }
        return "(" + String.join(operator, operands) + ")";
    }

    private String encodeMemberAccess(AstNode node) throws ErrorException {
        AstNode.MemberAccess data = node.getValue();
        AstNode accessed = data.accessed();
        String member = data.memberName();
        if(accessed.isIdentifier(Names.PLACEHOLDER)) {
            return "&" + Names.escape(member);
        }
        if(member.equals(Names.PLACEHOLDER)) {
            return "(*" + this.encode(accessed) + ")";
        }
        if(accessed.type == AstNode.Type.MEMBER_ACCESS) {
            AstNode.MemberAccess inner = accessed.getValue();
            if(inner.memberName().equals(Names.PLACEHOLDER)) {
                return this.encode(inner.accessed()) + "->"
                    + Names.escape(member);
            }
        }
        return this.encode(accessed) + "." + Names.escape(member);
    }

    /**
     * Renders keyword arguments as designated initializers following the
     * positional values, as in '{1, .y = 2}'.
     */
    public String encodeInitializer(
        List<AstNode> arguments, List<AstNode.KeywordArgument> keywords
    ) throws ErrorException {
        List<String> values = new ArrayList<>();
        for(AstNode argument: arguments) {
            values.add(this.encode(argument));
        }
        for(AstNode.KeywordArgument keyword: keywords) {
            values.add(
                "." + Names.escape(keyword.name()) + " = "
                    + this.encode(keyword.value())
            );
        }
        return "{" + String.join(", ", values) + "}";
    }

    private String encodeCall(AstNode node) throws ErrorException {
        AstNode.Call data = node.getValue();
        AstNode called = data.called();
        List<AstNode> arguments = data.arguments();
        List<AstNode.KeywordArgument> keywords = data.keywordArguments();
        boolean singleArgument = arguments.size() == 1 && keywords.isEmpty();
        if(called.type == AstNode.Type.LIST_LITERAL && singleArgument) {
            List<AstNode> castTypes = called.<AstNode.ArrayLiteral>getValue()
                .values();
            if(castTypes.size() == 1) {
                return this.encodeCast(castTypes.get(0), arguments.get(0));
            }
        }
        if(called.type == AstNode.Type.INDEX_ACCESS
                && called.<AstNode.IndexAccess>getValue().accessed()
                    .isIdentifier("cast")) {
            if(!singleArgument) {
                throw ExpressionEncoder.unsupported(
                    node, "Invalid cast", "a cast takes exactly one value"
                );
            }
            return this.encodeCast(
                called.<AstNode.IndexAccess>getValue().index(),
                arguments.get(0)
            );
        }
        if(called.isIdentifier("sizeof") && singleArgument) {
            AstNode argument = arguments.get(0);
            if(argument.isIdentifier() || this.types.isTypeReference(argument)) {
                return "sizeof(" + this.types.encodeAbstract(argument) + ")";
            }
            return "sizeof(" + this.encode(argument) + ")";
        }
        if(called.isIdentifier(Names.PLACEHOLDER)
                && arguments.isEmpty() && !keywords.isEmpty()) {
            return this.encodeInitializer(List.of(), keywords);
        }
        if(called.isIdentifier()
                && this.registry.constructsStruct(called.identifierName())) {
            return this.encodeInitializer(arguments, keywords);
        }
        if(!keywords.isEmpty()) {
            throw new ErrorException(new Error(
                Error.Kind.UNSUPPORTED_CONSTRUCT,
                "Keyword arguments in a function call",
                Error.Marking.error(
                    keywords.get(0).source(),
                    "C functions only take positional arguments"
                ),
                Error.Marking.help(
                    called.source,
                    "keyword arguments are only allowed when constructing"
                        + " a struct or with '_'"
                )
            ));
        }
        if(called.isIdentifier("static_assert")) {
            return "_Static_assert(" + this.encodeAll(arguments) + ")";
        }
        return this.encode(called) + "(" + this.encodeAll(arguments) + ")";
    }

    private String encodeCast(AstNode type, AstNode value)
        throws ErrorException {
        return "((" + this.types.encodeAbstract(type) + ")("
            + this.encode(value) + "))";
    }

}
