package typesafeschwalbe.arafura.compiler.frontend;

import java.util.List;
import java.util.Optional;

import typesafeschwalbe.arafura.compiler.Source;

public class AstNode {

    public static record Block(
        List<AstNode> statements
    ) {}

    public static record Import(
        List<String> modules
    ) {}

    public static record FromImport(
        String module,
        List<String> names
    ) {
        public boolean isWildcard() {
            return this.names.size() == 1 && this.names.get(0).equals("*");
        }
    }

    public static record Declaration(
        AstNode target,
        AstNode annotation,
        Optional<AstNode> value
    ) {}

    public static record Assignment(
        List<AstNode> targets,
        AstNode value
    ) {}

    public static record AugmentedAssignment(
        AstNode target,
        Type operator,
        AstNode value
    ) {}

    public static record Conditional(
        AstNode condition,
        List<AstNode> ifBody,
        List<AstNode> elseBody
    ) {}

    public static record Loop(
        AstNode condition,
        List<AstNode> body,
        List<AstNode> elseBody
    ) {}

    public static record ForLoop(
        AstNode target,
        AstNode source,
        List<AstNode> body,
        List<AstNode> elseBody
    ) {}

    public static record Jump(
        Optional<AstNode> target,
        Optional<AstNode> cause
    ) {}

    public static record Parameter(
        String name,
        Optional<AstNode> annotation,
        Optional<AstNode> defaultValue,
        Source source
    ) {}

    public static record Definition(
        String name,
        List<Parameter> parameters,
        Optional<Parameter> variadic,
        List<Parameter> keywordOnlyParameters,
        Optional<AstNode> returnType,
        List<AstNode> decorators,
        List<AstNode> body
    ) {}

    public static record CompositeDefinition(
        String name,
        List<AstNode> bases,
        List<AstNode> decorators,
        List<AstNode> body
    ) {}

    public static record TypeAlias(
        String name,
        AstNode value
    ) {}

    public static record SwitchCase(
        List<AstNode> patterns,
        Optional<AstNode> guard,
        List<AstNode> body,
        Source source
    ) {}

    public static record Switch(
        AstNode subject,
        List<SwitchCase> cases
    ) {}

    public static record SimpleLiteral(
        String value
    ) {}

    public static record Identifier(
        String name
    ) {}

    public static record MonoOp(
        AstNode value
    ) {}

    public static record BiOp(
        AstNode left,
        AstNode right
    ) {}

    public enum Comparator {
        EQUALS,
        NOT_EQUALS,
        LESS_THAN,
        LESS_THAN_EQUAL,
        GREATER_THAN,
        GREATER_THAN_EQUAL
    }

    public static record Comparison(
        AstNode first,
        List<Comparator> operators,
        List<AstNode> operands
    ) {}

    public static record Junction(
        List<AstNode> operands
    ) {}

    public static record Ternary(
        AstNode condition,
        AstNode ifValue,
        AstNode elseValue
    ) {}

    public static record KeywordArgument(
        String name,
        AstNode value,
        Source source
    ) {}

    public static record Call(
        AstNode called,
        List<AstNode> arguments,
        List<KeywordArgument> keywordArguments
    ) {}

    public static record MemberAccess(
        AstNode accessed,
        String memberName
    ) {}

    public static record IndexAccess(
        AstNode accessed,
        AstNode index
    ) {}

    public static record ArrayLiteral(
        List<AstNode> values
    ) {}

    public static record MappingLiteral(
        List<AstNode> keys,
        List<AstNode> values
    ) {}

    public enum Type {
        // statements
        MODULE,                  // Block
        IMPORT,                  // Import
        FROM_IMPORT,             // FromImport
        DECLARATION,             // Declaration
        ASSIGNMENT,              // Assignment
        AUGMENTED_ASSIGNMENT,    // AugmentedAssignment
        EXPRESSION_STATEMENT,    // MonoOp
        CONDITIONAL,             // Conditional
        WHILE_LOOP,              // Loop
        FOR_LOOP,                // ForLoop
        BREAK,                   // = null
        CONTINUE,                // = null
        RETURN,                  // MonoOp or null
        JUMP,                    // Jump
        DEFINITION,              // Definition
        COMPOSITE_DEFINITION,    // CompositeDefinition
        TYPE_ALIAS,              // TypeAlias
        UNDEFINE,                // ArrayLiteral
        SWITCH,                  // Switch
        PASS,                    // = null
        // expressions
        BOOLEAN_LITERAL,         // SimpleLiteral
        INTEGER_LITERAL,         // SimpleLiteral
        FLOAT_LITERAL,           // SimpleLiteral
        STRING_LITERAL,          // SimpleLiteral
        NONE_LITERAL,            // = null
        ELLIPSIS_LITERAL,        // = null
        IDENTIFIER,              // Identifier
        NEGATE,                  // MonoOp
        POSITIVE,                // MonoOp
        NOT,                     // MonoOp
        BITWISE_NOT,             // MonoOp
        ADD,                     // BiOp
        SUBTRACT,                // BiOp
        MULTIPLY,                // BiOp
        DIVIDE,                  // BiOp
        FLOOR_DIVIDE,            // BiOp
        MODULO,                  // BiOp
        POWER,                   // BiOp
        MATRIX_MULTIPLY,         // BiOp
        BITWISE_AND,             // BiOp
        BITWISE_OR,              // BiOp
        BITWISE_XOR,             // BiOp
        LEFT_SHIFT,              // BiOp
        RIGHT_SHIFT,             // BiOp
        COMPARISON,              // Comparison
        AND,                     // Junction
        OR,                      // Junction
        TERNARY,                 // Ternary
        CALL,                    // Call
        MEMBER_ACCESS,           // MemberAccess
        INDEX_ACCESS,            // IndexAccess
        LIST_LITERAL,            // ArrayLiteral
        DICT_LITERAL,            // MappingLiteral
        TUPLE_LITERAL,           // ArrayLiteral
        ASSIGNMENT_VALUE         // BiOp
    }

    public final Type type;
    private final Object value;
    public final Source source;

    public AstNode(Type type, Object value, Source source) {
        this.type = type;
        this.value = value;
        this.source = source;
    }

    @SuppressWarnings("unchecked")
    public <T> T getValue() {
        return (T) this.value;
    }

    public boolean isIdentifier() {
        return this.type == Type.IDENTIFIER;
    }

    public boolean isIdentifier(String name) {
        return this.type == Type.IDENTIFIER
            && this.<Identifier>getValue().name().equals(name);
    }

    public String identifierName() {
        if(this.type != Type.IDENTIFIER) {
            throw new IllegalStateException(
                "Attempted to get the name of a non-identifier node!"
            );
        }
        return this.<Identifier>getValue().name();
    }

    @Override
    public String toString() {
        return this.type + "(" + this.value + ")";
    }

}
