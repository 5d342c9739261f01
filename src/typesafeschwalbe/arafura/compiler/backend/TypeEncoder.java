package typesafeschwalbe.arafura.compiler.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.Set;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;

/**
 * Turns type expressions into C declarators. Declarators are built inside
 * out: every type form wraps the declarator of the name it declares, and
 * the innermost base type is prepended last.
 */
public class TypeEncoder {

    public static final Set<String> QUALIFIERS = Set.of(
        "const", "volatile", "unsigned", "signed", "short", "long",
        "static", "extern", "register"
    );

    private static final Set<String> BUILTIN_TYPES = Set.of(
        "void", "char", "short", "int", "long", "float", "double",
        "signed", "unsigned", "bool", "_Bool", "size_t", "ssize_t",
        "ptrdiff_t", "intptr_t", "uintptr_t", "wchar_t",
        "int8_t", "int16_t", "int32_t", "int64_t",
        "uint8_t", "uint16_t", "uint32_t", "uint64_t"
    );

    private static final Set<String> CONSTRUCTORS = Set.of(
        "type", "union", "enum", "list", "bit", "atomic", "thread_local",
        "alignas"
    );

    private final TypeRegistry registry;
    private final ExpressionEncoder expressions;

    public TypeEncoder(TypeRegistry registry, ExpressionEncoder expressions) {
        this.registry = registry;
        this.expressions = expressions;
    }

    public String encode(AstNode node, String name) throws ErrorException {
        return this.encodeDeclarator(node, Names.escape(name), name.isEmpty());
    }

    public String encodeAbstract(AstNode node) throws ErrorException {
        return this.encodeDeclarator(node, "", true);
    }

    /**
     * Builds the head of a function returning the given type around an
     * already built declarator like 'f(int a)'. Returned pointers to
     * functions or arrays wrap it, as in 'int (*f(int a))(int)'.
     */
    String encodeFunctionHead(
        AstNode returnType, String declarator
    ) throws ErrorException {
        String returned = this.encodeAbstract(returnType);
        if(!returned.contains("(*")) {
            return returned + " " + declarator;
        }
        return this.encodeDeclarator(returnType, declarator, false);
    }

    /**
     * Gives the part of a declaration shared by all of its declarators,
     * which is 'char' for 'char *p'.
     */
    String encodeBase(AstNode node) throws ErrorException {
        String first = this.encodeDeclarator(node, "a", false);
        String second = this.encodeDeclarator(node, "b", false);
        int shared = 0;
        while(shared < first.length() && shared < second.length()
                && first.charAt(shared) == second.charAt(shared)) {
            shared += 1;
        }
        int end = first.lastIndexOf(' ', shared - 1);
        if(end < 0) {
            throw new IllegalStateException(
                "declaration '" + first + "' has no base type"
            );
        }
        return first.substring(0, end);
    }

    /**
     * Renders the declarator of a further name in a declaration of the
     * given type, so that 'j' follows 'int i' and '*q' follows 'char *p'.
     */
    String encodeFollowing(AstNode node, String name) throws ErrorException {
        String base = this.encodeBase(node);
        return this.encode(node, name).substring(base.length() + 1);
    }

    private static String join(String base, String declarator, boolean abs) {
        if(declarator.isEmpty()) { return base; }
        if(abs && (declarator.startsWith("*") || declarator.startsWith("["))) {
            return base + declarator;
        }
        return base + " " + declarator;
    }

    private static ErrorException unsupported(AstNode node, String note) {
        return new ErrorException(new Error(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            "Unsupported type expression",
            Error.Marking.error(node.source, note)
        ));
    }

    private static boolean isNamed(AstNode node, Set<String> names) {
        return node.isIdentifier() && names.contains(node.identifierName());
    }

    private boolean isQualifierApplication(AstNode node) {
        if(node.type != AstNode.Type.INDEX_ACCESS) { return false; }
        AstNode accessed = node.<AstNode.IndexAccess>getValue().accessed();
        return TypeEncoder.isNamed(accessed, QUALIFIERS)
            || accessed.isIdentifier("atomic")
            || accessed.isIdentifier("thread_local");
    }

    /**
     * Tells whether an index applied to a qualifier continues the
     * qualifier chain, as 'int' does in 'volatile[unsigned][int]', rather
     * than giving an array dimension.
     */
    private boolean continuesQualifierChain(AstNode index) {
        switch(index.type) {
            case IDENTIFIER: {
                String name = index.identifierName();
                return BUILTIN_TYPES.contains(name)
                    || QUALIFIERS.contains(name)
                    || this.registry.tagKind(name).isPresent()
                    || this.registry.isAlias(name);
            }
            case NEGATE:
            case POSITIVE:
                return true;
            case INDEX_ACCESS: {
                AstNode accessed = index.<AstNode.IndexAccess>getValue()
                    .accessed();
                return TypeEncoder.isNamed(accessed, CONSTRUCTORS)
                    || TypeEncoder.isNamed(accessed, QUALIFIERS);
            }
            default:
                return false;
        }
    }

    /**
     * Tells whether an expression can only be read as a type, such as
     * 'type[Node]', 'int[4]' or '-char'. Plain variable names do not count.
     */
    public boolean isTypeReference(AstNode node) {
        switch(node.type) {
            case IDENTIFIER: {
                String name = node.identifierName();
                return BUILTIN_TYPES.contains(name)
                    || this.registry.tagKind(name).isPresent()
                    || this.registry.isAlias(name);
            }
            case NEGATE:
            case POSITIVE:
                return this.isTypeReference(
                    node.<AstNode.MonoOp>getValue().value()
                );
            case INDEX_ACCESS: {
                AstNode accessed = node.<AstNode.IndexAccess>getValue()
                    .accessed();
                if(TypeEncoder.isNamed(accessed, CONSTRUCTORS)
                        || TypeEncoder.isNamed(accessed, QUALIFIERS)) {
                    return true;
                }
                return this.isTypeReference(accessed);
            }
            case CALL:
                return TypeEncoder.isFunctionType(node);
            default:
                return false;
        }
    }

    private boolean isPlainArray(AstNode node) {
        if(node.type != AstNode.Type.INDEX_ACCESS) { return false; }
        AstNode.IndexAccess data = node.getValue();
        AstNode accessed = data.accessed();
        if(accessed.isIdentifier()) {
            String name = accessed.identifierName();
            if(CONSTRUCTORS.contains(name)) { return false; }
            if(QUALIFIERS.contains(name)) {
                // 'long[4]' is an array, 'long[T]' a qualified type
                return !data.index().isIdentifier()
                    && !this.continuesQualifierChain(data.index());
            }
            return true;
        }
        return !(this.isQualifierApplication(accessed)
            && this.continuesQualifierChain(data.index()));
    }

    private boolean isArrayType(AstNode node) {
        if(this.isPlainArray(node)) { return true; }
        return node.type == AstNode.Type.INDEX_ACCESS
            && node.<AstNode.IndexAccess>getValue().accessed()
                .isIdentifier("list");
    }

    private static boolean isFunctionType(AstNode node) {
        return node.type == AstNode.Type.CALL
            && node.<AstNode.Call>getValue().called().type
                == AstNode.Type.TUPLE_LITERAL;
    }

    private String encodeDeclarator(
        AstNode node, String declarator, boolean abs
    ) throws ErrorException {
        switch(node.type) {
            case IDENTIFIER: {
                String name = node.identifierName();
                if(name.equals(Names.PLACEHOLDER)) {
                    throw TypeEncoder.unsupported(
                        node, "the placeholder '_' is not a type"
                    );
                }
                Optional<Composite> keyword = this.registry.keywordFor(name);
                String base = keyword.isPresent()
                    ? keyword.get().keyword + " " + Names.escape(name)
                    : Names.escape(name);
                return TypeEncoder.join(base, declarator, abs);
            }
            case NEGATE: {
                AstNode pointee = node.<AstNode.MonoOp>getValue().value();
                if(this.isArrayType(pointee)) {
                    throw new ErrorException(new Error(
                        Error.Kind.UNSUPPORTED_CONSTRUCT,
                        "Ambiguous pointer to array type",
                        Error.Marking.error(
                            node.source,
                            "this is a pointer to an array"
                        ),
                        Error.Marking.help(
                            pointee.source,
                            "write '+T[n]' for a pointer to an array"
                                + " or 'list[-T, n]' for an array of pointers"
                        )
                    ));
                }
                String inner = TypeEncoder.isFunctionType(pointee)
                    ? "(*" + declarator + ")"
                    : "*" + declarator;
                return this.encodeDeclarator(pointee, inner, abs);
            }
            case POSITIVE: {
                AstNode pointee = node.<AstNode.MonoOp>getValue().value();
                if(!this.isArrayType(pointee)) {
                    throw TypeEncoder.unsupported(
                        node, "'+' may only be applied to an array type"
                    );
                }
                return this.encodeDeclarator(
                    pointee, "(*" + declarator + ")", abs
                );
            }
            case INDEX_ACCESS: {
                return this.encodeIndexed(node, declarator, abs);
            }
            case CALL: {
                AstNode.Call data = node.getValue();
                if(!data.keywordArguments().isEmpty()) {
                    throw TypeEncoder.unsupported(
                        node, "keyword arguments cannot appear in a type"
                    );
                }
                if(data.called().type == AstNode.Type.TUPLE_LITERAL) {
                    if(data.arguments().size() != 1) {
                        throw TypeEncoder.unsupported(
                            node, "a function type needs exactly one"
                                + " return type"
                        );
                    }
                    List<AstNode> parameters = data.called()
                        .<AstNode.ArrayLiteral>getValue().values();
                    return this.encodeDeclarator(
                        data.arguments().get(0),
                        declarator + this.encodeParameterTypes(parameters),
                        abs
                    );
                }
                return this.encodeDeclarator(
                    data.called(),
                    "(*" + declarator + ")"
                        + this.encodeParameterTypes(data.arguments()),
                    abs
                );
            }
            default:
                throw TypeEncoder.unsupported(
                    node, "this cannot be used as a C type"
                );
        }
    }

    private String encodeParameterTypes(
        List<AstNode> parameters
    ) throws ErrorException {
        if(parameters.isEmpty()) { return "(void)"; }
        List<String> encoded = new ArrayList<>();
        for(AstNode parameter: parameters) {
            if(parameter.type == AstNode.Type.ELLIPSIS_LITERAL) {
                encoded.add("...");
                continue;
            }
            encoded.add(this.encodeAbstract(parameter));
        }
        return "(" + String.join(", ", encoded) + ")";
    }

    private List<AstNode> typeArguments(
        AstNode node, AstNode index, int count, String usage
    ) throws ErrorException {
        List<AstNode> arguments = index.type == AstNode.Type.TUPLE_LITERAL
            ? index.<AstNode.ArrayLiteral>getValue().values()
            : List.of(index);
        if(arguments.size() != count) {
            throw TypeEncoder.unsupported(node, "expected " + usage);
        }
        return arguments;
    }

    private String encodeIndexed(
        AstNode node, String declarator, boolean abs
    ) throws ErrorException {
        AstNode.IndexAccess data = node.getValue();
        AstNode accessed = data.accessed();
        AstNode index = data.index();
        if(this.isPlainArray(node)) {
            List<AstNode> dimensions = new ArrayList<>();
            AstNode base = node;
            while(this.isPlainArray(base)) {
                AstNode.IndexAccess level = base.getValue();
                dimensions.add(0, level.index());
                base = level.accessed();
            }
            return this.encodeDeclarator(
                base, declarator + this.encodeDimensions(dimensions), abs
            );
        }
        if(!accessed.isIdentifier()) {
            // qualifier chain, 'Q[A][B]' is 'Q[A[B]]'
            AstNode.IndexAccess qualified = accessed.getValue();
            AstNode regrouped = new AstNode(
                AstNode.Type.INDEX_ACCESS,
                new AstNode.IndexAccess(
                    qualified.accessed(),
                    new AstNode(
                        AstNode.Type.INDEX_ACCESS,
                        new AstNode.IndexAccess(qualified.index(), index),
                        node.source
                    )
                ),
                node.source
            );
            return this.encodeDeclarator(regrouped, declarator, abs);
        }
        String constructor = accessed.identifierName();
        switch(constructor) {
            case "type":
                return this.encodeComposite(
                    node, Composite.STRUCT, index, declarator, abs
                );
            case "union":
                return this.encodeComposite(
                    node, Composite.UNION, index, declarator, abs
                );
            case "enum":
                return this.encodeComposite(
                    node, Composite.ENUM, index, declarator, abs
                );
            case "list": {
                if(index.type == AstNode.Type.TUPLE_LITERAL) {
                    List<AstNode> arguments = this.typeArguments(
                        node, index, 2, "'list[T, n]' or 'list[T]'"
                    );
                    return this.encodeDeclarator(
                        arguments.get(0),
                        declarator + this.encodeDimensions(
                            List.of(arguments.get(1))
                        ),
                        abs
                    );
                }
                return this.encodeDeclarator(index, declarator + "[]", abs);
            }
            case "bit": {
                List<AstNode> arguments = this.typeArguments(
                    node, index, 2, "'bit[T, n]'"
                );
                return this.encodeDeclarator(arguments.get(0), declarator, abs)
                    + " : " + this.expressions.encode(arguments.get(1));
            }
            case "atomic":
                return "_Atomic "
                    + this.encodeDeclarator(index, declarator, abs);
            case "thread_local":
                return "_Thread_local "
                    + this.encodeDeclarator(index, declarator, abs);
            case "alignas": {
                List<AstNode> arguments = this.typeArguments(
                    node, index, 2, "'alignas[N, T]'"
                );
                return "_Alignas("
                    + this.expressions.encode(arguments.get(0)) + ") "
                    + this.encodeDeclarator(arguments.get(1), declarator, abs);
            }
            default:
                if(QUALIFIERS.contains(constructor)) {
                    return constructor + " "
                        + this.encodeDeclarator(index, declarator, abs);
                }
                throw new IllegalStateException(
                    "unhandled type constructor '" + constructor + "'"
                );
        }
    }

    private String encodeComposite(
        AstNode node, Composite kind, AstNode index, String declarator,
        boolean abs
    ) throws ErrorException {
        List<AstNode> dimensions = new ArrayList<>();
        AstNode tag = index;
        while(this.isPlainArray(tag)) {
            AstNode.IndexAccess level = tag.getValue();
            dimensions.add(0, level.index());
            tag = level.accessed();
        }
        if(!tag.isIdentifier()) {
            throw TypeEncoder.unsupported(
                node, "'" + kind.keyword + "' needs the name of a tag"
            );
        }
        String base = kind.keyword + " " + Names.escape(tag.identifierName());
        return TypeEncoder.join(
            base, declarator + this.encodeDimensions(dimensions), abs
        );
    }

    private String encodeDimensions(
        List<AstNode> dimensions
    ) throws ErrorException {
        StringBuilder output = new StringBuilder();
        for(AstNode dimension: dimensions) {
            output.append("[");
            output.append(this.expressions.encode(dimension));
            output.append("]");
        }
        return output.toString();
    }

}
