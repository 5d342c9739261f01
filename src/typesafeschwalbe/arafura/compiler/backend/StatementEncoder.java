package typesafeschwalbe.arafura.compiler.backend;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;

public class StatementEncoder {

    private final TypeRegistry registry;
    private final ExpressionEncoder expressions;
    private final TypeEncoder types;

    public StatementEncoder(TypeRegistry registry) {
        this.registry = registry;
        this.expressions = new ExpressionEncoder(registry);
        this.types = this.expressions.types();
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

    public void emitAll(
        List<AstNode> statements, Output out
    ) throws ErrorException {
        for(AstNode statement: statements) {
            this.emit(statement, out);
        }
    }

    public void emit(AstNode statement, Output out) throws ErrorException {
        switch(statement.type) {
            case IMPORT: {
                AstNode.Import data = statement.getValue();
                for(String module: data.modules()) {
                    out.line(
                        "#include \"" + StatementEncoder.headerOf(module) + "\""
                    );
                }
                return;
            }
            case FROM_IMPORT: {
                AstNode.FromImport data = statement.getValue();
                String header = StatementEncoder.headerOf(data.module());
                if(data.isWildcard()) {
                    out.line("#include <" + header + ">");
                } else {
                    out.line("#include \"" + header + "\"");
                }
                return;
            }
            case DECLARATION: {
                this.emitDeclaration(statement, out);
                return;
            }
            case ASSIGNMENT: {
                AstNode.Assignment data = statement.getValue();
                String value = this.expressions.encode(data.value());
                for(AstNode target: data.targets()) {
                    out.line(this.expressions.encode(target) + " = " + value + ";");
                }
                return;
            }
            case AUGMENTED_ASSIGNMENT: {
                AstNode.AugmentedAssignment data = statement.getValue();
                String operator = StatementEncoder.compoundOperatorOf(
                    statement, data.operator()
                );
                out.line(
                    this.expressions.encode(data.target())
                        + " " + operator + " "
                        + this.expressions.encode(data.value()) + ";"
                );
                return;
            }
            case EXPRESSION_STATEMENT: {
                AstNode value = statement.<AstNode.MonoOp>getValue().value();
                if(value.type == AstNode.Type.ELLIPSIS_LITERAL) { return; }
                out.line(this.expressions.encode(value) + ";");
                return;
            }
            case CONDITIONAL: {
                AstNode.Conditional data = statement.getValue();
                if(StatementEncoder.isPreprocessorTest(data.condition())) {
                    this.emitPreprocessorConditional(statement, out);
                } else {
                    this.emitConditional(statement, out);
                }
                return;
            }
            case WHILE_LOOP: {
                this.emitWhileLoop(statement, out);
                return;
            }
            case FOR_LOOP: {
                this.emitForLoop(statement, out);
                return;
            }
            case BREAK: {
                out.line("break;");
                return;
            }
            case CONTINUE: {
                out.line("continue;");
                return;
            }
            case RETURN: {
                AstNode.MonoOp data = statement.getValue();
                if(data == null) {
                    out.line("return;");
                } else {
                    out.line(
                        "return " + this.expressions.encode(data.value()) + ";"
                    );
                }
                return;
            }
            case JUMP: {
                this.emitJump(statement, out);
                return;
            }
            case DEFINITION: {
                this.emitDefinition(statement, out);
                return;
            }
            case COMPOSITE_DEFINITION: {
                this.emitComposite(statement, out);
                return;
            }
            case TYPE_ALIAS: {
                AstNode.TypeAlias data = statement.getValue();
                out.line(
                    "typedef " + this.types.encode(data.value(), data.name())
                        + ";"
                );
                return;
            }
            case UNDEFINE: {
                AstNode.ArrayLiteral data = statement.getValue();
                for(AstNode target: data.values()) {
                    if(!target.isIdentifier()) {
                        throw StatementEncoder.unsupported(
                            target, "Invalid undefinition",
                            "only a macro name can be undefined"
                        );
                    }
                    out.line("#undef " + Names.escape(target.identifierName()));
                }
                return;
            }
            case SWITCH: {
                this.emitSwitch(statement, out);
                return;
            }
            case PASS: {
                return;
            }
            default:
                throw new IllegalStateException(
                    "unhandled statement type " + statement.type
                );
        }
    }

    private static String headerOf(String module) {
        return module.replace('.', '/') + ".h";
    }

    private static String compoundOperatorOf(
        AstNode statement, AstNode.Type operator
    ) throws ErrorException {
        switch(operator) {
            case ADD: return "+=";
            case SUBTRACT: return "-=";
            case MULTIPLY: return "*=";
            case DIVIDE: return "/=";
            case FLOOR_DIVIDE: return "/=";
            case MODULO: return "%=";
            case BITWISE_AND: return "&=";
            case BITWISE_OR: return "|=";
            case BITWISE_XOR: return "^=";
            case LEFT_SHIFT: return "<<=";
            case RIGHT_SHIFT: return ">>=";
            case POWER:
            case MATRIX_MULTIPLY:
                throw StatementEncoder.unsupported(
                    statement, "Unsupported augmented assignment",
                    "this operator has no C equivalent"
                );
            default:
                throw new IllegalStateException(
                    "unhandled augmented assignment operator " + operator
                );
        }
    }

    private void emitDeclaration(
        AstNode statement, Output out
    ) throws ErrorException {
        AstNode.Declaration data = statement.getValue();
        if(!data.target().isIdentifier()) {
            throw StatementEncoder.unsupported(
                data.target(), "Invalid declaration",
                "only a name can be declared"
            );
        }
        String name = data.target().identifierName();
        AstNode annotation = data.annotation();
        if(annotation.isIdentifier("label")) {
            if(data.value().isPresent()) {
                throw StatementEncoder.unsupported(
                    data.value().get(), "Invalid label",
                    "a label cannot have a value"
                );
            }
            out.rawLine(Names.escape(name) + ":");
            return;
        }
        if(annotation.isIdentifier("macro")) {
            if(data.value().isPresent()) {
                out.line(
                    "#define " + Names.escape(name) + " "
                        + this.expressions.encode(data.value().get())
                );
            } else {
                out.line("#define " + Names.escape(name));
            }
            return;
        }
        if(this.isInitializingAnnotation(annotation)) {
            if(data.value().isPresent()) {
                throw StatementEncoder.unsupported(
                    data.value().get(), "Conflicting initializers",
                    "the annotation already initializes '" + name + "'"
                );
            }
            AstNode.Call call = annotation.getValue();
            out.line(
                this.types.encode(call.called(), name) + " = "
                    + this.expressions.encodeInitializer(
                        call.arguments(), call.keywordArguments()
                    )
                    + ";"
            );
            return;
        }
        String declared = this.types.encode(annotation, name);
        if(data.value().isPresent()) {
            out.line(
                declared + " = " + this.expressions.encode(data.value().get())
                    + ";"
            );
        } else {
            out.line(declared + ";");
        }
    }

    private boolean isInitializingAnnotation(AstNode annotation) {
        if(annotation.type != AstNode.Type.CALL) { return false; }
        AstNode.Call call = annotation.getValue();
        if(!call.keywordArguments().isEmpty()) { return true; }
        return call.called().isIdentifier()
            && this.types.isTypeReference(call.called())
            && this.registry.constructsStruct(call.called().identifierName());
    }

    private static boolean isPreprocessorTest(AstNode condition) {
        return condition.type == AstNode.Type.LIST_LITERAL
            && condition.<AstNode.ArrayLiteral>getValue().values().size() == 1;
    }

    private void emitConditional(
        AstNode statement, Output out
    ) throws ErrorException {
        AstNode.Conditional data = statement.getValue();
        out.line("if (" + this.expressions.encode(data.condition()) + ") {");
        out.enter();
        this.emitAll(data.ifBody(), out);
        out.exit();
        List<AstNode> elseBody = data.elseBody();
        while(true) {
            if(elseBody.isEmpty()) {
                out.line("}");
                return;
            }
            AstNode only = elseBody.get(0);
            boolean chained = elseBody.size() == 1
                && only.type == AstNode.Type.CONDITIONAL
                && !StatementEncoder.isPreprocessorTest(
                    only.<AstNode.Conditional>getValue().condition()
                );
            if(!chained) {
                out.line("} else {");
                out.enter();
                this.emitAll(elseBody, out);
                out.exit();
                out.line("}");
                return;
            }
            AstNode.Conditional branch = only.getValue();
            out.line(
                "} else if (" + this.expressions.encode(branch.condition())
                    + ") {"
            );
            out.enter();
            this.emitAll(branch.ifBody(), out);
            out.exit();
            elseBody = branch.elseBody();
        }
    }

    private String preprocessorDirective(
        AstNode condition, boolean first
    ) throws ErrorException {
        AstNode tested = condition.<AstNode.ArrayLiteral>getValue()
            .values().get(0);
        if(tested.isIdentifier()) {
            String name = Names.escape(tested.identifierName());
            return first? "#ifdef " + name : "#elif defined(" + name + ")";
        }
        if(tested.type == AstNode.Type.NOT) {
            AstNode negated = tested.<AstNode.MonoOp>getValue().value();
            if(negated.isIdentifier()) {
                String name = Names.escape(negated.identifierName());
                return first? "#ifndef " + name : "#elif !defined(" + name + ")";
            }
        }
        String expression = this.expressions.encode(tested);
        return (first? "#if " : "#elif ") + expression;
    }

    private void emitPreprocessorConditional(
        AstNode statement, Output out
    ) throws ErrorException {
        AstNode.Conditional data = statement.getValue();
        boolean first = true;
        while(true) {
            out.line(this.preprocessorDirective(data.condition(), first));
            this.emitAll(data.ifBody(), out);
            first = false;
            List<AstNode> elseBody = data.elseBody();
            if(elseBody.size() == 1
                    && elseBody.get(0).type == AstNode.Type.CONDITIONAL) {
                AstNode.Conditional branch = elseBody.get(0).getValue();
                if(StatementEncoder.isPreprocessorTest(branch.condition())) {
                    data = branch;
                    continue;
                }
            }
            if(!elseBody.isEmpty()) {
                out.line("#else");
                this.emitAll(elseBody, out);
            }
            out.line("#endif");
            return;
        }
    }

    private static void rejectElseClause(
        AstNode statement, List<AstNode> elseBody
    ) throws ErrorException {
        if(elseBody.isEmpty()) { return; }
        throw new ErrorException(new Error(
            Error.Kind.UNSUPPORTED_CONSTRUCT,
            "Loop with an 'else'-clause",
            Error.Marking.error(
                elseBody.get(0).source, "C loops have no 'else'-clause"
            ),
            Error.Marking.info(statement.source, "in this loop")
        ));
    }

    private void emitWhileLoop(
        AstNode statement, Output out
    ) throws ErrorException {
        AstNode.Loop data = statement.getValue();
        StatementEncoder.rejectElseClause(statement, data.elseBody());
        AstNode condition = data.condition();
        boolean doWhile = condition.type == AstNode.Type.TUPLE_LITERAL
            && condition.<AstNode.ArrayLiteral>getValue().values().isEmpty();
        if(!doWhile) {
            out.line("while (" + this.expressions.encode(condition) + ") {");
            out.enter();
            this.emitAll(data.body(), out);
            out.exit();
            out.line("}");
            return;
        }
        List<AstNode> body = data.body();
        AstNode last = body.get(body.size() - 1);
        if(!StatementEncoder.isLoopCondition(last)) {
            throw new ErrorException(new Error(
                Error.Kind.MALFORMED_DO_WHILE,
                "Malformed do-while loop",
                Error.Marking.error(
                    last.source,
                    "expected 'if <condition>: continue' as the last statement"
                ),
                Error.Marking.info(
                    condition.source, "'while ()' starts a do-while loop"
                )
            ));
        }
        out.line("do {");
        out.enter();
        this.emitAll(body.subList(0, body.size() - 1), out);
        out.exit();
        AstNode.Conditional loopCondition = last.getValue();
        out.line(
            "} while (" + this.expressions.encode(loopCondition.condition())
                + ");"
        );
    }

    private static boolean isLoopCondition(AstNode statement) {
        if(statement.type != AstNode.Type.CONDITIONAL) { return false; }
        AstNode.Conditional data = statement.getValue();
        return data.elseBody().isEmpty()
            && data.ifBody().size() == 1
            && data.ifBody().get(0).type == AstNode.Type.CONTINUE
            && !StatementEncoder.isPreprocessorTest(data.condition());
    }

    private static ErrorException invalidForLoop(
        AstNode node, String note
    ) {
        return new ErrorException(new Error(
            Error.Kind.INVALID_FOR_LOOP,
            "Invalid for loop",
            Error.Marking.error(node.source, note),
            Error.Marking.help(
                node.source,
                "loops are written as"
                    + " 'for i in int(i := 0)(i < n)(i ** _)'"
            )
        ));
    }

    private static AstNode.Call loopClause(
        AstNode node, String clause
    ) throws ErrorException {
        if(node.type != AstNode.Type.CALL) {
            throw StatementEncoder.invalidForLoop(
                node, "expected the " + clause + " clause here"
            );
        }
        AstNode.Call data = node.getValue();
        if(!data.keywordArguments().isEmpty() || data.arguments().size() > 1) {
            throw StatementEncoder.invalidForLoop(
                node, "the " + clause + " clause takes at most one value"
            );
        }
        return data;
    }

    private static List<AstNode> elementsOf(AstNode node) {
        if(node.type == AstNode.Type.TUPLE_LITERAL) {
            return node.<AstNode.ArrayLiteral>getValue().values();
        }
        return List.of(node);
    }

    /**
     * Finds the type all loop variables are declared with. A single type
     * applies to every variable, a tuple needs one equal type per variable.
     */
    private AstNode sharedLoopType(
        AstNode written, List<AstNode> variables
    ) throws ErrorException {
        if(written.type != AstNode.Type.TUPLE_LITERAL) { return written; }
        List<AstNode> loopTypes = written.<AstNode.ArrayLiteral>getValue()
            .values();
        if(loopTypes.size() != variables.size()) {
            throw StatementEncoder.invalidForLoop(
                written,
                "expected " + variables.size() + " type(s) for the loop"
                    + " variables, but got " + loopTypes.size()
            );
        }
        String first = this.types.encodeAbstract(loopTypes.get(0));
        for(AstNode loopType: loopTypes) {
            if(!this.types.encodeAbstract(loopType).equals(first)) {
                throw StatementEncoder.invalidForLoop(
                    loopType,
                    "all loop variables are declared together and need"
                        + " the same type"
                );
            }
        }
        return loopTypes.get(0);
    }

    private void emitForLoop(
        AstNode statement, Output out
    ) throws ErrorException {
        AstNode.ForLoop data = statement.getValue();
        StatementEncoder.rejectElseClause(statement, data.elseBody());
        List<AstNode> variables = StatementEncoder.elementsOf(data.target());
        for(AstNode variable: variables) {
            if(!variable.isIdentifier()) {
                throw StatementEncoder.invalidForLoop(
                    variable, "the loop variables must be names"
                );
            }
        }
        AstNode.Call step = StatementEncoder.loopClause(data.source(), "step");
        AstNode.Call condition = StatementEncoder
            .loopClause(step.called(), "condition");
        AstNode.Call initial = StatementEncoder
            .loopClause(condition.called(), "initialization");
        AstNode loopType = this.sharedLoopType(initial.called(), variables);
        String init = "";
        if(!initial.arguments().isEmpty()) {
            List<AstNode> values = StatementEncoder.elementsOf(
                initial.arguments().get(0)
            );
            if(values.size() != variables.size()) {
                throw StatementEncoder.invalidForLoop(
                    initial.arguments().get(0),
                    "expected an initial value for each loop variable"
                );
            }
            List<String> initialized = new ArrayList<>();
            for(int i = 0; i < values.size(); i += 1) {
                AstNode value = values.get(i);
                String variable = variables.get(i).identifierName();
                if(value.type != AstNode.Type.ASSIGNMENT_VALUE
                        || !value.<AstNode.BiOp>getValue().left()
                            .isIdentifier(variable)) {
                    throw StatementEncoder.invalidForLoop(
                        value, "expected '" + variable + " := <value>'"
                    );
                }
                String assigned = this.expressions.encode(
                    value.<AstNode.BiOp>getValue().right()
                );
                String declared = i == 0
                    ? this.types.encode(loopType, variable)
                    : this.types.encodeFollowing(loopType, variable);
                initialized.add(declared + " = " + assigned);
            }
            init = String.join(", ", initialized);
        }
        String test = condition.arguments().isEmpty()
            ? "" : this.expressions.encode(condition.arguments().get(0));
        String increment = step.arguments().isEmpty()
            ? "" : this.expressions.encode(step.arguments().get(0));
        out.line("for (" + init + "; " + test + "; " + increment + ") {");
        out.enter();
        this.emitAll(data.body(), out);
        out.exit();
        out.line("}");
    }

    private void emitJump(AstNode statement, Output out) throws ErrorException {
        AstNode.Jump data = statement.getValue();
        if(data.target().isEmpty() || !data.target().get().isIdentifier()
                || data.cause().isPresent()) {
            throw new ErrorException(new Error(
                Error.Kind.INVALID_GOTO,
                "Invalid goto",
                Error.Marking.error(
                    statement.source, "expected 'raise <label>'"
                )
            ));
        }
        out.line(
            "goto " + Names.escape(data.target().get().identifierName()) + ";"
        );
    }

    private void emitDefinition(
        AstNode statement, Output out
    ) throws ErrorException {
        AstNode.Definition data = statement.getValue();
        if(!data.decorators().isEmpty()) {
            throw StatementEncoder.unsupported(
                data.decorators().get(0), "Unsupported decorator",
                "functions and macros cannot be decorated"
            );
        }
        if(!data.keywordOnlyParameters().isEmpty()) {
            throw StatementEncoder.unsupported(
                statement, "Keyword-only parameters",
                "'" + data.keywordOnlyParameters().get(0).name() + "'"
                    + " can only be passed by keyword, which C does not have"
            );
        }
        for(AstNode.Parameter parameter: data.parameters()) {
            if(parameter.defaultValue().isPresent()) {
                throw new ErrorException(new Error(
                    Error.Kind.UNSUPPORTED_CONSTRUCT,
                    "Default parameter value",
                    Error.Marking.error(
                        parameter.source(),
                        "C parameters cannot have default values"
                    )
                ));
            }
        }
        boolean allTyped = true;
        Optional<AstNode.Parameter> untyped = Optional.empty();
        Optional<AstNode.Parameter> typed = Optional.empty();
        for(AstNode.Parameter parameter: data.parameters()) {
            if(parameter.annotation().isPresent()) {
                typed = Optional.of(parameter);
            } else {
                allTyped = false;
                untyped = Optional.of(parameter);
            }
        }
        if(data.returnType().isPresent() && allTyped) {
            this.emitFunction(data, out);
            return;
        }
        if(data.returnType().isEmpty() && typed.isEmpty()) {
            this.emitMacro(data, out);
            return;
        }
        List<Error.Marking> markings = new ArrayList<>();
        if(untyped.isPresent()) {
            markings.add(Error.Marking.error(
                untyped.get().source(), "this parameter has no type"
            ));
        }
        if(typed.isPresent() && data.returnType().isEmpty()) {
            markings.add(Error.Marking.error(
                typed.get().source(), "but this parameter has a type"
            ));
        }
        markings.add(Error.Marking.help(
            statement.source,
            "annotate everything for a function or nothing for a macro"
        ));
        throw new ErrorException(new Error(
            Error.Kind.AMBIGUOUS_DEFINITION,
            "'" + data.name() + "' is neither a function nor a macro",
            markings.toArray(new Error.Marking[0])
        ));
    }

    private static boolean isPrototypeBody(List<AstNode> body) {
        if(body.size() != 1) { return false; }
        AstNode only = body.get(0);
        return only.type == AstNode.Type.EXPRESSION_STATEMENT
            && only.<AstNode.MonoOp>getValue().value().type
                == AstNode.Type.ELLIPSIS_LITERAL;
    }

    private void emitFunction(
        AstNode.Definition data, Output out
    ) throws ErrorException {
        List<String> parameters = new ArrayList<>();
        for(AstNode.Parameter parameter: data.parameters()) {
            parameters.add(
                this.types.encode(parameter.annotation().get(), parameter.name())
            );
        }
        if(data.variadic().isPresent()) {
            parameters.add("...");
        }
        String parameterList = parameters.isEmpty()
            ? "void" : String.join(", ", parameters);
        String header = this.types.encodeFunctionHead(
            data.returnType().get(),
            Names.escape(data.name()) + "(" + parameterList + ")"
        );
        if(StatementEncoder.isPrototypeBody(data.body())) {
            out.line(header + ";");
            return;
        }
        out.line(header + " {");
        out.enter();
        this.emitAll(data.body(), out);
        out.exit();
        out.line("}");
    }

    private void emitMacro(
        AstNode.Definition data, Output out
    ) throws ErrorException {
        List<String> parameters = new ArrayList<>();
        for(AstNode.Parameter parameter: data.parameters()) {
            parameters.add(Names.escape(parameter.name()));
        }
        if(data.variadic().isPresent()) {
            parameters.add("...");
        }
        String header = "#define " + Names.escape(data.name())
            + "(" + String.join(", ", parameters) + ")";
        List<AstNode> body = data.body();
        if(body.size() == 1
                && body.get(0).type == AstNode.Type.EXPRESSION_STATEMENT) {
            AstNode value = body.get(0).<AstNode.MonoOp>getValue().value();
            out.line(header + " (" + this.expressions.encode(value) + ")");
            return;
        }
        out.line(header + " do { \\");
        Output inner = out.nested();
        inner.enter();
        this.emitAll(body, inner);
        for(String line: inner.lines()) {
            out.rawLine(line + " \\");
        }
        out.line("} while(0)");
    }

    private List<String> variablesOf(
        AstNode.CompositeDefinition data
    ) throws ErrorException {
        List<String> variables = new ArrayList<>();
        for(AstNode decorator: data.decorators()) {
            if(decorator.isIdentifier("typedef")) { continue; }
            if(decorator.type == AstNode.Type.CALL) {
                AstNode.Call call = decorator.getValue();
                if(call.called().isIdentifier("typedef")) { continue; }
                if(call.called().isIdentifier("var")
                        && call.keywordArguments().isEmpty()) {
                    for(AstNode variable: call.arguments()) {
                        if(!variable.isIdentifier()) {
                            throw StatementEncoder.unsupported(
                                variable, "Invalid variable declaration",
                                "'@var' only takes variable names"
                            );
                        }
                        variables.add(Names.escape(variable.identifierName()));
                    }
                    continue;
                }
            }
            throw StatementEncoder.unsupported(
                decorator, "Unsupported decorator",
                "only '@typedef' and '@var' can be applied to a class"
            );
        }
        return variables;
    }

    private void emitComposite(
        AstNode statement, Output out
    ) throws ErrorException {
        AstNode.CompositeDefinition data = statement.getValue();
        Composite kind = TypeRegistry.kindOf(data);
        Optional<String> alias = TypeRegistry.typedefAliasOf(data)
            .map(Names::escape);
        List<String> variables = this.variablesOf(data);
        boolean anonymous = data.name().equals(Names.PLACEHOLDER);
        out.line(
            (alias.isPresent()? "typedef " : "") + kind.keyword
                + (anonymous? "" : " " + Names.escape(data.name())) + " {"
        );
        out.enter();
        for(AstNode member: data.body()) {
            if(kind == Composite.ENUM) {
                this.emitEnumMember(member, out);
            } else {
                this.emitField(member, out);
            }
        }
        out.exit();
        String variableList = String.join(", ", variables);
        if(alias.isPresent()) {
            out.line("} " + alias.get() + ";");
            if(!variables.isEmpty()) {
                out.line(alias.get() + " " + variableList + ";");
            }
        } else if(!variables.isEmpty()) {
            out.line("} " + variableList + ";");
        } else {
            out.line("};");
        }
    }

    private static boolean isIgnoredMember(AstNode member) {
        if(member.type == AstNode.Type.PASS) { return true; }
        if(member.type != AstNode.Type.EXPRESSION_STATEMENT) { return false; }
        AstNode value = member.<AstNode.MonoOp>getValue().value();
        return value.type == AstNode.Type.ELLIPSIS_LITERAL
            || value.type == AstNode.Type.STRING_LITERAL;
    }

    private void emitField(AstNode member, Output out) throws ErrorException {
        if(StatementEncoder.isIgnoredMember(member)) { return; }
        switch(member.type) {
            case DECLARATION: {
                AstNode.Declaration data = member.getValue();
                if(!data.target().isIdentifier()) {
                    throw StatementEncoder.unsupported(
                        data.target(), "Invalid member declaration",
                        "only a name can be declared"
                    );
                }
                if(data.value().isPresent()) {
                    throw StatementEncoder.unsupported(
                        data.value().get(), "Member with a default value",
                        "struct and union members cannot have default values"
                    );
                }
                out.line(
                    this.types.encode(
                        data.annotation(), data.target().identifierName()
                    ) + ";"
                );
                return;
            }
            case COMPOSITE_DEFINITION: {
                this.emitComposite(member, out);
                return;
            }
            default:
                throw StatementEncoder.unsupported(
                    member, "Unsupported struct member",
                    "expected a member declaration like 'x: int'"
                );
        }
    }

    private void emitEnumMember(
        AstNode member, Output out
    ) throws ErrorException {
        if(StatementEncoder.isIgnoredMember(member)) { return; }
        AstNode name;
        Optional<AstNode> value;
        switch(member.type) {
            case ASSIGNMENT: {
                AstNode.Assignment data = member.getValue();
                if(data.targets().size() != 1) {
                    throw StatementEncoder.unsupported(
                        member, "Invalid enum member",
                        "an enum member has exactly one name"
                    );
                }
                name = data.targets().get(0);
                value = Optional.of(data.value());
                break;
            }
            case DECLARATION: {
                AstNode.Declaration data = member.getValue();
                name = data.target();
                value = data.value();
                break;
            }
            case EXPRESSION_STATEMENT: {
                name = member.<AstNode.MonoOp>getValue().value();
                value = Optional.empty();
                break;
            }
            default:
                throw StatementEncoder.unsupported(
                    member, "Unsupported enum member",
                    "expected 'NAME = value' or 'NAME'"
                );
        }
        if(!name.isIdentifier()) {
            throw StatementEncoder.unsupported(
                name, "Invalid enum member",
                "an enum member must be a name"
            );
        }
        String escaped = Names.escape(name.identifierName());
        if(value.isPresent()) {
            out.line(escaped + " = " + this.expressions.encode(value.get()) + ",");
        } else {
            out.line(escaped + ",");
        }
    }

    private void emitSwitch(AstNode statement, Output out) throws ErrorException {
        AstNode.Switch data = statement.getValue();
        out.line("switch (" + this.expressions.encode(data.subject()) + ") {");
        for(AstNode.SwitchCase switchCase: data.cases()) {
            if(switchCase.guard().isPresent()) {
                throw StatementEncoder.unsupported(
                    switchCase.guard().get(), "Guarded case",
                    "C case labels cannot have conditions"
                );
            }
            for(AstNode pattern: switchCase.patterns()) {
                if(pattern.isIdentifier(Names.PLACEHOLDER)) {
                    out.line("default:");
                } else {
                    out.line("case " + this.expressions.encode(pattern) + ":");
                }
            }
            out.enter();
            this.emitAll(switchCase.body(), out);
            out.exit();
        }
        out.line("}");
    }

}
