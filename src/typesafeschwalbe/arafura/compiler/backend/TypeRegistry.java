package typesafeschwalbe.arafura.compiler.backend;

import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;

import typesafeschwalbe.arafura.compiler.Error;
import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;

/**
 * Classifies identifiers as struct, union or enum tags, along with the
 * typedef aliases declared for them. Built once per translation by
 * {@link #collect(List)} and never modified afterwards.
 */
public final class TypeRegistry {

    private final Set<String> structTags;
    private final Set<String> unionTags;
    private final Set<String> enumTags;
    private final Map<String, Composite> aliases;

    private TypeRegistry(
        Set<String> structTags, Set<String> unionTags, Set<String> enumTags,
        Map<String, Composite> aliases
    ) {
        this.structTags = Set.copyOf(structTags);
        this.unionTags = Set.copyOf(unionTags);
        this.enumTags = Set.copyOf(enumTags);
        this.aliases = Map.copyOf(aliases);
    }

    private static class Collector {
        private final Map<String, Composite> tags = new HashMap<>();
        private final Map<String, Composite> aliases = new HashMap<>();

        private void register(
            Map<String, Composite> into, String name, Composite kind,
            AstNode node
        ) throws ErrorException {
            Composite existing = into.putIfAbsent(name, kind);
            if(existing != null && existing != kind) {
                throw new ErrorException(new Error(
                    Error.Kind.UNSUPPORTED_CONSTRUCT,
                    "Conflicting composite type declarations",
                    Error.Marking.error(
                        node.source,
                        "'" + name + "' is declared as " + existing.keyword
                            + " elsewhere, but as " + kind.keyword + " here"
                    )
                ));
            }
        }

        private void visit(List<AstNode> statements) throws ErrorException {
            for(AstNode statement: statements) {
                if(statement.type != AstNode.Type.COMPOSITE_DEFINITION) {
                    continue;
                }
                AstNode.CompositeDefinition data = statement.getValue();
                Composite kind = TypeRegistry.kindOf(data);
                if(!data.name().equals(Names.PLACEHOLDER)) {
                    this.register(this.tags, data.name(), kind, statement);
                }
                Optional<String> alias = TypeRegistry.typedefAliasOf(data);
                if(alias.isPresent()) {
                    this.register(this.aliases, alias.get(), kind, statement);
                }
                this.visit(data.body());
            }
        }
    }

    public static TypeRegistry collect(
        List<AstNode> statements
    ) throws ErrorException {
        Collector collector = new Collector();
        collector.visit(statements);
        Set<String> structTags = new HashSet<>();
        Set<String> unionTags = new HashSet<>();
        Set<String> enumTags = new HashSet<>();
        for(Map.Entry<String, Composite> tag: collector.tags.entrySet()) {
            switch(tag.getValue()) {
                case STRUCT: structTags.add(tag.getKey()); break;
                case UNION: unionTags.add(tag.getKey()); break;
                case ENUM: enumTags.add(tag.getKey()); break;
                default: throw new IllegalStateException(
                    "unhandled composite kind " + tag.getValue()
                );
            }
        }
        return new TypeRegistry(
            structTags, unionTags, enumTags, collector.aliases
        );
    }

    public static Composite kindOf(AstNode.CompositeDefinition data) {
        for(AstNode base: data.bases()) {
            if(base.isIdentifier()) {
                Composite kind = Composite.fromBaseName(base.identifierName());
                if(kind != Composite.STRUCT) { return kind; }
            }
        }
        return Composite.STRUCT;
    }

    /**
     * Finds the alias named by a '@typedef' decorator. A bare '@typedef' or
     * one without arguments aliases the class name itself.
     */
    public static Optional<String> typedefAliasOf(
        AstNode.CompositeDefinition data
    ) {
        for(AstNode decorator: data.decorators()) {
            if(decorator.isIdentifier("typedef")) {
                return Optional.of(data.name());
            }
            if(decorator.type != AstNode.Type.CALL) { continue; }
            AstNode.Call call = decorator.getValue();
            if(!call.called().isIdentifier("typedef")) { continue; }
            if(call.arguments().size() == 1
                    && call.arguments().get(0).isIdentifier()) {
                return Optional.of(call.arguments().get(0).identifierName());
            }
            return Optional.of(data.name());
        }
        return Optional.empty();
    }

    public Optional<Composite> tagKind(String name) {
        if(this.structTags.contains(name)) { return Optional.of(Composite.STRUCT); }
        if(this.unionTags.contains(name)) { return Optional.of(Composite.UNION); }
        if(this.enumTags.contains(name)) { return Optional.of(Composite.ENUM); }
        return Optional.empty();
    }

    public boolean isAlias(String name) {
        return this.aliases.containsKey(name);
    }

    /**
     * Tells whether a call to the given name builds a struct literal,
     * which holds for struct tags and for aliases of structs.
     */
    public boolean constructsStruct(String name) {
        return this.structTags.contains(name)
            || this.aliases.get(name) == Composite.STRUCT;
    }

    /**
     * Gives the keyword a bare reference to the given name needs. Aliases
     * are referenced bare, tags without an alias need their keyword.
     */
    public Optional<Composite> keywordFor(String name) {
        if(this.aliases.containsKey(name)) { return Optional.empty(); }
        return this.tagKind(name);
    }

    @Override
    public String toString() {
        return "TypeRegistry[structs=" + new TreeSet<>(this.structTags)
            + ", unions=" + new TreeSet<>(this.unionTags)
            + ", enums=" + new TreeSet<>(this.enumTags)
            + ", aliases=" + new TreeMap<>(this.aliases) + "]";
    }

}
