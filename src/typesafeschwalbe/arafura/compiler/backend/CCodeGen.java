package typesafeschwalbe.arafura.compiler.backend;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.arafura.compiler.ErrorException;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;

/**
 * Turns a parsed module into C99 source text.
 * Generation happens in two passes: all composite type tags are collected
 * into a {@link TypeRegistry} first, which the statement and expression
 * encoders then consult while emitting lines.
 */
public class CCodeGen {

    private static final Logger LOGGER = LoggerFactory.getLogger(CCodeGen.class);

    public String generate(AstNode module) throws ErrorException {
        if(module.type != AstNode.Type.MODULE) {
            throw new IllegalArgumentException(
                "Code can only be generated for a module!"
            );
        }
        AstNode.Block data = module.getValue();
        TypeRegistry registry = TypeRegistry.collect(data.statements());
        LOGGER.debug(
            "Collected composite types of '{}': {}",
            module.source.file(), registry
        );
        Output out = new Output();
        StatementEncoder statements = new StatementEncoder(registry);
        statements.emitAll(data.statements(), out);
        if(out.indentation() != 0) {
            throw new IllegalStateException(
                "Emission finished inside of a block!"
            );
        }
        LOGGER.debug(
            "Generated {} line(s) of C for '{}'",
            out.lines().size(), module.source.file()
        );
        return out.text();
    }

}
