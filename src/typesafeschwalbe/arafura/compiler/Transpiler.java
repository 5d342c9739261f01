package typesafeschwalbe.arafura.compiler;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import typesafeschwalbe.arafura.compiler.backend.CCodeGen;
import typesafeschwalbe.arafura.compiler.frontend.AstNode;
import typesafeschwalbe.arafura.compiler.frontend.Lexer;
import typesafeschwalbe.arafura.compiler.frontend.SourceParser;

public class Transpiler {

    private static final Logger LOGGER = LoggerFactory.getLogger(Transpiler.class);

    public static Result<String> transpile(String fileName, String content) {
        AstNode module;
        try {
            Lexer lexer = new Lexer(fileName, content);
            SourceParser parser = new SourceParser(lexer);
            module = parser.parseModule();
        } catch(ErrorException e) {
            LOGGER.debug("Parsing of '{}' failed: {}", fileName, e.error);
            return Result.ofError(e.error);
        }
        LOGGER.debug("Parsed '{}'", fileName);
        CCodeGen codeGen = new CCodeGen();
        try {
            return Result.ofValue(codeGen.generate(module));
        } catch(ErrorException e) {
            LOGGER.debug("Translation of '{}' failed: {}", fileName, e.error);
            return Result.ofError(e.error);
        }
    }

}
