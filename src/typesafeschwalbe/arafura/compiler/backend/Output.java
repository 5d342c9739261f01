package typesafeschwalbe.arafura.compiler.backend;

import java.util.ArrayList;
import java.util.List;

/**
 * An append-only buffer of completed C lines with an indentation cursor.
 */
public class Output {

    private static final String INDENTATION = "    ";

    private final List<String> lines = new ArrayList<>();
    private int indentation;

    public Output() {
        this(0);
    }

    private Output(int indentation) {
        this.indentation = indentation;
    }

    public void line(String content) {
        this.lines.add(INDENTATION.repeat(this.indentation) + content);
    }

    public void rawLine(String content) {
        this.lines.add(content);
    }

    public void enter() {
        this.indentation += 1;
    }

    public void exit() {
        if(this.indentation == 0) {
            throw new IllegalStateException(
                "Attempted to leave a block while at the outermost level!"
            );
        }
        this.indentation -= 1;
    }

    public int indentation() {
        return this.indentation;
    }

    /**
     * Creates an empty buffer starting at this buffer's indentation,
     * for content that needs to be post-processed before being added.
     */
    public Output nested() {
        return new Output(this.indentation);
    }

    public List<String> lines() {
        return List.copyOf(this.lines);
    }

    public String text() {
        return String.join("\n", this.lines);
    }

}
