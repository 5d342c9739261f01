package typesafeschwalbe.arafura.compiler;

import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.Objects;

public record Error(Kind kind, String message, Marking... markings) {

    public enum Kind {
        USAGE("usage error"),
        FILE_ACCESS("file access error"),
        FRONT_END("syntax error"),
        UNSUPPORTED_CONSTRUCT("unsupported construct"),
        MALFORMED_DO_WHILE("malformed do-while loop"),
        INVALID_FOR_LOOP("invalid for loop"),
        INVALID_GOTO("invalid goto"),
        AMBIGUOUS_DEFINITION("ambiguous definition");

        public final String description;

        private Kind(String description) {
            this.description = description;
        }
    }

    public static record Marking(Type type, Source location, String note) {

        private enum Type {
            ERROR('^', Color.RED),
            INFO('~', Color.BRIGHT_BLUE),
            HELP('*', Color.GREEN);

            private final char marker;
            private final Color color;

            private Type(char marker, Color color) {
                this.marker = marker;
                this.color = color;
            }
        }

        public static Marking error(Source location, String note) {
            return new Marking(Type.ERROR, location, note);
        }

        public static Marking info(Source location, String note) {
            return new Marking(Type.INFO, location, note);
        }

        public static Marking help(Source location, String note) {
            return new Marking(Type.HELP, location, note);
        }

    }

    @Override
    public boolean equals(Object otherRaw) {
        if(!(otherRaw instanceof Error)) { return false; }
        Error other = (Error) otherRaw;
        return this.kind == other.kind
            && this.message.equals(other.message)
            && Arrays.equals(this.markings, other.markings);
    }

    @Override
    public int hashCode() {
        return Objects.hash(
            this.kind, this.message, Arrays.hashCode(this.markings)
        );
    }

    @Override
    public String toString() {
        return this.kind.description + ": " + this.message;
    }

    public String render(Map<String, String> files, boolean colored) {
        String headlineColor = colored
            ? Color.from(Color.BOLD, Color.RED) : "";
        String messageColor = colored ? Color.from(Color.RED) : "";
        String frameColor = colored ? Color.from(Color.GRAY) : "";
        String codeColor = colored ? Color.reset() : "";
        StringBuilder output = new StringBuilder();
        output.append(headlineColor);
        output.append("error: ");
        output.append(messageColor);
        output.append(this.message);
        output.append("\n");
        for(Marking marked: this.markings) {
            String fileContent = files.get(marked.location.file());
            if(fileContent == null) {
                throw new IllegalArgumentException(
                    "An error source location refers to a file"
                        + " that is not present in the provided files!"
                );
            }
            List<String> lines = fileContent.lines().toList();
            Source.Position start = marked.location.startPosition(fileContent);
            Source.Position end = marked.location.endPosition(fileContent);
            final int paddingLines = 1;
            int firstLine = Math.max(1, start.line() - paddingLines);
            int lastLine = Math.min(
                Math.max(lines.size(), 1), end.line() + paddingLines
            );
            int gutterWidth = String.valueOf(lastLine).length() + 2;
            output.append(frameColor);
            output.append(" ".repeat(gutterWidth));
            output.append("╭─ ");
            output.append(marked.location.file());
            output.append(":");
            output.append(start.line());
            output.append(":");
            output.append(start.column());
            output.append("\n");
            for(int lineNumber = firstLine; lineNumber <= lastLine;
                    lineNumber += 1) {
                String line = lineNumber <= lines.size()
                    ? lines.get(lineNumber - 1) : "";
                String lineNumberStr = String.valueOf(lineNumber);
                output.append(frameColor);
                output.append(" ".repeat(gutterWidth - 1 - lineNumberStr.length()));
                output.append(lineNumberStr);
                output.append(" │ ");
                output.append(codeColor);
                output.append(line);
                output.append("\n");
                if(lineNumber < start.line() || lineNumber > end.line()) {
                    continue;
                }
                int markFrom = lineNumber == start.line()
                    ? start.column() - 1 : Error.indentationOf(line);
                int markTo = lineNumber == end.line()
                    ? end.column() : line.length();
                output.append(frameColor);
                output.append(" ".repeat(gutterWidth));
                output.append("┊ ");
                output.append(" ".repeat(Math.max(0, markFrom)));
                output.append(colored ? Color.from(marked.type.color) : "");
                output.append(String.valueOf(marked.type.marker).repeat(
                    Math.max(1, markTo - markFrom)
                ));
                if(lineNumber == end.line()) {
                    output.append(" ");
                    output.append(marked.note);
                }
                output.append("\n");
            }
            output.append(frameColor);
            output.append(" ".repeat(gutterWidth - 1));
            output.append("─╯\n");
        }
        if(colored) {
            output.append(Color.reset());
        }
        return output.toString();
    }

    private static int indentationOf(String line) {
        int indentation = 0;
        while(indentation < line.length()
                && Character.isWhitespace(line.charAt(indentation))) {
            indentation += 1;
        }
        return indentation;
    }

}
