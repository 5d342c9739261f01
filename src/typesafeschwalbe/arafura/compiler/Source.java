package typesafeschwalbe.arafura.compiler;

public record Source(String file, int startOffset, int endOffset) {

    public Source(Source start, Source end) {
        this(start.file, start.startOffset, end.endOffset);
        if(!start.file.equals(end.file)) {
            throw new IllegalArgumentException(
                "Provided source locations are not from the same file!"
            );
        }
    }

    public static record Position(int line, int column) {}

    public Position startPosition(String fileContent) {
        return Source.positionOf(fileContent, this.startOffset);
    }

    public Position endPosition(String fileContent) {
        return Source.positionOf(
            fileContent, Math.max(this.startOffset, this.endOffset - 1)
        );
    }

    private static Position positionOf(String fileContent, int offset) {
        int line = 1;
        int lineStart = 0;
        int limit = Math.min(offset, fileContent.length());
        for(int charIdx = 0; charIdx < limit; charIdx += 1) {
            if(fileContent.charAt(charIdx) == '\n') {
                line += 1;
                lineStart = charIdx + 1;
            }
        }
        return new Position(line, offset - lineStart + 1);
    }

    @Override
    public String toString() {
        return "@\"" + this.file + "\"";
    }

}
