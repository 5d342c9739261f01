package typesafeschwalbe.arafura.compiler.backend;

public enum Composite {
    STRUCT("struct"),
    UNION("union"),
    ENUM("enum");

    public final String keyword;

    private Composite(String keyword) {
        this.keyword = keyword;
    }

    public static Composite fromBaseName(String name) {
        switch(name) {
            case "Union": return UNION;
            case "Enum": return ENUM;
            default: return STRUCT;
        }
    }

}
