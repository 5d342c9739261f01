package typesafeschwalbe.arafura.compiler;

public enum Color {
    BOLD("1"),
    RED("31"),
    GREEN("32"),
    GRAY("90"),
    BRIGHT_BLUE("94");

    private final String code;

    private Color(String code) {
        this.code = code;
    }

    public static String from(Color... properties) {
        StringBuilder sequence = new StringBuilder("\033[0");
        for(Color property: properties) {
            sequence.append(";");
            sequence.append(property.code);
        }
        sequence.append("m");
        return sequence.toString();
    }

    public static String reset() {
        return Color.from();
    }

}
