package typesafeschwalbe.arafura.compiler.backend;

public class Names {

    private Names() {}

    public static final String PLACEHOLDER = "_";

    public static final String VARIADIC_ARGUMENTS = "__VA_ARGS__";

    /**
     * Removes the two leading underscores from an escaped identifier, so
     * that '___' becomes '_' and '__FILE__' becomes 'FILE__'.
     * '__VA_ARGS__' is kept as is for use in variadic macros.
     */
    public static String escape(String name) {
        if(name.equals(VARIADIC_ARGUMENTS)) { return name; }
        if(name.length() > 2 && name.startsWith("__")) {
            return name.substring(2);
        }
        return name;
    }

}
