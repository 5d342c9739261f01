package typesafeschwalbe.arafura.compiler;

public class ErrorException extends Exception {
    
    public final Error error;

    public ErrorException(Error error) {
        super(error.message());
        this.error = error;
    }

    public Error.Kind kind() {
        return this.error.kind();
    }

}
