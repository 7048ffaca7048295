package build.orchestra;

public class ConsistencyException extends RuntimeException {

    public ConsistencyException(String message) {
        super(message);
    }
}
