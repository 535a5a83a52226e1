package site.rstream.exception;

/**
 * 对键执行了与其值类型不符的操作。
 */
public class WrongTypeException extends IllegalStateException {

    public static final String MESSAGE = "WRONGTYPE Operation against a key holding the wrong kind of value";

    public WrongTypeException() {
        super(MESSAGE);
    }
}
