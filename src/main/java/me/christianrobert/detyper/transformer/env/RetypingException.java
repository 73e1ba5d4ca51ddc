package me.christianrobert.detyper.transformer.env;

/**
 * Raised by a {@link Retyper} when it cannot type or expand a term.
 *
 * <p>The detyper always recovers from it by falling back to a less informative display.</p>
 */
public class RetypingException extends RuntimeException {

    public RetypingException(String message) {
        super(message);
    }

    public RetypingException(String message, Throwable cause) {
        super(message, cause);
    }
}
