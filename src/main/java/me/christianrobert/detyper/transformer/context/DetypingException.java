package me.christianrobert.detyper.transformer.context;

/**
 * Exception raised for detyper configuration mistakes.
 *
 * <p>Translation itself never throws it: display degrades to placeholders
 * instead. It is raised when a display preference is registered that can
 * never apply, e.g. if-notation for an inductive without exactly two
 * constructors.</p>
 */
public class DetypingException extends RuntimeException {

    private final String reference;
    private final String context;

    public DetypingException(String message) {
        super(message);
        this.reference = null;
        this.context = null;
    }

    public DetypingException(String message, Throwable cause) {
        super(message, cause);
        this.reference = null;
        this.context = null;
    }

    public DetypingException(String message, String reference, String context) {
        super(message);
        this.reference = reference;
        this.context = context;
    }

    /**
     * Gets the global the failing request was about, or null.
     */
    public String getReference() {
        return reference;
    }

    public String getContext() {
        return context;
    }

    /**
     * Gets a detailed error message including the reference and context.
     */
    public String getDetailedMessage() {
        StringBuilder sb = new StringBuilder(getMessage());
        if (reference != null) {
            sb.append("\nReference: ").append(reference);
        }
        if (context != null) {
            sb.append("\nContext: ").append(context);
        }
        return sb.toString();
    }
}
