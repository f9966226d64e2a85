package org.lojban.analysis.lujvo;

/**
 * Thrown when a word cannot be built, split or classified.
 */
public class LujvoException extends Exception {

    private static final long serialVersionUID = 1L;

    private final ErrorKind kind;

    public LujvoException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public LujvoException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    /**
     * True for the failures that mean "this is not a well-formed split": a bad cluster,
     * no split at all, or a split that is not the canonical form.
     */
    public boolean isDecompositionFailure() {
        return kind == ErrorKind.DECOMPOSITION_FAILED
                || kind == ErrorKind.INVALID_CLUSTER
                || kind == ErrorKind.MALFORMED_WORD;
    }
}
