package org.lojban.analysis.lujvo;

/**
 * A word splits into rafsi, but the builder would have produced a different form.
 */
public class MalformedWordException extends LujvoException {

    private static final long serialVersionUID = 1L;

    private final String word;
    private final String correctForm;

    public MalformedWordException(String word, String correctForm) {
        super(ErrorKind.MALFORMED_WORD, "malformed lujvo {" + word + "}; it should be {" + correctForm + "}");
        this.word = word;
        this.correctForm = correctForm;
    }

    public String getWord() {
        return word;
    }

    /** The form the builder produces for the same rafsi. */
    public String getCorrectForm() {
        return correctForm;
    }
}
