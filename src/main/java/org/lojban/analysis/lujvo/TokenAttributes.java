package org.lojban.analysis.lujvo;

import org.apache.lucene.analysis.tokenattributes.TypeAttribute;

/**
 * Lucene keeps attribute state in a {@code State} object that has to be captured and
 * restored around every change. The filter instead queues plain copies of the attributes
 * it sets: term, offsets, position increment, position length and type.
 */
class TokenAttributes {
    protected CharSequence term;
    protected int termLength;
    public int offsetStart;
    public int offsetEnd;
    public int posIncrement;
    public int posLength;
    public String type;

    /**
     * Copy of an existing token.
     */
    TokenAttributes(TokenAttributes from) {
        this.copyAttributesFrom(from);
    }

    TokenAttributes(CharSequence term, int offsetStart, int offsetEnd, int posIncrement, int posLength) {
        this.setTerm(term);
        this.offsetStart = offsetStart;
        this.offsetEnd = offsetEnd;
        this.posIncrement = posIncrement;
        this.posLength = posLength;
        this.type = TypeAttribute.DEFAULT_TYPE;
    }

    /**
     * A piece of this token, typed {@code type}, at the same offsets.
     */
    TokenAttributes piece(CharSequence pieceTerm, String pieceType) {
        TokenAttributes token = new TokenAttributes(this);
        token.setTerm(pieceTerm);
        token.type = pieceType;
        token.posLength = 1;
        return token;
    }

    public final void setTerm(CharSequence term) {
        this.term = term;
        this.termLength = term.length();
    }

    public CharSequence getTerm() {
        return this.term;
    }

    /**
     * Whether the offsets cover exactly the term, so piece offsets can be derived from
     * positions in the term.
     */
    boolean offsetsMatchTerm() {
        return this.offsetEnd - this.offsetStart == this.termLength;
    }

    public final void copyAttributesFrom(TokenAttributes token) {
        this.term = token.term;
        this.termLength = token.termLength;
        this.offsetStart = token.offsetStart;
        this.offsetEnd = token.offsetEnd;
        this.posIncrement = token.posIncrement;
        this.posLength = token.posLength;
        this.type = token.type;
    }
}
