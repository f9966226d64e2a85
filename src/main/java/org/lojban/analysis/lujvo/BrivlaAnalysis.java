package org.lojban.analysis.lujvo;

import java.util.Collections;
import java.util.List;

/**
 * A classified word and the pieces it splits into, hyphens included.
 */
public final class BrivlaAnalysis {
    private final WordType type;
    private final List<String> pieces;

    BrivlaAnalysis(WordType type, List<String> pieces) {
        this.type = type;
        this.pieces = Collections.unmodifiableList(pieces);
    }

    public WordType getType() {
        return type;
    }

    public List<String> getPieces() {
        return pieces;
    }

    @Override
    public String toString() {
        return type + " " + pieces;
    }
}
