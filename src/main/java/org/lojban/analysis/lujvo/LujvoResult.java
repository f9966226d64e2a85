package org.lojban.analysis.lujvo;

import java.util.Collections;
import java.util.List;

/**
 * A built lujvo with its score and the position of each rafsi, hyphens excluded.
 * Lower scores are better.
 */
public final class LujvoResult {
    private final String lujvo;
    private final int score;
    private final List<Span> rafsiSpans;

    LujvoResult(String lujvo, int score, List<Span> rafsiSpans) {
        this.lujvo = lujvo;
        this.score = score;
        this.rafsiSpans = Collections.unmodifiableList(rafsiSpans);
    }

    public String getLujvo() {
        return lujvo;
    }

    public int getScore() {
        return score;
    }

    public List<Span> getRafsiSpans() {
        return rafsiSpans;
    }

    @Override
    public String toString() {
        return lujvo + " " + score + " " + rafsiSpans;
    }
}
