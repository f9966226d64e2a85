package org.lojban.analysis.lujvo;

/**
 * Half-open character range {@code [start, end)} of one rafsi inside a word.
 */
public final class Span {
    public final int start;
    public final int end;

    public Span(int start, int end) {
        this.start = start;
        this.end = end;
    }

    public int length() {
        return end - start;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof Span)) {
            return false;
        }
        Span other = (Span) o;
        return start == other.start && end == other.end;
    }

    @Override
    public int hashCode() {
        return 31 * start + end;
    }

    @Override
    public String toString() {
        return "(" + start + ", " + end + ")";
    }
}
