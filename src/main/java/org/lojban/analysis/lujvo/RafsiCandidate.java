package org.lojban.analysis.lujvo;

/**
 * One way a tanru component can appear inside a lujvo: the rafsi with any hyphen it
 * carries, and how many consonants it contributes towards the brivla requirement.
 */
public final class RafsiCandidate {
    public final String form;
    public final int consonants;

    RafsiCandidate(String form, int consonants) {
        this.form = form;
        this.consonants = consonants;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof RafsiCandidate)) {
            return false;
        }
        RafsiCandidate other = (RafsiCandidate) o;
        return consonants == other.consonants && form.equals(other.form);
    }

    @Override
    public int hashCode() {
        return 31 * form.hashCode() + consonants;
    }

    @Override
    public String toString() {
        return "(" + form + ", " + consonants + ")";
    }
}
