package org.lojban.analysis.lujvo;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable set of morphology options shared by the builder, the splitter and the
 * classifier. Use {@link #DEFAULT} for the standard rules or {@link #builder()} to change
 * individual options.
 */
public final class MorphologySettings {

    /**
     * Where the {@code 'y} hyphen may be used.
     */
    public enum YHyphens {
        /** Only where the standard rules require it. */
        STANDARD,
        /** Also allowed where an {@code r} or {@code n} hyphen would normally go. */
        ALLOW_Y,
        /** Always used in place of {@code r} and {@code n} hyphens. */
        FORCE_Y
    }

    /**
     * What counts as enough consonants for a word to be a brivla.
     */
    public enum ConsonantRule {
        CLUSTER, TWO_CONSONANTS, ONE_CONSONANT
    }

    public static final MorphologySettings DEFAULT = builder().build();

    private final YHyphens yHyphens;
    private final boolean expRafsiShapes;
    private final ConsonantRule consonants;
    private final boolean glides;
    private final boolean allowMz;

    private MorphologySettings(Builder builder) {
        this.yHyphens = builder.yHyphens;
        this.expRafsiShapes = builder.expRafsiShapes;
        this.consonants = builder.consonants;
        this.glides = builder.glides;
        this.allowMz = builder.allowMz;
    }

    public YHyphens getYHyphens() {
        return yHyphens;
    }

    /** Whether rafsi shapes outside the standard set are accepted. */
    public boolean isExpRafsiShapes() {
        return expRafsiShapes;
    }

    public ConsonantRule getConsonants() {
        return consonants;
    }

    /** Whether a leading glide counts as a consonant. */
    public boolean isGlides() {
        return glides;
    }

    /** Whether {@code mz} is a permissible consonant pair. */
    public boolean isAllowMz() {
        return allowMz;
    }

    public Builder toBuilder() {
        return new Builder()
                .yHyphens(yHyphens)
                .expRafsiShapes(expRafsiShapes)
                .consonants(consonants)
                .glides(glides)
                .allowMz(allowMz);
    }

    /**
     * Standard rules, with only the {@code mz} option carried over.
     */
    static MorphologySettings standard(boolean allowMz) {
        return allowMz ? builder().allowMz(true).build() : DEFAULT;
    }

    /**
     * Same settings with the consonant rule reset to {@link ConsonantRule#CLUSTER} and glides
     * not counted.
     */
    MorphologySettings withoutConsonantRules() {
        if (consonants == ConsonantRule.CLUSTER && !glides) {
            return this;
        }
        return toBuilder().consonants(ConsonantRule.CLUSTER).glides(false).build();
    }

    MorphologySettings withoutExpRafsiShapes() {
        return expRafsiShapes ? toBuilder().expRafsiShapes(false).build() : this;
    }

    /**
     * Every combination of options, 72 in all.
     */
    public static List<MorphologySettings> allCombinations() {
        List<MorphologySettings> all = new ArrayList<>();
        for (YHyphens y : YHyphens.values()) {
            for (boolean exp : new boolean[] {false, true}) {
                for (ConsonantRule c : ConsonantRule.values()) {
                    for (boolean g : new boolean[] {false, true}) {
                        for (boolean mz : new boolean[] {false, true}) {
                            all.add(builder().yHyphens(y).expRafsiShapes(exp).consonants(c).glides(g).allowMz(mz).build());
                        }
                    }
                }
            }
        }
        return Collections.unmodifiableList(all);
    }

    public static Builder builder() {
        return new Builder();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof MorphologySettings)) {
            return false;
        }
        MorphologySettings other = (MorphologySettings) o;
        return yHyphens == other.yHyphens
                && expRafsiShapes == other.expRafsiShapes
                && consonants == other.consonants
                && glides == other.glides
                && allowMz == other.allowMz;
    }

    @Override
    public int hashCode() {
        return Objects.hash(yHyphens, expRafsiShapes, consonants, glides, allowMz);
    }

    @Override
    public String toString() {
        return "MorphologySettings{yHyphens=" + yHyphens
                + ", expRafsiShapes=" + expRafsiShapes
                + ", consonants=" + consonants
                + ", glides=" + glides
                + ", allowMz=" + allowMz + "}";
    }

    public static final class Builder {
        private YHyphens yHyphens = YHyphens.STANDARD;
        private boolean expRafsiShapes = false;
        private ConsonantRule consonants = ConsonantRule.CLUSTER;
        private boolean glides = false;
        private boolean allowMz = false;

        private Builder() {
        }

        public Builder yHyphens(YHyphens yHyphens) {
            this.yHyphens = Objects.requireNonNull(yHyphens, "yHyphens");
            return this;
        }

        public Builder expRafsiShapes(boolean expRafsiShapes) {
            this.expRafsiShapes = expRafsiShapes;
            return this;
        }

        public Builder consonants(ConsonantRule consonants) {
            this.consonants = Objects.requireNonNull(consonants, "consonants");
            return this;
        }

        public Builder glides(boolean glides) {
            this.glides = glides;
            return this;
        }

        public Builder allowMz(boolean allowMz) {
            this.allowMz = allowMz;
            return this;
        }

        public MorphologySettings build() {
            return new MorphologySettings(this);
        }
    }
}
