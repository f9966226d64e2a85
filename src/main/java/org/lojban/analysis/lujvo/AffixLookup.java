package org.lojban.analysis.lujvo;

import java.util.List;

/**
 * Read-only mapping between source words and their rafsi.
 */
public interface AffixLookup {

    /**
     * Rafsi of the word in priority order; empty if it has none or is unknown.
     */
    List<String> rafsiFor(String valsi);

    /**
     * Whether the word is a known source word, with or without rafsi.
     */
    boolean contains(String valsi);

    /**
     * The source word owning this rafsi, or {@code null}.
     */
    String valsiForRafsi(String rafsi);
}
