package org.lojban.analysis.lujvo;

/**
 * Why a build, split or classification was rejected.
 */
public enum ErrorKind {
    /** Input contains a character outside the Lojban alphabet. */
    NON_LOJBAN_CHARACTER,
    /** A consonant pair or triple is not permitted where it occurs. */
    INVALID_CLUSTER,
    /** No lujvo can be built from the given components. */
    NO_LUJVO_FOUND,
    /** The word could not be split into rafsi. */
    DECOMPOSITION_FAILED,
    /** The word splits, but is not the form the builder produces. */
    MALFORMED_WORD,
    /** The word is not a valid zi'evla or rafsi shape. */
    NOT_ZIHEVLA,
    /** The word is not a brivla or cmevla of any kind. */
    NOT_BRIVLA
}
