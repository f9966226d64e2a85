package org.lojban.analysis.lujvo;

/**
 * Category of a classified word.
 */
public enum WordType {
    /** A five-letter root word (gismu). */
    ROOT,
    /** A compound (lujvo) built only from standard rafsi. */
    COMPOUND,
    /** A compound containing loan-word or experimental pieces. */
    EXTENDED_COMPOUND,
    /** A loan word (zi'evla). */
    LOAN_SHAPE,
    /** A consonant-final name (cmevla) that decomposes into rafsi. */
    NAME
}
