package org.lojban.analysis.lujvo;

/**
 * Result of the loan-word shape check.
 */
public enum WordShape {
    /** Has a consonant cluster; a zi'evla. */
    LOAN_SHAPE,
    /** No cluster; usable only as an experimental rafsi. */
    RAFSI_SHAPE
}
