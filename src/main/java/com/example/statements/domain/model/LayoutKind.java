package com.example.statements.domain.model;

/**
 * Structural convention of a bank's transaction lines, used to pick a layout parser.
 */
public enum LayoutKind {
    /** {@code DD.MM LABEL 12,50}: day and month only, the year comes from the processing year. */
    DOT_DATE,
    /** {@code DDMMYY LABEL 12,50}: concatenated date at the start of the line. */
    COMPACT_DATE,
    /** {@code LABEL LE DD/MM 12,50}: anchor phrase, amount on the same or the following line. */
    ANCHOR_DATE
}
