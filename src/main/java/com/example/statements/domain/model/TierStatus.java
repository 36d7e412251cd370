package com.example.statements.domain.model;

/**
 * Tag of a {@link TierResult}.
 */
public enum TierStatus {
    SUCCESS,
    EMPTY,
    ERROR
}
