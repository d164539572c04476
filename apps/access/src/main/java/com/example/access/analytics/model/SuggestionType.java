package com.example.access.analytics.model;

public enum SuggestionType {
    /** Frequently obtained through temporary grants; a role should carry it. */
    PROMOTE_TO_ROLE,
    /** Held by many users through roles but rarely exercised. */
    NARROW_ROLE
}
