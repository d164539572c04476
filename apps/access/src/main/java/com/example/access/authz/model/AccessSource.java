package com.example.access.authz.model;

/**
 * Where an effective permission came from. {@code NONE} labels denials.
 */
public enum AccessSource {
    ROLE,
    TEMPORARY,
    ADMIN,
    NONE
}
