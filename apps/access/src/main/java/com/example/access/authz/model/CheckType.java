package com.example.access.authz.model;

public enum CheckType {
    SINGLE,
    ANY,
    ALL
}
