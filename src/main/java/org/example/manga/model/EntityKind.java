package org.example.manga.model;

public enum EntityKind {
    CHARACTER,
    ENVIRONMENT
}
