package com.example.musictracker.domain.enumtype;

public enum ReplaceMode {
    CREATE_ONLY,
    UPDATE_ONLY,
    UPDATE_OR_CREATE
}
