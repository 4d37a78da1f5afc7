package com.sessionretry.model.enums;

public enum LogFormat {
    TEXT,
    JSON
}
