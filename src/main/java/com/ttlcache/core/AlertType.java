package com.ttlcache.core;

public enum AlertType {
    WARNING,
    CRITICAL
}
