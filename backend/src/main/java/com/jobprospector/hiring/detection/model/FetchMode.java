package com.jobprospector.hiring.detection.model;

public enum FetchMode {
    PLAIN_HTTP,
    BROWSER,
    NONE
}
