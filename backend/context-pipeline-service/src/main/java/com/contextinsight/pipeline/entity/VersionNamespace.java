package com.contextinsight.pipeline.entity;

public enum VersionNamespace {
    DOCUMENT,
    RECORD
}
