package com.newsdigest.backend.signature.entity;

public enum DedupVerdict {
    DUPLICATE,
    UNIQUE
}
