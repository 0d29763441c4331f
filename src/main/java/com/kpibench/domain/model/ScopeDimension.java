package com.kpibench.domain.model;

public enum ScopeDimension {
    REGION,
    CATEGORY
}
