package com.docsum.core.model;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

@Getter
@RequiredArgsConstructor
public enum ProcessingMode {
    EMPTY("empty"),
    SINGLE_PASS("single-pass"),
    MAP_REDUCE("map-reduce");
    
    private final String label;
}
