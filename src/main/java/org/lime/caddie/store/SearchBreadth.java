package org.lime.caddie.store;

public enum SearchBreadth {
    LOCAL,
    BROAD
}
