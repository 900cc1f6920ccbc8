package org.lime.caddie.store;

public enum Provenance {
    CURATED,
    LIVE,
    PLACEHOLDER
}
