package com.delta.catalogcrawler.crawl.model;

public record SaveResult(
    int added,
    int updated,
    int unchanged,
    int failed
) {
    public static SaveResult empty() {
        return new SaveResult(0, 0, 0, 0);
    }

    public SaveResult plus(SaveResult other) {
        if (other == null) {
            return this;
        }
        return new SaveResult(
            added + other.added,
            updated + other.updated,
            unchanged + other.unchanged,
            failed + other.failed
        );
    }

    public int total() {
        return added + updated + unchanged + failed;
    }
}
