package com.delta.catalogcrawler.crawl.stage;

public enum StageKind {
    LIST(1, "listing discovery", "page"),
    DETAIL(2, "detail collection", "record");

    private final int order;
    private final String label;
    private final String unitName;

    StageKind(int order, String label, String unitName) {
        this.order = order;
        this.label = label;
        this.unitName = unitName;
    }

    public int order() {
        return order;
    }

    public String label() {
        return label;
    }

    public String unitName() {
        return unitName;
    }
}
