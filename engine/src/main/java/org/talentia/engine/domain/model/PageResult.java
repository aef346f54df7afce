package org.talentia.engine.domain.model;

import java.util.Collections;
import java.util.List;

public final class PageResult<T> {

    private final List<T> items;
    private final long total;
    private final int page;
    private final int perPage;

    public PageResult(List<T> items, long total, int page, int perPage) {
        this.items = Collections.unmodifiableList(items);
        this.total = total;
        this.page = page;
        this.perPage = perPage;
    }

    public List<T> getItems() {
        return items;
    }

    public long getTotal() {
        return total;
    }

    public int getPage() {
        return page;
    }

    public int getPerPage() {
        return perPage;
    }
}
