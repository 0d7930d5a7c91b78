package tether.core.model.session;

import java.util.List;

/**
 * One page of query results.
 *
 * @param items   sessions on this page
 * @param page    1-based page number
 * @param perPage page size
 * @param total   number of sessions matched across all pages
 */
public record SessionPage(List<SessionRecord> items, int page, int perPage, int total) {

    public SessionPage {
        items = List.copyOf(items);
    }

    public int lastPage() {
        return perPage <= 0 ? 1 : Math.max(1, (total + perPage - 1) / perPage);
    }

    public boolean hasMore() {
        return page < lastPage();
    }
}
