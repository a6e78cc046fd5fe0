package tech.tessera.identity.common;

/**
 * Skip/limit window and single-field sort for list, query and search reads.
 *
 * @param skip      documents to skip, or null for none
 * @param limit     maximum documents to return, or null for all
 * @param withCount whether the total match count should be computed
 * @param sortField field to sort by, or null for store order
 * @param direction sort direction, ignored without a sort field
 */
public record Paging(Integer skip, Integer limit, boolean withCount, String sortField, SortDirection direction) {

    public enum SortDirection {
        ASC, DESC
    }

    public Paging {
        if (skip != null && skip < 0) {
            throw new IllegalArgumentException("skip must not be negative");
        }
        if (limit != null && limit < 0) {
            throw new IllegalArgumentException("limit must not be negative");
        }
        if (direction == null) {
            direction = SortDirection.ASC;
        }
    }

    public static Paging all() {
        return new Paging(null, null, true, null, SortDirection.ASC);
    }

    public static Paging of(int skip, int limit) {
        return new Paging(skip, limit, true, null, SortDirection.ASC);
    }

    public Paging sortedBy(String field, SortDirection direction) {
        return new Paging(skip, limit, withCount, field, direction);
    }

    public Paging withoutCount() {
        return new Paging(skip, limit, false, sortField, direction);
    }
}
