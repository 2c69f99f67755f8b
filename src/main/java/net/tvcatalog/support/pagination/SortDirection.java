package net.tvcatalog.support.pagination;

/**
 * Direction of a single sort key.
 */
public enum SortDirection {
    ASC,
    DESC;

    public SortDirection flip() {
        return this == ASC ? DESC : ASC;
    }

    public String sql() {
        return name();
    }
}
