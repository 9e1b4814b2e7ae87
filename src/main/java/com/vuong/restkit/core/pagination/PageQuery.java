package com.vuong.restkit.core.pagination;

import com.vuong.restkit.exception.ValidationException;
import org.springframework.util.MultiValueMap;

import java.util.List;
import java.util.Objects;

/**
 * The page a list request asks for: a 1-based page number and a page size, both positive.
 */
public final class PageQuery {

    public static final int FIRST_PAGE = 1;

    private final int page;
    private final int pageSize;

    private PageQuery(int page, int pageSize) {
        this.page = page;
        this.pageSize = pageSize;
    }

    public static PageQuery of(int page, int pageSize) {
        if (page < FIRST_PAGE) {
            throw new IllegalArgumentException("Page must be at least 1, got " + page);
        }
        if (pageSize < 1) {
            throw new IllegalArgumentException("Page size must be positive, got " + pageSize);
        }
        if (page > lastAddressablePage(pageSize)) {
            throw new IllegalArgumentException("Page " + page + " is out of range for page size " + pageSize);
        }
        return new PageQuery(page, pageSize);
    }

    /**
     * Reads the page selection from query parameters, falling back to the first page and the
     * given default size.
     * @param queryParams the request's query parameters
     * @param pageParameter name of the page parameter
     * @param pageSizeParameter name of the page size parameter
     * @param defaultPageSize size used when the parameter is absent
     * @return the page selection
     * @throws ValidationException if either parameter is not a positive integer, or the page
     *         starts past the largest offset a query can skip to
     */
    public static PageQuery from(MultiValueMap<String, ?> queryParams, String pageParameter,
                                 String pageSizeParameter, int defaultPageSize) {
        int page = readPositive(queryParams, pageParameter, FIRST_PAGE);
        int pageSize = readPositive(queryParams, pageSizeParameter, defaultPageSize);
        int lastPage = lastAddressablePage(pageSize);
        if (page > lastPage) {
            throw ValidationException.forField(pageParameter, "Must be less than or equal to " + lastPage + ".");
        }
        return new PageQuery(page, pageSize);
    }

    // offsets are int-sized in JPA queries
    private static int lastAddressablePage(int pageSize) {
        return (int) Math.min(Integer.MAX_VALUE, Integer.MAX_VALUE / pageSize + 1L);
    }

    private static int readPositive(MultiValueMap<String, ?> queryParams, String name, int fallback) {
        List<?> values = queryParams.get(name);
        if (values == null || values.isEmpty() || values.get(0) == null) {
            return fallback;
        }
        Object raw = values.get(0);
        int value;
        try {
            value = raw instanceof Number number ? number.intValue() : Integer.parseInt(raw.toString().trim());
        } catch (NumberFormatException e) {
            throw ValidationException.forField(name, "Not a valid integer.");
        }
        if (value < 1) {
            throw ValidationException.forField(name, "Must be greater than or equal to 1.");
        }
        return value;
    }

    public int getPage() {
        return page;
    }

    public int getPageSize() {
        return pageSize;
    }

    /**
     * @return number of items that come before this page
     */
    public long getOffset() {
        return (long) (page - 1) * pageSize;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof PageQuery that)) return false;
        return page == that.page && pageSize == that.pageSize;
    }

    @Override
    public int hashCode() {
        return Objects.hash(page, pageSize);
    }

    @Override
    public String toString() {
        return "PageQuery{page=" + page + ", pageSize=" + pageSize + "}";
    }
}
