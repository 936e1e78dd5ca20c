package org.caureq.selfrepair.repo;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/** Pageable addressed by row offset, so {@code limit/offset} query parameters skip exactly {@code offset} rows. */
public final class OffsetPageRequest implements Pageable {
    private final long offset;
    private final int size;
    private final Sort sort;

    private OffsetPageRequest(long offset, int size, Sort sort) {
        if (offset < 0) throw new IllegalArgumentException("offset must not be negative");
        if (size < 1) throw new IllegalArgumentException("size must be at least 1");
        this.offset = offset;
        this.size = size;
        this.sort = sort;
    }

    public static OffsetPageRequest of(long offset, int size, Sort sort) {
        return new OffsetPageRequest(Math.max(0, offset), size, sort);
    }

    @Override public int getPageNumber() { return (int) (offset / size); }
    @Override public int getPageSize() { return size; }
    @Override public long getOffset() { return offset; }
    @Override public Sort getSort() { return sort; }

    @Override
    public Pageable next() {
        return new OffsetPageRequest(offset + size, size, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetPageRequest(Math.max(0, offset - size), size, sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetPageRequest(0, size, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetPageRequest((long) pageNumber * size, size, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof OffsetPageRequest other)) return false;
        return offset == other.offset && size == other.size && sort.equals(other.sort);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * Long.hashCode(offset) + size) + sort.hashCode();
    }

    @Override
    public String toString() {
        return "OffsetPageRequest[offset=%d, size=%d, sort=%s]".formatted(offset, size, sort);
    }
}
