package com.example.estoque.common;

import org.springframework.data.domain.Pageable;
import org.springframework.data.domain.Sort;

/**
 * {@link Pageable} por deslocamento absoluto (skip/limit), já que o
 * {@code PageRequest} do Spring Data só aceita múltiplos do tamanho da página.
 */
public final class OffsetBasedPageRequest implements Pageable {

    private final long offset;
    private final int limit;
    private final Sort sort;

    private OffsetBasedPageRequest(long offset, int limit, Sort sort) {
        this.offset = offset;
        this.limit = limit;
        this.sort = sort;
    }

    /**
     * Valida os parâmetros da requisição: {@code skip >= 0} e
     * {@code 1 <= limit <= limiteMaximo}.
     */
    public static OffsetBasedPageRequest of(int skip, int limit, int limiteMaximo, Sort sort) {
        if (skip < 0) {
            throw new ValidationException("skip deve ser maior ou igual a zero");
        }
        if (limit < 1 || limit > limiteMaximo) {
            throw new ValidationException("limit deve estar entre 1 e " + limiteMaximo);
        }
        return new OffsetBasedPageRequest(skip, limit, sort);
    }

    @Override
    public int getPageNumber() {
        return (int) (offset / limit);
    }

    @Override
    public int getPageSize() {
        return limit;
    }

    @Override
    public long getOffset() {
        return offset;
    }

    @Override
    public Sort getSort() {
        return sort;
    }

    @Override
    public Pageable next() {
        return new OffsetBasedPageRequest(offset + limit, limit, sort);
    }

    @Override
    public Pageable previousOrFirst() {
        return hasPrevious() ? new OffsetBasedPageRequest(Math.max(0, offset - limit), limit, sort) : first();
    }

    @Override
    public Pageable first() {
        return new OffsetBasedPageRequest(0, limit, sort);
    }

    @Override
    public Pageable withPage(int pageNumber) {
        return new OffsetBasedPageRequest((long) pageNumber * limit, limit, sort);
    }

    @Override
    public boolean hasPrevious() {
        return offset > 0;
    }
}
