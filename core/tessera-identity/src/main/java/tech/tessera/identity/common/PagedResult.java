package tech.tessera.identity.common;

import java.util.List;
import java.util.function.Function;

/**
 * A page of items plus the total match count when it was requested.
 */
public record PagedResult<T>(List<T> items, Long count) {

    public PagedResult {
        items = List.copyOf(items);
    }

    public <R> PagedResult<R> map(Function<? super T, ? extends R> mapper) {
        return new PagedResult<>(items.stream().<R>map(mapper).toList(), count);
    }
}
