package quest.gekko.pulse.util;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.Executor;
import java.util.function.Function;

/**
 * Batched lookup by id: splits the ids into chunks, issues the chunks concurrently on a bounded
 * executor and unions the results.
 */
public class ChunkedLookup {
    private final Executor executor;
    private final int chunkSize;

    public ChunkedLookup(Executor executor, int chunkSize) {
        this.executor = executor;
        this.chunkSize = Math.max(1, chunkSize);
    }

    public <K, V> List<V> fetch(Collection<K> keys, Function<List<K>, ? extends Collection<V>> loader) {
        if (keys == null || keys.isEmpty()) return List.of();
        List<K> distinct = new ArrayList<>(new LinkedHashSet<>(keys));
        distinct.removeIf(Objects::isNull);
        List<List<K>> chunks = partition(distinct, chunkSize);
        if (chunks.isEmpty()) return List.of();
        if (chunks.size() == 1) return new ArrayList<>(loader.apply(chunks.get(0)));

        List<CompletableFuture<? extends Collection<V>>> futures = chunks.stream()
                .<CompletableFuture<? extends Collection<V>>>map(chunk -> CompletableFuture.supplyAsync(() -> loader.apply(chunk), executor))
                .toList();
        try {
            CompletableFuture.allOf(futures.toArray(new CompletableFuture[0])).join();
        } catch (CompletionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw e;
        }
        List<V> out = new ArrayList<>();
        for (CompletableFuture<? extends Collection<V>> f : futures) {
            out.addAll(f.join());
        }
        return out;
    }

    public static <T> List<List<T>> partition(List<T> items, int size) {
        List<List<T>> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i += size) {
            out.add(List.copyOf(items.subList(i, Math.min(items.size(), i + size))));
        }
        return out;
    }
}
