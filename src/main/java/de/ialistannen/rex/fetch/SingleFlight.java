package de.ialistannen.rex.fetch;

import com.google.common.base.Throwables;
import de.ialistannen.rex.cache.CacheException;
import de.ialistannen.rex.registry.TransportException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;

/**
 * Collapses concurrent loads of the same key: the first caller loads, everybody else waits for its result.
 *
 * @param <K> the key type
 */
class SingleFlight<K> {

  private final ConcurrentHashMap<K, CompletableFuture<Object>> inFlight = new ConcurrentHashMap<>();

  @SuppressWarnings("unchecked")
  <V> V load(K key, Loader<V> loader) throws CacheException, InterruptedException {
    CompletableFuture<Object> ours = new CompletableFuture<>();
    CompletableFuture<Object> running = inFlight.putIfAbsent(key, ours);
    if (running != null) {
      return (V) await(key, running);
    }

    try {
      V value = loader.load();
      ours.complete(value);
      return value;
    } catch (CacheException | InterruptedException | RuntimeException | Error e) {
      ours.completeExceptionally(e);
      throw e;
    } finally {
      inFlight.remove(key, ours);
    }
  }

  private Object await(K key, CompletableFuture<Object> running) throws CacheException, InterruptedException {
    try {
      return running.get();
    } catch (ExecutionException e) {
      Throwable cause = e.getCause();
      Throwables.throwIfInstanceOf(cause, CacheException.class);
      Throwables.throwIfUnchecked(cause);
      throw new TransportException("Concurrent load of '" + key + "' failed", cause);
    }
  }

  @FunctionalInterface
  interface Loader<V> {

    V load() throws CacheException, InterruptedException;
  }
}
