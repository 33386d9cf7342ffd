package com.codeheadsystems.weft.middleware;

import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.function.Function;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Runs the ordered middleware chain around a dispatcher.
 * <p>
 * The chain is a fixed list of entries, each with an {@code alive} flag. A hook that throws
 * flips its entry's flag (under a lock) and the entry is skipped by every later hook
 * invocation, in this and all subsequent requests. Entries are never revived, so
 * {@link #live()} only ever shrinks.
 * <p>
 * Request hooks run in configured order. A hook that returns a response short-circuits the
 * rest of the request phase and the dispatcher. Response hooks then run in reverse order over
 * every entry that is still alive.
 */
public class MiddlewarePipeline {

  private static final Logger log = LoggerFactory.getLogger(MiddlewarePipeline.class);

  private final List<Entry> entries;
  private final Object evictionLock = new Object();

  /**
   * Instantiates a new Middleware pipeline.
   *
   * @param middleware the middleware in configured order
   */
  public MiddlewarePipeline(List<Middleware> middleware) {
    List<Entry> list = new ArrayList<>(middleware.size());
    for (Middleware m : middleware) {
      list.add(new Entry(m));
    }
    this.entries = List.copyOf(list);
  }

  /**
   * Handles one exchange.
   *
   * @param request    the request
   * @param dispatcher produces the response when no middleware short-circuits
   * @return the response to hand back to the gateway
   */
  public Response execute(Request request, Function<Request, Response> dispatcher) {
    PipelineState state = PipelineState.PENDING;
    log.trace("{} {}", request, state);

    state = PipelineState.REQUEST_PHASE;
    Response response = null;
    for (Entry entry : entries) {
      if (!entry.alive) {
        continue;
      }
      try {
        Optional<Response> shortCircuit = entry.middleware.onRequest(request);
        if (shortCircuit.isPresent()) {
          log.debug("{} answered {} during {}", entry.middleware.name(), request, state);
          response = shortCircuit.get();
          break;
        }
      } catch (RuntimeException e) {
        evict(entry, state, e);
      }
    }

    if (response == null) {
      state = PipelineState.DISPATCH;
      response = dispatcher.apply(request);
    }

    state = PipelineState.RESPONSE_PHASE;
    for (int i = entries.size() - 1; i >= 0; i--) {
      Entry entry = entries.get(i);
      if (!entry.alive) {
        continue;
      }
      try {
        entry.middleware.onResponse(request, response);
      } catch (RuntimeException e) {
        evict(entry, state, e);
      }
    }

    state = PipelineState.DONE;
    log.trace("{} {} status={}", request, state, response.status());
    return response;
  }

  /**
   * The middleware still taking part in requests, in configured order.
   *
   * @return the live middleware
   */
  public List<Middleware> live() {
    List<Middleware> live = new ArrayList<>(entries.size());
    for (Entry entry : entries) {
      if (entry.alive) {
        live.add(entry.middleware);
      }
    }
    return live;
  }

  /**
   * Number of middleware the application was configured with.
   *
   * @return the configured count
   */
  public int configuredSize() {
    return entries.size();
  }

  private void evict(Entry entry, PipelineState state, RuntimeException cause) {
    boolean removed;
    synchronized (evictionLock) {
      removed = entry.alive;
      entry.alive = false;
    }
    if (!removed) {
      // Another request already removed it.
      return;
    }
    if (cause instanceof UnusedMiddlewareException) {
      log.info("Removing {} from the middleware chain: {}", entry.middleware.name(), cause.getMessage());
    } else {
      log.error("{} failed during {}; removing it from the middleware chain",
          entry.middleware.name(), state, cause);
    }
  }

  private static final class Entry {

    private final Middleware middleware;
    private volatile boolean alive = true;

    private Entry(Middleware middleware) {
      this.middleware = middleware;
    }
  }
}
