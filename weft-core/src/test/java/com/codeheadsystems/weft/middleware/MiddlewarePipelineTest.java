package com.codeheadsystems.weft.middleware;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

@ExtendWith(MockitoExtension.class)
class MiddlewarePipelineTest {

  @Mock private Middleware first;
  @Mock private Middleware second;

  private final Response viewResponse = Response.text("view");
  private final AtomicInteger dispatches = new AtomicInteger();

  private Request request;

  @BeforeEach
  void setUp() {
    request = Request.builder().path("/").build();
  }

  private Response dispatch(Request r) {
    dispatches.incrementAndGet();
    return viewResponse;
  }

  @Test
  void execute_runsRequestHooksInOrderAndResponseHooksInReverse() {
    when(first.onRequest(request)).thenReturn(Optional.empty());
    when(second.onRequest(request)).thenReturn(Optional.empty());
    MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(first, second));

    Response response = pipeline.execute(request, this::dispatch);

    assertThat(response).isSameAs(viewResponse);
    InOrder order = inOrder(first, second);
    order.verify(first).onRequest(request);
    order.verify(second).onRequest(request);
    order.verify(second).onResponse(request, viewResponse);
    order.verify(first).onResponse(request, viewResponse);
  }

  @Test
  void execute_shortCircuit_skipsLaterHooksAndDispatch_butRunsResponsePhase() {
    Response blocked = Response.text(403, "no");
    when(first.onRequest(request)).thenReturn(Optional.of(blocked));
    MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(first, second));

    Response response = pipeline.execute(request, this::dispatch);

    assertThat(response).isSameAs(blocked);
    assertThat(dispatches).hasValue(0);
    verify(second, never()).onRequest(any());
    verify(second).onResponse(request, blocked);
    verify(first).onResponse(request, blocked);
  }

  @Test
  void execute_requestHookThrows_evictsMiddlewareAndContinues() {
    when(first.onRequest(any())).thenThrow(new IllegalStateException("boom"));
    when(second.onRequest(any())).thenReturn(Optional.empty());
    when(first.name()).thenReturn("first");
    MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(first, second));

    Response response = pipeline.execute(request, this::dispatch);

    assertThat(response).isSameAs(viewResponse);
    assertThat(pipeline.live()).containsExactly(second);
    verify(first, never()).onResponse(any(), any());

    pipeline.execute(request, this::dispatch);
    verify(first, times(1)).onRequest(any());
    verify(second, times(2)).onRequest(any());
  }

  @Test
  void execute_responseHookThrows_evictsMiddleware() {
    when(first.onRequest(any())).thenReturn(Optional.empty());
    when(second.onRequest(any())).thenReturn(Optional.empty());
    doThrow(new IllegalStateException("boom")).when(second).onResponse(any(), any());
    when(second.name()).thenReturn("second");
    MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(first, second));

    Response response = pipeline.execute(request, this::dispatch);

    assertThat(response).isSameAs(viewResponse);
    assertThat(pipeline.live()).containsExactly(first);
    verify(first).onResponse(request, viewResponse);
  }

  @Test
  void execute_unusedMiddleware_isRemovedQuietly() {
    when(first.onRequest(any())).thenThrow(new UnusedMiddlewareException("not needed"));
    when(first.name()).thenReturn("first");
    MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(first));

    pipeline.execute(request, this::dispatch);

    assertThat(pipeline.live()).isEmpty();
    assertThat(pipeline.configuredSize()).isEqualTo(1);
  }

  @Test
  void execute_concurrentFailures_chainShrinksOnceAndNeverGrows() throws Exception {
    AtomicInteger calls = new AtomicInteger();
    Middleware flaky = new Middleware() {
      @Override
      public Optional<Response> onRequest(Request r) {
        calls.incrementAndGet();
        throw new IllegalStateException("always fails");
      }
    };
    Middleware steady = new Middleware() {
    };
    MiddlewarePipeline pipeline = new MiddlewarePipeline(List.of(flaky, steady));
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<Response>> tasks = new ArrayList<>();
      for (int i = 0; i < 200; i++) {
        tasks.add(() -> pipeline.execute(Request.builder().build(), this::dispatch));
      }
      for (Future<Response> f : executor.invokeAll(tasks)) {
        assertThat(f.get()).isSameAs(viewResponse);
      }
    } finally {
      executor.shutdownNow();
    }

    assertThat(pipeline.live()).containsExactly(steady);
    assertThat(dispatches).hasValue(200);
    // Requests that had already passed the alive check may still have called it.
    assertThat(calls.get()).isBetween(1, 8);
  }
}
