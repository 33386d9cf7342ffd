package com.codeheadsystems.weft;

import static com.codeheadsystems.weft.testing.Exchanges.get;
import static com.codeheadsystems.weft.testing.Exchanges.post;
import static com.codeheadsystems.weft.testing.Exchanges.sessionKey;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.codeheadsystems.weft.config.WeftConfig;
import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import com.codeheadsystems.weft.middleware.MiddlewareRegistry;
import com.codeheadsystems.weft.middleware.csrf.CheckForSessionMiddleware;
import com.codeheadsystems.weft.middleware.csrf.CsrfMiddleware;
import com.codeheadsystems.weft.middleware.csrf.VerifyCorrectMiddlewarePlacement;
import com.codeheadsystems.weft.middleware.session.SessionMiddleware;
import com.codeheadsystems.weft.session.InMemorySessionStore;
import com.codeheadsystems.weft.startup.StartupErrorsException;
import com.codeheadsystems.weft.testing.ExplodingRequestMiddleware;
import com.codeheadsystems.weft.testing.ExplodingResponseMiddleware;
import com.codeheadsystems.weft.testing.TestViews;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import org.junit.jupiter.api.Test;

class WeftApplicationTest {

  @Test
  void csrfWithoutSessionMiddleware_failsAtStartup() {
    WeftConfig config = WeftConfig.builder().middleware("csrf").build();

    assertThatThrownBy(() -> WeftApplication.create(config))
        .isInstanceOfSatisfying(StartupErrorsException.class, e -> {
          assertThat(e.errors()).hasSize(1);
          assertThat(e.errors().get(0).getMessage())
              .isEqualTo(CheckForSessionMiddleware.SESSION_MIDDLEWARE_NOT_FOUND);
        });
  }

  @Test
  void csrfAboveSessionMiddleware_failsAtStartup() {
    WeftConfig config = WeftConfig.builder().middleware("csrf", "session").build();

    assertThatThrownBy(() -> WeftApplication.create(config))
        .isInstanceOfSatisfying(StartupErrorsException.class, e ->
            assertThat(e.errors().get(0).getMessage())
                .isEqualTo(VerifyCorrectMiddlewarePlacement.SESSION_MIDDLEWARE_BELOW_CSRF));
  }

  @Test
  void unknownMiddlewareAndBadOrdering_areReportedTogether() {
    WeftConfig config = WeftConfig.builder().middleware("no-such-middleware", "csrf").build();

    assertThatThrownBy(() -> WeftApplication.create(config))
        .isInstanceOfSatisfying(StartupErrorsException.class, e -> {
          assertThat(e.errors()).hasSize(2);
          assertThat(e.errors().get(0)).hasMessageContaining("no-such-middleware");
          assertThat(e.errors().get(1).getMessage())
              .isEqualTo(CheckForSessionMiddleware.SESSION_MIDDLEWARE_NOT_FOUND);
        });
  }

  @Test
  void sessionAboveCsrf_starts() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().middleware("session", "csrf").build());

    assertThat(app.middleware()).hasSize(2);
    assertThat(app.middleware().get(0)).isInstanceOf(SessionMiddleware.class);
    assertThat(app.middleware().get(1)).isInstanceOf(CsrfMiddleware.class);
  }

  @Test
  void explodingMiddleware_isRemovedAfterFirstUse() {
    MiddlewareRegistry registry = MiddlewareRegistry.withDefaults()
        .register("explodes-on-request", services -> new ExplodingRequestMiddleware())
        .register("explodes-on-response", services -> new ExplodingResponseMiddleware());
    WeftApplication app = WeftApplication.builder(WeftConfig.builder()
            .middleware("explodes-on-request", "explodes-on-response")
            .build())
        .registry(registry)
        .build();
    app.addRoute("/", request -> Response.text("0"));

    assertThat(app.handle(get("/")).bodyAsString()).isEqualTo("0");
    assertThat(app.middleware()).isEmpty();
    assertThat(app.configuredMiddlewareCount()).isEqualTo(2);

    assertThat(app.handle(get("/")).bodyAsString()).isEqualTo("0");
  }

  @Test
  void evictedSessionMiddleware_csrfFailsClosed() {
    MiddlewareRegistry registry = MiddlewareRegistry.withDefaults()
        .register("session", services -> new SessionMiddleware(services) {
          @Override
          public Optional<Response> onRequest(Request request) {
            throw new IllegalStateException("session store unavailable");
          }
        });
    WeftApplication app = WeftApplication.builder(WeftConfig.builder().middleware("session", "csrf").build())
        .registry(registry)
        .build();
    app.addRoute("/plain", TestViews::formAsJson, "POST");
    app.addRoute("/exempt", TestViews.exemptFormAsJson(), "POST");

    Response rejected = app.handle(post("/plain", null, "name=bob")
        .header(CsrfMiddleware.HEADER, "anything")
        .build());

    assertThat(app.middleware()).hasSize(1).first().isInstanceOf(CsrfMiddleware.class);
    assertThat(rejected.status()).isEqualTo(403);
    assertThat(rejected.bodyAsString()).contains("CSRF token is invalid");
    assertThat(app.handle(post("/exempt", null, "name=bob").build()).status()).isEqualTo(200);
  }

  @Test
  void unknownPath_is404() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().build());

    assertThat(app.handle(get("/missing")).status()).isEqualTo(404);
  }

  @Test
  void disallowedMethod_is405WithAllowHeader() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().build());
    app.addRoute("/", request -> Response.text("ok"), "GET", "PUT");

    Response response = app.handle(post("/", null, "a=b").build());

    assertThat(response.status()).isEqualTo(405);
    assertThat(response.headers().first("Allow")).contains("GET, PUT");
  }

  @Test
  void failingView_is500() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().middleware("session").build());
    app.addRoute("/", request -> {
      throw new IllegalStateException("view bug");
    });

    Response response = app.handle(get("/"));

    assertThat(response.status()).isEqualTo(500);
    assertThat(response.headers().first("Set-Cookie")).isPresent();
    assertThat(app.middleware()).hasSize(1);
  }

  @Test
  void oversizedBody_is413() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().maxRequestBodyBytes(4).build());
    app.addRoute("/", request -> Response.text("ok"), "POST");

    assertThat(app.handle(post("/", null, "name=bob").build()).status()).isEqualTo(413);
  }

  @Test
  void oversizedBody_isRejectedBeforeMiddlewareRuns() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder()
        .middleware("session", "csrf")
        .maxRequestBodyBytes(4)
        .build());
    app.addRoute("/", request -> Response.text("ok"), "POST");
    InMemorySessionStore store = (InMemorySessionStore) app.sessionStore();

    Response response = app.handle(post("/", null, "name=bob").build());

    assertThat(response.status()).isEqualTo(413);
    assertThat(response.headers().all("Set-Cookie")).isEmpty();
    assertThat(store.size()).isZero();
    assertThat(app.middleware()).hasSize(2);
  }

  @Test
  void veryLargeSessionMaxAge_keepsSessionMiddleware() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder()
        .middleware("session")
        .sessionMaxAgeSeconds(Long.MAX_VALUE)
        .build());
    app.addRoute("/", TestViews::counter);

    Response first = app.handle(get("/"));
    Response second = app.handle(get("/", sessionKey(first)));

    assertThat(second.bodyAsString()).isEqualTo("1");
    assertThat(app.middleware()).hasSize(1);
  }

  @Test
  void sessionCookieInSecondCookieHeader_isFound() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().middleware("session").build());
    app.addRoute("/", TestViews::counter);
    String key = sessionKey(app.handle(get("/")));

    Response response = app.handle(Request.builder()
        .header("Cookie", "theme=dark")
        .header("Cookie", WeftConfig.DEFAULT_SESSION_COOKIE_NAME + "=" + key)
        .build());

    assertThat(response.bodyAsString()).isEqualTo("1");
  }

  @Test
  void trailingSlash_resolvesToSameRoute() {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().build());
    app.addRoute("/form", request -> Response.text("ok"));

    assertThat(app.handle(get("/form/")).bodyAsString()).isEqualTo("ok");
  }

  @Test
  void configuredHexKey_isSharedAcrossInstances() {
    WeftConfig config = WeftConfig.builder()
        .secretKey("000102030405060708090a0b0c0d0e0f101112131415161718191a1b1c1d1e1f")
        .build();

    String token = WeftApplication.create(config).encrypt("payload");

    assertThat(WeftApplication.create(config).decrypt(token)).isEqualTo("payload");
  }

  @Test
  void concurrentClients_keepIndependentCounters() throws Exception {
    WeftApplication app = WeftApplication.create(WeftConfig.builder().middleware("session", "csrf").build());
    app.addRoute("/", TestViews::counter);
    ExecutorService executor = Executors.newFixedThreadPool(8);
    try {
      List<Callable<List<String>>> clients = new ArrayList<>();
      for (int c = 0; c < 16; c++) {
        clients.add(() -> {
          List<String> bodies = new ArrayList<>();
          Response first = app.handle(get("/"));
          bodies.add(first.bodyAsString());
          String key = sessionKey(first);
          for (int i = 0; i < 9; i++) {
            bodies.add(app.handle(get("/", key)).bodyAsString());
          }
          return bodies;
        });
      }
      for (Future<List<String>> f : executor.invokeAll(clients)) {
        assertThat(f.get()).containsExactly("0", "1", "2", "3", "4", "5", "6", "7", "8", "9");
      }
    } finally {
      executor.shutdownNow();
    }
    assertThat(app.middleware()).hasSize(2);
  }
}
