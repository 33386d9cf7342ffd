package com.codeheadsystems.weft;

import com.codeheadsystems.weft.config.WeftConfig;
import com.codeheadsystems.weft.crypto.DecryptionException;
import com.codeheadsystems.weft.crypto.TokenCipher;
import com.codeheadsystems.weft.http.Request;
import com.codeheadsystems.weft.http.Response;
import com.codeheadsystems.weft.middleware.Middleware;
import com.codeheadsystems.weft.middleware.MiddlewarePipeline;
import com.codeheadsystems.weft.middleware.MiddlewareRegistry;
import com.codeheadsystems.weft.middleware.MiddlewareServices;
import com.codeheadsystems.weft.routing.Route;
import com.codeheadsystems.weft.routing.Router;
import com.codeheadsystems.weft.routing.View;
import com.codeheadsystems.weft.session.InMemorySessionStore;
import com.codeheadsystems.weft.session.SessionStore;
import com.codeheadsystems.weft.startup.StartupCheck;
import com.codeheadsystems.weft.startup.StartupCheckException;
import com.codeheadsystems.weft.startup.StartupErrorsException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * The gateway-facing application: resolves routes, runs the middleware pipeline and dispatches
 * to views.
 * <p>
 * Construction resolves every configured middleware and runs their startup checks. Any failure
 * is raised as one {@link StartupErrorsException} and the application never serves a request.
 * After that, {@link #handle(Request)} may be called concurrently from any number of gateway
 * threads.
 * <p>
 * Request outcomes are always responses, never exceptions: unknown paths get 404, disallowed
 * methods 405, oversized bodies 413, and views that throw 500.
 */
public class WeftApplication {

  private static final Logger log = LoggerFactory.getLogger(WeftApplication.class);

  private final WeftConfig config;
  private final SessionStore sessionStore;
  private final TokenCipher tokenCipher;
  private final Router router = new Router();
  private final MiddlewarePipeline pipeline;

  private WeftApplication(Builder builder) {
    this.config = builder.config;
    this.sessionStore = builder.sessionStore != null ? builder.sessionStore : new InMemorySessionStore(builder.clock);
    this.tokenCipher = builder.tokenCipher != null ? builder.tokenCipher : buildTokenCipher(config);

    MiddlewareServices services = new MiddlewareServices(config, sessionStore, tokenCipher, builder.clock);
    List<StartupCheckException> errors = new ArrayList<>();
    List<Middleware> middleware = new ArrayList<>();
    for (String identifier : config.middleware()) {
      try {
        middleware.add(builder.registry.resolve(identifier, services));
      } catch (IllegalArgumentException e) {
        errors.add(new StartupCheckException(e.getMessage(), e));
      }
    }
    errors.addAll(runStartupChecks(middleware));
    if (!errors.isEmpty()) {
      throw new StartupErrorsException(errors);
    }
    this.pipeline = new MiddlewarePipeline(middleware);
    log.info("Started with middleware {}", middleware.stream().map(Middleware::name).toList());
  }

  /**
   * Builder.
   *
   * @param config the config
   * @return the builder
   */
  public static Builder builder(WeftConfig config) {
    return new Builder(config);
  }

  /**
   * Application with in-memory sessions, the built-in middleware and the system clock.
   *
   * @param config the config
   * @return the application
   * @throws StartupErrorsException if the configuration is invalid
   */
  public static WeftApplication create(WeftConfig config) {
    return builder(config).build();
  }

  private static TokenCipher buildTokenCipher(WeftConfig config) {
    String secret = config.secretKey();
    if (secret.isEmpty()) {
      log.warn("No secret key configured: generating one randomly. "
          + "Tokens will be invalidated on restart. Do not use in production.");
      return TokenCipher.random();
    }
    if (secret.length() == TokenCipher.KEY_LENGTH * 2 && secret.chars().allMatch(c -> Character.digit(c, 16) >= 0)) {
      return TokenCipher.fromHex(secret);
    }
    return TokenCipher.fromSecret(secret);
  }

  private static List<StartupCheckException> runStartupChecks(List<Middleware> middleware) {
    List<StartupCheckException> errors = new ArrayList<>();
    Set<Class<?>> seen = new HashSet<>();
    for (Middleware m : middleware) {
      for (StartupCheck check : m.checks()) {
        if (seen.add(check.getClass())) {
          check.check(middleware).ifPresent(errors::add);
        }
      }
    }
    return errors;
  }

  /**
   * Binds a path to a view.
   *
   * @param path    the path
   * @param view    the view
   * @param methods allowed methods; GET when none are given
   * @return this
   */
  public WeftApplication addRoute(String path, View view, String... methods) {
    router.add(path, view, methods);
    return this;
  }

  /**
   * Handles one request. Safe to call concurrently.
   * <p>
   * A body larger than {@code maxRequestBodyBytes} is answered with 413 before any middleware
   * runs, so no middleware ever sees a truncated body. That response carries no session cookie
   * and leaves the session store untouched.
   *
   * @param request the request
   * @return the response
   */
  public Response handle(Request request) {
    if (request.bodyLength() > config.maxRequestBodyBytes()) {
      return Response.text(413, "Request body too large");
    }
    request.setRoute(router.resolve(request.path()).orElse(null));
    return pipeline.execute(request, this::dispatch);
  }

  private Response dispatch(Request request) {
    Optional<Route> route = request.route();
    if (route.isEmpty()) {
      return Response.text(404, "Not Found");
    }
    if (!route.get().allows(request.method())) {
      Response response = Response.text(405, "Method Not Allowed");
      response.headers().set("Allow", String.join(", ", new TreeSet<>(route.get().methods())));
      return response;
    }
    try {
      return route.get().view().handle(request);
    } catch (Exception e) {
      log.error("View for {} failed", request, e);
      return Response.text(500, "Internal Server Error");
    }
  }

  /**
   * The middleware still taking part in requests, in configured order.
   *
   * @return the live chain
   */
  public List<Middleware> middleware() {
    return pipeline.live();
  }

  /**
   * The first live middleware of the given type.
   *
   * @param <T>  the type
   * @param type the type
   * @return the middleware, or empty
   */
  public <T extends Middleware> Optional<T> middleware(Class<T> type) {
    return pipeline.live().stream().filter(type::isInstance).map(type::cast).findFirst();
  }

  /**
   * Number of middleware the application was configured with.
   *
   * @return the count
   */
  public int configuredMiddlewareCount() {
    return pipeline.configuredSize();
  }

  /**
   * Encrypts with the application's key.
   *
   * @param plaintext the plaintext
   * @return the token
   */
  public String encrypt(String plaintext) {
    return tokenCipher.encrypt(plaintext);
  }

  /**
   * Decrypts with the application's key.
   *
   * @param token the token
   * @return the plaintext
   * @throws DecryptionException if the token is invalid
   */
  public String decrypt(String token) {
    return tokenCipher.decryptToString(token);
  }

  public WeftConfig config() {
    return config;
  }

  public SessionStore sessionStore() {
    return sessionStore;
  }

  /**
   * Builder for {@link WeftApplication}.
   */
  public static class Builder {

    private final WeftConfig config;
    private SessionStore sessionStore;
    private TokenCipher tokenCipher;
    private MiddlewareRegistry registry = MiddlewareRegistry.withDefaults();
    private Clock clock = Clock.systemUTC();

    private Builder(WeftConfig config) {
      this.config = config;
    }

    public Builder sessionStore(SessionStore sessionStore) {
      this.sessionStore = sessionStore;
      return this;
    }

    public Builder tokenCipher(TokenCipher tokenCipher) {
      this.tokenCipher = tokenCipher;
      return this;
    }

    public Builder registry(MiddlewareRegistry registry) {
      this.registry = registry;
      return this;
    }

    public Builder clock(Clock clock) {
      this.clock = clock;
      return this;
    }

    /**
     * Build weft application.
     *
     * @return the weft application
     * @throws StartupErrorsException if the configuration is invalid
     */
    public WeftApplication build() {
      return new WeftApplication(this);
    }
  }
}
