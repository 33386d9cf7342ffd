package com.codeheadsystems.weft.middleware;

import com.codeheadsystems.weft.middleware.csrf.CsrfMiddleware;
import com.codeheadsystems.weft.middleware.session.SessionMiddleware;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Maps configured middleware identifiers to factories.
 * <p>
 * The built-in identifiers are {@code session} and {@code csrf}. Applications add their own
 * middleware with {@link #register(String, MiddlewareFactory)} before building.
 */
public class MiddlewareRegistry {

  private static final Logger log = LoggerFactory.getLogger(MiddlewareRegistry.class);

  private final Map<String, MiddlewareFactory> factories = new ConcurrentHashMap<>();

  /**
   * Creates a registry holding the built-in middleware.
   *
   * @return the registry
   */
  public static MiddlewareRegistry withDefaults() {
    return new MiddlewareRegistry()
        .register(SessionMiddleware.NAME, SessionMiddleware::new)
        .register(CsrfMiddleware.NAME, CsrfMiddleware::new);
  }

  /**
   * Registers a factory, replacing any previous one for the identifier.
   *
   * @param identifier the identifier used in configuration
   * @param factory    the factory
   * @return this
   */
  public MiddlewareRegistry register(String identifier, MiddlewareFactory factory) {
    factories.put(identifier, factory);
    return this;
  }

  /**
   * Builds the middleware for an identifier.
   *
   * @param identifier the identifier
   * @param services   the services passed to the factory
   * @return the middleware
   * @throws IllegalArgumentException if the identifier cannot be resolved
   */
  public Middleware resolve(String identifier, MiddlewareServices services) {
    MiddlewareFactory factory = factories.get(identifier);
    if (factory == null) {
      throw new IllegalArgumentException("Unknown middleware: " + identifier);
    }
    log.debug("Resolving middleware {}", identifier);
    return factory.create(services);
  }
}
