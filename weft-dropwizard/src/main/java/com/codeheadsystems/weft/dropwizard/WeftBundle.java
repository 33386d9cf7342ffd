package com.codeheadsystems.weft.dropwizard;

import com.codeheadsystems.weft.WeftApplication;
import com.codeheadsystems.weft.dropwizard.health.MiddlewareChainHealthCheck;
import com.codeheadsystems.weft.session.InMemorySessionStore;
import com.codeheadsystems.weft.session.SessionStore;
import io.dropwizard.core.ConfiguredBundle;
import io.dropwizard.core.setup.Bootstrap;
import io.dropwizard.core.setup.Environment;
import jakarta.inject.Inject;
import jakarta.inject.Singleton;
import java.util.function.Consumer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dropwizard bundle that serves a weft application from an existing Dropwizard application.
 * <p>
 * Mounts the application servlet at {@link WeftConfiguration#getMountPath()} and registers the
 * middleware chain health check. Requires a {@link WeftConfiguration} in the application's YAML
 * config.
 * <p>
 * Embed in your application with in-memory sessions (dev/test only):
 * <pre>{@code
 *   bootstrap.addBundle(new WeftBundle<>(app -> app.addRoute("/", new IndexView())));
 * }</pre>
 * <p>
 * Or supply a persistent session store:
 * <pre>{@code
 *   bootstrap.addBundle(new WeftBundle<>(mySessionStore, app -> app.addRoute("/", new IndexView())));
 * }</pre>
 * Invalid middleware configuration fails startup with a
 * {@link com.codeheadsystems.weft.startup.StartupErrorsException}.
 */
@Singleton
public class WeftBundle<C extends WeftConfiguration> implements ConfiguredBundle<C> {

  private static final Logger log = LoggerFactory.getLogger(WeftBundle.class);

  private final SessionStore sessionStore;
  private final Consumer<WeftApplication> routes;
  private WeftApplication application;

  /**
   * Creates a bundle backed by an in-memory session store.
   * <p>
   * For dev/test only. All sessions are lost on restart.
   *
   * @param routes registers the views
   */
  public WeftBundle(Consumer<WeftApplication> routes) {
    this(new InMemorySessionStore(), routes);
    log.warn("""
        #################################################################
        # WARNING: Using an in-memory session store.                    #
        # All sessions will be lost on restart.                         #
        # Do not use in production.                                     #
        #################################################################
        """);
  }

  /**
   * Creates a bundle backed by the supplied session store.
   *
   * @param sessionStore the session store
   * @param routes       registers the views
   */
  @Inject
  public WeftBundle(SessionStore sessionStore, Consumer<WeftApplication> routes) {
    this.sessionStore = sessionStore;
    this.routes = routes;
  }

  @Override
  public void initialize(Bootstrap<?> bootstrap) {
    // No additional bootstrapping needed
  }

  @Override
  public void run(C configuration, Environment environment) {
    application = WeftApplication.builder(configuration.toWeftConfig())
        .sessionStore(sessionStore)
        .build();
    routes.accept(application);

    environment.servlets()
        .addServlet("weft", new WeftServlet(application))
        .addMapping(configuration.getMountPath());
    environment.healthChecks().register("weft-middleware", new MiddlewareChainHealthCheck(application));
    log.info("Weft application mounted at {}", configuration.getMountPath());
  }

  /**
   * The application built by {@link #run}, or null before the bundle has run.
   *
   * @return the application
   */
  public WeftApplication application() {
    return application;
  }
}
