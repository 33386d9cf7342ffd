package com.codeheadsystems.weft.dropwizard.health;

import com.codahale.metrics.health.HealthCheck;
import com.codeheadsystems.weft.WeftApplication;
import com.codeheadsystems.weft.middleware.Middleware;
import java.util.List;

/**
 * Health check that reports unhealthy once any configured middleware has been removed from the
 * chain after failing.
 */
public class MiddlewareChainHealthCheck extends HealthCheck {

  private final WeftApplication application;

  /**
   * Instantiates a new Middleware chain health check.
   *
   * @param application the application
   */
  public MiddlewareChainHealthCheck(WeftApplication application) {
    this.application = application;
  }

  @Override
  protected Result check() {
    List<Middleware> live = application.middleware();
    int configured = application.configuredMiddlewareCount();
    if (live.size() < configured) {
      return Result.unhealthy("%d of %d middleware removed, live chain %s",
          configured - live.size(), configured, live.stream().map(Middleware::name).toList());
    }
    return Result.healthy("middleware=%s", live.stream().map(Middleware::name).toList());
  }
}
