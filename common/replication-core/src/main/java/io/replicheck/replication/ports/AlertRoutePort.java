package io.replicheck.replication.ports;

import io.replicheck.replication.model.AlertRoute;
import java.util.Optional;

/**
 * Looks up alert routing metadata for an owning service.
 */
public interface AlertRoutePort {

  /**
   * @param service owning service name
   * @return the route, or empty when the service has no team configured
   * @throws RouteResolutionException if the routing configuration exists but is unreadable
   */
  Optional<AlertRoute> resolveRoute(String service);
}
