package io.replicheck.replication.ports;

public class RouteResolutionException extends RuntimeException {

  public RouteResolutionException(String message, Throwable cause) {
    super(message, cause);
  }
}
