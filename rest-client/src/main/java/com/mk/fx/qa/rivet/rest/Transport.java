package com.mk.fx.qa.rivet.rest;

import java.time.Duration;

/**
 * Sends one request and waits for its response. Implementations must be safe for concurrent use by
 * many worker threads.
 */
@FunctionalInterface
public interface Transport {

  /**
   * Sends the request.
   *
   * @param request resolved request
   * @param timeout upper bound for the whole exchange
   * @return the response, whatever its status code
   * @throws TransportException when no response could be obtained
   * @throws InterruptedException when the calling worker is interrupted while waiting
   */
  RestResponseData send(Request request, Duration timeout)
      throws TransportException, InterruptedException;
}
