package com.mk.fx.qa.rivet.execution.engine;

import com.mk.fx.qa.rivet.rest.Request;
import com.mk.fx.qa.rivet.rest.RestResponseData;
import com.mk.fx.qa.rivet.rest.Transport;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ThreadLocalRandom;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * In-memory transport. URLs containing {@code /fail} answer 500, everything else 200 with a body
 * echoing the URL. Each call sleeps a random few milliseconds so completions arrive out of order.
 */
class StubTransport implements Transport {

  final List<Request> requests = new CopyOnWriteArrayList<>();
  final AtomicInteger inFlight = new AtomicInteger();
  final AtomicInteger maxInFlight = new AtomicInteger();
  private final int maxJitterMillis;

  StubTransport(int maxJitterMillis) {
    this.maxJitterMillis = maxJitterMillis;
  }

  StubTransport() {
    this(5);
  }

  @Override
  public RestResponseData send(Request request, Duration timeout) throws InterruptedException {
    maxInFlight.accumulateAndGet(inFlight.incrementAndGet(), Math::max);
    try {
      requests.add(request);
      if (maxJitterMillis > 0) {
        Thread.sleep(ThreadLocalRandom.current().nextInt(maxJitterMillis + 1));
      }
      var response = new RestResponseData();
      response.setStatusCode(request.getUrl().contains("/fail") ? 500 : 200);
      response.setHeaders(Map.of("Content-Type", "application/json"));
      response.setBody("{\"url\":\"" + request.getUrl() + "\"}");
      return response;
    } finally {
      inFlight.decrementAndGet();
    }
  }

  List<String> urls() {
    return requests.stream().map(Request::getUrl).toList();
  }
}
