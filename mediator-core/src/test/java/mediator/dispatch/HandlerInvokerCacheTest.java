package mediator.dispatch;

import mediator.CancellationToken;
import mediator.Request;
import mediator.RequestHandler;
import mediator.spi.ServiceKey;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

class HandlerInvokerCacheTest {

    private final HandlerInvokerCache cache = new HandlerInvokerCache();

    @Test
    void returnsSameInvokerForKey() {
        ServiceKey key = ServiceKey.forHandler(Ping.class, String.class);

        HandlerInvoker first = cache.invokerFor(key);
        HandlerInvoker second = cache.invokerFor(ServiceKey.forHandler(Ping.class, String.class));

        assertSame(first, second);
        assertEquals(key, first.handlerKey());
        assertEquals(1, cache.size());
    }

    @Test
    void concurrentFirstLookupsAgreeOnOneInvoker() throws Exception {
        ServiceKey key = ServiceKey.forHandler(Ping.class, String.class);
        ExecutorService pool = Executors.newFixedThreadPool(8);
        CountDownLatch start = new CountDownLatch(1);
        try {
            List<Future<HandlerInvoker>> lookups = new ArrayList<>();
            for (int i = 0; i < 32; i++) {
                lookups.add(pool.submit(() -> {
                    start.await();
                    return cache.invokerFor(key);
                }));
            }
            start.countDown();
            HandlerInvoker expected = lookups.get(0).get();
            for (Future<HandlerInvoker> lookup : lookups) {
                assertSame(expected, lookup.get());
            }
        } finally {
            pool.shutdownNow();
        }
        assertEquals(1, cache.size());
    }

    @Test
    void rejectsNonHandlerKeys() {
        assertThrows(IllegalArgumentException.class, () -> cache.invokerFor(ServiceKey.of(String.class)));
        assertThrows(IllegalArgumentException.class,
                () -> cache.invokerFor(ServiceKey.forHandler(String.class, String.class)));
    }

    @Test
    void declaredResponseTypeIsCached() {
        assertEquals(String.class, cache.declaredResponseType(Ping.class));
        assertEquals(String.class, cache.declaredResponseType(Ping.class));
        assertNull(cache.declaredResponseType(Box.class));
        assertNull(cache.declaredResponseType(Box.class));
    }

    @Test
    void invokerRejectsWrongHandlerType() {
        HandlerInvoker invoker = cache.invokerFor(ServiceKey.forHandler(Ping.class, String.class));

        assertThrows(IllegalStateException.class,
                () -> invoker.invoke("not a handler", new Ping(), CancellationToken.NONE));
    }

    @Test
    void invokerCallsHandler() throws Exception {
        HandlerInvoker invoker = cache.invokerFor(ServiceKey.forHandler(Ping.class, String.class));

        Object value = invoker.invoke(new PingHandler(), new Ping(), CancellationToken.NONE)
                .toCompletableFuture().get();

        assertEquals("pong", value);
    }

    record Ping() implements Request<String> {
    }

    record Box<T>(T value) implements Request<T> {
    }

    static class PingHandler implements RequestHandler<Ping, String> {
        @Override
        public CompletionStage<String> handle(Ping request, CancellationToken cancellationToken) {
            return CompletableFuture.completedFuture("pong");
        }
    }
}
