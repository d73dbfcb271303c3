package alpha.nomagicrouter.util;

import alpha.nomagicrouter.message.Request;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static java.util.concurrent.TimeUnit.SECONDS;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

/**
 * Small tests of {@link Getter}.
 */
final class GetterTest
{
    @Test
    void computedOncePerRequest() throws Exception {
        var count = new AtomicInteger();
        var testee = Getter.create(req -> new Object[]{count.incrementAndGet()});
        var req = request();
        var first = testee.get(req);
        assertThat(testee.get(req)).isSameAs(first);
        assertThat(count).hasValue(1);
    }
    
    @Test
    void requestsAreIsolated() throws Exception {
        var count = new AtomicInteger();
        var testee = Getter.create(req -> count.incrementAndGet());
        assertThat(testee.get(request())).isEqualTo(1);
        assertThat(testee.get(request())).isEqualTo(2);
    }
    
    @Test
    void gettersAreIsolated() throws Exception {
        var a = Getter.create(req -> "a");
        var b = Getter.create(req -> "b");
        var req = request();
        assertThat(a.get(req)).isEqualTo("a");
        assertThat(b.get(req)).isEqualTo("b");
    }
    
    @Test
    void argumentIsNotPartOfKey() throws Exception {
        Getter<String, String> testee = Getter.createWithArg((req, arg) -> arg);
        var req = request();
        assertThat(testee.get(req, "one")).isEqualTo("one");
        assertThat(testee.get(req, "two")).isEqualTo("one");
    }
    
    @Test
    void set_overridesCompute() throws Exception {
        Getter<Void, String> testee = Getter.create(req -> {
            throw new AssertionError("not called");
        });
        var req = request();
        testee.set(req, "given");
        assertThat(testee.get(req)).isEqualTo("given");
    }
    
    @Test
    void set_replacesComputed() throws Exception {
        var testee = Getter.create(req -> "computed");
        var req = request();
        assertThat(testee.get(req)).isEqualTo("computed");
        testee.set(req, "given");
        assertThat(testee.get(req)).isEqualTo("given");
    }
    
    @Test
    void nullIsAValue() throws Exception {
        var count = new AtomicInteger();
        Getter<Void, String> testee = Getter.create(req -> {
            count.incrementAndGet();
            return null;
        });
        var req = request();
        assertThat(testee.get(req)).isNull();
        assertThat(testee.get(req)).isNull();
        assertThat(count).hasValue(1);
    }
    
    @Test
    void exception_notCached() throws Exception {
        var count = new AtomicInteger();
        Getter<Void, String> testee = Getter.create(req -> {
            if (count.incrementAndGet() == 1) {
                throw new IOException("boom");
            }
            return "ok";
        });
        var req = request();
        assertThatThrownBy(() -> testee.get(req))
                .isExactlyInstanceOf(IOException.class)
                .hasMessage("boom");
        assertThat(testee.get(req)).isEqualTo("ok");
        assertThat(count).hasValue(2);
    }
    
    @Test
    void stage_isShared() throws Exception {
        var count = new AtomicInteger();
        var testee = Getter.create(req -> {
            count.incrementAndGet();
            return new CompletableFuture<String>();
        });
        var req = request();
        var stage = testee.get(req);
        assertThat(testee.get(req)).isSameAs(stage);
        stage.complete("done");
        assertThat(testee.get(req).get()).isEqualTo("done");
        assertThat(count).hasValue(1);
    }
    
    @Test
    void recursion_fails() {
        var self = new AtomicReference<Getter<Void, String>>();
        self.set(Getter.create(req -> self.get().get(req)));
        var req = request();
        assertThatThrownBy(() -> self.get().get(req))
                .isExactlyInstanceOf(IllegalStateException.class)
                .hasMessage("Getter called recursively from its own compute function.");
        // Failure was not cached
        assertThat(req.getterValues()).isEmpty();
    }
    
    @Test
    void concurrentCallers_computeOnce() throws Exception {
        var count = new AtomicInteger();
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var testee = Getter.create(req -> {
            count.incrementAndGet();
            entered.countDown();
            assertThat(release.await(3, SECONDS)).isTrue();
            return new Object();
        });
        var req = request();
        var pool = Executors.newFixedThreadPool(2);
        try {
            Future<Object> first = pool.submit(() -> testee.get(req));
            assertThat(entered.await(3, SECONDS)).isTrue();
            var waiter = new AtomicReference<Thread>();
            Future<Object> second = pool.submit(() -> {
                waiter.set(Thread.currentThread());
                return testee.get(req);
            });
            awaitParked(waiter);
            release.countDown();
            assertThat(second.get(3, SECONDS)).isSameAs(first.get(3, SECONDS));
        } finally {
            pool.shutdownNow();
        }
        assertThat(count).hasValue(1);
    }
    
    @Test
    void concurrentCallers_shareFailure() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        Getter<Void, Object> testee = Getter.create(req -> {
            entered.countDown();
            assertThat(release.await(3, SECONDS)).isTrue();
            throw new IOException("shared");
        });
        var req = request();
        var pool = Executors.newFixedThreadPool(2);
        try {
            Future<Object> first = pool.submit(() -> testee.get(req));
            assertThat(entered.await(3, SECONDS)).isTrue();
            var waiter = new AtomicReference<Thread>();
            Future<Object> second = pool.submit(() -> {
                waiter.set(Thread.currentThread());
                return testee.get(req);
            });
            awaitParked(waiter);
            release.countDown();
            assertThatThrownBy(() -> first.get(3, SECONDS))
                    .hasCauseExactlyInstanceOf(IOException.class);
            assertThatThrownBy(() -> second.get(3, SECONDS))
                    .hasRootCauseMessage("shared");
        } finally {
            pool.shutdownNow();
        }
    }
    
    // Returns once the thread blocks on the slot published by the first caller
    private static void awaitParked(AtomicReference<Thread> waiter) throws InterruptedException {
        final long deadline = System.nanoTime() + SECONDS.toNanos(3);
        while (waiter.get() == null || waiter.get().getState() != Thread.State.WAITING) {
            assertThat(System.nanoTime()).isLessThan(deadline);
            Thread.sleep(1);
        }
    }
    
    static Request request() {
        Request req = mock(Request.class);
        when(req.getterValues()).thenReturn(new ConcurrentHashMap<>());
        return req;
    }
}
