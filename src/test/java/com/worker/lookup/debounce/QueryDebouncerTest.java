package com.worker.lookup.debounce;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("QueryDebouncer Tests")
class QueryDebouncerTest {

    private static final Duration DELAY = Duration.ofMillis(50);

    private QueryDebouncer debouncer;
    private final List<String> executed = new CopyOnWriteArrayList<>();

    @BeforeEach
    void setUp() {
        debouncer = new QueryDebouncer(DELAY);
    }

    @AfterEach
    void tearDown() {
        debouncer.shutdown();
    }

    private CompletableFuture<String> upperCase(String arg) {
        executed.add(arg);
        return CompletableFuture.completedFuture(arg.toUpperCase());
    }

    @Nested
    @DisplayName("Coalescing")
    class CoalescingTests {

        @Test
        @DisplayName("Ten rapid calls should execute once with the last argument")
        void tenRapidCalls() throws Exception {
            Duration burstDelay = Duration.ofMillis(200);
            Function<String, CompletableFuture<String>> search =
                    debouncer.debounce("search", QueryDebouncerTest.this::upperCase, burstDelay);

            List<CompletableFuture<String>> futures = new ArrayList<>();
            for (int i = 0; i < 10; i++) {
                futures.add(search.apply("query" + i));
            }

            assertEquals("QUERY9", futures.get(9).get(2, TimeUnit.SECONDS));
            for (int i = 0; i < 9; i++) {
                assertTrue(futures.get(i).isCancelled(), "call " + i + " should be cancelled");
            }

            Thread.sleep(burstDelay.toMillis());
            assertEquals(List.of("query9"), executed);
        }

        @Test
        @DisplayName("Different keys should not cancel each other")
        void independentKeys() throws Exception {
            CompletableFuture<String> a = debouncer.<String, String>debounce("a", QueryDebouncerTest.this::upperCase)
                    .apply("alpha");
            CompletableFuture<String> b = debouncer.<String, String>debounce("b", QueryDebouncerTest.this::upperCase)
                    .apply("beta");

            assertEquals("ALPHA", a.get(2, TimeUnit.SECONDS));
            assertEquals("BETA", b.get(2, TimeUnit.SECONDS));
            assertEquals(2, executed.size());
        }

        @Test
        @DisplayName("Calls spaced beyond the delay should each execute")
        void spacedCalls() throws Exception {
            Function<String, CompletableFuture<String>> search = debouncer.debounce("search", QueryDebouncerTest.this::upperCase);

            assertEquals("JOH", search.apply("joh").get(2, TimeUnit.SECONDS));
            assertEquals("JOHN", search.apply("john").get(2, TimeUnit.SECONDS));
            assertEquals(List.of("joh", "john"), executed);
        }

        @Test
        @DisplayName("A per-call delay should override the default")
        void customDelay() throws Exception {
            Function<String, CompletableFuture<String>> search =
                    debouncer.debounce("fast", QueryDebouncerTest.this::upperCase, Duration.ZERO);
            assertEquals("NOW", search.apply("now").get(2, TimeUnit.SECONDS));
        }
    }

    @Nested
    @DisplayName("Cancellation")
    class CancellationTests {

        @Test
        @DisplayName("clear() should cancel a pending call before it runs")
        void clearPending() throws Exception {
            CompletableFuture<String> future = debouncer.<String, String>debounce(
                    "search", QueryDebouncerTest.this::upperCase, Duration.ofSeconds(5)).apply("john");

            assertTrue(debouncer.isPending("search"));
            assertTrue(debouncer.clear("search"));

            assertTrue(future.isCancelled());
            assertFalse(debouncer.isPending("search"));
            assertFalse(debouncer.clear("search"));
            assertTrue(executed.isEmpty());
        }

        @Test
        @DisplayName("clearAll() should cancel every key")
        void clearAll() {
            Duration longDelay = Duration.ofSeconds(5);
            CompletableFuture<String> a = debouncer.<String, String>debounce("a", QueryDebouncerTest.this::upperCase, longDelay)
                    .apply("alpha");
            CompletableFuture<String> b = debouncer.<String, String>debounce("b", QueryDebouncerTest.this::upperCase, longDelay)
                    .apply("beta");
            assertEquals(2, debouncer.pendingCount());

            debouncer.clearAll();

            assertTrue(a.isCancelled());
            assertTrue(b.isCancelled());
            assertEquals(0, debouncer.pendingCount());
        }

        @Test
        @DisplayName("A newer call should cancel the in-flight work of an older one")
        void cancelsInFlight() throws Exception {
            CountDownLatch started = new CountDownLatch(1);
            AtomicReference<CompletableFuture<String>> firstWork = new AtomicReference<>();
            AtomicInteger calls = new AtomicInteger();

            Function<String, CompletableFuture<String>> search = debouncer.debounce("search", arg -> {
                if (calls.incrementAndGet() == 1) {
                    CompletableFuture<String> slow = new CompletableFuture<>();
                    firstWork.set(slow);
                    started.countDown();
                    return slow;
                }
                return CompletableFuture.completedFuture(arg);
            });

            CompletableFuture<String> first = search.apply("joh");
            assertTrue(started.await(2, TimeUnit.SECONDS));

            CompletableFuture<String> second = search.apply("john");

            assertTrue(first.isCancelled());
            assertEquals("john", second.get(2, TimeUnit.SECONDS));
            assertTrue(firstWork.get().isCancelled());
        }

        @Test
        @DisplayName("Cancelling the caller's future should drop the pending call")
        void callerCancels() {
            CompletableFuture<String> future = debouncer.<String, String>debounce(
                    "search", QueryDebouncerTest.this::upperCase, Duration.ofSeconds(5)).apply("john");

            future.cancel(true);

            assertFalse(debouncer.isPending("search"));
            assertThrows(CancellationException.class, future::join);
        }
    }

    @Nested
    @DisplayName("Errors and validation")
    class ErrorTests {

        @Test
        @DisplayName("A failing call should fail the caller's future with the original cause")
        void failure() {
            CompletableFuture<String> future = debouncer.<String, String>debounce("search",
                    arg -> CompletableFuture.failedFuture(new IllegalStateException("store down"))).apply("john");

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
            assertInstanceOf(IllegalStateException.class, e.getCause());
            assertEquals("store down", e.getCause().getMessage());
        }

        @Test
        @DisplayName("A call that throws should fail the caller's future")
        void throwingCall() {
            CompletableFuture<String> future = debouncer.<String, String>debounce("search", arg -> {
                throw new IllegalArgumentException("bad");
            }).apply("john");

            ExecutionException e = assertThrows(ExecutionException.class, () -> future.get(2, TimeUnit.SECONDS));
            assertInstanceOf(IllegalArgumentException.class, e.getCause());
        }

        @Test
        @DisplayName("Should reject missing key, function or negative delay")
        void validation() {
            assertThrows(IllegalArgumentException.class,
                    () -> debouncer.debounce(null, QueryDebouncerTest.this::upperCase));
            assertThrows(IllegalArgumentException.class,
                    () -> debouncer.debounce("k", QueryDebouncerTest.this::upperCase, Duration.ofMillis(-1)));
            assertThrows(IllegalArgumentException.class, () -> new QueryDebouncer(Duration.ofMillis(-1)));
        }

        @Test
        @DisplayName("Default delay should be 300ms")
        void defaultDelay() {
            try (QueryDebouncer defaults = new QueryDebouncer()) {
                assertEquals(Duration.ofMillis(300), defaults.getDefaultDelay());
            }
        }
    }
}
