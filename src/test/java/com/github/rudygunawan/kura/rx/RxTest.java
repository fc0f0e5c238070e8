package com.github.rudygunawan.kura.rx;

import com.github.rudygunawan.kura.schedule.VirtualMainThread;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.observers.TestObserver;
import io.reactivex.rxjava3.subjects.PublishSubject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class RxTest {

    private VirtualMainThread main;
    private Rx rx;

    @BeforeEach
    void setUp() {
        main = new VirtualMainThread();
        rx = new Rx(main.scheduler());
    }

    // ==================== retryWithBackoff ====================

    @Test
    void testRetryBacksOffThenSucceeds() {
        AtomicInteger attempts = new AtomicInteger();
        List<Long> subscribedAtMillis = new ArrayList<>();
        Observable<String> flaky = Observable.defer(() -> {
            subscribedAtMillis.add(rx.scheduler().now(TimeUnit.MILLISECONDS));
            int n = attempts.incrementAndGet();
            return n <= 3 ? Observable.<String>error(new IOException("attempt " + n)) : Observable.just("ok");
        });
        RetryConfig config = RetryConfig.of(3, Duration.ofMillis(100), Duration.ofMillis(300), 2.0);

        TestObserver<String> observer = rx.retryWithBackoff(flaky, config).test();
        main.advance(1, TimeUnit.SECONDS);

        observer.assertResult("ok");
        // 100, 200, then min(400, 300)
        assertEquals(List.of(0L, 100L, 300L, 600L), subscribedAtMillis);
    }

    @Test
    void testRetryTwoFailuresWithDefaultBackoff() {
        AtomicInteger attempts = new AtomicInteger();
        Observable<String> flaky = Observable.defer(() -> attempts.incrementAndGet() <= 2
                ? Observable.<String>error(new IOException("transient"))
                : Observable.just("ok"));

        TestObserver<String> observer = rx.retryWithBackoff(flaky, 3).test();
        main.advance(999, TimeUnit.MILLISECONDS);
        assertEquals(1, attempts.get());
        main.advance(1, TimeUnit.MILLISECONDS);
        assertEquals(2, attempts.get());
        main.advance(2, TimeUnit.SECONDS);

        observer.assertResult("ok");
        assertEquals(3, attempts.get());
    }

    @Test
    void testRetryExhaustedPropagatesFinalErrorUnchanged() {
        AtomicInteger attempts = new AtomicInteger();
        List<IOException> thrown = new ArrayList<>();
        Observable<String> broken = Observable.defer(() -> {
            IOException error = new IOException("attempt " + attempts.incrementAndGet());
            thrown.add(error);
            return Observable.error(error);
        });

        TestObserver<String> observer = rx.retryWithBackoff(broken,
                RetryConfig.of(2, Duration.ofMillis(10), Duration.ofMillis(10), 1.0)).test();
        main.advance(1, TimeUnit.SECONDS);

        assertEquals(3, attempts.get());
        observer.assertError(thrown.get(2));
        observer.assertNoValues();
    }

    @Test
    void testRetryPredicateRejectsError() {
        AtomicInteger attempts = new AtomicInteger();
        IllegalArgumentException fatal = new IllegalArgumentException("bad request");
        Observable<String> source = Observable.defer(() -> {
            attempts.incrementAndGet();
            return Observable.error(fatal);
        });
        RetryConfig onlyIo = RetryConfig.defaultConfig().retryIf(e -> e instanceof IOException);

        TestObserver<String> observer = rx.retryWithBackoff(source, onlyIo).test();
        main.runPending();

        observer.assertError(fatal);
        assertEquals(1, attempts.get());
    }

    @Test
    void testRetryValuesBeforeFailureAreDelivered() {
        AtomicInteger attempts = new AtomicInteger();
        Observable<Integer> source = Observable.defer(() -> attempts.incrementAndGet() == 1
                ? Observable.just(1).concatWith(Observable.<Integer>error(new IOException("drop")))
                : Observable.just(2));

        TestObserver<Integer> observer = rx.retryWithBackoff(source, 1).test();
        main.advance(5, TimeUnit.SECONDS);

        observer.assertResult(1, 2);
    }

    @Test
    void testDisposeDuringBackoffStopsRetrying() {
        AtomicInteger attempts = new AtomicInteger();
        Observable<String> broken = Observable.defer(() -> {
            attempts.incrementAndGet();
            return Observable.error(new IOException("down"));
        });

        TestObserver<String> observer = rx.retryWithBackoff(broken, 5).test();
        main.advance(500, TimeUnit.MILLISECONDS);
        observer.dispose();
        main.advance(1, TimeUnit.MINUTES);

        assertEquals(1, attempts.get());
    }

    @Test
    void testRetryConfigPresetsAndDelays() {
        RetryConfig defaults = RetryConfig.defaultConfig();
        assertEquals(3, defaults.maxRetries());
        assertEquals(Duration.ofSeconds(1), defaults.delayFor(1));
        assertEquals(Duration.ofSeconds(2), defaults.delayFor(2));
        assertEquals(Duration.ofSeconds(16), defaults.delayFor(5));
        assertEquals(Duration.ofSeconds(30), defaults.delayFor(6));
        assertEquals(Duration.ofSeconds(30), defaults.delayFor(10_000));

        RetryConfig aggressive = RetryConfig.aggressive();
        assertEquals(5, aggressive.maxRetries());
        assertEquals(Duration.ofMillis(500), aggressive.delayFor(1));
        assertEquals(Duration.ofMillis(750), aggressive.delayFor(2));

        RetryConfig conservative = RetryConfig.conservative();
        assertEquals(2, conservative.maxRetries());
        assertEquals(Duration.ofSeconds(6), conservative.delayFor(2));
        assertEquals(Duration.ofSeconds(60), conservative.maxDelay());

        assertThrows(IllegalArgumentException.class, () -> RetryConfig.of(-1, Duration.ZERO, Duration.ZERO, 2.0));
        assertThrows(IllegalArgumentException.class,
                () -> RetryConfig.of(1, Duration.ofSeconds(1), Duration.ofSeconds(1), 0.5));
        assertThrows(IllegalArgumentException.class, () -> defaults.delayFor(0));
    }

    // ==================== timeoutWithFallback ====================

    @Test
    void testTimeoutSwitchesToFallbackAndDropsLateValues() {
        PublishSubject<String> slow = PublishSubject.create();

        TestObserver<String> observer = rx.timeoutWithFallback(slow, Duration.ofSeconds(5),
                Observable.just("cached")).test();
        main.advance(4, TimeUnit.SECONDS);
        observer.assertEmpty();
        main.advance(1, TimeUnit.SECONDS);

        observer.assertResult("cached");
        assertFalse(slow.hasObservers(), "source subscription is dropped on timeout");

        slow.onNext("late");
        slow.onComplete();
        main.runPending();
        observer.assertResult("cached");
    }

    @Test
    void testFastSourceWinsOverTimeout() {
        AtomicInteger fallbackSubscriptions = new AtomicInteger();
        Observable<String> fallback = Observable.defer(() -> {
            fallbackSubscriptions.incrementAndGet();
            return Observable.just("fallback");
        });

        TestObserver<String> observer = rx.timeoutWithFallback(Observable.just("fresh"),
                Duration.ofSeconds(5), fallback).test();
        main.advance(10, TimeUnit.SECONDS);

        observer.assertResult("fresh");
        assertEquals(0, fallbackSubscriptions.get());
    }

    @Test
    void testSourceErrorBeforeTimeoutPropagates() {
        IOException failure = new IOException("refused");

        TestObserver<String> observer = rx.timeoutWithFallback(Observable.<String>error(failure),
                Duration.ofSeconds(5), Observable.just("fallback")).test();
        main.advance(10, TimeUnit.SECONDS);

        observer.assertError(failure);
    }

    @Test
    void testFailingFallbackPropagatesItsError() {
        IOException fallbackFailure = new IOException("no cache either");

        TestObserver<String> observer = rx.timeoutWithFallback(Observable.<String>never(),
                Duration.ofMillis(100), Observable.error(fallbackFailure)).test();
        main.advance(100, TimeUnit.MILLISECONDS);

        observer.assertError(fallbackFailure);
    }

    @Test
    void testValuesBeforeTimeoutAreKept() {
        PublishSubject<String> source = PublishSubject.create();

        TestObserver<String> observer = rx.timeoutWithFallback(source, Duration.ofSeconds(1),
                Observable.just("fallback")).test();
        source.onNext("partial");
        main.advance(1, TimeUnit.SECONDS);

        observer.assertResult("partial", "fallback");
    }

    @Test
    @Timeout(10)
    void testSourceEmittingOnAnotherThreadDoesNotInterleaveWithFallback() throws Exception {
        CountDownLatch emitting = new CountDownLatch(1);
        Observable<String> busy = Observable.create(emitter -> {
            Thread producer = new Thread(() -> {
                for (int i = 0; i < 200_000 && !emitter.isDisposed(); i++) {
                    emitter.onNext("source-" + i);
                    if (i == 100) {
                        emitting.countDown();
                    }
                }
            }, "kura-test-producer");
            producer.setDaemon(true);
            producer.start();
        });

        TestObserver<String> observer = rx.timeoutWithFallback(busy, Duration.ofSeconds(1),
                Observable.just("fallback")).test();
        assertTrue(emitting.await(5, TimeUnit.SECONDS));
        main.advance(1, TimeUnit.SECONDS);
        main.runPending();

        observer.assertComplete();
        observer.assertNoErrors();
        List<String> values = observer.values();
        assertEquals("fallback", values.get(values.size() - 1));
        assertEquals(1, values.stream().filter("fallback"::equals).count());
        for (int i = 0; i < values.size() - 1; i++) {
            assertEquals("source-" + i, values.get(i), "source values arrive in order");
        }
    }

    // ==================== cacheWithTTL ====================

    @Test
    void testCacheWithTtlServesMemoWithinWindow() {
        AtomicInteger calls = new AtomicInteger();
        Observable<Integer> cached = rx.cacheWithTTL(Observable.fromCallable(calls::incrementAndGet),
                Duration.ofMinutes(5));

        TestObserver<Integer> first = cached.test();
        main.runPending();
        main.advance(4, TimeUnit.MINUTES);
        TestObserver<Integer> second = cached.test();
        main.runPending();

        first.assertResult(1);
        second.assertResult(1);
        assertEquals(1, calls.get());

        main.advance(1, TimeUnit.MINUTES);
        TestObserver<Integer> third = cached.test();
        main.runPending();

        third.assertResult(2);
        assertEquals(2, calls.get());
    }

    @Test
    void testCacheWithTtlDoesNotMemoizeErrors() {
        AtomicInteger calls = new AtomicInteger();
        Observable<String> source = Observable.defer(() -> calls.incrementAndGet() == 1
                ? Observable.<String>error(new IOException("first call fails"))
                : Observable.just("second"));
        Observable<String> cached = rx.cacheWithTTL(source, Duration.ofMinutes(1));

        TestObserver<String> failed = cached.test();
        main.runPending();
        TestObserver<String> retried = cached.test();
        main.runPending();

        failed.assertError(IOException.class);
        retried.assertResult("second");
    }

    @Test
    void testSharedTtlSlot() {
        TtlSlot<String> slot = new TtlSlot<>();
        AtomicInteger calls = new AtomicInteger();
        Observable<String> source = Observable.fromCallable(() -> "profile-" + calls.incrementAndGet());

        TestObserver<String> viaHeader = rx.cacheWithTTL(source, Duration.ofMinutes(1), slot).test();
        TestObserver<String> viaSidebar = rx.cacheWithTTL(source, Duration.ofMinutes(1), slot).test();
        main.runPending();

        viaHeader.assertResult("profile-1");
        viaSidebar.assertResult("profile-1");

        slot.invalidate();
        TestObserver<String> refreshed = rx.cacheWithTTL(source, Duration.ofMinutes(1), slot).test();
        main.runPending();
        refreshed.assertResult("profile-2");
    }

    // ==================== debouncedSearch ====================

    @Test
    void testDebouncedSearchWaitsForQuietPeriod() {
        PublishSubject<String> queries = PublishSubject.create();
        List<String> searched = new ArrayList<>();
        Observable<String> results = rx.debouncedSearch(queries, q -> {
            searched.add(q);
            return Observable.just("results:" + q);
        }, Duration.ofMillis(300));

        TestObserver<String> observer = results.test();
        queries.onNext("a");
        main.advance(100, TimeUnit.MILLISECONDS);
        queries.onNext("ab");
        main.advance(100, TimeUnit.MILLISECONDS);
        queries.onNext("abc");
        main.advance(299, TimeUnit.MILLISECONDS);
        assertTrue(searched.isEmpty());
        main.advance(1, TimeUnit.MILLISECONDS);

        assertEquals(List.of("abc"), searched);
        observer.assertValues("results:abc");
    }

    @Test
    void testDebouncedSearchSkipsRepeatedQuery() {
        PublishSubject<String> queries = PublishSubject.create();
        List<String> searched = new ArrayList<>();
        TestObserver<String> observer = rx.<String>debouncedSearch(queries, q -> {
            searched.add(q);
            return Observable.just("results:" + q);
        }).test();

        queries.onNext("drums");
        main.advance(300, TimeUnit.MILLISECONDS);
        queries.onNext("drum");
        queries.onNext("drums");
        main.advance(300, TimeUnit.MILLISECONDS);
        queries.onNext("synth");
        main.advance(300, TimeUnit.MILLISECONDS);

        assertEquals(List.of("drums", "synth"), searched);
        observer.assertValues("results:drums", "results:synth");
    }

    @Test
    void testDebouncedSearchDropsStaleResults() {
        PublishSubject<String> queries = PublishSubject.create();
        PublishSubject<String> slowSearch = PublishSubject.create();
        TestObserver<String> observer = rx.<String>debouncedSearch(queries,
                q -> q.equals("slow") ? slowSearch : Observable.just("results:" + q),
                Duration.ofMillis(300)).test();

        queries.onNext("slow");
        main.advance(300, TimeUnit.MILLISECONDS);
        queries.onNext("fast");
        main.advance(300, TimeUnit.MILLISECONDS);
        slowSearch.onNext("results:slow");
        main.runPending();

        observer.assertValues("results:fast");
    }

    // ==================== pollObservable ====================

    @Test
    void testPollRunsImmediatelyAndKeepsGoingAfterErrors() {
        AtomicInteger calls = new AtomicInteger();
        TestObserver<Integer> observer = rx.pollObservable(Duration.ofSeconds(30), () -> {
            int n = calls.incrementAndGet();
            return n == 2 ? Observable.<Integer>error(new IOException("network down")) : Observable.just(n);
        }).test();

        main.runPending();
        observer.assertValues(1);

        main.advance(30, TimeUnit.SECONDS);
        assertEquals(2, calls.get());
        observer.assertValues(1);

        main.advance(30, TimeUnit.SECONDS);
        observer.assertValues(1, 3);
        observer.assertNoErrors();
        observer.assertNotComplete();
    }

    @Test
    void testPollSurvivesThrowingFactory() {
        AtomicInteger calls = new AtomicInteger();
        TestObserver<Integer> observer = rx.pollObservable(Duration.ofSeconds(1), () -> {
            int n = calls.incrementAndGet();
            if (n == 1) {
                throw new IllegalStateException("not ready");
            }
            return Observable.just(n);
        }).test();

        main.advance(1, TimeUnit.SECONDS);

        observer.assertValues(2);
        observer.assertNoErrors();
    }

    @Test
    void testPollIntervalStartsAfterIterationCompletes() {
        AtomicInteger calls = new AtomicInteger();
        List<Long> startedAtSeconds = new ArrayList<>();
        rx.pollObservable(Duration.ofSeconds(10), () -> {
            calls.incrementAndGet();
            startedAtSeconds.add(rx.scheduler().now(TimeUnit.SECONDS));
            return Observable.timer(5, TimeUnit.SECONDS, rx.scheduler());
        }).test();

        main.advance(31, TimeUnit.SECONDS);

        assertEquals(List.of(0L, 15L, 30L), startedAtSeconds);
    }

    @Test
    void testDisposeStopsPolling() {
        AtomicInteger calls = new AtomicInteger();
        TestObserver<Integer> observer = rx.pollObservable(Duration.ofSeconds(1),
                () -> Observable.just(calls.incrementAndGet())).test();

        main.advance(2, TimeUnit.SECONDS);
        assertEquals(3, calls.get());
        observer.dispose();
        main.advance(1, TimeUnit.MINUTES);

        assertEquals(3, calls.get());
    }

    // ==================== shareReplay ====================

    @Test
    void testShareReplaySubscribesOnce() {
        AtomicInteger subscriptions = new AtomicInteger();
        AtomicBoolean disposed = new AtomicBoolean();
        Observable<String> expensive = Observable.<String>create(emitter -> {
            subscriptions.incrementAndGet();
            emitter.onNext("profile");
        }).doOnDispose(() -> disposed.set(true));
        Observable<String> shared = rx.shareReplay(expensive);

        TestObserver<String> first = shared.test();
        TestObserver<String> second = shared.test();
        main.runPending();

        assertEquals(1, subscriptions.get());
        first.assertValues("profile");
        second.assertValues("profile");

        TestObserver<String> late = shared.test();
        late.assertValues("profile");
        assertEquals(1, subscriptions.get());

        first.dispose();
        second.dispose();
        assertFalse(disposed.get(), "still one subscriber left");
        late.dispose();
        assertTrue(disposed.get());

        TestObserver<String> again = shared.test();
        main.runPending();
        again.assertValues("profile");
        assertEquals(2, subscriptions.get());
    }

    // ==================== threading ====================

    @Test
    void testObserveOnMainThread() {
        AtomicBoolean onMain = new AtomicBoolean();

        TestObserver<Integer> observer = rx.observeOnMainThread(Observable.just(7))
                .doOnNext(v -> onMain.set(main.isMainThread()))
                .test();
        observer.assertEmpty();
        main.runPending();

        observer.assertResult(7);
        assertTrue(onMain.get());
    }

    @Test
    void testFromCallableRunsOffMainAndDeliversOnMain() {
        AtomicBoolean workOnMain = new AtomicBoolean(true);
        AtomicBoolean deliveredOnMain = new AtomicBoolean();
        Executor background = Runnable::run;

        TestObserver<String> observer = rx.fromCallable(() -> {
            workOnMain.set(main.isMainThread());
            return "decoded";
        }, background).doOnNext(v -> deliveredOnMain.set(main.isMainThread())).test();
        main.runPending();

        observer.assertResult("decoded");
        assertFalse(workOnMain.get());
        assertTrue(deliveredOnMain.get());
    }
}
