package com.github.rudygunawan.kura.rx;

import com.github.rudygunawan.kura.builder.CacheDefaults;
import com.github.rudygunawan.kura.schedule.MainThreadScheduler;

import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.core.ObservableEmitter;
import io.reactivex.rxjava3.core.ObservableSource;
import io.reactivex.rxjava3.core.Observer;
import io.reactivex.rxjava3.disposables.CompositeDisposable;
import io.reactivex.rxjava3.disposables.Disposable;
import io.reactivex.rxjava3.disposables.SerialDisposable;
import io.reactivex.rxjava3.functions.Function;
import io.reactivex.rxjava3.schedulers.Schedulers;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.function.Supplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Operators for flaky or expensive async sources. Every observable returned here delivers its
 * signals on the {@link MainThreadScheduler} it was built with, and every timer it arms runs on
 * that scheduler's clock.
 *
 * <pre>{@code
 * Rx rx = new Rx(scheduler);
 * rx.retryWithBackoff(api.fetchFeed(), RetryConfig.defaultConfig())
 *     .subscribe(this::render, this::showError);
 * }</pre>
 */
public class Rx {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.Rx");

    private final MainThreadScheduler scheduler;

    public Rx(MainThreadScheduler scheduler) {
        this.scheduler = Objects.requireNonNull(scheduler, "scheduler cannot be null");
    }

    public MainThreadScheduler scheduler() {
        return scheduler;
    }

    // ==================== Retry ====================

    /**
     * Resubscribes to {@code source} after each error, waiting
     * {@link RetryConfig#delayFor(int) delayFor(n)} before retry {@code n}. Once the retries are
     * spent, or the config's predicate rejects an error, that error is delivered unchanged.
     */
    public <T> Observable<T> retryWithBackoff(Observable<T> source, RetryConfig config) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(config, "config cannot be null");
        return Observable.<T>create(emitter -> {
            SerialDisposable current = new SerialDisposable();
            emitter.setDisposable(current);
            new RetryObserver<>(source, config, emitter, current).subscribeNext();
        }).observeOn(scheduler);
    }

    public <T> Observable<T> retryWithBackoff(Observable<T> source, int maxRetries) {
        return retryWithBackoff(source, RetryConfig.defaultConfig().withMaxRetries(maxRetries));
    }

    private final class RetryObserver<T> implements Observer<T> {
        private final Observable<T> source;
        private final RetryConfig config;
        private final ObservableEmitter<T> emitter;
        private final SerialDisposable current;
        private int attempt;

        RetryObserver(Observable<T> source, RetryConfig config, ObservableEmitter<T> emitter,
                      SerialDisposable current) {
            this.source = source;
            this.config = config;
            this.emitter = emitter;
            this.current = current;
        }

        void subscribeNext() {
            if (!emitter.isDisposed()) {
                source.subscribe(this);
            }
        }

        @Override
        public void onSubscribe(Disposable d) {
            current.replace(d);
        }

        @Override
        public void onNext(T value) {
            emitter.onNext(value);
        }

        @Override
        public void onError(Throwable e) {
            if (emitter.isDisposed()) {
                return;
            }
            attempt++;
            if (!config.shouldRetry(e, attempt)) {
                if (attempt > 1 && LOGGER.isLoggable(Level.WARNING)) {
                    LOGGER.warning("Giving up after " + (attempt - 1) + " retries: " + e);
                }
                emitter.onError(e);
                return;
            }
            Duration delay = config.delayFor(attempt);
            if (LOGGER.isLoggable(Level.FINE)) {
                LOGGER.fine("Retry " + attempt + "/" + config.maxRetries() + " in " + delay.toMillis()
                        + "ms after " + e);
            }
            current.replace(scheduler.scheduleAfter(this::subscribeNext, delay));
        }

        @Override
        public void onComplete() {
            emitter.onComplete();
        }
    }

    // ==================== Timeout ====================

    /**
     * Mirrors {@code source} unless it has not terminated within {@code timeout}; then the source
     * is dropped and {@code fallback} is mirrored instead. Anything the source emits after the
     * switch is discarded. An error from the fallback is delivered as is.
     */
    public <T> Observable<T> timeoutWithFallback(Observable<T> source, Duration timeout,
                                                 Observable<T> fallback) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(timeout, "timeout cannot be null");
        Objects.requireNonNull(fallback, "fallback cannot be null");
        return Observable.<T>create(emitter -> {
            ObservableEmitter<T> out = emitter.serialize();
            // Guards the timedOut and completed transitions
            Object gate = new Object();
            AtomicBoolean timedOut = new AtomicBoolean();
            AtomicBoolean completed = new AtomicBoolean();
            CompositeDisposable resources = new CompositeDisposable();
            SerialDisposable sourceSubscription = new SerialDisposable();
            resources.add(sourceSubscription);
            emitter.setDisposable(resources);

            Disposable timer = scheduler.scheduleAfter(() -> {
                synchronized (gate) {
                    if (completed.get() || timedOut.get()) {
                        return;
                    }
                    timedOut.set(true);
                }
                LOGGER.warning("Operation timed out after " + timeout.toMillis() + "ms, using fallback");
                sourceSubscription.dispose();
                resources.add(fallback.subscribe(out::onNext, out::tryOnError, out::onComplete));
            }, timeout);
            resources.add(timer);

            sourceSubscription.replace(source.subscribe(
                    value -> {
                        synchronized (gate) {
                            if (!timedOut.get()) {
                                out.onNext(value);
                            }
                        }
                    },
                    error -> {
                        synchronized (gate) {
                            if (timedOut.get() || completed.get()) {
                                return;
                            }
                            completed.set(true);
                        }
                        timer.dispose();
                        out.tryOnError(error);
                    },
                    () -> {
                        synchronized (gate) {
                            if (timedOut.get() || completed.get()) {
                                return;
                            }
                            completed.set(true);
                        }
                        timer.dispose();
                        out.onComplete();
                    }));
        }).observeOn(scheduler);
    }

    // ==================== TTL cache ====================

    /**
     * Memoizes the latest value from {@code source} for {@code ttl}. A subscription inside the
     * window gets the memo and completes without touching the source; after it, the source is
     * subscribed again.
     */
    public <T> Observable<T> cacheWithTTL(Observable<T> source, Duration ttl) {
        return cacheWithTTL(source, ttl, new TtlSlot<>());
    }

    /**
     * Like {@link #cacheWithTTL(Observable, Duration)}, memoizing into {@code slot} so several
     * observables can share one memo.
     */
    public <T> Observable<T> cacheWithTTL(Observable<T> source, Duration ttl, TtlSlot<T> slot) {
        Objects.requireNonNull(source, "source cannot be null");
        Objects.requireNonNull(slot, "slot cannot be null");
        long ttlNanos = Objects.requireNonNull(ttl, "ttl cannot be null").toNanos();
        return Observable.defer(() -> {
            Optional<T> cached = slot.get(scheduler.nanoTime());
            if (cached.isPresent()) {
                LOGGER.finest("TTL cache hit");
                return Observable.just(cached.get());
            }
            LOGGER.finest("TTL cache miss, subscribing to source");
            return source.doOnNext(value -> slot.set(value, scheduler.nanoTime() + ttlNanos));
        }).observeOn(scheduler);
    }

    // ==================== Debounce ====================

    /**
     * Runs {@code searchFn} for a query only after {@code queries} has been quiet for
     * {@code debounce} and the query differs from the last one searched. A new search cancels
     * delivery of the previous one.
     */
    public <R> Observable<R> debouncedSearch(Observable<String> queries,
                                             Function<? super String, ? extends ObservableSource<? extends R>> searchFn,
                                             Duration debounce) {
        Objects.requireNonNull(queries, "queries cannot be null");
        Objects.requireNonNull(searchFn, "searchFn cannot be null");
        return queries
                .debounce(debounce.toNanos(), TimeUnit.NANOSECONDS, scheduler)
                .distinctUntilChanged()
                .<R>switchMap(searchFn)
                .observeOn(scheduler);
    }

    public <R> Observable<R> debouncedSearch(Observable<String> queries,
                                             Function<? super String, ? extends ObservableSource<? extends R>> searchFn) {
        return debouncedSearch(queries, searchFn, CacheDefaults.SEARCH_DEBOUNCE);
    }

    // ==================== Polling ====================

    /**
     * Subscribes to {@code factory.get()} now, and again {@code interval} after each iteration
     * ends. A failed iteration is logged and the loop carries on; it stops only when the returned
     * observable is disposed.
     */
    public <T> Observable<T> pollObservable(Duration interval, Supplier<? extends Observable<T>> factory) {
        Objects.requireNonNull(interval, "interval cannot be null");
        Objects.requireNonNull(factory, "factory cannot be null");
        return Observable.<T>create(emitter -> {
            SerialDisposable current = new SerialDisposable();
            emitter.setDisposable(current);
            new PollObserver<>(interval, factory, emitter, current).poll();
        }).observeOn(scheduler);
    }

    private final class PollObserver<T> implements Observer<T> {
        private final Duration interval;
        private final Supplier<? extends Observable<T>> factory;
        private final ObservableEmitter<T> emitter;
        private final SerialDisposable current;

        PollObserver(Duration interval, Supplier<? extends Observable<T>> factory,
                     ObservableEmitter<T> emitter, SerialDisposable current) {
            this.interval = interval;
            this.factory = factory;
            this.emitter = emitter;
            this.current = current;
        }

        void poll() {
            if (emitter.isDisposed()) {
                return;
            }
            Observable<T> iteration;
            try {
                iteration = factory.get();
            } catch (RuntimeException e) {
                LOGGER.log(Level.WARNING, "Poll factory threw exception", e);
                scheduleNext();
                return;
            }
            iteration.subscribe(this);
        }

        private void scheduleNext() {
            if (!emitter.isDisposed()) {
                current.replace(scheduler.scheduleAfter(this::poll, interval));
            }
        }

        @Override
        public void onSubscribe(Disposable d) {
            current.replace(d);
        }

        @Override
        public void onNext(T value) {
            emitter.onNext(value);
        }

        @Override
        public void onError(Throwable e) {
            LOGGER.log(Level.WARNING, "Poll iteration failed", e);
            scheduleNext();
        }

        @Override
        public void onComplete() {
            scheduleNext();
        }
    }

    // ==================== Sharing ====================

    /**
     * Shares one subscription to {@code source} among all current subscribers. The first
     * subscriber connects, the last one to leave disconnects, and a late joiner gets the latest
     * value replayed.
     */
    public <T> Observable<T> shareReplay(Observable<T> source) {
        return source.observeOn(scheduler).replay(1).refCount();
    }

    // ==================== Threading ====================

    public <T> Observable<T> observeOnMainThread(Observable<T> source) {
        return source.observeOn(scheduler);
    }

    /**
     * Runs {@code work} on {@code executor} and delivers its result on the scheduler.
     */
    public <T> Observable<T> fromCallable(Callable<? extends T> work, Executor executor) {
        Objects.requireNonNull(work, "work cannot be null");
        Objects.requireNonNull(executor, "executor cannot be null");
        return Observable.<T>fromCallable(work)
                .subscribeOn(Schedulers.from(executor))
                .observeOn(scheduler);
    }
}
