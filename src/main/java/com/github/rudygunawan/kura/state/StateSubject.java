package com.github.rudygunawan.kura.state;

import io.reactivex.rxjava3.core.Completable;
import io.reactivex.rxjava3.core.Observable;
import io.reactivex.rxjava3.disposables.Disposable;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Holds exactly one current value and notifies subscribers each time it is replaced.
 *
 * <p>Values are treated as immutable snapshots: {@link #next} swaps the reference, so a reader
 * never sees a half-applied update. Use immutable state classes, or copy before mutating.
 *
 * <p>Notification happens after the value lock is released, in subscription order, so a callback
 * may call {@link #next} again without deadlocking. Only "last value wins" holds across threads:
 * two concurrent {@code next} calls may reach a given subscriber in either order.
 *
 * <pre>{@code
 * StateSubject<FeedState> feed = new StateSubject<>(FeedState.initial());
 * Disposable posts = feed.select(FeedState::posts, this::renderPosts);
 * feed.update(state -> state.withLoading(true));
 * }</pre>
 *
 * @param <T> the state type
 */
public class StateSubject<T> {
    private static final Logger LOGGER = Logger.getLogger("com.github.rudygunawan.kura.State");

    private final ReentrantReadWriteLock valueLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock subscribersLock = new ReentrantReadWriteLock();
    private final List<Subscriber<T>> subscribers = new ArrayList<>();
    private final AtomicLong nextSubscriberId = new AtomicLong();
    private T value;

    public StateSubject(T initialValue) {
        this.value = Objects.requireNonNull(initialValue, "initial value cannot be null");
    }

    /**
     * Returns the current snapshot.
     */
    public T getValue() {
        valueLock.readLock().lock();
        try {
            return value;
        } finally {
            valueLock.readLock().unlock();
        }
    }

    /**
     * Replaces the value and notifies every subscriber registered at this moment, in
     * subscription order.
     */
    public void next(T newValue) {
        Objects.requireNonNull(newValue, "value cannot be null");
        valueLock.writeLock().lock();
        try {
            value = newValue;
        } finally {
            valueLock.writeLock().unlock();
        }
        notifySubscribers(newValue);
    }

    /**
     * Applies {@code transform} to the current value and publishes the result.
     *
     * <p>Read-modify-write without retry: if two threads update at once, the last {@code next}
     * wins and the other transform's result is lost.
     */
    public void update(UnaryOperator<T> transform) {
        Objects.requireNonNull(transform, "transform cannot be null");
        next(transform.apply(getValue()));
    }

    /**
     * Registers {@code callback} and synchronously delivers the current value to it before
     * returning.
     *
     * @return a handle whose {@code dispose()} removes the subscription
     */
    public Disposable subscribe(Consumer<? super T> callback) {
        Objects.requireNonNull(callback, "callback cannot be null");
        Subscriber<T> subscriber = new Subscriber<>(nextSubscriberId.incrementAndGet(), callback);
        subscribersLock.writeLock().lock();
        try {
            subscribers.add(subscriber);
        } finally {
            subscribersLock.writeLock().unlock();
        }

        deliver(subscriber, getValue());
        return Disposable.fromAction(() -> unsubscribe(subscriber));
    }

    /**
     * Registers {@code callback} for the slice of state picked by {@code selector}. The callback
     * receives the current slice immediately, then only when a new value's slice is not
     * {@link Objects#equals} to the last one delivered.
     *
     * @return a handle whose {@code dispose()} removes the subscription
     */
    public <R> Disposable select(Function<? super T, ? extends R> selector, Consumer<? super R> callback) {
        Objects.requireNonNull(selector, "selector cannot be null");
        Objects.requireNonNull(callback, "callback cannot be null");
        AtomicReference<Object> previous = new AtomicReference<>(Unset.INSTANCE);
        return subscribe(state -> {
            R slice = selector.apply(state);
            Object last = previous.getAndSet(slice);
            if (last == Unset.INSTANCE || !Objects.equals(last, slice)) {
                callback.accept(slice);
            }
        });
    }

    /**
     * Applies {@code transform} right away, then runs {@code operation}. If the operation fails
     * the value from before the transform is restored and {@code onError} is told why.
     *
     * <p>The rollback restores the old snapshot as a whole, discarding any update made by others
     * while the operation was in flight.
     *
     * @return a handle that stops waiting for the operation; it does not undo the transform
     */
    public Disposable optimisticUpdate(UnaryOperator<T> transform, Completable operation,
                                       Consumer<? super Throwable> onError) {
        Objects.requireNonNull(operation, "operation cannot be null");
        Objects.requireNonNull(onError, "onError cannot be null");
        T previous = getValue();
        update(transform);
        return operation.subscribe(
                () -> { },
                error -> {
                    LOGGER.log(Level.FINE, "Optimistic update failed, rolling back", error);
                    next(previous);
                    onError.accept(error);
                });
    }

    /**
     * Returns an {@link Observable} that emits the current value on subscribe and every later
     * value, on the thread that calls {@link #next}.
     */
    public Observable<T> asObservable() {
        return Observable.create(emitter -> {
            Disposable subscription = subscribe(emitter::onNext);
            emitter.setDisposable(subscription);
        });
    }

    public int subscriberCount() {
        subscribersLock.readLock().lock();
        try {
            return subscribers.size();
        } finally {
            subscribersLock.readLock().unlock();
        }
    }

    public boolean hasSubscribers() {
        return subscriberCount() > 0;
    }

    private void notifySubscribers(T newValue) {
        List<Subscriber<T>> snapshot;
        subscribersLock.readLock().lock();
        try {
            snapshot = new ArrayList<>(subscribers);
        } finally {
            subscribersLock.readLock().unlock();
        }
        for (Subscriber<T> subscriber : snapshot) {
            deliver(subscriber, newValue);
        }
    }

    private void deliver(Subscriber<T> subscriber, T state) {
        // An earlier callback in this round may have disposed a later subscriber
        if (!subscriber.active.get()) {
            return;
        }
        try {
            subscriber.callback.accept(state);
        } catch (RuntimeException e) {
            LOGGER.log(Level.WARNING, "State subscriber " + subscriber.id + " threw exception", e);
        }
    }

    private void unsubscribe(Subscriber<T> subscriber) {
        subscriber.active.set(false);
        subscribersLock.writeLock().lock();
        try {
            subscribers.remove(subscriber);
        } finally {
            subscribersLock.writeLock().unlock();
        }
    }

    private static final class Subscriber<T> {
        final long id;
        final Consumer<? super T> callback;
        final AtomicBoolean active = new AtomicBoolean(true);

        Subscriber(long id, Consumer<? super T> callback) {
            this.id = id;
            this.callback = callback;
        }
    }

    private enum Unset {
        INSTANCE
    }
}
