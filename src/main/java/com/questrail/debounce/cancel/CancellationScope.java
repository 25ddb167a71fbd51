package com.questrail.debounce.cancel;

import com.questrail.debounce.internal.time.Cancellable;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * CancellationScope
 * =============================================================================
 * Explicit cancellation context, passed by reference into the debounce
 * operator and into every task it spawns.
 *
 * <h2>Semantics</h2>
 * <ul>
 *   <li>Cancellation is cooperative. {@link #cancel()} only sets a flag and runs
 *       the registered listeners; running code observes it at its next
 *       suspension point or {@link #throwIfCancelled()} check.</li>
 *   <li>A scope created by {@link #child(String)} is cancelled whenever its
 *       parent is. A child of an already cancelled parent is born cancelled.</li>
 *   <li>Cancelling a child never affects its parent or siblings.</li>
 *   <li>{@link #cancel()} is idempotent; listeners run exactly once, in
 *       registration order, on the thread that performed the cancellation.</li>
 * </ul>
 *
 * <h2>Thread Safety</h2>
 * <p>All methods are thread-safe. Listeners are invoked outside the internal
 * lock, so a listener may freely call back into this scope.</p>
 */
public final class CancellationScope
{
    private final String name;
    private final Object lock = new Object();

    // Guarded by lock.
    private final Map<Long, Runnable> listeners = new LinkedHashMap<>();
    private long nextListenerId = 0L;
    private boolean cancelled = false;
    private Cancellable parentRegistration = Cancellable.NONE;

    private CancellationScope(String name)
    {
        this.name = Objects.requireNonNull(name, "name");
    }

    /**
     * Creates an independent scope with no parent.
     */
    public static CancellationScope root(String name)
    {
        return new CancellationScope(name);
    }

    public static CancellationScope root()
    {
        return root("root");
    }

    /**
     * Creates a scope that is cancelled whenever this scope is cancelled.
     *
     * @param childName diagnostic name of the child
     * @return the child scope (already cancelled if this scope is)
     */
    public CancellationScope child(String childName)
    {
        CancellationScope child = new CancellationScope(name + "/" + childName);
        Cancellable registration = onCancel(child::cancel);
        child.attachParentRegistration(registration);
        return child;
    }

    /**
     * Requests cancellation of this scope and, transitively, of all its children.
     *
     * @return {@code true} if this call cancelled the scope; {@code false} if it
     *         was already cancelled
     */
    public boolean cancel()
    {
        List<Runnable> toRun;
        Cancellable registration;

        synchronized (lock) {
            if (cancelled) {
                return false;
            }
            cancelled = true;
            toRun = new ArrayList<>(listeners.values());
            listeners.clear();
            registration = parentRegistration;
            parentRegistration = Cancellable.NONE;
        }

        // The parent no longer needs to track us.
        registration.cancel();

        RuntimeException failure = null;
        for (Runnable listener : toRun) {
            try {
                listener.run();
            }
            catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                }
                else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
        return true;
    }

    /**
     * Registers a listener to run when this scope is cancelled.
     *
     * <p>If the scope is already cancelled the listener runs immediately on the
     * calling thread.</p>
     *
     * @return a handle that deregisters the listener; cancelling it after the
     *         listener has run returns {@code false}
     */
    public Cancellable onCancel(Runnable listener)
    {
        Objects.requireNonNull(listener, "listener");

        synchronized (lock) {
            if (!cancelled) {
                long id = nextListenerId++;
                listeners.put(id, listener);
                return () -> {
                    synchronized (lock) {
                        return listeners.remove(id) != null;
                    }
                };
            }
        }

        listener.run();
        return Cancellable.NONE;
    }

    /**
     * Stops tracking this scope from its parent without cancelling it.
     *
     * <p>Used once the work owned by this scope has finished, so that a
     * long-lived parent does not accumulate finished children.</p>
     */
    public void detach()
    {
        Cancellable registration;
        synchronized (lock) {
            registration = parentRegistration;
            parentRegistration = Cancellable.NONE;
        }
        registration.cancel();
    }

    public boolean isCancelled()
    {
        synchronized (lock) {
            return cancelled;
        }
    }

    /**
     * Cancellation check for use at suspension points.
     *
     * @throws TaskCancelledException if this scope has been cancelled
     */
    public void throwIfCancelled()
    {
        if (isCancelled()) {
            throw new TaskCancelledException("scope '" + name + "' was cancelled");
        }
    }

    public String name()
    {
        return name;
    }

    int listenerCount()
    {
        synchronized (lock) {
            return listeners.size();
        }
    }

    private void attachParentRegistration(Cancellable registration)
    {
        boolean alreadyCancelled;
        synchronized (lock) {
            alreadyCancelled = cancelled;
            if (!alreadyCancelled) {
                parentRegistration = registration;
            }
        }
        if (alreadyCancelled) {
            registration.cancel();
        }
    }

    @Override
    public String toString()
    {
        return "CancellationScope[" + name + (isCancelled() ? ", cancelled]" : "]");
    }
}
