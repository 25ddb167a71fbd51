package com.questrail.debounce.source;

/**
 * ValueSink
 * -----------------------------------------------------------------------------
 * Callback side of a {@link ValueSource}.
 *
 * <p>Sources must deliver callbacks in a <em>serialized</em> manner: no two
 * callbacks for the same sink may overlap. Emission order is the order in
 * which values are offered.</p>
 */
public interface ValueSink<T>
{
    /**
     * Offers the next value.
     *
     * @return {@code true} if the value was accepted; {@code false} once the
     *         sink has stopped consuming (closed, cancelled or failed)
     */
    boolean onValue(T value);

    /**
     * Signals that the source has no more values.
     */
    void onClose();

    /**
     * Signals that the source failed and will produce no more values.
     */
    void onError(Throwable cause);
}
