package com.questrail.framebus.api;

import com.questrail.framebus.error.MethodInvocationException;
import com.questrail.framebus.error.UnknownMethodException;

import java.util.List;

/**
 * MethodTable
 * -----------------------------------------------------------------------------
 * Name-based, type-erased invocation surface shared by frames and ports.
 *
 * <p>A method table lets tooling, scripting bridges and generic transport
 * code call operations on an instance without compile-time knowledge of its
 * concrete type. Functions receive an ordered list of {@link SignalValue}
 * arguments and return a {@link SignalValue}.</p>
 *
 * <h2>Thread Safety</h2>
 * Implementations guard their table with one lock per instance. The bound
 * function itself runs outside that lock.
 */
public interface MethodTable
{
    /**
     * Binds {@code name} to {@code fn}. An existing binding is overwritten.
     */
    void registerMethod(String name, MethodFunction fn);

    /**
     * Invokes the function bound to {@code name}.
     *
     * @throws UnknownMethodException    if nothing is bound to {@code name}
     * @throws MethodInvocationException if the function fails with a checked
     *                                   exception; unchecked failures propagate
     *                                   unchanged
     */
    SignalValue invoke(String name, List<SignalValue> args);

    /**
     * Invokes the function bound to {@code name} with no arguments.
     */
    default SignalValue invoke(String name) {
        return invoke(name, List.of());
    }

    /**
     * Returns the bound method names in ascending order.
     */
    List<String> listMethods();
}
