package com.questrail.framebus.core;

import com.questrail.framebus.api.MethodFunction;
import com.questrail.framebus.api.MethodTable;
import com.questrail.framebus.api.SignalValue;
import com.questrail.framebus.error.MethodInvocationException;
import com.questrail.framebus.error.UnknownMethodException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * DefaultMethodTable
 * -----------------------------------------------------------------------------
 * Straightforward {@link MethodTable} backed by a map guarded by one private
 * lock. Frames and ports delegate to an instance of this class.
 *
 * <p>Lookup happens under the lock; the bound function runs after the lock is
 * released, so a function may itself call {@link #invoke} or
 * {@link #registerMethod} on the same table.</p>
 */
public final class DefaultMethodTable implements MethodTable
{
    private final String owner;

    private final Object lock = new Object();
    private final Map<String, MethodFunction> methods = new HashMap<>();

    /**
     * @param owner description of the owning instance, used in error messages
     */
    public DefaultMethodTable(String owner) {
        this.owner = Objects.requireNonNull(owner, "owner");
    }

    @Override
    public void registerMethod(String name, MethodFunction fn) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(fn, "fn");
        synchronized (lock) {
            methods.put(name, fn);
        }
    }

    @Override
    public SignalValue invoke(String name, List<SignalValue> args) {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(args, "args");

        final MethodFunction fn;
        synchronized (lock) {
            fn = methods.get(name);
        }
        if (fn == null) {
            throw new UnknownMethodException(owner + ": method '" + name + "' not registered");
        }

        final SignalValue result;
        try {
            result = fn.apply(List.copyOf(args));
        } catch (RuntimeException e) {
            throw e;
        } catch (Exception e) {
            throw new MethodInvocationException(name, e);
        }
        return result != null ? result : SignalValue.none();
    }

    @Override
    public List<String> listMethods() {
        List<String> names;
        synchronized (lock) {
            names = new ArrayList<>(methods.keySet());
        }
        Collections.sort(names);
        return Collections.unmodifiableList(names);
    }
}
