package com.questrail.framebus.api;

import java.util.List;

/**
 * A function bound by name in a {@link MethodTable}.
 *
 * <p>Arguments arrive in call order. Implementations return
 * {@link SignalValue#none()} when they produce nothing.</p>
 */
@FunctionalInterface
public interface MethodFunction
{
    SignalValue apply(List<SignalValue> args) throws Exception;
}
