package com.questrail.framebus.registry;

/**
 * Creates one instance of a registered frame or port type.
 *
 * @param <B> the base kind produced ({@code Frame} or {@code Port})
 */
@FunctionalInterface
public interface TypeFactory<B>
{
    /**
     * @param instanceName never null or blank
     * @param context      the context the instance is created in
     */
    B create(String instanceName, BusContext context);
}
