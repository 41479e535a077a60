package com.questrail.framebus.registry;

/**
 * Startup routine that registers a group of types with a {@link BusContext}.
 *
 * <p>Catalogs run once, in the order given to
 * {@link BusContext.Builder#withCatalog(TypeCatalog...)}, before the context
 * is handed out.</p>
 */
@FunctionalInterface
public interface TypeCatalog
{
    void register(BusContext context);
}
