package com.questrail.framebus.registry;

import java.util.Objects;

/**
 * Self-identifying name of a concrete frame or port type plus its factory.
 *
 * <p>Concrete types publish one as a {@code public static final} constant;
 * a {@link TypeCatalog} hands it to the matching {@link TypeRegistry}.</p>
 */
public record TypeDescriptor<B>(String name, TypeFactory<B> factory)
{
    public TypeDescriptor {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(factory, "factory");
        if (name.isBlank()) {
            throw new IllegalArgumentException("Type name must not be blank");
        }
    }

    public static <B> TypeDescriptor<B> of(String name, TypeFactory<B> factory) {
        return new TypeDescriptor<>(name, factory);
    }
}
