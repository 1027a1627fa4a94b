package com.rackplay.common.factory;

import jakarta.inject.Provider;
import org.jspecify.annotations.Nullable;

public interface ObjectBinder {

    <T> BindingBuilder<T> bind(final Class<T> type);

    interface BindingBuilder<T> {

        BindingBuilder<T> named(final @Nullable String name);

        void toImpl(final Class<? extends T> impl);

        void toInst(final T inst);

        void toProv(final Class<? extends Provider<? extends T>> prov);
    }
}
