package com.rackplay.common.factory;

@FunctionalInterface
public interface ObjectModule {

    void configure(final ObjectBinder binder);
}
