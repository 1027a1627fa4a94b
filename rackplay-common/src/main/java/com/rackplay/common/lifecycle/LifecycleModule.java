package com.rackplay.common.lifecycle;

import com.rackplay.common.factory.ObjectBinder;
import com.rackplay.common.factory.ObjectModule;

public final class LifecycleModule implements ObjectModule {

    @Override
    public void configure(final ObjectBinder binder) {
        binder.bind(LifecycleService.class).toImpl(LifecycleServiceImpl.class);
    }
}
