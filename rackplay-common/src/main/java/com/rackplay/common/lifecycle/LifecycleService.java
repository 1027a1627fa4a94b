package com.rackplay.common.lifecycle;

import java.util.List;

public interface LifecycleService {

    void addListener(final LifecycleListener listener);

    void addListener(final Class<? extends LifecycleListener> listener);

    void load();

    void exit(final ExitService.Code code);

    /** The loaded listeners, most recently loaded first. */
    List<LifecycleListener> listeners();
}
