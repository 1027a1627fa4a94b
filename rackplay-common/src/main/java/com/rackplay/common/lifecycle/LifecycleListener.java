package com.rackplay.common.lifecycle;

public interface LifecycleListener {

    default void onRackplayInit() {}

    default void onRackplayExit() {}
}
