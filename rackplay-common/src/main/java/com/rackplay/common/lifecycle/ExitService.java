package com.rackplay.common.lifecycle;

@FunctionalInterface
public interface ExitService {

    void exit(final Code code);

    enum Code {
        SUCCESS,
        FAILURE
    }
}
