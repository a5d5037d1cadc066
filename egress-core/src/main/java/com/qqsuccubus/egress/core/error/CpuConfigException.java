package com.qqsuccubus.egress.core.error;

/**
 * The node cannot run any egress type with the configured CPU costs. Fatal at startup.
 */
public class CpuConfigException extends RuntimeException {

    public CpuConfigException(String message) {
        super(message);
    }
}
