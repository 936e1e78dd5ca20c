package org.caureq.selfrepair.service.store;

public class UnknownComponentException extends RuntimeException {
    private final String component;

    public UnknownComponentException(String component) {
        super("component not registered: " + component);
        this.component = component;
    }

    public String component() { return component; }
}
