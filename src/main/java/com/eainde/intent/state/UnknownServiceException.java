package com.eainde.intent.state;

/**
 * Raised when an operation names a service that was never identified in the session.
 */
public class UnknownServiceException extends IllegalArgumentException {

    private final String serviceName;

    public UnknownServiceException(String serviceName) {
        super("Service '" + serviceName + "' was never identified in this session");
        this.serviceName = serviceName;
    }

    public String getServiceName() {
        return serviceName;
    }
}
