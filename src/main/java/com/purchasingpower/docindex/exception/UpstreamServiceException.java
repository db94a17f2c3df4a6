package com.purchasingpower.docindex.exception;

import com.purchasingpower.docindex.model.ServiceType;
import lombok.Getter;

/**
 * A remote service (extraction or index) could not serve a request, retries included.
 */
@Getter
public class UpstreamServiceException extends RuntimeException {

    private final ServiceType service;

    /** HTTP status of the last response, or -1 when no response was received. */
    private final int statusCode;

    public UpstreamServiceException(ServiceType service, String message, int statusCode, Throwable cause) {
        super(service.getName() + ": " + message, cause);
        this.service = service;
        this.statusCode = statusCode;
    }

    public UpstreamServiceException(ServiceType service, String message, Throwable cause) {
        this(service, message, -1, cause);
    }
}
