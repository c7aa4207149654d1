package com.eainde.analysis.error;

public class UpstreamCapabilityException extends PipelineException {

    public UpstreamCapabilityException(String message) {
        super(message);
    }

    public UpstreamCapabilityException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.UPSTREAM_CAPABILITY;
    }
}
