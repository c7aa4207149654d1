package com.eainde.analysis.error;

public class ReportFormatException extends PipelineException {

    public ReportFormatException(String message) {
        super(message);
    }

    public ReportFormatException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.FORMAT;
    }
}
