package com.eainde.analysis.error;

import java.time.Duration;

public class StageTimeoutException extends PipelineException {

    public StageTimeoutException(String stage, Duration timeout) {
        super("Stage " + stage + " did not finish within " + timeout);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.TIMEOUT;
    }
}
