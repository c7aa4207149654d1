package com.eainde.analysis.error;

public class CalculationException extends PipelineException {

    public CalculationException(String message) {
        super(message);
    }

    @Override
    public ErrorKind kind() {
        return ErrorKind.CALCULATION;
    }
}
