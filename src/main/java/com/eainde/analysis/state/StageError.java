package com.eainde.analysis.state;

import com.eainde.analysis.error.ErrorKind;

public record StageError(ErrorKind kind, String message) {
}
