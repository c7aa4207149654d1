package com.eainde.analysis.controller;

import com.eainde.analysis.state.RunStatus;

public record RunAcceptedView(String runId, String subject, RunStatus status, boolean attached) {
}
