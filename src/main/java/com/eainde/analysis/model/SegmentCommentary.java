package com.eainde.analysis.model;

import java.io.Serializable;

public record SegmentCommentary(String segment, String commentary) implements Serializable {
}
