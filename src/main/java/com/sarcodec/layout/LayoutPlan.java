package com.sarcodec.layout;

import lombok.Value;

import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Ordered, gap-free segments of a container and the resulting file length. Plans hold only
 * offsets, lengths and payload declarations, so equal models always produce equal plans.
 */
@Value
public class LayoutPlan {
    String format;
    List<Segment> segments;
    long totalLength;
    List<PendingField> pendingFields;

    public Segment getSegment(int index) {
        return segments.get(index);
    }

    public Optional<Segment> find(String name) {
        return segments.stream().filter(s -> s.getName().equals(name)).findFirst();
    }

    public List<Segment> segmentsOf(SegmentKind kind) {
        return segments.stream().filter(s -> s.getKind() == kind).collect(Collectors.toList());
    }

    public List<Segment> dataSegments() {
        return segmentsOf(SegmentKind.DATA);
    }
}
