package com.sarcodec.layout;

/**
 * Role of a byte range within a container.
 */
public enum SegmentKind {
    HEADER,
    METADATA,
    DATA,
    PADDING
}
