package com.sarcodec.layout;

import lombok.Value;

/**
 * A header byte range left as a placeholder until the writer finalizes the file.
 */
@Value
public class PendingField {
    String name;
    long offset;
    int width;
}
