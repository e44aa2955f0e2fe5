package com.sarcodec.data;

import lombok.Value;

/**
 * Named member of a structured {@link DataType}, located at a byte offset inside the record.
 */
@Value
public class DataField {
    String name;
    DataType type;
    int offset;
}
