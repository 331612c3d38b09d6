package io.routeflow.core.batch;

/** Strategy used to cut a raw batched payload into units. */
public enum SplitType {
    /** One unit per record. */
    RECORD,
    /** Records accumulate until a sentinel record. */
    SENTINEL,
    /** Consecutive records sharing a grouping-column value form one unit. */
    GROUPING_COLUMN,
    /** A user script pulls each unit from a line reader. */
    SCRIPT,
    /** One unit per {@code MSH} segment of an HL7 v2 batch. */
    HL7
}
