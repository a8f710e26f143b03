package com.example.h3csv.processing;

import com.example.h3csv.csv.GeoRecord;

import java.io.IOException;

/**
 * Receives every forwarded record, synchronously and in input order.
 * A failure here stops the stream.
 */
@FunctionalInterface
public interface RecordSink {

    void accept(GeoRecord record) throws IOException;
}
