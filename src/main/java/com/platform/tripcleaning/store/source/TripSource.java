package com.platform.tripcleaning.store.source;

import java.io.IOException;
import java.util.function.Consumer;

/**
 * A finite, ordered sequence of raw trip rows. Read failures of the underlying file are fatal and
 * surface as {@link IOException}; per-row value problems are left to the parser.
 */
public interface TripSource extends AutoCloseable {

    /**
     * Push every row, in source order, to the consumer. Row numbers start at 0.
     */
    void forEachRow(Consumer<RawTripRow> consumer) throws IOException;

    String description();

    @Override
    void close() throws IOException;
}
