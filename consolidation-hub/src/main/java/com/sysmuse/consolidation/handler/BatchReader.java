package com.sysmuse.consolidation.handler;

import com.sysmuse.consolidation.table.DataBatch;

import java.io.Closeable;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Lazy sequence of batches read from one file. Read failures after opening
 * surface as {@link java.io.UncheckedIOException} from {@code hasNext}/{@code next}.
 */
public interface BatchReader extends Iterator<DataBatch>, Closeable {

    /**
     * Reader over a batch that is already in memory.
     */
    static BatchReader of(DataBatch batch) {
        return new BatchReader() {
            private boolean consumed = false;

            @Override
            public boolean hasNext() {
                return !consumed;
            }

            @Override
            public DataBatch next() {
                if (consumed) {
                    throw new NoSuchElementException();
                }
                consumed = true;
                return batch;
            }

            @Override
            public void close() {
                consumed = true;
            }
        };
    }

    static BatchReader empty() {
        return new BatchReader() {
            @Override
            public boolean hasNext() {
                return false;
            }

            @Override
            public DataBatch next() {
                throw new NoSuchElementException();
            }

            @Override
            public void close() {
                // nothing to release
            }
        };
    }
}
