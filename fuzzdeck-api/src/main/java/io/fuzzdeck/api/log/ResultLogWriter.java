package io.fuzzdeck.api.log;

import io.fuzzdeck.api.result.ResultRecord;
import io.fuzzdeck.api.session.SessionToken;

/**
 * Writes session results to a log file as they arrive.
 */
public interface ResultLogWriter extends AutoCloseable {

    /**
     * Append a single result record (streaming mode).
     *
     * @param token  the session the record belongs to
     * @param record the result record
     */
    void append(SessionToken token, ResultRecord record);

    /**
     * Flush and close the log writer.
     */
    @Override
    void close();
}
