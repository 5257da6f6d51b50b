package com.flow.sync.service.fanout;

import com.flow.sync.service.change.ChangeRecord;

/**
 * Transport-side receiver of live change records.
 *
 * The only contract is best-effort delivery in the order records are handed
 * over. Retries and backpressure belong to the transport.
 */
public interface LiveUpdateSink {

    void deliver(ChangeRecord record);
}
