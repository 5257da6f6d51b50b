package com.flow.sync.service.engine;

import com.flow.sync.service.change.ChangeRecord;

/**
 * Consumer of committed change records.
 *
 * Invoked from the owning actor's thread, in sequence order, after the
 * change has been committed. Implementations must not block for long and
 * must not call back into the actor.
 */
public interface ChangeRecordListener {

    void onChange(ChangeRecord record);
}
