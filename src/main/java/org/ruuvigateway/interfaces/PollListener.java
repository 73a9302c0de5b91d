package org.ruuvigateway.interfaces;

import java.util.List;
import org.ruuvigateway.model.BeaconRecord;
import org.ruuvigateway.model.FailureKind;

/**
 * Host-side receiver of poll cycle outcomes.
 * Called on the poll thread; implementations should return quickly.
 */
public interface PollListener {

    /** Records that are new or whose payload changed since the previous cycle. May be empty. */
    void onChanges(List<BeaconRecord> changed);

    /** The cycle failed; the cache was left untouched. */
    void onFailure(FailureKind kind, String message);
}
