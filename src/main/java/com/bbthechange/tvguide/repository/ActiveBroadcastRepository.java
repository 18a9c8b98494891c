package com.bbthechange.tvguide.repository;

import com.bbthechange.tvguide.model.ActiveBroadcasts;
import com.bbthechange.tvguide.util.CancellationSignal;

public interface ActiveBroadcastRepository {

    ActiveBroadcasts load(CancellationSignal cancellation);

    void save(ActiveBroadcasts activeBroadcasts, CancellationSignal cancellation);
}
