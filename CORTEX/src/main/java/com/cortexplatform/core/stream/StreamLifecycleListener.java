package com.cortexplatform.core.stream;

import com.cortexplatform.core.event.ConversationKey;

/**
 * Notified by the {@link StreamBroadcaster} about stream attachment changes.
 */
public interface StreamLifecycleListener {

    /**
     * The last stream handle of a conversation has been detached; nobody is listening to it any more.
     */
    void onLastDetach(ConversationKey key);
}
