package com.warden.scope;

import com.warden.eventmodel.ScopeChangeNotification;
import com.warden.eventmodel.SessionInvalidatedNotification;

/**
 * Push boundary towards live client connections.
 *
 * <p>Implementations deliver payloads verbatim. Delivery is best effort; a failure may be thrown as
 * an unchecked exception and is handled by the caller.
 */
public interface ChangeNotifier {

    /** @return number of connections the notification reached */
    int notifyScopeChange(ScopeChangeNotification notification);

    /** @return number of connections the notification reached */
    int notifySessionInvalidated(SessionInvalidatedNotification notification);
}
