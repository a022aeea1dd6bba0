package com.example.blockalert.session;

import com.example.blockalert.exception.NetworkUnavailableException;
import com.example.blockalert.util.Constants.ConnectivityState;
import lombok.extern.slf4j.Slf4j;

import java.util.concurrent.atomic.AtomicReference;

/**
 * Online/offline state of one session. Transitions act only when the state actually changes, so
 * repeated signals from the stream, the client and the store probe are harmless.
 */
@Slf4j
public class ConnectivityReconciler {

    /**
     * What the owning session does around a transition.
     */
    public interface RecoveryActions {
        void resubscribe();

        void reconcile();

        void refreshSnapshots();

        void connectivityChanged(ConnectivityState state);
    }

    private final String sessionId;
    private final RecoveryActions actions;
    private final AtomicReference<ConnectivityState> state = new AtomicReference<>(ConnectivityState.ONLINE);

    public ConnectivityReconciler(String sessionId, RecoveryActions actions) {
        this.sessionId = sessionId;
        this.actions = actions;
    }

    public ConnectivityState state() {
        return state.get();
    }

    public boolean isOnline() {
        return state.get() == ConnectivityState.ONLINE;
    }

    /**
     * @return true if the session was online before this call
     */
    public boolean onConnectionLost(String reason) {
        if (!state.compareAndSet(ConnectivityState.ONLINE, ConnectivityState.OFFLINE)) {
            return false;
        }
        log.warn("Session {} went offline: {}", sessionId, reason);
        actions.connectivityChanged(ConnectivityState.OFFLINE);
        return true;
    }

    /**
     * Resubscribes, reconciles and refreshes snapshots. If any step fails the session stays offline.
     *
     * @return true if the session was offline before this call
     * @throws NetworkUnavailableException if recovery failed
     */
    public boolean onConnectionRestored() {
        if (!state.compareAndSet(ConnectivityState.OFFLINE, ConnectivityState.ONLINE)) {
            return false;
        }
        try {
            actions.resubscribe();
            actions.reconcile();
            actions.refreshSnapshots();
        } catch (RuntimeException e) {
            state.set(ConnectivityState.OFFLINE);
            throw new NetworkUnavailableException("Session " + sessionId + " could not recover: " + e.getMessage(), e);
        }
        log.info("Session {} back online", sessionId);
        actions.connectivityChanged(ConnectivityState.ONLINE);
        return true;
    }

    public void ensureOnline() {
        if (!isOnline()) {
            throw new NetworkUnavailableException("Offline. Try again once the connection is back.");
        }
    }
}
