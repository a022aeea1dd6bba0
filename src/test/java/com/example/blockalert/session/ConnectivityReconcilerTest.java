package com.example.blockalert.session;

import com.example.blockalert.exception.NetworkUnavailableException;
import com.example.blockalert.util.Constants.ConnectivityState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;

@ExtendWith(MockitoExtension.class)
class ConnectivityReconcilerTest {

    @Mock
    private ConnectivityReconciler.RecoveryActions actions;

    @Test
    void shouldStartOnline() {
        ConnectivityReconciler reconciler = new ConnectivityReconciler("s1", actions);

        assertThat(reconciler.state()).isEqualTo(ConnectivityState.ONLINE);
        assertThatCode(reconciler::ensureOnline).doesNotThrowAnyException();
        verifyNoInteractions(actions);
    }

    @Test
    void shouldFailFastWhileOffline() {
        ConnectivityReconciler reconciler = new ConnectivityReconciler("s1", actions);
        reconciler.onConnectionLost("test");

        assertThatThrownBy(reconciler::ensureOnline).isInstanceOf(NetworkUnavailableException.class);
    }

    @Test
    void shouldFireTransitionsOnlyOnChange() {
        ConnectivityReconciler reconciler = new ConnectivityReconciler("s1", actions);

        assertThat(reconciler.onConnectionLost("first")).isTrue();
        assertThat(reconciler.onConnectionLost("second")).isFalse();
        assertThat(reconciler.onConnectionRestored()).isTrue();
        assertThat(reconciler.onConnectionRestored()).isFalse();

        verify(actions, times(1)).connectivityChanged(ConnectivityState.OFFLINE);
        verify(actions, times(1)).connectivityChanged(ConnectivityState.ONLINE);
        verify(actions, times(1)).resubscribe();
        verify(actions, times(1)).reconcile();
        verify(actions, times(1)).refreshSnapshots();
    }

    @Test
    void shouldResubscribeThenReconcileThenRefreshOnRestore() {
        ConnectivityReconciler reconciler = new ConnectivityReconciler("s1", actions);
        reconciler.onConnectionLost("test");
        reconciler.onConnectionRestored();

        InOrder order = inOrder(actions);
        order.verify(actions).resubscribe();
        order.verify(actions).reconcile();
        order.verify(actions).refreshSnapshots();
        order.verify(actions).connectivityChanged(ConnectivityState.ONLINE);
    }

    @Test
    void shouldStayOfflineWhenRecoveryFails() {
        ConnectivityReconciler reconciler = new ConnectivityReconciler("s1", actions);
        reconciler.onConnectionLost("test");
        doThrow(new IllegalStateException("store down")).when(actions).reconcile();

        assertThatThrownBy(reconciler::onConnectionRestored)
                .isInstanceOf(NetworkUnavailableException.class)
                .hasMessageContaining("store down");
        assertThat(reconciler.state()).isEqualTo(ConnectivityState.OFFLINE);
        verify(actions, never()).connectivityChanged(ConnectivityState.ONLINE);
    }
}
