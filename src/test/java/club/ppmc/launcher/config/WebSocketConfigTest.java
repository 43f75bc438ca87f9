package club.ppmc.launcher.config;

import static org.assertj.core.api.Assertions.assertThat;

import java.security.Principal;
import java.util.HashMap;
import org.junit.jupiter.api.Test;

class WebSocketConfigTest {

    @Test
    void handshake_assignsDistinctPrincipalPerConnection() {
        var handler = new WebSocketConfig.AnonymousObserverHandshakeHandler();

        Principal first = handler.determineUser(null, null, new HashMap<>());
        Principal second = handler.determineUser(null, null, new HashMap<>());

        assertThat(first.getName()).startsWith("observer-");
        assertThat(second.getName()).isNotEqualTo(first.getName());
    }
}
