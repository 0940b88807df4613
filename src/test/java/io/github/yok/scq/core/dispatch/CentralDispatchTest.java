package io.github.yok.scq.core.dispatch;

import static org.assertj.core.api.Assertions.*;

import java.util.ArrayList;
import java.util.List;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

class CentralDispatchTest {

    private final CentralDispatch dispatch = new CentralDispatch();

    private final List<String> received = new ArrayList<>();

    private DispatchClient client(String name) {
        return (topic, sender) -> received.add(name + ":" + topic + ":" + sender);
    }

    @Test
    @DisplayName("登録順に配信します")
    void broadcastInOrder() {
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, client("a"));
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, client("b"));
        dispatch.broadcast(DispatchTopic.STRUCTURAL_UPDATE, "root");
        assertThat(received).containsExactly("a:STRUCTURAL_UPDATE:root",
                "b:STRUCTURAL_UPDATE:root");
    }

    @Test
    @DisplayName("同じクライアントは一度だけ登録されます")
    void registerIdempotent() {
        DispatchClient c = client("a");
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, c);
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, c);
        assertThat(dispatch.subscriberCount(DispatchTopic.STRUCTURAL_UPDATE)).isEqualTo(1);
        assertThat(dispatch.isRegistered(DispatchTopic.STRUCTURAL_UPDATE, c)).isTrue();
    }

    @Test
    @DisplayName("登録解除したクライアントには配信しません")
    void unregister() {
        DispatchClient a = client("a");
        DispatchClient b = client("b");
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, a);
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, b);
        dispatch.unregister(DispatchTopic.STRUCTURAL_UPDATE, a);
        dispatch.unregisterAll(b);
        dispatch.broadcast(DispatchTopic.STRUCTURAL_UPDATE, "root");
        assertThat(received).isEmpty();
        assertThat(dispatch.subscriberCount(DispatchTopic.STRUCTURAL_UPDATE)).isZero();
    }

    @Test
    @DisplayName("配信中に登録解除しても残りのクライアントに届きます")
    void unregisterDuringBroadcast() {
        DispatchClient b = client("b");
        DispatchClient a = (topic, sender) -> {
            received.add("a");
            dispatch.unregister(topic, b);
        };
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, a);
        dispatch.register(DispatchTopic.STRUCTURAL_UPDATE, b);
        dispatch.broadcast(DispatchTopic.STRUCTURAL_UPDATE, "root");
        assertThat(received).containsExactly("a", "b:STRUCTURAL_UPDATE:root");
        assertThat(dispatch.isRegistered(DispatchTopic.STRUCTURAL_UPDATE, b)).isFalse();
    }

    @Test
    @DisplayName("null は登録できません")
    void rejectNull() {
        assertThatThrownBy(() -> dispatch.register(null, client("a")))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
