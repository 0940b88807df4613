package io.github.yok.scq.core.dispatch;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import lombok.extern.slf4j.Slf4j;

/**
 * トピック単位の発行・購読を仲介するディスパッチャです。
 *
 * <p>
 * ルート回路が 1 つ所有し、 階層的対角化で生成したサブシステムへ渡します。 単一スレッドでの利用を前提とします。
 * </p>
 */
@Slf4j
public final class CentralDispatch {

    /**
     * トピック → 購読者（登録順）です。
     */
    private final Map<DispatchTopic, List<DispatchClient>> clients =
            new EnumMap<>(DispatchTopic.class);

    /**
     * 購読者を登録します（登録済みなら何もしません）。
     *
     * @param topic トピックです
     * @param client 購読者です
     */
    public void register(DispatchTopic topic, DispatchClient client) {
        if (topic == null || client == null) {
            throw new IllegalArgumentException("topic と client は null 不可です");
        }
        List<DispatchClient> list = clients.computeIfAbsent(topic, t -> new ArrayList<>());
        if (!list.contains(client)) {
            list.add(client);
        }
    }

    /**
     * 購読者の登録を解除します。
     *
     * @param topic トピックです
     * @param client 購読者です
     */
    public void unregister(DispatchTopic topic, DispatchClient client) {
        List<DispatchClient> list = clients.get(topic);
        if (list != null) {
            list.remove(client);
        }
    }

    /**
     * 購読者をすべてのトピックから解除します。
     *
     * @param client 購読者です
     */
    public void unregisterAll(DispatchClient client) {
        clients.values().forEach(list -> list.remove(client));
    }

    /**
     * トピックの購読者すべてに通知します。
     *
     * @param topic トピックです
     * @param sender 送信元です
     */
    public void broadcast(DispatchTopic topic, Object sender) {
        List<DispatchClient> list = clients.get(topic);
        if (list == null || list.isEmpty()) {
            return;
        }
        log.debug("配信します: topic={}, subscribers={}", topic, list.size());
        // 通知中の登録解除に備えて複製してから配信します。
        for (DispatchClient client : new ArrayList<>(list)) {
            client.receive(topic, sender);
        }
    }

    /**
     * トピックの購読者数を返します。
     *
     * @param topic トピックです
     * @return 購読者数です
     */
    public int subscriberCount(DispatchTopic topic) {
        List<DispatchClient> list = clients.get(topic);
        return (list == null) ? 0 : list.size();
    }

    /**
     * 購読者が登録済みかどうかを返します。
     *
     * @param topic トピックです
     * @param client 購読者です
     * @return 登録済みなら true です
     */
    public boolean isRegistered(DispatchTopic topic, DispatchClient client) {
        List<DispatchClient> list = clients.get(topic);
        return list != null && list.contains(client);
    }
}
