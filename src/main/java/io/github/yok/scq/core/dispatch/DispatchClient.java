package io.github.yok.scq.core.dispatch;

/**
 * 同期ディスパッチャから通知を受け取るクライアントです。
 */
public interface DispatchClient {

    /**
     * 通知を受け取ります。
     *
     * @param topic トピックです
     * @param sender 送信元です
     */
    void receive(DispatchTopic topic, Object sender);
}
