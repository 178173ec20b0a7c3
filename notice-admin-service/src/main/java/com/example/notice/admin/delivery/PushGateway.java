package com.example.notice.admin.delivery;

public interface PushGateway {

    /**
     * @return the provider's message id
     */
    String sendToTopic(String topic, PushMessage message);
}
