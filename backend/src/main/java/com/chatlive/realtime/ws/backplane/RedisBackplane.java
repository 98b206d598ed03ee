package com.chatlive.realtime.ws.backplane;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.data.redis.connection.Message;
import org.springframework.data.redis.connection.MessageListener;
import org.springframework.data.redis.connection.lettuce.LettuceConnectionFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.data.redis.listener.ChannelTopic;
import org.springframework.data.redis.listener.RedisMessageListenerContainer;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * Redis pub/sub relay. Delivery is at-least-once per subscriber process and unordered across
 * channels; envelopes published by this node are ignored on receipt.
 */
public class RedisBackplane implements Backplane, MessageListener, DisposableBean {

    private static final Logger log = LoggerFactory.getLogger(RedisBackplane.class);

    private final String nodeId = "node_" + UUID.randomUUID();
    private final LettuceConnectionFactory connectionFactory;
    private final StringRedisTemplate redisTemplate;
    private final RedisMessageListenerContainer listenerContainer;
    private final ObjectMapper objectMapper;
    private final String topic;
    private final List<Consumer<BackplaneEnvelope>> listeners = new CopyOnWriteArrayList<>();

    public RedisBackplane(LettuceConnectionFactory connectionFactory, ObjectMapper objectMapper, String topic) {
        this.connectionFactory = connectionFactory;
        this.objectMapper = objectMapper;
        this.topic = topic;

        this.redisTemplate = new StringRedisTemplate(connectionFactory);
        this.redisTemplate.afterPropertiesSet();

        this.listenerContainer = new RedisMessageListenerContainer();
        this.listenerContainer.setConnectionFactory(connectionFactory);
        this.listenerContainer.addMessageListener(this, new ChannelTopic(topic));
        this.listenerContainer.afterPropertiesSet();
        this.listenerContainer.start();
    }

    @Override
    public void publish(BackplaneEnvelope envelope) {
        try {
            redisTemplate.convertAndSend(topic, objectMapper.writeValueAsString(envelope));
        } catch (JsonProcessingException ex) {
            throw new IllegalStateException("backplane_encode_failed", ex);
        } catch (RuntimeException ex) {
            // Local subscribers already got the event; remote ones miss it.
            log.warn("backplane_publish_failed kind={} channel={}", envelope.kind(), envelope.channel(), ex);
        }
    }

    @Override
    public void subscribe(Consumer<BackplaneEnvelope> listener) {
        listeners.add(listener);
    }

    @Override
    public void onMessage(Message message, byte[] pattern) {
        BackplaneEnvelope envelope;
        try {
            envelope = objectMapper.readValue(new String(message.getBody(), StandardCharsets.UTF_8), BackplaneEnvelope.class);
        } catch (Exception ex) {
            log.warn("backplane_decode_failed", ex);
            return;
        }
        if (nodeId.equals(envelope.originNode())) return;
        for (var l : listeners) {
            try {
                l.accept(envelope);
            } catch (RuntimeException ex) {
                log.warn("backplane_listener_failed kind={} channel={}", envelope.kind(), envelope.channel(), ex);
            }
        }
    }

    @Override
    public boolean distributed() {
        return true;
    }

    @Override
    public String nodeId() {
        return nodeId;
    }

    @Override
    public void destroy() throws Exception {
        listenerContainer.stop();
        listenerContainer.destroy();
        connectionFactory.destroy();
    }
}
