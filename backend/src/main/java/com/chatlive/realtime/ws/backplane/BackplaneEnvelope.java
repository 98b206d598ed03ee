package com.chatlive.realtime.ws.backplane;

/**
 * Cross-process message. EVENT carries an encoded outbound frame for a channel; JOIN asks every
 * process to subscribe the identity's local connections to a channel.
 */
public record BackplaneEnvelope(
        Kind kind,
        String originNode,
        String namespace,
        String channel,
        String frame,
        String excludeIdentityId,
        String identityId
) {
    public enum Kind {
        EVENT,
        JOIN
    }

    public static BackplaneEnvelope event(String originNode, String namespace, String channel, String frame, String excludeIdentityId) {
        return new BackplaneEnvelope(Kind.EVENT, originNode, namespace, channel, frame, excludeIdentityId, null);
    }

    public static BackplaneEnvelope join(String originNode, String namespace, String channel, String identityId) {
        return new BackplaneEnvelope(Kind.JOIN, originNode, namespace, channel, null, null, identityId);
    }
}
