package com.chatlive.realtime.notification.ws;

import com.chatlive.realtime.notification.service.NotificationService;
import com.chatlive.realtime.ws.ConnectionInfo;
import com.chatlive.realtime.ws.InboundFrame;
import com.chatlive.realtime.ws.Namespace;
import com.chatlive.realtime.ws.NamespaceDispatcher;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

@Component
public class NotificationEventDispatcher implements NamespaceDispatcher {

    private final ObjectMapper objectMapper;
    private final NotificationService notificationService;

    public NotificationEventDispatcher(ObjectMapper objectMapper, NotificationService notificationService) {
        this.objectMapper = objectMapper;
        this.notificationService = notificationService;
    }

    @Override
    public Namespace namespace() {
        return Namespace.NOTIFICATIONS;
    }

    @Override
    public void onConnected(ConnectionInfo connection) {
        // the handler already joined user:<id>, which is all this namespace delivers to
    }

    @Override
    public void dispatch(ConnectionInfo connection, InboundFrame frame) {
        var event = NotificationInboundEvent.parse(frame, objectMapper);
        var identity = connection.identity();

        if (event instanceof NotificationInboundEvent.MarkAsRead e) {
            notificationService.markAsRead(identity, e.notificationId(), e.userId());
        } else if (event instanceof NotificationInboundEvent.MarkAllAsRead e) {
            notificationService.markAllAsRead(identity, e.userId());
        } else if (event instanceof NotificationInboundEvent.DeleteNotification e) {
            notificationService.deleteNotification(identity, e.notificationId(), e.userId());
        }
    }
}
