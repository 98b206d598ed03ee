package com.chatlive.realtime.notification.service;

import com.chatlive.realtime.auth.repo.UserAccountRepository;
import com.chatlive.realtime.auth.service.Role;
import com.chatlive.realtime.auth.service.jwt.JwtService;
import com.chatlive.realtime.bootstrap.RealtimeApplication;
import com.chatlive.realtime.common.error.ErrorCode;
import com.chatlive.realtime.common.error.RealtimeException;
import com.chatlive.realtime.testing.TestUsers;
import com.chatlive.realtime.ws.RealtimeWsHandler;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.web.socket.TextMessage;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(classes = RealtimeApplication.class)
@ActiveProfiles("dev")
class NotificationServiceIntegrationTest {

    private static final Duration WAIT = Duration.ofSeconds(5);

    @Autowired
    NotificationService notificationService;

    @Autowired
    @Qualifier("notificationsWsHandler")
    RealtimeWsHandler notifications;

    @Autowired
    UserAccountRepository userRepository;

    @Autowired
    JwtService jwtService;

    @Autowired
    JdbcTemplate jdbcTemplate;

    TestUsers users;

    @BeforeEach
    void setUp() {
        users = new TestUsers(userRepository, jwtService);
    }

    @Test
    void delivery_continues_past_the_hourly_budget() throws Exception {
        var u = users.create("nb", Role.USER);
        var session = users.connect(notifications, u);

        for (int i = 0; i < 101; i++) {
            notificationService.sendNotificationToUser(u.id(), draft(u.id(), "n" + i));
        }

        assertThat(countFor(u.id())).isEqualTo(101);
        var last = session.await("newNotification", 101, WAIT);
        assertThat(last.path("data").path("title").asText()).isEqualTo("n100");
        assertThat(session.framesOf("rateLimitExceeded")).isEmpty();
    }

    @Test
    void status_moves_forward_only() throws Exception {
        var u = users.create("ns", Role.USER);
        var session = users.connect(notifications, u);
        var item = notificationService.sendNotificationToUser(u.id(), draft(u.id(), "hello"));
        assertThat(item.status()).isEqualTo("unread");

        var read = notificationService.markAsRead(u, item.id(), u.id());
        assertThat(read.status()).isEqualTo("read");
        assertThat(read.readAt()).isNotNull();
        var update = session.await("notificationUpdate");
        assertThat(update.path("data").path("notificationId").asText()).isEqualTo(item.id());
        assertThat(update.path("data").path("updates").path("status").asText()).isEqualTo("read");

        var again = notificationService.markAsRead(u, item.id(), null);
        assertThat(again.readAt()).isEqualTo(read.readAt());

        assertThat(notificationService.archive(u, item.id()).status()).isEqualTo("archived");
        assertThatThrownBy(() -> notificationService.markAsRead(u, item.id(), null))
                .isInstanceOf(RealtimeException.class)
                .hasMessage("notification_archived");
    }

    @Test
    void only_the_owner_may_touch_a_notification() {
        var owner = users.create("no", Role.USER);
        var other = users.create("nx", Role.USER);
        var item = notificationService.sendNotificationToUser(owner.id(), draft(owner.id(), "private"));

        assertThatThrownBy(() -> notificationService.markAsRead(other, item.id(), null))
                .extracting(ex -> ((RealtimeException) ex).code())
                .isEqualTo(ErrorCode.ACCESS_DENIED);
        assertThatThrownBy(() -> notificationService.markAsRead(other, item.id(), owner.id()))
                .extracting(ex -> ((RealtimeException) ex).code())
                .isEqualTo(ErrorCode.ACCESS_DENIED);
        assertThatThrownBy(() -> notificationService.deleteNotification(other, item.id(), null))
                .extracting(ex -> ((RealtimeException) ex).code())
                .isEqualTo(ErrorCode.NOT_FOUND);
        assertThatThrownBy(() -> notificationService.markAsRead(owner, "ntf_missing", null))
                .extracting(ex -> ((RealtimeException) ex).code())
                .isEqualTo(ErrorCode.NOT_FOUND);
    }

    @Test
    void mark_all_and_delete_over_the_socket() throws Exception {
        var u = users.create("nm", Role.USER);
        var session = users.connect(notifications, u);
        var first = notificationService.sendNotificationToUser(u.id(), draft(u.id(), "a"));
        notificationService.sendNotificationToUser(u.id(), draft(u.id(), "b"));

        notifications.handleMessage(session, new TextMessage("{\"event\":\"markAllAsRead\",\"data\":\"" + u.id() + "\"}"));
        var read = session.await("notificationsRead");
        assertThat(read.path("data").path("count").asInt()).isEqualTo(2);
        assertThat(read.path("data").path("notificationIds")).hasSize(2);

        notifications.handleMessage(session, new TextMessage("{\"event\":\"markAllAsRead\",\"data\":{\"userId\":\"" + u.id() + "\"}}"));
        assertThat(session.await("notificationsRead", 2, WAIT).path("data").path("count").asInt()).isZero();

        notifications.handleMessage(session, new TextMessage(
                "{\"event\":\"deleteNotification\",\"data\":{\"notificationId\":\"" + first.id() + "\"}}"));
        assertThat(session.await("notificationDeleted").path("data").path("notificationId").asText()).isEqualTo(first.id());

        notifications.handleMessage(session, new TextMessage(
                "{\"event\":\"deleteNotification\",\"data\":{\"notificationId\":\"" + first.id() + "\"}}"));
        assertThat(session.await("error").path("data").path("message").asText()).isEqualTo("notification_not_found");
        assertThat(countFor(u.id())).isEqualTo(1);
        assertThat(session.isOpen()).isTrue();
    }

    @Test
    void bulk_creation_is_all_or_nothing() {
        var u = users.create("nk", Role.USER);

        assertThatThrownBy(() -> notificationService.createBulkNotifications(List.of(
                draft(u.id(), "ok"),
                draft("nobody_" + u.id(), "bad"))))
                .extracting(ex -> ((RealtimeException) ex).code())
                .isEqualTo(ErrorCode.NOT_FOUND);
        assertThat(countFor(u.id())).isZero();

        var created = notificationService.createBulkNotifications(List.of(draft(u.id(), "x"), draft(u.id(), "y")));
        assertThat(created).hasSize(2);
        assertThat(countFor(u.id())).isEqualTo(2);
    }

    private static NotificationDraft draft(String userId, String title) {
        return new NotificationDraft(userId, title, "body of " + title, "info", null);
    }

    private int countFor(String userId) {
        var n = jdbcTemplate.queryForObject("select count(*) from notification where user_id = ?", Integer.class, userId);
        return n == null ? 0 : n;
    }
}
