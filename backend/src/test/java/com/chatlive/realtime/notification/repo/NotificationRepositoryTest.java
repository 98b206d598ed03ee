package com.chatlive.realtime.notification.repo;

import com.chatlive.realtime.auth.repo.UserAccountRepository;
import com.chatlive.realtime.auth.service.Role;
import com.chatlive.realtime.auth.service.jwt.JwtService;
import com.chatlive.realtime.bootstrap.RealtimeApplication;
import com.chatlive.realtime.testing.TestUsers;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;

import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.UUID;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest(classes = RealtimeApplication.class)
@ActiveProfiles("dev")
class NotificationRepositoryTest {

    @Autowired
    NotificationRepository repository;

    @Autowired
    UserAccountRepository userRepository;

    @Autowired
    JwtService jwtService;

    private NotificationRepository.NotificationRow unread(String userId, Instant at) {
        var row = new NotificationRepository.NotificationRow("ntf_" + UUID.randomUUID(), userId, "t", "m", "info",
                "unread", null, at, at, null);
        repository.insert(row);
        return row;
    }

    @Test
    void mark_all_read_touches_only_the_locked_ids() {
        var user = new TestUsers(userRepository, jwtService).create("nr", Role.USER);
        var t0 = Instant.now().truncatedTo(ChronoUnit.MILLIS);
        unread(user.id(), t0);
        unread(user.id(), t0.plusMillis(1));

        var locked = repository.lockUnreadIds(user.id());
        var lateArrival = unread(user.id(), t0.plusMillis(2));
        var count = repository.markAllRead(user.id(), locked, t0.plusSeconds(1));

        assertThat(locked).hasSize(2);
        assertThat(count).isEqualTo(locked.size());
        assertThat(repository.findById(lateArrival.id()).orElseThrow().status()).isEqualTo("unread");
        assertThat(repository.lockUnreadIds(user.id())).containsExactly(lateArrival.id());
    }

    @Test
    void mark_all_read_with_nothing_locked_is_a_no_op() {
        var user = new TestUsers(userRepository, jwtService).create("nr0", Role.USER);
        unread(user.id(), Instant.now().truncatedTo(ChronoUnit.MILLIS));

        assertThat(repository.markAllRead(user.id(), List.of(), Instant.now())).isZero();
        assertThat(repository.lockUnreadIds(user.id())).hasSize(1);
    }
}
