package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.chat.domain.ChatMessage;
import com.eventvalidate.supportchat.chat.domain.MessageSender;
import com.eventvalidate.supportchat.chat.domain.SessionStatus;
import com.eventvalidate.supportchat.chat.ws.InboundEvent;
import com.eventvalidate.supportchat.chat.ws.OutboundEvent;
import com.eventvalidate.supportchat.chat.ws.RecordingConnection;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;

class ChatBrokerScenarioTest {

    private final BrokerFixture fx = new BrokerFixture();

    @AfterEach
    void tearDown() {
        fx.close();
    }

    @Test
    void user_escalates_agent_replies_and_closes() {
        var user = new RecordingConnection("u1");
        var agent = new RecordingConnection("a1");
        fx.broker.onConnect(user);
        fx.broker.onConnect(agent);

        fx.broker.onEvent(user, new InboundEvent.JoinUserSession("s1", "u@example.com"));
        fx.broker.onEvent(agent, new InboundEvent.JoinAdminSession("g1", null));
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "Hello", null));

        var ack = user.lastOf(OutboundEvent.MessageReceived.class);
        assertThat(ack.delivery()).isEqualTo(MessageRouter.BOT);
        assertThat(agent.eventsOf(OutboundEvent.NewUserMessage.class)).isEmpty();

        fx.broker.onEvent(user, new InboundEvent.EscalateToAdmin("s1", null, "billing"));
        assertThat(fx.store.loadSession("s1").orElseThrow().status()).isEqualTo(SessionStatus.PENDING_AGENT);
        var request = agent.lastOf(OutboundEvent.EscalationRequest.class);
        assertThat(request.sessionId()).isEqualTo("s1");
        assertThat(request.reason()).isEqualTo("billing");
        assertThat(user.lastOf(OutboundEvent.EscalationConfirmed.class).message())
                .isEqualTo(EscalationController.CONFIRMATION);

        fx.broker.onEvent(agent, new InboundEvent.JoinAdminSession("g1", "s1"));
        var joined = agent.lastOf(OutboundEvent.SessionData.class);
        assertThat(joined.status()).isEqualTo("active");
        assertThat(joined.assignedAgentId()).isEqualTo("g1");
        assertThat(joined.messages()).extracting(OutboundEvent.MessageView::text)
                .containsExactly("Hello", "User requested human support. Reason: billing");

        fx.broker.onEvent(agent, new InboundEvent.AdminMessage("s1", "Hi, I can help", "g1"));
        assertThat(agent.lastOf(OutboundEvent.MessageSent.class).delivery()).isEqualTo(MessageRouter.DELIVERED);
        assertThat(user.lastOf(OutboundEvent.AdminMessage.class).message().text()).isEqualTo("Hi, I can help");

        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "Thanks", null));
        assertThat(agent.lastOf(OutboundEvent.NewUserMessage.class).message().text()).isEqualTo("Thanks");
        assertThat(user.lastOf(OutboundEvent.MessageReceived.class).delivery()).isEqualTo(MessageRouter.DELIVERED);

        fx.broker.close("s1", "g1");
        assertThat(user.lastOf(OutboundEvent.SessionClosed.class).closedBy()).isEqualTo("g1");
        assertThat(agent.lastOf(OutboundEvent.ActiveSessions.class).sessions()).isEmpty();

        user.clear();
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "one more thing", null));
        assertThat(user.lastOf(OutboundEvent.ErrorEvent.class).code()).isEqualTo("session_closed");
        assertThat(user.eventsOf(OutboundEvent.MessageReceived.class)).isEmpty();

        var stored = fx.repository.stored("s1").orElseThrow();
        assertThat(stored.status()).isEqualTo(SessionStatus.RESOLVED);
        assertThat(stored.messages()).extracting(ChatMessage::sender).containsExactly(
                MessageSender.USER, MessageSender.USER, MessageSender.AGENT, MessageSender.USER);
    }

    @Test
    void reconnecting_user_receives_delivery_on_new_connection_only() {
        var agent = new RecordingConnection("a1");
        fx.broker.onEvent(agent, new InboundEvent.JoinAdminSession("g1", null));
        var oldConn = new RecordingConnection("u-old");
        fx.broker.onEvent(oldConn, new InboundEvent.EscalateToAdmin("s1", null, null));
        fx.broker.onEvent(agent, new InboundEvent.JoinAdminSession("g1", "s1"));

        var newConn = new RecordingConnection("u-new");
        fx.broker.onEvent(newConn, new InboundEvent.JoinUserSession("s1", null));
        fx.broker.onEvent(agent, new InboundEvent.AdminMessage("s1", "still there?", "g1"));

        assertThat(newConn.eventsOf(OutboundEvent.AdminMessage.class)).hasSize(1);
        assertThat(oldConn.eventsOf(OutboundEvent.AdminMessage.class)).isEmpty();

        // closing the evicted socket must not unbind the replacement
        fx.broker.onClose(oldConn);
        fx.broker.onEvent(agent, new InboundEvent.AdminMessage("s1", "hello again", "g1"));
        assertThat(newConn.eventsOf(OutboundEvent.AdminMessage.class)).hasSize(2);
    }

    @Test
    void escalation_request_reaches_each_agent_connection_once() {
        var g1tab1 = new RecordingConnection("a1");
        var g1tab2 = new RecordingConnection("a2");
        var g2 = new RecordingConnection("b1");
        fx.broker.onEvent(g1tab1, new InboundEvent.JoinAdminSession("g1", null));
        fx.broker.onEvent(g1tab2, new InboundEvent.JoinAdminSession("g1", null));
        fx.broker.onEvent(g2, new InboundEvent.JoinAdminSession("g2", null));

        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "Hello", null));
        fx.broker.onEvent(user, new InboundEvent.EscalateToAdmin("s1", "u@example.com", ""));

        for (var conn : new RecordingConnection[]{g1tab1, g1tab2, g2}) {
            var requests = conn.eventsOf(OutboundEvent.EscalationRequest.class);
            assertThat(requests).hasSize(1);
            assertThat(requests.get(0).reason()).isEqualTo("not specified");
        }
        assertThat(fx.repository.stored("s1").orElseThrow().messages())
                .extracting(ChatMessage::text).first().isEqualTo("Hello");
    }

    @Test
    void pending_session_messages_go_to_all_agents_until_claimed() {
        var g1 = new RecordingConnection("a1");
        var g2 = new RecordingConnection("b1");
        fx.broker.onEvent(g1, new InboundEvent.JoinAdminSession("g1", null));
        fx.broker.onEvent(g2, new InboundEvent.JoinAdminSession("g2", null));
        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.EscalateToAdmin("s1", null, "refund"));

        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "anyone?", null));
        assertThat(g1.eventsOf(OutboundEvent.NewUserMessage.class)).hasSize(1);
        assertThat(g2.eventsOf(OutboundEvent.NewUserMessage.class)).hasSize(1);

        fx.broker.onEvent(g1, new InboundEvent.JoinAdminSession("g1", "s1"));
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "great", null));
        assertThat(g1.eventsOf(OutboundEvent.NewUserMessage.class)).hasSize(2);
        assertThat(g2.eventsOf(OutboundEvent.NewUserMessage.class)).hasSize(1);
    }

    @Test
    void message_for_escalated_session_with_no_agent_online_is_pending() {
        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.EscalateToAdmin("s1", null, null));
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "hello?", null));

        assertThat(user.lastOf(OutboundEvent.MessageReceived.class).delivery()).isEqualTo(MessageRouter.PENDING);
        assertThat(fx.repository.stored("s1").orElseThrow().messages()).hasSize(2);
    }

    @Test
    void blank_user_message_is_ignored() {
        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "   ", null));

        assertThat(user.eventsOf(OutboundEvent.MessageReceived.class)).isEmpty();
        assertThat(user.eventsOf(OutboundEvent.ErrorEvent.class)).isEmpty();
        assertThat(fx.repository.stored("s1").orElseThrow().messages()).isEmpty();
    }

    @Test
    void agent_message_to_unknown_session_reports_error_and_keeps_connection() {
        var agent = new RecordingConnection("a1");
        fx.broker.onEvent(agent, new InboundEvent.AdminMessage("ghost", "hi", "g1"));

        assertThat(agent.lastOf(OutboundEvent.ErrorEvent.class).code()).isEqualTo("session_not_found");
        assertThat(agent.isOpen()).isTrue();
        assertThat(fx.repository.stored("ghost")).isEmpty();
    }

    @Test
    void agent_without_identity_is_unauthorized() {
        var agent = new RecordingConnection("a1");
        fx.broker.onEvent(agent, new InboundEvent.JoinAdminSession(null, null));

        assertThat(agent.lastOf(OutboundEvent.ErrorEvent.class).code()).isEqualTo("unauthorized");
        assertThat(fx.registry.allAgentConnections()).isEmpty();
    }

    @Test
    void store_failure_is_reported_without_ack() {
        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.JoinUserSession("s1", null));
        fx.repository.failSavesWith(new IllegalStateException("connection refused"));

        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "Hello", null));

        assertThat(user.lastOf(OutboundEvent.ErrorEvent.class).code()).isEqualTo("store_unavailable");
        assertThat(user.eventsOf(OutboundEvent.MessageReceived.class)).isEmpty();
        assertThat(fx.meterRegistry.counter("chat.events.rejected", "code", "store_unavailable").count())
                .isEqualTo(1.0);
    }

    @Test
    void broken_agent_socket_does_not_block_others() {
        var broken = new RecordingConnection("a1");
        var healthy = new RecordingConnection("b1");
        fx.broker.onEvent(broken, new InboundEvent.JoinAdminSession("g1", null));
        fx.broker.onEvent(healthy, new InboundEvent.JoinAdminSession("g2", null));
        broken.failSends();

        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.EscalateToAdmin("s1", null, null));

        assertThat(healthy.eventsOf(OutboundEvent.EscalationRequest.class)).hasSize(1);
        assertThat(user.eventsOf(OutboundEvent.EscalationConfirmed.class)).hasSize(1);
    }

    @Test
    void agent_join_uses_durable_state() {
        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.EscalateToAdmin("s1", null, null));
        var cached = fx.store.loadSession("s1").orElseThrow();
        fx.repository.putExternally(cached.withMessage(MessageSender.USER, "written elsewhere", fx.store.now()));

        var agent = new RecordingConnection("a1");
        fx.broker.onEvent(agent, new InboundEvent.JoinAdminSession("g1", "s1"));

        assertThat(agent.lastOf(OutboundEvent.SessionData.class).messages())
                .extracting(OutboundEvent.MessageView::text)
                .contains("written elsewhere");
    }

    @Test
    void bot_reply_is_stored_and_pushed_to_user() {
        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.JoinUserSession("s1", null));

        var message = fx.broker.botReply("s1", "Have you tried restarting?");

        assertThat(message.sender()).isEqualTo(MessageSender.BOT);
        assertThat(user.lastOf(OutboundEvent.BotMessage.class).message().seq()).isEqualTo(message.seq());
    }

    @Test
    void messages_since_returns_only_newer_messages() {
        var user = new RecordingConnection("u1");
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "one", null));
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "two", null));
        fx.broker.onEvent(user, new InboundEvent.UserMessage("s1", "three", null));

        assertThat(fx.broker.messagesSince("s1", 1)).extracting(ChatMessage::text).containsExactly("two", "three");
    }

    @Test
    void ping_refreshes_agent_presence() {
        var agent = new RecordingConnection("a1");
        fx.broker.onEvent(agent, new InboundEvent.JoinAdminSession("g1", null));
        fx.broker.onClose(agent);

        assertThat(fx.registry.connectedAgentIds()).isEmpty();
        assertThat(fx.presence.onlineAgents()).containsExactly("g1");

        var other = new RecordingConnection("a2");
        fx.broker.onEvent(other, new InboundEvent.Ping(null));
        assertThat(other.eventsOf(OutboundEvent.Pong.class)).hasSize(1);
    }

    @Test
    void pong_carries_broker_clock_time() {
        var fixed = Instant.parse("2026-03-01T10:15:30.250Z");
        try (var fixedFx = new BrokerFixture(5000, Clock.fixed(fixed, ZoneOffset.UTC))) {
            var conn = new RecordingConnection("c1");
            fixedFx.broker.onEvent(conn, new InboundEvent.Ping(null));

            assertThat(conn.lastOf(OutboundEvent.Pong.class).serverTime()).isEqualTo(fixed.toEpochMilli());
        }
    }
}
