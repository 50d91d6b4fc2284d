package com.eventvalidate.supportchat.chat.api;

import com.eventvalidate.supportchat.auth.service.jwt.JwtService;
import com.eventvalidate.supportchat.bootstrap.SupportChatApplication;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.AutoConfigureMockMvc;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Duration;
import java.util.UUID;

import static org.hamcrest.Matchers.hasItem;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@SpringBootTest(classes = SupportChatApplication.class)
@AutoConfigureMockMvc
@ActiveProfiles("dev")
class SupportSessionControllerTest {

    @Autowired
    MockMvc mvc;

    @Autowired
    JwtService jwtService;

    @Test
    void bot_reply_agent_reply_recovery_and_close() throws Exception {
        var id = "rest_" + UUID.randomUUID();

        // bot hand-off creates the session
        mvc.perform(post("/api/v1/support/sessions/{id}/bot-reply", id)
                        .header("Authorization", botAuth())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"How can I help?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true))
                .andExpect(jsonPath("$.data.sender").value("bot"))
                .andExpect(jsonPath("$.data.seq").value(1));

        mvc.perform(post("/api/v1/support/sessions/{id}/respond", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"An agent here\",\"admin_id\":\"g1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.sender").value("admin"))
                .andExpect(jsonPath("$.data.seq").value(2));

        mvc.perform(get("/api/v1/support/sessions/{id}", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.session.id").value(id))
                .andExpect(jsonPath("$.data.session.status").value("active"))
                .andExpect(jsonPath("$.data.session.assigned_agent_id").value("g1"))
                .andExpect(jsonPath("$.data.messages.length()").value(2));

        mvc.perform(get("/api/v1/support/sessions/{id}/messages", id).param("after_seq", "1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.length()").value(1))
                .andExpect(jsonPath("$.data[0].text").value("An agent here"));

        mvc.perform(get("/api/v1/support/sessions").param("admin_id", "g1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data[*].id", hasItem(id)));

        mvc.perform(post("/api/v1/support/sessions/{id}/close", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"admin_id\":\"g1\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.status").value("resolved"));

        mvc.perform(post("/api/v1/support/sessions/{id}/respond", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"too late\",\"admin_id\":\"g1\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.ok").value(false))
                .andExpect(jsonPath("$.error").value("session_closed"));
    }

    @Test
    void unknown_session_is_404() throws Exception {
        mvc.perform(get("/api/v1/support/sessions/{id}", "rest_missing_" + UUID.randomUUID()))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error").value("session_not_found"));
    }

    @Test
    void respond_requires_agent_identity() throws Exception {
        var id = "rest_" + UUID.randomUUID();
        mvc.perform(post("/api/v1/support/sessions/{id}/bot-reply", id)
                        .header("Authorization", botAuth())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hi\"}"))
                .andExpect(status().isOk());

        mvc.perform(post("/api/v1/support/sessions/{id}/respond", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"who am I\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthorized"));
    }

    @Test
    void respond_with_bearer_token() throws Exception {
        var id = "rest_" + UUID.randomUUID();
        mvc.perform(post("/api/v1/support/sessions/{id}/bot-reply", id)
                        .header("Authorization", botAuth())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hi\"}"))
                .andExpect(status().isOk());
        var token = jwtService.issueAgentToken("g7", "agent", "Agent Seven", Duration.ofMinutes(5));

        mvc.perform(post("/api/v1/support/sessions/{id}/respond", id)
                        .header("Authorization", "Bearer " + token)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hello from g7\"}"))
                .andExpect(status().isOk());

        mvc.perform(get("/api/v1/support/sessions/{id}", id))
                .andExpect(jsonPath("$.data.session.assigned_agent_id").value("g7"));
    }

    @Test
    void blank_text_is_rejected() throws Exception {
        mvc.perform(post("/api/v1/support/sessions/{id}/respond", "rest_" + UUID.randomUUID())
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"  \",\"admin_id\":\"g1\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("missing_text"));
    }

    @Test
    void heartbeat_marks_agent_online() throws Exception {
        mvc.perform(post("/api/v1/support/agents/heartbeat")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"admin_id\":\"g_heartbeat\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.online").value(true))
                .andExpect(jsonPath("$.data.online_agents", hasItem("g_heartbeat")));

        mvc.perform(get("/api/v1/support/agents/status"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.data.online_agents", hasItem("g_heartbeat")))
                .andExpect(jsonPath("$.data.live_connections").isNumber());
    }

    @Test
    void session_list_requires_agent_identity() throws Exception {
        mvc.perform(get("/api/v1/support/sessions"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("unauthorized"));

        var token = jwtService.issueAgentToken("g8", "agent", "Agent Eight", Duration.ofMinutes(5));
        mvc.perform(get("/api/v1/support/sessions").header("Authorization", "Bearer " + token))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.ok").value(true));
    }

    @Test
    void bot_reply_requires_service_token() throws Exception {
        var id = "rest_" + UUID.randomUUID();
        mvc.perform(post("/api/v1/support/sessions/{id}/bot-reply", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hi\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("missing_token"));

        var userToken = jwtService.issueAgentToken("someone", "user", "Someone", Duration.ofMinutes(5));
        mvc.perform(post("/api/v1/support/sessions/{id}/bot-reply", id)
                        .header("Authorization", "Bearer " + userToken)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hi\"}"))
                .andExpect(status().isForbidden())
                .andExpect(jsonPath("$.error").value("forbidden"));

        mvc.perform(post("/api/v1/support/sessions/{id}/bot-reply", id)
                        .header("Authorization", "Bearer not-a-jwt")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"text\":\"hi\"}"))
                .andExpect(status().isUnauthorized())
                .andExpect(jsonPath("$.error").value("invalid_token"));

        mvc.perform(get("/api/v1/support/sessions/{id}", id))
                .andExpect(status().isNotFound());
    }

    private String botAuth() {
        return "Bearer " + jwtService.issueServiceToken("support-bot", Duration.ofMinutes(5));
    }
}
