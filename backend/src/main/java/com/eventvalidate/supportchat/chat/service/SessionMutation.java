package com.eventvalidate.supportchat.chat.service;

import com.eventvalidate.supportchat.chat.domain.ChatSession;

import java.time.Instant;

@FunctionalInterface
public interface SessionMutation {

    ChatSession apply(ChatSession current, Instant now);
}
