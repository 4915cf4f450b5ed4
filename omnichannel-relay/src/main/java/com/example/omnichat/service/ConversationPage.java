package com.example.omnichat.service;

import com.example.omnichat.domain.Conversation;
import java.util.List;

public record ConversationPage(List<Conversation> conversations, String nextCursor) {}
