package com.example.omnichat.autoreply;

import com.fasterxml.jackson.annotation.JsonAlias;

public record GeneratedReply(@JsonAlias({"reply", "answer"}) String text, String model) {}
