package com.example.omnichat.domain;

public enum Channel {
    FACEBOOK,
    INSTAGRAM,
    TELEGRAM,
    WIDGET
}
