package com.example.omnichat.domain;

public enum DeliveryStatus {
    /** Inbound message received from the customer. */
    RECEIVED,
    /** Outbound message stored, platform call not finished yet. */
    PENDING,
    SENT,
    FAILED
}
