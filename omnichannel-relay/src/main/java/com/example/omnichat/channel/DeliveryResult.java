package com.example.omnichat.channel;

public record DeliveryResult(boolean success, String platformMessageId, String error) {

    public static DeliveryResult sent(String platformMessageId) {
        return new DeliveryResult(true, platformMessageId, null);
    }

    public static DeliveryResult failed(String error) {
        return new DeliveryResult(false, null, error);
    }
}
