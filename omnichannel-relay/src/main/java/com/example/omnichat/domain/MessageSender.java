package com.example.omnichat.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Author details of an agent or bot message. Customer messages carry no sender; the conversation
 * already identifies the customer.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MessageSender implements Serializable {

    private String id;
    private String name;
    private String photoUrl;
    private String model;
}
