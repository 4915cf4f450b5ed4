package com.example.omnichat.realtime;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One room event as it travels over the broker topic. The payload is re-read as plain JSON structures
 * on the receiving node and handed to the socket server unchanged.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class RoomEnvelope implements Serializable {

    private String room;
    private String event;
    private Object payload;
}
