package com.example.omnichat.domain;

import java.io.Serializable;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Attachment implements Serializable {

    private String url;
    private String contentType;
    private Long sizeBytes;
}
