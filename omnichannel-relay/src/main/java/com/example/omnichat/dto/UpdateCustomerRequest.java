package com.example.omnichat.dto;

import jakarta.validation.constraints.Email;
import jakarta.validation.constraints.Size;
import java.util.Map;
import lombok.Data;

@Data
public class UpdateCustomerRequest {

    @Size(max = 255)
    private String name;

    @Email
    @Size(max = 255)
    private String email;

    @Size(max = 64)
    private String phone;

    @Size(max = 512)
    private String address;

    private Map<String, Object> attributes;
}
