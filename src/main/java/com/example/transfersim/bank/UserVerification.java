package com.example.transfersim.bank;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class UserVerification {

    boolean exists;
    String displayName;
    String error;

    public static UserVerification notFound(String error) {
        return UserVerification.builder().exists(false).error(error).build();
    }
}
