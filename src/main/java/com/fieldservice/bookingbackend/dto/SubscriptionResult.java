package com.fieldservice.bookingbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class SubscriptionResult {
    private boolean success;
    private boolean alreadySubscribed;
    private String subscriberId;
    private String professionalId;
    private String message;
}
