package com.fieldservice.bookingbackend.dto;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Outcome of one subscriber fanout. {@code notifiedCount} only counts dispatches that succeeded.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class FanoutResult {
    private int subscriberCount;
    private int notifiedCount;

    public static FanoutResult none() {
        return new FanoutResult(0, 0);
    }
}
