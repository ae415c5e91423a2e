package com.fieldservice.bookingbackend.dto;

import jakarta.validation.constraints.NotNull;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Position fix sent by a professional's device.
 * Range checks happen in the service so the error names the offending field.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationUpdateRequest {
    @NotNull
    private Double latitude;
    @NotNull
    private Double longitude;
    private Double accuracy;
    private Double speed;
    private Double heading;
}
