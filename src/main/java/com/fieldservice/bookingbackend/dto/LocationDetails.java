package com.fieldservice.bookingbackend.dto;

import com.fieldservice.bookingbackend.model.ProfessionalLocation;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A professional's location record together with the minimal profile shown to customers.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LocationDetails {
    private ProfessionalLocation location;
    private ProfessionalProfile professional;
}
