package com.fieldservice.bookingbackend.dto;

import com.fieldservice.bookingbackend.model.LocationPoint;
import com.fieldservice.bookingbackend.model.ProfessionalStatus;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.time.LocalDateTime;

/**
 * One nearby search hit. {@code distance} is in kilometres, rounded to two decimals.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class NearbyProfessional implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String professionalId;
    private LocationPoint current;
    private ProfessionalStatus status;
    private LocalDateTime lastUpdated;
    private double distance;
    private ProfessionalSummary professional;
}
