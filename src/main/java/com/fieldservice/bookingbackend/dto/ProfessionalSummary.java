package com.fieldservice.bookingbackend.dto;

import com.fieldservice.bookingbackend.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Public projection of a professional attached to nearby search results.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfessionalSummary implements Serializable {
    private static final long serialVersionUID = 1L;

    private String id;
    private String name;
    private String phone;
    private List<String> specialization = new ArrayList<>();
    private Double rating;
    private Integer totalRatings;

    public static ProfessionalSummary from(User user) {
        return new ProfessionalSummary(
                user.getId(),
                user.getName(),
                user.getPhone(),
                user.getSpecialization() != null ? new ArrayList<>(user.getSpecialization()) : new ArrayList<>(),
                user.getRating(),
                user.getTotalRatings()
        );
    }
}
