package com.fieldservice.bookingbackend.dto;

import com.fieldservice.bookingbackend.model.User;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class ProfessionalProfile {
    private String id;
    private String name;
    private String phone;
    private Boolean isAvailable;
    private Double rating;

    public static ProfessionalProfile from(User user) {
        return new ProfessionalProfile(
                user.getId(),
                user.getName(),
                user.getPhone(),
                user.getAvailable(),
                user.getRating()
        );
    }
}
