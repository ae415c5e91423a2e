package com.fieldservice.bookingbackend.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.Field;

import java.io.Serializable;
import java.util.ArrayList;
import java.util.List;

/**
 * Identity record owned by the account/auth side of the platform.
 * The tracking subsystem only reads it, apart from the availability flag,
 * and declares no indexes on it.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "users")
@JsonIgnoreProperties(ignoreUnknown = true)
public class User implements Serializable {
    private static final long serialVersionUID = 1L;

    @Id
    private String id;

    private String name;

    private String phone;

    private Role role = Role.CUSTOMER;

    @Field("isAvailable")
    private Boolean available = true;

    private Double rating = 0.0;

    private Integer totalRatings = 0;

    private List<String> specialization = new ArrayList<>();

    // Services offered by a professional (service catalogue ids)
    private List<String> serviceIds = new ArrayList<>();

    @JsonIgnore
    public boolean isProfessional() {
        return role == Role.PROFESSIONAL;
    }
}
