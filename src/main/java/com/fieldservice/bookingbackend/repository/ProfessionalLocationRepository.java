package com.fieldservice.bookingbackend.repository;

import com.fieldservice.bookingbackend.model.ProfessionalLocation;
import com.fieldservice.bookingbackend.model.ProfessionalStatus;
import org.springframework.data.geo.Distance;
import org.springframework.data.geo.Point;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface ProfessionalLocationRepository extends MongoRepository<ProfessionalLocation, String> {

    Optional<ProfessionalLocation> findByProfessionalId(String professionalId);

    // $near on the 2dsphere index of current.point, nearest first
    List<ProfessionalLocation> findByTrackingEnabledTrueAndCurrentPointNear(Point point, Distance maxDistance);

    List<ProfessionalLocation> findByTrackingEnabledTrueAndStatusAndCurrentPointNear(ProfessionalStatus status,
                                                                                    Point point,
                                                                                    Distance maxDistance);
}
