package com.fieldservice.bookingbackend.repository;

import com.fieldservice.bookingbackend.model.User;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.data.mongodb.repository.Query;
import org.springframework.data.mongodb.repository.Update;
import org.springframework.stereotype.Repository;

@Repository
public interface UserRepository extends MongoRepository<User, String> {

    // Touches only the availability flag; the rest of the identity belongs to the account side
    @Query("{ '_id': ?0 }")
    @Update("{ '$set': { 'isAvailable': ?1 } }")
    long updateAvailability(String userId, boolean available);
}
