package com.municipality.wastecollection.repository;

import com.municipality.wastecollection.model.LocationSample;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface LocationSampleRepository extends MongoRepository<LocationSample, String> {

    List<LocationSample> findByDriverIdAndRecordedAtBetweenOrderByRecordedAtAsc(
            String driverId,
            LocalDateTime start,
            LocalDateTime end
    );

    long deleteByRecordedAtBefore(LocalDateTime cutoff);
}
