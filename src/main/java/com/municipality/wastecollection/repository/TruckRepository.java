package com.municipality.wastecollection.repository;

import com.municipality.wastecollection.model.Truck;
import com.municipality.wastecollection.model.TruckStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface TruckRepository extends MongoRepository<Truck, String> {
    List<Truck> findByStatus(TruckStatus status);

    Optional<Truck> findByCurrentDriverId(String driverId);
}
