package com.municipality.wastecollection.repository;

import com.municipality.wastecollection.model.CollectionRoute;
import com.municipality.wastecollection.model.RouteStatus;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.Collection;
import java.util.List;
import java.util.Optional;

@Repository
public interface CollectionRouteRepository extends MongoRepository<CollectionRoute, String> {

    List<CollectionRoute> findByStatus(RouteStatus status);

    List<CollectionRoute> findByStatusIn(Collection<RouteStatus> statuses);

    Optional<CollectionRoute> findFirstByDriverIdAndStatusIn(String driverId, Collection<RouteStatus> statuses);
}
