package com.municipality.wastecollection.repository;

import com.municipality.wastecollection.model.Bin;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BinRepository extends MongoRepository<Bin, String> {
    List<Bin> findByActiveTrue();

    List<Bin> findByActiveFalse();

    List<Bin> findByOwnerIdAndActiveTrue(String ownerId);
}
