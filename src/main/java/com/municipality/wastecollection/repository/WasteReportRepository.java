package com.municipality.wastecollection.repository;

import com.municipality.wastecollection.model.WasteReport;
import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import java.time.LocalDateTime;
import java.util.List;

@Repository
public interface WasteReportRepository extends MongoRepository<WasteReport, String> {

    boolean existsByBinIdAndReportedAt(String binId, LocalDateTime reportedAt);

    List<WasteReport> findByBinIdOrderByReportedAtDesc(String binId);
}
