package com.journeytide.repository;

import com.journeytide.model.Segment;
import org.springframework.data.jpa.repository.JpaRepository;

public interface SegmentRepository extends JpaRepository<Segment, String> {
}
