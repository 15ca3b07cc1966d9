package com.journeytide.repository;

import com.journeytide.model.CustomerProfile;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface CustomerProfileRepository extends JpaRepository<CustomerProfile, String> {

    List<CustomerProfile> findByStoreId(String storeId);

    Optional<CustomerProfile> findFirstByPhone(String phone);
}
