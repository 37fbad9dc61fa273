package com.flagship.custodial_exchange.lobby;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface BreweryStatusRepository extends JpaRepository<BreweryStatusEntity, BreweryStatusId> {
}
