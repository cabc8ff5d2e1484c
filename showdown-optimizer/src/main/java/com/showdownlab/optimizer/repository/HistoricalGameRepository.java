package com.showdownlab.optimizer.repository;

import com.showdownlab.optimizer.domain.HistoricalGameEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

/**
 * Key-value access to cached historical games.
 */
@Repository
public interface HistoricalGameRepository extends JpaRepository<HistoricalGameEntity, String> {

    List<HistoricalGameEntity> findAllByOrderByGameIdAsc();
}
