package com.showdownlab.optimizer.repository;

import com.showdownlab.optimizer.domain.TunedModelEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

/**
 * Key-value access to saved tuned models.
 */
@Repository
public interface TunedModelRepository extends JpaRepository<TunedModelEntity, String> {
}
