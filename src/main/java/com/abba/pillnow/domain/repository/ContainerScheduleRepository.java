package com.abba.pillnow.domain.repository;

import com.abba.pillnow.domain.model.ContainerSchedule;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface ContainerScheduleRepository extends MongoRepository<ContainerSchedule, Integer> {

    List<ContainerSchedule> findAllByOrderByRegistrationOrderAsc();
}
