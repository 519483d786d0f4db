package com.cronflow.cronflow_backend.repository;

import com.cronflow.cronflow_backend.model.domain.Event;
import org.springframework.data.jpa.repository.JpaRepository;

public interface EventRepository extends JpaRepository<Event, Long> {}
