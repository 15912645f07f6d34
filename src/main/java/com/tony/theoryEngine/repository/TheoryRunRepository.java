package com.tony.theoryEngine.repository;

import com.tony.theoryEngine.model.TheoryRun;
import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;

public interface TheoryRunRepository extends JpaRepository<TheoryRun, String> {
    List<TheoryRun> findAllByOrderByCreatedAtDesc();
}
