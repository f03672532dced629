package com.deptcatalog.domain.department;

import org.springframework.data.jpa.repository.JpaRepository;

import java.util.List;
import java.util.Optional;

public interface DepartmentRepository extends JpaRepository<Department, Long> {

    Optional<Department> findByNameKey(String nameKey);

    List<Department> findAllByOrderByNameAsc();

    List<Department> findByNameKeyContainingOrderByNameAsc(String keyword);

    boolean existsByNameKey(String nameKey);

    boolean existsByNameKeyAndIdNot(String nameKey, Long id);
}
