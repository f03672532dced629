package com.deptcatalog.domain.department;

import org.springframework.test.util.ReflectionTestUtils;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * DB 없이 서비스를 검증하기 위한 메모리 저장소. id는 1부터 순차 부여한다.
 */
public class InMemoryDepartmentGateway implements DepartmentGateway {

    private final Map<Long, Department> departments = new LinkedHashMap<>();
    private long sequence = 0;
    private int pendingChanges = 0;
    private int commitCount = 0;

    @Override
    public Department add(Department department) {
        ReflectionTestUtils.setField(department, "id", ++sequence);
        departments.put(department.getId(), department);
        pendingChanges++;
        return department;
    }

    @Override
    public Department update(Department department) {
        Department stored = departments.get(department.getId());
        stored.update(department.getName(), department.getDescription());
        pendingChanges++;
        return stored;
    }

    @Override
    public boolean delete(Long id) {
        if (departments.remove(id) == null) {
            return false;
        }
        pendingChanges++;
        return true;
    }

    @Override
    public Optional<Department> findById(Long id) {
        return Optional.ofNullable(departments.get(id));
    }

    @Override
    public Optional<Department> findByName(String name) {
        return departments.values().stream()
                .filter(d -> d.getName().equalsIgnoreCase(name))
                .findFirst();
    }

    @Override
    public List<Department> findAll() {
        return sortedByName(new ArrayList<>(departments.values()));
    }

    @Override
    public List<Department> searchByName(String keyword) {
        String key = keyword.toLowerCase(Locale.ROOT);
        return sortedByName(departments.values().stream()
                .filter(d -> d.getNameKey().contains(key))
                .toList());
    }

    @Override
    public boolean existsByName(String name) {
        return findByName(name).isPresent();
    }

    @Override
    public boolean existsByName(String name, Long excludeId) {
        return departments.values().stream()
                .anyMatch(d -> d.getName().equalsIgnoreCase(name) && !d.getId().equals(excludeId));
    }

    @Override
    public int commit() {
        int affected = pendingChanges;
        pendingChanges = 0;
        commitCount++;
        return affected;
    }

    public int size() {
        return departments.size();
    }

    public int getCommitCount() {
        return commitCount;
    }

    private List<Department> sortedByName(List<Department> list) {
        return list.stream()
                .sorted(Comparator.comparing(Department::getName))
                .toList();
    }
}
