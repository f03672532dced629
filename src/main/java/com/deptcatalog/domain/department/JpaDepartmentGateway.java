package com.deptcatalog.domain.department;

import com.deptcatalog.api.exception.BusinessException;
import com.deptcatalog.api.exception.ErrorCode;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Component
@RequiredArgsConstructor
public class JpaDepartmentGateway implements DepartmentGateway {

    private final DepartmentRepository departmentRepository;

    // 요청 단위(스레드)로 commit 전까지 적재된 변경 수
    private final ThreadLocal<Integer> pendingChanges = ThreadLocal.withInitial(() -> 0);

    @Override
    public Department add(Department department) {
        // id가 채워진 엔티티는 save 시 merge 되어 기존 행을 덮어쓰므로 항상 신규 엔티티로 저장
        Department transientDepartment = department.getId() == null ? department : Department.builder()
                .name(department.getName())
                .description(department.getDescription())
                .build();
        Department saved = translateNameConflict(() -> departmentRepository.save(transientDepartment));
        stage();
        return saved;
    }

    @Override
    public Department update(Department department) {
        Department managed = departmentRepository.findById(department.getId())
                .orElseThrow(() -> new BusinessException(ErrorCode.DEPARTMENT_NOT_FOUND));
        managed.update(department.getName(), department.getDescription());
        stage();
        return managed;
    }

    @Override
    public boolean delete(Long id) {
        Optional<Department> department = departmentRepository.findById(id);
        if (department.isEmpty()) {
            return false;
        }
        departmentRepository.delete(department.get());
        stage();
        return true;
    }

    @Override
    public Optional<Department> findById(Long id) {
        return departmentRepository.findById(id);
    }

    @Override
    public Optional<Department> findByName(String name) {
        return departmentRepository.findByNameKey(Department.toNameKey(name));
    }

    @Override
    public List<Department> findAll() {
        return departmentRepository.findAllByOrderByNameAsc();
    }

    @Override
    public List<Department> searchByName(String keyword) {
        return departmentRepository.findByNameKeyContainingOrderByNameAsc(keyword.toLowerCase(Locale.ROOT));
    }

    @Override
    public boolean existsByName(String name) {
        return departmentRepository.existsByNameKey(Department.toNameKey(name));
    }

    @Override
    public boolean existsByName(String name, Long excludeId) {
        return departmentRepository.existsByNameKeyAndIdNot(Department.toNameKey(name), excludeId);
    }

    @Override
    public int commit() {
        try {
            translateNameConflict(() -> {
                departmentRepository.flush();
                return null;
            });
            return pendingChanges.get();
        } finally {
            pendingChanges.remove();
        }
    }

    private void stage() {
        pendingChanges.set(pendingChanges.get() + 1);
    }

    private <T> T translateNameConflict(Supplier<T> action) {
        try {
            return action.get();
        } catch (DataIntegrityViolationException e) {
            if (isNameKeyViolation(e)) {
                log.warn("부서명 유니크 제약 위반 감지");
                throw new BusinessException(ErrorCode.DUPLICATE_DEPARTMENT_NAME, e);
            }
            throw e;
        }
    }

    private boolean isNameKeyViolation(DataIntegrityViolationException e) {
        Throwable cause = e;
        while (cause != null) {
            String message = cause.getMessage();
            if (message != null && message.toLowerCase(Locale.ROOT).contains(Department.NAME_KEY_CONSTRAINT)) {
                return true;
            }
            cause = cause.getCause();
        }
        return false;
    }
}
