package com.deptcatalog.service.department;

import com.deptcatalog.api.exception.BusinessException;
import com.deptcatalog.api.exception.ErrorCode;
import com.deptcatalog.domain.department.Department;
import com.deptcatalog.domain.department.DepartmentGateway;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.List;
import java.util.Optional;
import java.util.function.Supplier;

@Slf4j
@Service
@RequiredArgsConstructor
@Transactional(readOnly = true)
public class DepartmentService {

    private final DepartmentGateway departmentGateway;
    private final DepartmentValidator departmentValidator;

    @Transactional
    public Department addDepartment(Department department) {
        log.info("부서 등록 시작");

        // 1~4. 입력 검증
        departmentValidator.validateForAdd(department);

        // 5. 중복 부서명 검증 (대소문자 무시)
        if (departmentGateway.existsByName(department.getName())) {
            log.warn("중복 부서명 등록 시도: {}", department.getName());
            throw new BusinessException(ErrorCode.DUPLICATE_DEPARTMENT_NAME);
        }

        // 6. 저장
        Department saved = write("등록", department.getName(), () -> departmentGateway.add(department));
        log.info("부서 등록 완료: {} (id={})", saved.getName(), saved.getId());
        return saved;
    }

    @Transactional
    public Department updateDepartment(Department department) {
        log.info("부서 수정 시작");

        departmentValidator.validateForUpdate(department);

        Long id = department.getId();
        if (departmentGateway.findById(id).isEmpty()) {
            throw new BusinessException(ErrorCode.DEPARTMENT_NOT_FOUND);
        }

        // 자기 자신은 제외하고 중복 검사
        if (departmentGateway.existsByName(department.getName(), id)) {
            log.warn("중복 부서명으로 수정 시도: {} (id={})", department.getName(), id);
            throw new BusinessException(ErrorCode.DUPLICATE_DEPARTMENT_NAME);
        }

        Department updated = write("수정", id, () -> departmentGateway.update(department));
        log.info("부서 수정 완료: id={}", id);
        return updated;
    }

    @Transactional
    public void deleteDepartment(Long id) {
        log.info("부서 삭제 시작: id={}", id);

        departmentValidator.validateId(id);
        if (departmentGateway.findById(id).isEmpty()) {
            throw new BusinessException(ErrorCode.DEPARTMENT_NOT_FOUND);
        }

        write("삭제", id, () -> {
            if (!departmentGateway.delete(id)) {
                throw new BusinessException(ErrorCode.PERSISTENCE_FAILURE);
            }
            return null;
        });
        log.info("부서 삭제 완료: id={}", id);
    }

    public Optional<Department> getDepartmentById(Long id) {
        departmentValidator.validateId(id);
        log.debug("부서 ID 조회: {}", id);
        return departmentGateway.findById(id);
    }

    public Optional<Department> getDepartmentByName(String name) {
        departmentValidator.validateName(name);
        log.debug("부서명 조회: {}", name);
        return departmentGateway.findByName(name);
    }

    public List<Department> searchDepartmentsByName(String keyword) {
        departmentValidator.validateKeyword(keyword);
        log.debug("부서명 검색: {}", keyword);
        return departmentGateway.searchByName(keyword);
    }

    public List<Department> getAllDepartments() {
        log.debug("전체 부서 조회");
        return departmentGateway.findAll();
    }

    /**
     * 저장소 변경 후 commit 까지 수행한다. 반영된 행이 없거나 저장소 예외가 발생하면
     * PERSISTENCE_FAILURE 로 변환하고, 이미 분류된 BusinessException 은 그대로 전파한다.
     */
    private <T> T write(String operation, Object target, Supplier<T> action) {
        try {
            T result = action.get();
            int affectedRows = departmentGateway.commit();
            if (affectedRows == 0) {
                log.warn("부서 {} 시 반영된 행 없음: {}", operation, target);
                throw new BusinessException(ErrorCode.PERSISTENCE_FAILURE);
            }
            return result;
        } catch (BusinessException e) {
            throw e;
        } catch (RuntimeException e) {
            log.error("부서 {} 중 저장소 오류: {}", operation, target, e);
            throw new BusinessException(ErrorCode.PERSISTENCE_FAILURE, e);
        }
    }
}
