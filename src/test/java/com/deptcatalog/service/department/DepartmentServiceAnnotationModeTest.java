package com.deptcatalog.service.department;

import com.deptcatalog.api.exception.DepartmentValidationException;
import com.deptcatalog.domain.department.Department;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest(properties = "department.validation.mode=annotation")
@DirtiesContext
class DepartmentServiceAnnotationModeTest {

    @Autowired
    private DepartmentService departmentService;

    @Test
    @DisplayName("annotation 모드 설정 시 서비스가 모든 필드 위반을 수집")
    void serviceCollectsAllViolations() {
        Department department = Department.builder()
                .name("")
                .description("d".repeat(501))
                .build();

        assertThatThrownBy(() -> departmentService.addDepartment(department))
                .isInstanceOf(DepartmentValidationException.class)
                .satisfies(e -> assertThat(((DepartmentValidationException) e).getViolations())
                        .containsExactly("부서명은 필수입니다.", "부서 설명은 500자를 초과할 수 없습니다."));
    }
}
