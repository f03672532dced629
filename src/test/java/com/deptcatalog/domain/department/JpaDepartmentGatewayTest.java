package com.deptcatalog.domain.department;

import com.deptcatalog.api.exception.BusinessException;
import com.deptcatalog.api.exception.ErrorCode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@SpringBootTest
@DirtiesContext(classMode = DirtiesContext.ClassMode.BEFORE_EACH_TEST_METHOD)
class JpaDepartmentGatewayTest {

    @Autowired
    private JpaDepartmentGateway gateway;

    @Autowired
    private DepartmentRepository departmentRepository;

    private Department department(String name) {
        return Department.builder().name(name).description("").build();
    }

    @Test
    @DisplayName("commit 은 적재된 변경 수를 반환하고 초기화")
    void commit_returnsPendingCount() {
        gateway.add(department("Finance"));
        gateway.add(department("Marketing"));

        assertThat(gateway.commit()).isEqualTo(2);
        assertThat(gateway.commit()).isZero();
    }

    @Test
    @DisplayName("서비스 중복 검사를 우회해도 DB 유니크 제약이 대소문자 무시 중복을 CONFLICT 로 막음")
    void add_uniqueConstraintTranslatedToConflict() {
        gateway.add(department("Finance"));
        gateway.commit();

        assertThatThrownBy(() -> gateway.add(department("FINANCE")))
                .isInstanceOf(BusinessException.class)
                .satisfies(e -> assertThat(((BusinessException) e).getErrorCode())
                        .isEqualTo(ErrorCode.DUPLICATE_DEPARTMENT_NAME));
        assertThat(gateway.commit()).isZero();
        assertThat(departmentRepository.count()).isEqualTo(1);
    }

    @Test
    @DisplayName("id 가 채워진 부서를 add 해도 기존 행을 덮어쓰지 않고 새 행으로 저장")
    void add_presetIdInsertsNewRow() {
        Department finance = gateway.add(department("Finance"));
        gateway.commit();

        Department marketing = gateway.add(
                Department.builder().id(finance.getId()).name("Marketing").description("").build());

        assertThat(gateway.commit()).isEqualTo(1);
        assertThat(marketing.getId()).isNotEqualTo(finance.getId());
        assertThat(departmentRepository.count()).isEqualTo(2);
        assertThat(departmentRepository.findById(finance.getId()).orElseThrow().getName()).isEqualTo("Finance");
    }

    @Test
    @DisplayName("commit 이후 다음 쓰기는 0 부터 다시 센다")
    void commit_resetsBetweenWrites() {
        gateway.add(department("Finance"));
        assertThat(gateway.commit()).isEqualTo(1);

        gateway.add(department("Marketing"));
        assertThat(gateway.commit()).isEqualTo(1);
    }

    @Test
    @DisplayName("exists 는 제외 id 를 반영")
    void existsByName_excludeId() {
        Department saved = gateway.add(department("Finance"));
        gateway.commit();

        assertThat(gateway.existsByName("finance")).isTrue();
        assertThat(gateway.existsByName("finance", saved.getId())).isFalse();
        assertThat(gateway.existsByName("finance", saved.getId() + 1)).isTrue();
    }

    @Test
    @DisplayName("없는 id 삭제는 false")
    void delete_absent() {
        assertThat(gateway.delete(12345L)).isFalse();
        assertThat(gateway.commit()).isZero();
    }
}
