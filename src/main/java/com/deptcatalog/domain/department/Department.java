package com.deptcatalog.domain.department;

import jakarta.persistence.*;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AccessLevel;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.util.Locale;

@Entity
@Table(name = "departments",
        uniqueConstraints = @UniqueConstraint(name = Department.NAME_KEY_CONSTRAINT, columnNames = "name_key"))
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class Department {

    public static final int NAME_MAX_LENGTH = 100;
    public static final int DESCRIPTION_MAX_LENGTH = 500;
    // 소문자 변환 시 한 글자가 여러 글자로 늘어날 수 있음 (예: "İ" -> "i̇")
    public static final int NAME_KEY_MAX_LENGTH = NAME_MAX_LENGTH * 3;
    public static final String NAME_KEY_CONSTRAINT = "uk_departments_name_key";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @NotBlank(message = "부서명은 필수입니다.")
    @Size(max = NAME_MAX_LENGTH, message = "부서명은 1자 이상 100자 이하여야 합니다.")
    @Column(nullable = false, length = NAME_MAX_LENGTH)
    private String name;

    // 대소문자 구분 없는 유일성은 DB 유니크 제약으로 보장
    @Column(name = "name_key", nullable = false, length = NAME_KEY_MAX_LENGTH)
    private String nameKey;

    @Size(max = DESCRIPTION_MAX_LENGTH, message = "부서 설명은 500자를 초과할 수 없습니다.")
    @Column(nullable = false, length = DESCRIPTION_MAX_LENGTH)
    private String description;

    @Builder
    private Department(Long id, String name, String description) {
        this.id = id;
        apply(name, description);
    }

    public void update(String name, String description) {
        apply(name, description);
    }

    public static String toNameKey(String name) {
        return name == null ? null : name.toLowerCase(Locale.ROOT);
    }

    private void apply(String name, String description) {
        this.name = name;
        this.nameKey = toNameKey(name);
        this.description = description == null ? "" : description;
    }
}
