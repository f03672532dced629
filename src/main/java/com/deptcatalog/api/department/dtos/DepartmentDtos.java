package com.deptcatalog.api.department.dtos;

import com.deptcatalog.domain.department.Department;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public class DepartmentDtos {

    public record CreateRequest(
            @NotBlank(message = "부서명은 필수입니다.")
            @Size(max = Department.NAME_MAX_LENGTH, message = "부서명은 1자 이상 100자 이하여야 합니다.")
            String name,

            @Size(max = Department.DESCRIPTION_MAX_LENGTH, message = "부서 설명은 500자를 초과할 수 없습니다.")
            String description
    ) {
        public Department toEntity() {
            return Department.builder()
                    .name(name)
                    .description(description)
                    .build();
        }
    }

    public record UpdateRequest(
            @NotBlank(message = "부서명은 필수입니다.")
            @Size(max = Department.NAME_MAX_LENGTH, message = "부서명은 1자 이상 100자 이하여야 합니다.")
            String name,

            @Size(max = Department.DESCRIPTION_MAX_LENGTH, message = "부서 설명은 500자를 초과할 수 없습니다.")
            String description
    ) {
        public Department toEntity(Long id) {
            return Department.builder()
                    .id(id)
                    .name(name)
                    .description(description)
                    .build();
        }
    }

    public record Response(
            Long id,
            String name,
            String description
    ) {
        public static Response from(Department department) {
            return new Response(
                    department.getId(),
                    department.getName(),
                    department.getDescription()
            );
        }
    }
}
