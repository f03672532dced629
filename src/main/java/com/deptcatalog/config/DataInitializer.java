package com.deptcatalog.config;

import com.deptcatalog.domain.department.Department;
import com.deptcatalog.service.department.DepartmentService;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.CommandLineRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;

@Slf4j
@Component
@RequiredArgsConstructor
@ConditionalOnProperty(prefix = "department.seed", name = "enabled", havingValue = "true")
public class DataInitializer implements CommandLineRunner {

    private static final Map<String, String> SEED_DEPARTMENTS = new LinkedHashMap<>();

    static {
        SEED_DEPARTMENTS.put("Human Resources", "HR operations and employee management");
        SEED_DEPARTMENTS.put("Information Technology", "IT infrastructure and software development");
        SEED_DEPARTMENTS.put("Finance", "Financial planning and accounting");
    }

    private final DepartmentService departmentService;

    @Override
    public void run(String... args) {
        if (!departmentService.getAllDepartments().isEmpty()) {
            log.info("부서 데이터가 이미 존재하여 초기 데이터 생성을 건너뜀");
            return;
        }

        long startTime = System.currentTimeMillis();
        log.info("초기 부서 데이터 생성 시작...");

        SEED_DEPARTMENTS.forEach((name, description) -> departmentService.addDepartment(
                Department.builder()
                        .name(name)
                        .description(description)
                        .build()));

        long elapsed = System.currentTimeMillis() - startTime;
        log.info("초기 부서 데이터 생성 완료: {}건 ({}ms)", SEED_DEPARTMENTS.size(), elapsed);
    }
}
