package com.deptcatalog.api.department;

import com.deptcatalog.api.department.dtos.DepartmentDtos;
import com.deptcatalog.api.exception.BusinessException;
import com.deptcatalog.api.exception.ErrorCode;
import com.deptcatalog.domain.department.Department;
import com.deptcatalog.service.department.DepartmentService;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.*;

import java.net.URI;
import java.util.List;

@RestController
@RequestMapping("/api/departments")
@RequiredArgsConstructor
public class DepartmentController {

    private final DepartmentService departmentService;

    @GetMapping
    public List<DepartmentDtos.Response> findAll() {
        return departmentService.getAllDepartments().stream()
                .map(DepartmentDtos.Response::from)
                .toList();
    }

    @GetMapping("/{id}")
    public DepartmentDtos.Response findById(@PathVariable Long id) {
        return departmentService.getDepartmentById(id)
                .map(DepartmentDtos.Response::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.DEPARTMENT_NOT_FOUND));
    }

    @GetMapping("/by-name/{name}")
    public DepartmentDtos.Response findByName(@PathVariable String name) {
        return departmentService.getDepartmentByName(name)
                .map(DepartmentDtos.Response::from)
                .orElseThrow(() -> new BusinessException(ErrorCode.DEPARTMENT_NOT_FOUND));
    }

    @GetMapping("/search")
    public List<DepartmentDtos.Response> search(@RequestParam String keyword) {
        return departmentService.searchDepartmentsByName(keyword).stream()
                .map(DepartmentDtos.Response::from)
                .toList();
    }

    @PostMapping
    public ResponseEntity<DepartmentDtos.Response> create(@Valid @RequestBody DepartmentDtos.CreateRequest request) {
        Department department = departmentService.addDepartment(request.toEntity());
        return ResponseEntity
                .created(URI.create("/api/departments/" + department.getId()))
                .body(DepartmentDtos.Response.from(department));
    }

    @PutMapping("/{id}")
    public DepartmentDtos.Response update(@PathVariable Long id,
                                          @Valid @RequestBody DepartmentDtos.UpdateRequest request) {
        Department department = departmentService.updateDepartment(request.toEntity(id));
        return DepartmentDtos.Response.from(department);
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable Long id) {
        departmentService.deleteDepartment(id);
    }
}
