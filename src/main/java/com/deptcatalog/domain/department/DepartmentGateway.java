package com.deptcatalog.domain.department;

import java.util.List;
import java.util.Optional;

/**
 * 부서 저장소 추상화.
 *
 * <p>쓰기 연산({@link #add}, {@link #update}, {@link #delete})은 변경을 적재만 하고,
 * {@link #commit()}이 적재된 변경을 반영한 뒤 반영된 행 수를 돌려준다.
 * 적재 상태는 호출 스레드에 묶여 있으므로 쓰기 연산 뒤에는 같은 스레드에서 반드시
 * {@link #commit()}을 호출해야 한다. 호출하지 않으면 적재 건수가 다음 요청으로 넘어간다.
 * 이름 비교는 모두 대소문자를 구분하지 않는다.
 */
public interface DepartmentGateway {

    /**
     * @return 저장소가 부여한 id가 채워진 부서
     */
    Department add(Department department);

    Department update(Department department);

    /**
     * @return 삭제 대상이 존재했으면 true
     */
    boolean delete(Long id);

    Optional<Department> findById(Long id);

    Optional<Department> findByName(String name);

    /**
     * @return 이름 오름차순
     */
    List<Department> findAll();

    /**
     * @return 이름에 keyword를 포함하는 부서, 이름 오름차순
     */
    List<Department> searchByName(String keyword);

    boolean existsByName(String name);

    boolean existsByName(String name, Long excludeId);

    /**
     * 적재된 변경을 반영하고 호출 스레드의 적재 건수를 초기화한다. 예외가 발생해도 초기화된다.
     *
     * @return 반영된 행 수
     */
    int commit();
}
