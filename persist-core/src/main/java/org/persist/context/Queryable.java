package org.persist.context;

import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;

import java.util.List;
import java.util.Optional;

/**
 * 延迟、可组合的实体查询
 * 组合操作返回新实例，终结操作（list/first/count）才访问数据库
 *
 * @author qiaohe
 * @date 2024/4/2
 */
public interface Queryable<T> {

    Class<T> getEntityClass();

    /**
     * 追加筛选条件，多次调用以AND组合
     *
     * @param specification
     * @return
     */
    Queryable<T> where(Specification<T> specification);

    Queryable<T> orderBy(Sort sort);

    Queryable<T> skip(int count);

    Queryable<T> take(int count);

    List<T> list();

    Optional<T> first();

    /**
     * 计数，忽略排序与分页
     *
     * @return
     */
    long count();
}
