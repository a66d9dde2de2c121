package org.persist.context;

import lombok.Getter;
import org.hibernate.Session;
import org.slf4j.Logger;
import org.springframework.data.domain.Sort;
import org.springframework.data.jpa.domain.Specification;
import org.springframework.data.jpa.repository.query.QueryUtils;

import javax.persistence.TypedQuery;
import javax.persistence.criteria.CriteriaBuilder;
import javax.persistence.criteria.CriteriaQuery;
import javax.persistence.criteria.Predicate;
import javax.persistence.criteria.Root;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * 基于JPA Criteria的延迟查询
 *
 * @author qiaohe
 * @date 2024/4/3
 */
public class CriteriaQueryable<T> implements Queryable<T> {
    private final Session session;
    @Getter
    private final Class<T> entityClass;
    private final Logger log;

    private final Specification<T> specification;
    private final Sort sort;
    private final int firstResult;
    private final Integer maxResults;

    public CriteriaQueryable(Session session, Class<T> entityClass, Logger log) {
        this(session, entityClass, log, null, Sort.unsorted(), 0, null);
    }

    private CriteriaQueryable(Session session, Class<T> entityClass, Logger log,
                              Specification<T> specification, Sort sort, int firstResult, Integer maxResults) {
        this.session = session;
        this.entityClass = entityClass;
        this.log = log;
        this.specification = specification;
        this.sort = sort;
        this.firstResult = firstResult;
        this.maxResults = maxResults;
    }

    @Override
    public Queryable<T> where(Specification<T> specification) {
        Objects.requireNonNull(specification, "specification");
        Specification<T> combined = this.specification == null
                ? specification
                : this.specification.and(specification);
        return new CriteriaQueryable<>(session, entityClass, log, combined, sort, firstResult, maxResults);
    }

    @Override
    public Queryable<T> orderBy(Sort sort) {
        return new CriteriaQueryable<>(session, entityClass, log, specification,
                sort == null ? Sort.unsorted() : sort, firstResult, maxResults);
    }

    @Override
    public Queryable<T> skip(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("skip count must not be negative: " + count);
        }
        return new CriteriaQueryable<>(session, entityClass, log, specification, sort, count, maxResults);
    }

    @Override
    public Queryable<T> take(int count) {
        if (count < 0) {
            throw new IllegalArgumentException("take count must not be negative: " + count);
        }
        return new CriteriaQueryable<>(session, entityClass, log, specification, sort, firstResult, count);
    }

    @Override
    public List<T> list() {
        if (maxResults != null && maxResults == 0) {
            return Collections.emptyList();
        }
        log.trace("Executing query for {}", entityClass.getSimpleName());
        return createQuery(maxResults).getResultList();
    }

    @Override
    public Optional<T> first() {
        if (maxResults != null && maxResults == 0) {
            return Optional.empty();
        }
        log.trace("Executing query for {}", entityClass.getSimpleName());
        return createQuery(1).getResultList().stream().findFirst();
    }

    @Override
    public long count() {
        log.trace("Executing query for {}", entityClass.getSimpleName());
        CriteriaBuilder criteriaBuilder = session.getCriteriaBuilder();
        CriteriaQuery<Long> criteriaQuery = criteriaBuilder.createQuery(Long.class);
        Root<T> root = criteriaQuery.from(entityClass);
        applySpecification(root, criteriaQuery, criteriaBuilder);
        if (criteriaQuery.isDistinct()) {
            criteriaQuery.select(criteriaBuilder.countDistinct(root));
        } else {
            criteriaQuery.select(criteriaBuilder.count(root));
        }
        // 不应用排序
        criteriaQuery.orderBy(Collections.emptyList());
        return session.createQuery(criteriaQuery).getSingleResult();
    }

    private TypedQuery<T> createQuery(Integer limit) {
        CriteriaBuilder criteriaBuilder = session.getCriteriaBuilder();
        CriteriaQuery<T> criteriaQuery = criteriaBuilder.createQuery(entityClass);
        Root<T> root = criteriaQuery.from(entityClass);
        criteriaQuery.select(root);
        applySpecification(root, criteriaQuery, criteriaBuilder);
        if (sort.isSorted()) {
            criteriaQuery.orderBy(QueryUtils.toOrders(sort, root, criteriaBuilder));
        }
        TypedQuery<T> query = session.createQuery(criteriaQuery);
        query.setFirstResult(firstResult);
        if (limit != null) {
            query.setMaxResults(limit);
        }
        return query;
    }

    private void applySpecification(Root<T> root, CriteriaQuery<?> criteriaQuery, CriteriaBuilder criteriaBuilder) {
        if (specification == null) {
            return;
        }
        Predicate predicate = specification.toPredicate(root, criteriaQuery, criteriaBuilder);
        if (predicate != null) {
            criteriaQuery.where(predicate);
        }
    }
}
